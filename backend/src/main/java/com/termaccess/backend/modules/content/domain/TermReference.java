package com.termaccess.backend.modules.content.domain;

import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * One value of a taxonomy reference field on a content item.
 */
@Embeddable
public class TermReference {

    @Column(name = "field_name", nullable = false, length = 64)
    private String fieldName;

    @Column(name = "term_id", nullable = false)
    private long termId;

    protected TermReference() {
    }

    public TermReference(String fieldName, long termId) {
        this.fieldName = fieldName;
        this.termId = termId;
    }

    public String getFieldName() {
        return fieldName;
    }

    public long getTermId() {
        return termId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TermReference that)) return false;
        return termId == that.termId && Objects.equals(fieldName, that.fieldName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, termId);
    }
}
