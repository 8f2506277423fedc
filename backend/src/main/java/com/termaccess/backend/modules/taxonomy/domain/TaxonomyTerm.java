package com.termaccess.backend.modules.taxonomy.domain;

import java.util.HashSet;
import java.util.Set;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Host taxonomy term. A term may have several parents; roots have none.
 */
@Entity
@Immutable
@Table(name = "taxonomy_term")
public class TaxonomyTerm {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "vocabulary_id", nullable = false, length = 64)
    private String vocabularyId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "taxonomy_term_hierarchy", joinColumns = @JoinColumn(name = "term_id"))
    @Column(name = "parent_id", nullable = false)
    private Set<Long> parentIds = new HashSet<>();

    protected TaxonomyTerm() {
    }

    public Long getId() {
        return id;
    }

    public String getVocabularyId() {
        return vocabularyId;
    }

    public String getName() {
        return name;
    }

    public Set<Long> getParentIds() {
        return parentIds;
    }
}
