package com.termaccess.backend.modules.permission.domain;

import com.termaccess.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/**
 * Presence of a row means the principal is allowed on the term.
 */
@Entity
@Table(name = "term_permissions")
public class TermPermission extends AbstractTimestampedEntity {

    @EmbeddedId
    private TermPermissionId id;

    protected TermPermission() {
    }

    public TermPermission(TermPermissionId id) {
        this.id = id;
    }

    public TermPermissionId getId() {
        return id;
    }

    public long getTermId() {
        return id.getTermId();
    }

    public PrincipalKind getPrincipalKind() {
        return id.getPrincipalKind();
    }

    public String getPrincipalId() {
        return id.getPrincipalId();
    }
}
