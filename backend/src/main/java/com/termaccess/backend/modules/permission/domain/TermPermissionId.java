package com.termaccess.backend.modules.permission.domain;

import java.io.Serializable;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/**
 * Natural key of a permission record. User ids are stored in decimal form next to role ids.
 */
@Embeddable
public class TermPermissionId implements Serializable {

    @Column(name = "term_id", nullable = false)
    private long termId;

    @Enumerated(EnumType.STRING)
    @Column(name = "principal_kind", nullable = false, length = 8)
    private PrincipalKind principalKind;

    @Column(name = "principal_id", nullable = false, length = 64)
    private String principalId;

    protected TermPermissionId() {
    }

    public TermPermissionId(long termId, PrincipalKind principalKind, String principalId) {
        this.termId = termId;
        this.principalKind = Objects.requireNonNull(principalKind, "principalKind");
        this.principalId = Objects.requireNonNull(principalId, "principalId");
    }

    public static TermPermissionId forUser(long termId, long userId) {
        return new TermPermissionId(termId, PrincipalKind.USER, Long.toString(userId));
    }

    public static TermPermissionId forRole(long termId, String roleId) {
        return new TermPermissionId(termId, PrincipalKind.ROLE, roleId);
    }

    public long getTermId() {
        return termId;
    }

    public PrincipalKind getPrincipalKind() {
        return principalKind;
    }

    public String getPrincipalId() {
        return principalId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TermPermissionId that)) return false;
        return termId == that.termId
                && principalKind == that.principalKind
                && Objects.equals(principalId, that.principalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(termId, principalKind, principalId);
    }

    @Override
    public String toString() {
        return "term " + termId + " -> " + principalKind + ":" + principalId;
    }
}
