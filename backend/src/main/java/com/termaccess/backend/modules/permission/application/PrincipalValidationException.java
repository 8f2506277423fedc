package com.termaccess.backend.modules.permission.application;

import java.util.Set;
import java.util.TreeSet;

import com.termaccess.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * A term permission save referenced users or roles the host cannot resolve. Nothing was written.
 */
public class PrincipalValidationException extends ProblemException {

    public static final String CODE = "term_permissions.unresolvable_principal";

    private final long termId;
    private final Set<Long> unresolvedUserIds;
    private final Set<String> unresolvedRoleIds;

    public PrincipalValidationException(long termId, Set<Long> unresolvedUserIds, Set<String> unresolvedRoleIds) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, describe(termId, unresolvedUserIds, unresolvedRoleIds));
        this.termId = termId;
        this.unresolvedUserIds = Set.copyOf(unresolvedUserIds);
        this.unresolvedRoleIds = Set.copyOf(unresolvedRoleIds);
    }

    private static String describe(long termId, Set<Long> users, Set<String> roles) {
        StringBuilder sb = new StringBuilder("Term ").append(termId).append(" references unknown principals:");
        if (!users.isEmpty()) {
            sb.append(" users ").append(new TreeSet<>(users));
        }
        if (!roles.isEmpty()) {
            sb.append(" roles ").append(new TreeSet<>(roles));
        }
        return sb.toString();
    }

    public long getTermId() {
        return termId;
    }

    public Set<Long> getUnresolvedUserIds() {
        return unresolvedUserIds;
    }

    public Set<String> getUnresolvedRoleIds() {
        return unresolvedRoleIds;
    }
}
