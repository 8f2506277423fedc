package com.termaccess.backend.modules.permission.domain;

import java.util.HashSet;
import java.util.Set;

import com.termaccess.backend.modules.access.domain.AccessPrincipal;

/**
 * Allowed users and roles of one term. A term with an empty list is unrestricted.
 */
public record TermAccessList(long termId, Set<Long> userIds, Set<String> roleIds) {

    public TermAccessList {
        userIds = Set.copyOf(userIds);
        roleIds = Set.copyOf(roleIds);
    }

    public static TermAccessList of(long termId, Iterable<TermPermission> records) {
        Set<Long> users = new HashSet<>();
        Set<String> roles = new HashSet<>();
        for (TermPermission record : records) {
            if (record.getPrincipalKind() == PrincipalKind.USER) {
                users.add(Long.parseLong(record.getPrincipalId()));
            } else {
                roles.add(record.getPrincipalId());
            }
        }
        return new TermAccessList(termId, users, roles);
    }

    public boolean isRestricted() {
        return !userIds.isEmpty() || !roleIds.isEmpty();
    }

    /**
     * Explicit allow for the principal's user id or any of its roles. Says nothing about unrestricted terms.
     */
    public boolean explicitlyAllows(AccessPrincipal principal) {
        if (userIds.contains(principal.userId())) {
            return true;
        }
        for (String role : principal.roleIds()) {
            if (roleIds.contains(role)) {
                return true;
            }
        }
        return false;
    }
}
