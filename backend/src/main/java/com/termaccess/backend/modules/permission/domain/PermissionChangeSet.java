package com.termaccess.backend.modules.permission.domain;

import java.util.Set;

/**
 * Entries added to and removed from one term by a full-replace save.
 */
public record PermissionChangeSet(
        long termId,
        Set<Long> addedUserIds,
        Set<Long> removedUserIds,
        Set<String> addedRoleIds,
        Set<String> removedRoleIds
) {

    public PermissionChangeSet {
        addedUserIds = Set.copyOf(addedUserIds);
        removedUserIds = Set.copyOf(removedUserIds);
        addedRoleIds = Set.copyOf(addedRoleIds);
        removedRoleIds = Set.copyOf(removedRoleIds);
    }

    public static PermissionChangeSet unchanged(long termId) {
        return new PermissionChangeSet(termId, Set.of(), Set.of(), Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return addedUserIds.isEmpty() && removedUserIds.isEmpty()
                && addedRoleIds.isEmpty() && removedRoleIds.isEmpty();
    }
}
