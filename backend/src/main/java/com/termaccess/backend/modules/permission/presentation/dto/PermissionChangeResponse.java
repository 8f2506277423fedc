package com.termaccess.backend.modules.permission.presentation.dto;

import java.util.List;

import com.termaccess.backend.modules.permission.domain.PermissionChangeSet;

public record PermissionChangeResponse(
        long termId,
        boolean changed,
        List<Long> addedUserIds,
        List<Long> removedUserIds,
        List<String> addedRoleIds,
        List<String> removedRoleIds
) {

    public static PermissionChangeResponse from(PermissionChangeSet changeSet) {
        return new PermissionChangeResponse(
                changeSet.termId(),
                !changeSet.isEmpty(),
                changeSet.addedUserIds().stream().sorted().toList(),
                changeSet.removedUserIds().stream().sorted().toList(),
                changeSet.addedRoleIds().stream().sorted().toList(),
                changeSet.removedRoleIds().stream().sorted().toList()
        );
    }
}
