package com.termaccess.backend.modules.permission.presentation.dto;

import java.util.List;

import com.termaccess.backend.modules.permission.domain.TermAccessList;

public record TermPermissionsResponse(
        long termId,
        boolean restricted,
        List<Long> userIds,
        List<String> roleIds
) {

    public static TermPermissionsResponse from(TermAccessList accessList) {
        return new TermPermissionsResponse(
                accessList.termId(),
                accessList.isRestricted(),
                accessList.userIds().stream().sorted().toList(),
                accessList.roleIds().stream().sorted().toList()
        );
    }
}
