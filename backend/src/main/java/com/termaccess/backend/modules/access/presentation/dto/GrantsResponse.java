package com.termaccess.backend.modules.access.presentation.dto;

import java.util.List;

import com.termaccess.backend.modules.access.domain.AccessOperation;

public record GrantsResponse(
        String realm,
        AccessOperation operation,
        List<Integer> gids
) {
}
