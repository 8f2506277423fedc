package com.termaccess.backend.modules.access.presentation.dto;

import com.termaccess.backend.modules.access.domain.AccessDecision;
import com.termaccess.backend.modules.access.domain.AccessOperation;

public record AccessCheckResponse(
        long contentItemId,
        AccessOperation operation,
        AccessDecision decision
) {
}
