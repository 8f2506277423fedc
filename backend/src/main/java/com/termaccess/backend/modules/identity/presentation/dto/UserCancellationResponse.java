package com.termaccess.backend.modules.identity.presentation.dto;

import java.util.List;

public record UserCancellationResponse(long userId, List<Long> affectedTermIds) {
}
