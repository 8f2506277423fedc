package com.termaccess.backend.modules.access.presentation.dto;

import java.util.List;

public record PermittedTermsResponse(
        String vocabulary,
        List<Long> termIds
) {
}
