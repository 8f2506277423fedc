package com.termaccess.backend.modules.permission.presentation.dto;

public record TermLookupResponse(String name, long termId) {
}
