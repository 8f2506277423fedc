package com.termaccess.backend.modules.access.domain;

import java.util.Locale;

public enum AccessOperation {
    VIEW,
    UPDATE,
    DELETE;

    public static AccessOperation from(String value) {
        if (value == null || value.isBlank()) {
            return VIEW;
        }
        return AccessOperation.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
