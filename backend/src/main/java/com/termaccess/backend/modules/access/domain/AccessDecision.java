package com.termaccess.backend.modules.access.domain;

public enum AccessDecision {
    ALLOW,
    DENY;

    public static AccessDecision of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
