package com.termaccess.backend.modules.identity.domain;

public enum HostUserStatus {
    ACTIVE,
    BLOCKED,
    CANCELLED
}
