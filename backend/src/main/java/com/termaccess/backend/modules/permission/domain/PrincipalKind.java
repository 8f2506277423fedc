package com.termaccess.backend.modules.permission.domain;

public enum PrincipalKind {
    USER,
    ROLE
}
