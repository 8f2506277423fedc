package com.termaccess.backend.modules.identity.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * User account owned by the host. Read only from this module.
 */
@Entity
@Immutable
@Table(name = "host_user")
public class HostUser {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 60)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private HostUserStatus status;

    protected HostUser() {
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public HostUserStatus getStatus() {
        return status;
    }
}
