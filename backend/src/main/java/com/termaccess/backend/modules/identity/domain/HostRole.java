package com.termaccess.backend.modules.identity.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Host role definition, e.g. {@code editor}. Read only from this module.
 */
@Entity
@Immutable
@Table(name = "host_role")
public class HostRole {

    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "label", nullable = false, length = 255)
    private String label;

    protected HostRole() {
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }
}
