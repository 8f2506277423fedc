package com.termaccess.backend.modules.grant.domain;

import com.termaccess.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Registry row mapping a policy key to its gid. Rebuildable from permissions and term references.
 */
@Entity
@Table(name = "access_policy")
public class AccessPolicy extends AbstractTimestampedEntity {

    @Id
    @Column(name = "gid", nullable = false, updatable = false)
    private Integer gid;

    @Column(name = "policy_hash", nullable = false, unique = true, length = 64)
    private String policyHash;

    @Column(name = "policy_key", nullable = false, columnDefinition = "text")
    private String policyKey;

    protected AccessPolicy() {
    }

    public AccessPolicy(int gid, PolicyKey policyKey) {
        this.gid = gid;
        this.policyHash = policyKey.hash();
        this.policyKey = policyKey.value();
    }

    public Integer getGid() {
        return gid;
    }

    public PolicyKey getPolicyKey() {
        return PolicyKey.parse(policyKey);
    }
}
