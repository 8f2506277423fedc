package com.termaccess.backend.modules.grant.domain;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/**
 * Denormalized row the host joins against when filtering listings and search results.
 */
@Entity
@Table(name = "node_access_grants")
public class NodeAccessGrant {

    @EmbeddedId
    private NodeAccessGrantId id;

    @Column(name = "grant_view", nullable = false)
    private boolean grantView;

    @Column(name = "grant_update", nullable = false)
    private boolean grantUpdate;

    @Column(name = "grant_delete", nullable = false)
    private boolean grantDelete;

    @Column(name = "fallback", nullable = false)
    private boolean fallback;

    protected NodeAccessGrant() {
    }

    public NodeAccessGrant(GrantRecord record) {
        this.id = new NodeAccessGrantId(record.contentItemId(), record.gid(), record.realm(), record.language());
        this.grantView = record.grantView();
        this.grantUpdate = record.grantUpdate();
        this.grantDelete = record.grantDelete();
        this.fallback = record.fallback();
    }

    public NodeAccessGrantId getId() {
        return id;
    }

    public boolean isGrantView() {
        return grantView;
    }

    public boolean isGrantUpdate() {
        return grantUpdate;
    }

    public boolean isGrantDelete() {
        return grantDelete;
    }

    public boolean isFallback() {
        return fallback;
    }

    public GrantRecord toRecord() {
        return new GrantRecord(id.getContentItemId(), id.getRealm(), id.getGid(),
                grantView, grantUpdate, grantDelete, id.getLanguage(), fallback);
    }
}
