package com.termaccess.backend.modules.grant.domain;

import java.io.Serializable;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class NodeAccessGrantId implements Serializable {

    @Column(name = "content_item_id", nullable = false)
    private long contentItemId;

    @Column(name = "gid", nullable = false)
    private int gid;

    @Column(name = "realm", nullable = false, length = 64)
    private String realm;

    @Column(name = "language", nullable = false, length = 12)
    private String language;

    protected NodeAccessGrantId() {
    }

    public NodeAccessGrantId(long contentItemId, int gid, String realm, String language) {
        this.contentItemId = contentItemId;
        this.gid = gid;
        this.realm = realm;
        this.language = language;
    }

    public long getContentItemId() {
        return contentItemId;
    }

    public int getGid() {
        return gid;
    }

    public String getRealm() {
        return realm;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeAccessGrantId that)) return false;
        return contentItemId == that.contentItemId
                && gid == that.gid
                && Objects.equals(realm, that.realm)
                && Objects.equals(language, that.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentItemId, gid, realm, language);
    }
}
