package com.termaccess.backend.modules.grant.domain;

/**
 * One grant of this module's realm for one content item.
 */
public record GrantRecord(
        long contentItemId,
        String realm,
        int gid,
        boolean grantView,
        boolean grantUpdate,
        boolean grantDelete,
        String language,
        boolean fallback
) {

    public static final String REALM = "permissions_by_term";
}
