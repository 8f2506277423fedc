package com.termaccess.backend.modules.access.presentation.dto;

import com.termaccess.backend.modules.grant.domain.GrantRecord;

public record GrantRecordResponse(
        long contentItemId,
        String realm,
        int gid,
        int grantView,
        int grantUpdate,
        int grantDelete,
        String language,
        int fallback
) {

    public static GrantRecordResponse from(GrantRecord record) {
        return new GrantRecordResponse(
                record.contentItemId(),
                record.realm(),
                record.gid(),
                flag(record.grantView()),
                flag(record.grantUpdate()),
                flag(record.grantDelete()),
                record.language(),
                flag(record.fallback())
        );
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }
}
