package com.termaccess.backend.modules.grant.presentation.dto;

import java.time.OffsetDateTime;

import com.termaccess.backend.modules.grant.domain.RebuildReport;

public record RebuildResponse(
        int contentItems,
        int policies,
        int highestGid,
        OffsetDateTime completedAt
) {

    public static RebuildResponse from(RebuildReport report) {
        return new RebuildResponse(report.contentItems(), report.policies(), report.highestGid(), report.completedAt());
    }
}
