package com.termaccess.backend.modules.grant.domain;

import java.time.OffsetDateTime;

public record RebuildReport(int contentItems, int policies, int highestGid, OffsetDateTime completedAt) {
}
