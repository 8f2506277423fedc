package com.termaccess.backend.modules.audit.application;

import java.util.Map;

import com.termaccess.backend.global.security.SecurityUtils;
import com.termaccess.backend.modules.access.application.AccessDeniedObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records denials caused by unpublished content. Audit storage failures are logged and never
 * change the decision already taken.
 */
@Component
public class AuditingAccessDeniedObserver implements AccessDeniedObserver {

    private static final Logger log = LoggerFactory.getLogger(AuditingAccessDeniedObserver.class);

    private final AuditLogService auditLogService;

    public AuditingAccessDeniedObserver(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Override
    public void onAccessDenied(long contentItemId) {
        Long actorUserId = SecurityUtils.currentUserIdOrNull();
        log.warn("Access denied to unpublished content item {} for user {}", contentItemId, actorUserId);
        try {
            auditLogService.record(new AuditLogService.AuditLogCommand(
                    AuditLogService.ACTION_ACCESS_DENIED,
                    AuditLogService.RESOURCE_CONTENT_ITEM,
                    String.valueOf(contentItemId),
                    actorUserId,
                    Map.of("reason", "unpublished")
            ));
        } catch (RuntimeException ex) {
            log.error("Failed to record access denial for content item {}", contentItemId, ex);
        }
    }
}
