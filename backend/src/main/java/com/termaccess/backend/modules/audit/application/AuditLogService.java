package com.termaccess.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import com.termaccess.backend.global.web.RequestIdFilter;
import com.termaccess.backend.modules.audit.domain.AuditLog;
import com.termaccess.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String ACTION_ACCESS_DENIED = "ACCESS_DENIED";
    public static final String ACTION_TERM_PERMISSIONS_UPDATED = "TERM_PERMISSIONS_UPDATED";
    public static final String ACTION_USER_PERMISSIONS_DELETED = "USER_PERMISSIONS_DELETED";
    public static final String ACTION_GRANTS_REBUILT = "GRANTS_REBUILT";

    public static final String RESOURCE_CONTENT_ITEM = "CONTENT_ITEM";
    public static final String RESOURCE_TERM = "TAXONOMY_TERM";
    public static final String RESOURCE_USER = "USER";
    public static final String RESOURCE_GRANT_INDEX = "GRANT_INDEX";

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            Long actorUserId,
            Map<String, Object> detail
    ) {
    }
}
