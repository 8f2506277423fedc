package com.termaccess.backend.modules.access.application;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

import com.termaccess.backend.global.config.AccessControlSettings;
import com.termaccess.backend.global.error.RetryableProblemException;
import com.termaccess.backend.global.security.SecurityUtils;
import com.termaccess.backend.modules.access.domain.AccessDecision;
import com.termaccess.backend.modules.access.domain.AccessOperation;
import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.audit.application.AuditLogService;
import com.termaccess.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.termaccess.backend.modules.content.application.ContentItemQuery;
import com.termaccess.backend.modules.grant.application.GrantIndexMaintainer;
import com.termaccess.backend.modules.grant.domain.GrantRecord;
import com.termaccess.backend.modules.grant.domain.RebuildReport;
import com.termaccess.backend.modules.invalidation.application.CacheTags;
import com.termaccess.backend.modules.invalidation.application.InvalidationSignaler;
import com.termaccess.backend.modules.permission.application.TermPermissionStore;
import com.termaccess.backend.modules.permission.domain.PermissionChangeSet;
import com.termaccess.backend.modules.permission.domain.TermAccessList;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyException;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry points the host calls: access checks, grant lookups for bulk queries, permission form
 * submits, content saves and account cancellation.
 */
@Service
public class AccessHookService {

    private static final Logger log = LoggerFactory.getLogger(AccessHookService.class);

    static final String REBUILD_IN_PROGRESS = "grants.rebuild_in_progress";
    static final int REBUILD_RETRY_AFTER_SECONDS = 30;

    private final AccessDecisionEngine accessDecisionEngine;
    private final GrantIndexMaintainer grantIndexMaintainer;
    private final TermPermissionStore termPermissionStore;
    private final TermHierarchyResolver termHierarchyResolver;
    private final ContentItemQuery contentItemQuery;
    private final InvalidationSignaler invalidationSignaler;
    private final AuditLogService auditLogService;
    private final List<AccessDeniedObserver> accessDeniedObservers;
    private final AccessControlSettings settings;
    private final AtomicBoolean rebuildRunning = new AtomicBoolean(false);

    public AccessHookService(
            AccessDecisionEngine accessDecisionEngine,
            GrantIndexMaintainer grantIndexMaintainer,
            TermPermissionStore termPermissionStore,
            TermHierarchyResolver termHierarchyResolver,
            ContentItemQuery contentItemQuery,
            InvalidationSignaler invalidationSignaler,
            AuditLogService auditLogService,
            List<AccessDeniedObserver> accessDeniedObservers,
            AccessControlSettings settings
    ) {
        this.accessDecisionEngine = accessDecisionEngine;
        this.grantIndexMaintainer = grantIndexMaintainer;
        this.termPermissionStore = termPermissionStore;
        this.termHierarchyResolver = termHierarchyResolver;
        this.contentItemQuery = contentItemQuery;
        this.invalidationSignaler = invalidationSignaler;
        this.auditLogService = auditLogService;
        this.accessDeniedObservers = List.copyOf(accessDeniedObservers);
        this.settings = settings;
    }

    /**
     * Single-item decision. Principals holding the bypass capability are always allowed;
     * unpublished items are denied to everyone else; any failure while deciding denies.
     */
    public AccessDecision onAccessCheck(long contentItemId, AccessOperation operation, AccessPrincipal principal) {
        if (principal.hasCapability(settings.bypassCapability())) {
            return AccessDecision.ALLOW;
        }
        try {
            if (!contentItemQuery.isPublished(contentItemId)) {
                notifyDenied(contentItemId);
                return AccessDecision.DENY;
            }
            AccessDecision decision = AccessDecision.of(accessDecisionEngine.isAllowed(contentItemId, principal));
            log.debug("{} on content item {} for user {}: {}", operation, contentItemId, principal.userId(), decision);
            return decision;
        } catch (RuntimeException ex) {
            log.error("Access check failed for content item {} and user {}; denying", contentItemId, principal.userId(), ex);
            return AccessDecision.DENY;
        }
    }

    public List<Integer> onGrantsRequested(AccessPrincipal principal, AccessOperation operation) {
        if (principal.hasCapability(settings.bypassCapability())) {
            return grantIndexMaintainer.allGids();
        }
        List<Integer> gids = grantIndexMaintainer.membershipGids(principal);
        log.debug("User {} holds {} gids for {}", principal.userId(), gids.size(), operation);
        return gids;
    }

    @Transactional
    public List<GrantRecord> onGrantRecordsRequested(long contentItemId) {
        return grantIndexMaintainer.recordGrantsForContentItem(contentItemId)
                .map(List::of)
                .orElse(List.of());
    }

    public List<GrantRecord> storedGrantRecords(long contentItemId) {
        return grantIndexMaintainer.grantRecordsFor(contentItemId);
    }

    @Transactional
    public List<GrantRecord> onContentItemSaved(long contentItemId) {
        List<GrantRecord> records = onGrantRecordsRequested(contentItemId);
        grantIndexMaintainer.pruneUnusedPolicies();
        invalidationSignaler.contentVisibilityChanged(List.of(contentItemId), List.of());
        return records;
    }

    public TermAccessList termPermissions(long termId) {
        return termPermissionStore.getAccessList(termId);
    }

    /**
     * Replaces a term's allowed principals, recomputes grants of content attached to it (and to
     * its descendants when inheritance is enabled) and invalidates caches after commit.
     * An unchanged submission touches nothing.
     */
    @Transactional
    public PermissionChangeSet onTermFormSubmit(long termId, Collection<Long> userIds, Collection<String> roleIds) {
        PermissionChangeSet changeSet = termPermissionStore.saveTermPermissions(termId, userIds, roleIds);
        if (changeSet.isEmpty()) {
            log.debug("Term {} permissions unchanged", termId);
            return changeSet;
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("addedUserIds", new TreeSet<>(changeSet.addedUserIds()));
        detail.put("removedUserIds", new TreeSet<>(changeSet.removedUserIds()));
        detail.put("addedRoleIds", new TreeSet<>(changeSet.addedRoleIds()));
        detail.put("removedRoleIds", new TreeSet<>(changeSet.removedRoleIds()));
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_TERM_PERMISSIONS_UPDATED,
                AuditLogService.RESOURCE_TERM,
                String.valueOf(termId),
                SecurityUtils.currentUserIdOrNull(),
                detail
        ));

        recomputeForTerms(Set.of(termId));
        return changeSet;
    }

    @Transactional
    public Set<Long> onUserCancelled(long userId) {
        Set<Long> affectedTerms = termPermissionStore.deleteAllForUser(userId);
        if (affectedTerms.isEmpty()) {
            log.info("User {} cancelled; no term permissions to remove", userId);
            return affectedTerms;
        }
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_USER_PERMISSIONS_DELETED,
                AuditLogService.RESOURCE_USER,
                String.valueOf(userId),
                SecurityUtils.currentUserIdOrNull(),
                Map.of("termIds", new TreeSet<>(affectedTerms))
        ));
        recomputeForTerms(affectedTerms);
        log.info("User {} cancelled; removed from {} terms", userId, affectedTerms.size());
        return affectedTerms;
    }

    /**
     * Full grant reindex. Only one pass runs at a time in this process; a concurrent request is
     * rejected with a retryable conflict.
     */
    public RebuildReport rebuildGrants() {
        if (!rebuildRunning.compareAndSet(false, true)) {
            throw new RetryableProblemException(HttpStatus.CONFLICT, REBUILD_IN_PROGRESS,
                    "A grant rebuild is already running", REBUILD_RETRY_AFTER_SECONDS);
        }
        try {
            RebuildReport report = grantIndexMaintainer.rebuildAll();
            auditLogService.record(new AuditLogCommand(
                    AuditLogService.ACTION_GRANTS_REBUILT,
                    AuditLogService.RESOURCE_GRANT_INDEX,
                    GrantRecord.REALM,
                    SecurityUtils.currentUserIdOrNull(),
                    Map.of("contentItems", report.contentItems(), "policies", report.policies())
            ));
            invalidationSignaler.signal(List.of(CacheTags.NODE_LIST, CacheTags.SEARCH_INDEX));
            return report;
        } finally {
            rebuildRunning.set(false);
        }
    }

    public Set<Long> permittedTerms(AccessPrincipal principal, String vocabularyId) {
        Collection<Long> candidates = (vocabularyId == null || vocabularyId.isBlank())
                ? termPermissionStore.getRestrictedTermIds()
                : termHierarchyResolver.termIdsInVocabulary(vocabularyId.trim());
        if (principal.hasCapability(settings.bypassCapability())) {
            return new TreeSet<>(candidates);
        }
        return accessDecisionEngine.filterAllowedTerms(candidates, principal);
    }

    public long lookupTerm(String name) {
        return termHierarchyResolver.resolveIdByName(name);
    }

    private void recomputeForTerms(Set<Long> termIds) {
        Set<Long> scope = new TreeSet<>(termIds);
        for (Long termId : termIds) {
            try {
                scope.addAll(termHierarchyResolver.getDescendants(termId));
            } catch (TermHierarchyException ex) {
                log.warn("Recomputing term {} without descendants: {}", termId, ex.getMessage());
            }
        }
        List<Long> contentItemIds = contentItemQuery.contentItemIdsReferencing(scope);
        for (Long contentItemId : contentItemIds) {
            grantIndexMaintainer.recordGrantsForContentItem(contentItemId);
        }
        grantIndexMaintainer.pruneUnusedPolicies();
        log.info("Recomputed grants of {} content items for terms {}", contentItemIds.size(), scope);
        invalidationSignaler.contentVisibilityChanged(contentItemIds, scope);
    }

    private void notifyDenied(long contentItemId) {
        for (AccessDeniedObserver observer : accessDeniedObservers) {
            try {
                observer.onAccessDenied(contentItemId);
            } catch (RuntimeException ex) {
                log.error("Access denied observer {} failed for content item {}",
                        observer.getClass().getSimpleName(), contentItemId, ex);
            }
        }
    }
}
