package com.termaccess.backend.modules.grant.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.termaccess.backend.global.config.AccessControlSettings;
import com.termaccess.backend.modules.access.application.AccessDecisionEngine;
import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.content.application.ContentItemQuery;
import com.termaccess.backend.modules.content.domain.ContentItemSnapshot;
import com.termaccess.backend.modules.grant.domain.AccessPolicy;
import com.termaccess.backend.modules.grant.domain.GidAllocator;
import com.termaccess.backend.modules.grant.domain.GrantRecord;
import com.termaccess.backend.modules.grant.domain.NodeAccessGrant;
import com.termaccess.backend.modules.grant.domain.PolicyKey;
import com.termaccess.backend.modules.grant.domain.RebuildReport;
import com.termaccess.backend.modules.grant.infrastructure.persistence.AccessPolicyRepository;
import com.termaccess.backend.modules.grant.infrastructure.persistence.NodeAccessGrantRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps {@code node_access_grants} in line with permission records and term references.
 *
 * <p>Every content item gets exactly one row in the {@value GrantRecord#REALM} realm. The row's
 * gid identifies the item's access policy (its set of restricting terms); principals belong to a
 * gid when they are allowed on every term of the policy. Membership is evaluated on request, so
 * rows only change when an item's policy, publication state or language changes.
 */
@Service
public class GrantIndexMaintainer {

    private static final Logger log = LoggerFactory.getLogger(GrantIndexMaintainer.class);

    private final NodeAccessGrantRepository nodeAccessGrantRepository;
    private final AccessPolicyRepository accessPolicyRepository;
    private final AccessDecisionEngine accessDecisionEngine;
    private final ContentItemQuery contentItemQuery;
    private final AccessControlSettings settings;
    private final Clock clock;

    public GrantIndexMaintainer(
            NodeAccessGrantRepository nodeAccessGrantRepository,
            AccessPolicyRepository accessPolicyRepository,
            AccessDecisionEngine accessDecisionEngine,
            ContentItemQuery contentItemQuery,
            AccessControlSettings settings,
            Clock clock
    ) {
        this.nodeAccessGrantRepository = nodeAccessGrantRepository;
        this.accessPolicyRepository = accessPolicyRepository;
        this.accessDecisionEngine = accessDecisionEngine;
        this.contentItemQuery = contentItemQuery;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Recomputes and stores the grant of one content item, replacing any previous rows.
     * Calling it again without an intervening change stores an identical record.
     *
     * @return the stored record, or empty when node access records are disabled
     */
    @Transactional
    public Optional<GrantRecord> recordGrantsForContentItem(long contentItemId) {
        if (settings.nodeAccessRecordsDisabled()) {
            nodeAccessGrantRepository.deleteByContentItem(contentItemId, GrantRecord.REALM);
            return Optional.empty();
        }

        ContentItemSnapshot snapshot = contentItemQuery.getSnapshot(contentItemId);
        PolicyKey policyKey = policyKeyOf(snapshot);
        int gid = accessPolicyRepository.findByPolicyHash(policyKey.hash())
                .map(AccessPolicy::getGid)
                .orElseGet(() -> registerPolicy(policyKey));

        GrantRecord record = buildRecord(snapshot, gid);
        nodeAccessGrantRepository.deleteByContentItem(contentItemId, GrantRecord.REALM);
        nodeAccessGrantRepository.save(new NodeAccessGrant(record));
        log.debug("Recorded grant for content item {}: gid={} policy={}", contentItemId, gid, policyKey);
        return Optional.of(record);
    }

    /**
     * Drops every grant and policy of the realm and recomputes them from source, allocating
     * gids from {@code 1} in ascending content item order. Callers must not run two passes at once.
     */
    @Transactional
    public RebuildReport rebuildAll() {
        int removedGrants = nodeAccessGrantRepository.deleteByRealm(GrantRecord.REALM);
        accessPolicyRepository.deleteAllPolicies();

        if (settings.nodeAccessRecordsDisabled()) {
            log.info("Node access records disabled; removed {} grants and wrote none", removedGrants);
            return new RebuildReport(0, 0, 0, OffsetDateTime.now(clock));
        }

        GidAllocator allocator = GidAllocator.freshPass();
        List<NodeAccessGrant> rows = new ArrayList<>();
        List<Long> contentItemIds = contentItemQuery.allContentItemIds();
        for (Long contentItemId : contentItemIds) {
            ContentItemSnapshot snapshot = contentItemQuery.getSnapshot(contentItemId);
            int gid = allocator.gidFor(policyKeyOf(snapshot));
            rows.add(new NodeAccessGrant(buildRecord(snapshot, gid)));
        }

        List<AccessPolicy> registry = new ArrayList<>();
        allocator.newlyAllocated().forEach((key, gid) -> registry.add(new AccessPolicy(gid, key)));
        accessPolicyRepository.saveAll(registry);
        nodeAccessGrantRepository.saveAll(rows);

        log.info("Rebuilt grants for {} content items using {} access policies", contentItemIds.size(), registry.size());
        return new RebuildReport(contentItemIds.size(), registry.size(), allocator.highestIssued(), OffsetDateTime.now(clock));
    }

    @Transactional
    public int pruneUnusedPolicies() {
        int removed = accessPolicyRepository.deleteUnreferenced(GrantRecord.REALM);
        if (removed > 0) {
            log.info("Pruned {} unused access policies", removed);
        }
        return removed;
    }

    @Transactional(readOnly = true)
    public List<GrantRecord> grantRecordsFor(long contentItemId) {
        return nodeAccessGrantRepository.findByContentItem(contentItemId, GrantRecord.REALM).stream()
                .map(NodeAccessGrant::toRecord)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Integer> membershipGids(AccessPrincipal principal) {
        if (settings.nodeAccessRecordsDisabled()) {
            return List.of();
        }
        Map<Long, Boolean> termDecisions = new HashMap<>();
        List<Integer> gids = new ArrayList<>();
        for (AccessPolicy policy : accessPolicyRepository.findAllOrdered()) {
            boolean member = true;
            for (Long termId : policy.getPolicyKey().termIds()) {
                boolean allowed = termDecisions.computeIfAbsent(termId,
                        id -> accessDecisionEngine.isTermAllowed(id, principal));
                if (!allowed) {
                    member = false;
                    break;
                }
            }
            if (member) {
                gids.add(policy.getGid());
            }
        }
        return gids;
    }

    @Transactional(readOnly = true)
    public List<Integer> allGids() {
        return accessPolicyRepository.findAllOrdered().stream()
                .map(AccessPolicy::getGid)
                .toList();
    }

    private PolicyKey policyKeyOf(ContentItemSnapshot snapshot) {
        return PolicyKey.of(accessDecisionEngine.restrictingTerms(
                accessDecisionEngine.participatingTerms(snapshot.termIds())));
    }

    private int registerPolicy(PolicyKey policyKey) {
        GidAllocator allocator = GidAllocator.continuing(accessPolicyRepository.findHighestGid(), Map.of());
        int gid = allocator.gidFor(policyKey);
        accessPolicyRepository.save(new AccessPolicy(gid, policyKey));
        log.info("Registered access policy {} as gid {}", policyKey, gid);
        return gid;
    }

    private GrantRecord buildRecord(ContentItemSnapshot snapshot, int gid) {
        boolean published = snapshot.published();
        return new GrantRecord(
                snapshot.id(),
                GrantRecord.REALM,
                gid,
                published,
                published,
                published,
                snapshot.language(),
                true
        );
    }
}
