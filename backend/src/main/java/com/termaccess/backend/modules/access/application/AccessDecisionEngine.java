package com.termaccess.backend.modules.access.application;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.termaccess.backend.global.config.AccessControlSettings;
import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.content.application.ContentItemQuery;
import com.termaccess.backend.modules.permission.application.TermPermissionStore;
import com.termaccess.backend.modules.permission.domain.TermAccessList;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyException;
import com.termaccess.backend.modules.taxonomy.application.TermHierarchyResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides whether a principal may access content based on the terms attached to it.
 *
 * <p>A term without any permission record is open to everyone. A content item is accessible
 * only when every restricted term attached to it allows the principal, so the most restrictive
 * term wins. Decisions always read the permission records, never the grant table.
 */
@Service
@Transactional(readOnly = true)
public class AccessDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(AccessDecisionEngine.class);

    private final TermPermissionStore termPermissionStore;
    private final TermHierarchyResolver termHierarchyResolver;
    private final ContentItemQuery contentItemQuery;
    private final AccessControlSettings settings;

    public AccessDecisionEngine(
            TermPermissionStore termPermissionStore,
            TermHierarchyResolver termHierarchyResolver,
            ContentItemQuery contentItemQuery,
            AccessControlSettings settings
    ) {
        this.termPermissionStore = termPermissionStore;
        this.termHierarchyResolver = termHierarchyResolver;
        this.contentItemQuery = contentItemQuery;
        this.settings = settings;
    }

    public boolean isAllowed(long contentItemId, AccessPrincipal principal) {
        return areAllTermsAllowed(restrictedTermsOf(contentItemId), principal);
    }

    /**
     * Terms of the item that take part in restriction, i.e. those of participating vocabularies.
     */
    public Set<Long> restrictedTermsOf(long contentItemId) {
        return participatingTerms(contentItemQuery.getTermIdsForContentItem(contentItemId));
    }

    public Set<Long> participatingTerms(Collection<Long> termIds) {
        if (termIds == null || termIds.isEmpty()) {
            return Set.of();
        }
        if (settings.restrictedVocabularies().isEmpty()) {
            return new TreeSet<>(termIds);
        }
        Map<Long, String> vocabularies = termHierarchyResolver.vocabulariesOf(termIds);
        Set<Long> participating = new TreeSet<>();
        for (Long termId : termIds) {
            String vocabulary = vocabularies.get(termId);
            // unknown vocabulary stays in: dropping it could only widen access
            if (vocabulary == null || settings.participates(vocabulary)) {
                participating.add(termId);
            }
        }
        return participating;
    }

    /**
     * Terms that currently carry at least one permission record. Terms outside this set are open.
     */
    public Set<Long> restrictingTerms(Collection<Long> termIds) {
        Set<Long> restricting = new TreeSet<>();
        for (Long termId : termIds) {
            if (termPermissionStore.getAccessList(termId).isRestricted()) {
                restricting.add(termId);
            }
        }
        return restricting;
    }

    public boolean areAllTermsAllowed(Collection<Long> termIds, AccessPrincipal principal) {
        for (Long termId : termIds) {
            if (!isTermAllowed(termId, principal)) {
                log.debug("User {} denied by term {}", principal.userId(), termId);
                return false;
            }
        }
        return true;
    }

    public boolean isTermAllowed(long termId, AccessPrincipal principal) {
        TermAccessList accessList = termPermissionStore.getAccessList(termId);
        if (!accessList.isRestricted()) {
            return true;
        }
        if (accessList.explicitlyAllows(principal)) {
            return true;
        }
        if (!settings.inheritHierarchy()) {
            return false;
        }

        List<Long> ancestors;
        try {
            ancestors = termHierarchyResolver.getAncestors(termId);
        } catch (TermHierarchyException ex) {
            log.warn("Ignoring inheritance for term {}: {}", termId, ex.getMessage());
            return false;
        }
        for (Long ancestorId : ancestors) {
            if (termPermissionStore.getAccessList(ancestorId).explicitlyAllows(principal)) {
                return true;
            }
        }
        return false;
    }

    public Set<Long> filterAllowedTerms(Collection<Long> termIds, AccessPrincipal principal) {
        Set<Long> allowed = new LinkedHashSet<>();
        for (Long termId : new TreeSet<>(termIds)) {
            if (isTermAllowed(termId, principal)) {
                allowed.add(termId);
            }
        }
        return allowed;
    }
}
