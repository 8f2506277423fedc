package com.termaccess.backend.modules.invalidation.application;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Tells the host which cached renderings and index entries may now be stale.
 * Inside a transaction the tags are sent after commit so readers never refill caches from
 * uncommitted state; a rolled back change sends nothing.
 */
@Component
public class InvalidationSignaler {

    private static final Logger log = LoggerFactory.getLogger(InvalidationSignaler.class);

    private final CacheTagInvalidator cacheTagInvalidator;

    public InvalidationSignaler(CacheTagInvalidator cacheTagInvalidator) {
        this.cacheTagInvalidator = cacheTagInvalidator;
    }

    public void contentVisibilityChanged(Collection<Long> contentItemIds, Collection<Long> termIds) {
        Set<String> tags = new LinkedHashSet<>();
        contentItemIds.forEach(id -> tags.add(CacheTags.node(id)));
        termIds.forEach(id -> tags.add(CacheTags.term(id)));
        tags.add(CacheTags.NODE_LIST);
        tags.add(CacheTags.SEARCH_INDEX);
        signal(tags);
    }

    public void signal(Collection<String> tags) {
        if (tags.isEmpty()) {
            return;
        }
        Set<String> pending = new LinkedHashSet<>(tags);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(pending);
                }
            });
        } else {
            dispatch(pending);
        }
    }

    // a failing tag is logged; the rest still go out
    private void dispatch(Set<String> tags) {
        log.debug("Invalidating {} cache tags", tags.size());
        for (String tag : tags) {
            try {
                cacheTagInvalidator.invalidate(tag);
            } catch (RuntimeException ex) {
                log.error("Failed to invalidate cache tag {}", tag, ex);
            }
        }
    }
}
