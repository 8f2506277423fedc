package com.termaccess.backend.modules.content.application;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.termaccess.backend.modules.content.domain.ContentItemSnapshot;

/**
 * Read access to host content items.
 */
public interface ContentItemQuery {

    /**
     * @throws ContentItemNotFoundException when the host has no such item
     */
    ContentItemSnapshot getSnapshot(long contentItemId);

    default Set<Long> getTermIdsForContentItem(long contentItemId) {
        return getSnapshot(contentItemId).termIds();
    }

    default boolean isPublished(long contentItemId) {
        return getSnapshot(contentItemId).published();
    }

    List<Long> contentItemIdsReferencing(Collection<Long> termIds);

    /**
     * Every content item id in ascending order.
     */
    List<Long> allContentItemIds();
}
