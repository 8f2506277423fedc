package com.termaccess.backend.modules.content.application;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.termaccess.backend.modules.content.domain.ContentItem;
import com.termaccess.backend.modules.content.domain.ContentItemSnapshot;
import com.termaccess.backend.modules.content.domain.TermReference;
import com.termaccess.backend.modules.content.infrastructure.persistence.ContentItemRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class JpaContentItemQuery implements ContentItemQuery {

    private final ContentItemRepository contentItemRepository;

    public JpaContentItemQuery(ContentItemRepository contentItemRepository) {
        this.contentItemRepository = contentItemRepository;
    }

    @Override
    public ContentItemSnapshot getSnapshot(long contentItemId) {
        ContentItem item = contentItemRepository.findWithTerms(contentItemId)
                .orElseThrow(() -> new ContentItemNotFoundException(contentItemId));
        Set<Long> termIds = item.getTermReferences().stream()
                .map(TermReference::getTermId)
                .collect(Collectors.toSet());
        return new ContentItemSnapshot(item.getId(), item.isPublished(), item.getLangcode(), termIds);
    }

    @Override
    public List<Long> contentItemIdsReferencing(Collection<Long> termIds) {
        if (termIds == null || termIds.isEmpty()) {
            return List.of();
        }
        return contentItemRepository.findIdsReferencingTerms(termIds);
    }

    @Override
    public List<Long> allContentItemIds() {
        return contentItemRepository.findAllIdsOrdered();
    }
}
