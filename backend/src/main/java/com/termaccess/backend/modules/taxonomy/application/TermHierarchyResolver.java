package com.termaccess.backend.modules.taxonomy.application;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongFunction;

import com.termaccess.backend.global.config.AccessControlSettings;
import com.termaccess.backend.modules.taxonomy.domain.TermVocabularyView;
import com.termaccess.backend.modules.taxonomy.infrastructure.persistence.TaxonomyTermRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Walks the host term tree. Traversal is depth-first over every parent (or child) edge; each
 * term is reported once even when reachable along several paths.
 */
@Service
@Transactional(readOnly = true)
public class TermHierarchyResolver {

    private final TaxonomyTermRepository taxonomyTermRepository;
    private final AccessControlSettings settings;

    public TermHierarchyResolver(TaxonomyTermRepository taxonomyTermRepository, AccessControlSettings settings) {
        this.taxonomyTermRepository = taxonomyTermRepository;
        this.settings = settings;
    }

    /**
     * Ancestors of the term, parents before grandparents along each path.
     * Empty when the term is a root or inheritance is disabled.
     *
     * @throws TermHierarchyException on a cycle or when the depth limit is exceeded
     */
    public List<Long> getAncestors(long termId) {
        if (!settings.inheritHierarchy()) {
            return List.of();
        }
        return walk(termId, taxonomyTermRepository::findParentIds);
    }

    public List<Long> getDescendants(long termId) {
        if (!settings.inheritHierarchy()) {
            return List.of();
        }
        return walk(termId, taxonomyTermRepository::findChildIds);
    }

    /**
     * Lowest term id whose name matches case-insensitively.
     *
     * @throws TermNotFoundException when no term carries the name
     */
    public long resolveIdByName(String name) {
        if (name == null || name.isBlank()) {
            throw new TermNotFoundException(String.valueOf(name));
        }
        List<Long> ids = taxonomyTermRepository.findIdsByNameIgnoreCase(name.trim());
        if (ids.isEmpty()) {
            throw new TermNotFoundException(name);
        }
        return ids.get(0);
    }

    public Map<Long, String> vocabulariesOf(Collection<Long> termIds) {
        if (termIds == null || termIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, String> vocabularies = new HashMap<>();
        for (TermVocabularyView view : taxonomyTermRepository.findVocabularies(termIds)) {
            vocabularies.put(view.getId(), view.getVocabularyId());
        }
        return vocabularies;
    }

    public List<Long> termIdsInVocabulary(String vocabularyId) {
        return taxonomyTermRepository.findIdsByVocabulary(vocabularyId);
    }

    private List<Long> walk(long startTermId, LongFunction<List<Long>> edges) {
        Set<Long> reached = new LinkedHashSet<>();
        Set<Long> onPath = new HashSet<>();
        Set<Long> finished = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        onPath.add(startTermId);
        stack.push(new Frame(startTermId, edges.apply(startTermId)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next >= frame.neighbours.size()) {
                stack.pop();
                onPath.remove(frame.termId);
                finished.add(frame.termId);
                continue;
            }
            long neighbour = frame.neighbours.get(frame.next++);
            if (onPath.contains(neighbour)) {
                throw new TermHierarchyException(startTermId,
                        "Cycle in term hierarchy at term " + neighbour + " reached from term " + startTermId);
            }
            if (finished.contains(neighbour)) {
                continue;
            }
            if (stack.size() > settings.maxHierarchyDepth()) {
                throw new TermHierarchyException(startTermId,
                        "Term hierarchy deeper than " + settings.maxHierarchyDepth() + " levels from term " + startTermId);
            }
            reached.add(neighbour);
            onPath.add(neighbour);
            stack.push(new Frame(neighbour, edges.apply(neighbour)));
        }
        return List.copyOf(reached);
    }

    private static final class Frame {
        private final long termId;
        private final List<Long> neighbours;
        private int next;

        private Frame(long termId, List<Long> neighbours) {
            this.termId = termId;
            this.neighbours = neighbours;
        }
    }
}
