package com.termaccess.backend.modules.content.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.termaccess.backend.modules.content.domain.ContentItem;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContentItemRepository extends JpaRepository<ContentItem, Long> {

    @EntityGraph(attributePaths = "termReferences")
    @Query("select c from ContentItem c where c.id = :id")
    Optional<ContentItem> findWithTerms(@Param("id") long id);

    @Query("""
            select distinct c.id
              from ContentItem c
              join c.termReferences ref
             where ref.termId in :termIds
             order by c.id
            """)
    List<Long> findIdsReferencingTerms(@Param("termIds") Collection<Long> termIds);

    @Query("select c.id from ContentItem c order by c.id")
    List<Long> findAllIdsOrdered();
}
