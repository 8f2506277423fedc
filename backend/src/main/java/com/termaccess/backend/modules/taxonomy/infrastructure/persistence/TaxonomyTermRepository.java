package com.termaccess.backend.modules.taxonomy.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.termaccess.backend.modules.taxonomy.domain.TaxonomyTerm;
import com.termaccess.backend.modules.taxonomy.domain.TermVocabularyView;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaxonomyTermRepository extends JpaRepository<TaxonomyTerm, Long> {

    @Query("""
            select t.id
              from TaxonomyTerm t
             where lower(t.name) = lower(:name)
             order by t.id
            """)
    List<Long> findIdsByNameIgnoreCase(@Param("name") String name);

    @Query("""
            select p
              from TaxonomyTerm t
              join t.parentIds p
             where t.id = :termId
             order by p
            """)
    List<Long> findParentIds(@Param("termId") long termId);

    @Query("""
            select t.id
              from TaxonomyTerm t
              join t.parentIds p
             where p = :parentId
             order by t.id
            """)
    List<Long> findChildIds(@Param("parentId") long parentId);

    @Query("select t.id as id, t.vocabularyId as vocabularyId from TaxonomyTerm t where t.id in :ids")
    List<TermVocabularyView> findVocabularies(@Param("ids") Collection<Long> ids);

    @Query("select t.id from TaxonomyTerm t where t.vocabularyId = :vocabularyId order by t.id")
    List<Long> findIdsByVocabulary(@Param("vocabularyId") String vocabularyId);
}
