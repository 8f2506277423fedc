package com.termaccess.backend.modules.grant.infrastructure.persistence;

import java.util.List;

import com.termaccess.backend.modules.grant.domain.NodeAccessGrant;
import com.termaccess.backend.modules.grant.domain.NodeAccessGrantId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NodeAccessGrantRepository extends JpaRepository<NodeAccessGrant, NodeAccessGrantId> {

    @Query("""
            select g
              from NodeAccessGrant g
             where g.id.contentItemId = :contentItemId
               and g.id.realm = :realm
             order by g.id.gid, g.id.language
            """)
    List<NodeAccessGrant> findByContentItem(@Param("contentItemId") long contentItemId, @Param("realm") String realm);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from NodeAccessGrant g
             where g.id.contentItemId = :contentItemId
               and g.id.realm = :realm
            """)
    int deleteByContentItem(@Param("contentItemId") long contentItemId, @Param("realm") String realm);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from NodeAccessGrant g where g.id.realm = :realm")
    int deleteByRealm(@Param("realm") String realm);
}
