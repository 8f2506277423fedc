package com.termaccess.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.Set;

import com.termaccess.backend.modules.permission.domain.PrincipalKind;
import com.termaccess.backend.modules.permission.domain.TermPermission;
import com.termaccess.backend.modules.permission.domain.TermPermissionId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TermPermissionRepository extends JpaRepository<TermPermission, TermPermissionId> {

    List<TermPermission> findByIdTermId(long termId);

    @Query("""
            select tp.id.principalId
              from TermPermission tp
             where tp.id.termId = :termId
               and tp.id.principalKind = :kind
            """)
    List<String> findPrincipalIds(@Param("termId") long termId, @Param("kind") PrincipalKind kind);

    @Query("""
            select distinct tp.id.termId
              from TermPermission tp
             where tp.id.principalKind = :kind
               and tp.id.principalId = :principalId
            """)
    Set<Long> findTermIdsByPrincipal(@Param("kind") PrincipalKind kind, @Param("principalId") String principalId);

    @Query("select distinct tp.id.termId from TermPermission tp order by tp.id.termId")
    List<Long> findRestrictedTermIds();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from TermPermission tp
             where tp.id.principalKind = :kind
               and tp.id.principalId = :principalId
            """)
    int deleteByPrincipal(@Param("kind") PrincipalKind kind, @Param("principalId") String principalId);
}
