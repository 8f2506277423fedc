package com.termaccess.backend.modules.grant.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.termaccess.backend.modules.grant.domain.AccessPolicy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessPolicyRepository extends JpaRepository<AccessPolicy, Integer> {

    @Query("select ap from AccessPolicy ap where ap.policyHash = :policyHash")
    Optional<AccessPolicy> findByPolicyHash(@Param("policyHash") String policyHash);

    @Query("select coalesce(max(ap.gid), 0) from AccessPolicy ap")
    int findHighestGid();

    @Query("select ap from AccessPolicy ap order by ap.gid")
    List<AccessPolicy> findAllOrdered();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from AccessPolicy ap")
    int deleteAllPolicies();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from AccessPolicy ap
             where not exists (
                   select g
                     from NodeAccessGrant g
                    where g.id.gid = ap.gid
                      and g.id.realm = :realm
             )
            """)
    int deleteUnreferenced(@Param("realm") String realm);
}
