package com.termaccess.backend.modules.identity.infrastructure.persistence;

import java.util.Collection;
import java.util.Set;

import com.termaccess.backend.modules.identity.domain.HostUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HostUserRepository extends JpaRepository<HostUser, Long> {

    @Query("""
            select hu.id
              from HostUser hu
             where hu.id in :ids
               and hu.status <> com.termaccess.backend.modules.identity.domain.HostUserStatus.CANCELLED
            """)
    Set<Long> findResolvableIds(@Param("ids") Collection<Long> ids);
}
