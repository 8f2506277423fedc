package com.termaccess.backend.modules.identity.infrastructure.persistence;

import java.util.Collection;
import java.util.Set;

import com.termaccess.backend.modules.identity.domain.HostRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HostRoleRepository extends JpaRepository<HostRole, String> {

    @Query("select hr.id from HostRole hr where hr.id in :ids")
    Set<String> findExistingIds(@Param("ids") Collection<String> ids);
}
