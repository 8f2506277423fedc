package com.termaccess.backend.modules.identity.application;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import com.termaccess.backend.modules.identity.infrastructure.persistence.HostRoleRepository;
import com.termaccess.backend.modules.identity.infrastructure.persistence.HostUserRepository;
import com.termaccess.backend.modules.permission.application.PrincipalDirectory;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class HostPrincipalDirectory implements PrincipalDirectory {

    private final HostUserRepository hostUserRepository;
    private final HostRoleRepository hostRoleRepository;

    public HostPrincipalDirectory(HostUserRepository hostUserRepository, HostRoleRepository hostRoleRepository) {
        this.hostUserRepository = hostUserRepository;
        this.hostRoleRepository = hostRoleRepository;
    }

    @Override
    public Set<Long> unresolvableUserIds(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return Set.of();
        }
        Set<Long> missing = new HashSet<>(userIds);
        missing.removeAll(hostUserRepository.findResolvableIds(userIds));
        return missing;
    }

    @Override
    public Set<String> unresolvableRoleIds(Collection<String> roleIds) {
        if (roleIds == null || roleIds.isEmpty()) {
            return Set.of();
        }
        Set<String> missing = new HashSet<>(roleIds);
        missing.removeAll(hostRoleRepository.findExistingIds(roleIds));
        return missing;
    }
}
