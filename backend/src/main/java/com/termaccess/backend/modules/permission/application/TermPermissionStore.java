package com.termaccess.backend.modules.permission.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.termaccess.backend.modules.permission.domain.PermissionChangeSet;
import com.termaccess.backend.modules.permission.domain.PrincipalKind;
import com.termaccess.backend.modules.permission.domain.TermAccessList;
import com.termaccess.backend.modules.permission.domain.TermPermission;
import com.termaccess.backend.modules.permission.domain.TermPermissionId;
import com.termaccess.backend.modules.permission.infrastructure.persistence.TermPermissionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class TermPermissionStore {

    private static final Logger log = LoggerFactory.getLogger(TermPermissionStore.class);

    private final TermPermissionRepository termPermissionRepository;
    private final PrincipalDirectory principalDirectory;

    public TermPermissionStore(TermPermissionRepository termPermissionRepository, PrincipalDirectory principalDirectory) {
        this.termPermissionRepository = termPermissionRepository;
        this.principalDirectory = principalDirectory;
    }

    public Set<Long> getAllowedUserIds(long termId) {
        return termPermissionRepository.findPrincipalIds(termId, PrincipalKind.USER).stream()
                .map(Long::parseLong)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<String> getAllowedRoleIds(long termId) {
        return Set.copyOf(termPermissionRepository.findPrincipalIds(termId, PrincipalKind.ROLE));
    }

    public TermAccessList getAccessList(long termId) {
        return TermAccessList.of(termId, termPermissionRepository.findByIdTermId(termId));
    }

    public List<Long> getRestrictedTermIds() {
        return termPermissionRepository.findRestrictedTermIds();
    }

    /**
     * Replaces the allowed users and roles of a term with exactly the submitted sets.
     *
     * @return entries that were added or removed; empty when the stored sets already matched
     * @throws PrincipalValidationException if any submitted id is unknown to the host
     */
    @Transactional
    public PermissionChangeSet saveTermPermissions(long termId, Collection<Long> userIds, Collection<String> roleIds) {
        Set<Long> submittedUsers = userIds == null ? Set.of() : userIds.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<String> submittedRoles = roleIds == null ? Set.of() : roleIds.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(role -> !role.isEmpty())
                .collect(Collectors.toSet());

        Set<Long> unresolvedUsers = principalDirectory.unresolvableUserIds(submittedUsers);
        Set<String> unresolvedRoles = principalDirectory.unresolvableRoleIds(submittedRoles);
        if (!unresolvedUsers.isEmpty() || !unresolvedRoles.isEmpty()) {
            throw new PrincipalValidationException(termId, unresolvedUsers, unresolvedRoles);
        }

        TermAccessList current = getAccessList(termId);

        Set<Long> addedUsers = difference(submittedUsers, current.userIds());
        Set<Long> removedUsers = difference(current.userIds(), submittedUsers);
        Set<String> addedRoles = difference(submittedRoles, current.roleIds());
        Set<String> removedRoles = difference(current.roleIds(), submittedRoles);

        PermissionChangeSet changeSet = new PermissionChangeSet(termId, addedUsers, removedUsers, addedRoles, removedRoles);
        if (changeSet.isEmpty()) {
            return changeSet;
        }

        List<TermPermissionId> removedIds = new ArrayList<>();
        removedUsers.forEach(userId -> removedIds.add(TermPermissionId.forUser(termId, userId)));
        removedRoles.forEach(roleId -> removedIds.add(TermPermissionId.forRole(termId, roleId)));
        if (!removedIds.isEmpty()) {
            termPermissionRepository.deleteAllById(removedIds);
        }

        List<TermPermission> added = new ArrayList<>();
        addedUsers.forEach(userId -> added.add(new TermPermission(TermPermissionId.forUser(termId, userId))));
        addedRoles.forEach(roleId -> added.add(new TermPermission(TermPermissionId.forRole(termId, roleId))));
        termPermissionRepository.saveAll(added);

        log.info("Term {} permissions replaced: +{} users, -{} users, +{} roles, -{} roles",
                termId, addedUsers.size(), removedUsers.size(), addedRoles.size(), removedRoles.size());
        return changeSet;
    }

    @Transactional
    public Set<Long> deleteAllForUser(long userId) {
        String principalId = Long.toString(userId);
        Set<Long> affectedTerms = new HashSet<>(termPermissionRepository.findTermIdsByPrincipal(PrincipalKind.USER, principalId));
        if (affectedTerms.isEmpty()) {
            return Set.of();
        }
        int deleted = termPermissionRepository.deleteByPrincipal(PrincipalKind.USER, principalId);
        log.info("Deleted {} term permission records of user {}", deleted, userId);
        return Set.copyOf(affectedTerms);
    }

    private static <T> Set<T> difference(Set<T> left, Set<T> right) {
        Set<T> result = new HashSet<>(left);
        result.removeAll(right);
        return result;
    }
}
