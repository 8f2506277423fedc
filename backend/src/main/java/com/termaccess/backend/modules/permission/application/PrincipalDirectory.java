package com.termaccess.backend.modules.permission.application;

import java.util.Collection;
import java.util.Set;

/**
 * Host identity lookups needed to validate permission saves.
 */
public interface PrincipalDirectory {

    /**
     * @return the subset of {@code userIds} that the host cannot resolve to a live account
     */
    Set<Long> unresolvableUserIds(Collection<Long> userIds);

    /**
     * @return the subset of {@code roleIds} the host does not define
     */
    Set<String> unresolvableRoleIds(Collection<String> roleIds);
}
