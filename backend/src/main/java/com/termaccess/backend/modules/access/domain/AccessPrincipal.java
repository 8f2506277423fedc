package com.termaccess.backend.modules.access.domain;

import java.util.Set;

/**
 * Already-authenticated subject of an access decision, as described by the host.
 *
 * @param userId       stable numeric user id; {@code 0} for anonymous visitors
 * @param roleIds      role memberships
 * @param capabilities host capabilities such as {@code bypass node access}
 */
public record AccessPrincipal(long userId, Set<String> roleIds, Set<String> capabilities) {

    public static final long ANONYMOUS_USER_ID = 0L;
    public static final String ANONYMOUS_ROLE = "anonymous";

    public AccessPrincipal {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public static AccessPrincipal anonymous() {
        return new AccessPrincipal(ANONYMOUS_USER_ID, Set.of(ANONYMOUS_ROLE), Set.of());
    }

    public boolean hasCapability(String capability) {
        return capability != null && capabilities.contains(capability);
    }
}
