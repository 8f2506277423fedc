package com.termaccess.backend.modules.grant.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands out group ids for access policies during one maintenance pass.
 *
 * <p>Equal policies get the same gid; a new policy gets the next integer after the highest gid
 * issued so far. The allocator owns its counter and is discarded after the pass. It is not
 * thread-safe; passes run one at a time.
 */
public final class GidAllocator {

    private final Map<PolicyKey, Integer> known;
    private final Map<PolicyKey, Integer> allocated = new LinkedHashMap<>();
    private int highestIssued;

    private GidAllocator(int highestIssued, Map<PolicyKey, Integer> known) {
        if (highestIssued < 0) {
            throw new IllegalArgumentException("highestIssued must be >= 0");
        }
        this.highestIssued = highestIssued;
        this.known = new LinkedHashMap<>(known);
    }

    /**
     * Allocator for a full rebuild: no policy known, first gid is {@code 1}.
     */
    public static GidAllocator freshPass() {
        return new GidAllocator(0, Map.of());
    }

    /**
     * Allocator continuing an existing registry whose highest gid is {@code highestIssued}.
     */
    public static GidAllocator continuing(int highestIssued, Map<PolicyKey, Integer> known) {
        return new GidAllocator(highestIssued, known);
    }

    public int gidFor(PolicyKey key) {
        Integer existing = known.get(key);
        if (existing != null) {
            return existing;
        }
        if (highestIssued == Integer.MAX_VALUE) {
            throw new IllegalStateException("Gid space exhausted");
        }
        int gid = ++highestIssued;
        known.put(key, gid);
        allocated.put(key, gid);
        return gid;
    }

    /**
     * Policies that received a new gid from this allocator, in allocation order.
     */
    public Map<PolicyKey, Integer> newlyAllocated() {
        return Collections.unmodifiableMap(allocated);
    }

    public int highestIssued() {
        return highestIssued;
    }
}
