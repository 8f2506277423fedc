package com.termaccess.backend.modules.grant.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Canonical description of one access policy: the sorted set of restricted term ids a
 * principal must be allowed on. Two items with the same key share a gid.
 */
public record PolicyKey(SortedSet<Long> termIds) {

    private static final String PREFIX = "terms:";

    public PolicyKey {
        termIds = Collections.unmodifiableSortedSet(new TreeSet<>(termIds));
    }

    public static PolicyKey of(Collection<Long> termIds) {
        return new PolicyKey(new TreeSet<>(termIds));
    }

    public static PolicyKey open() {
        return new PolicyKey(new TreeSet<>());
    }

    public static PolicyKey parse(String value) {
        if (value == null || !value.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not a policy key: " + value);
        }
        String body = value.substring(PREFIX.length());
        if (body.isEmpty()) {
            return open();
        }
        Set<Long> ids = Arrays.stream(body.split(","))
                .map(Long::parseLong)
                .collect(Collectors.toSet());
        return of(ids);
    }

    public boolean isOpen() {
        return termIds.isEmpty();
    }

    public String value() {
        return PREFIX + termIds.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    /**
     * SHA-256 of {@link #value()} in hex; the registry indexes this instead of the unbounded key.
     */
    public String hash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    @Override
    public String toString() {
        return value();
    }
}
