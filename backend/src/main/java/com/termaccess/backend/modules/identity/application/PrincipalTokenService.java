package com.termaccess.backend.modules.identity.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.identity.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reads the principal the host has already authenticated out of a signed bearer token.
 * The subject is the numeric user id; {@code roles} and {@code capabilities} are string arrays.
 */
@Service
public class PrincipalTokenService {

    static final String ROLES_CLAIM = "roles";
    static final String CAPABILITIES_CLAIM = "capabilities";

    private final JwtTokenProvider tokenProvider;
    private final long tokenTtlMillis;
    private final Clock clock;

    public PrincipalTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long tokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.tokenTtlMillis = tokenTtlMillis;
        this.clock = clock;
    }

    public String issueToken(AccessPrincipal principal) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(Long.toString(principal.userId()))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(tokenTtlMillis)))
                .claim(ROLES_CLAIM, List.copyOf(principal.roleIds()))
                .claim(CAPABILITIES_CLAIM, List.copyOf(principal.capabilities()))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public AccessPrincipal parseToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            long userId = Long.parseLong(claims.getSubject());
            if (userId < 0) {
                throw new InvalidTokenException("Negative user id in token subject", null);
            }
            return new AccessPrincipal(
                    userId,
                    readStrings(claims, ROLES_CLAIM),
                    readStrings(claims, CAPABILITIES_CLAIM)
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid principal token", e);
        }
    }

    private Set<String> readStrings(Claims claims, String name) {
        Collection<?> raw = claims.get(name, List.class);
        if (raw == null) {
            return Set.of();
        }
        return raw.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
