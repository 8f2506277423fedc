package com.termaccess.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.termaccess.backend.modules.access.domain.AccessPrincipal;
import com.termaccess.backend.modules.identity.application.PrincipalTokenService;
import com.termaccess.backend.modules.identity.application.PrincipalTokenService.InvalidTokenException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Turns the host's bearer token into an {@link AccessPrincipal}. Roles become {@code ROLE_*}
 * authorities and capabilities become plain authorities so URL rules can require them.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String USER_ID_MDC_KEY = "userId";

    private final PrincipalTokenService principalTokenService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            PrincipalTokenService principalTokenService,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.principalTokenService = principalTokenService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length());
        AccessPrincipal principal;
        try {
            principal = principalTokenService.parseToken(token);
        } catch (InvalidTokenException ex) {
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response,
                    new BadCredentialsException("INVALID_ACCESS_TOKEN", ex));
            return;
        }

        List<GrantedAuthority> authorities = new ArrayList<>();
        principal.roleIds().forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));
        principal.capabilities().forEach(capability -> authorities.add(new SimpleGrantedAuthority(capability)));

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        MDC.put(USER_ID_MDC_KEY, Long.toString(principal.userId()));
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(USER_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return request.getServletPath().startsWith("/actuator");
    }
}
