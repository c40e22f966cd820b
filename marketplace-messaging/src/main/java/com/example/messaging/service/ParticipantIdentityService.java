package com.example.messaging.service;

import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.service.exception.ServiceException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the caller of a REST request or socket connection. Every acting user id in the service comes
 * from here, never from request bodies.
 */
@Component
@RequiredArgsConstructor
public class ParticipantIdentityService {

    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";

    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityVerifier identityVerifier;

    public AuthenticatedPrincipal resolveToken(String token) {
        return identityVerifier.verify(token)
                .orElseThrow(() -> new ServiceException(HttpStatus.UNAUTHORIZED, "Invalid or expired token", UNAUTHENTICATED));
    }

    public AuthenticatedPrincipal resolveAuthorization(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader) || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "Bearer token required", UNAUTHENTICATED);
        }
        return resolveToken(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
    }

    public AuthenticatedPrincipal requireAdmin(String authorizationHeader) {
        AuthenticatedPrincipal principal = resolveAuthorization(authorizationHeader);
        if (!principal.isAdmin()) {
            throw new ServiceException(HttpStatus.FORBIDDEN, "Administrator role required", "FORBIDDEN");
        }
        return principal;
    }
}
