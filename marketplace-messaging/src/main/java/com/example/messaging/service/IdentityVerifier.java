package com.example.messaging.service;

import com.example.messaging.domain.AuthenticatedPrincipal;
import java.util.Optional;

/**
 * Turns a bearer token into the caller's identity.
 */
public interface IdentityVerifier {

    /**
     * @return the principal, or empty when the token is malformed, forged or expired
     */
    Optional<AuthenticatedPrincipal> verify(String token);
}
