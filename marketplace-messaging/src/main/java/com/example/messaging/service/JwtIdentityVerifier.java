package com.example.messaging.service;

import com.example.messaging.config.MessagingSecurityProperties;
import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.domain.ParticipantType;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Verifies the HS256 access tokens issued by the marketplace login service. User tokens carry
 * {@code userId} and {@code type} ({@code client} or {@code talent}); admin tokens carry {@code role}.
 */
@Slf4j
@Component
public class JwtIdentityVerifier implements IdentityVerifier {

    public static final String USER_ID_CLAIM = "userId";
    public static final String TYPE_CLAIM = "type";
    public static final String ROLE_CLAIM = "role";

    private static final Set<String> ADMIN_ROLES = Set.of("admin", "super_admin");

    private final JwtParser parser;

    public JwtIdentityVerifier(MessagingSecurityProperties securityProperties, Clock clock) {
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(securityProperties.getTokenSecret().getBytes(StandardCharsets.UTF_8)))
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public Optional<AuthenticatedPrincipal> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected token: {}", ex.getMessage());
            return Optional.empty();
        }
        if (claims.getExpiration() == null) {
            log.debug("Rejected token without expiry");
            return Optional.empty();
        }
        String userId = stringClaim(claims, USER_ID_CLAIM);
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return participantType(claims).map(type -> new AuthenticatedPrincipal(userId, type));
    }

    private static Optional<ParticipantType> participantType(Claims claims) {
        String role = stringClaim(claims, ROLE_CLAIM);
        if (role != null && ADMIN_ROLES.contains(role.toLowerCase(Locale.ROOT))) {
            return Optional.of(ParticipantType.ADMIN);
        }
        String type = stringClaim(claims, TYPE_CLAIM);
        String value = StringUtils.hasText(type) ? type : role;
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(ParticipantType.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            log.debug("Rejected token with unknown participant type {}", value);
            return Optional.empty();
        }
    }

    private static String stringClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value == null ? null : value.toString();
    }
}
