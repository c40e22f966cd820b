package com.example.messaging.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.messaging.config.MessagingSecurityProperties;
import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.domain.ParticipantType;
import com.example.messaging.support.MutableClock;
import com.example.messaging.support.TestTokens;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtIdentityVerifierTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final TestTokens tokens = new TestTokens(clock);
    private JwtIdentityVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new JwtIdentityVerifier(properties(TestTokens.SECRET), clock);
    }

    @Test
    void acceptsLoginServiceUserToken() {
        String token = tokens.sign(Map.of("userId", 42, "email", "t@example.com", "type", "talent"),
                clock.instant().plus(Duration.ofDays(7)));

        assertThat(verifier.verify(token)).contains(new AuthenticatedPrincipal("42", ParticipantType.TALENT));
    }

    @Test
    void readsParticipantTypeFromRoleWhenTypeIsAbsent() {
        String token = tokens.sign(Map.of("userId", "42", "role", "client"), clock.instant().plus(Duration.ofHours(1)));

        assertThat(verifier.verify(token)).contains(new AuthenticatedPrincipal("42", ParticipantType.CLIENT));
    }

    @Test
    void adminRolesMapToAdmin() {
        String admin = tokens.sign(Map.of("userId", 1, "username", "ops", "role", "admin"),
                clock.instant().plus(Duration.ofHours(24)));
        String superAdmin = tokens.sign(Map.of("userId", 2, "role", "super_admin"),
                clock.instant().plus(Duration.ofHours(24)));

        assertThat(verifier.verify(admin)).map(AuthenticatedPrincipal::getType).contains(ParticipantType.ADMIN);
        assertThat(verifier.verify(superAdmin)).map(AuthenticatedPrincipal::getType).contains(ParticipantType.ADMIN);
    }

    @Test
    void rejectsExpiredToken() {
        String token = tokens.issue("user-42", ParticipantType.CLIENT, Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(6));

        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    void rejectsTokenWithoutExpiry() {
        String token = tokens.sign(Map.of("userId", "42", "type", "client"), null);

        assertThat(verifier.verify(token)).isEmpty();
    }

    @Test
    void rejectsTokenSignedWithAnotherSecret() {
        String forged = new TestTokens("another-secret-that-is-long-enough-123", clock)
                .issue("user-42", ParticipantType.ADMIN, Duration.ofHours(1));

        assertThat(verifier.verify(forged)).isEmpty();
    }

    @Test
    void rejectsTamperedPayload() {
        String token = tokens.issue("user-42", ParticipantType.CLIENT, Duration.ofHours(1));
        String other = tokens.issue("user-43", ParticipantType.ADMIN, Duration.ofHours(1));
        String[] parts = token.split("\\.");
        String[] otherParts = other.split("\\.");

        assertThat(verifier.verify(parts[0] + "." + otherParts[1] + "." + parts[2])).isEmpty();
    }

    @Test
    void rejectsMissingClaimsAndUnknownTypes() {
        Instant expires = clock.instant().plus(Duration.ofHours(1));

        assertThat(verifier.verify(tokens.sign(Map.of("type", "client"), expires))).isEmpty();
        assertThat(verifier.verify(tokens.sign(Map.of("userId", "42"), expires))).isEmpty();
        assertThat(verifier.verify(tokens.sign(Map.of("userId", "42", "type", "guest"), expires))).isEmpty();
    }

    @Test
    void rejectsGarbage() {
        assertThat(verifier.verify(null)).isEmpty();
        assertThat(verifier.verify("")).isEmpty();
        assertThat(verifier.verify("no-dot")).isEmpty();
        assertThat(verifier.verify("!!!.???.***")).isEmpty();
    }

    private static MessagingSecurityProperties properties(String secret) {
        MessagingSecurityProperties properties = new MessagingSecurityProperties();
        properties.setTokenSecret(secret);
        return properties;
    }
}
