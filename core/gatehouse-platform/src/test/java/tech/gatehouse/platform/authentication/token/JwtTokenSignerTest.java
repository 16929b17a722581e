package tech.gatehouse.platform.authentication.token;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.gatehouse.platform.testing.MutableClock;

import java.security.KeyPair;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JwtTokenSigner using a generated key pair.
 */
class JwtTokenSignerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private static KeyPair keyPair;

    private MutableClock clock;
    private JwtTokenSigner signer;

    @BeforeAll
    static void generateKeys() throws Exception {
        keyPair = JwtTokenSigner.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        signer = new JwtTokenSigner("gatehouse-test", keyPair, clock);
    }

    private static AccessTokenClaims claims(Instant issuedAt, Duration ttl) {
        return new AccessTokenClaims(
            "jti-1",
            "prn_0HZTEST00001",
            "alice@acme.com",
            "Alice",
            true,
            Set.of("Editor"),
            Set.of("documents:edit", "documents:read"),
            issuedAt,
            issuedAt.plus(ttl));
    }

    // ========================================
    // SIGN / VERIFY TESTS
    // ========================================

    @Test
    @DisplayName("verify should return the signed claims when token valid")
    void verify_shouldReturnClaims_whenTokenValid() {
        // Arrange
        String token = signer.sign(claims(T0, Duration.ofMinutes(15)));

        // Act
        AccessTokenClaims verified = signer.verify(token).orElseThrow();

        // Assert
        assertThat(token.split("\\.")).hasSize(3);
        assertThat(verified.tokenId()).isEqualTo("jti-1");
        assertThat(verified.subject()).isEqualTo("prn_0HZTEST00001");
        assertThat(verified.email()).isEqualTo("alice@acme.com");
        assertThat(verified.name()).isEqualTo("Alice");
        assertThat(verified.emailVerified()).isTrue();
        assertThat(verified.roles()).containsExactly("Editor");
        assertThat(verified.permissions()).containsExactlyInAnyOrder("documents:edit", "documents:read");
        assertThat(verified.issuedAt()).isEqualTo(T0);
        assertThat(verified.expiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(15)));
    }

    @Test
    @DisplayName("verify should reject an expired token")
    void verify_shouldReject_whenTokenExpired() {
        Instant issued = T0.minus(Duration.ofHours(2));
        String token = signer.sign(claims(issued, Duration.ofMinutes(15)));

        assertThat(signer.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("verify should judge expiry by the injected clock, not the system clock")
    void verify_shouldUseInjectedClock_whenJudgingExpiry() {
        // Arrange
        Instant issued = Instant.parse("2020-01-01T10:00:00Z");
        clock.set(issued);
        String token = signer.sign(claims(issued, Duration.ofMinutes(15)));

        // Act & Assert
        clock.set(issued.plus(Duration.ofMinutes(5)));
        assertThat(signer.verify(token)).isPresent();

        clock.set(issued.plus(Duration.ofMinutes(15)));
        assertThat(signer.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("verify should reject a token from another issuer or key")
    void verify_shouldReject_whenIssuerOrKeyDiffers() throws Exception {
        // Arrange
        String token = signer.sign(claims(T0, Duration.ofMinutes(15)));
        JwtTokenSigner otherIssuer = new JwtTokenSigner("someone-else", keyPair, clock);
        JwtTokenSigner otherKey = new JwtTokenSigner("gatehouse-test", JwtTokenSigner.generateKeyPair(), clock);

        // Act & Assert
        assertThat(otherIssuer.verify(token)).isEmpty();
        assertThat(otherKey.verify(token)).isEmpty();
    }

    @Test
    @DisplayName("verify should reject tampered and malformed tokens")
    void verify_shouldReject_whenTokenTamperedOrMalformed() {
        String token = signer.sign(claims(T0, Duration.ofMinutes(15)));
        String[] parts = token.split("\\.");
        String tampered = parts[0] + "." + parts[1] + "x." + parts[2];

        assertThat(signer.verify(tampered)).isEmpty();
        assertThat(signer.verify("not.a.jwt")).isEmpty();
        assertThat(signer.verify("")).isEmpty();
        assertThat(signer.verify(null)).isEmpty();
    }

    @Test
    @DisplayName("keyId should be a short fingerprint of the public key")
    void keyId_shouldBeStableFingerprint() {
        assertThat(signer.getKeyId()).hasSize(8);
        assertThat(JwtTokenSigner.keyIdOf(signer.getPublicKey())).isEqualTo(signer.getKeyId());
        assertThat(signer.getIssuer()).isEqualTo("gatehouse-test");
    }

    @Test
    @DisplayName("parsePem should strip armor and whitespace")
    void parsePem_shouldDecodeBody() {
        String pem = "-----BEGIN PUBLIC KEY-----\nAQID\nBA==\n-----END PUBLIC KEY-----\n";

        assertThat(JwtTokenSigner.parsePem(pem, "PUBLIC KEY")).containsExactly(1, 2, 3, 4);
    }
}
