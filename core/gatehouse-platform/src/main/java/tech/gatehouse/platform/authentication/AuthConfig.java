package tech.gatehouse.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Min;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for authentication, token issuance and account lockout.
 *
 * Example configuration:
 * <pre>
 * gatehouse.auth.jwt.issuer=https://auth.example.com
 * gatehouse.auth.jwt.private-key-path=/keys/private.pem
 * gatehouse.auth.jwt.public-key-path=/keys/public.pem
 * gatehouse.auth.lockout.max-failed-attempts=5
 * gatehouse.auth.lockout.duration=PT30M
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "gatehouse.auth")
public interface AuthConfig {

    /**
     * JWT configuration for token issuance and validation.
     */
    JwtConfig jwt();

    /**
     * Failed-login lockout configuration.
     */
    LockoutConfig lockout();

    /**
     * JWT configuration.
     */
    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         */
        @WithDefault("gatehouse")
        String issuer();

        /**
         * Path to the RSA private key for signing tokens (PEM, PKCS#8).
         * When absent a key pair is generated at startup.
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key for validating tokens (PEM, X.509).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Access token lifetime.
         */
        @WithName("access-token-expiry")
        @WithDefault("PT15M")
        Duration accessTokenExpiry();

        /**
         * Refresh token lifetime.
         */
        @WithName("refresh-token-expiry")
        @WithDefault("P7D")
        Duration refreshTokenExpiry();
    }

    /**
     * Lockout configuration.
     */
    interface LockoutConfig {
        /**
         * Consecutive failed logins that lock the account.
         */
        @WithName("max-failed-attempts")
        @WithDefault("5")
        @Min(1)
        int maxFailedAttempts();

        /**
         * How long a locked account stays locked.
         */
        @WithDefault("PT30M")
        Duration duration();
    }
}
