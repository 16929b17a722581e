package tech.gatehouse.platform.authentication.lockout;

import tech.gatehouse.platform.authentication.AuthConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Validated lockout settings.
 *
 * @param maxFailedAttempts consecutive failures that trigger a lock; at least 1
 * @param lockoutDuration   how long the lock lasts; strictly positive
 */
public record LockoutPolicy(int maxFailedAttempts, Duration lockoutDuration) {

    public LockoutPolicy {
        Objects.requireNonNull(lockoutDuration, "lockoutDuration");
        if (maxFailedAttempts < 1) {
            throw new IllegalArgumentException(
                "gatehouse.auth.lockout.max-failed-attempts must be at least 1, was " + maxFailedAttempts);
        }
        if (lockoutDuration.isZero() || lockoutDuration.isNegative()) {
            throw new IllegalArgumentException(
                "gatehouse.auth.lockout.duration must be positive, was " + lockoutDuration);
        }
    }

    public static LockoutPolicy from(AuthConfig.LockoutConfig config) {
        return new LockoutPolicy(config.maxFailedAttempts(), config.duration());
    }
}
