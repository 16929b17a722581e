package tech.gatehouse.platform.principal;

import java.time.Instant;

/**
 * Failure count and lock of a principal as left by one failed login write.
 *
 * @param failedLoginCount consecutive failures after the write, 0 when the principal is unknown
 * @param lockedUntil lock end after the write, null when not locked
 */
public record FailedLoginTally(int failedLoginCount, Instant lockedUntil) {

    public static FailedLoginTally unknownPrincipal() {
        return new FailedLoginTally(0, null);
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }
}
