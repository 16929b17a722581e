package tech.gatehouse.platform.principal;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence operations the credential and authorization services need on principals.
 *
 * <p>The lockout mutators must each be atomic in the store: concurrent failed
 * logins for the same principal must never lose an increment, and a count
 * that reaches the threshold is never stored without its lock.
 */
public interface PrincipalRepository {

    Optional<Principal> findById(String id);

    /**
     * @param normalizedEmail email already passed through {@link Principal#normalizeEmail(String)}
     */
    Optional<Principal> findByEmail(String normalizedEmail);

    /**
     * Stored ABAC attributes for the principal; empty when none or unknown.
     */
    Map<String, String> findAttributes(String principalId);

    /**
     * Names of the active roles assigned to the principal.
     */
    Set<String> findActiveRoleNames(String principalId);

    /**
     * Atomically add one failed attempt and, in the same write, lock the
     * principal until {@code lockUntil} once the new count reaches
     * {@code maxFailedAttempts}. A lock still in force is left as it is.
     * When a previous lock has already expired at {@code now}, the count
     * restarts at 1 and the stale lock is cleared.
     *
     * @return the count and lock after the write, or
     *     {@link FailedLoginTally#unknownPrincipal()} when the principal does not exist
     */
    FailedLoginTally recordFailedLogin(String principalId, Instant now, int maxFailedAttempts, Instant lockUntil);

    /**
     * Reset the failure count, clear the lock and set last login.
     */
    void recordSuccessfulLogin(String principalId, Instant loginAt);
}
