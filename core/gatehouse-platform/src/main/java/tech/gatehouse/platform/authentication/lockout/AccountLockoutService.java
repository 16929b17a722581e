package tech.gatehouse.platform.authentication.lockout;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authentication.AuthConfig;
import tech.gatehouse.platform.principal.FailedLoginTally;
import tech.gatehouse.platform.principal.Principal;
import tech.gatehouse.platform.principal.PrincipalRepository;

import java.time.Instant;

/**
 * Failed-login lockout state machine.
 *
 * <p>States are {@code Active} and {@code Locked(until)}. The lock is always
 * derived from {@code lockedUntil > now}; the stored {@code locked} flag is
 * informational.
 *
 * <ul>
 *   <li>Active, failure with count below the threshold: stays Active.</li>
 *   <li>Active, failure reaching the threshold: Locked(now + duration).</li>
 *   <li>Any state, success: Active with the count reset to 0 and the lock cleared.</li>
 *   <li>Locked past its expiry: Active again; the next failure starts a new count.</li>
 * </ul>
 *
 * <p>Configuration via gatehouse.auth.lockout:
 * <ul>
 *   <li>max-failed-attempts: Threshold before lockout (default: 5)</li>
 *   <li>duration: How long the lock lasts (default: 30m)</li>
 * </ul>
 */
@ApplicationScoped
public class AccountLockoutService {

    private static final Logger LOG = Logger.getLogger(AccountLockoutService.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    PrincipalRepository principalRepo;

    LockoutPolicy policy;

    public AccountLockoutService() {
    }

    public AccountLockoutService(PrincipalRepository principalRepo, LockoutPolicy policy) {
        this.principalRepo = principalRepo;
        this.policy = policy;
    }

    @PostConstruct
    void init() {
        this.policy = LockoutPolicy.from(authConfig.lockout());
        LOG.infof("Account lockout: %d failed attempts lock for %s",
            policy.maxFailedAttempts(), policy.lockoutDuration());
    }

    /**
     * Current state as seen at {@code now}.
     */
    public LockoutState stateOf(Principal principal, Instant now) {
        return principal.isLockedAt(now)
            ? new LockoutState.Locked(principal.lockedUntil)
            : LockoutState.active();
    }

    /**
     * Count a failed attempt and lock the account when the threshold is reached.
     * The count and the lock are written together by one repository call.
     *
     * @return the state after this failure
     */
    public LockoutState recordFailure(Principal principal, Instant now) {
        Instant until = now.plus(policy.lockoutDuration());
        FailedLoginTally tally = principalRepo.recordFailedLogin(
            principal.id, now, policy.maxFailedAttempts(), until);

        if (tally.isLockedAt(now)) {
            if (until.equals(tally.lockedUntil())) {
                LOG.warnf("Principal %s locked until %s after %d failed login attempts",
                    principal.id, until, tally.failedLoginCount());
            }
            return new LockoutState.Locked(tally.lockedUntil());
        }

        LOG.debugf("Recorded failed login for principal %s, count=%d", principal.id, tally.failedLoginCount());
        return LockoutState.active();
    }

    /**
     * Reset the failure count and clear any lock after a successful login.
     */
    public void recordSuccess(Principal principal, Instant now) {
        principalRepo.recordSuccessfulLogin(principal.id, now);
        if (principal.failedLoginCount > 0 || principal.locked) {
            LOG.debugf("Cleared %d failed attempts for principal %s", principal.failedLoginCount, principal.id);
        }
    }

    public LockoutPolicy policy() {
        return policy;
    }
}
