package tech.gatehouse.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.gatehouse.platform.authentication.history.LoginHistory;
import tech.gatehouse.platform.authentication.history.LoginHistoryRepository;
import tech.gatehouse.platform.authentication.history.LoginOutcome;
import tech.gatehouse.platform.authentication.lockout.AccountLockoutService;
import tech.gatehouse.platform.authentication.lockout.LockoutState;
import tech.gatehouse.platform.authentication.session.RefreshToken;
import tech.gatehouse.platform.authentication.session.RefreshTokenRepository;
import tech.gatehouse.platform.authentication.session.RefreshTokenValues;
import tech.gatehouse.platform.authentication.token.AccessTokenClaims;
import tech.gatehouse.platform.authentication.token.TokenSigner;
import tech.gatehouse.platform.cache.PermissionCacheService;
import tech.gatehouse.platform.common.Result;
import tech.gatehouse.platform.principal.PasswordService;
import tech.gatehouse.platform.principal.Principal;
import tech.gatehouse.platform.principal.PrincipalRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Credential verification and session lifecycle.
 *
 * <p>Login checks, in order: the principal exists and is active, the account
 * is not locked, the password matches. Failures feed the lockout counter;
 * a success resets it and issues an access token plus a refresh token.
 *
 * <p>Refresh tokens are single-use. Refreshing revokes the presented token
 * and stores its replacement atomically; presenting a revoked token again
 * revokes every token descending from the same login.
 */
@ApplicationScoped
public class CredentialService {

    private static final Logger LOG = Logger.getLogger(CredentialService.class);

    static final int MAX_HISTORY_LIMIT = 100;

    /**
     * Verified against when the email is unknown, so both paths pay one Argon2 verification.
     */
    private static final String TIMING_PASSWORD = "gatehouse-timing-equalizer";

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    PasswordService passwordService;

    @Inject
    AccountLockoutService lockoutService;

    @Inject
    PermissionCacheService permissionCache;

    @Inject
    TokenSigner tokenSigner;

    @Inject
    RefreshTokenRepository refreshTokenRepo;

    @Inject
    LoginHistoryRepository loginHistoryRepo;

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    private volatile String dummyHash;

    /**
     * Verify an email/password pair and open a session.
     *
     * @param email     login email; matched case-insensitively after trimming
     * @param password  plain password
     * @param ipAddress client address, recorded on the refresh token and in login history
     * @param userAgent client user agent for login history
     */
    public Result<SessionTokens> authenticate(String email, String password, String ipAddress, String userAgent) {
        Instant now = clock.instant();
        String normalizedEmail = Principal.normalizeEmail(email);

        Optional<Principal> found = normalizedEmail == null || normalizedEmail.isEmpty()
            ? Optional.empty()
            : principalRepo.findByEmail(normalizedEmail);

        if (found.isEmpty()) {
            passwordService.verifyPassword(password, dummyHash());
            LOG.debug("Login failed: no principal for the given email");
            return Result.failure(AuthenticationErrors.invalidCredentials());
        }

        Principal principal = found.get();

        if (!principal.active) {
            LOG.infof("Login rejected for inactive principal %s", principal.id);
            recordAttempt(principal, LoginOutcome.ACCOUNT_INACTIVE, ipAddress, userAgent, now);
            return Result.failure(AuthenticationErrors.accountInactive());
        }

        if (lockoutService.stateOf(principal, now) instanceof LockoutState.Locked locked) {
            LOG.infof("Login rejected for locked principal %s (locked until %s)", principal.id, locked.until());
            recordAttempt(principal, LoginOutcome.ACCOUNT_LOCKED, ipAddress, userAgent, now);
            return Result.failure(AuthenticationErrors.accountLocked(locked.until()));
        }

        if (password == null || !passwordService.verifyPassword(password, principal.passwordHash)) {
            LockoutState after = lockoutService.recordFailure(principal, now);
            recordAttempt(principal, LoginOutcome.INVALID_CREDENTIALS, ipAddress, userAgent, now);
            if (after instanceof LockoutState.Locked locked) {
                return Result.failure(AuthenticationErrors.accountLocked(locked.until()));
            }
            return Result.failure(AuthenticationErrors.invalidCredentials());
        }

        lockoutService.recordSuccess(principal, now);
        recordAttempt(principal, LoginOutcome.SUCCESS, ipAddress, userAgent, now);

        IssuedSession issued = prepareSession(principal, null, ipAddress, now);
        refreshTokenRepo.persist(issued.refreshToken());

        LOG.infof("Principal %s logged in, refresh token %s issued", principal.id, issued.refreshToken().id);
        return Result.success(issued.tokens());
    }

    /**
     * Exchange a refresh token for a new access token and a new refresh token.
     */
    public Result<SessionTokens> refreshSession(String refreshToken) {
        return refreshSession(refreshToken, null);
    }

    public Result<SessionTokens> refreshSession(String refreshToken, String ipAddress) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Result.failure(AuthenticationErrors.invalidToken());
        }

        Instant now = clock.instant();
        String tokenHash = RefreshTokenValues.hash(refreshToken);

        Optional<RefreshToken> found = refreshTokenRepo.findByTokenHash(tokenHash);
        if (found.isEmpty()) {
            LOG.debug("Refresh rejected: unknown token");
            return Result.failure(AuthenticationErrors.invalidToken());
        }

        RefreshToken current = found.get();

        if (current.isRevoked()) {
            int revoked = refreshTokenRepo.revokeFamily(current.familyId, now);
            LOG.warnf("Revoked refresh token %s presented again for principal %s; revoked %d tokens of family %s",
                current.id, current.principalId, revoked, current.familyId);
            return Result.failure(AuthenticationErrors.invalidToken());
        }

        if (current.isExpiredAt(now)) {
            LOG.debugf("Refresh rejected: token %s expired at %s", current.id, current.expiresAt);
            return Result.failure(AuthenticationErrors.invalidToken());
        }

        Optional<Principal> owner = principalRepo.findById(current.principalId);
        if (owner.isEmpty() || !owner.get().active) {
            LOG.infof("Refresh rejected: principal %s missing or inactive", current.principalId);
            return Result.failure(AuthenticationErrors.accountInactive());
        }

        Principal principal = owner.get();
        if (lockoutService.stateOf(principal, now) instanceof LockoutState.Locked locked) {
            LOG.infof("Refresh rejected: principal %s locked until %s", principal.id, locked.until());
            return Result.failure(AuthenticationErrors.accountLocked(locked.until()));
        }

        String clientIp = ipAddress != null ? ipAddress : current.createdByIp;
        IssuedSession issued = prepareSession(principal, current.familyId, clientIp, now);

        if (!refreshTokenRepo.rotate(tokenHash, issued.refreshToken(), now)) {
            LOG.infof("Refresh token %s was rotated or revoked concurrently", current.id);
            return Result.failure(AuthenticationErrors.invalidToken());
        }

        LOG.debugf("Rotated refresh token %s to %s for principal %s",
            current.id, issued.refreshToken().id, principal.id);
        return Result.success(issued.tokens());
    }

    /**
     * Principal that owns a refresh token, empty when the id is unknown.
     */
    public Optional<String> sessionOwner(String refreshTokenId) {
        if (refreshTokenId == null) {
            return Optional.empty();
        }
        return refreshTokenRepo.findByTokenId(refreshTokenId).map(token -> token.principalId);
    }

    /**
     * Revoke one refresh token by id. Revoking an already revoked token succeeds.
     */
    public Result<Void> revokeSession(String refreshTokenId) {
        Optional<RefreshToken> found = refreshTokenId == null
            ? Optional.empty()
            : refreshTokenRepo.findByTokenId(refreshTokenId);
        if (found.isEmpty()) {
            return Result.failure(AuthenticationErrors.refreshTokenNotFound(String.valueOf(refreshTokenId)));
        }

        RefreshToken token = found.get();
        if (!token.isRevoked() && refreshTokenRepo.revoke(token.id, clock.instant())) {
            LOG.infof("Revoked refresh token %s for principal %s", token.id, token.principalId);
        }
        return Result.success(null);
    }

    /**
     * Revoke the refresh token with the given value, as presented by a client on logout.
     */
    public Result<Void> logout(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Result.failure(AuthenticationErrors.invalidToken());
        }
        Optional<RefreshToken> found = refreshTokenRepo.findByTokenHash(RefreshTokenValues.hash(refreshToken));
        if (found.isEmpty()) {
            return Result.failure(AuthenticationErrors.invalidToken());
        }
        return revokeSession(found.get().id);
    }

    /**
     * Revoke every refresh token of a principal.
     *
     * @return number of tokens revoked
     */
    public Result<Integer> revokeAllSessions(String principalId) {
        if (principalId == null || principalRepo.findById(principalId).isEmpty()) {
            return Result.failure(AuthenticationErrors.principalNotFound(String.valueOf(principalId)));
        }
        int revoked = refreshTokenRepo.revokeAllForPrincipal(principalId, clock.instant());
        LOG.infof("Revoked %d refresh tokens for principal %s", revoked, principalId);
        return Result.success(revoked);
    }

    /**
     * Most recent login attempts of a principal, newest first.
     *
     * @param limit requested row count, clamped to 1..100
     */
    public Result<List<LoginHistory>> recentLoginAttempts(String principalId, int limit) {
        if (principalId == null || principalRepo.findById(principalId).isEmpty()) {
            return Result.failure(AuthenticationErrors.principalNotFound(String.valueOf(principalId)));
        }
        int bounded = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return Result.success(loginHistoryRepo.findRecent(principalId, bounded));
    }

    private IssuedSession prepareSession(Principal principal, String familyId, String ipAddress, Instant now) {
        AuthConfig.JwtConfig jwt = authConfig.jwt();

        Set<String> roles = principalRepo.findActiveRoleNames(principal.id);
        Set<String> permissions = permissionCache.getPermissions(principal.id);

        Instant accessExpiresAt = now.plus(jwt.accessTokenExpiry());
        String accessToken = tokenSigner.sign(new AccessTokenClaims(
            UUID.randomUUID().toString(),
            principal.id,
            principal.email,
            principal.name,
            principal.emailVerified,
            roles,
            permissions,
            now,
            accessExpiresAt));

        String refreshValue = RefreshTokenValues.generate();
        Instant refreshExpiresAt = now.plus(jwt.refreshTokenExpiry());
        RefreshToken refreshToken = RefreshToken.issue(
            principal.id, RefreshTokenValues.hash(refreshValue), familyId, now, refreshExpiresAt, ipAddress);

        SessionTokens tokens = new SessionTokens(
            principal.id, accessToken, accessExpiresAt, refreshValue, refreshToken.id, refreshExpiresAt);
        return new IssuedSession(tokens, refreshToken);
    }

    private void recordAttempt(Principal principal, LoginOutcome outcome, String ipAddress, String userAgent,
                               Instant now) {
        try {
            loginHistoryRepo.append(LoginHistory.of(principal.id, outcome, ipAddress, userAgent, now));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record %s login attempt for principal %s", outcome, principal.id);
        }
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = passwordService.hashPassword(TIMING_PASSWORD);
            dummyHash = hash;
        }
        return hash;
    }

    private record IssuedSession(SessionTokens tokens, RefreshToken refreshToken) {
    }
}
