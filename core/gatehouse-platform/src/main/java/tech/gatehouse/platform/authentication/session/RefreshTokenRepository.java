package tech.gatehouse.platform.authentication.session;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for refresh tokens.
 */
public interface RefreshTokenRepository {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    Optional<RefreshToken> findByTokenId(String id);

    void persist(RefreshToken token);

    /**
     * Revoke the token with {@code currentHash} and store {@code replacement},
     * as one transaction. The revoke only applies while the current token is
     * unrevoked and unexpired at {@code now}, so of two concurrent rotations of
     * the same token exactly one succeeds.
     *
     * @return true if this call revoked the token and stored the replacement
     */
    boolean rotate(String currentHash, RefreshToken replacement, Instant now);

    /**
     * @return true if the token was active and is now revoked
     */
    boolean revoke(String id, Instant now);

    /**
     * Revoke every unrevoked token of a family.
     *
     * @return number of tokens revoked
     */
    int revokeFamily(String familyId, Instant now);

    /**
     * Revoke every unrevoked token of a principal.
     *
     * @return number of tokens revoked
     */
    int revokeAllForPrincipal(String principalId, Instant now);
}
