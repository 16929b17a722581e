package tech.gatehouse.platform.authentication.session;

import tech.gatehouse.platform.shared.EntityType;
import tech.gatehouse.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * A long-lived, single-use credential that can be exchanged for a new session.
 *
 * Features:
 * - Rotation: each use revokes this token and issues a replacement
 * - Family tracking: every token descending from one login shares a family id,
 *   and the whole family is revoked when a revoked token is presented again
 * - Revocation: tokens can be explicitly revoked
 *
 * Only the SHA-256 hash of the token value is stored.
 */
public class RefreshToken {

    public String id;

    /**
     * Base64url SHA-256 of the token value handed to the client.
     */
    public String tokenHash;

    public String principalId;

    /**
     * Id of the first token issued at login; shared by all rotations of it.
     */
    public String familyId;

    public Instant createdAt;

    public Instant expiresAt;

    /**
     * When this token was revoked (null while usable).
     */
    public Instant revokedAt;

    /**
     * Id of the token that replaced this one on rotation.
     */
    public String replacedBy;

    public String createdByIp;

    public RefreshToken() {
    }

    /**
     * New unrevoked token. A null {@code familyId} starts a new family.
     */
    public static RefreshToken issue(String principalId, String tokenHash, String familyId,
                                     Instant now, Instant expiresAt, String createdByIp) {
        RefreshToken token = new RefreshToken();
        token.id = TsidGenerator.generate(EntityType.REFRESH_TOKEN);
        token.tokenHash = tokenHash;
        token.principalId = principalId;
        token.familyId = familyId != null ? familyId : token.id;
        token.createdAt = now;
        token.expiresAt = expiresAt;
        token.createdByIp = createdByIp;
        return token;
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isActiveAt(Instant now) {
        return !isRevoked() && !isExpiredAt(now);
    }
}
