package tech.gatehouse.platform.authentication;

import java.time.Instant;

/**
 * Credentials handed to a client after login or refresh.
 *
 * @param principalId           authenticated principal
 * @param accessToken           signed JWT
 * @param accessTokenExpiresAt  exp of the access token
 * @param refreshToken          opaque refresh token value; only its hash is stored
 * @param refreshTokenId        id of the stored refresh token, usable for revocation
 * @param refreshTokenExpiresAt expiry of the refresh token
 */
public record SessionTokens(
    String principalId,
    String accessToken,
    Instant accessTokenExpiresAt,
    String refreshToken,
    String refreshTokenId,
    Instant refreshTokenExpiresAt
) {
    @Override
    public String toString() {
        return "SessionTokens[principalId=" + principalId
            + ", refreshTokenId=" + refreshTokenId
            + ", accessTokenExpiresAt=" + accessTokenExpiresAt
            + ", refreshTokenExpiresAt=" + refreshTokenExpiresAt + "]";
    }
}
