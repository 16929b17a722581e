package tech.gatehouse.platform.authentication.token;

import java.time.Instant;
import java.util.Set;

/**
 * Claims carried by a signed access token.
 *
 * @param tokenId       unique token id (jti)
 * @param subject       principal id (sub)
 * @param email         principal email
 * @param name          display name, may be null
 * @param emailVerified whether the email address has been verified
 * @param roles         active role names
 * @param permissions   canonical "resource:action" permissions at issuance
 * @param issuedAt      iat
 * @param expiresAt     exp
 */
public record AccessTokenClaims(
    String tokenId,
    String subject,
    String email,
    String name,
    boolean emailVerified,
    Set<String> roles,
    Set<String> permissions,
    Instant issuedAt,
    Instant expiresAt
) {
    public AccessTokenClaims {
        roles = roles != null ? Set.copyOf(roles) : Set.of();
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
    }
}
