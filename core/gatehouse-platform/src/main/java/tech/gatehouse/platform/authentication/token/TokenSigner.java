package tech.gatehouse.platform.authentication.token;

import java.util.Optional;

/**
 * Signs and verifies access tokens.
 */
public interface TokenSigner {

    /**
     * Produce a compact signed token for the given claims.
     */
    String sign(AccessTokenClaims claims);

    /**
     * Verify signature, issuer and expiry.
     *
     * @return the claims, or empty when the token is not valid
     */
    Optional<AccessTokenClaims> verify(String token);
}
