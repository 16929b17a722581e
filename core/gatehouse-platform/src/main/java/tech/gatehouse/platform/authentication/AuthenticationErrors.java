package tech.gatehouse.platform.authentication;

import tech.gatehouse.platform.common.errors.UseCaseError;

import java.time.Instant;
import java.util.Map;

/**
 * Error values returned by credential and session operations.
 */
public final class AuthenticationErrors {

    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String ACCOUNT_INACTIVE = "ACCOUNT_INACTIVE";
    public static final String ACCOUNT_LOCKED = "ACCOUNT_LOCKED";
    public static final String INVALID_TOKEN = "INVALID_TOKEN";
    public static final String REFRESH_TOKEN_NOT_FOUND = "REFRESH_TOKEN_NOT_FOUND";
    public static final String PRINCIPAL_NOT_FOUND = "PRINCIPAL_NOT_FOUND";

    /**
     * Shared by unknown email and wrong password so callers cannot enumerate accounts.
     */
    public static final String INVALID_CREDENTIALS_MESSAGE = "Invalid credentials.";

    private AuthenticationErrors() {
    }

    public static UseCaseError.AuthenticationError invalidCredentials() {
        return new UseCaseError.AuthenticationError(INVALID_CREDENTIALS, INVALID_CREDENTIALS_MESSAGE, Map.of());
    }

    public static UseCaseError.AuthenticationError accountInactive() {
        return new UseCaseError.AuthenticationError(ACCOUNT_INACTIVE, "Account is not active.", Map.of());
    }

    public static UseCaseError.AuthenticationError accountLocked(Instant until) {
        return new UseCaseError.AuthenticationError(
            ACCOUNT_LOCKED,
            "Account is locked until " + until + ".",
            Map.of("lockedUntil", until.toString()));
    }

    public static UseCaseError.AuthenticationError invalidToken() {
        return new UseCaseError.AuthenticationError(INVALID_TOKEN, "Invalid or expired refresh token.", Map.of());
    }

    public static UseCaseError.NotFoundError refreshTokenNotFound(String id) {
        return new UseCaseError.NotFoundError(
            REFRESH_TOKEN_NOT_FOUND,
            "Refresh token not found: " + id,
            Map.of("refreshTokenId", id));
    }

    public static UseCaseError.NotFoundError principalNotFound(String id) {
        return new UseCaseError.NotFoundError(
            PRINCIPAL_NOT_FOUND,
            "Principal not found: " + id,
            Map.of("principalId", id));
    }
}
