package tech.gatehouse.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for operation failures.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping
 * and client-side handling. A denied authorization is not an error; it is an
 * ordinary {@code AuthorizationDecision}.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Principal or refresh token not found.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Authentication failed: bad credentials, inactive or locked account, invalid refresh token.
     * The code tells the cases apart; the message for unknown email and wrong password is identical.
     * Maps to HTTP 401 Unauthorized (423 Locked for ACCOUNT_LOCKED).
     */
    record AuthenticationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
