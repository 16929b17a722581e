package tech.gatehouse.platform.common;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import tech.gatehouse.platform.authentication.AuthenticationErrors;
import tech.gatehouse.platform.common.errors.UseCaseError;

/**
 * Maps {@link UseCaseError} values to HTTP responses.
 *
 * <ul>
 *   <li>AuthenticationError: 401, or 423 for a locked account</li>
 *   <li>NotFoundError: 404</li>
 * </ul>
 */
public final class ErrorResponses {

    static final int LOCKED = 423;

    private ErrorResponses() {
    }

    public static int statusOf(UseCaseError error) {
        if (error instanceof UseCaseError.NotFoundError) {
            return Response.Status.NOT_FOUND.getStatusCode();
        }
        return AuthenticationErrors.ACCOUNT_LOCKED.equals(error.code())
            ? LOCKED
            : Response.Status.UNAUTHORIZED.getStatusCode();
    }

    public static Response from(UseCaseError error) {
        return Response.status(statusOf(error))
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(error.message(), error.code(), error.details()))
            .build();
    }
}
