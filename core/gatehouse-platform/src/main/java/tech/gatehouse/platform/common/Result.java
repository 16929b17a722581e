package tech.gatehouse.platform.common;

import tech.gatehouse.platform.common.errors.UseCaseError;

/**
 * Result type for credential and session operations.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Domain rule violations (bad credentials, locked account, replayed refresh token)
 * come back as a {@link Failure}. Only unexpected faults are thrown.
 *
 * <p>Usage in the API layer:
 * <pre>{@code
 * if (result instanceof Result.Failure<SessionTokens> f) {
 *     return ErrorResponses.from(f.error());
 * }
 * return Response.ok(((Result.Success<SessionTokens>) result).value()).build();
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
