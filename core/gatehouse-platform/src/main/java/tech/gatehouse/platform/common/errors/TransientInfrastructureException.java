package tech.gatehouse.platform.common.errors;

/**
 * Raised when the cache or store is temporarily unreachable.
 *
 * <p>Calls that may throw this are retried with bounded backoff at the
 * cache/persistence boundary. Refresh token rotation is never retried.
 */
public class TransientInfrastructureException extends RuntimeException {

    public TransientInfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
