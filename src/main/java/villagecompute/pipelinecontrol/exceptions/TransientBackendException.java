package villagecompute.pipelinecontrol.exceptions;

/**
 * Exception thrown when the backing store is temporarily unavailable (connection loss, lock wait timeout).
 *
 * <p>
 * Service methods annotated with {@code @Retry(retryOn = TransientBackendException.class)} retry these with backoff
 * before propagating.
 */
public class TransientBackendException extends RuntimeException {

    public TransientBackendException(String message) {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
