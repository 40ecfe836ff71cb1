package villagecompute.pipelinecontrol.exceptions;

/**
 * Exception thrown when caller input fails validation (priority out of range, illegal state edge, malformed cron).
 *
 * <p>
 * Runs failing with this exception are classified {@code VALIDATION} and are never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
