package villagecompute.pipelinecontrol.exceptions;

/**
 * Exception thrown when a requested run, queue item or pipeline definition does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
