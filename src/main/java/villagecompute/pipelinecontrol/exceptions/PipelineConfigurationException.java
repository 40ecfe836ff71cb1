package villagecompute.pipelinecontrol.exceptions;

/**
 * Exception thrown when a run cannot execute because its configuration is unusable: unknown tenant, missing
 * subscription, missing pipeline definition or no executor for the step type.
 *
 * <p>
 * Classified {@code CONFIGURATION}; retrying would fail the same way.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
