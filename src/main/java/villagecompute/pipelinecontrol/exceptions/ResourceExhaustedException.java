package villagecompute.pipelinecontrol.exceptions;

/**
 * Exception signalling that a tenant has reached its concurrent operation ceiling.
 *
 * <p>
 * This is a contention signal, not a failure. The worker returns the run to the queue instead of spending a retry
 * attempt on it.
 */
public class ResourceExhaustedException extends RuntimeException {

    private final String tenantId;

    public ResourceExhaustedException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public ResourceExhaustedException(String tenantId, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
