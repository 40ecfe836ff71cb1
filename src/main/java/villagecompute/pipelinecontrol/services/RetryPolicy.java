package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Retry rules for a run.
 *
 * @param maxRetries
 *            failed attempts after which the run is terminal
 * @param backoffMultiplier
 *            growth factor between consecutive delays
 * @param baseDelay
 *            delay before the first retry
 * @param maxDelay
 *            cap applied to every delay
 * @param retryableErrors
 *            error classes eligible for retry
 */
public record RetryPolicy(int maxRetries, double backoffMultiplier, Duration baseDelay, Duration maxDelay,
        Set<ErrorClass> retryableErrors) {

    /**
     * Error classes retried unless a policy says otherwise. Validation and configuration failures are never in this
     * set.
     */
    public static final Set<ErrorClass> DEFAULT_RETRYABLE = Set.copyOf(EnumSet.of(ErrorClass.TRANSIENT,
            ErrorClass.TIMEOUT, ErrorClass.RESOURCE_EXHAUSTED, ErrorClass.UNKNOWN));

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
        retryableErrors = retryableErrors == null || retryableErrors.isEmpty() ? DEFAULT_RETRYABLE
                : Set.copyOf(retryableErrors);
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, backoffMultiplier, baseDelay, maxDelay, retryableErrors);
    }

    public boolean isRetryable(ErrorClass errorClass) {
        return errorClass != ErrorClass.VALIDATION && errorClass != ErrorClass.CONFIGURATION
                && retryableErrors.contains(errorClass);
    }
}
