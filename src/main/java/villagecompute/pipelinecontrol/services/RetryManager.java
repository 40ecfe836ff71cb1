package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.PipelineRun;
import villagecompute.pipelinecontrol.data.models.PipelineRun.RunState;
import villagecompute.pipelinecontrol.exceptions.TransientBackendException;

/**
 * Decides whether and when a FAILED run goes back to PENDING.
 *
 * <p>
 * <b>Eligibility:</b> the run is FAILED, its failure was not recorded as terminal, {@code attempt_count} is below the
 * policy's {@code max_retries}, and its error class is in the policy's retryable set. Validation and configuration
 * errors are never retried.
 *
 * <p>
 * <b>Backoff:</b> {@code base_delay × multiplier^(attempt-1)}, capped at {@code max_delay}. With the defaults (60s,
 * 2.0, 1h cap) the delays are 1, 2, 4, 8 ... minutes.
 *
 * <p>
 * {@link #scheduleRetry} only flips the run to PENDING and stamps {@code next_retry_time}; the dispatch job
 * re-enqueues it once that time has passed.
 */
@ApplicationScoped
public class RetryManager {

    private static final Logger LOG = Logger.getLogger(RetryManager.class);

    @Inject
    RetryPolicy defaultPolicy;

    public RetryPolicy defaultPolicy() {
        return defaultPolicy;
    }

    public boolean shouldRetry(String runId) {
        return shouldRetry(runId, defaultPolicy);
    }

    /**
     * @return true if the run is eligible for another attempt under {@code policy}; false for unknown runs
     */
    public boolean shouldRetry(String runId, RetryPolicy policy) {
        Optional<PipelineRun> found = QuarkusTransaction.requiringNew().call(() -> PipelineRun.findByRunId(runId));
        if (found.isEmpty()) {
            LOG.warnf("Run %s not found, not retrying", runId);
            return false;
        }
        PipelineRun run = found.get();
        if (run.state != RunState.FAILED) {
            LOG.debugf("Run %s is %s, not FAILED; nothing to retry", runId, run.state);
            return false;
        }
        if (!run.retryable) {
            LOG.infof("Run %s failure recorded as terminal, not retrying", runId);
            return false;
        }
        if (run.attemptCount >= policy.maxRetries()) {
            LOG.infof("Run %s exhausted retries (%d/%d)", runId, run.attemptCount, policy.maxRetries());
            return false;
        }
        ErrorClass errorClass = run.errorClass != null ? run.errorClass : ErrorClass.classify(run.errorMessage);
        if (!policy.isRetryable(errorClass)) {
            LOG.infof("Run %s error class %s is not retryable", runId, errorClass);
            return false;
        }
        return true;
    }

    /**
     * Delay before retry number {@code attempt} under the default policy's base and cap.
     */
    public Duration backoffDelay(int attempt, double backoffMultiplier) {
        return backoffDelay(attempt, backoffMultiplier, defaultPolicy);
    }

    /**
     * @param attempt
     *            1-based attempt number that just failed; values below 1 are treated as 1
     * @param backoffMultiplier
     *            growth factor, at least 1.0
     */
    public static Duration backoffDelay(int attempt, double backoffMultiplier, RetryPolicy policy) {
        int effectiveAttempt = Math.max(1, attempt);
        double multiplier = Math.max(1.0, backoffMultiplier);
        double seconds = policy.baseDelay().toSeconds() * Math.pow(multiplier, effectiveAttempt - 1);
        long capSeconds = policy.maxDelay().toSeconds();
        if (Double.isInfinite(seconds) || seconds >= capSeconds) {
            return policy.maxDelay();
        }
        return Duration.ofSeconds(Math.round(seconds));
    }

    public Instant calculateRetryTime(int attempt, double backoffMultiplier) {
        return calculateRetryTime(attempt, backoffMultiplier, Instant.now());
    }

    public Instant calculateRetryTime(int attempt, double backoffMultiplier, Instant from) {
        return from.plus(backoffDelay(attempt, backoffMultiplier));
    }

    /**
     * FAILED → PENDING with {@code next_retry_time} set.
     *
     * @return true if the run was moved; false if it was not FAILED
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean scheduleRetry(String runId, Instant retryTime) {
        try {
            int updated = QuarkusTransaction.requiringNew()
                    .call(() -> PipelineRun.update(
                            "state = ?1, nextRetryTime = ?2, updatedAt = ?3 WHERE runId = ?4 AND state = ?5",
                            RunState.PENDING, retryTime, Instant.now(), runId, RunState.FAILED));
            if (updated == 1) {
                LOG.infof("Run %s scheduled for retry at %s", runId, retryTime);
                return true;
            }
            LOG.infof("Run %s not FAILED, retry not scheduled", runId);
            return false;
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "schedule retry");
        }
    }

    /**
     * Applies the retry decision to a run that just failed.
     *
     * @return the retry time if a retry was scheduled, empty if the run is now terminally FAILED
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public Optional<Instant> retryIfEligible(String runId, RetryPolicy policy) {
        if (!shouldRetry(runId, policy)) {
            return Optional.empty();
        }
        int attempt;
        try {
            attempt = QuarkusTransaction.requiringNew()
                    .call(() -> PipelineRun.findByRunId(runId).map(run -> run.attemptCount).orElse(1));
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "read attempt count");
        }
        Instant retryTime = Instant.now().plus(backoffDelay(attempt, policy.backoffMultiplier(), policy));
        return scheduleRetry(runId, retryTime) ? Optional.of(retryTime) : Optional.empty();
    }
}
