package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.PipelineRun;
import villagecompute.pipelinecontrol.data.models.PipelineRun.RunState;
import villagecompute.pipelinecontrol.exceptions.ResourceNotFoundException;
import villagecompute.pipelinecontrol.exceptions.TransientBackendException;
import villagecompute.pipelinecontrol.exceptions.ValidationException;

/**
 * Run lifecycle state machine.
 *
 * <p>
 * <b>States:</b> SCHEDULED → PENDING → RUNNING → {COMPLETED | FAILED}. PENDING may also fail directly (duplicate
 * execution, stale, unusable configuration). FAILED → PENDING is the only backward edge and is taken by
 * {@link RetryManager#scheduleRetry}.
 *
 * <p>
 * Every change is a conditional update on the expected current state. A {@code false} return means another actor
 * moved the run first; callers must not assume the change happened.
 */
@ApplicationScoped
public class PipelineRunService {

    private static final Logger LOG = Logger.getLogger(PipelineRunService.class);

    static final Map<RunState, Set<RunState>> VALID_TRANSITIONS = new EnumMap<>(RunState.class);

    static {
        VALID_TRANSITIONS.put(RunState.SCHEDULED, EnumSet.of(RunState.PENDING));
        VALID_TRANSITIONS.put(RunState.PENDING, EnumSet.of(RunState.RUNNING, RunState.FAILED));
        VALID_TRANSITIONS.put(RunState.RUNNING, EnumSet.of(RunState.COMPLETED, RunState.FAILED));
        VALID_TRANSITIONS.put(RunState.FAILED, EnumSet.of(RunState.PENDING));
        VALID_TRANSITIONS.put(RunState.COMPLETED, EnumSet.noneOf(RunState.class));
    }

    public static boolean isValidTransition(RunState from, RunState to) {
        return from != null && to != null && VALID_TRANSITIONS.get(from).contains(to);
    }

    /**
     * Creates a SCHEDULED run under a generated id.
     *
     * @return the run id
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public String create(String tenantId, String configId, Instant scheduledTime) {
        String runId = UUID.randomUUID().toString();
        create(runId, tenantId, configId, scheduledTime);
        return runId;
    }

    /**
     * Creates a SCHEDULED run under a caller-chosen id. Creating an id that already exists is a no-op.
     *
     * @return true if the run was created, false if it already existed
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean create(String runId, String tenantId, String configId, Instant scheduledTime) {
        requireText(runId, "runId");
        requireText(tenantId, "tenantId");
        requireText(configId, "configId");
        if (scheduledTime == null) {
            throw new ValidationException("scheduledTime is required");
        }
        try {
            boolean created = QuarkusTransaction.requiringNew().call(() -> {
                if (PipelineRun.findByRunId(runId).isPresent()) {
                    return false;
                }
                Instant now = Instant.now();
                PipelineRun run = new PipelineRun();
                run.runId = runId;
                run.tenantId = tenantId;
                run.configId = configId;
                run.scheduledTime = scheduledTime;
                run.state = RunState.SCHEDULED;
                run.attemptCount = 0;
                run.retryable = true;
                run.createdAt = now;
                run.updatedAt = now;
                run.persist();
                return true;
            });
            if (created) {
                LOG.infof("Created run %s for tenant %s, config %s, scheduled %s", runId, tenantId, configId,
                        scheduledTime);
            }
            return created;
        } catch (RuntimeException e) {
            if (BackendFailures.isDuplicateKey(e)) {
                return false;
            }
            throw BackendFailures.translate(e, "create run");
        }
    }

    /**
     * Moves a run from {@code from} to {@code to} if it is still in {@code from}.
     *
     * @return true if this call moved the run; false if its state was not {@code from}
     * @throws ValidationException
     *             if the edge is not part of the state machine
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean transition(String runId, RunState from, RunState to) {
        requireText(runId, "runId");
        if (!isValidTransition(from, to)) {
            throw new ValidationException("Invalid state transition: " + from + " -> " + to);
        }
        int updated = execute("transition", () -> PipelineRun.update(
                "state = ?1, updatedAt = ?2 WHERE runId = ?3 AND state = ?4", to, Instant.now(), runId, from));
        return logOutcome(runId, updated, from + " -> " + to);
    }

    /**
     * PENDING → RUNNING, recording the execution id of this attempt.
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean markRunning(String runId, String pipelineLoggingId) {
        requireText(runId, "runId");
        requireText(pipelineLoggingId, "pipelineLoggingId");
        Instant now = Instant.now();
        int updated = execute("mark running",
                () -> PipelineRun.update(
                        "state = ?1, pipelineLoggingId = ?2, startedAt = ?3, nextRetryTime = null, updatedAt = ?3 "
                                + "WHERE runId = ?4 AND state = ?5",
                        RunState.RUNNING, pipelineLoggingId, now, runId, RunState.PENDING));
        return logOutcome(runId, updated, "PENDING -> RUNNING (" + pipelineLoggingId + ")");
    }

    /**
     * RUNNING → COMPLETED.
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean markCompleted(String runId, Duration duration) {
        requireText(runId, "runId");
        int seconds = duration == null ? 0 : (int) Math.min(Integer.MAX_VALUE, duration.toSeconds());
        Instant now = Instant.now();
        int updated = execute("mark completed",
                () -> PipelineRun.update(
                        "state = ?1, executionDurationSeconds = ?2, completedAt = ?3, errorMessage = null, "
                                + "errorClass = null, updatedAt = ?3 WHERE runId = ?4 AND state = ?5",
                        RunState.COMPLETED, seconds, now, runId, RunState.RUNNING));
        return logOutcome(runId, updated, "RUNNING -> COMPLETED (" + seconds + "s)");
    }

    /**
     * RUNNING or PENDING → FAILED, counting a failed attempt.
     *
     * @param error
     *            recorded error message, classified by its markers
     * @param shouldRetry
     *            false makes the failure terminal regardless of remaining attempts
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean markFailed(String runId, String error, boolean shouldRetry) {
        return markFailed(runId, error, ErrorClass.classify(error), shouldRetry, true);
    }

    /**
     * RUNNING or PENDING → FAILED, classifying the exception by type.
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean markFailed(String runId, Throwable error, boolean shouldRetry) {
        String message = error == null ? "Unknown error"
                : error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        return markFailed(runId, message, ErrorClass.classify(error), shouldRetry, true);
    }

    /**
     * RUNNING or PENDING → FAILED.
     *
     * @param errorClass
     *            classification deciding retry eligibility
     * @param shouldRetry
     *            false makes the failure terminal regardless of classification
     * @param countAttempt
     *            false for contention (admission denied), which does not use up a retry
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean markFailed(String runId, String error, ErrorClass errorClass, boolean shouldRetry,
            boolean countAttempt) {
        requireText(runId, "runId");
        String message = PipelineQueueService.truncate(error != null ? error : "Unknown error");
        ErrorClass effectiveClass = errorClass != null ? errorClass : ErrorClass.UNKNOWN;
        boolean retryable = shouldRetry && effectiveClass != ErrorClass.VALIDATION
                && effectiveClass != ErrorClass.CONFIGURATION;
        int increment = countAttempt ? 1 : 0;
        Instant now = Instant.now();
        int updated = execute("mark failed",
                () -> PipelineRun.update(
                        "state = ?1, errorMessage = ?2, errorClass = ?3, retryable = ?4, "
                                + "attemptCount = attemptCount + ?5, failedAt = ?6, updatedAt = ?6 "
                                + "WHERE runId = ?7 AND state IN (?8, ?9)",
                        RunState.FAILED, message, effectiveClass, retryable, increment, now, runId, RunState.RUNNING,
                        RunState.PENDING));
        if (updated == 1) {
            LOG.warnf("Run %s FAILED (%s, retryable=%s): %s", runId, effectiveClass, retryable, message);
            return true;
        }
        return logOutcome(runId, updated, "-> FAILED");
    }

    /**
     * Pushes back a PENDING run's next re-enqueue time. Used when a claimed run could not start for reasons that are
     * not its own failure.
     */
    public boolean deferPending(String runId, Instant nextAttempt) {
        requireText(runId, "runId");
        int updated = execute("defer run",
                () -> PipelineRun.update("nextRetryTime = ?1, updatedAt = ?2 WHERE runId = ?3 AND state = ?4",
                        nextAttempt, Instant.now(), runId, RunState.PENDING));
        return logOutcome(runId, updated, "deferred to " + nextAttempt);
    }

    public Optional<PipelineRun> findRun(String runId) {
        return execute("find run", () -> PipelineRun.findByRunId(runId));
    }

    /**
     * @throws ResourceNotFoundException
     *             if the run does not exist
     */
    public PipelineRun requireRun(String runId) {
        return findRun(runId).orElseThrow(() -> new ResourceNotFoundException("Run not found: " + runId));
    }

    private static boolean logOutcome(String runId, int updated, String change) {
        if (updated == 1) {
            LOG.debugf("Run %s: %s", runId, change);
            return true;
        }
        LOG.infof("Run %s: %s not applied, run missing or in another state", runId, change);
        return false;
    }

    private static <T> T execute(String operation, Callable<T> work) {
        try {
            return QuarkusTransaction.requiringNew().call(work);
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, operation);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }
}
