package villagecompute.pipelinecontrol.services;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.PipelineDefinition;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem;
import villagecompute.pipelinecontrol.data.models.PipelineRun;
import villagecompute.pipelinecontrol.data.models.PipelineRun.RunState;
import villagecompute.pipelinecontrol.exceptions.PipelineConfigurationException;
import villagecompute.pipelinecontrol.exceptions.ResourceExhaustedException;
import villagecompute.pipelinecontrol.jobs.PipelineStepExecutor;
import villagecompute.pipelinecontrol.jobs.StepContext;
import villagecompute.pipelinecontrol.jobs.StepResult;
import villagecompute.pipelinecontrol.observability.LoggingConfig;
import villagecompute.pipelinecontrol.observability.ObservabilityMetrics;
import villagecompute.pipelinecontrol.services.ExecutionLockManager.LockResult;
import villagecompute.pipelinecontrol.services.UsageQuotaService.RunOutcome;

/**
 * Executes claimed queue items.
 *
 * <p>
 * <b>Per item:</b>
 * <ol>
 * <li>claim the next item and load its run and definition</li>
 * <li>resolve the tenant tier</li>
 * <li>acquire the execution lock for (tenant, pipeline); a live holder defers the run as a duplicate</li>
 * <li>PENDING → RUNNING and reserve a concurrency count on today's quota row</li>
 * <li>run the step executor registered for the definition's step type</li>
 * <li>COMPLETED, or FAILED followed by the retry decision</li>
 * <li>release the lock and the quota reservation</li>
 * </ol>
 *
 * <p>
 * Contention never blocks the worker. A run whose executor was denied admission, whose pipeline is already running
 * elsewhere, or whose lock could not be decided because the store was down and the lock fails closed, goes back to
 * PENDING with a short delay and the dispatch job
 * re-enqueues it. These deferrals do not use up a retry.
 */
@ApplicationScoped
public class PipelineWorker {

    private static final Logger LOG = Logger.getLogger(PipelineWorker.class);

    /**
     * What happened to one claimed item.
     */
    public enum WorkOutcome {
        /** Nothing was claimable. */
        EMPTY,
        COMPLETED,
        /** Failed and scheduled for another attempt. */
        RETRY_SCHEDULED,
        /** Failed terminally. */
        FAILED,
        /** Another execution of the pipeline held the lock; the run was deferred. */
        DUPLICATE,
        /** Deferred without using up a retry. */
        REQUEUED,
        /** The run was not PENDING; nothing was executed. */
        SKIPPED
    }

    @Inject
    PipelineQueueService queueService;

    @Inject
    PipelineRunService runService;

    @Inject
    RetryManager retryManager;

    @Inject
    ExecutionLockManager lockManager;

    @Inject
    SubscriptionService subscriptionService;

    @Inject
    UsageQuotaService usageQuotaService;

    @Inject
    PipelineStepExecutorRegistry executorRegistry;

    @Inject
    ObservabilityMetrics metrics;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "pipelinecontrol.worker.id")
    Optional<String> configuredWorkerId;

    @ConfigProperty(
            name = "pipelinecontrol.worker.requeue-delay-seconds",
            defaultValue = "30")
    long requeueDelaySeconds;

    /**
     * @return configured worker id, or {@code hostname:pid}
     */
    public String workerId() {
        if (configuredWorkerId.isPresent() && !configuredWorkerId.get().isBlank()) {
            return configuredWorkerId.get();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        return host + ":" + ProcessHandle.current().pid();
    }

    /**
     * Processes items until the queue is empty or {@code batchSize} items were handled.
     *
     * @return number of items handled
     */
    public int poll(String workerId, int batchSize) {
        int handled = 0;
        while (handled < batchSize) {
            if (processNext(workerId) == WorkOutcome.EMPTY) {
                break;
            }
            handled++;
        }
        return handled;
    }

    public WorkOutcome processNext(String workerId) {
        Optional<PipelineQueueItem> claimed = queueService.dequeue(workerId);
        if (claimed.isEmpty()) {
            return WorkOutcome.EMPTY;
        }
        PipelineQueueItem item = claimed.get();

        Span span = tracer.spanBuilder("pipeline.execute").setAttribute("queue.id", item.queueId)
                .setAttribute("tenant.id", item.tenantId).setAttribute("worker.id", workerId).startSpan();
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setWorkerId(workerId);
            LoggingConfig.setQueueId(item.queueId);
            LoggingConfig.setTenantId(item.tenantId);

            WorkOutcome outcome = process(item, workerId);
            span.setAttribute("pipeline.outcome", outcome.name());
            span.setStatus(outcome == WorkOutcome.COMPLETED ? StatusCode.OK : StatusCode.UNSET);
            metrics.incrementRunFinished(outcome.name().toLowerCase(Locale.ROOT));
            return outcome;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Worker %s failed while handling item %s", workerId, item.queueId);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            failItemQuietly(item.queueId, "Worker error: " + e.getMessage());
            metrics.incrementRunFinished("error");
            return WorkOutcome.FAILED;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private WorkOutcome process(PipelineQueueItem item, String workerId) {
        String runId = item.runId != null ? item.runId
                : item.config.get(PipelineDispatchService.CONFIG_RUN_ID) != null
                        ? item.config.get(PipelineDispatchService.CONFIG_RUN_ID).toString()
                        : null;
        if (runId == null) {
            queueService.markFailed(item.queueId, "Invalid queue item: no run_id");
            return WorkOutcome.FAILED;
        }
        LoggingConfig.setRunId(runId);

        Optional<PipelineRun> found = runService.findRun(runId);
        if (found.isEmpty()) {
            queueService.markFailed(item.queueId, "Run " + runId + " not found");
            return WorkOutcome.FAILED;
        }
        PipelineRun run = found.get();
        if (run.state != RunState.PENDING) {
            LOG.infof("Run %s is %s, item %s has nothing to execute", runId, run.state, item.queueId);
            queueService.markFailed(item.queueId, "Run " + runId + " is " + run.state + ", not PENDING");
            return WorkOutcome.SKIPPED;
        }

        Optional<PipelineDefinition> definition = QuarkusTransaction.requiringNew()
                .call(() -> PipelineDefinition.findByConfigId(run.configId));
        if (definition.isEmpty()) {
            return failBeforeStart(item, run,
                    new PipelineConfigurationException("Pipeline not configured: definition " + run.configId));
        }

        SubscriptionTier tier;
        try {
            tier = subscriptionService.getTier(run.tenantId);
        } catch (PipelineConfigurationException e) {
            return failBeforeStart(item, run, e);
        }

        return executeLocked(item, run, definition.get(), tier, workerId);
    }

    private WorkOutcome executeLocked(PipelineQueueItem item, PipelineRun run, PipelineDefinition definition,
            SubscriptionTier tier, String workerId) {
        String executionId = UUID.randomUUID().toString();
        LoggingConfig.setPipelineLoggingId(executionId);

        LockResult lock = lockManager.acquire(run.tenantId, definition.pipelineId, executionId, workerId);
        if (lock.isDuplicate()) {
            Instant retryAt = Instant.now().plusSeconds(requeueDelaySeconds);
            LOG.infof("Pipeline %s already running (execution %s), run %s deferred to %s", definition.pipelineId,
                    lock.existingExecutionId(), run.runId, retryAt);
            runService.deferPending(run.runId, retryAt);
            queueService.markFailed(item.queueId, "Pipeline " + definition.pipelineId + " already running (execution "
                    + lock.existingExecutionId() + "), run deferred to " + retryAt);
            recordStatus(definition, "DUPLICATE");
            return WorkOutcome.DUPLICATE;
        }
        if (!lock.granted()) {
            Instant retryAt = Instant.now().plusSeconds(requeueDelaySeconds);
            runService.deferPending(run.runId, retryAt);
            queueService.markFailed(item.queueId, "Lock store unavailable, run deferred to " + retryAt);
            return WorkOutcome.REQUEUED;
        }

        LocalDate reservation = null;
        RunOutcome quotaOutcome = RunOutcome.RELEASED;
        try {
            if (!runService.markRunning(run.runId, executionId)) {
                queueService.markFailed(item.queueId, "Run " + run.runId + " left PENDING before it started");
                return WorkOutcome.SKIPPED;
            }
            reservation = usageQuotaService.recordRunStarted(run.tenantId);

            StepContext context = new StepContext(run.runId, run.tenantId, definition.configId,
                    definition.pipelineId, executionId, run.attemptCount + 1, tier, parameters(definition, item));
            long started = System.nanoTime();
            try {
                PipelineStepExecutor executor = executorRegistry.executorFor(definition.stepType);
                StepResult result = executor.execute(context);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                metrics.recordStepDuration(definition.stepType.name(), "completed", elapsed);

                runService.markCompleted(run.runId, elapsed);
                queueService.markCompleted(item.queueId);
                quotaOutcome = RunOutcome.SUCCEEDED;
                recordStatus(definition, "COMPLETED");
                LOG.infof("Run %s completed in %dms: %s", run.runId, elapsed.toMillis(), result.summary());
                return WorkOutcome.COMPLETED;
            } catch (ResourceExhaustedException e) {
                metrics.recordStepDuration(definition.stepType.name(), "requeued",
                        Duration.ofNanos(System.nanoTime() - started));
                return requeue(item, run, e);
            } catch (Exception e) {
                metrics.recordStepDuration(definition.stepType.name(), "failed",
                        Duration.ofNanos(System.nanoTime() - started));
                quotaOutcome = RunOutcome.FAILED;
                return fail(item, run, definition, e);
            }
        } finally {
            if (reservation != null) {
                usageQuotaService.recordRunFinished(run.tenantId, reservation, quotaOutcome);
            }
            lockManager.release(run.tenantId, definition.pipelineId, executionId);
        }
    }

    private WorkOutcome requeue(PipelineQueueItem item, PipelineRun run, ResourceExhaustedException e) {
        LOG.infof("Run %s denied admission, returning to queue in %ds: %s", run.runId, requeueDelaySeconds,
                e.getMessage());
        runService.markFailed(run.runId, e.getMessage(), ErrorClass.RESOURCE_EXHAUSTED, true, false);
        retryManager.scheduleRetry(run.runId, Instant.now().plusSeconds(requeueDelaySeconds));
        queueService.markFailed(item.queueId, e.getMessage());
        return WorkOutcome.REQUEUED;
    }

    private WorkOutcome fail(PipelineQueueItem item, PipelineRun run, PipelineDefinition definition, Exception e) {
        LOG.errorf(e, "Run %s failed on attempt %d", run.runId, run.attemptCount + 1);
        runService.markFailed(run.runId, e, true);
        queueService.markFailed(item.queueId, errorMessage(e));

        RetryPolicy policy = retryManager.defaultPolicy().withMaxRetries(definition.maxRetries);
        Optional<Instant> retryAt = retryManager.retryIfEligible(run.runId, policy);
        if (retryAt.isPresent()) {
            recordStatus(definition, "RETRY_SCHEDULED");
            return WorkOutcome.RETRY_SCHEDULED;
        }
        recordStatus(definition, "FAILED");
        return WorkOutcome.FAILED;
    }

    private WorkOutcome failBeforeStart(PipelineQueueItem item, PipelineRun run, PipelineConfigurationException e) {
        LOG.errorf("Run %s cannot start: %s", run.runId, e.getMessage());
        runService.markFailed(run.runId, e, false);
        queueService.markFailed(item.queueId, e.getMessage());
        return WorkOutcome.FAILED;
    }

    /**
     * Definition parameters overlaid with the queue item's config.
     */
    private static Map<String, Object> parameters(PipelineDefinition definition, PipelineQueueItem item) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (definition.parameters != null) {
            merged.putAll(definition.parameters);
        }
        if (item.config != null) {
            merged.putAll(item.config);
        }
        return merged;
    }

    private void recordStatus(PipelineDefinition definition, String status) {
        try {
            QuarkusTransaction.requiringNew()
                    .run(() -> PipelineDefinition.recordLastRunStatus(definition.configId, status, Instant.now()));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record last run status %s for definition %s", status, definition.configId);
        }
    }

    private void failItemQuietly(String queueId, String message) {
        try {
            queueService.markFailed(queueId, message);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to mark item %s FAILED, the recovery sweep will fail it", queueId);
        }
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
