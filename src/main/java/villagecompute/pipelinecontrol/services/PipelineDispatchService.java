package villagecompute.pipelinecontrol.services;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.PipelineDefinition;
import villagecompute.pipelinecontrol.data.models.PipelineRun;
import villagecompute.pipelinecontrol.data.models.PipelineRun.RunState;
import villagecompute.pipelinecontrol.exceptions.PipelineConfigurationException;
import villagecompute.pipelinecontrol.exceptions.ValidationException;

/**
 * Turns pipeline definitions and due runs into queue items.
 *
 * <p>
 * <b>Each dispatch tick:</b>
 * <ol>
 * <li>cron definitions whose latest fire time has passed, and that have no live run, get a SCHEDULED run for that
 * fire time</li>
 * <li>due SCHEDULED runs move to PENDING and are enqueued as {@code <run_id>-a<attempt>}</li>
 * <li>PENDING runs whose retry time has passed are enqueued as
 * {@code <run_id>-a<attempt>-<retry_epoch_seconds>}</li>
 * </ol>
 *
 * <p>
 * Run ids for cron fire times and all queue ids are deterministic, and both inserts ignore existing rows. Several
 * dispatchers ticking at once, or one tick repeated after a crash, enqueue each attempt once.
 */
@ApplicationScoped
public class PipelineDispatchService {

    private static final Logger LOG = Logger.getLogger(PipelineDispatchService.class);

    public static final String CONFIG_RUN_ID = "run_id";

    public static final String CONFIG_CONFIG_ID = "config_id";

    public static final String CONFIG_PIPELINE_ID = "pipeline_id";

    public static final String CONFIG_STEP_TYPE = "step_type";

    public static final String CONFIG_ATTEMPT = "attempt";

    @Inject
    PipelineRunService runService;

    @Inject
    PipelineQueueService queueService;

    @Inject
    PipelineScheduleCalculator scheduleCalculator;

    @ConfigProperty(
            name = "pipelinecontrol.dispatch.batch-size",
            defaultValue = "100")
    int batchSize;

    @ConfigProperty(
            name = "pipelinecontrol.queue.default-priority",
            defaultValue = "5")
    int defaultPriority;

    /**
     * What one tick did.
     */
    public record DispatchResult(int runsCreated, int runsEnqueued, int retriesEnqueued) {

        public int total() {
            return runsCreated + runsEnqueued + retriesEnqueued;
        }
    }

    /**
     * Creates a run for a definition now and enqueues it without waiting for the next tick.
     *
     * @return the run id
     * @throws PipelineConfigurationException
     *             if the definition does not exist or is disabled
     */
    public String submitRun(String configId) {
        PipelineDefinition definition = requireDefinition(configId);
        if (!definition.enabled) {
            throw new PipelineConfigurationException("Pipeline definition " + configId + " is disabled");
        }
        String runId = runService.create(definition.tenantId, configId, Instant.now());
        PipelineRun run = runService.requireRun(runId);
        promote(run, definition);
        return runId;
    }

    public DispatchResult dispatch() {
        return dispatch(Instant.now());
    }

    public DispatchResult dispatch(Instant now) {
        int created = createCronRuns(now);
        int enqueued = promoteDueRuns(now);
        int retries = enqueueDueRetries(now);
        DispatchResult result = new DispatchResult(created, enqueued, retries);
        if (result.total() > 0) {
            LOG.infof("Dispatch: %s", result);
        }
        return result;
    }

    int createCronRuns(Instant now) {
        List<PipelineDefinition> definitions = QuarkusTransaction.requiringNew()
                .call(PipelineDefinition::findScheduled);
        int created = 0;
        for (PipelineDefinition definition : definitions) {
            try {
                if (createCronRun(definition, now)) {
                    created++;
                }
            } catch (ValidationException e) {
                LOG.warnf("Skipping definition %s with unusable schedule: %s", definition.configId, e.getMessage());
            }
        }
        return created;
    }

    private boolean createCronRun(PipelineDefinition definition, Instant now) {
        Instant after = definition.lastRunTime != null ? definition.lastRunTime : definition.createdAt;
        Optional<Instant> due = scheduleCalculator.latestDueFireTime(definition.scheduleCron, definition.timezone,
                after, now);
        if (due.isEmpty()) {
            return false;
        }
        Instant fireTime = due.get();
        boolean live = QuarkusTransaction.requiringNew().call(() -> PipelineRun.countLive(definition.configId) > 0);
        if (live) {
            LOG.debugf("Definition %s still has a live run, fire time %s not scheduled", definition.configId,
                    fireTime);
            return false;
        }
        int advanced = QuarkusTransaction.requiringNew()
                .call(() -> PipelineDefinition.advanceSchedule(definition.configId, fireTime, Instant.now()));
        if (advanced == 0) {
            // Another dispatcher took this fire time
            return false;
        }
        String runId = definition.configId + "@" + fireTime.getEpochSecond();
        return runService.create(runId, definition.tenantId, definition.configId, fireTime);
    }

    int promoteDueRuns(Instant now) {
        List<PipelineRun> due = QuarkusTransaction.requiringNew()
                .call(() -> PipelineRun.findDueScheduled(now, batchSize));
        int enqueued = 0;
        for (PipelineRun run : due) {
            Optional<PipelineDefinition> definition = findDefinition(run.configId);
            if (definition.isEmpty()) {
                failUnconfigured(run);
                continue;
            }
            if (promote(run, definition.get())) {
                enqueued++;
            }
        }
        return enqueued;
    }

    private boolean promote(PipelineRun run, PipelineDefinition definition) {
        if (!runService.transition(run.runId, RunState.SCHEDULED, RunState.PENDING)) {
            return false;
        }
        int attempt = run.attemptCount + 1;
        queueService.enqueue(run.runId + "-a" + attempt, run.tenantId, run.runId,
                itemConfig(run, definition, attempt), priorityOf(definition));
        return true;
    }

    private void failUnconfigured(PipelineRun run) {
        LOG.errorf("Run %s references missing definition %s", run.runId, run.configId);
        if (runService.transition(run.runId, RunState.SCHEDULED, RunState.PENDING)) {
            runService.markFailed(run.runId, "Pipeline not configured: definition " + run.configId + " not found",
                    ErrorClass.CONFIGURATION, false, true);
        }
    }

    int enqueueDueRetries(Instant now) {
        List<PipelineRun> due = QuarkusTransaction.requiringNew()
                .call(() -> PipelineRun.findDueRetries(now, batchSize));
        int enqueued = 0;
        for (PipelineRun run : due) {
            Optional<PipelineDefinition> definition = findDefinition(run.configId);
            if (definition.isEmpty()) {
                LOG.errorf("Retry of run %s references missing definition %s", run.runId, run.configId);
                runService.markFailed(run.runId, "Pipeline not configured: definition " + run.configId + " not found",
                        ErrorClass.CONFIGURATION, false, false);
                continue;
            }
            int attempt = run.attemptCount + 1;
            String queueId = run.runId + "-a" + attempt + "-" + run.nextRetryTime.getEpochSecond();
            if (queueService.findItem(queueId).isPresent()) {
                // Enqueued on an earlier tick and not yet claimed
                continue;
            }
            queueService.enqueue(queueId, run.tenantId, run.runId, itemConfig(run, definition.get(), attempt),
                    priorityOf(definition.get()));
            enqueued++;
        }
        return enqueued;
    }

    private int priorityOf(PipelineDefinition definition) {
        if (definition.priority < PipelineQueueService.HIGHEST_PRIORITY
                || definition.priority > PipelineQueueService.LOWEST_PRIORITY) {
            return defaultPriority;
        }
        return definition.priority;
    }

    private static Map<String, Object> itemConfig(PipelineRun run, PipelineDefinition definition, int attempt) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put(CONFIG_RUN_ID, run.runId);
        config.put(CONFIG_CONFIG_ID, definition.configId);
        config.put(CONFIG_PIPELINE_ID, definition.pipelineId);
        config.put(CONFIG_STEP_TYPE, definition.stepType.name());
        config.put(CONFIG_ATTEMPT, attempt);
        return config;
    }

    private static Optional<PipelineDefinition> findDefinition(String configId) {
        return QuarkusTransaction.requiringNew().call(() -> PipelineDefinition.findByConfigId(configId));
    }

    private static PipelineDefinition requireDefinition(String configId) {
        return findDefinition(configId).orElseThrow(
                () -> new PipelineConfigurationException("Pipeline not configured: definition " + configId));
    }
}
