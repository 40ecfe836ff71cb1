package villagecompute.pipelinecontrol.services;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.pipelinecontrol.TestFixtures;
import villagecompute.pipelinecontrol.data.models.PipelineDefinition;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem.QueueStatus;
import villagecompute.pipelinecontrol.data.models.PipelineRun;
import villagecompute.pipelinecontrol.data.models.PipelineRun.RunState;
import villagecompute.pipelinecontrol.data.models.UsageLedgerEntry;
import villagecompute.pipelinecontrol.data.models.UsageQuota;
import villagecompute.pipelinecontrol.jobs.PipelineStepType;
import villagecompute.pipelinecontrol.jobs.ScriptedStepExecutor;
import villagecompute.pipelinecontrol.jobs.StepContext;
import villagecompute.pipelinecontrol.services.PipelineWorker.WorkOutcome;
import villagecompute.pipelinecontrol.testing.H2TestResource;

/**
 * End-to-end tests of the claim, lock, execute and record cycle.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class PipelineWorkerTest {

    private static final String WORKER = "worker-test";

    @Inject
    PipelineWorker worker;

    @Inject
    PipelineDispatchService dispatchService;

    @Inject
    PipelineRunService runService;

    @Inject
    PipelineQueueService queueService;

    @Inject
    ExecutionLockManager lockManager;

    @Inject
    UsageQuotaService usageQuotaService;

    @Inject
    SubscriptionService subscriptionService;

    @Inject
    ScriptedStepExecutor scriptedExecutor;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.deleteAll();
        TestFixtures.createTenant("tenant-1", "PROFESSIONAL");
        subscriptionService.invalidateAll();
        scriptedExecutor.reset();
    }

    @Test
    void testProcessNext_EmptyQueue_ReturnsEmpty() {
        assertEquals(WorkOutcome.EMPTY, worker.processNext(WORKER));
    }

    @Test
    void testProcessNext_Success_CompletesRunAndItem() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "success", "region", "eu"));
        String runId = dispatchService.submitRun("cfg-1");

        WorkOutcome outcome = worker.processNext(WORKER);

        assertEquals(WorkOutcome.COMPLETED, outcome);
        PipelineRun run = runService.requireRun(runId);
        assertEquals(RunState.COMPLETED, run.state);
        assertNotNull(run.pipelineLoggingId);
        assertEquals(QueueStatus.COMPLETED, item(runId + "-a1").status);
        assertEquals("COMPLETED", definitionStatus("cfg-1"));
        assertTrue(lockManager.status("tenant-1", "pipeline-cfg-1").isEmpty(), "Lock released after the run");

        List<StepContext> received = scriptedExecutor.received();
        assertEquals(1, received.size());
        StepContext context = received.get(0);
        assertEquals(1, context.attempt());
        assertEquals(SubscriptionTier.PROFESSIONAL, context.tier());
        assertEquals("eu", context.stringParameter("region"));
        assertEquals(runId, context.stringParameter(PipelineDispatchService.CONFIG_RUN_ID));
        assertEquals(run.pipelineLoggingId, context.pipelineLoggingId());

        UsageQuota quota = todaysQuota();
        assertEquals(1, quota.runsToday);
        assertEquals(1, quota.runsSucceededToday);
        assertEquals(0, quota.concurrentRunning);
    }

    @Test
    void testProcessNext_TransientFailure_RetryScheduled() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "transient"));
        String runId = dispatchService.submitRun("cfg-1");
        Instant before = Instant.now();

        assertEquals(WorkOutcome.RETRY_SCHEDULED, worker.processNext(WORKER));

        PipelineRun run = runService.requireRun(runId);
        assertEquals(RunState.PENDING, run.state);
        assertEquals(1, run.attemptCount);
        assertEquals(ErrorClass.TRANSIENT, run.errorClass);
        assertFalse(run.nextRetryTime.isBefore(before.plusSeconds(60)), "First retry waits the base delay");
        assertEquals(QueueStatus.FAILED, item(runId + "-a1").status);
        assertEquals("RETRY_SCHEDULED", definitionStatus("cfg-1"));
        assertEquals(1, todaysQuota().runsFailedToday);
    }

    @Test
    void testProcessNext_RetryDispatched_SecondAttemptSeesAttemptTwo() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "transient"));
        String runId = dispatchService.submitRun("cfg-1");
        worker.processNext(WORKER);
        PipelineRun failedOnce = runService.requireRun(runId);

        dispatchService.dispatch(failedOnce.nextRetryTime.plusSeconds(1));
        worker.processNext(WORKER);

        assertEquals(2, scriptedExecutor.received().get(1).attempt());
        assertEquals(2, runService.requireRun(runId).attemptCount);
    }

    @Test
    void testProcessNext_RetriesExhausted_TerminallyFailed() {
        PipelineDefinition definition = definition("cfg-1", PipelineStepType.COST_CALCULATION,
                Map.of("outcome", "transient"));
        QuarkusTransaction.requiringNew()
                .run(() -> PipelineDefinition.update("maxRetries = 1 WHERE configId = ?1", definition.configId));
        String runId = dispatchService.submitRun("cfg-1");

        assertEquals(WorkOutcome.FAILED, worker.processNext(WORKER));

        assertEquals(RunState.FAILED, runService.requireRun(runId).state);
        assertEquals("FAILED", definitionStatus("cfg-1"));
    }

    @Test
    void testProcessNext_ValidationFailure_NotRetried() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "validation"));
        String runId = dispatchService.submitRun("cfg-1");

        assertEquals(WorkOutcome.FAILED, worker.processNext(WORKER));

        PipelineRun run = runService.requireRun(runId);
        assertEquals(RunState.FAILED, run.state);
        assertEquals(ErrorClass.VALIDATION, run.errorClass);
        assertFalse(run.retryable);
        assertNull(run.nextRetryTime);
    }

    @Test
    void testProcessNext_AdmissionDenied_RequeuedWithoutUsingAttempt() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "exhausted"));
        String runId = dispatchService.submitRun("cfg-1");
        Instant before = Instant.now();

        assertEquals(WorkOutcome.REQUEUED, worker.processNext(WORKER));

        PipelineRun run = runService.requireRun(runId);
        assertEquals(RunState.PENDING, run.state);
        assertEquals(0, run.attemptCount);
        Duration delay = Duration.between(before, run.nextRetryTime);
        assertTrue(delay.compareTo(Duration.ofSeconds(25)) >= 0 && delay.compareTo(Duration.ofSeconds(60)) < 0,
                "Requeue delay is short, was " + delay);
        assertEquals(0, todaysQuota().concurrentRunning);
    }

    @Test
    void testProcessNext_LockHeldElsewhere_DeferredWithoutFailing() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "success"));
        lockManager.acquire("tenant-1", "pipeline-cfg-1", "exec-other", "worker-other");
        String runId = dispatchService.submitRun("cfg-1");
        Instant before = Instant.now();

        assertEquals(WorkOutcome.DUPLICATE, worker.processNext(WORKER));

        PipelineRun run = runService.requireRun(runId);
        assertEquals(RunState.PENDING, run.state, "Contention must not fail the run");
        assertEquals(0, run.attemptCount);
        assertNull(run.errorClass);
        assertNotNull(run.nextRetryTime);
        assertTrue(run.nextRetryTime.isAfter(before));
        assertTrue(item(runId + "-a1").errorMessage.contains("already running (execution exec-other)"));
        assertTrue(scriptedExecutor.received().isEmpty());
        assertEquals("exec-other",
                lockManager.status("tenant-1", "pipeline-cfg-1").orElseThrow().pipelineLoggingId(),
                "The holder's lock is untouched");
        assertEquals("DUPLICATE", definitionStatus("cfg-1"));
    }

    @Test
    void testProcessNext_RunNotPending_Skipped() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "success"));
        QuarkusTransaction.requiringNew()
                .run(() -> TestFixtures.createRun("run-done", "tenant-1", "cfg-1", RunState.COMPLETED));
        queueService.enqueue("run-done-a1", "tenant-1", "run-done", Map.of(), 5);

        assertEquals(WorkOutcome.SKIPPED, worker.processNext(WORKER));

        assertEquals(QueueStatus.FAILED, item("run-done-a1").status);
        assertTrue(scriptedExecutor.received().isEmpty());
    }

    @Test
    void testProcessNext_TenantWithoutSubscription_FailedAsConfiguration() {
        QuarkusTransaction.requiringNew().run(() -> TestFixtures.createDefinition("cfg-orphan", "tenant-unknown",
                PipelineStepType.COST_CALCULATION, Map.of("outcome", "success")));
        String runId = dispatchService.submitRun("cfg-orphan");

        assertEquals(WorkOutcome.FAILED, worker.processNext(WORKER));

        PipelineRun run = runService.requireRun(runId);
        assertEquals(RunState.FAILED, run.state);
        assertEquals(ErrorClass.CONFIGURATION, run.errorClass);
        assertFalse(run.retryable);
    }

    @Test
    void testProcessNext_NoExecutorForStepType_FailedAsConfiguration() {
        definition("cfg-1", PipelineStepType.NOTIFICATION, Map.of());
        String runId = dispatchService.submitRun("cfg-1");

        assertEquals(WorkOutcome.FAILED, worker.processNext(WORKER));

        PipelineRun run = runService.requireRun(runId);
        assertEquals(ErrorClass.CONFIGURATION, run.errorClass);
        assertFalse(run.retryable);
    }

    @Test
    void testProcessNext_WarehouseSql_RunsStatementAndRecordsUsage() {
        definition("cfg-sql", PipelineStepType.WAREHOUSE_SQL,
                Map.of("statement", "SELECT tenant_id FROM tenants", "estimated_bytes", 1L << 30));
        String runId = dispatchService.submitRun("cfg-sql");

        assertEquals(WorkOutcome.COMPLETED, worker.processNext(WORKER));

        assertEquals(RunState.COMPLETED, runService.requireRun(runId).state);
        List<UsageLedgerEntry> usage = QuarkusTransaction.requiringNew()
                .call(() -> UsageLedgerEntry.findByTenant("tenant-1"));
        assertEquals(1, usage.size());
        assertEquals(1, usage.get(0).unitsProcessed, "One tenant row");
        assertEquals("warehouse_sql", usage.get(0).resourceType);
    }

    @Test
    void testProcessNext_WarehouseSqlWithoutStatement_FailedAsValidation() {
        definition("cfg-sql", PipelineStepType.WAREHOUSE_SQL, Map.of());
        String runId = dispatchService.submitRun("cfg-sql");

        assertEquals(WorkOutcome.FAILED, worker.processNext(WORKER));

        assertEquals(ErrorClass.VALIDATION, runService.requireRun(runId).errorClass);
    }

    @Test
    void testPoll_StopsWhenQueueEmpty() {
        definition("cfg-1", PipelineStepType.COST_CALCULATION, Map.of("outcome", "success"));
        definition("cfg-2", PipelineStepType.COST_CALCULATION, Map.of("outcome", "success"));
        dispatchService.submitRun("cfg-1");
        dispatchService.submitRun("cfg-2");

        assertEquals(2, worker.poll(WORKER, 5));
        assertEquals(0L, queueService.queueLength());
    }

    private static PipelineDefinition definition(String configId, PipelineStepType stepType,
            Map<String, Object> parameters) {
        return QuarkusTransaction.requiringNew()
                .call(() -> TestFixtures.createDefinition(configId, "tenant-1", stepType, parameters));
    }

    private static PipelineQueueItem item(String queueId) {
        return QuarkusTransaction.requiringNew().call(() -> PipelineQueueItem.<PipelineQueueItem> findById(queueId));
    }

    private static String definitionStatus(String configId) {
        return QuarkusTransaction.requiringNew()
                .call(() -> PipelineDefinition.findByConfigId(configId).orElseThrow().lastRunStatus);
    }

    private UsageQuota todaysQuota() {
        return usageQuotaService.findQuota("tenant-1", LocalDate.now(ZoneOffset.UTC)).orElseThrow();
    }
}
