package villagecompute.pipelinecontrol.services;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.pipelinecontrol.TestFixtures;
import villagecompute.pipelinecontrol.data.models.AdmissionCounter;
import villagecompute.pipelinecontrol.data.models.PipelineExecutionLock;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem.QueueStatus;
import villagecompute.pipelinecontrol.data.models.PipelineRun;
import villagecompute.pipelinecontrol.data.models.PipelineRun.RunState;
import villagecompute.pipelinecontrol.data.models.UsageQuota;
import villagecompute.pipelinecontrol.services.StaleRunRecoveryService.RecoveryResult;
import villagecompute.pipelinecontrol.testing.H2TestResource;

/**
 * Tests for the stale run sweep (60 minute threshold, 3 reconcile days).
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class StaleRunRecoveryServiceTest {

    @Inject
    StaleRunRecoveryService recoveryService;

    @Inject
    PipelineRunService runService;

    private Instant now;

    private LocalDate today;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.deleteAll();
        now = Instant.now();
        today = LocalDate.ofInstant(now, ZoneOffset.UTC);
    }

    @Test
    void testRecover_StaleRunningRun_FailedWithTimeout() {
        Instant twoHoursAgo = now.minus(Duration.ofHours(2));
        QuarkusTransaction.requiringNew().run(() -> {
            PipelineRun stale = TestFixtures.createRun("run-stale", "tenant-1", "config-1", RunState.RUNNING);
            stale.startedAt = twoHoursAgo;
            TestFixtures.createRun("run-fresh", "tenant-1", "config-2", RunState.RUNNING);
        });

        RecoveryResult result = recoveryService.recover(now);

        assertEquals(1, result.runsFailed());
        PipelineRun stale = runService.requireRun("run-stale");
        assertEquals(RunState.FAILED, stale.state);
        assertEquals("Pipeline marked as FAILED due to timeout (>60 minutes)", stale.errorMessage);
        assertEquals(ErrorClass.TIMEOUT, stale.errorClass);
        assertFalse(stale.retryable);
        assertEquals(RunState.RUNNING, runService.requireRun("run-fresh").state);
    }

    @Test
    void testRecover_StalePendingRun_FailedUnlessRetryIsDue() {
        Instant twoHoursAgo = now.minus(Duration.ofHours(2));
        QuarkusTransaction.requiringNew().run(() -> {
            PipelineRun stuck = TestFixtures.createRun("run-stuck", "tenant-1", "config-1", RunState.PENDING);
            stuck.updatedAt = twoHoursAgo;
            PipelineRun waiting = TestFixtures.createRun("run-waiting", "tenant-1", "config-2", RunState.PENDING);
            waiting.updatedAt = twoHoursAgo;
            waiting.nextRetryTime = now.plus(Duration.ofMinutes(30));
        });

        recoveryService.recover(now);

        assertEquals(RunState.FAILED, runService.requireRun("run-stuck").state);
        assertEquals(RunState.PENDING, runService.requireRun("run-waiting").state);
    }

    @Test
    void testRecover_StuckQueueItem_Failed() {
        QuarkusTransaction.requiringNew().run(() -> {
            PipelineQueueItem item = new PipelineQueueItem();
            item.queueId = "item-1";
            item.tenantId = "tenant-1";
            item.config = Map.of();
            item.priority = 5;
            item.status = QueueStatus.PROCESSING;
            item.workerId = "worker-gone";
            item.createdAt = now.minus(Duration.ofHours(3));
            item.updatedAt = now.minus(Duration.ofHours(2));
            item.persist();
        });

        RecoveryResult result = recoveryService.recover(now);

        assertEquals(1, result.queueItemsFailed());
        PipelineQueueItem item = QuarkusTransaction.requiringNew()
                .call(() -> PipelineQueueItem.<PipelineQueueItem> findById("item-1"));
        assertEquals(QueueStatus.FAILED, item.status);
    }

    @Test
    void testRecover_ConcurrentCounters_ReconciledToLiveRuns() {
        QuarkusTransaction.requiringNew().run(() -> {
            TestFixtures.createQuota("tenant-1", today.minusDays(1), 3, 10);
            TestFixtures.createQuota("tenant-1", today, 4, 12);
            TestFixtures.createQuota("tenant-1", today.minusDays(5), 2, 5);
            TestFixtures.createRun("run-live", "tenant-1", "config-1", RunState.RUNNING);
        });

        RecoveryResult result = recoveryService.recover(now);

        assertEquals(2, result.quotaRowsCorrected());
        assertEquals(0, concurrentRunning("tenant-1", today.minusDays(1)), "Past days hold no live runs");
        assertEquals(1, concurrentRunning("tenant-1", today));
        assertEquals(2, concurrentRunning("tenant-1", today.minusDays(5)), "Outside the reconcile window");
    }

    @Test
    void testRecover_IdleTenantAdmissionCounter_Reset() {
        QuarkusTransaction.requiringNew().run(() -> {
            persistCounter("tenant-idle", 2);
            persistCounter("tenant-busy", 1);
            TestFixtures.createRun("run-live", "tenant-busy", "config-1", RunState.RUNNING);
        });

        RecoveryResult result = recoveryService.recover(now);

        assertEquals(1, result.admissionCountersReset());
        assertEquals(0, inFlight("tenant-idle"));
        assertEquals(1, inFlight("tenant-busy"));
    }

    @Test
    void testRecover_ExpiredLock_Purged() {
        QuarkusTransaction.requiringNew().run(() -> {
            PipelineExecutionLock lock = new PipelineExecutionLock();
            lock.lockKey = PipelineExecutionLock.lockKey("tenant-1", "pipeline-1");
            lock.tenantId = "tenant-1";
            lock.pipelineId = "pipeline-1";
            lock.pipelineLoggingId = "exec-1";
            lock.lockedBy = "worker-gone";
            lock.lockedAt = now.minus(Duration.ofHours(2));
            lock.expiresAt = now.minus(Duration.ofHours(1));
            lock.persist();
        });

        assertEquals(1L, recoveryService.recover(now).locksPurged());
    }

    @Test
    void testRecover_SecondSweep_ChangesNothing() {
        Instant twoHoursAgo = now.minus(Duration.ofHours(2));
        QuarkusTransaction.requiringNew().run(() -> {
            PipelineRun stale = TestFixtures.createRun("run-stale", "tenant-1", "config-1", RunState.RUNNING);
            stale.startedAt = twoHoursAgo;
            TestFixtures.createQuota("tenant-1", today, 2, 5);
            persistCounter("tenant-1", 2);
        });

        assertTrue(recoveryService.recover(now).changedAnything());
        RecoveryResult second = recoveryService.recover(now);

        assertFalse(second.changedAnything(), "Second sweep found: " + second);
        assertEquals(0, concurrentRunning("tenant-1", today));
    }

    private static void persistCounter(String tenantId, int inFlight) {
        AdmissionCounter counter = new AdmissionCounter();
        counter.tenantId = tenantId;
        counter.inFlight = inFlight;
        counter.updatedAt = Instant.now();
        counter.persist();
    }

    private static int inFlight(String tenantId) {
        return QuarkusTransaction.requiringNew()
                .call(() -> AdmissionCounter.<AdmissionCounter> findById(tenantId).inFlight);
    }

    private static int concurrentRunning(String tenantId, LocalDate date) {
        return QuarkusTransaction.requiringNew()
                .call(() -> UsageQuota.findFor(tenantId, date).orElseThrow().concurrentRunning);
    }
}
