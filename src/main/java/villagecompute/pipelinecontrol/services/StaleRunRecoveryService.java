package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.AdmissionCounter;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem;
import villagecompute.pipelinecontrol.data.models.PipelineRun;
import villagecompute.pipelinecontrol.data.models.UsageQuota;
import villagecompute.pipelinecontrol.observability.ObservabilityMetrics;

/**
 * Repairs state left behind by crashed workers.
 *
 * <p>
 * <b>Sweep order:</b>
 * <ol>
 * <li>RUNNING runs started before the threshold, and PENDING runs idle since before it, are failed with a timeout
 * error</li>
 * <li>PROCESSING queue items claimed before the threshold are failed</li>
 * <li>{@code concurrent_running} on the last {@code reconcile-days} quota rows is corrected: days before today to
 * zero, today to the tenant's live RUNNING count</li>
 * <li>store-backed admission counters of tenants with no live RUNNING run are zeroed</li>
 * <li>expired execution locks are deleted</li>
 * </ol>
 *
 * <p>
 * Every step only writes rows that are wrong, so a second sweep right after the first changes nothing.
 */
@ApplicationScoped
public class StaleRunRecoveryService {

    private static final Logger LOG = Logger.getLogger(StaleRunRecoveryService.class);

    @Inject
    PipelineRunService runService;

    @Inject
    ExecutionLockManager lockManager;

    @Inject
    ObservabilityMetrics metrics;

    @ConfigProperty(
            name = "pipelinecontrol.recovery.stale-threshold-minutes",
            defaultValue = "60")
    long staleThresholdMinutes;

    @ConfigProperty(
            name = "pipelinecontrol.recovery.reconcile-days",
            defaultValue = "3")
    int reconcileDays;

    /**
     * Counts of what one sweep changed.
     */
    public record RecoveryResult(int runsFailed, int queueItemsFailed, int quotaRowsCorrected,
            int admissionCountersReset, long locksPurged) {

        public boolean changedAnything() {
            return runsFailed > 0 || queueItemsFailed > 0 || quotaRowsCorrected > 0 || admissionCountersReset > 0
                    || locksPurged > 0;
        }
    }

    public RecoveryResult recover() {
        return recover(Instant.now());
    }

    public RecoveryResult recover(Instant now) {
        Instant threshold = now.minus(Duration.ofMinutes(staleThresholdMinutes));
        String timeoutMessage = "Pipeline marked as FAILED due to timeout (>" + staleThresholdMinutes + " minutes)";

        int runsFailed = failStaleRuns(threshold, timeoutMessage);
        int queueItemsFailed = QuarkusTransaction.requiringNew()
                .call(() -> PipelineQueueItem.failStaleProcessing(threshold, timeoutMessage, Instant.now()));
        if (queueItemsFailed > 0) {
            LOG.warnf("Failed %d queue items stuck in PROCESSING since before %s", queueItemsFailed, threshold);
        }
        int quotaRowsCorrected = reconcileConcurrentCounters(LocalDate.ofInstant(now, ZoneOffset.UTC), threshold);
        int countersReset = resetIdleAdmissionCounters(threshold);
        long locksPurged = lockManager.purgeExpired();

        metrics.incrementRecoveryAction("runs_failed", runsFailed);
        metrics.incrementRecoveryAction("queue_items_failed", queueItemsFailed);
        metrics.incrementRecoveryAction("quota_rows_corrected", quotaRowsCorrected);
        metrics.incrementRecoveryAction("admission_counters_reset", countersReset);
        metrics.incrementRecoveryAction("locks_purged", locksPurged);

        RecoveryResult result = new RecoveryResult(runsFailed, queueItemsFailed, quotaRowsCorrected, countersReset,
                locksPurged);
        if (result.changedAnything()) {
            LOG.infof("Stale recovery: %s", result);
        } else {
            LOG.debug("Stale recovery found nothing to repair");
        }
        return result;
    }

    private int failStaleRuns(Instant threshold, String timeoutMessage) {
        List<PipelineRun> stale = QuarkusTransaction.requiringNew().call(() -> PipelineRun.findStale(threshold));
        int failed = 0;
        for (PipelineRun run : stale) {
            try {
                if (runService.markFailed(run.runId, timeoutMessage, ErrorClass.TIMEOUT, false, true)) {
                    LOG.warnf("Run %s (tenant %s) was %s since before %s, marked FAILED", run.runId, run.tenantId,
                            run.state, threshold);
                    failed++;
                }
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to mark stale run %s as FAILED", run.runId);
            }
        }
        return failed;
    }

    /**
     * Runs after the stale runs are failed, so the live count no longer includes them.
     */
    private int reconcileConcurrentCounters(LocalDate today, Instant threshold) {
        LocalDate from = today.minusDays(Math.max(1, reconcileDays) - 1L);
        return QuarkusTransaction.requiringNew().call(() -> {
            Map<String, Long> liveByTenant = new HashMap<>();
            int corrected = 0;
            for (UsageQuota row : UsageQuota.findSince(from)) {
                if (row.usageDate.isAfter(today)) {
                    continue;
                }
                long expected = row.usageDate.isBefore(today) ? 0L
                        : liveByTenant.computeIfAbsent(row.tenantId,
                                tenantId -> PipelineRun.countLiveRunning(tenantId, threshold));
                if (row.concurrentRunning != expected) {
                    LOG.infof("Correcting concurrent_running on %s from %d to %d", row.usageId, row.concurrentRunning,
                            expected);
                    row.concurrentRunning = (int) expected;
                    row.lastUpdated = Instant.now();
                    corrected++;
                }
            }
            return corrected;
        });
    }

    private int resetIdleAdmissionCounters(Instant threshold) {
        return QuarkusTransaction.requiringNew().call(() -> {
            int reset = 0;
            for (AdmissionCounter counter : AdmissionCounter.findBusy()) {
                if (PipelineRun.countLiveRunning(counter.tenantId, threshold) == 0
                        && AdmissionCounter.reset(counter.tenantId, Instant.now()) == 1) {
                    LOG.infof("Reset admission counter for idle tenant %s (was %d)", counter.tenantId,
                            counter.inFlight);
                    reset++;
                }
            }
            return reset;
        });
    }
}
