package villagecompute.pipelinecontrol.services;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.Tenant;
import villagecompute.pipelinecontrol.data.models.TenantSubscription;
import villagecompute.pipelinecontrol.data.models.UsageQuota;
import villagecompute.pipelinecontrol.observability.ObservabilityMetrics;

/**
 * Daily and monthly resets of the per-tenant {@link UsageQuota} rows.
 *
 * <p>
 * <b>Daily:</b> every ACTIVE tenant with an ACTIVE or TRIAL subscription gets that day's row created or reset. The
 * day counters and the concurrency counters start at zero, the month count is carried forward from the tenant's latest
 * earlier row in the same month, and the subscription limits are snapshotted. Rows older than
 * {@code pipelinecontrol.quota.retention-days} are deleted.
 *
 * <p>
 * <b>Monthly:</b> zeroes the month count on that day's rows. Only runs on the first day of a month; any other day is
 * answered with {@link ResetResult.Status#SKIPPED}.
 */
@ApplicationScoped
public class QuotaResetService {

    private static final Logger LOG = Logger.getLogger(QuotaResetService.class);

    @Inject
    ObservabilityMetrics metrics;

    @ConfigProperty(
            name = "pipelinecontrol.quota.retention-days",
            defaultValue = "90")
    int retentionDays;

    /**
     * Outcome of a reset.
     *
     * @param status
     *            SUCCESS, or SKIPPED when the monthly guard rejected the day
     * @param date
     *            day the reset applied to
     * @param rowsReset
     *            rows created or zeroed
     * @param rowsDeleted
     *            rows removed by retention
     * @param message
     *            human-readable summary
     */
    public record ResetResult(Status status, LocalDate date, int rowsReset, long rowsDeleted, String message) {

        public enum Status {
            SUCCESS, SKIPPED
        }

        static ResetResult skipped(LocalDate date, String message) {
            return new ResetResult(Status.SKIPPED, date, 0, 0, message);
        }

        public boolean isSkipped() {
            return status == Status.SKIPPED;
        }
    }

    public ResetResult resetDaily(LocalDate date) {
        LOG.infof("Starting daily quota reset for %s", date);

        Map<String, TenantSubscription> eligible = QuarkusTransaction.requiringNew().call(() -> {
            Map<String, TenantSubscription> found = new HashMap<>();
            for (Tenant tenant : Tenant.findActive()) {
                Optional<TenantSubscription> subscription = TenantSubscription.findCurrent(tenant.tenantId);
                if (subscription.isPresent()) {
                    found.put(tenant.tenantId, subscription.get());
                } else {
                    LOG.debugf("Tenant %s has no current subscription, no quota row", tenant.tenantId);
                }
            }
            return found;
        });

        // One query for the whole month; the first row per tenant is its latest
        Map<String, Integer> carriedMonthCounts = QuarkusTransaction.requiringNew().call(() -> {
            Map<String, Integer> counts = new HashMap<>();
            List<UsageQuota> monthRows = UsageQuota.findBetween(date.withDayOfMonth(1), date);
            for (UsageQuota row : monthRows) {
                counts.putIfAbsent(row.tenantId, row.runsThisMonth);
            }
            return counts;
        });

        int rowsReset = 0;
        for (Map.Entry<String, TenantSubscription> entry : eligible.entrySet()) {
            String tenantId = entry.getKey();
            int carried = carriedMonthCounts.getOrDefault(tenantId, 0);
            try {
                QuarkusTransaction.requiringNew().run(() -> resetRow(tenantId, date, carried, entry.getValue()));
                rowsReset++;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Daily quota reset failed for tenant %s on %s", tenantId, date);
            }
        }

        LocalDate cutoff = date.minusDays(retentionDays);
        long rowsDeleted = QuarkusTransaction.requiringNew().call(() -> UsageQuota.deleteOlderThan(cutoff));

        metrics.incrementRecoveryAction("quota_rows_reset", rowsReset);
        metrics.incrementRecoveryAction("quota_rows_deleted", rowsDeleted);
        String message = String.format("Reset %d of %d tenant quota rows for %s, deleted %d rows before %s", rowsReset,
                eligible.size(), date, rowsDeleted, cutoff);
        LOG.info(message);
        return new ResetResult(ResetResult.Status.SUCCESS, date, rowsReset, rowsDeleted, message);
    }

    private static void resetRow(String tenantId, LocalDate date, int carried, TenantSubscription subscription) {
        Optional<UsageQuota> existing = UsageQuota.findFor(tenantId, date);
        if (existing.isEmpty()) {
            UsageQuotaService.newRow(tenantId, date, carried, subscription).persist();
            return;
        }
        UsageQuota row = existing.get();
        row.runsToday = 0;
        row.runsSucceededToday = 0;
        row.runsFailedToday = 0;
        row.runsThisMonth = carried;
        row.concurrentRunning = 0;
        row.maxConcurrentReached = 0;
        UsageQuotaService.applyLimits(row, subscription);
        row.lastUpdated = Instant.now();
    }

    public ResetResult resetMonthly(LocalDate date) {
        if (date.getDayOfMonth() != 1) {
            String message = "Monthly quota reset skipped: " + date + " is not the first day of the month";
            LOG.info(message);
            return ResetResult.skipped(date, message);
        }
        int rowsReset = QuarkusTransaction.requiringNew()
                .call(() -> UsageQuota.update("runsThisMonth = 0, lastUpdated = ?1 WHERE usageDate = ?2",
                        Instant.now(), date));
        metrics.incrementRecoveryAction("quota_month_reset", rowsReset);
        String message = String.format("Reset monthly run count on %d quota rows for %s", rowsReset, date);
        LOG.info(message);
        return new ResetResult(ResetResult.Status.SUCCESS, date, rowsReset, 0, message);
    }
}
