/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.pipelinecontrol.services;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.TenantSubscription;
import villagecompute.pipelinecontrol.data.models.UsageQuota;

/**
 * Run counters on the tenant's daily {@link UsageQuota} row.
 *
 * <p>
 * Bookkeeping is best-effort: a failed counter update is logged and never fails the run. Counters left wrong by a
 * failure or a crash are corrected by the stale recovery sweep.
 *
 * <p>
 * {@link #recordRunStarted} returns the UTC date whose row was incremented. The caller passes that date back to
 * {@link #recordRunFinished}, so a run crossing midnight decrements the row it incremented.
 */
@ApplicationScoped
public class UsageQuotaService {

    private static final Logger LOG = Logger.getLogger(UsageQuotaService.class);

    /**
     * How a started run ended, for the daily counters.
     */
    public enum RunOutcome {
        SUCCEEDED, FAILED,

        /**
         * Gave its slot back without an outcome, e.g. returned to the queue.
         */
        RELEASED
    }

    public LocalDate recordRunStarted(String tenantId) {
        return recordRunStarted(tenantId, Instant.now());
    }

    /**
     * Increments today's run and concurrency counters, creating today's row if the daily reset has not yet run.
     *
     * @return the reservation date to pass to {@link #recordRunFinished}
     */
    public LocalDate recordRunStarted(String tenantId, Instant startedAt) {
        LocalDate reservationDate = LocalDate.ofInstant(startedAt, ZoneOffset.UTC);
        try {
            ensureRow(tenantId, reservationDate);
            QuarkusTransaction.requiringNew().run(() -> UsageQuota.update(
                    "runsToday = runsToday + 1, runsThisMonth = runsThisMonth + 1, "
                            + "concurrentRunning = concurrentRunning + 1, "
                            + "maxConcurrentReached = CASE WHEN concurrentRunning + 1 > maxConcurrentReached "
                            + "THEN concurrentRunning + 1 ELSE maxConcurrentReached END, lastUpdated = ?1 "
                            + "WHERE usageId = ?2",
                    Instant.now(), UsageQuota.usageId(tenantId, reservationDate)));
        } catch (Exception e) {
            LOG.warnf(e, "Failed to record run start for tenant %s on %s", tenantId, reservationDate);
        }
        return reservationDate;
    }

    /**
     * Decrements the concurrency counter on the reservation date's row (never below zero) and records the outcome.
     */
    public void recordRunFinished(String tenantId, LocalDate reservationDate, RunOutcome outcome) {
        String usageId = UsageQuota.usageId(tenantId, reservationDate);
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                Instant now = Instant.now();
                UsageQuota.update("concurrentRunning = concurrentRunning - 1, lastUpdated = ?1 "
                        + "WHERE usageId = ?2 AND concurrentRunning > 0", now, usageId);
                if (outcome == RunOutcome.SUCCEEDED) {
                    UsageQuota.update("runsSucceededToday = runsSucceededToday + 1 WHERE usageId = ?1", usageId);
                } else if (outcome == RunOutcome.FAILED) {
                    UsageQuota.update("runsFailedToday = runsFailedToday + 1 WHERE usageId = ?1", usageId);
                }
            });
        } catch (Exception e) {
            LOG.warnf(e, "Failed to record run finish (%s) for tenant %s on %s", outcome, tenantId, reservationDate);
        }
    }

    public Optional<UsageQuota> findQuota(String tenantId, LocalDate date) {
        return QuarkusTransaction.requiringNew().call(() -> UsageQuota.findFor(tenantId, date));
    }

    /**
     * Creates the tenant's row for {@code date} with zero counters, carrying the month count forward from the latest
     * earlier row of the same month. Existing rows are left alone.
     */
    void ensureRow(String tenantId, LocalDate date) {
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                if (UsageQuota.findFor(tenantId, date).isPresent()) {
                    return;
                }
                int carried = UsageQuota.findLatestBetween(tenantId, date.withDayOfMonth(1), date)
                        .map(row -> row.runsThisMonth).orElse(0);
                Optional<TenantSubscription> subscription = TenantSubscription.findCurrent(tenantId);
                UsageQuota row = newRow(tenantId, date, carried, subscription.orElse(null));
                row.persist();
                LOG.debugf("Created usage row %s (carried %d runs this month)", row.usageId, carried);
            });
        } catch (RuntimeException e) {
            if (!BackendFailures.isDuplicateKey(e)) {
                throw e;
            }
            // Created concurrently by another worker or the daily reset
        }
    }

    static UsageQuota newRow(String tenantId, LocalDate date, int runsThisMonth, TenantSubscription subscription) {
        Instant now = Instant.now();
        UsageQuota row = new UsageQuota();
        row.usageId = UsageQuota.usageId(tenantId, date);
        row.tenantId = tenantId;
        row.usageDate = date;
        row.runsThisMonth = runsThisMonth;
        applyLimits(row, subscription);
        row.createdAt = now;
        row.lastUpdated = now;
        return row;
    }

    static void applyLimits(UsageQuota row, TenantSubscription subscription) {
        row.dailyLimit = subscription != null ? subscription.dailyLimit : 0;
        row.monthlyLimit = subscription != null ? subscription.monthlyLimit : 0;
        row.concurrentLimit = subscription != null ? subscription.concurrentLimit : 0;
    }
}
