/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Per-tenant, per-UTC-day usage counters.
 *
 * <p>
 * Rows are created by the daily reset and mutated by run bookkeeping and the stale recovery sweep. Limits are a
 * snapshot of the tenant's subscription at reset time.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code usage_id} (TEXT, PK) - {@code <tenant_id>_<yyyyMMdd>}</li>
 * <li>{@code usage_date} (DATE) - UTC calendar day</li>
 * <li>{@code runs_today}, {@code runs_succeeded_today}, {@code runs_failed_today} (INT)</li>
 * <li>{@code runs_this_month} (INT) - Cumulative month count, carried forward by the daily reset</li>
 * <li>{@code concurrent_running}, {@code max_concurrent_reached} (INT)</li>
 * <li>{@code daily_limit}, {@code monthly_limit}, {@code concurrent_limit} (INT) - Snapshotted limits</li>
 * </ul>
 */
@Entity
@Table(
        name = "usage_quotas",
        indexes = @Index(
                name = "idx_usage_quotas_tenant_date",
                columnList = "tenant_id, usage_date"))
public class UsageQuota extends PanacheEntityBase {

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    @Id
    @Column(
            name = "usage_id",
            nullable = false,
            length = 160)
    public String usageId;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "usage_date",
            nullable = false)
    public LocalDate usageDate;

    @Column(
            name = "runs_today",
            nullable = false)
    public int runsToday;

    @Column(
            name = "runs_succeeded_today",
            nullable = false)
    public int runsSucceededToday;

    @Column(
            name = "runs_failed_today",
            nullable = false)
    public int runsFailedToday;

    @Column(
            name = "runs_this_month",
            nullable = false)
    public int runsThisMonth;

    @Column(
            name = "concurrent_running",
            nullable = false)
    public int concurrentRunning;

    @Column(
            name = "max_concurrent_reached",
            nullable = false)
    public int maxConcurrentReached;

    @Column(
            name = "daily_limit",
            nullable = false)
    public int dailyLimit;

    @Column(
            name = "monthly_limit",
            nullable = false)
    public int monthlyLimit;

    @Column(
            name = "concurrent_limit",
            nullable = false)
    public int concurrentLimit;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "last_updated",
            nullable = false)
    public Instant lastUpdated;

    public static String usageId(String tenantId, LocalDate date) {
        return tenantId + "_" + ID_DATE.format(date);
    }

    public static Optional<UsageQuota> findFor(String tenantId, LocalDate date) {
        return findByIdOptional(usageId(tenantId, date));
    }

    /**
     * Finds the latest row for a tenant dated between {@code from} (inclusive) and {@code before} (exclusive).
     */
    public static Optional<UsageQuota> findLatestBetween(String tenantId, LocalDate from, LocalDate before) {
        return find("tenantId = ?1 AND usageDate >= ?2 AND usageDate < ?3 ORDER BY usageDate DESC", tenantId, from,
                before).firstResultOptional();
    }

    /**
     * Rows of every tenant dated between {@code from} (inclusive) and {@code before} (exclusive), newest first within
     * each tenant.
     */
    public static List<UsageQuota> findBetween(LocalDate from, LocalDate before) {
        return find("usageDate >= ?1 AND usageDate < ?2 ORDER BY tenantId, usageDate DESC", from, before).list();
    }

    public static List<UsageQuota> findByDate(LocalDate date) {
        return find("usageDate", date).list();
    }

    public static List<UsageQuota> findSince(LocalDate from) {
        return find("usageDate >= ?1 ORDER BY usageDate ASC", from).list();
    }

    public static long deleteOlderThan(LocalDate cutoff) {
        return delete("usageDate < ?1", cutoff);
    }
}
