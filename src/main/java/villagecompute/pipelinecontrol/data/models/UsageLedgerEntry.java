/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.pipelinecontrol.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Append-only cost tracking record for one resource-heavy operation. Writes are best-effort.
 */
@Entity
@Table(
        name = "usage_ledger",
        indexes = @Index(
                name = "idx_usage_ledger_tenant_date",
                columnList = "tenant_id, usage_date"))
public class UsageLedgerEntry extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.UUID)
    @Column(
            name = "id",
            nullable = false)
    public UUID id;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "usage_date",
            nullable = false)
    public LocalDate usageDate;

    @Column(
            name = "pipeline_logging_id")
    public String pipelineLoggingId;

    @Column(
            name = "resource_type",
            nullable = false)
    public String resourceType;

    @Column(
            name = "units_processed",
            nullable = false)
    public long unitsProcessed;

    @Column(
            name = "duration_ms",
            nullable = false)
    public long durationMs;

    @Column(
            name = "estimated_cost_usd",
            nullable = false,
            precision = 14,
            scale = 6)
    public BigDecimal estimatedCostUsd;

    @Column(
            name = "recorded_at",
            nullable = false)
    public Instant recordedAt;

    public static List<UsageLedgerEntry> findByTenant(String tenantId) {
        return find("tenantId = ?1 ORDER BY recordedAt DESC", tenantId).list();
    }
}
