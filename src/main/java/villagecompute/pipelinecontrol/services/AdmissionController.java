/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.pipelinecontrol.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.Callable;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.UsageLedgerEntry;
import villagecompute.pipelinecontrol.exceptions.ResourceExhaustedException;
import villagecompute.pipelinecontrol.observability.ObservabilityMetrics;

/**
 * Per-tenant resource gate applied before resource-heavy operations.
 *
 * <p>
 * <b>Responsibilities:</b>
 * <ul>
 * <li>Concurrency: at most {@link TierLimits#maxConcurrentOperations()} operations in flight per tenant, counted by
 * the configured {@link AdmissionGate}</li>
 * <li>Timeouts: {@link #resolveTimeout} never returns more than the tier ceiling, whatever the caller asks for</li>
 * <li>Cost: per-operation cost cap check and the best-effort usage ledger</li>
 * </ul>
 *
 * <p>
 * A denied slot is contention, not failure. Callers that need the slot to proceed use {@link #runAdmitted}, which
 * raises {@link ResourceExhaustedException}; the worker answers that by returning the run to the queue rather than
 * waiting in-process.
 */
@ApplicationScoped
public class AdmissionController {

    private static final Logger LOG = Logger.getLogger(AdmissionController.class);

    /**
     * Warehouse on-demand price per TiB scanned.
     */
    static final BigDecimal USD_PER_TIB = new BigDecimal("5.00");

    static final long BYTES_PER_TIB = 1L << 40;

    @Inject
    AdmissionGate gate;

    @Inject
    ObservabilityMetrics metrics;

    /**
     * Takes a concurrency slot for the tenant.
     *
     * @return true if admitted; false means the tenant is at its tier ceiling
     */
    public boolean acquireSlot(String tenantId, SubscriptionTier tier) {
        Objects.requireNonNull(tenantId, "tenantId");
        SubscriptionTier effectiveTier = tier != null ? tier : SubscriptionTier.STARTER;
        int ceiling = effectiveTier.limits().maxConcurrentOperations();

        boolean granted = gate.tryAcquire(tenantId, ceiling);
        metrics.incrementAdmissionDecision(effectiveTier.name(), granted);
        if (granted) {
            LOG.debugf("Admitted operation for tenant %s (%d/%d in flight, tier %s)", tenantId,
                    gate.inFlight(tenantId), ceiling, effectiveTier);
        } else {
            LOG.warnf("Tenant %s at concurrency limit %d (tier %s), operation not admitted", tenantId, ceiling,
                    effectiveTier);
        }
        return granted;
    }

    /**
     * Returns a slot. Failures are logged; a leaked store-backed slot is reclaimed by the stale recovery sweep.
     */
    public void releaseSlot(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        try {
            gate.release(tenantId);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to release admission slot for tenant %s", tenantId);
        }
    }

    /**
     * Runs an operation while holding a slot, releasing it afterwards.
     *
     * @throws ResourceExhaustedException
     *             if the tenant is at its ceiling; the operation is not invoked
     */
    public <T> T runAdmitted(String tenantId, SubscriptionTier tier, Callable<T> operation) throws Exception {
        if (!acquireSlot(tenantId, tier)) {
            SubscriptionTier effectiveTier = tier != null ? tier : SubscriptionTier.STARTER;
            throw new ResourceExhaustedException(tenantId,
                    "Resource exhausted: tenant " + tenantId + " reached concurrency limit of "
                            + effectiveTier.limits().maxConcurrentOperations() + " (tier " + effectiveTier + ")");
        }
        try {
            return operation.call();
        } finally {
            releaseSlot(tenantId);
        }
    }

    public int inFlight(String tenantId) {
        return gate.inFlight(tenantId);
    }

    /**
     * Resolves the timeout for an operation.
     *
     * <p>
     * An explicit positive timeout is honored up to the tier ceiling. Otherwise the shape's default applies, also
     * capped by the tier ceiling; {@link OperationShape#UNKNOWN} gets the ceiling itself.
     *
     * @param shape
     *            operation shape, null treated as UNKNOWN
     * @param explicitTimeoutSeconds
     *            caller-requested timeout, null or non-positive when absent
     * @param tier
     *            tenant tier, null treated as STARTER
     * @return timeout in seconds, at least 1
     */
    public int resolveTimeout(OperationShape shape, Integer explicitTimeoutSeconds, SubscriptionTier tier) {
        int ceiling = (tier != null ? tier : SubscriptionTier.STARTER).limits().operationTimeoutSeconds();
        if (explicitTimeoutSeconds != null && explicitTimeoutSeconds > 0) {
            return Math.min(explicitTimeoutSeconds, ceiling);
        }
        OperationShape effectiveShape = shape != null ? shape : OperationShape.UNKNOWN;
        return Math.min(effectiveShape.defaultTimeoutSeconds(), ceiling);
    }

    public int resolveTimeout(String statement, Integer explicitTimeoutSeconds, SubscriptionTier tier) {
        return resolveTimeout(OperationShape.classify(statement), explicitTimeoutSeconds, tier);
    }

    /**
     * @param estimatedUnits
     *            billed units (GB) the operation is expected to process
     * @return true if the estimate is within the tier's per-operation cap
     */
    public boolean withinCostCeiling(SubscriptionTier tier, long estimatedUnits) {
        TierLimits limits = (tier != null ? tier : SubscriptionTier.STARTER).limits();
        return limits.isCostUnlimited() || estimatedUnits <= limits.maxCostUnits();
    }

    /**
     * Estimates on-demand cost for bytes scanned.
     */
    public BigDecimal estimateCost(long bytesProcessed) {
        if (bytesProcessed <= 0) {
            return BigDecimal.ZERO.setScale(6);
        }
        return USD_PER_TIB.multiply(BigDecimal.valueOf(bytesProcessed)).divide(BigDecimal.valueOf(BYTES_PER_TIB), 6,
                RoundingMode.HALF_UP);
    }

    public void recordUsage(String tenantId, long unitsProcessed, Duration duration, BigDecimal estimatedCost) {
        recordUsage(tenantId, null, "warehouse_query", unitsProcessed, duration, estimatedCost);
    }

    /**
     * Appends a usage record to the ledger. Never throws: a ledger failure is logged and the operation being measured
     * is unaffected.
     */
    public void recordUsage(String tenantId, String pipelineLoggingId, String resourceType, long unitsProcessed,
            Duration duration, BigDecimal estimatedCost) {
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                Instant now = Instant.now();
                UsageLedgerEntry entry = new UsageLedgerEntry();
                entry.tenantId = Objects.requireNonNull(tenantId, "tenantId");
                entry.usageDate = LocalDate.ofInstant(now, ZoneOffset.UTC);
                entry.pipelineLoggingId = pipelineLoggingId;
                entry.resourceType = resourceType != null ? resourceType : "unknown";
                entry.unitsProcessed = Math.max(0L, unitsProcessed);
                entry.durationMs = duration != null ? duration.toMillis() : 0L;
                entry.estimatedCostUsd = estimatedCost != null ? estimatedCost : BigDecimal.ZERO;
                entry.recordedAt = now;
                entry.persist();
            });
        } catch (Exception e) {
            LOG.warnf(e, "Failed to record usage for tenant %s (%d units), continuing", tenantId, unitsProcessed);
        }
    }
}
