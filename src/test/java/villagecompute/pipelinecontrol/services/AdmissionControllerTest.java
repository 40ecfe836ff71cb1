/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.pipelinecontrol.services;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.pipelinecontrol.TestFixtures;
import villagecompute.pipelinecontrol.data.models.UsageLedgerEntry;
import villagecompute.pipelinecontrol.exceptions.ResourceExhaustedException;
import villagecompute.pipelinecontrol.testing.H2TestResource;

/**
 * Tier ceilings, timeout resolution and usage recording of the admission controller.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class AdmissionControllerTest {

    @Inject
    AdmissionController admission;

    private String tenantId;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.deleteAll();
        // The in-process gate lives as long as the application; a fresh tenant per test isolates counts
        tenantId = "tenant-" + UUID.randomUUID();
    }

    @Test
    void testAcquireSlot_StarterCeilingOfTwo_ThirdDenied() {
        List<Boolean> decisions = List.of(admission.acquireSlot(tenantId, SubscriptionTier.STARTER),
                admission.acquireSlot(tenantId, SubscriptionTier.STARTER),
                admission.acquireSlot(tenantId, SubscriptionTier.STARTER));

        assertEquals(List.of(true, true, false), decisions);
        assertEquals(2, admission.inFlight(tenantId));
    }

    @Test
    void testReleaseSlot_FreesCapacity_NeverNegative() {
        admission.acquireSlot(tenantId, SubscriptionTier.STARTER);
        admission.acquireSlot(tenantId, SubscriptionTier.STARTER);

        admission.releaseSlot(tenantId);
        assertTrue(admission.acquireSlot(tenantId, SubscriptionTier.STARTER));

        admission.releaseSlot(tenantId);
        admission.releaseSlot(tenantId);
        admission.releaseSlot(tenantId);
        assertEquals(0, admission.inFlight(tenantId));
    }

    @Test
    void testAcquireSlot_NullTier_TreatedAsStarter() {
        assertTrue(admission.acquireSlot(tenantId, null));
        assertTrue(admission.acquireSlot(tenantId, null));
        assertFalse(admission.acquireSlot(tenantId, null));
    }

    @Test
    void testRunAdmitted_AtCeiling_ThrowsWithoutInvoking() {
        admission.acquireSlot(tenantId, SubscriptionTier.STARTER);
        admission.acquireSlot(tenantId, SubscriptionTier.STARTER);
        AtomicBoolean invoked = new AtomicBoolean();

        ResourceExhaustedException e = assertThrows(ResourceExhaustedException.class,
                () -> admission.runAdmitted(tenantId, SubscriptionTier.STARTER, () -> invoked.getAndSet(true)));

        assertFalse(invoked.get());
        assertEquals(tenantId, e.getTenantId());
        assertTrue(e.getMessage().contains("concurrency limit of 2"));
    }

    @Test
    void testRunAdmitted_OperationFails_SlotReleased() {
        assertThrows(IllegalStateException.class, () -> admission.runAdmitted(tenantId, SubscriptionTier.STARTER,
                () -> {
                    throw new IllegalStateException("boom");
                }));

        assertEquals(0, admission.inFlight(tenantId));
    }

    @Test
    void testResolveTimeout_ExplicitValue_CappedAtTier() {
        assertEquals(60, admission.resolveTimeout(OperationShape.SIMPLE_READ, 500, SubscriptionTier.STARTER));
        assertEquals(20, admission.resolveTimeout(OperationShape.HEAVY, 20, SubscriptionTier.STARTER));
    }

    @Test
    void testResolveTimeout_ShapeDefaults_CappedAtTier() {
        assertEquals(30, admission.resolveTimeout(OperationShape.SIMPLE_READ, null, SubscriptionTier.PROFESSIONAL));
        assertEquals(60, admission.resolveTimeout(OperationShape.WRITE, null, SubscriptionTier.PROFESSIONAL));
        assertEquals(120, admission.resolveTimeout(OperationShape.HEAVY, 0, SubscriptionTier.PROFESSIONAL));
        assertEquals(60, admission.resolveTimeout(OperationShape.HEAVY, null, SubscriptionTier.STARTER));
        assertEquals(300, admission.resolveTimeout(OperationShape.UNKNOWN, null, SubscriptionTier.SCALE));
        assertEquals(600, admission.resolveTimeout((OperationShape) null, null, SubscriptionTier.ENTERPRISE));
        assertEquals(30, admission.resolveTimeout("SELECT 1", null, null));
    }

    @Test
    void testWithinCostCeiling_TierCaps() {
        assertTrue(admission.withinCostCeiling(SubscriptionTier.STARTER, 10));
        assertFalse(admission.withinCostCeiling(SubscriptionTier.STARTER, 11));
        assertFalse(admission.withinCostCeiling(SubscriptionTier.PROFESSIONAL, 101));
        assertTrue(admission.withinCostCeiling(SubscriptionTier.SCALE, 1_000_000));
    }

    @Test
    void testEstimateCost_FivePerTib() {
        assertEquals(new BigDecimal("5.000000"), admission.estimateCost(1L << 40));
        assertEquals(new BigDecimal("2.500000"), admission.estimateCost(1L << 39));
        assertEquals(0, admission.estimateCost(0).signum());
    }

    @Test
    void testRecordUsage_PersistsLedgerEntry() {
        admission.recordUsage(tenantId, "exec-1", "warehouse_sql", 42, Duration.ofMillis(1500),
                new BigDecimal("0.125000"));

        List<UsageLedgerEntry> entries = QuarkusTransaction.requiringNew()
                .call(() -> UsageLedgerEntry.findByTenant(tenantId));
        assertEquals(1, entries.size());
        assertEquals(42, entries.get(0).unitsProcessed);
        assertEquals(1500, entries.get(0).durationMs);
        assertEquals("exec-1", entries.get(0).pipelineLoggingId);
    }

    @Test
    void testRecordUsage_StoreRejectsEntry_Swallowed() {
        assertDoesNotThrow(() -> admission.recordUsage(null, 1, Duration.ZERO, BigDecimal.ONE));
    }
}
