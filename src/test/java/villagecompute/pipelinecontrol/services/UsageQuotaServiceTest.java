/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.pipelinecontrol.services;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.LocalDate;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.pipelinecontrol.TestFixtures;
import villagecompute.pipelinecontrol.data.models.UsageQuota;
import villagecompute.pipelinecontrol.services.UsageQuotaService.RunOutcome;
import villagecompute.pipelinecontrol.testing.H2TestResource;

/**
 * Tests for the daily run counters kept by the worker.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class UsageQuotaServiceTest {

    private static final Instant MARCH_10_NOON = Instant.parse("2025-03-10T12:00:00Z");

    private static final LocalDate MARCH_10 = LocalDate.of(2025, 3, 10);

    @Inject
    UsageQuotaService usageQuotaService;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.deleteAll();
        TestFixtures.createTenant("tenant-1", "PROFESSIONAL");
    }

    @Test
    void testRecordRunStarted_NoRowYet_CreatesRowWithLimits() {
        LocalDate reservation = usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);

        assertEquals(MARCH_10, reservation);
        UsageQuota row = usageQuotaService.findQuota("tenant-1", MARCH_10).orElseThrow();
        assertEquals(1, row.runsToday);
        assertEquals(1, row.runsThisMonth);
        assertEquals(1, row.concurrentRunning);
        assertEquals(1, row.maxConcurrentReached);
        assertEquals(100, row.dailyLimit);
        assertEquals(5, row.concurrentLimit);
    }

    @Test
    void testRecordRunStarted_CarriesMonthCountFromEarlierDay() {
        QuarkusTransaction.requiringNew()
                .run(() -> TestFixtures.createQuota("tenant-1", LocalDate.of(2025, 3, 7), 0, 12));
        QuarkusTransaction.requiringNew()
                .run(() -> TestFixtures.createQuota("tenant-1", LocalDate.of(2025, 2, 28), 0, 90));

        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);

        assertEquals(13, usageQuotaService.findQuota("tenant-1", MARCH_10).orElseThrow().runsThisMonth,
                "February rows do not count toward March");
    }

    @Test
    void testRecordRunStarted_TracksPeakConcurrency() {
        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);
        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);
        usageQuotaService.recordRunFinished("tenant-1", MARCH_10, RunOutcome.SUCCEEDED);
        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);

        UsageQuota row = usageQuotaService.findQuota("tenant-1", MARCH_10).orElseThrow();
        assertEquals(2, row.concurrentRunning);
        assertEquals(2, row.maxConcurrentReached);
        assertEquals(3, row.runsToday);
    }

    @Test
    void testRecordRunFinished_CountsOutcomes() {
        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);
        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);
        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);

        usageQuotaService.recordRunFinished("tenant-1", MARCH_10, RunOutcome.SUCCEEDED);
        usageQuotaService.recordRunFinished("tenant-1", MARCH_10, RunOutcome.FAILED);
        usageQuotaService.recordRunFinished("tenant-1", MARCH_10, RunOutcome.RELEASED);

        UsageQuota row = usageQuotaService.findQuota("tenant-1", MARCH_10).orElseThrow();
        assertEquals(0, row.concurrentRunning);
        assertEquals(1, row.runsSucceededToday);
        assertEquals(1, row.runsFailedToday);
    }

    @Test
    void testRecordRunFinished_NeverBelowZero() {
        usageQuotaService.recordRunStarted("tenant-1", MARCH_10_NOON);

        usageQuotaService.recordRunFinished("tenant-1", MARCH_10, RunOutcome.RELEASED);
        usageQuotaService.recordRunFinished("tenant-1", MARCH_10, RunOutcome.RELEASED);

        assertEquals(0, usageQuotaService.findQuota("tenant-1", MARCH_10).orElseThrow().concurrentRunning);
    }

    @Test
    void testRecordRunFinished_AcrossMidnight_DecrementsReservationDay() {
        LocalDate reservation = usageQuotaService.recordRunStarted("tenant-1", Instant.parse("2025-03-10T23:59:30Z"));
        usageQuotaService.recordRunStarted("tenant-1", Instant.parse("2025-03-11T00:00:30Z"));

        usageQuotaService.recordRunFinished("tenant-1", reservation, RunOutcome.SUCCEEDED);

        assertEquals(0, usageQuotaService.findQuota("tenant-1", MARCH_10).orElseThrow().concurrentRunning);
        assertEquals(1,
                usageQuotaService.findQuota("tenant-1", LocalDate.of(2025, 3, 11)).orElseThrow().concurrentRunning);
    }

    @Test
    void testRecordRunFinished_MissingRow_DoesNotThrow() {
        assertDoesNotThrow(() -> usageQuotaService.recordRunFinished("tenant-1", MARCH_10, RunOutcome.FAILED));
        assertTrue(usageQuotaService.findQuota("tenant-1", MARCH_10).isEmpty());
    }
}
