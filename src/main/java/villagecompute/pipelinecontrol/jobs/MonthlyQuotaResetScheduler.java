/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.pipelinecontrol.jobs;

import java.time.LocalDate;
import java.time.ZoneOffset;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.observability.LoggingConfig;
import villagecompute.pipelinecontrol.services.QuotaResetService;
import villagecompute.pipelinecontrol.services.QuotaResetService.ResetResult;

/**
 * Zeroes the month counters on the first of each month, after the daily reset has created that day's rows.
 */
@ApplicationScoped
public class MonthlyQuotaResetScheduler {

    private static final Logger LOG = Logger.getLogger(MonthlyQuotaResetScheduler.class);

    @Inject
    QuotaResetService quotaResetService;

    @Scheduled(
            identity = "monthly-quota-reset",
            cron = "{pipelinecontrol.schedule.monthly-reset}",
            timeZone = "UTC")
    void resetMonthly() {
        LoggingConfig.setJobOrigin("monthly-quota-reset");
        try {
            ResetResult result = quotaResetService.resetMonthly(LocalDate.now(ZoneOffset.UTC));
            if (result.isSkipped()) {
                LOG.warnf("Monthly quota reset fired outside the first of the month: %s", result.message());
            }
        } catch (Exception e) {
            LOG.errorf(e, "Monthly quota reset failed");
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
