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
 * Creates or resets every eligible tenant's quota row at the start of each UTC day.
 */
@ApplicationScoped
public class DailyQuotaResetScheduler {

    private static final Logger LOG = Logger.getLogger(DailyQuotaResetScheduler.class);

    @Inject
    QuotaResetService quotaResetService;

    @Scheduled(
            identity = "daily-quota-reset",
            cron = "{pipelinecontrol.schedule.daily-reset}",
            timeZone = "UTC")
    void resetDaily() {
        LoggingConfig.setJobOrigin("daily-quota-reset");
        try {
            ResetResult result = quotaResetService.resetDaily(LocalDate.now(ZoneOffset.UTC));
            LOG.debugf("Daily quota reset finished: %s", result);
        } catch (Exception e) {
            LOG.errorf(e, "Daily quota reset failed");
            // Next tick retries; the worker creates missing rows on demand meanwhile
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
