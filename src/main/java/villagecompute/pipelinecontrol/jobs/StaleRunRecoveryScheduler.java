package villagecompute.pipelinecontrol.jobs;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.observability.LoggingConfig;
import villagecompute.pipelinecontrol.services.StaleRunRecoveryService;

/**
 * Runs the stale recovery sweep, every 15 minutes by default.
 */
@ApplicationScoped
public class StaleRunRecoveryScheduler {

    private static final Logger LOG = Logger.getLogger(StaleRunRecoveryScheduler.class);

    @Inject
    StaleRunRecoveryService recoveryService;

    @Scheduled(
            identity = "stale-run-recovery",
            cron = "{pipelinecontrol.schedule.stale-recovery}",
            timeZone = "UTC",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void recover() {
        LoggingConfig.setJobOrigin("stale-run-recovery");
        try {
            recoveryService.recover();
        } catch (Exception e) {
            LOG.errorf(e, "Stale run recovery failed");
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
