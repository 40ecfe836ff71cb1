package villagecompute.pipelinecontrol.jobs;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.observability.LoggingConfig;
import villagecompute.pipelinecontrol.services.PipelineDispatchService;

/**
 * Creates cron runs and enqueues due runs and retries, every minute by default.
 */
@ApplicationScoped
public class PipelineDispatchScheduler {

    private static final Logger LOG = Logger.getLogger(PipelineDispatchScheduler.class);

    @Inject
    PipelineDispatchService dispatchService;

    @Scheduled(
            identity = "pipeline-dispatch",
            cron = "{pipelinecontrol.schedule.dispatch}",
            timeZone = "UTC",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void dispatch() {
        LoggingConfig.setJobOrigin("pipeline-dispatch");
        try {
            dispatchService.dispatch();
        } catch (Exception e) {
            LOG.errorf(e, "Pipeline dispatch failed");
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
