package villagecompute.pipelinecontrol.jobs;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.observability.LoggingConfig;
import villagecompute.pipelinecontrol.services.PipelineWorker;

/**
 * Polls the queue on a fixed interval. An empty queue ends the tick; there is no in-process waiting.
 */
@ApplicationScoped
public class QueueWorkerScheduler {

    private static final Logger LOG = Logger.getLogger(QueueWorkerScheduler.class);

    @Inject
    PipelineWorker worker;

    @ConfigProperty(
            name = "pipelinecontrol.worker.batch-size",
            defaultValue = "5")
    int batchSize;

    @Scheduled(
            identity = "queue-worker",
            every = "{pipelinecontrol.schedule.worker-poll}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        LoggingConfig.setJobOrigin("queue-worker");
        String workerId = worker.workerId();
        try {
            int handled = worker.poll(workerId, batchSize);
            if (handled > 0) {
                LOG.debugf("Worker %s handled %d items", workerId, handled);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Worker %s poll failed", workerId);
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
