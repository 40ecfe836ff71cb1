package villagecompute.pipelinecontrol.observability;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.PipelineQueueItem;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem.QueueStatus;

/**
 * Custom metrics for the pipeline control plane. All names use the {@code pipelinecontrol_} prefix.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauge:</b> {@code pipelinecontrol_queue_depth{status}} - QUEUED and PROCESSING item counts</li>
 * <li><b>Counter:</b> {@code pipelinecontrol_lock_acquisitions_total{result}} - granted, contended, fail_open,
 * fail_closed</li>
 * <li><b>Counter:</b> {@code pipelinecontrol_admission_decisions_total{tier,result}} - admitted, denied</li>
 * <li><b>Counter:</b> {@code pipelinecontrol_runs_finished_total{outcome}} - completed, retrying, failed, duplicate,
 * requeued</li>
 * <li><b>Counter:</b> {@code pipelinecontrol_recovery_actions_total{kind}} - stale runs, stale items, corrected quota
 * rows, purged locks</li>
 * <li><b>Timer:</b> {@code pipelinecontrol_step_duration{step_type,outcome}} - executor wall time</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    /**
     * Registers queue depth gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        for (QueueStatus status : List.of(QueueStatus.QUEUED, QueueStatus.PROCESSING)) {
            Gauge.builder("pipelinecontrol_queue_depth", this, m -> getQueueDepth(status))
                    .description("Pipeline queue items in " + status.name() + " status")
                    .tags(List.of(Tag.of("status", status.name()))).register(registry);
            LOG.debugf("Registered gauge: pipelinecontrol_queue_depth{status=%s}", status.name());
        }
    }

    private double getQueueDepth(QueueStatus status) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> PipelineQueueItem.countByStatus(status));
        } catch (Exception e) {
            // A scrape must not fail because the database is briefly unavailable
            LOG.warnf(e, "Failed to read queue depth for status %s, returning 0", status);
            return 0.0;
        }
    }

    public void incrementLockAcquisition(String result) {
        counter("pipelinecontrol_lock_acquisitions_total", "Execution lock acquisition attempts",
                List.of(Tag.of("result", result))).increment();
    }

    public void incrementAdmissionDecision(String tier, boolean admitted) {
        counter("pipelinecontrol_admission_decisions_total", "Admission gate decisions",
                List.of(Tag.of("tier", tier), Tag.of("result", admitted ? "admitted" : "denied"))).increment();
    }

    public void incrementRunFinished(String outcome) {
        counter("pipelinecontrol_runs_finished_total", "Claimed queue items by final outcome",
                List.of(Tag.of("outcome", outcome))).increment();
    }

    public void incrementRecoveryAction(String kind, long amount) {
        if (amount <= 0) {
            return;
        }
        counter("pipelinecontrol_recovery_actions_total", "Corrections applied by maintenance jobs",
                List.of(Tag.of("kind", kind))).increment(amount);
    }

    public void recordStepDuration(String stepType, String outcome, Duration duration) {
        String key = stepType + ":" + outcome;
        Timer timer = timers.computeIfAbsent(key,
                k -> Timer.builder("pipelinecontrol_step_duration").description("Pipeline step execution time")
                        .tags(List.of(Tag.of("step_type", stepType), Tag.of("outcome", outcome))).register(registry));
        timer.record(duration);
    }

    private Counter counter(String name, String description, List<Tag> tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append(':').append(tag.getKey()).append('=').append(tag.getValue());
        }
        return counters.computeIfAbsent(key.toString(),
                k -> Counter.builder(name).description(description).tags(tags).register(registry));
    }
}
