package villagecompute.pipelinecontrol.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for structured logging of pipeline execution.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - OpenTelemetry context of the current execution span</li>
 * <li>{@code tenant_id} - Tenant owning the claimed item</li>
 * <li>{@code run_id} - Run being executed</li>
 * <li>{@code queue_id} - Claimed queue item</li>
 * <li>{@code worker_id} - Claiming worker (hostname:pid)</li>
 * <li>{@code pipeline_logging_id} - Execution id of the current attempt, also the lock ownership proof</li>
 * <li>{@code job_origin} - Scheduled job name for maintenance runs</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the worker:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setTenantId(item.tenantId);
 * LoggingConfig.setQueueId(item.queueId);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * MDC is thread-local; every worker iteration clears it so pooled scheduler threads do not leak context.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_TENANT_ID = "tenant_id";

    public static final String MDC_RUN_ID = "run_id";

    public static final String MDC_QUEUE_ID = "queue_id";

    public static final String MDC_WORKER_ID = "worker_id";

    public static final String MDC_PIPELINE_LOGGING_ID = "pipeline_logging_id";

    public static final String MDC_JOB_ORIGIN = "job_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace and span ids from the current OpenTelemetry span. Empty strings are written when no span is
     * active so the log layout stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();
        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setTenantId(String tenantId) {
        putIfPresent(MDC_TENANT_ID, tenantId);
    }

    public static void setRunId(String runId) {
        putIfPresent(MDC_RUN_ID, runId);
    }

    public static void setQueueId(String queueId) {
        putIfPresent(MDC_QUEUE_ID, queueId);
    }

    public static void setWorkerId(String workerId) {
        putIfPresent(MDC_WORKER_ID, workerId);
    }

    public static void setPipelineLoggingId(String pipelineLoggingId) {
        putIfPresent(MDC_PIPELINE_LOGGING_ID, pipelineLoggingId);
    }

    public static void setJobOrigin(String jobOrigin) {
        putIfPresent(MDC_JOB_ORIGIN, jobOrigin);
    }

    /**
     * Clears every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_TENANT_ID);
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_QUEUE_ID);
        MDC.remove(MDC_WORKER_ID);
        MDC.remove(MDC_PIPELINE_LOGGING_ID);
        MDC.remove(MDC_JOB_ORIGIN);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isEmpty()) {
            MDC.put(key, value);
        }
    }
}
