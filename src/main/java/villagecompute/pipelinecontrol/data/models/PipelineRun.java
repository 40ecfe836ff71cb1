package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import villagecompute.pipelinecontrol.services.ErrorClass;

/**
 * Panache entity holding the authoritative record of one scheduled pipeline execution, surviving across retries.
 *
 * <p>
 * All state changes go through conditional updates keyed on the expected current state, see
 * {@link villagecompute.pipelinecontrol.services.PipelineRunService}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code run_id} (TEXT, PK)</li>
 * <li>{@code tenant_id} (TEXT) - Owning tenant</li>
 * <li>{@code config_id} (TEXT) - Pipeline definition executed by this run</li>
 * <li>{@code scheduled_time} (TIMESTAMPTZ) - When the run becomes due</li>
 * <li>{@code state} (TEXT) - SCHEDULED, PENDING, RUNNING, COMPLETED, FAILED</li>
 * <li>{@code pipeline_logging_id} (TEXT) - Execution id of the current attempt, set on RUNNING</li>
 * <li>{@code attempt_count} (INT) - Failed attempts so far</li>
 * <li>{@code execution_duration_seconds} (INT) - Set on COMPLETED</li>
 * <li>{@code error_message} / {@code error_class} (TEXT) - Set on FAILED</li>
 * <li>{@code retryable} (BOOLEAN) - False once a failure was recorded as terminal</li>
 * <li>{@code next_retry_time} (TIMESTAMPTZ) - Earliest re-enqueue time for a retried run</li>
 * </ul>
 */
@Entity
@Table(
        name = "pipeline_runs",
        indexes = {@Index(
                name = "idx_pipeline_runs_state_time",
                columnList = "state, scheduled_time"),
                @Index(
                        name = "idx_pipeline_runs_tenant",
                        columnList = "tenant_id, state")})
public class PipelineRun extends PanacheEntityBase {

    @Id
    @Column(
            name = "run_id",
            nullable = false,
            length = 160)
    public String runId;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "config_id",
            nullable = false)
    public String configId;

    @Column(
            name = "scheduled_time",
            nullable = false)
    public Instant scheduledTime;

    @Column(
            name = "state",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public RunState state;

    @Column(
            name = "pipeline_logging_id")
    public String pipelineLoggingId;

    @Column(
            name = "attempt_count",
            nullable = false)
    public int attemptCount;

    @Column(
            name = "execution_duration_seconds")
    public Integer executionDurationSeconds;

    @Column(
            name = "error_message",
            length = 4000)
    public String errorMessage;

    @Column(
            name = "error_class")
    @Enumerated(EnumType.STRING)
    public ErrorClass errorClass;

    @Column(
            name = "retryable",
            nullable = false)
    public boolean retryable;

    @Column(
            name = "next_retry_time")
    public Instant nextRetryTime;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "failed_at")
    public Instant failedAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Run lifecycle states. FAILED to PENDING is the only backward edge and is reserved for retries.
     */
    public enum RunState {
        SCHEDULED, PENDING, RUNNING, COMPLETED, FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    public static Optional<PipelineRun> findByRunId(String runId) {
        return findByIdOptional(runId);
    }

    /**
     * Finds SCHEDULED runs whose scheduled time has passed, oldest first.
     */
    public static List<PipelineRun> findDueScheduled(Instant now, int limit) {
        return find("state = ?1 AND scheduledTime <= ?2 ORDER BY scheduledTime ASC", RunState.SCHEDULED, now)
                .page(0, limit).list();
    }

    /**
     * Finds PENDING runs waiting on a retry whose {@code next_retry_time} has passed.
     */
    public static List<PipelineRun> findDueRetries(Instant now, int limit) {
        return find("state = ?1 AND nextRetryTime IS NOT NULL AND nextRetryTime <= ?2 ORDER BY nextRetryTime ASC",
                RunState.PENDING, now).page(0, limit).list();
    }

    /**
     * Counts runs of a definition that are not yet terminal. Used to avoid stacking cron-created runs.
     */
    public static long countLive(String configId) {
        return count("configId = ?1 AND state IN (?2, ?3, ?4)", configId, RunState.SCHEDULED, RunState.PENDING,
                RunState.RUNNING);
    }

    /**
     * Counts a tenant's RUNNING runs that started at or after the staleness threshold.
     */
    public static long countLiveRunning(String tenantId, Instant staleThreshold) {
        return count("tenantId = ?1 AND state = ?2 AND startedAt >= ?3", tenantId, RunState.RUNNING,
                staleThreshold);
    }

    /**
     * Finds RUNNING runs started before the threshold and PENDING runs that have not moved since before it. A
     * PENDING run with a future retry time is not stale.
     */
    public static List<PipelineRun> findStale(Instant threshold) {
        return find("(state = ?1 AND (startedAt < ?2 OR (startedAt IS NULL AND updatedAt < ?2))) "
                + "OR (state = ?3 AND updatedAt < ?2 AND (nextRetryTime IS NULL OR nextRetryTime < ?2))",
                RunState.RUNNING, threshold, RunState.PENDING).list();
    }
}
