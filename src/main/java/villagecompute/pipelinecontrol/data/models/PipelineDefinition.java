package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import villagecompute.pipelinecontrol.jobs.PipelineStepType;

/**
 * A tenant's configured pipeline: which step to run, with what parameters, on what schedule.
 *
 * <p>
 * {@code schedule_cron} uses Quartz syntax (seconds field first) and is evaluated in {@code timezone}. A null cron
 * means the pipeline only runs when a caller creates a run for it.
 */
@Entity
@Table(
        name = "pipeline_definitions")
public class PipelineDefinition extends PanacheEntityBase {

    @Id
    @Column(
            name = "config_id",
            nullable = false,
            length = 128)
    public String configId;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "pipeline_id",
            nullable = false)
    public String pipelineId;

    @Column(
            name = "step_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public PipelineStepType stepType;

    @Column(
            name = "parameters",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> parameters;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "schedule_cron")
    public String scheduleCron;

    @Column(
            name = "timezone",
            nullable = false)
    public String timezone;

    @Column(
            name = "max_retries",
            nullable = false)
    public int maxRetries;

    @Column(
            name = "enabled",
            nullable = false)
    public boolean enabled;

    @Column(
            name = "last_run_time")
    public Instant lastRunTime;

    @Column(
            name = "last_run_status")
    public String lastRunStatus;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static Optional<PipelineDefinition> findByConfigId(String configId) {
        return findByIdOptional(configId);
    }

    public static List<PipelineDefinition> findScheduled() {
        return find("enabled = true AND scheduleCron IS NOT NULL ORDER BY configId").list();
    }

    /**
     * Advances {@code last_run_time} to a cron fire time. Only one dispatcher wins for a given fire time because the
     * update matches only while the stored time is older.
     *
     * @return 1 if this caller advanced the schedule, 0 otherwise
     */
    public static int advanceSchedule(String configId, Instant fireTime, Instant now) {
        return update(
                "lastRunTime = ?1, updatedAt = ?2 WHERE configId = ?3 AND (lastRunTime IS NULL OR lastRunTime < ?1)",
                fireTime, now, configId);
    }

    public static int recordLastRunStatus(String configId, String status, Instant now) {
        return update("lastRunStatus = ?1, updatedAt = ?2 WHERE configId = ?3", status, now, configId);
    }
}
