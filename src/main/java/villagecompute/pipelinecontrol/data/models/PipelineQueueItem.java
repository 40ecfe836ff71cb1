package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Panache entity for the global pipeline work queue.
 *
 * <p>
 * Any worker in the pool may claim any tenant's item. Claims are made with a conditional update that only matches
 * rows still in {@link QueueStatus#QUEUED}, so a given {@code queue_id} moves to PROCESSING exactly once.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code queue_id} (TEXT, PK) - Generated or caller-supplied deterministic identifier</li>
 * <li>{@code tenant_id} (TEXT) - Owning tenant</li>
 * <li>{@code run_id} (TEXT) - Run this item executes, null for ad-hoc items</li>
 * <li>{@code config} (JSONB) - Opaque pipeline configuration payload</li>
 * <li>{@code priority} (INT) - 1 (most urgent) through 10</li>
 * <li>{@code status} (TEXT) - QUEUED, PROCESSING, COMPLETED, FAILED</li>
 * <li>{@code worker_id} (TEXT) - Claiming worker (hostname:pid)</li>
 * <li>{@code error_message} (TEXT) - Failure reason for FAILED items</li>
 * <li>{@code created_at} / {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 */
@Entity
@Table(
        name = "pipeline_queue",
        indexes = @Index(
                name = "idx_pipeline_queue_claim",
                columnList = "status, priority, created_at"))
public class PipelineQueueItem extends PanacheEntityBase {

    @Id
    @Column(
            name = "queue_id",
            nullable = false,
            length = 200)
    public String queueId;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "run_id")
    public String runId;

    @Column(
            name = "config",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> config;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public QueueStatus status;

    @Column(
            name = "worker_id")
    public String workerId;

    @Column(
            name = "error_message",
            length = 4000)
    public String errorMessage;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Queue item lifecycle statuses.
     */
    public enum QueueStatus {
        QUEUED, PROCESSING, COMPLETED, FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }

    /**
     * Returns the next claim candidates in dispatch order: lowest priority value first, then oldest, then by id so
     * that ties inside the same timestamp tick are still deterministic.
     *
     * @param limit
     *            max candidates to return
     * @return QUEUED items in claim order
     */
    public static List<PipelineQueueItem> findClaimCandidates(int limit) {
        return find("status = ?1 ORDER BY priority ASC, createdAt ASC, queueId ASC", QueueStatus.QUEUED).page(0, limit)
                .list();
    }

    /**
     * Claims an item for a worker. Matches only while the row is still QUEUED, so concurrent callers racing for the
     * same item see exactly one affected row between them.
     *
     * @return number of rows claimed (0 or 1)
     */
    public static int claim(String queueId, String workerId, Instant now) {
        return update("status = ?1, workerId = ?2, updatedAt = ?3 WHERE queueId = ?4 AND status = ?5",
                QueueStatus.PROCESSING, workerId, now, queueId, QueueStatus.QUEUED);
    }

    /**
     * Moves a claimed item to a terminal status. Items that are not PROCESSING are left untouched.
     *
     * @return number of rows updated (0 or 1)
     */
    public static int finish(String queueId, QueueStatus terminal, String errorMessage, Instant now) {
        return update("status = ?1, errorMessage = ?2, updatedAt = ?3 WHERE queueId = ?4 AND status = ?5", terminal,
                errorMessage, now, queueId, QueueStatus.PROCESSING);
    }

    public static long countByStatus(QueueStatus status) {
        return count("status", status);
    }

    public static List<PipelineQueueItem> findClaimedSince(Instant since) {
        return find("status = ?1 AND updatedAt >= ?2", QueueStatus.PROCESSING, since).list();
    }

    /**
     * Fails PROCESSING items whose last update is older than the threshold. A worker that crashed after claiming
     * leaves its item in PROCESSING forever otherwise.
     *
     * @return number of items failed
     */
    public static int failStaleProcessing(Instant threshold, String errorMessage, Instant now) {
        return update("status = ?1, errorMessage = ?2, updatedAt = ?3 WHERE status = ?4 AND updatedAt < ?5",
                QueueStatus.FAILED, errorMessage, now, QueueStatus.PROCESSING, threshold);
    }
}
