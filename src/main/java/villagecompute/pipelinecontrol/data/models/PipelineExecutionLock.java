package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.util.List;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Transient mutual-exclusion record for one (tenant, pipeline) pair.
 *
 * <p>
 * The primary key is {@code <tenant length>:tenant_id:pipeline_id}, so at most one row exists per (tenant, pipeline)
 * pair. The length prefix keeps tenants whose ids contain {@code :} from sharing a key. An expired row stays until a
 * new acquirer overwrites it or a status read deletes it.
 */
@Entity
@Table(
        name = "pipeline_execution_locks")
public class PipelineExecutionLock extends PanacheEntityBase {

    @Id
    @Column(
            name = "lock_key",
            nullable = false,
            length = 255)
    public String lockKey;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "pipeline_id",
            nullable = false)
    public String pipelineId;

    @Column(
            name = "pipeline_logging_id",
            nullable = false)
    public String pipelineLoggingId;

    @Column(
            name = "locked_at",
            nullable = false)
    public Instant lockedAt;

    @Column(
            name = "locked_by",
            nullable = false)
    public String lockedBy;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    public static String lockKey(String tenantId, String pipelineId) {
        return tenantId.length() + ":" + tenantId + ":" + pipelineId;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public static List<PipelineExecutionLock> findActive(Instant now) {
        return find("expiresAt > ?1 ORDER BY lockedAt ASC", now).list();
    }

    public static long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }

    public static long deleteIfExpired(String lockKey, Instant now) {
        return delete("lockKey = ?1 AND expiresAt <= ?2", lockKey, now);
    }
}
