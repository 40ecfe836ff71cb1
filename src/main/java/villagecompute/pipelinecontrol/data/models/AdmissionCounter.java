package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.util.List;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Cluster-wide in-flight operation counter for one tenant, backing the store-backed admission gate.
 */
@Entity
@Table(
        name = "admission_counters")
public class AdmissionCounter extends PanacheEntityBase {

    @Id
    @Column(
            name = "tenant_id",
            nullable = false,
            length = 128)
    public String tenantId;

    @Column(
            name = "in_flight",
            nullable = false)
    public int inFlight;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Increments the counter only while it is below the ceiling.
     *
     * @return 1 if a slot was taken, 0 if the tenant is at its ceiling or has no counter row
     */
    public static int tryIncrement(String tenantId, int ceiling, Instant now) {
        return update("inFlight = inFlight + 1, updatedAt = ?1 WHERE tenantId = ?2 AND inFlight < ?3", now, tenantId,
                ceiling);
    }

    /**
     * Decrements the counter, never below zero.
     */
    public static int decrement(String tenantId, Instant now) {
        return update("inFlight = inFlight - 1, updatedAt = ?1 WHERE tenantId = ?2 AND inFlight > 0", now, tenantId);
    }

    public static List<AdmissionCounter> findBusy() {
        return find("inFlight > 0 ORDER BY tenantId").list();
    }

    /**
     * Zeroes a counter left non-zero by a crashed process.
     */
    public static int reset(String tenantId, Instant now) {
        return update("inFlight = 0, updatedAt = ?1 WHERE tenantId = ?2 AND inFlight > 0", now, tenantId);
    }
}
