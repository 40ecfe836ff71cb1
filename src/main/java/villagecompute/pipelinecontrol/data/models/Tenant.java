package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.util.List;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Customer organization. Onboarding owns these rows; the control plane only reads the status.
 */
@Entity
@Table(
        name = "tenants")
public class Tenant extends PanacheEntityBase {

    @Id
    @Column(
            name = "tenant_id",
            nullable = false,
            length = 128)
    public String tenantId;

    @Column(
            name = "display_name")
    public String displayName;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public TenantStatus status;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public enum TenantStatus {
        ACTIVE, SUSPENDED, DELETED
    }

    public static List<Tenant> findActive() {
        return find("status = ?1 ORDER BY tenantId", TenantStatus.ACTIVE).list();
    }
}
