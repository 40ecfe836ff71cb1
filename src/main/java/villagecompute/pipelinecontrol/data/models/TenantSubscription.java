package villagecompute.pipelinecontrol.data.models;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Tenant subscription: plan name plus run limits. Billing owns these rows.
 *
 * <p>
 * {@code plan_name} is resolved through {@link villagecompute.pipelinecontrol.services.SubscriptionTier#fromName}, so
 * unknown plan names fall back to the starter limits.
 */
@Entity
@Table(
        name = "tenant_subscriptions")
public class TenantSubscription extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.UUID)
    @Column(
            name = "id",
            nullable = false)
    public UUID id;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "plan_name",
            nullable = false)
    public String planName;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public SubscriptionStatus status;

    @Column(
            name = "daily_limit",
            nullable = false)
    public int dailyLimit;

    @Column(
            name = "monthly_limit",
            nullable = false)
    public int monthlyLimit;

    @Column(
            name = "concurrent_limit",
            nullable = false)
    public int concurrentLimit;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public enum SubscriptionStatus {
        ACTIVE, TRIAL, PAST_DUE, CANCELLED, EXPIRED;

        public boolean isCurrent() {
            return this == ACTIVE || this == TRIAL;
        }
    }

    /**
     * Finds the tenant's newest ACTIVE or TRIAL subscription.
     */
    public static Optional<TenantSubscription> findCurrent(String tenantId) {
        return find("tenantId = ?1 AND status IN (?2, ?3) ORDER BY createdAt DESC", tenantId,
                SubscriptionStatus.ACTIVE, SubscriptionStatus.TRIAL).firstResultOptional();
    }
}
