package villagecompute.pipelinecontrol.services;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.TenantSubscription;
import villagecompute.pipelinecontrol.exceptions.PipelineConfigurationException;

/**
 * Resolves a tenant's subscription tier.
 *
 * <p>
 * Tiers are cached for five minutes; a plan change takes effect on the next cache miss or after
 * {@link #invalidate(String)}.
 */
@ApplicationScoped
public class SubscriptionService {

    private static final Logger LOG = Logger.getLogger(SubscriptionService.class);

    private final Cache<String, SubscriptionTier> tierCache = Caffeine.newBuilder()
            .expireAfterWrite(5, TimeUnit.MINUTES).maximumSize(10_000).build();

    /**
     * @return the tier of the tenant's ACTIVE or TRIAL subscription; unknown plan names map to STARTER
     * @throws PipelineConfigurationException
     *             if the tenant has no current subscription
     */
    public SubscriptionTier getTier(String tenantId) {
        SubscriptionTier cached = tierCache.getIfPresent(tenantId);
        if (cached != null) {
            return cached;
        }
        TenantSubscription subscription = findCurrentSubscription(tenantId)
                .orElseThrow(() -> new PipelineConfigurationException(
                        "Unknown tenant or no active subscription: " + tenantId));
        SubscriptionTier tier = SubscriptionTier.fromName(subscription.planName);
        if (!tier.name().equalsIgnoreCase(subscription.planName)) {
            LOG.warnf("Tenant %s has unrecognized plan '%s', applying %s limits", tenantId, subscription.planName,
                    tier);
        }
        tierCache.put(tenantId, tier);
        return tier;
    }

    public Optional<TenantSubscription> findCurrentSubscription(String tenantId) {
        return QuarkusTransaction.requiringNew().call(() -> TenantSubscription.findCurrent(tenantId));
    }

    public void invalidate(String tenantId) {
        tierCache.invalidate(tenantId);
    }

    public void invalidateAll() {
        tierCache.invalidateAll();
    }
}
