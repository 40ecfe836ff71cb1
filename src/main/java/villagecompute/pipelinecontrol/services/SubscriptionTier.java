package villagecompute.pipelinecontrol.services;

import java.util.Locale;

/**
 * Subscription tiers and their resource ceilings.
 *
 * <p>
 * <b>Tier Table:</b>
 * <ul>
 * <li>STARTER - 2 concurrent, 60s, 10 GB per operation, BATCH</li>
 * <li>PROFESSIONAL - 5 concurrent, 180s, 100 GB per operation, INTERACTIVE</li>
 * <li>SCALE - 10 concurrent, 300s, unlimited, INTERACTIVE</li>
 * <li>ENTERPRISE - 20 concurrent, 600s, unlimited, INTERACTIVE</li>
 * </ul>
 */
public enum SubscriptionTier {

    STARTER(new TierLimits(2, 60, 10, SchedulingClass.BATCH)),

    PROFESSIONAL(new TierLimits(5, 180, 100, SchedulingClass.INTERACTIVE)),

    SCALE(new TierLimits(10, 300, 0, SchedulingClass.INTERACTIVE)),

    ENTERPRISE(new TierLimits(20, 600, 0, SchedulingClass.INTERACTIVE));

    private final TierLimits limits;

    SubscriptionTier(TierLimits limits) {
        this.limits = limits;
    }

    public TierLimits limits() {
        return limits;
    }

    /**
     * Resolves a plan name case-insensitively. Unknown, blank or null names resolve to {@link #STARTER}, the most
     * restrictive tier.
     *
     * @param name
     *            plan name from the subscription service
     * @return matching tier, never null
     */
    public static SubscriptionTier fromName(String name) {
        if (name == null || name.isBlank()) {
            return STARTER;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STARTER;
        }
    }
}
