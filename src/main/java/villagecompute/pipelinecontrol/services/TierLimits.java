package villagecompute.pipelinecontrol.services;

/**
 * Immutable resource ceilings for one subscription tier.
 *
 * @param maxConcurrentOperations
 *            concurrent resource-heavy operations per tenant
 * @param operationTimeoutSeconds
 *            hard ceiling on any single operation's timeout
 * @param maxCostUnits
 *            billed units (GB) a single operation may scan, 0 means unlimited
 * @param schedulingClass
 *            warehouse scheduling class
 */
public record TierLimits(int maxConcurrentOperations, int operationTimeoutSeconds, long maxCostUnits,
        SchedulingClass schedulingClass) {

    public TierLimits {
        if (maxConcurrentOperations < 1) {
            throw new IllegalArgumentException("maxConcurrentOperations must be positive");
        }
        if (operationTimeoutSeconds < 1) {
            throw new IllegalArgumentException("operationTimeoutSeconds must be positive");
        }
        if (maxCostUnits < 0) {
            throw new IllegalArgumentException("maxCostUnits must not be negative");
        }
    }

    public boolean isCostUnlimited() {
        return maxCostUnits == 0;
    }
}
