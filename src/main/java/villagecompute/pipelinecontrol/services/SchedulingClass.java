package villagecompute.pipelinecontrol.services;

/**
 * Warehouse scheduling class a tier's operations are submitted under.
 */
public enum SchedulingClass {
    /**
     * Starts immediately, counts against the shared interactive slots.
     */
    INTERACTIVE,

    /**
     * Queued by the warehouse until idle capacity is available.
     */
    BATCH
}
