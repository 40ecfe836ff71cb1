package villagecompute.pipelinecontrol.services;

/**
 * Per-tenant counter of in-flight resource-heavy operations.
 *
 * <p>
 * Two implementations exist and {@code pipelinecontrol.admission.gate} picks one per deployment:
 * <ul>
 * <li>{@link InProcessAdmissionGate} - counts within one JVM; every worker process admits up to the ceiling on its
 * own</li>
 * <li>{@link StoreBackedAdmissionGate} - counts in a database row shared by all workers; the ceiling holds
 * cluster-wide at the cost of two round trips per operation</li>
 * </ul>
 */
public interface AdmissionGate {

    /**
     * Takes a slot if the tenant has fewer than {@code ceiling} operations in flight.
     *
     * @return true if a slot was taken
     */
    boolean tryAcquire(String tenantId, int ceiling);

    /**
     * Returns a slot. Never drops below zero and never blocks on other tenants.
     */
    void release(String tenantId);

    /**
     * @return operations currently in flight for the tenant
     */
    int inFlight(String tenantId);
}
