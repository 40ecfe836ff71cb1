package villagecompute.pipelinecontrol.services;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link AdmissionGate} counting in this JVM. One mutex guards every tenant's counter; each critical section is a
 * single map read and write.
 */
public class InProcessAdmissionGate implements AdmissionGate {

    private final Object mutex = new Object();

    private final Map<String, Integer> inFlight = new HashMap<>();

    @Override
    public boolean tryAcquire(String tenantId, int ceiling) {
        synchronized (mutex) {
            int current = inFlight.getOrDefault(tenantId, 0);
            if (current >= ceiling) {
                return false;
            }
            inFlight.put(tenantId, current + 1);
            return true;
        }
    }

    @Override
    public void release(String tenantId) {
        synchronized (mutex) {
            int current = inFlight.getOrDefault(tenantId, 0);
            if (current <= 1) {
                inFlight.remove(tenantId);
            } else {
                inFlight.put(tenantId, current - 1);
            }
        }
    }

    @Override
    public int inFlight(String tenantId) {
        synchronized (mutex) {
            return inFlight.getOrDefault(tenantId, 0);
        }
    }
}
