package villagecompute.pipelinecontrol.services;

import java.time.Instant;

import io.quarkus.narayana.jta.QuarkusTransaction;

import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.AdmissionCounter;

/**
 * {@link AdmissionGate} backed by one {@code admission_counters} row per tenant, shared by every worker.
 *
 * <p>
 * A slot is taken by a conditional increment that only matches while {@code in_flight < ceiling}, so two workers can
 * never both take the last slot. A worker that crashes while holding a slot leaves the counter high until the stale
 * recovery sweep resets it.
 */
public class StoreBackedAdmissionGate implements AdmissionGate {

    private static final Logger LOG = Logger.getLogger(StoreBackedAdmissionGate.class);

    @Override
    public boolean tryAcquire(String tenantId, int ceiling) {
        try {
            ensureCounter(tenantId);
            return QuarkusTransaction.requiringNew()
                    .call(() -> AdmissionCounter.tryIncrement(tenantId, ceiling, Instant.now()) == 1);
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "admission acquire");
        }
    }

    @Override
    public void release(String tenantId) {
        try {
            int updated = QuarkusTransaction.requiringNew()
                    .call(() -> AdmissionCounter.decrement(tenantId, Instant.now()));
            if (updated == 0) {
                LOG.debugf("Admission counter for tenant %s already at zero", tenantId);
            }
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "admission release");
        }
    }

    @Override
    public int inFlight(String tenantId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            AdmissionCounter counter = AdmissionCounter.findById(tenantId);
            return counter == null ? 0 : counter.inFlight;
        });
    }

    private void ensureCounter(String tenantId) {
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                if (AdmissionCounter.findById(tenantId) == null) {
                    AdmissionCounter counter = new AdmissionCounter();
                    counter.tenantId = tenantId;
                    counter.inFlight = 0;
                    counter.updatedAt = Instant.now();
                    counter.persist();
                }
            });
        } catch (RuntimeException e) {
            if (!BackendFailures.isDuplicateKey(e)) {
                throw e;
            }
            // Another worker created the row first
        }
    }
}
