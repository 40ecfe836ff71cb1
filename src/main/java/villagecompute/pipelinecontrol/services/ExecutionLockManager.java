package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.exceptions.TransientBackendException;
import villagecompute.pipelinecontrol.exceptions.ValidationException;
import villagecompute.pipelinecontrol.observability.ObservabilityMetrics;
import villagecompute.pipelinecontrol.services.LockStore.AcquireOutcome;
import villagecompute.pipelinecontrol.services.LockStore.LockRecord;

/**
 * Distributed mutual exclusion per (tenant, pipeline), guaranteeing at most one live execution of a pipeline for a
 * tenant across all workers.
 *
 * <p>
 * <b>Ownership:</b> the lock records the holder's execution id ({@code pipeline_logging_id}). Only a release carrying
 * that id deletes the lock, so a slow worker whose lock expired and was taken over cannot release the newer holder's
 * lock.
 *
 * <p>
 * <b>Expiry:</b> every lock carries a TTL ({@code pipelinecontrol.lock.ttl-seconds}, default one hour). A lock past
 * its TTL is replaced by the next acquirer. There is no heartbeat; an execution running longer than the TTL loses its
 * exclusivity.
 *
 * <p>
 * <b>Store outage:</b> {@code pipelinecontrol.lock.fail-open} decides what {@link #acquire} returns when the store
 * cannot be reached. Fail-open (default) grants locally and favors availability over strict exclusion. Fail-closed
 * denies, and the caller returns the run to the queue.
 */
@ApplicationScoped
public class ExecutionLockManager {

    private static final Logger LOG = Logger.getLogger(ExecutionLockManager.class);

    @Inject
    LockStore lockStore;

    @Inject
    ObservabilityMetrics metrics;

    @ConfigProperty(
            name = "pipelinecontrol.lock.ttl-seconds",
            defaultValue = "3600")
    long defaultTtlSeconds;

    @ConfigProperty(
            name = "pipelinecontrol.lock.fail-open",
            defaultValue = "true")
    boolean failOpen;

    /**
     * Outcome of {@link #acquire}.
     *
     * @param granted
     *            true if the caller may proceed
     * @param existingExecutionId
     *            holder's execution id when denied because the pipeline is already running
     * @param backendUnavailable
     *            true if the store could not be reached and the fail-open or fail-closed policy decided
     */
    public record LockResult(boolean granted, String existingExecutionId, boolean backendUnavailable) {

        static LockResult acquired() {
            return new LockResult(true, null, false);
        }

        static LockResult alreadyRunning(String existingExecutionId) {
            return new LockResult(false, existingExecutionId, false);
        }

        static LockResult storeUnavailable(boolean granted) {
            return new LockResult(granted, null, true);
        }

        /**
         * @return true if denied because another execution holds the lock
         */
        public boolean isDuplicate() {
            return !granted && !backendUnavailable;
        }
    }

    public LockResult acquire(String tenantId, String pipelineId, String executionId, String holder) {
        return acquire(tenantId, pipelineId, executionId, holder, Duration.ofSeconds(defaultTtlSeconds));
    }

    /**
     * Acquires the lock for (tenant, pipeline).
     *
     * @param tenantId
     *            tenant
     * @param pipelineId
     *            pipeline
     * @param executionId
     *            caller's execution id, the ownership proof for {@link #release}
     * @param holder
     *            worker identity recorded for operators
     * @param ttl
     *            lifetime of the lock
     * @return grant decision; contention is reported here, not thrown
     * @throws ValidationException
     *             if an identifier is blank or the TTL is not positive
     */
    public LockResult acquire(String tenantId, String pipelineId, String executionId, String holder, Duration ttl) {
        requireText(tenantId, "tenantId");
        requireText(pipelineId, "pipelineId");
        requireText(executionId, "executionId");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new ValidationException("Lock TTL must be positive");
        }
        String lockedBy = holder != null ? holder : "unknown";

        AcquireOutcome outcome;
        try {
            outcome = lockStore.tryAcquire(tenantId, pipelineId, executionId, lockedBy, ttl);
        } catch (TransientBackendException e) {
            if (failOpen) {
                LOG.warnf(e, "Lock store unavailable for %s:%s, failing open for execution %s", tenantId, pipelineId,
                        executionId);
                metrics.incrementLockAcquisition("fail_open");
                return LockResult.storeUnavailable(true);
            }
            LOG.errorf(e, "Lock store unavailable for %s:%s, failing closed for execution %s", tenantId, pipelineId,
                    executionId);
            metrics.incrementLockAcquisition("fail_closed");
            return LockResult.storeUnavailable(false);
        }

        if (outcome.granted()) {
            LOG.infof("Acquired lock %s:%s for execution %s (ttl %ds, holder %s)", tenantId, pipelineId, executionId,
                    ttl.toSeconds(), lockedBy);
            metrics.incrementLockAcquisition("granted");
            return LockResult.acquired();
        }
        LOG.infof("Lock %s:%s already held by execution %s, execution %s not started", tenantId, pipelineId,
                outcome.existingExecutionId(), executionId);
        metrics.incrementLockAcquisition("contended");
        return LockResult.alreadyRunning(outcome.existingExecutionId());
    }

    /**
     * Releases the lock if {@code executionId} holds it. A missing lock, a lock held by someone else, or an
     * unreachable store all return false; an unreleased lock expires with its TTL.
     *
     * @return true if the lock was deleted
     */
    public boolean release(String tenantId, String pipelineId, String executionId) {
        requireText(tenantId, "tenantId");
        requireText(pipelineId, "pipelineId");
        requireText(executionId, "executionId");
        try {
            boolean released = lockStore.release(tenantId, pipelineId, executionId);
            if (released) {
                LOG.infof("Released lock %s:%s held by execution %s", tenantId, pipelineId, executionId);
            }
            return released;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to release lock %s:%s for execution %s, it will expire with its TTL", tenantId,
                    pipelineId, executionId);
            return false;
        }
    }

    /**
     * Reads the current lock. Observing an expired lock deletes it.
     */
    public Optional<LockRecord> status(String tenantId, String pipelineId) {
        requireText(tenantId, "tenantId");
        requireText(pipelineId, "pipelineId");
        return lockStore.status(tenantId, pipelineId);
    }

    public List<LockRecord> activeLocks() {
        return lockStore.activeLocks();
    }

    /**
     * Deletes every expired lock.
     *
     * @return number of locks deleted
     */
    public long purgeExpired() {
        return lockStore.purgeExpired();
    }

    public boolean isFailOpen() {
        return failOpen;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }
}
