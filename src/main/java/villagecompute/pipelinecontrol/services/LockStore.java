package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Coordination store backing {@link ExecutionLockManager}. Each method is a single atomic read-modify-write against
 * the store.
 *
 * <p>
 * Implementations raise {@link villagecompute.pipelinecontrol.exceptions.TransientBackendException} when the store
 * cannot be reached; the lock manager applies its fail-open or fail-closed policy on top.
 */
public interface LockStore {

    /**
     * A lock as currently stored.
     */
    record LockRecord(String tenantId, String pipelineId, String pipelineLoggingId, Instant lockedAt,
            String lockedBy, Instant expiresAt) {

        public boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }

    /**
     * Result of an acquisition attempt against the store.
     *
     * @param granted
     *            true if the caller now holds the lock
     * @param existingExecutionId
     *            current holder when not granted, may be null if the holder could not be read
     */
    record AcquireOutcome(boolean granted, String existingExecutionId) {

        public static AcquireOutcome grant() {
            return new AcquireOutcome(true, null);
        }

        public static AcquireOutcome heldBy(String existingExecutionId) {
            return new AcquireOutcome(false, existingExecutionId);
        }
    }

    /**
     * Writes a fresh lock when none exists or the existing one has expired.
     */
    AcquireOutcome tryAcquire(String tenantId, String pipelineId, String executionId, String holder, Duration ttl);

    /**
     * Deletes the lock only when {@code executionId} is the recorded holder.
     *
     * @return true if the lock was deleted
     */
    boolean release(String tenantId, String pipelineId, String executionId);

    /**
     * Reads the lock, deleting it if it has expired.
     *
     * @return the live lock, or empty if none exists or it had expired
     */
    Optional<LockRecord> status(String tenantId, String pipelineId);

    /**
     * @return all non-expired locks, oldest first
     */
    List<LockRecord> activeLocks();

    /**
     * Deletes every expired lock.
     *
     * @return number of locks deleted
     */
    long purgeExpired();
}
