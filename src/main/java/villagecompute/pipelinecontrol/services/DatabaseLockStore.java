package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.PipelineExecutionLock;
import villagecompute.pipelinecontrol.exceptions.TransientBackendException;

/**
 * {@link LockStore} backed by the {@code pipeline_execution_locks} table.
 *
 * <p>
 * Acquisition reads the row with {@code SELECT ... FOR UPDATE} and overwrites it in the same transaction when it has
 * expired. When no row exists, two acquirers may both insert; the primary key lets exactly one commit and the loser
 * reports the winner as the holder.
 */
@ApplicationScoped
public class DatabaseLockStore implements LockStore {

    private static final Logger LOG = Logger.getLogger(DatabaseLockStore.class);

    @Override
    @Retry(
            maxRetries = 2,
            delay = 100,
            jitter = 50,
            retryOn = TransientBackendException.class)
    public AcquireOutcome tryAcquire(String tenantId, String pipelineId, String executionId, String holder,
            Duration ttl) {
        String key = PipelineExecutionLock.lockKey(tenantId, pipelineId);
        try {
            return QuarkusTransaction.requiringNew().call(() -> {
                Instant now = Instant.now();
                PipelineExecutionLock existing = PipelineExecutionLock.findById(key, LockModeType.PESSIMISTIC_WRITE);
                if (existing != null && !existing.isExpired(now)) {
                    return AcquireOutcome.heldBy(existing.pipelineLoggingId);
                }
                if (existing != null) {
                    LOG.infof("Lock %s held by %s expired at %s, replacing", key, existing.pipelineLoggingId,
                            existing.expiresAt);
                }
                PipelineExecutionLock lock = existing != null ? existing : new PipelineExecutionLock();
                lock.lockKey = key;
                lock.tenantId = tenantId;
                lock.pipelineId = pipelineId;
                lock.pipelineLoggingId = executionId;
                lock.lockedBy = holder;
                lock.lockedAt = now;
                lock.expiresAt = now.plus(ttl);
                if (existing == null) {
                    lock.persist();
                }
                return AcquireOutcome.grant();
            });
        } catch (RuntimeException e) {
            if (BackendFailures.isDuplicateKey(e)) {
                LOG.debugf("Lock %s inserted concurrently by another acquirer", key);
                return AcquireOutcome.heldBy(status(tenantId, pipelineId).map(LockRecord::pipelineLoggingId)
                        .orElse(null));
            }
            throw BackendFailures.translate(e, "lock acquire");
        }
    }

    @Override
    @Retry(
            maxRetries = 2,
            delay = 100,
            jitter = 50,
            retryOn = TransientBackendException.class)
    public boolean release(String tenantId, String pipelineId, String executionId) {
        String key = PipelineExecutionLock.lockKey(tenantId, pipelineId);
        try {
            return QuarkusTransaction.requiringNew().call(() -> {
                PipelineExecutionLock existing = PipelineExecutionLock.findById(key, LockModeType.PESSIMISTIC_WRITE);
                if (existing == null) {
                    LOG.warnf("Release of lock %s by %s ignored: no lock held", key, executionId);
                    return false;
                }
                if (!existing.pipelineLoggingId.equals(executionId)) {
                    LOG.warnf("Release of lock %s by %s ignored: held by %s", key, executionId,
                            existing.pipelineLoggingId);
                    return false;
                }
                existing.delete();
                return true;
            });
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "lock release");
        }
    }

    @Override
    public Optional<LockRecord> status(String tenantId, String pipelineId) {
        String key = PipelineExecutionLock.lockKey(tenantId, pipelineId);
        try {
            return QuarkusTransaction.requiringNew().call(() -> {
                Instant now = Instant.now();
                PipelineExecutionLock existing = PipelineExecutionLock.findById(key, LockModeType.PESSIMISTIC_WRITE);
                if (existing == null) {
                    return Optional.<LockRecord> empty();
                }
                if (existing.isExpired(now)) {
                    // Re-checks expiry in the statement so a lock renewed since the read survives
                    if (PipelineExecutionLock.deleteIfExpired(key, now) > 0) {
                        LOG.debugf("Lock %s observed expired, deleted", key);
                    }
                    return Optional.<LockRecord> empty();
                }
                return Optional.of(toRecord(existing));
            });
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "lock status");
        }
    }

    @Override
    public List<LockRecord> activeLocks() {
        try {
            return QuarkusTransaction.requiringNew().call(() -> PipelineExecutionLock.findActive(Instant.now())
                    .stream().map(DatabaseLockStore::toRecord).toList());
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "active locks");
        }
    }

    @Override
    public long purgeExpired() {
        try {
            return QuarkusTransaction.requiringNew().call(() -> PipelineExecutionLock.deleteExpired(Instant.now()));
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "purge expired locks");
        }
    }

    private static LockRecord toRecord(PipelineExecutionLock lock) {
        return new LockRecord(lock.tenantId, lock.pipelineId, lock.pipelineLoggingId, lock.lockedAt, lock.lockedBy,
                lock.expiresAt);
    }
}
