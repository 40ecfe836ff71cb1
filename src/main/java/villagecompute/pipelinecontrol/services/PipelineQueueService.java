package villagecompute.pipelinecontrol.services;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import villagecompute.pipelinecontrol.data.models.PipelineQueueItem;
import villagecompute.pipelinecontrol.data.models.PipelineQueueItem.QueueStatus;
import villagecompute.pipelinecontrol.exceptions.TransientBackendException;
import villagecompute.pipelinecontrol.exceptions.ValidationException;

/**
 * Durable priority work queue shared by every worker.
 *
 * <p>
 * <b>Ordering:</b> lowest {@code priority} value first, then oldest {@code created_at}. The queue is tenant-blind;
 * per-tenant isolation is enforced by the execution lock and the admission gate.
 *
 * <p>
 * <b>Claiming:</b> {@link #dequeue(String)} selects candidates in claim order and claims one with a single conditional
 * update that only matches while the row is still QUEUED. When every candidate was taken by other workers it selects
 * again, so an empty result means no QUEUED row was left. The claimed row is read back inside the same transaction,
 * so a crash can never leave an item claimed without the claimant having observed it.
 *
 * <p>
 * Every operation runs in its own transaction. Transient store failures are retried with backoff and then
 * propagated as {@link TransientBackendException}.
 */
@ApplicationScoped
public class PipelineQueueService {

    private static final Logger LOG = Logger.getLogger(PipelineQueueService.class);

    public static final int HIGHEST_PRIORITY = 1;

    public static final int LOWEST_PRIORITY = 10;

    /**
     * Candidates read per selection. Losing a claim race moves on to the next one.
     */
    private static final int CLAIM_CANDIDATES = 5;

    private static final Duration STATUS_WINDOW = Duration.ofHours(1);

    /**
     * Queue counters for dashboards.
     *
     * @param queued
     *            items waiting to be claimed
     * @param processing
     *            items claimed and not yet terminal
     * @param avgWaitSeconds
     *            mean time between creation and claim for items claimed in the last hour
     */
    public record QueueStatusSnapshot(long queued, long processing, double avgWaitSeconds) {
    }

    /**
     * Enqueues an item under a generated id.
     *
     * @return the new queue id
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public String enqueue(String tenantId, Map<String, Object> config, int priority) {
        return enqueue(null, tenantId, null, config, priority);
    }

    /**
     * Enqueues an item. When {@code queueId} is supplied and an item with that id already exists, nothing is written
     * and the id is returned, so callers can safely repeat the call after a timeout.
     *
     * @param queueId
     *            deterministic id, or null to generate one
     * @param tenantId
     *            owning tenant
     * @param runId
     *            run the item executes, may be null
     * @param config
     *            opaque pipeline configuration
     * @param priority
     *            1 (most urgent) through 10
     * @return the queue id
     * @throws ValidationException
     *             if the tenant is blank, the config is null or the priority is out of range
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public String enqueue(String queueId, String tenantId, String runId, Map<String, Object> config, int priority) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId is required");
        }
        if (config == null) {
            throw new ValidationException("config is required");
        }
        if (priority < HIGHEST_PRIORITY || priority > LOWEST_PRIORITY) {
            throw new ValidationException("priority must be between " + HIGHEST_PRIORITY + " and " + LOWEST_PRIORITY
                    + ", got " + priority);
        }
        String id = queueId != null ? queueId : UUID.randomUUID().toString();

        try {
            boolean inserted = QuarkusTransaction.requiringNew().call(() -> {
                if (PipelineQueueItem.findByIdOptional(id).isPresent()) {
                    return false;
                }
                Instant now = Instant.now();
                PipelineQueueItem item = new PipelineQueueItem();
                item.queueId = id;
                item.tenantId = tenantId;
                item.runId = runId;
                item.config = config;
                item.priority = priority;
                item.status = QueueStatus.QUEUED;
                item.createdAt = now;
                item.updatedAt = now;
                item.persist();
                return true;
            });
            if (inserted) {
                LOG.infof("Enqueued item %s for tenant %s (priority %d)", id, tenantId, priority);
            } else {
                LOG.debugf("Queue item %s already exists, enqueue ignored", id);
            }
            return id;
        } catch (RuntimeException e) {
            if (queueId != null && BackendFailures.isDuplicateKey(e)) {
                LOG.debugf("Queue item %s inserted concurrently, enqueue ignored", id);
                return id;
            }
            throw BackendFailures.translate(e, "enqueue");
        }
    }

    /**
     * Claims the next item for a worker.
     *
     * @param workerId
     *            claiming worker identity
     * @return the claimed item, now PROCESSING, or empty when nothing is claimable
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public Optional<PipelineQueueItem> dequeue(String workerId) {
        Objects.requireNonNull(workerId, "workerId");
        try {
            Optional<PipelineQueueItem> claimed = QuarkusTransaction.requiringNew().call(() -> claimNext(workerId));
            claimed.ifPresent(item -> LOG.infof("Worker %s claimed item %s (tenant %s, priority %d)", workerId,
                    item.queueId, item.tenantId, item.priority));
            return claimed;
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "dequeue");
        }
    }

    private Optional<PipelineQueueItem> claimNext(String workerId) {
        Instant now = Instant.now();
        List<PipelineQueueItem> candidates = PipelineQueueItem.findClaimCandidates(CLAIM_CANDIDATES);
        // Every lost race means another worker claimed an item, so re-selecting always makes progress
        while (!candidates.isEmpty()) {
            for (PipelineQueueItem candidate : candidates) {
                if (PipelineQueueItem.claim(candidate.queueId, workerId, now) == 1) {
                    // The bulk update bypassed the persistence context
                    PipelineQueueItem.getEntityManager().refresh(candidate);
                    return Optional.of(candidate);
                }
                LOG.debugf("Item %s was claimed by another worker, trying next candidate", candidate.queueId);
            }
            candidates = PipelineQueueItem.findClaimCandidates(CLAIM_CANDIDATES);
        }
        return Optional.empty();
    }

    /**
     * Marks a claimed item COMPLETED. No-op if the item is not PROCESSING.
     *
     * @return true if this call changed the item
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean markCompleted(String queueId) {
        return finish(queueId, QueueStatus.COMPLETED, null);
    }

    /**
     * Marks a claimed item FAILED. No-op if the item is not PROCESSING.
     *
     * @return true if this call changed the item
     */
    @Retry(
            maxRetries = 3,
            delay = 200,
            jitter = 100,
            retryOn = TransientBackendException.class)
    public boolean markFailed(String queueId, String errorMessage) {
        return finish(queueId, QueueStatus.FAILED, truncate(errorMessage));
    }

    private boolean finish(String queueId, QueueStatus terminal, String errorMessage) {
        Objects.requireNonNull(queueId, "queueId");
        try {
            int updated = QuarkusTransaction.requiringNew()
                    .call(() -> PipelineQueueItem.finish(queueId, terminal, errorMessage, Instant.now()));
            if (updated == 0) {
                LOG.debugf("Item %s not PROCESSING, %s transition ignored", queueId, terminal);
                return false;
            }
            LOG.debugf("Item %s marked %s", queueId, terminal);
            return true;
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "mark " + terminal);
        }
    }

    public Optional<PipelineQueueItem> findItem(String queueId) {
        return QuarkusTransaction.requiringNew()
                .call(() -> PipelineQueueItem.<PipelineQueueItem> findByIdOptional(queueId));
    }

    /**
     * @return number of QUEUED items
     */
    public long queueLength() {
        try {
            return QuarkusTransaction.requiringNew().call(() -> PipelineQueueItem.countByStatus(QueueStatus.QUEUED));
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "queue length");
        }
    }

    public QueueStatusSnapshot queueStatus() {
        try {
            return QuarkusTransaction.requiringNew().call(() -> {
                long queued = PipelineQueueItem.countByStatus(QueueStatus.QUEUED);
                long processing = PipelineQueueItem.countByStatus(QueueStatus.PROCESSING);
                List<PipelineQueueItem> recent = PipelineQueueItem
                        .findClaimedSince(Instant.now().minus(STATUS_WINDOW));
                double avgWait = recent.stream()
                        .mapToLong(item -> Duration.between(item.createdAt, item.updatedAt).toMillis()).average()
                        .orElse(0.0) / 1000.0;
                return new QueueStatusSnapshot(queued, processing, avgWait);
            });
        } catch (RuntimeException e) {
            throw BackendFailures.translate(e, "queue status");
        }
    }

    static String truncate(String message) {
        if (message == null || message.length() <= 4000) {
            return message;
        }
        return message.substring(0, 4000);
    }
}
