package villagecompute.pipelinecontrol.services;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.pipelinecontrol.TestFixtures;
import villagecompute.pipelinecontrol.data.models.PipelineExecutionLock;
import villagecompute.pipelinecontrol.exceptions.ValidationException;
import villagecompute.pipelinecontrol.services.ExecutionLockManager.LockResult;
import villagecompute.pipelinecontrol.services.LockStore.LockRecord;
import villagecompute.pipelinecontrol.testing.H2TestResource;

/**
 * Mutual exclusion, expiry and release ownership against the database lock store.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class ExecutionLockManagerTest {

    @Inject
    ExecutionLockManager lockManager;

    @BeforeEach
    @Transactional
    void setUp() {
        TestFixtures.deleteAll();
    }

    @Test
    void testAcquire_SecondExecution_DeniedWithHolder() {
        LockResult first = lockManager.acquire("tenant-1", "daily-costs", "exec-a", "worker-1");
        LockResult second = lockManager.acquire("tenant-1", "daily-costs", "exec-b", "worker-2");

        assertTrue(first.granted());
        assertFalse(second.granted());
        assertTrue(second.isDuplicate());
        assertEquals("exec-a", second.existingExecutionId());
        assertFalse(second.backendUnavailable());
    }

    @Test
    void testAcquire_DifferentPipelineOrTenant_Independent() {
        assertTrue(lockManager.acquire("tenant-1", "daily-costs", "exec-a", "worker-1").granted());
        assertTrue(lockManager.acquire("tenant-1", "usage-ingest", "exec-b", "worker-1").granted());
        assertTrue(lockManager.acquire("tenant-2", "daily-costs", "exec-c", "worker-1").granted());
        assertEquals(3, lockManager.activeLocks().size());
    }

    @Test
    void testAcquire_AfterTtlExpiry_NewHolderReplacesLock() throws InterruptedException {
        assertTrue(lockManager.acquire("tenant-1", "daily-costs", "exec-a", "worker-1", Duration.ofSeconds(1))
                .granted());

        Thread.sleep(1500);

        LockResult replacement = lockManager.acquire("tenant-1", "daily-costs", "exec-b", "worker-2");
        assertTrue(replacement.granted(), "Expired lock must be replaceable");
        Optional<LockRecord> status = lockManager.status("tenant-1", "daily-costs");
        assertEquals("exec-b", status.orElseThrow().pipelineLoggingId());
        assertEquals("worker-2", status.get().lockedBy());
        assertFalse(lockManager.release("tenant-1", "daily-costs", "exec-a"), "The expired holder lost ownership");
    }

    @Test
    void testRelease_NotHolder_ReturnsFalseAndKeepsLock() {
        lockManager.acquire("tenant-1", "daily-costs", "exec-a", "worker-1");

        assertFalse(lockManager.release("tenant-1", "daily-costs", "exec-b"));
        assertEquals("exec-a", lockManager.status("tenant-1", "daily-costs").orElseThrow().pipelineLoggingId());
    }

    @Test
    void testRelease_Holder_FreesLock() {
        lockManager.acquire("tenant-1", "daily-costs", "exec-a", "worker-1");

        assertTrue(lockManager.release("tenant-1", "daily-costs", "exec-a"));
        assertTrue(lockManager.status("tenant-1", "daily-costs").isEmpty());
        assertTrue(lockManager.acquire("tenant-1", "daily-costs", "exec-b", "worker-1").granted());
    }

    @Test
    void testRelease_NoLock_ReturnsFalse() {
        assertFalse(lockManager.release("tenant-1", "daily-costs", "exec-a"));
    }

    @Test
    void testStatus_ExpiredLock_DeletedOnRead() throws InterruptedException {
        lockManager.acquire("tenant-1", "daily-costs", "exec-a", "worker-1", Duration.ofSeconds(1));

        Thread.sleep(1500);

        assertTrue(lockManager.status("tenant-1", "daily-costs").isEmpty());
        assertEquals(0L, (long) QuarkusTransaction.requiringNew().call(() -> PipelineExecutionLock.count()));
    }

    @Test
    void testAcquire_TenantIdsContainingSeparator_DoNotCollide() {
        LockResult first = lockManager.acquire("acme:eu", "daily", "exec-a", "worker-1");
        LockResult second = lockManager.acquire("acme", "eu:daily", "exec-b", "worker-2");

        assertTrue(first.granted());
        assertTrue(second.granted(), "Another tenant's pipeline must not share the lock");
        assertEquals("exec-a", lockManager.status("acme:eu", "daily").orElseThrow().pipelineLoggingId());
        assertEquals("exec-b", lockManager.status("acme", "eu:daily").orElseThrow().pipelineLoggingId());
        assertNotEquals(PipelineExecutionLock.lockKey("acme:eu", "daily"),
                PipelineExecutionLock.lockKey("acme", "eu:daily"));
    }

    @Test
    void testDeleteIfExpired_RenewedLock_Survives() {
        lockManager.acquire("tenant-1", "daily-costs", "exec-b", "worker-2");
        String key = PipelineExecutionLock.lockKey("tenant-1", "daily-costs");

        // A reader that saw the previous holder's expired row must not delete the renewed one
        long deleted = QuarkusTransaction.requiringNew()
                .call(() -> PipelineExecutionLock.deleteIfExpired(key, Instant.now()));

        assertEquals(0L, deleted);
        assertEquals("exec-b", lockManager.status("tenant-1", "daily-costs").orElseThrow().pipelineLoggingId());
        assertFalse(lockManager.acquire("tenant-1", "daily-costs", "exec-c", "worker-3").granted());
    }

    @Test
    void testPurgeExpired_RemovesOnlyExpired() throws InterruptedException {
        lockManager.acquire("tenant-1", "short", "exec-a", "worker-1", Duration.ofSeconds(1));
        lockManager.acquire("tenant-1", "long", "exec-b", "worker-1");

        Thread.sleep(1500);

        assertEquals(1, lockManager.purgeExpired());
        assertEquals(1, lockManager.activeLocks().size());
        assertEquals("long", lockManager.activeLocks().get(0).pipelineId());
    }

    @Test
    void testAcquire_InvalidArguments_ValidationException() {
        assertThrows(ValidationException.class, () -> lockManager.acquire("", "daily-costs", "exec-a", "worker-1"));
        assertThrows(ValidationException.class, () -> lockManager.acquire("tenant-1", "daily-costs", null, "w"));
        assertThrows(ValidationException.class,
                () -> lockManager.acquire("tenant-1", "daily-costs", "exec-a", "w", Duration.ZERO));
    }
}
