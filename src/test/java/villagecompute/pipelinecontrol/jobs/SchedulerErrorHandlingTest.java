package villagecompute.pipelinecontrol.jobs;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.jboss.logging.MDC;
import org.junit.jupiter.api.Test;

import villagecompute.pipelinecontrol.exceptions.TransientBackendException;
import villagecompute.pipelinecontrol.services.PipelineWorker;
import villagecompute.pipelinecontrol.services.StaleRunRecoveryService;

/**
 * Scheduled jobs log failures instead of propagating them, and never leave MDC context behind on the scheduler thread.
 */
class SchedulerErrorHandlingTest {

    @Test
    void testQueueWorkerScheduler_PollsWithConfiguredBatchSize() {
        PipelineWorker worker = mock(PipelineWorker.class);
        when(worker.workerId()).thenReturn("worker-1");
        QueueWorkerScheduler scheduler = new QueueWorkerScheduler();
        scheduler.worker = worker;
        scheduler.batchSize = 7;

        scheduler.poll();

        verify(worker).poll("worker-1", 7);
        assertNull(MDC.get("job_origin"));
    }

    @Test
    void testQueueWorkerScheduler_PollFails_Swallowed() {
        PipelineWorker worker = mock(PipelineWorker.class);
        when(worker.workerId()).thenReturn("worker-1");
        when(worker.poll("worker-1", 5)).thenThrow(new TransientBackendException("store down"));
        QueueWorkerScheduler scheduler = new QueueWorkerScheduler();
        scheduler.worker = worker;
        scheduler.batchSize = 5;

        assertDoesNotThrow(scheduler::poll);
        assertNull(MDC.get("job_origin"));
    }

    @Test
    void testStaleRunRecoveryScheduler_SweepFails_Swallowed() {
        StaleRunRecoveryService recoveryService = mock(StaleRunRecoveryService.class);
        when(recoveryService.recover()).thenThrow(new TransientBackendException("store down"));
        StaleRunRecoveryScheduler scheduler = new StaleRunRecoveryScheduler();
        scheduler.recoveryService = recoveryService;

        assertDoesNotThrow(scheduler::recover);
        verify(recoveryService).recover();
    }
}
