package com.nevis.dossier.listener;

import com.nevis.dossier.event.BatchSubmittedEvent;
import com.nevis.dossier.service.IngestionCoordinator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.util.UUID;
import java.util.concurrent.Executor;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BatchEventListenerTest {

    private final IngestionCoordinator ingestionCoordinator = mock(IngestionCoordinator.class);

    @Test
    @DisplayName("Should run the coordinator on the batch executor")
    void shouldHandOffBatch() {
        UUID batchId = UUID.randomUUID();
        BatchEventListener listener = new BatchEventListener(ingestionCoordinator, Runnable::run);

        listener.handleBatchSubmitted(new BatchSubmittedEvent(batchId));

        verify(ingestionCoordinator).process(batchId);
        verify(ingestionCoordinator, never()).reject(any(), anyString());
    }

    @Test
    @DisplayName("Should fail the batch when the executor refuses it")
    void shouldRejectBatchWhenQueueIsFull() {
        UUID batchId = UUID.randomUUID();
        Executor saturated = task -> {
            throw new TaskRejectedException("Executor did not accept task");
        };
        BatchEventListener listener = new BatchEventListener(ingestionCoordinator, saturated);

        listener.handleBatchSubmitted(new BatchSubmittedEvent(batchId));

        verify(ingestionCoordinator).reject(batchId, BatchEventListener.QUEUE_FULL);
        verify(ingestionCoordinator, never()).process(any());
    }
}
