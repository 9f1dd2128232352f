package com.nevis.dossier.listener;

import com.nevis.dossier.event.BatchSubmittedEvent;
import com.nevis.dossier.service.IngestionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.Executor;

/**
 * Hands a committed batch to the coordinator on {@code batchTaskExecutor}. A batch the executor
 * refuses is failed right away so its documents do not stay PENDING.
 */
@Component
@Slf4j
public class BatchEventListener {

    static final String QUEUE_FULL = "Ingestion queue is full";

    private final IngestionCoordinator ingestionCoordinator;
    private final Executor batchTaskExecutor;

    public BatchEventListener(
        IngestionCoordinator ingestionCoordinator,
        @Qualifier("batchTaskExecutor") Executor batchTaskExecutor
    ) {
        this.ingestionCoordinator = ingestionCoordinator;
        this.batchTaskExecutor = batchTaskExecutor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleBatchSubmitted(BatchSubmittedEvent event) {
        try {
            batchTaskExecutor.execute(() -> {
                log.info("Starting async ingestion for batch: {}", event.batchId());
                ingestionCoordinator.process(event.batchId());
            });
        } catch (TaskRejectedException e) {
            log.warn("Batch {}: rejected by batch executor: {}", event.batchId(), e.getMessage());
            ingestionCoordinator.reject(event.batchId(), QUEUE_FULL);
        }
    }
}
