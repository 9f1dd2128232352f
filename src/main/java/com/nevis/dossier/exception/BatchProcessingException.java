package com.nevis.dossier.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Failure outside the per-document isolation boundary; aborts the whole batch.
 */
@Getter
public class BatchProcessingException extends RuntimeException {
    private final UUID batchId;

    public BatchProcessingException(UUID batchId, String message, Throwable cause) {
        super(message, cause);
        this.batchId = batchId;
    }
}
