package com.nevis.dossier.service;

import com.nevis.dossier.model.BatchProgress;
import com.nevis.dossier.model.BatchStatus;
import com.nevis.dossier.model.DocumentAnalysis;
import com.nevis.dossier.model.DocumentStatus;
import com.nevis.dossier.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Owns every status change of a document. Transitions the store refuses are reported, never forced.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StatusTracker {

    private final DocumentRepository documentRepository;

    public int markProcessing(Collection<UUID> documentIds) {
        int moved = documentRepository.markProcessing(documentIds);
        if (moved < documentIds.size()) {
            log.warn("Only {} of {} documents moved to PROCESSING, the rest were not PENDING",
                moved, documentIds.size());
        }
        return moved;
    }

    public boolean markCompleted(UUID documentId, DocumentAnalysis analysis) {
        boolean moved = documentRepository.markCompleted(documentId, analysis);
        if (moved) {
            log.info("Doc {}: COMPLETED as {}", documentId, analysis.category().label());
        } else {
            log.warn("Doc {}: refused transition to COMPLETED, document is not PROCESSING", documentId);
        }
        return moved;
    }

    public boolean markFailed(UUID documentId, String error) {
        boolean moved = documentRepository.markFailed(documentId, error);
        if (moved) {
            log.info("Doc {}: FAILED ({})", documentId, error);
        } else {
            log.warn("Doc {}: refused transition to FAILED, document is already terminal", documentId);
        }
        return moved;
    }

    public int failAll(Collection<UUID> documentIds, String error) {
        int moved = documentRepository.markAllFailed(documentIds, error);
        log.info("Marked {} of {} documents FAILED: {}", moved, documentIds.size(), error);
        return moved;
    }

    public static BatchStatus deriveBatchStatus(Collection<DocumentStatus> statuses) {
        if (statuses.isEmpty()) {
            return BatchStatus.UNKNOWN;
        }
        Map<DocumentStatus, Long> counts = count(statuses);
        long total = statuses.size();
        if (counts.get(DocumentStatus.COMPLETED) == total) {
            return BatchStatus.COMPLETED;
        }
        if (counts.get(DocumentStatus.FAILED) == total) {
            return BatchStatus.FAILED;
        }
        if (counts.get(DocumentStatus.PENDING) > 0 || counts.get(DocumentStatus.PROCESSING) > 0) {
            return BatchStatus.PROCESSING;
        }
        return BatchStatus.UNKNOWN;
    }

    public static BatchProgress progress(Collection<DocumentStatus> statuses) {
        Map<DocumentStatus, Long> counts = count(statuses);
        int total = statuses.size();
        int completed = counts.get(DocumentStatus.COMPLETED).intValue();
        int percentage = total == 0 ? 0 : (int) ((long) completed * 100 / total);
        return new BatchProgress(
            total,
            completed,
            counts.get(DocumentStatus.FAILED).intValue(),
            counts.get(DocumentStatus.PROCESSING).intValue(),
            counts.get(DocumentStatus.PENDING).intValue(),
            percentage
        );
    }

    private static Map<DocumentStatus, Long> count(Collection<DocumentStatus> statuses) {
        Map<DocumentStatus, Long> counts = new EnumMap<>(DocumentStatus.class);
        for (DocumentStatus status : DocumentStatus.values()) {
            counts.put(status, 0L);
        }
        statuses.forEach(status -> counts.merge(status, 1L, Long::sum));
        return counts;
    }
}
