package com.nevis.dossier.repository;

import com.nevis.dossier.model.Document;
import com.nevis.dossier.model.DocumentAnalysis;
import com.nevis.dossier.model.DocumentCategory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Status-changing methods only apply forward transitions and report whether the row actually moved.
 */
public interface DocumentRepository {
    Document save(Document document);
    Optional<Document> findById(UUID id);
    List<Document> findByBatchId(UUID batchId);
    List<Document> findCompletedByCaseId(UUID caseId);
    List<Document> findCompletedByCaseIdAndCategory(UUID caseId, DocumentCategory category);
    boolean attachToBatch(UUID documentId, UUID caseId, UUID batchId, int position, String filename, String blobKey);
    int markProcessing(Collection<UUID> ids);
    boolean markCompleted(UUID id, DocumentAnalysis analysis);
    boolean markFailed(UUID id, String error);
    int markAllFailed(Collection<UUID> ids, String error);
    List<UUID> failStaleProcessing(int staleThresholdMinutes, String error);
    List<UUID> failStalePending(int staleThresholdMinutes, String error);
    boolean deleteById(UUID id);
}
