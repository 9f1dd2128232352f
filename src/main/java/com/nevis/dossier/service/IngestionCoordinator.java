package com.nevis.dossier.service;

import com.nevis.dossier.exception.BatchProcessingException;
import com.nevis.dossier.exception.BlobStoreUnavailableException;
import com.nevis.dossier.exception.EntityNotFoundException;
import com.nevis.dossier.model.Batch;
import com.nevis.dossier.model.Document;
import com.nevis.dossier.model.DocumentAnalysis;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.DocumentDownload;
import com.nevis.dossier.model.IngestionStage;
import com.nevis.dossier.model.PreparedDocument;
import com.nevis.dossier.model.extraction.DocumentExtraction;
import com.nevis.dossier.repository.BatchRepository;
import com.nevis.dossier.repository.DocumentRepository;
import com.nevis.dossier.storage.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one batch through download, preparation, analysis and synthesis.
 * <p>
 * Failures of a single document only fail that document. Failures outside that boundary (record
 * store errors, missing batch, blob store completely unreachable) fail every member that is not
 * terminal yet. Nothing is thrown to the caller.
 */
@Service
@Slf4j
public class IngestionCoordinator {

    private static final int TRACKED_BATCHES = 1_000;

    private final BatchRepository batchRepository;
    private final DocumentRepository documentRepository;
    private final BlobStore blobStore;
    private final DocumentPreparer documentPreparer;
    private final DocumentClassifier documentClassifier;
    private final DocumentExtractor documentExtractor;
    private final StatusTracker statusTracker;
    private final SynthesesAggregator synthesesAggregator;
    private final Executor documentTaskExecutor;
    private final Executor preparationExecutor;

    private final Map<UUID, IngestionStage> stages = Collections.synchronizedMap(
        new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<UUID, IngestionStage> eldest) {
                return size() > TRACKED_BATCHES;
            }
        });

    public IngestionCoordinator(
        BatchRepository batchRepository,
        DocumentRepository documentRepository,
        BlobStore blobStore,
        DocumentPreparer documentPreparer,
        DocumentClassifier documentClassifier,
        DocumentExtractor documentExtractor,
        StatusTracker statusTracker,
        SynthesesAggregator synthesesAggregator,
        @Qualifier("documentTaskExecutor") Executor documentTaskExecutor,
        @Qualifier("preparationExecutor") Executor preparationExecutor
    ) {
        this.batchRepository = batchRepository;
        this.documentRepository = documentRepository;
        this.blobStore = blobStore;
        this.documentPreparer = documentPreparer;
        this.documentClassifier = documentClassifier;
        this.documentExtractor = documentExtractor;
        this.statusTracker = statusTracker;
        this.synthesesAggregator = synthesesAggregator;
        this.documentTaskExecutor = documentTaskExecutor;
        this.preparationExecutor = preparationExecutor;
    }

    /**
     * Stage of a batch run by this instance, empty when unknown (for example after a restart).
     */
    public Optional<IngestionStage> stageOf(UUID batchId) {
        return Optional.ofNullable(stages.get(batchId));
    }

    public void process(UUID batchId) {
        stages.put(batchId, IngestionStage.SUBMITTED);
        List<UUID> memberIds = new ArrayList<>();

        try {
            Batch batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new EntityNotFoundException("Batch", batchId));
            List<Document> members = documentRepository.findByBatchId(batchId);
            members.forEach(member -> memberIds.add(member.id()));

            log.info("Batch {}: starting ingestion of {} documents for case {}", batchId, members.size(), batch.caseId());
            statusTracker.markProcessing(memberIds);

            advance(batchId, IngestionStage.DOWNLOADING);
            List<DocumentDownload> downloads = download(batchId, members);

            advance(batchId, IngestionStage.PREPARING);
            List<PreparedDocument> prepared = prepare(downloads);

            advance(batchId, IngestionStage.ANALYZING);
            analyze(batch, prepared);

            advance(batchId, IngestionStage.SYNTHESIZING);
            synthesesAggregator.regenerate(batch.caseId(), batch.outputLanguage());

            advance(batchId, IngestionStage.DONE);
            log.info("Batch {}: ingestion finished", batchId);
        } catch (Exception e) {
            failBatch(batchId, memberIds, e);
        }
    }

    /**
     * Fails a batch that never got a coordinator run, for example because the batch queue was full.
     * Runs in its own transaction since it is called from an after-commit callback.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void reject(UUID batchId, String reason) {
        List<UUID> memberIds = documentRepository.findByBatchId(batchId).stream()
            .map(Document::id)
            .toList();
        log.error("Batch {}: not started, failing {} documents: {}", batchId, memberIds.size(), reason);
        advance(batchId, IngestionStage.BATCH_FAILED);
        statusTracker.failAll(memberIds, "Batch processing failed: " + reason);
    }

    private List<DocumentDownload> download(UUID batchId, List<Document> members) {
        List<CompletableFuture<DocumentDownload>> futures = members.stream()
            .map(member -> CompletableFuture.supplyAsync(
                () -> new DocumentDownload(member.id(), member.filename(), blobStore.get(member.blobKey())),
                documentTaskExecutor))
            .toList();

        List<DocumentDownload> downloads = new ArrayList<>();
        Map<UUID, Throwable> failures = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            try {
                downloads.add(futures.get(i).join());
            } catch (CompletionException e) {
                failures.put(members.get(i).id(), unwrap(e));
            }
        }

        if (!members.isEmpty() && downloads.isEmpty()
            && failures.values().stream().allMatch(BlobStoreUnavailableException.class::isInstance)) {
            throw new BatchProcessingException(batchId, "Blob store unavailable",
                failures.values().iterator().next());
        }

        failures.forEach((documentId, error) -> {
            log.warn("Doc {}: download failed: {}", documentId, error.getMessage());
            statusTracker.markFailed(documentId, "Download failed: " + error.getMessage());
        });
        return downloads;
    }

    private List<PreparedDocument> prepare(List<DocumentDownload> downloads) {
        List<CompletableFuture<PreparedDocument>> futures = downloads.stream()
            .map(download -> CompletableFuture.supplyAsync(() -> documentPreparer.prepare(download), preparationExecutor))
            .toList();

        List<PreparedDocument> prepared = new ArrayList<>();
        for (int i = 0; i < downloads.size(); i++) {
            try {
                prepared.add(futures.get(i).join());
            } catch (CompletionException e) {
                UUID documentId = downloads.get(i).documentId();
                Throwable cause = unwrap(e);
                log.warn("Doc {}: preparation failed: {}", documentId, cause.getMessage());
                statusTracker.markFailed(documentId, "Preparation failed: " + cause.getMessage());
            }
        }
        return prepared;
    }

    private void analyze(Batch batch, List<PreparedDocument> prepared) {
        CompletableFuture<?>[] tasks = prepared.stream()
            .map(document -> CompletableFuture.runAsync(() -> analyzeOne(batch, document), documentTaskExecutor))
            .toArray(CompletableFuture[]::new);

        try {
            CompletableFuture.allOf(tasks).join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BatchProcessingException(batch.id(), cause.getMessage(), cause);
        }
    }

    private void analyzeOne(Batch batch, PreparedDocument document) {
        try {
            DocumentCategory category = documentClassifier.classify(document);
            DocumentExtraction extraction = documentExtractor.extract(document, category, batch.outputLanguage());
            statusTracker.markCompleted(document.documentId(),
                new DocumentAnalysis(category, extraction, document.pageCount(), document.textExtractable()));
        } catch (DataAccessException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Doc {}: analysis failed: {}", document.documentId(), e.getMessage());
            statusTracker.markFailed(document.documentId(), "Analysis failed: " + e.getMessage());
        }
    }

    private void failBatch(UUID batchId, List<UUID> memberIds, Exception cause) {
        log.error("Batch {}: ingestion aborted: {}", batchId, cause.getMessage(), cause);
        advance(batchId, IngestionStage.BATCH_FAILED);
        try {
            statusTracker.failAll(memberIds, "Batch processing failed: " + cause.getMessage());
        } catch (DataAccessException e) {
            log.error("Batch {}: could not mark members FAILED, the stale sweeper will: {}", batchId, e.getMessage(), e);
        }
    }

    private void advance(UUID batchId, IngestionStage next) {
        IngestionStage current = stages.get(batchId);
        if (current != null && !current.canAdvanceTo(next)) {
            log.warn("Batch {}: ignoring stage change {} -> {}", batchId, current, next);
            return;
        }
        stages.put(batchId, next);
        log.debug("Batch {}: stage {}", batchId, next);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
