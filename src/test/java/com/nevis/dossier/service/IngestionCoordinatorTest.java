package com.nevis.dossier.service;

import com.nevis.dossier.exception.BlobNotFoundException;
import com.nevis.dossier.exception.BlobStoreUnavailableException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IngestionCoordinatorTest {

    private final BatchRepository batchRepository = mock(BatchRepository.class);
    private final DocumentRepository documentRepository = mock(DocumentRepository.class);
    private final BlobStore blobStore = mock(BlobStore.class);
    private final DocumentPreparer documentPreparer = mock(DocumentPreparer.class);
    private final DocumentClassifier documentClassifier = mock(DocumentClassifier.class);
    private final DocumentExtractor documentExtractor = mock(DocumentExtractor.class);
    private final StatusTracker statusTracker = mock(StatusTracker.class);
    private final SynthesesAggregator synthesesAggregator = mock(SynthesesAggregator.class);

    private IngestionCoordinator coordinator;

    private Batch batch;
    private Document first;
    private Document second;
    private Document third;

    @BeforeEach
    void setUp() {
        Executor direct = Runnable::run;
        coordinator = new IngestionCoordinator(batchRepository, documentRepository, blobStore, documentPreparer,
            documentClassifier, documentExtractor, statusTracker, synthesesAggregator, direct, direct);

        batch = new Batch(UUID.randomUUID(), UUID.randomUUID(), "French", OffsetDateTime.now());
        first = member(0, "pv_ag.pdf");
        second = member(1, "dpe.pdf");
        third = member(2, "tf.pdf");

        when(batchRepository.findById(batch.id())).thenReturn(Optional.of(batch));
        when(documentRepository.findByBatchId(batch.id())).thenReturn(List.of(first, second, third));
        when(documentPreparer.prepare(any())).thenAnswer(invocation -> prepared(invocation.getArgument(0)));
        when(documentClassifier.classify(any())).thenReturn(DocumentCategory.OTHER);
        when(documentExtractor.extract(any(), any(), anyString()))
            .thenReturn(DocumentExtraction.fallback(DocumentCategory.OTHER, "ok"));
    }

    @Test
    @DisplayName("Should isolate a failed download from its siblings")
    void shouldIsolateDownloadFailure() {
        when(blobStore.get(first.blobKey())).thenReturn(new byte[] {1});
        when(blobStore.get(second.blobKey())).thenThrow(new BlobNotFoundException(second.blobKey(), null));
        when(blobStore.get(third.blobKey())).thenReturn(new byte[] {3});

        coordinator.process(batch.id());

        verify(statusTracker).markProcessing(List.of(first.id(), second.id(), third.id()));
        verify(statusTracker).markCompleted(eq(first.id()), any(DocumentAnalysis.class));
        verify(statusTracker).markCompleted(eq(third.id()), any(DocumentAnalysis.class));
        verify(statusTracker).markFailed(eq(second.id()), startsWith("Download failed: Blob not found"));
        verify(statusTracker, never()).markCompleted(eq(second.id()), any());
        verify(statusTracker, never()).failAll(any(), any());
        verify(synthesesAggregator, times(1)).regenerate(batch.caseId(), "French");
        assertThat(coordinator.stageOf(batch.id())).contains(IngestionStage.DONE);
    }

    @Test
    @DisplayName("Should fail only the document whose analysis throws")
    void shouldIsolateAnalysisFailure() {
        when(blobStore.get(anyString())).thenReturn(new byte[] {1});
        when(documentExtractor.extract(argThat(doc -> doc != null && doc.documentId().equals(third.id())), any(), anyString()))
            .thenThrow(new IllegalStateException("unexpected"));

        coordinator.process(batch.id());

        verify(statusTracker).markFailed(third.id(), "Analysis failed: unexpected");
        verify(statusTracker, times(2)).markCompleted(any(), any());
        verify(synthesesAggregator).regenerate(batch.caseId(), "French");
    }

    @Test
    @DisplayName("Should record category and page facts on completion")
    void shouldCompleteWithAnalysis() {
        when(documentRepository.findByBatchId(batch.id())).thenReturn(List.of(first));
        when(blobStore.get(first.blobKey())).thenReturn(new byte[] {1});
        when(documentClassifier.classify(any())).thenReturn(DocumentCategory.ASSEMBLY_MINUTES);
        DocumentExtraction extraction = DocumentExtraction.fallback(DocumentCategory.ASSEMBLY_MINUTES, "AG 2024");
        when(documentExtractor.extract(any(), eq(DocumentCategory.ASSEMBLY_MINUTES), eq("French"))).thenReturn(extraction);

        coordinator.process(batch.id());

        verify(statusTracker).markCompleted(first.id(),
            new DocumentAnalysis(DocumentCategory.ASSEMBLY_MINUTES, extraction, 4, true));
    }

    @Test
    @DisplayName("Should fail the whole batch when the blob store is unreachable for every document")
    void shouldFailBatchWhenStoreUnavailable() {
        when(blobStore.get(anyString()))
            .thenAnswer(invocation -> {
                throw new BlobStoreUnavailableException(invocation.getArgument(0), new RuntimeException("connection refused"));
            });

        coordinator.process(batch.id());

        verify(statusTracker).failAll(List.of(first.id(), second.id(), third.id()),
            "Batch processing failed: Blob store unavailable");
        verify(statusTracker, never()).markFailed(any(), any());
        verifyNoInteractions(documentClassifier, synthesesAggregator);
        assertThat(coordinator.stageOf(batch.id())).contains(IngestionStage.BATCH_FAILED);
    }

    @Test
    @DisplayName("Should mark each document failed when downloads fail for different reasons")
    void shouldNotEscalateMixedDownloadFailures() {
        when(blobStore.get(first.blobKey()))
            .thenThrow(new BlobStoreUnavailableException(first.blobKey(), new RuntimeException("timeout")));
        when(blobStore.get(second.blobKey())).thenThrow(new BlobNotFoundException(second.blobKey(), null));
        when(blobStore.get(third.blobKey())).thenThrow(new BlobNotFoundException(third.blobKey(), null));

        coordinator.process(batch.id());

        verify(statusTracker, times(3)).markFailed(any(), startsWith("Download failed: "));
        verify(statusTracker, never()).failAll(any(), any());
        verify(synthesesAggregator).regenerate(batch.caseId(), "French");
    }

    @Test
    @DisplayName("Should fail the batch when the record store breaks mid-analysis")
    void shouldFailBatchOnDataAccessError() {
        when(blobStore.get(anyString())).thenReturn(new byte[] {1});
        when(statusTracker.markCompleted(any(), any()))
            .thenThrow(new DataAccessResourceFailureException("connection lost"));

        coordinator.process(batch.id());

        verify(statusTracker).failAll(eq(List.of(first.id(), second.id(), third.id())),
            startsWith("Batch processing failed: "));
        verify(synthesesAggregator, never()).regenerate(any(), anyString());
        assertThat(coordinator.stageOf(batch.id())).contains(IngestionStage.BATCH_FAILED);
    }

    @Test
    @DisplayName("Should not throw when even failing the batch is impossible")
    void shouldSwallowFailAllErrors() {
        when(documentRepository.findByBatchId(batch.id()))
            .thenThrow(new DataAccessResourceFailureException("database down"));
        when(statusTracker.failAll(any(), any())).thenThrow(new DataAccessResourceFailureException("database down"));

        coordinator.process(batch.id());

        assertThat(coordinator.stageOf(batch.id())).contains(IngestionStage.BATCH_FAILED);
    }

    @Test
    @DisplayName("Should mark the batch failed when it does not exist")
    void shouldHandleMissingBatch() {
        UUID unknown = UUID.randomUUID();
        when(batchRepository.findById(unknown)).thenReturn(Optional.empty());

        coordinator.process(unknown);

        verify(statusTracker).failAll(eq(List.of()), startsWith("Batch processing failed: "));
        assertThat(coordinator.stageOf(unknown)).contains(IngestionStage.BATCH_FAILED);
    }

    @Test
    @DisplayName("Should persist each document as it finishes and synthesize after all have settled")
    void shouldPersistEachDocumentBeforeSiblingsFinishOnRealThreads() throws Exception {
        ExecutorService documentPool = Executors.newFixedThreadPool(3);
        ExecutorService preparationPool = Executors.newFixedThreadPool(2);
        try {
            IngestionCoordinator concurrent = new IngestionCoordinator(batchRepository, documentRepository, blobStore,
                documentPreparer, documentClassifier, documentExtractor, statusTracker, synthesesAggregator,
                documentPool, preparationPool);

            when(blobStore.get(first.blobKey())).thenReturn(new byte[] {1});
            when(blobStore.get(second.blobKey())).thenThrow(new BlobNotFoundException(second.blobKey(), null));
            when(blobStore.get(third.blobKey())).thenReturn(new byte[] {3});

            CountDownLatch firstPersisted = new CountDownLatch(1);
            AtomicBoolean thirdSawFirstPersisted = new AtomicBoolean();
            when(statusTracker.markCompleted(eq(first.id()), any())).thenAnswer(invocation -> {
                firstPersisted.countDown();
                return true;
            });
            when(documentExtractor.extract(argThat(doc -> doc != null && doc.documentId().equals(third.id())), any(), anyString()))
                .thenAnswer(invocation -> {
                    thirdSawFirstPersisted.set(firstPersisted.await(5, TimeUnit.SECONDS));
                    return DocumentExtraction.fallback(DocumentCategory.OTHER, "late");
                });

            concurrent.process(batch.id());

            assertThat(thirdSawFirstPersisted).isTrue();
            assertThat(concurrent.stageOf(batch.id())).contains(IngestionStage.DONE);
            verify(statusTracker).markFailed(eq(second.id()), startsWith("Download failed"));

            InOrder order = inOrder(statusTracker, synthesesAggregator);
            order.verify(statusTracker).markCompleted(eq(first.id()), any());
            order.verify(statusTracker).markCompleted(eq(third.id()), any());
            order.verify(synthesesAggregator).regenerate(batch.caseId(), "French");
        } finally {
            documentPool.shutdownNow();
            preparationPool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should fail every member of a batch that was never started")
    void shouldRejectBatch() {
        coordinator.reject(batch.id(), "Ingestion queue is full");

        verify(statusTracker).failAll(List.of(first.id(), second.id(), third.id()),
            "Batch processing failed: Ingestion queue is full");
        verifyNoInteractions(blobStore, synthesesAggregator);
        assertThat(coordinator.stageOf(batch.id())).contains(IngestionStage.BATCH_FAILED);
    }

    @Test
    @DisplayName("Should report no stage for batches it never ran")
    void shouldReportUnknownStage() {
        assertThat(coordinator.stageOf(UUID.randomUUID())).isEmpty();
    }

    private Document member(int position, String filename) {
        return Document.pending(UUID.randomUUID(), batch.caseId(), batch.id(), position, filename,
            "cases/" + batch.caseId() + "/" + filename);
    }

    private static PreparedDocument prepared(DocumentDownload download) {
        return new PreparedDocument(download.documentId(), download.filename(), "application/pdf",
            download.content(), "text", 4, true);
    }
}
