package com.nevis.dossier.service;

import com.nevis.dossier.config.IngestionProperties;
import com.nevis.dossier.controller.BatchStatusResponse;
import com.nevis.dossier.controller.DocumentStatusItem;
import com.nevis.dossier.controller.SynthesisResponse;
import com.nevis.dossier.event.BatchSubmittedEvent;
import com.nevis.dossier.exception.EntityNotFoundException;
import com.nevis.dossier.exception.InvalidBatchException;
import com.nevis.dossier.model.Batch;
import com.nevis.dossier.model.BatchSubmission;
import com.nevis.dossier.model.Document;
import com.nevis.dossier.model.DocumentStatus;
import com.nevis.dossier.model.DocumentUpload;
import com.nevis.dossier.repository.BatchRepository;
import com.nevis.dossier.repository.DocumentRepository;
import com.nevis.dossier.repository.SynthesisRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@Slf4j
public class BatchServiceImpl implements BatchService {

    private final BatchRepository batchRepository;
    private final DocumentRepository documentRepository;
    private final SynthesisRepository synthesisRepository;
    private final IngestionCoordinator ingestionCoordinator;
    private final ApplicationEventPublisher eventPublisher;
    private final IngestionProperties ingestionProperties;

    @Value("${app.ingestion.default-output-language:French}")
    private String defaultOutputLanguage;

    public BatchServiceImpl(
        BatchRepository batchRepository,
        DocumentRepository documentRepository,
        SynthesisRepository synthesisRepository,
        IngestionCoordinator ingestionCoordinator,
        ApplicationEventPublisher eventPublisher,
        IngestionProperties ingestionProperties
    ) {
        this.batchRepository = batchRepository;
        this.documentRepository = documentRepository;
        this.synthesisRepository = synthesisRepository;
        this.ingestionCoordinator = ingestionCoordinator;
        this.eventPublisher = eventPublisher;
        this.ingestionProperties = ingestionProperties;
    }

    @Override
    @Transactional
    public BatchSubmission submit(UUID caseId, List<DocumentUpload> uploads, String outputLanguage) {
        validate(uploads);
        String language = outputLanguage == null || outputLanguage.isBlank() ? defaultOutputLanguage : outputLanguage;

        Batch batch = batchRepository.save(caseId, language);
        log.debug("Registering batch {} with {} documents for case {}", batch.id(), uploads.size(), caseId);

        List<UUID> documentIds = new ArrayList<>(uploads.size());
        for (int position = 0; position < uploads.size(); position++) {
            DocumentUpload upload = uploads.get(position);
            documentIds.add(register(caseId, batch.id(), position, upload));
        }

        eventPublisher.publishEvent(new BatchSubmittedEvent(batch.id()));
        log.info("Batch {} submitted for case {} ({} documents)", batch.id(), caseId, documentIds.size());
        return new BatchSubmission(batch.id(), List.copyOf(documentIds));
    }

    private UUID register(UUID caseId, UUID batchId, int position, DocumentUpload upload) {
        if (upload.documentId() == null || documentRepository.findById(upload.documentId()).isEmpty()) {
            UUID documentId = upload.documentId() != null ? upload.documentId() : UUID.randomUUID();
            return documentRepository.save(
                Document.pending(documentId, caseId, batchId, position, upload.filename(), upload.blobKey())).id();
        }

        boolean attached = documentRepository.attachToBatch(
            upload.documentId(), caseId, batchId, position, upload.filename(), upload.blobKey());
        if (!attached) {
            throw new InvalidBatchException(
                "Document " + upload.documentId() + " is not pending or belongs to another case");
        }
        return upload.documentId();
    }

    private void validate(List<DocumentUpload> uploads) {
        if (uploads == null || uploads.isEmpty()) {
            throw new InvalidBatchException("Batch must contain at least one document");
        }
        if (uploads.size() > ingestionProperties.maxBatchSize()) {
            throw new InvalidBatchException(String.format(
                "Batch contains %d documents, the maximum is %d", uploads.size(), ingestionProperties.maxBatchSize()));
        }

        Set<UUID> seen = new HashSet<>();
        for (DocumentUpload upload : uploads) {
            if (upload.blobKey() == null || upload.blobKey().isBlank()) {
                throw new InvalidBatchException("Every document needs a blob key");
            }
            if (upload.filename() == null || upload.filename().isBlank()) {
                throw new InvalidBatchException("Every document needs a filename");
            }
            if (upload.documentId() != null && !seen.add(upload.documentId())) {
                throw new InvalidBatchException("Document " + upload.documentId() + " appears twice in the batch");
            }
        }
    }

    @Override
    @Transactional(readOnly = true)
    public BatchStatusResponse getStatus(UUID batchId) {
        Batch batch = batchRepository.findById(batchId)
            .orElseThrow(() -> {
                log.warn("Batch not found with ID: {}", batchId);
                return new EntityNotFoundException("Batch", batchId);
            });

        List<Document> members = documentRepository.findByBatchId(batchId);
        List<DocumentStatus> statuses = members.stream().map(Document::status).toList();

        return new BatchStatusResponse(
            batch.id(),
            batch.caseId(),
            StatusTracker.deriveBatchStatus(statuses),
            ingestionCoordinator.stageOf(batchId).orElse(null),
            StatusTracker.progress(statuses),
            members.stream().map(BatchServiceImpl::toStatusItem).toList(),
            synthesisRepository.find(batch.caseId(), null).map(SynthesisResponse::from).orElse(null)
        );
    }

    private static DocumentStatusItem toStatusItem(Document document) {
        return new DocumentStatusItem(
            document.id(),
            document.filename(),
            document.category(),
            document.subcategory(),
            document.status(),
            document.processingError(),
            document.processingStartedAt(),
            document.processingCompletedAt()
        );
    }
}
