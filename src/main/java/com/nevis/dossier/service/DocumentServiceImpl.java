package com.nevis.dossier.service;

import com.nevis.dossier.controller.DocumentResponse;
import com.nevis.dossier.exception.DocumentBusyException;
import com.nevis.dossier.exception.EntityNotFoundException;
import com.nevis.dossier.model.Document;
import com.nevis.dossier.model.DocumentStatus;
import com.nevis.dossier.repository.DocumentRepository;
import com.nevis.dossier.repository.SynthesisRepository;
import com.nevis.dossier.storage.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

    private final DocumentRepository documentRepository;
    private final SynthesisRepository synthesisRepository;
    private final SynthesesAggregator synthesesAggregator;
    private final BlobStore blobStore;

    @Value("${app.ingestion.default-output-language:French}")
    private String defaultOutputLanguage;

    public DocumentServiceImpl(
        DocumentRepository documentRepository,
        SynthesisRepository synthesisRepository,
        SynthesesAggregator synthesesAggregator,
        BlobStore blobStore
    ) {
        this.documentRepository = documentRepository;
        this.synthesisRepository = synthesisRepository;
        this.synthesesAggregator = synthesesAggregator;
        this.blobStore = blobStore;
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentResponse getById(UUID id) {
        log.debug("Fetching document by ID: {}", id);

        return documentRepository.findById(id)
            .map(this::mapToResponse)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", id);
                return new EntityNotFoundException("Document", id);
            });
    }

    /**
     * Removes the blob and the row, then rebuilds the syntheses the document contributed to.
     */
    @Override
    public void delete(UUID id, String outputLanguage) {
        Document document = documentRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Document", id));

        if (document.status() == DocumentStatus.PROCESSING) {
            throw new DocumentBusyException(id);
        }

        if (!blobStore.delete(document.blobKey())) {
            log.warn("Doc {}: blob {} was already missing", id, document.blobKey());
        }
        if (!documentRepository.deleteById(id)) {
            log.warn("Doc {}: row already deleted", id);
            return;
        }
        log.info("Doc {}: deleted from case {}", id, document.caseId());

        if (document.status() != DocumentStatus.COMPLETED) {
            return;
        }

        String language = outputLanguage == null || outputLanguage.isBlank() ? defaultOutputLanguage : outputLanguage;
        synthesesAggregator.regenerate(document.caseId(), language);
        if (synthesisRepository.find(document.caseId(), document.category()).isPresent()) {
            synthesesAggregator.regenerate(document.caseId(), document.category(), language);
        }
    }

    private DocumentResponse mapToResponse(Document doc) {
        return new DocumentResponse(
            doc.id(),
            doc.caseId(),
            doc.batchId(),
            doc.filename(),
            doc.category(),
            doc.subcategory(),
            doc.status(),
            doc.summary(),
            doc.keyInsights(),
            doc.estimatedAnnualCost(),
            doc.oneTimeCost(),
            doc.pageCount(),
            doc.textExtractable(),
            doc.extraction(),
            doc.processingError(),
            doc.createdAt(),
            doc.updatedAt()
        );
    }
}
