package com.nevis.dossier.service;

import com.nevis.dossier.controller.DocumentResponse;
import com.nevis.dossier.exception.DocumentBusyException;
import com.nevis.dossier.exception.EntityNotFoundException;
import com.nevis.dossier.model.Document;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.DocumentStatus;
import com.nevis.dossier.model.RiskLevel;
import com.nevis.dossier.model.Synthesis;
import com.nevis.dossier.repository.DocumentRepository;
import com.nevis.dossier.repository.SynthesisRepository;
import com.nevis.dossier.storage.BlobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DocumentServiceImplTest {

    private final DocumentRepository documentRepository = mock(DocumentRepository.class);
    private final SynthesisRepository synthesisRepository = mock(SynthesisRepository.class);
    private final SynthesesAggregator synthesesAggregator = mock(SynthesesAggregator.class);
    private final BlobStore blobStore = mock(BlobStore.class);

    private final DocumentServiceImpl documentService =
        new DocumentServiceImpl(documentRepository, synthesisRepository, synthesesAggregator, blobStore);

    private final UUID caseId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(documentService, "defaultOutputLanguage", "French");
        when(blobStore.delete(anyString())).thenReturn(true);
        when(documentRepository.deleteById(any())).thenReturn(true);
    }

    @Test
    @DisplayName("Should map a stored document to its response")
    void shouldGetById() {
        Document document = document(DocumentStatus.COMPLETED);
        when(documentRepository.findById(document.id())).thenReturn(Optional.of(document));

        DocumentResponse response = documentService.getById(document.id());

        assertThat(response.id()).isEqualTo(document.id());
        assertThat(response.category()).isEqualTo(DocumentCategory.SERVICE_CHARGES);
        assertThat(response.status()).isEqualTo(DocumentStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should throw when the document does not exist")
    void shouldThrowWhenMissing() {
        UUID id = UUID.randomUUID();
        when(documentRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> documentService.getById(id))
            .isInstanceOf(EntityNotFoundException.class)
            .hasMessageContaining(id.toString());
    }

    @Test
    @DisplayName("Should rebuild overall and category syntheses after deleting a completed document")
    void shouldRegenerateAfterDelete() {
        Document document = document(DocumentStatus.COMPLETED);
        when(documentRepository.findById(document.id())).thenReturn(Optional.of(document));
        when(synthesisRepository.find(caseId, DocumentCategory.SERVICE_CHARGES)).thenReturn(Optional.of(
            new Synthesis(UUID.randomUUID(), caseId, DocumentCategory.SERVICE_CHARGES, "s", RiskLevel.LOW,
                BigDecimal.ZERO, BigDecimal.ZERO, Map.of(), Map.of(), List.of(), List.of(), List.of(), null, 1, null)));

        documentService.delete(document.id(), null);

        verify(blobStore).delete(document.blobKey());
        verify(documentRepository).deleteById(document.id());
        verify(synthesesAggregator).regenerate(caseId, "French");
        verify(synthesesAggregator).regenerate(caseId, DocumentCategory.SERVICE_CHARGES, "French");
    }

    @Test
    @DisplayName("Should skip the category synthesis when none was ever generated")
    void shouldSkipMissingCategorySynthesis() {
        Document document = document(DocumentStatus.COMPLETED);
        when(documentRepository.findById(document.id())).thenReturn(Optional.of(document));
        when(synthesisRepository.find(caseId, DocumentCategory.SERVICE_CHARGES)).thenReturn(Optional.empty());

        documentService.delete(document.id(), "English");

        verify(synthesesAggregator).regenerate(caseId, "English");
        verify(synthesesAggregator, never()).regenerate(any(), any(DocumentCategory.class), anyString());
    }

    @Test
    @DisplayName("Should not touch syntheses when a failed document is deleted")
    void shouldNotRegenerateForFailedDocument() {
        Document document = document(DocumentStatus.FAILED);
        when(documentRepository.findById(document.id())).thenReturn(Optional.of(document));

        documentService.delete(document.id(), null);

        verify(documentRepository).deleteById(document.id());
        verifyNoInteractions(synthesesAggregator);
    }

    @Test
    @DisplayName("Should refuse to delete a document being processed")
    void shouldRefuseBusyDocument() {
        Document document = document(DocumentStatus.PROCESSING);
        when(documentRepository.findById(document.id())).thenReturn(Optional.of(document));

        assertThatThrownBy(() -> documentService.delete(document.id(), null))
            .isInstanceOf(DocumentBusyException.class);
        verify(blobStore, never()).delete(anyString());
        verify(documentRepository, never()).deleteById(any());
    }

    private Document document(DocumentStatus status) {
        UUID id = UUID.randomUUID();
        return new Document(id, caseId, UUID.randomUUID(), 0, "charges.pdf", "cases/" + caseId + "/charges.pdf",
            DocumentCategory.SERVICE_CHARGES, null, null, "Charges 2024", List.of(), new BigDecimal("2400"), null,
            2, true, status, null, null, null, null, null);
    }
}
