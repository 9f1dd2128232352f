package com.nevis.dossier.controller;

import com.nevis.dossier.exception.EntityNotFoundException;
import com.nevis.dossier.exception.InvalidBatchException;
import com.nevis.dossier.model.BatchProgress;
import com.nevis.dossier.model.BatchStatus;
import com.nevis.dossier.model.BatchSubmission;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.DocumentStatus;
import com.nevis.dossier.model.DocumentUpload;
import com.nevis.dossier.model.IngestionStage;
import com.nevis.dossier.service.BatchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BatchController.class)
class BatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BatchService batchService;

    @Test
    @DisplayName("POST /cases/{id}/batches should accept the batch and return 202")
    void submitBatch_ShouldReturn202() throws Exception {
        UUID caseId = UUID.randomUUID();
        UUID batchId = UUID.randomUUID();
        UUID existing = UUID.randomUUID();
        UUID assigned = UUID.randomUUID();
        when(batchService.submit(eq(caseId), anyList(), eq("English")))
            .thenReturn(new BatchSubmission(batchId, List.of(existing, assigned)));

        mockMvc.perform(post("/cases/{caseId}/batches", caseId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"output_language": "English",
                     "documents": [
                       {"document_id": "%s", "blob_key": "cases/1/pv.pdf", "filename": "pv.pdf"},
                       {"blob_key": "cases/1/dpe.pdf", "filename": "dpe.pdf"}
                     ]}
                    """.formatted(existing)))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.batch_id").value(batchId.toString()))
            .andExpect(jsonPath("$.document_ids.length()").value(2));

        ArgumentCaptor<List<DocumentUpload>> uploads = ArgumentCaptor.forClass(List.class);
        verify(batchService).submit(eq(caseId), uploads.capture(), eq("English"));
        assertThat(uploads.getValue()).containsExactly(
            new DocumentUpload(existing, "cases/1/pv.pdf", "pv.pdf"),
            new DocumentUpload(null, "cases/1/dpe.pdf", "dpe.pdf"));
    }

    @Test
    @DisplayName("POST /cases/{id}/batches should return 400 for a document without blob key")
    void submitBatch_ShouldReturn400_WhenBlobKeyMissing() throws Exception {
        mockMvc.perform(post("/cases/{caseId}/batches", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": [{\"filename\": \"pv.pdf\"}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(batchService);
    }

    @Test
    @DisplayName("POST /cases/{id}/batches should return 400 for an empty batch")
    void submitBatch_ShouldReturn400_WhenEmpty() throws Exception {
        mockMvc.perform(post("/cases/{caseId}/batches", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Field 'documents' must not be empty"));
    }

    @Test
    @DisplayName("POST /cases/{id}/batches should surface batch validation errors as 400")
    void submitBatch_ShouldReturn400_WhenServiceRejects() throws Exception {
        when(batchService.submit(any(), anyList(), any()))
            .thenThrow(new InvalidBatchException("Batch contains 60 documents, the maximum is 50"));

        mockMvc.perform(post("/cases/{caseId}/batches", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": [{\"blob_key\": \"k\", \"filename\": \"a.pdf\"}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Batch contains 60 documents, the maximum is 50"));
    }

    @Test
    @DisplayName("GET /batches/{id} should return aggregated status")
    void getBatchStatus_ShouldReturnStatus() throws Exception {
        UUID batchId = UUID.randomUUID();
        UUID documentId = UUID.randomUUID();
        BatchStatusResponse response = new BatchStatusResponse(
            batchId, UUID.randomUUID(), BatchStatus.PROCESSING, IngestionStage.ANALYZING,
            new BatchProgress(2, 1, 0, 1, 0, 50),
            List.of(new DocumentStatusItem(documentId, "pv.pdf", DocumentCategory.ASSEMBLY_MINUTES, null,
                DocumentStatus.COMPLETED, null, null, null)),
            null);
        when(batchService.getStatus(batchId)).thenReturn(response);

        mockMvc.perform(get("/batches/{batchId}", batchId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PROCESSING"))
            .andExpect(jsonPath("$.stage").value("ANALYZING"))
            .andExpect(jsonPath("$.progress.percentage").value(50))
            .andExpect(jsonPath("$.documents[0].category").value("pv_ag"));
    }

    @Test
    @DisplayName("GET /batches/{id} should return 404 when the batch does not exist")
    void getBatchStatus_ShouldReturn404() throws Exception {
        UUID batchId = UUID.randomUUID();
        when(batchService.getStatus(batchId)).thenThrow(new EntityNotFoundException("Batch", batchId));

        mockMvc.perform(get("/batches/{batchId}", batchId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Batch not found: " + batchId));
    }
}
