package com.nevis.dossier.controller;

import com.nevis.dossier.model.BatchSubmission;
import com.nevis.dossier.model.DocumentUpload;
import com.nevis.dossier.service.BatchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class BatchController {

    private final BatchService batchService;

    @PostMapping("/cases/{caseId}/batches")
    public ResponseEntity<BatchResponse> submitBatch(
        @PathVariable UUID caseId,
        @Valid @RequestBody BatchRequest request) {

        List<DocumentUpload> uploads = request.documents().stream()
            .map(document -> new DocumentUpload(document.documentId(), document.blobKey(), document.filename()))
            .toList();

        BatchSubmission submission = batchService.submit(caseId, uploads, request.outputLanguage());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new BatchResponse(submission.batchId(), submission.documentIds()));
    }

    @GetMapping("/batches/{batchId}")
    public ResponseEntity<BatchStatusResponse> getBatchStatus(@PathVariable UUID batchId) {
        return ResponseEntity.ok(batchService.getStatus(batchId));
    }
}
