package com.nevis.dossier.service;

import com.nevis.dossier.controller.BatchStatusResponse;
import com.nevis.dossier.model.BatchSubmission;
import com.nevis.dossier.model.DocumentUpload;

import java.util.List;
import java.util.UUID;

public interface BatchService {
    BatchSubmission submit(UUID caseId, List<DocumentUpload> uploads, String outputLanguage);
    BatchStatusResponse getStatus(UUID batchId);
}
