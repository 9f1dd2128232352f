package com.nevis.dossier.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.dossier.controller.SynthesisResponse;
import com.nevis.dossier.model.DocumentCategory;

import java.util.Optional;
import java.util.UUID;

/**
 * A {@code null} category addresses the overall synthesis of the case.
 */
public interface SynthesisService {
    SynthesisResponse get(UUID caseId, DocumentCategory category);
    Optional<SynthesisResponse> regenerate(UUID caseId, DocumentCategory category, String outputLanguage);
    SynthesisResponse updateOverrides(UUID caseId, JsonNode patch);
}
