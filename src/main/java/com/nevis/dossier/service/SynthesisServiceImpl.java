package com.nevis.dossier.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.dossier.controller.SynthesisResponse;
import com.nevis.dossier.exception.EntityNotFoundException;
import com.nevis.dossier.exception.InvalidOverridesException;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.Synthesis;
import com.nevis.dossier.repository.SynthesisRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class SynthesisServiceImpl implements SynthesisService {

    private final SynthesisRepository synthesisRepository;
    private final SynthesesAggregator synthesesAggregator;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public SynthesisResponse get(UUID caseId, DocumentCategory category) {
        return synthesisRepository.find(caseId, category)
            .map(SynthesisResponse::from)
            .orElseThrow(() -> notFound(caseId, category));
    }

    @Override
    public Optional<SynthesisResponse> regenerate(UUID caseId, DocumentCategory category, String outputLanguage) {
        return synthesesAggregator.regenerate(caseId, category, outputLanguage)
            .map(SynthesisResponse::from);
    }

    @Override
    @Transactional
    public SynthesisResponse updateOverrides(UUID caseId, JsonNode patch) {
        if (patch == null || !patch.isObject()) {
            throw new InvalidOverridesException("Overrides must be a JSON object");
        }

        Synthesis synthesis = synthesisRepository.findForUpdate(caseId, null)
            .orElseThrow(() -> notFound(caseId, null));

        ObjectNode merged = currentOverrides(synthesis);
        merged.setAll((ObjectNode) patch);

        String overrides;
        try {
            overrides = objectMapper.writeValueAsString(merged);
        } catch (JsonProcessingException e) {
            throw new InvalidOverridesException("Overrides cannot be serialized: " + e.getOriginalMessage());
        }

        synthesisRepository.updateOverrides(caseId, null, overrides);
        log.info("Case {}: updated synthesis overrides ({} keys patched)", caseId, patch.size());
        return SynthesisResponse.from(synthesis.withOverrides(overrides));
    }

    private ObjectNode currentOverrides(Synthesis synthesis) {
        if (synthesis.overridesJson() == null || synthesis.overridesJson().isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode current = objectMapper.readTree(synthesis.overridesJson());
            if (current instanceof ObjectNode object) {
                return object;
            }
            log.warn("Case {}: stored overrides are not an object, replacing them", synthesis.caseId());
            return objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            log.warn("Case {}: stored overrides are not valid JSON, replacing them", synthesis.caseId());
            return objectMapper.createObjectNode();
        }
    }

    private static EntityNotFoundException notFound(UUID caseId, DocumentCategory category) {
        String scope = category == null ? "Synthesis" : "Synthesis (" + category.label() + ")";
        return new EntityNotFoundException(scope + " for case", caseId);
    }
}
