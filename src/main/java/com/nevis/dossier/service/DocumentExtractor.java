package com.nevis.dossier.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.dossier.inference.InferenceClient;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.PreparedDocument;
import com.nevis.dossier.model.extraction.DocumentExtraction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentExtractor {

    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper;

    @Value("${app.extraction.max-tokens:8192}")
    private int maxTokens;

    /**
     * Never throws: transport errors, empty answers and unparseable JSON all produce
     * {@link DocumentExtraction#fallback}.
     */
    public DocumentExtraction extract(PreparedDocument document, DocumentCategory category, String outputLanguage) {
        String response;
        try {
            response = inferenceClient.infer(
                DocumentClassifier.contentOf(document),
                PromptTemplates.extraction(category, document.filename(), outputLanguage),
                maxTokens,
                true
            );
        } catch (Exception e) {
            log.warn("Doc {}: extraction call failed: {}", document.documentId(), e.getMessage());
            return fallback(document, category);
        }

        if (response == null || response.isBlank()) {
            log.warn("Doc {}: extraction returned an empty response", document.documentId());
            return fallback(document, category);
        }

        String repaired = ResponseRepairer.repair(response);
        try {
            JsonNode root = objectMapper.readTree(repaired);
            DocumentExtraction extraction = ExtractionParser.parse(category, root);
            log.info("Doc {}: extracted {} fields", document.documentId(), category.label());
            return extraction;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Doc {}: extraction output unusable after repair: {}", document.documentId(), e.getMessage());
            log.debug("Doc {}: raw extraction output: {}", document.documentId(), abbreviate(response));
            return fallback(document, category);
        }
    }

    private static DocumentExtraction fallback(PreparedDocument document, DocumentCategory category) {
        return DocumentExtraction.fallback(category, "Error processing " + document.filename());
    }

    private static String abbreviate(String value) {
        return value.length() > 500 ? value.substring(0, 500) + "..." : value;
    }
}
