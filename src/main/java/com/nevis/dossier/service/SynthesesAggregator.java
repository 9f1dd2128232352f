package com.nevis.dossier.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.dossier.inference.InferenceClient;
import com.nevis.dossier.inference.InferenceContent;
import com.nevis.dossier.model.Document;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.Synthesis;
import com.nevis.dossier.repository.DocumentRepository;
import com.nevis.dossier.repository.SynthesisRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Rebuilds the cross-document synthesis of a case from every completed document, not only the
 * latest batch. User overrides on an existing row are carried over untouched.
 */
@Service
@Slf4j
public class SynthesesAggregator {

    private final DocumentRepository documentRepository;
    private final SynthesisRepository synthesisRepository;
    private final InferenceClient inferenceClient;
    private final ObjectMapper objectMapper;

    @Value("${app.synthesis.max-tokens:4096}")
    private int maxTokens;

    @Value("${app.synthesis.max-input-chars:60000}")
    private int maxInputChars;

    public SynthesesAggregator(
        DocumentRepository documentRepository,
        SynthesisRepository synthesisRepository,
        InferenceClient inferenceClient,
        ObjectMapper objectMapper
    ) {
        this.documentRepository = documentRepository;
        this.synthesisRepository = synthesisRepository;
        this.inferenceClient = inferenceClient;
        this.objectMapper = objectMapper;
    }

    public Optional<Synthesis> regenerate(UUID caseId, String outputLanguage) {
        return regenerate(caseId, null, outputLanguage);
    }

    /**
     * @param category {@code null} for the overall synthesis
     * @return the stored synthesis, or empty when the case has no completed document in scope
     */
    public Optional<Synthesis> regenerate(UUID caseId, DocumentCategory category, String outputLanguage) {
        List<Document> documents = category == null
            ? documentRepository.findCompletedByCaseId(caseId)
            : documentRepository.findCompletedByCaseIdAndCategory(caseId, category);

        if (documents.isEmpty()) {
            if (synthesisRepository.delete(caseId, category)) {
                log.info("Case {}: no completed documents left, deleted {} synthesis", caseId, scopeName(category));
            }
            return Optional.empty();
        }

        log.info("Case {}: regenerating {} synthesis from {} documents", caseId, scopeName(category), documents.size());
        Synthesis generated = generate(caseId, documents, outputLanguage);

        String overrides = synthesisRepository.find(caseId, category)
            .map(Synthesis::overridesJson)
            .orElse(null);

        Synthesis scoped = new Synthesis(
            null,
            caseId,
            category,
            generated.summary(),
            generated.riskLevel(),
            generated.totalAnnualCost() != null
                ? generated.totalAnnualCost()
                : sum(documents, Document::estimatedAnnualCost),
            generated.totalOneTimeCost() != null
                ? generated.totalOneTimeCost()
                : sum(documents, Document::oneTimeCost),
            generated.annualCostBreakdown(),
            generated.oneTimeCostBreakdown(),
            generated.keyFindings(),
            generated.recommendations(),
            generated.crossDocumentThemes(),
            overrides,
            documents.size(),
            null
        );

        return Optional.of(synthesisRepository.upsert(scoped));
    }

    private Synthesis generate(UUID caseId, List<Document> documents, String outputLanguage) {
        String response;
        try {
            response = inferenceClient.infer(
                InferenceContent.ofText(describe(documents)),
                PromptTemplates.synthesis(outputLanguage, documents.size()),
                maxTokens,
                true
            );
        } catch (Exception e) {
            log.warn("Case {}: synthesis call failed, storing degraded synthesis: {}", caseId, e.getMessage());
            return SynthesisParser.degraded(SynthesisParser.UNAVAILABLE_SUMMARY);
        }

        try {
            return SynthesisParser.parse(objectMapper.readTree(ResponseRepairer.repair(response)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Case {}: synthesis output unusable after repair, storing degraded synthesis: {}",
                caseId, e.getMessage());
            return SynthesisParser.degraded(SynthesisParser.UNAVAILABLE_SUMMARY);
        }
    }

    String describe(List<Document> documents) {
        int perDocument = Math.max(1_000, maxInputChars / documents.size());
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < documents.size(); i++) {
            Document document = documents.get(i);
            String body = document.extraction() != null ? toJson(document) : String.valueOf(document.summary());
            if (body.length() > perDocument) {
                body = body.substring(0, perDocument) + " [truncated]";
            }
            out.append("### Document ").append(i + 1).append(": ").append(document.filename())
                .append(" (").append(document.category().label()).append(")\n")
                .append(body).append("\n\n");
        }
        return out.toString();
    }

    private String toJson(Document document) {
        try {
            return objectMapper.writeValueAsString(document.extraction());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Extraction of document " + document.id() + " cannot be serialized", e);
        }
    }

    private static BigDecimal sum(List<Document> documents, Function<Document, BigDecimal> field) {
        return documents.stream()
            .map(field)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static String scopeName(DocumentCategory category) {
        return category == null ? "overall" : category.label();
    }
}
