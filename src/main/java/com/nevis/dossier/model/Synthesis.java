package com.nevis.dossier.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Cross-document analysis of a case. {@code category} is {@code null} for the overall synthesis.
 * {@code overridesJson} is user-supplied JSON kept verbatim; the aggregator never writes it.
 */
public record Synthesis(
    UUID id,
    UUID caseId,
    DocumentCategory category,
    String summary,
    RiskLevel riskLevel,
    BigDecimal totalAnnualCost,
    BigDecimal totalOneTimeCost,
    Map<String, BigDecimal> annualCostBreakdown,
    Map<String, BigDecimal> oneTimeCostBreakdown,
    List<String> keyFindings,
    List<String> recommendations,
    List<String> crossDocumentThemes,
    String overridesJson,
    int documentCount,
    OffsetDateTime lastUpdated
) {

    public Synthesis withOverrides(String overrides) {
        return new Synthesis(id, caseId, category, summary, riskLevel, totalAnnualCost, totalOneTimeCost,
            annualCostBreakdown, oneTimeCostBreakdown, keyFindings, recommendations, crossDocumentThemes,
            overrides, documentCount, lastUpdated);
    }

    public Synthesis withScope(UUID caseId, DocumentCategory category, int documentCount) {
        return new Synthesis(id, caseId, category, summary, riskLevel, totalAnnualCost, totalOneTimeCost,
            annualCostBreakdown, oneTimeCostBreakdown, keyFindings, recommendations, crossDocumentThemes,
            overridesJson, documentCount, lastUpdated);
    }
}
