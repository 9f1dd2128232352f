package com.nevis.dossier.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.RiskLevel;
import com.nevis.dossier.model.Synthesis;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record SynthesisResponse(
    @JsonProperty("case_id")
    UUID caseId,

    DocumentCategory category,

    String summary,

    @JsonProperty("risk_level")
    RiskLevel riskLevel,

    @JsonProperty("total_annual_cost")
    BigDecimal totalAnnualCost,

    @JsonProperty("total_one_time_cost")
    BigDecimal totalOneTimeCost,

    @JsonProperty("annual_cost_breakdown")
    Map<String, BigDecimal> annualCostBreakdown,

    @JsonProperty("one_time_cost_breakdown")
    Map<String, BigDecimal> oneTimeCostBreakdown,

    @JsonProperty("key_findings")
    List<String> keyFindings,

    List<String> recommendations,

    @JsonProperty("cross_document_themes")
    List<String> crossDocumentThemes,

    // stored user JSON, written out as-is
    @JsonRawValue
    String overrides,

    @JsonProperty("document_count")
    int documentCount,

    @JsonProperty("last_updated")
    OffsetDateTime lastUpdated
) {

    public static SynthesisResponse from(Synthesis synthesis) {
        return new SynthesisResponse(
            synthesis.caseId(),
            synthesis.category(),
            synthesis.summary(),
            synthesis.riskLevel(),
            synthesis.totalAnnualCost(),
            synthesis.totalOneTimeCost(),
            synthesis.annualCostBreakdown(),
            synthesis.oneTimeCostBreakdown(),
            synthesis.keyFindings(),
            synthesis.recommendations(),
            synthesis.crossDocumentThemes(),
            synthesis.overridesJson() != null ? synthesis.overridesJson() : "{}",
            synthesis.documentCount(),
            synthesis.lastUpdated()
        );
    }
}
