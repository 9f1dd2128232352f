package com.nevis.dossier.model.extraction;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nevis.dossier.model.DocumentCategory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServiceChargesExtraction(
    String summary,
    String subcategory,
    List<String> keyInsights,
    BigDecimal estimatedAnnualCost,
    List<CostItem> oneTimeCosts,
    String period,
    BigDecimal totalCharges,
    Map<String, BigDecimal> breakdown,
    List<CostItem> specialAssessments
) implements DocumentExtraction {

    @Override
    public DocumentCategory category() {
        return DocumentCategory.SERVICE_CHARGES;
    }
}
