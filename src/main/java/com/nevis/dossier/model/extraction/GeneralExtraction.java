package com.nevis.dossier.model.extraction;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nevis.dossier.model.DocumentCategory;

import java.math.BigDecimal;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GeneralExtraction(
    String summary,
    String subcategory,
    List<String> keyInsights,
    BigDecimal estimatedAnnualCost,
    List<CostItem> oneTimeCosts,
    String documentKind,
    List<String> keyFacts
) implements DocumentExtraction {

    @Override
    public DocumentCategory category() {
        return DocumentCategory.OTHER;
    }
}
