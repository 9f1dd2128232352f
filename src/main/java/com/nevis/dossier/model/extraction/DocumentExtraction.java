package com.nevis.dossier.model.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.nevis.dossier.model.DocumentCategory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Structured facts extracted from one document. The concrete type follows the document category;
 * the {@code type} property carries the category label when serialized.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AssemblyMinutesExtraction.class, name = "pv_ag"),
    @JsonSubTypes.Type(value = DiagnosticExtraction.class, name = "diags"),
    @JsonSubTypes.Type(value = PropertyTaxExtraction.class, name = "taxe_fonciere"),
    @JsonSubTypes.Type(value = ServiceChargesExtraction.class, name = "charges"),
    @JsonSubTypes.Type(value = GeneralExtraction.class, name = "other")
})
public sealed interface DocumentExtraction
    permits AssemblyMinutesExtraction, DiagnosticExtraction, PropertyTaxExtraction, ServiceChargesExtraction, GeneralExtraction {

    String summary();

    String subcategory();

    List<String> keyInsights();

    BigDecimal estimatedAnnualCost();

    List<CostItem> oneTimeCosts();

    @JsonIgnore
    DocumentCategory category();

    @JsonIgnore
    default BigDecimal totalOneTimeCost() {
        return oneTimeCosts().stream()
            .map(CostItem::amount)
            .filter(amount -> amount != null)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Empty extraction of the right shape, used when the model output cannot be used at all.
     */
    static DocumentExtraction fallback(DocumentCategory category, String summary) {
        return switch (category) {
            case ASSEMBLY_MINUTES -> new AssemblyMinutesExtraction(summary, null, List.of(), BigDecimal.ZERO, List.of(),
                null, List.of(), List.of());
            case DIAGNOSTIC -> new DiagnosticExtraction(summary, null, List.of(), BigDecimal.ZERO, List.of(),
                null, null, null, List.of());
            case PROPERTY_TAX -> new PropertyTaxExtraction(summary, null, List.of(), BigDecimal.ZERO, List.of(),
                null, BigDecimal.ZERO, BigDecimal.ZERO, List.of());
            case SERVICE_CHARGES -> new ServiceChargesExtraction(summary, null, List.of(), BigDecimal.ZERO, List.of(),
                null, BigDecimal.ZERO, Map.of(), List.of());
            case OTHER, UNCLASSIFIED -> new GeneralExtraction(summary, null, List.of(), BigDecimal.ZERO, List.of(),
                null, List.of());
        };
    }
}
