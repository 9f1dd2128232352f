package com.nevis.dossier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of document types the classifier may assign, plus {@link #UNCLASSIFIED} for documents
 * that have not been through classification yet.
 */
public enum DocumentCategory {
    ASSEMBLY_MINUTES("pv_ag", "co-ownership general assembly minutes (PV d'AG)"),
    DIAGNOSTIC("diags", "technical diagnostic or inspection report (DPE, asbestos, lead, termites, electrical, gas)"),
    PROPERTY_TAX("taxe_fonciere", "property tax notice (taxe fonciere)"),
    SERVICE_CHARGES("charges", "co-ownership service charge statement or call for funds"),
    OTHER("other", "any other property-related document"),
    UNCLASSIFIED("unclassified", "not classified yet");

    private final String label;
    private final String description;

    DocumentCategory(String label, String description) {
        this.label = label;
        this.description = description;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public boolean isClassifierOutput() {
        return this != UNCLASSIFIED;
    }

    /**
     * Resolves a label the classifier may answer with. {@code diagnostic} is accepted as an alias of
     * {@code diags}. {@code unclassified} is never a valid answer.
     */
    public static Optional<DocumentCategory> fromLabel(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String label = raw.trim().toLowerCase(Locale.ROOT);
        if ("diagnostic".equals(label)) {
            return Optional.of(DIAGNOSTIC);
        }
        return Arrays.stream(values())
            .filter(DocumentCategory::isClassifierOutput)
            .filter(category -> category.label.equals(label))
            .findFirst();
    }

    @JsonCreator
    public static DocumentCategory fromJson(String value) {
        if (UNCLASSIFIED.label.equals(value)) {
            return UNCLASSIFIED;
        }
        return fromLabel(value)
            .or(() -> Arrays.stream(values()).filter(c -> c.name().equalsIgnoreCase(value)).findFirst())
            .orElseThrow(() -> new IllegalArgumentException("Unknown document category: " + value));
    }
}
