package com.nevis.dossier.service;

import com.nevis.dossier.model.DocumentCategory;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Instruction texts sent with each inference request.
 */
public final class PromptTemplates {

    private PromptTemplates() {
    }

    private static final String CLASSIFICATION_TEMPLATE =
        """
            Role: Expert French real-estate paralegal.
            Task: Classify the attached document (file name: %s) into exactly one category.

            Categories:
            %s

            Output: Output only the category label, nothing else.
            """;

    private static final String EXTRACTION_TEMPLATE =
        """
            Role: Expert French real-estate analyst reviewing documents for a property purchase.
            Task: %s

            Document file name: %s

            Rules:
            - Write every free-text value in %s.
            - Amounts are plain numbers in euros, without currency symbols or thousand separators.
            - Use null for values the document does not state. Do not invent figures.
            - estimated_annual_cost is the recurring yearly cost for the owner; one_time_costs are exceptional
              expenses (works, remediation, special calls for funds).

            Output: Return only a JSON object with exactly these fields:
            %s
            """;

    private static final String SYNTHESIS_TEMPLATE =
        """
            Role: Expert French real-estate advisor.
            Task: Produce one consolidated analysis of a property file from the per-document analyses provided.
            Cross-check documents against each other: repeated works, charge increases, diagnostic issues that
            explain upcoming works, inconsistencies between figures.

            Rules:
            - Write every free-text value in %s.
            - total_annual_cost sums recurring yearly costs; total_one_time_cost sums exceptional costs.
              Do not count the same expense twice when several documents mention it.
            - risk_level is one of: low, medium, high.

            Output: Return only a JSON object with exactly these fields:
            {
              "summary": "Overall assessment in 3-5 sentences",
              "risk_level": "low",
              "total_annual_cost": 0,
              "total_one_time_cost": 0,
              "annual_cost_breakdown": {"charges": 0, "taxe_fonciere": 0},
              "one_time_cost_breakdown": {"roof works": 0},
              "key_findings": ["finding 1"],
              "recommendations": ["recommendation 1"],
              "cross_document_themes": ["theme 1"]
            }

            The message contains the analyses of %d documents.
            """;

    private static final String ASSEMBLY_MINUTES_TASK =
        "Analyze these co-ownership general assembly minutes (PV d'AG). Extract the meeting date, the decisions voted, "
            + "upcoming works with their cost and timeline, disputes or unpaid charges between co-owners, charges and "
            + "fees mentioned, and important deadlines.";

    private static final String ASSEMBLY_MINUTES_FIELDS =
        """
            {
              "summary": "Brief summary of the meeting",
              "subcategory": "ordinary or extraordinary assembly",
              "key_insights": ["insight 1", "insight 2"],
              "estimated_annual_cost": 1234.56,
              "one_time_costs": [{"description": "Work description", "amount": 1000}],
              "meeting_date": "2024-01-15",
              "decisions": ["decision 1", "decision 2"],
              "upcoming_works": [{"description": "Work", "cost": 5000, "timeline": "Q2 2024", "urgency": "high"}]
            }""";

    private static final String DIAGNOSTIC_TASK =
        "Analyze this technical diagnostic report. Extract the type of diagnostic (DPE, asbestos, lead, termites, "
            + "electrical, gas), its date, the overall result or rating, every issue or non-compliance found, and the "
            + "estimated remediation costs.";

    private static final String DIAGNOSTIC_FIELDS =
        """
            {
              "summary": "Brief summary",
              "subcategory": "DPE",
              "key_insights": ["insight 1", "insight 2"],
              "estimated_annual_cost": 0,
              "one_time_costs": [{"description": "Remediation", "amount": 2000}],
              "diagnostic_type": "DPE",
              "diagnostic_date": "2024-01-15",
              "rating": "C",
              "issues": [{"description": "issue 1", "severity": "medium", "estimated_cost": 500}]
            }""";

    private static final String PROPERTY_TAX_TASK =
        "Analyze this property tax notice (taxe fonciere). Extract the tax year, the total amount due, the cadastral "
            + "rental value and any exemptions or reductions.";

    private static final String PROPERTY_TAX_FIELDS =
        """
            {
              "summary": "Brief summary",
              "subcategory": "avis de taxe fonciere",
              "key_insights": ["insight 1"],
              "estimated_annual_cost": 1234.56,
              "one_time_costs": [],
              "year": 2024,
              "total_amount": 1234.56,
              "cadastral_value": 50000,
              "exemptions": ["exemption 1"]
            }""";

    private static final String SERVICE_CHARGES_TASK =
        "Analyze this co-ownership service charge document. Extract the period covered, the total charges, the "
            + "breakdown by category when available, and any special assessments or calls for funds for works.";

    private static final String SERVICE_CHARGES_FIELDS =
        """
            {
              "summary": "Brief summary",
              "subcategory": "annual statement",
              "key_insights": ["insight 1"],
              "estimated_annual_cost": 2400,
              "one_time_costs": [{"description": "Special assessment", "amount": 800}],
              "period": "2024",
              "total_charges": 2400,
              "breakdown": {"heating": 1000, "maintenance": 800, "other": 600},
              "special_assessments": [{"description": "Facade works call for funds", "amount": 800}]
            }""";

    private static final String GENERAL_TASK =
        "Analyze this property-related document. Identify what kind of document it is and extract the facts that "
            + "matter to a buyer, including any recurring or exceptional costs.";

    private static final String GENERAL_FIELDS =
        """
            {
              "summary": "Brief summary",
              "subcategory": "document kind",
              "key_insights": ["insight 1"],
              "estimated_annual_cost": 0,
              "one_time_costs": [],
              "document_kind": "rental lease",
              "key_facts": ["fact 1"]
            }""";

    public static String classification(String filename) {
        String categories = Arrays.stream(DocumentCategory.values())
            .filter(DocumentCategory::isClassifierOutput)
            .map(category -> "- " + category.label() + ": " + category.description())
            .collect(Collectors.joining("\n"));
        return String.format(CLASSIFICATION_TEMPLATE, filename, categories);
    }

    public static String extraction(DocumentCategory category, String filename, String outputLanguage) {
        String task = switch (category) {
            case ASSEMBLY_MINUTES -> ASSEMBLY_MINUTES_TASK;
            case DIAGNOSTIC -> DIAGNOSTIC_TASK;
            case PROPERTY_TAX -> PROPERTY_TAX_TASK;
            case SERVICE_CHARGES -> SERVICE_CHARGES_TASK;
            case OTHER, UNCLASSIFIED -> GENERAL_TASK;
        };
        String fields = switch (category) {
            case ASSEMBLY_MINUTES -> ASSEMBLY_MINUTES_FIELDS;
            case DIAGNOSTIC -> DIAGNOSTIC_FIELDS;
            case PROPERTY_TAX -> PROPERTY_TAX_FIELDS;
            case SERVICE_CHARGES -> SERVICE_CHARGES_FIELDS;
            case OTHER, UNCLASSIFIED -> GENERAL_FIELDS;
        };
        return String.format(EXTRACTION_TEMPLATE, task, filename, outputLanguage, fields);
    }

    public static String synthesis(String outputLanguage, int documentCount) {
        return String.format(SYNTHESIS_TEMPLATE, outputLanguage, documentCount);
    }
}
