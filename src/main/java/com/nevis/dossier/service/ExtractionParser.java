package com.nevis.dossier.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.extraction.AssemblyMinutesExtraction;
import com.nevis.dossier.model.extraction.CostItem;
import com.nevis.dossier.model.extraction.DiagnosticExtraction;
import com.nevis.dossier.model.extraction.DiagnosticIssue;
import com.nevis.dossier.model.extraction.DocumentExtraction;
import com.nevis.dossier.model.extraction.GeneralExtraction;
import com.nevis.dossier.model.extraction.PropertyTaxExtraction;
import com.nevis.dossier.model.extraction.ServiceChargesExtraction;
import com.nevis.dossier.model.extraction.UpcomingWork;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps model JSON onto the typed extraction of a category. Field types are coerced rather than
 * enforced: the model regularly answers {@code "1 200 €"} for a number or a bare number for a list.
 */
public final class ExtractionParser {

    private ExtractionParser() {
    }

    public static DocumentExtraction parse(DocumentCategory category, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Extraction must be a JSON object");
        }

        String summary = text(root, "summary");
        String subcategory = text(root, "subcategory");
        List<String> keyInsights = strings(root.get("key_insights"));
        BigDecimal annualCost = orZero(amount(root.get("estimated_annual_cost")));
        List<CostItem> oneTimeCosts = costItems(root.get("one_time_costs"));

        return switch (category) {
            case ASSEMBLY_MINUTES -> new AssemblyMinutesExtraction(
                summary, subcategory, keyInsights, annualCost, oneTimeCosts,
                text(root, "meeting_date"),
                strings(root.get("decisions")),
                upcomingWorks(root.get("upcoming_works"))
            );
            case DIAGNOSTIC -> new DiagnosticExtraction(
                summary, subcategory, keyInsights, annualCost, oneTimeCosts,
                text(root, "diagnostic_type"),
                text(root, "diagnostic_date"),
                text(root, "rating"),
                issues(root.has("issues") ? root.get("issues") : root.get("issues_found"))
            );
            case PROPERTY_TAX -> new PropertyTaxExtraction(
                summary, subcategory, keyInsights, annualCost, oneTimeCosts,
                year(root.get("year")),
                amount(root.get("total_amount")),
                amount(root.has("cadastral_value") ? root.get("cadastral_value") : root.get("property_value")),
                strings(root.get("exemptions"))
            );
            case SERVICE_CHARGES -> new ServiceChargesExtraction(
                summary, subcategory, keyInsights, annualCost, oneTimeCosts,
                text(root, "period"),
                amount(root.get("total_charges")),
                breakdown(root.get("breakdown")),
                costItems(root.get("special_assessments"))
            );
            case OTHER, UNCLASSIFIED -> new GeneralExtraction(
                summary, subcategory, keyInsights, annualCost, oneTimeCosts,
                text(root, "document_kind"),
                strings(root.get("key_facts"))
            );
        };
    }

    static BigDecimal amount(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return parseAmount(node.asText());
        }
        return null;
    }

    /**
     * Reads human-formatted amounts: {@code "1 200 €"}, {@code "12,500.50"}, {@code "1.234,56"}.
     * Returns {@code null} when no number can be recovered.
     */
    static BigDecimal parseAmount(String raw) {
        String cleaned = raw.replaceAll("[^0-9,.\\-]", "");
        if (cleaned.isEmpty() || cleaned.equals("-")) {
            return null;
        }

        int lastComma = cleaned.lastIndexOf(',');
        int lastDot = cleaned.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            // the right-most separator is the decimal one
            if (lastComma > lastDot) {
                cleaned = cleaned.replace(".", "").replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        } else if (lastComma >= 0) {
            boolean grouped = cleaned.indexOf(',') != lastComma || cleaned.length() - lastComma - 1 == 3;
            cleaned = grouped ? cleaned.replace(",", "") : cleaned.replace(',', '.');
        } else if (lastDot >= 0 && cleaned.indexOf('.') != lastDot) {
            cleaned = cleaned.replace(".", "");
        }

        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isValueNode()) {
            String value = node.asText();
            return value.isBlank() ? null : value;
        }
        return node.toString();
    }

    private static Integer year(JsonNode node) {
        BigDecimal value = amount(node);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isValueNode()) {
            String value = node.asText();
            return value.isBlank() ? List.of() : List.of(value);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isNull()) {
                continue;
            }
            if (element.isValueNode()) {
                values.add(element.asText());
            } else if (element.hasNonNull("description")) {
                values.add(element.get("description").asText());
            } else {
                values.add(element.toString());
            }
        }
        return List.copyOf(values);
    }

    static List<CostItem> costItems(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isNumber() || node.isTextual()) {
            BigDecimal total = amount(node);
            return total != null && total.signum() > 0 ? List.of(new CostItem("Total", total)) : List.of();
        }
        if (node.isObject()) {
            return List.of(costItem(node));
        }
        List<CostItem> items = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isObject()) {
                items.add(costItem(element));
            } else if (!element.isNull()) {
                BigDecimal value = amount(element);
                if (value != null) {
                    items.add(new CostItem("Total", value));
                }
            }
        }
        return List.copyOf(items);
    }

    private static CostItem costItem(JsonNode node) {
        JsonNode amount = node.has("amount") ? node.get("amount") : node.get("cost");
        return new CostItem(text(node, "description"), amount(amount));
    }

    private static List<UpcomingWork> upcomingWorks(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<UpcomingWork> works = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isObject()) {
                JsonNode cost = element.has("cost") ? element.get("cost") : element.get("amount");
                works.add(new UpcomingWork(
                    text(element, "description"),
                    amount(cost),
                    text(element, "timeline"),
                    text(element, "urgency")
                ));
            } else if (element.isTextual()) {
                works.add(new UpcomingWork(element.asText(), null, null, null));
            }
        }
        return List.copyOf(works);
    }

    private static List<DiagnosticIssue> issues(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<DiagnosticIssue> issues = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isObject()) {
                issues.add(new DiagnosticIssue(
                    text(element, "description"),
                    text(element, "severity"),
                    amount(element.get("estimated_cost"))
                ));
            } else if (element.isTextual()) {
                issues.add(new DiagnosticIssue(element.asText(), null, null));
            }
        }
        return List.copyOf(issues);
    }

    private static Map<String, BigDecimal> breakdown(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, BigDecimal> breakdown = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            BigDecimal value = amount(field.getValue());
            if (value != null) {
                breakdown.put(field.getKey(), value);
            }
        }
        return breakdown;
    }
}
