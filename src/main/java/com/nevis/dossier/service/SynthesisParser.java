package com.nevis.dossier.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.dossier.model.RiskLevel;
import com.nevis.dossier.model.Synthesis;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the generated part of a synthesis. Scope, overrides and timestamps are filled in by the caller.
 */
public final class SynthesisParser {

    public static final String UNAVAILABLE_SUMMARY = "Documents processed. Synthesis unavailable.";

    private SynthesisParser() {
    }

    public static Synthesis parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Synthesis must be a JSON object");
        }

        JsonNode summary = root.get("summary");
        if (summary == null || !summary.isTextual() || summary.asText().isBlank()) {
            throw new IllegalArgumentException("Synthesis has no summary");
        }

        return new Synthesis(
            null,
            null,
            null,
            summary.asText(),
            RiskLevel.fromLabel(root.path("risk_level").asText(null)),
            firstAmount(root, "total_annual_cost", "total_annual_costs"),
            firstAmount(root, "total_one_time_cost", "total_one_time_costs"),
            amounts(root.get("annual_cost_breakdown")),
            amounts(root.get("one_time_cost_breakdown")),
            strings(root.get("key_findings")),
            strings(root.get("recommendations")),
            strings(root.get("cross_document_themes")),
            null,
            0,
            null
        );
    }

    /**
     * Totals are left {@code null} so the caller can fill them from the documents' own costs.
     */
    public static Synthesis degraded(String summary) {
        return new Synthesis(null, null, null, summary, RiskLevel.UNKNOWN, null, null,
            Map.of(), Map.of(), List.of(), List.of(), List.of(), null, 0, null);
    }

    private static BigDecimal firstAmount(JsonNode root, String... fields) {
        for (String field : fields) {
            BigDecimal value = ExtractionParser.amount(root.get(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Map<String, BigDecimal> amounts(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            BigDecimal value = ExtractionParser.amount(field.getValue());
            if (value != null) {
                amounts.put(field.getKey(), value);
            }
        }
        return amounts;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isValueNode() && !element.isNull()) {
                values.add(element.asText());
            }
        }
        return List.copyOf(values);
    }
}
