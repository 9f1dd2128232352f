package com.nevis.dossier.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RiskLevel fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low", "faible" -> LOW;
            case "medium", "moderate", "moyen", "modere" -> MEDIUM;
            case "high", "critical", "eleve", "élevé" -> HIGH;
            default -> UNKNOWN;
        };
    }
}
