package com.nevis.dossier.model.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record DiagnosticIssue(
    String description,
    String severity,

    @JsonProperty("estimated_cost")
    BigDecimal estimatedCost
) {}
