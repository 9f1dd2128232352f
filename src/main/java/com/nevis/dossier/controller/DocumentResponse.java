package com.nevis.dossier.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.DocumentStatus;
import com.nevis.dossier.model.extraction.DocumentExtraction;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record DocumentResponse(
    UUID id,

    @JsonProperty("case_id")
    UUID caseId,

    @JsonProperty("batch_id")
    UUID batchId,

    String filename,

    DocumentCategory category,

    String subcategory,

    DocumentStatus status,

    String summary,

    @JsonProperty("key_insights")
    List<String> keyInsights,

    @JsonProperty("estimated_annual_cost")
    BigDecimal estimatedAnnualCost,

    @JsonProperty("one_time_cost")
    BigDecimal oneTimeCost,

    @JsonProperty("page_count")
    Integer pageCount,

    @JsonProperty("text_extractable")
    Boolean textExtractable,

    DocumentExtraction extraction,

    @JsonProperty("processing_error")
    String processingError,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {}
