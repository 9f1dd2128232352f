package com.nevis.dossier.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dossier.model.DocumentCategory;
import com.nevis.dossier.model.DocumentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DocumentStatusItem(
    UUID id,

    String filename,

    DocumentCategory category,

    String subcategory,

    DocumentStatus status,

    String error,

    @JsonProperty("processing_started_at")
    OffsetDateTime processingStartedAt,

    @JsonProperty("processing_completed_at")
    OffsetDateTime processingCompletedAt
) {}
