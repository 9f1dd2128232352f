package com.nevis.dossier.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record Batch(
    UUID id,
    UUID caseId,
    String outputLanguage,
    OffsetDateTime createdAt
) {}
