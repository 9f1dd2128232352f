package com.nevis.dossier.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.dossier.model.BatchProgress;
import com.nevis.dossier.model.BatchStatus;
import com.nevis.dossier.model.IngestionStage;

import java.util.List;
import java.util.UUID;

/**
 * {@code stage} is only known while the instance that ran the batch is up; {@code synthesis} is the
 * current overall synthesis of the case, if any.
 */
public record BatchStatusResponse(
    @JsonProperty("batch_id")
    UUID batchId,

    @JsonProperty("case_id")
    UUID caseId,

    BatchStatus status,

    IngestionStage stage,

    BatchProgress progress,

    List<DocumentStatusItem> documents,

    SynthesisResponse synthesis
) {}
