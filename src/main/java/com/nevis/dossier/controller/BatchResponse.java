package com.nevis.dossier.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

public record BatchResponse(
    @JsonProperty("batch_id")
    UUID batchId,

    @JsonProperty("document_ids")
    List<UUID> documentIds
) {}
