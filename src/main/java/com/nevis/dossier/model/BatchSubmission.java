package com.nevis.dossier.model;

import java.util.List;
import java.util.UUID;

public record BatchSubmission(
    UUID batchId,
    List<UUID> documentIds
) {}
