package com.nevis.dossier.event;

import java.util.UUID;

public record BatchSubmittedEvent(UUID batchId) {}
