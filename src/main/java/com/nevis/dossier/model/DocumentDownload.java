package com.nevis.dossier.model;

import java.util.UUID;

public record DocumentDownload(
    UUID documentId,
    String filename,
    byte[] content
) {}
