package com.nevis.dossier.model;

import java.util.UUID;

/**
 * Downloaded document plus what could be learned from it locally. {@code text} is {@code null} when
 * nothing could be extracted; {@code content} is always kept so multimodal inference stays possible.
 */
public record PreparedDocument(
    UUID documentId,
    String filename,
    String mimeType,
    byte[] content,
    String text,
    int pageCount,
    boolean textExtractable
) {}
