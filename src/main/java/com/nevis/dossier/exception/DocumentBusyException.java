package com.nevis.dossier.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class DocumentBusyException extends RuntimeException {
    private final UUID documentId;

    public DocumentBusyException(UUID documentId) {
        super("Document is still being processed: " + documentId);
        this.documentId = documentId;
    }
}
