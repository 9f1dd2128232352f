package com.nevis.dossier.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.UUID;

/**
 * {@code document_id} may be omitted for documents not registered yet; an id is then assigned.
 */
public record BatchDocumentRequest(
    @JsonProperty("document_id")
    UUID documentId,

    @NotBlank
    @JsonProperty("blob_key")
    String blobKey,

    @NotBlank
    String filename
) {}
