package com.nevis.dossier.model;

import java.util.UUID;

/**
 * One entry of a batch submission: a document already uploaded to the blob store.
 */
public record DocumentUpload(
    UUID documentId,
    String blobKey,
    String filename
) {}
