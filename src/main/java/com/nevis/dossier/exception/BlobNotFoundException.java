package com.nevis.dossier.exception;

public class BlobNotFoundException extends BlobStoreException {

    public BlobNotFoundException(String key, Throwable cause) {
        super("Blob not found: " + key, key, cause);
    }
}
