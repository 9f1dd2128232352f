package com.nevis.dossier.exception;

/**
 * The object store itself could not be reached or refused the call. Retried at the adapter level.
 */
public class BlobStoreUnavailableException extends BlobStoreException {

    public BlobStoreUnavailableException(String key, Throwable cause) {
        super("Blob store unavailable while accessing " + key + ": " + cause.getMessage(), key, cause);
    }
}
