package com.nevis.dossier.exception;

import lombok.Getter;

@Getter
public abstract class BlobStoreException extends RuntimeException {
    private final String key;

    protected BlobStoreException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }
}
