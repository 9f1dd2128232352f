package com.nevis.dossier.exception;

public class InvalidOverridesException extends RuntimeException {

    public InvalidOverridesException(String message) {
        super(message);
    }
}
