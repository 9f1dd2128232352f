package com.nevis.dossier.model;

public enum BatchStatus {
    PROCESSING,
    COMPLETED,
    FAILED,
    UNKNOWN
}
