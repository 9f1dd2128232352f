package com.nevis.dossier.model;

import java.util.EnumSet;
import java.util.Set;

public enum DocumentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(DocumentStatus next) {
        return predecessorsOf(next).contains(this);
    }

    /**
     * States a document may be in for a move to {@code target} to be accepted.
     */
    public static Set<DocumentStatus> predecessorsOf(DocumentStatus target) {
        return switch (target) {
            case PENDING -> EnumSet.noneOf(DocumentStatus.class);
            case PROCESSING -> EnumSet.of(PENDING);
            case COMPLETED -> EnumSet.of(PROCESSING);
            case FAILED -> EnumSet.of(PENDING, PROCESSING);
        };
    }
}
