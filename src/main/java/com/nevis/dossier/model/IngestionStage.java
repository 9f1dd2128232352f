package com.nevis.dossier.model;

/**
 * Coordinator stages of a batch run. {@link #BATCH_FAILED} is reachable from every non-terminal stage.
 */
public enum IngestionStage {
    SUBMITTED,
    DOWNLOADING,
    PREPARING,
    ANALYZING,
    SYNTHESIZING,
    DONE,
    BATCH_FAILED;

    public boolean isTerminal() {
        return this == DONE || this == BATCH_FAILED;
    }

    public boolean canAdvanceTo(IngestionStage next) {
        if (isTerminal()) {
            return false;
        }
        if (next == BATCH_FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
