package com.pubannotator.pipeline;

/**
 * Stages of one pipeline run, in order. {@code FAILED} and {@code CANCELLED} can follow any
 * non-terminal stage.
 */
public enum RunStatus {
    LOADING,
    DEDUPLICATING,
    FILTERING,
    ANNOTATING,
    PERSISTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
