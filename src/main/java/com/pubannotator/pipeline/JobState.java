package com.pubannotator.pipeline;

/**
 * States of an {@link AnnotationJob}. {@code PENDING} and {@code IN_FLIGHT} alternate while
 * attempts remain; every other state is terminal.
 */
public enum JobState {
    PENDING,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    EXHAUSTED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != IN_FLIGHT;
    }
}
