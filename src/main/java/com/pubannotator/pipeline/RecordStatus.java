package com.pubannotator.pipeline;

/**
 * Lifecycle status of a {@link PipelineRecord}.
 * <p>
 * {@code NEW} is the only non-terminal status. {@code ANNOTATED}, {@code FAILED} and
 * {@code EXHAUSTED} are set by {@link AnnotationScheduler} only; {@code SKIPPED} is set by
 * deduplication or the resumable filter before a record is ever scheduled.
 */
public enum RecordStatus {
    NEW,
    ANNOTATED,
    FAILED,
    EXHAUSTED,
    SKIPPED;

    public boolean isTerminal() {
        return this != NEW;
    }
}
