package com.pubannotator.pipeline;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Ephemeral unit of work owned by {@link AnnotationScheduler} for one record.
 * <p>
 * State changes go through compare-and-set so a job reaches exactly one terminal state even when
 * a worker finishing an attempt races with run-level cancellation.
 */
public final class AnnotationJob {
    private final PipelineRecord record;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.PENDING);
    private volatile int attempt;

    AnnotationJob(PipelineRecord record) {
        this.record = record;
    }

    public PipelineRecord record() {
        return record;
    }

    public JobState state() {
        return state.get();
    }

    /** Number of attempts started so far. */
    public int attempt() {
        return attempt;
    }

    /** PENDING -> IN_FLIGHT; returns false if the job was resolved meanwhile. */
    boolean begin() {
        if (!state.compareAndSet(JobState.PENDING, JobState.IN_FLIGHT)) return false;
        attempt++;
        return true;
    }

    /** IN_FLIGHT -> PENDING, ahead of a scheduled retry. */
    boolean backOff() {
        return state.compareAndSet(JobState.IN_FLIGHT, JobState.PENDING);
    }

    /** Moves the job to a terminal state; only the first caller succeeds. */
    boolean resolve(JobState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal job state");
        }
        while (true) {
            JobState current = state.get();
            if (current.isTerminal()) return false;
            if (state.compareAndSet(current, terminal)) return true;
        }
    }

    @Override
    public String toString() {
        return "AnnotationJob{" + record.id() + ", state=" + state.get() + ", attempt=" + attempt + "}";
    }
}
