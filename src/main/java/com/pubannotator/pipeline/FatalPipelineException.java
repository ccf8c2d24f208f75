package com.pubannotator.pipeline;

/**
 * Run-level failure that aborts the whole pipeline run: the sink stayed unreachable beyond its
 * retry budget, or acquisition produced no records.
 */
public class FatalPipelineException extends Exception {
    private final RunStatus stage;

    public FatalPipelineException(RunStatus stage, String message) {
        super(message);
        this.stage = stage;
    }

    public FatalPipelineException(RunStatus stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /** Stage the run was in when it failed. */
    public RunStatus stage() {
        return stage;
    }
}
