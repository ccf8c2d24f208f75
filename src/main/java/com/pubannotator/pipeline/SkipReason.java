package com.pubannotator.pipeline;

/**
 * Why a record never reached the annotation stage.
 */
public enum SkipReason {
    DUPLICATE,
    ALREADY_PROCESSED,
    PREVIOUSLY_FAILED
}
