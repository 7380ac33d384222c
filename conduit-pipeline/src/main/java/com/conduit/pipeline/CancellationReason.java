package com.conduit.pipeline;

/** Why a {@link PipelineContext} was cancelled. */
public enum CancellationReason {
    /** Explicit {@link PipelineContext#cancel()} by a caller or behavior. */
    REQUESTED,
    /** The request deadline passed before the chain completed. */
    DEADLINE_EXCEEDED
}
