package com.conduit.pipeline;

/**
 * Thrown when the chain stops because its context was cancelled before the next behavior could run.
 */
public final class PipelineCancelledException extends PipelineException {

    private final CancellationReason reason;

    public PipelineCancelledException(CancellationReason reason) {
        super("Pipeline execution was cancelled (" + reason + ")");
        this.reason = reason;
    }

    public CancellationReason getReason() {
        return reason;
    }
}
