package com.conduit.pipeline;

/**
 * Wraps a checked failure raised by a behavior that no error handler converted. Unchecked failures
 * propagate as they are.
 */
public final class PipelineExecutionException extends PipelineException {

    public PipelineExecutionException(Throwable cause) {
        super("Pipeline execution failed: " + cause.getMessage(), cause);
    }
}
