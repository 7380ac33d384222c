package com.conduit.pipeline;

import java.time.Duration;

/**
 * Thrown when a chain has not completed before its deadline. The in-flight execution was cancelled
 * through the context; its eventual result, if any, is discarded.
 */
public final class PipelineTimeoutException extends PipelineException {

    private final Duration timeout;

    public PipelineTimeoutException(Duration timeout) {
        super("Pipeline execution timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
