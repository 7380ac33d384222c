package com.conduit.pipeline;

/**
 * Base type of the terminal failures a chain run can report.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
