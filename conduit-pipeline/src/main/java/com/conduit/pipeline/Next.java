package com.conduit.pipeline;

/**
 * Continuation handed to a {@link Behavior}: "the rest of the chain".
 */
@FunctionalInterface
public interface Next {

    Object proceed(PipelineContext context) throws Exception;
}
