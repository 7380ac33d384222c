package com.conduit.pipeline;

/**
 * Converts a failure raised by a behavior into a result value instead of letting it propagate.
 * Only failures raised by the wrapped behavior itself are offered; failures coming back from
 * {@link Next} pass through untouched.
 */
@FunctionalInterface
public interface ErrorHandler {

    /**
     * @param error   failure raised by the behavior
     * @param context request context; {@link PipelineContext#LAST_ERROR} is already set to {@code error}
     * @return replacement result
     * @throws Exception to fail the request with a different error
     */
    Object handle(Exception error, PipelineContext context) throws Exception;
}
