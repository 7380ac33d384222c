package com.conduit.pipeline;

/**
 * One step of request processing contributed by a component. A behavior receives the request-scoped
 * {@link PipelineContext} and the continuation {@code next} representing the rest of the chain.
 * Calling {@code next.proceed(context)} runs the remaining behaviors; returning without calling it
 * short-circuits the chain and the returned value becomes the chain result.
 * <p>
 * <b>Threading:</b> one instance is shared by all concurrent requests; keep per-request state in the
 * context, not in fields.
 */
@FunctionalInterface
public interface Behavior {

    /**
     * Executes this step.
     *
     * @param context request context; never null
     * @param next    continuation for the rest of the chain; never null
     * @return the result of this step (typically what {@code next} returned)
     * @throws Exception on failure; propagates to the caller of the chain unless an error handler is attached
     */
    Object execute(PipelineContext context, Next next) throws Exception;
}
