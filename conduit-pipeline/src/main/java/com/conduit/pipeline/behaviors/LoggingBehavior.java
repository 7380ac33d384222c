package com.conduit.pipeline.behaviors;

import com.conduit.pipeline.Behavior;
import com.conduit.pipeline.Next;
import com.conduit.pipeline.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each request passing through the chain: message type on entry, duration and outcome on exit.
 * Failures are logged and rethrown.
 */
public final class LoggingBehavior implements Behavior {

    private static final Logger log = LoggerFactory.getLogger(LoggingBehavior.class);

    /** Property key holding the duration (ms) of the rest of the chain, set on exit. */
    public static final String DURATION_MS = "logging.durationMs";

    @Override
    public Object execute(PipelineContext context, Next next) throws Exception {
        Object message = context.getMessage();
        String type = message != null ? message.getClass().getSimpleName() : "null";
        log.info("Processing {} ({})", type, context.getContextId());
        long start = System.nanoTime();
        try {
            Object result = next.proceed(context);
            long ms = (System.nanoTime() - start) / 1_000_000L;
            context.setProperty(DURATION_MS, ms);
            log.info("Processed {} ({}) in {} ms", type, context.getContextId(), ms);
            return result;
        } catch (Exception e) {
            long ms = (System.nanoTime() - start) / 1_000_000L;
            context.setProperty(DURATION_MS, ms);
            log.warn("Processing {} ({}) failed after {} ms: {}", type, context.getContextId(), ms, e.getMessage());
            throw e;
        }
    }
}
