package com.conduit.pipeline.behaviors;

import com.conduit.pipeline.Behavior;
import com.conduit.pipeline.BehaviorChain;
import com.conduit.pipeline.Next;
import com.conduit.pipeline.PipelineCancelledException;
import com.conduit.pipeline.PipelineContext;
import com.conduit.pipeline.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Re-invokes the rest of the chain when it fails, according to a {@link RetryPolicy}. The current attempt is
 * exposed under {@link BehaviorChain#RETRY_ATTEMPT}. Downstream behaviors must tolerate being run more than
 * once for the same request.
 */
public final class RetryBehavior implements Behavior {

    private static final Logger log = LoggerFactory.getLogger(RetryBehavior.class);

    private final RetryPolicy policy;

    public RetryBehavior(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public Object execute(PipelineContext context, Next next) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                return next.proceed(context);
            } catch (Exception e) {
                if (attempt >= policy.getMaxRetries() || !policy.shouldRetry(e)) {
                    throw e;
                }
                attempt++;
                Duration delay = policy.delayFor(attempt);
                context.setProperty(BehaviorChain.RETRY_ATTEMPT, attempt);
                log.warn("Downstream failed for {} ({}); retry {}/{} in {} ms",
                        context.getContextId(), e.getMessage(), attempt, policy.getMaxRetries(), delay.toMillis());
                if (context.awaitCancellation(delay)) {
                    throw new PipelineCancelledException(context.getCancellationReason());
                }
            }
        }
    }
}
