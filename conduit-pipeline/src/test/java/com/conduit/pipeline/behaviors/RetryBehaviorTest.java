package com.conduit.pipeline.behaviors;

import com.conduit.pipeline.BehaviorChain;
import com.conduit.pipeline.BehaviorContribution;
import com.conduit.pipeline.PipelineContext;
import com.conduit.pipeline.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryBehaviorTest {

    @Test
    void execute_retriesDownstreamBehaviors() {
        int[] calls = new int[1];
        BehaviorChain chain = BehaviorChain.build(List.of(
                BehaviorContribution.of("retry", 10, new RetryBehavior(RetryPolicy.fixed(2, Duration.ZERO))),
                BehaviorContribution.of("flaky", 20, (ctx, next) -> {
                    if (++calls[0] == 1) throw new IllegalStateException("first");
                    return "ok";
                })));
        PipelineContext ctx = new PipelineContext(null);

        assertEquals("ok", chain.run(ctx));
        assertEquals(2, calls[0]);
        assertEquals(1, ctx.getProperty(BehaviorChain.RETRY_ATTEMPT, Integer.class));
    }

    @Test
    void execute_rethrowsNonRetryableFailureImmediately() {
        int[] calls = new int[1];
        RetryPolicy policy = RetryPolicy.builder()
                .maxRetries(5)
                .baseDelay(Duration.ZERO)
                .retryOn(e -> e instanceof IllegalStateException)
                .build();
        BehaviorChain chain = BehaviorChain.build(List.of(
                BehaviorContribution.of("retry", 10, new RetryBehavior(policy)),
                BehaviorContribution.of("bad", 20, (ctx, next) -> {
                    calls[0]++;
                    throw new IllegalArgumentException("bad input");
                })));

        assertThrows(IllegalArgumentException.class, () -> chain.run(new PipelineContext(null)));
        assertEquals(1, calls[0]);
    }
}
