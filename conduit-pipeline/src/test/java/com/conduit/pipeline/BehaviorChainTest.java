package com.conduit.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BehaviorChainTest {

    private final List<String> trace = new CopyOnWriteArrayList<>();
    private final ChainWatchdog watchdog = new ChainWatchdog("test-watchdog");

    @AfterEach
    void tearDown() {
        watchdog.close();
    }

    private BehaviorContribution tracing(String id, int priority) {
        return BehaviorContribution.of(id, priority, (ctx, next) -> {
            trace.add(id);
            return next.proceed(ctx);
        });
    }

    @Test
    void run_invokesBehaviorsInPriorityOrderThenTerminal() {
        BehaviorChain chain = BehaviorChain.build(
                List.of(tracing("C", 30), tracing("A", 10), tracing("B", 20)),
                ctx -> {
                    trace.add("T");
                    return "done";
                });

        Object result = chain.run(new PipelineContext("msg"));

        assertEquals("done", result);
        assertEquals(List.of("A", "B", "C", "T"), trace);
        assertEquals(List.of("A", "B", "C"), chain.behaviorIds());
    }

    @Test
    void build_breaksPriorityTiesById() {
        BehaviorChain chain = BehaviorChain.build(List.of(tracing("zeta", 5), tracing("alpha", 5), tracing("mid", 5)));

        assertEquals(List.of("alpha", "mid", "zeta"), chain.behaviorIds());
    }

    @Test
    void build_dropsDisabledContributions() {
        BehaviorContribution disabled = tracing("B", 20).withEnabled(false);
        BehaviorChain chain = BehaviorChain.build(List.of(tracing("A", 10), disabled));

        chain.run(new PipelineContext(null));

        assertEquals(List.of("A"), trace);
        assertEquals(1, chain.size());
    }

    @Test
    void run_emptyChainReturnsContextResult() {
        PipelineContext ctx = new PipelineContext("m");
        ctx.setResult("preset");

        assertEquals("preset", BehaviorChain.empty().run(ctx));
        assertTrue(BehaviorChain.empty().isEmpty());
    }

    @Test
    void run_behaviorThatDoesNotCallNextShortCircuits() {
        BehaviorContribution stop = BehaviorContribution.of("B", 20, (ctx, next) -> {
            trace.add("B");
            return "short";
        });
        BehaviorChain chain = BehaviorChain.build(List.of(tracing("A", 10), stop, tracing("C", 30)),
                ctx -> {
                    trace.add("T");
                    return "terminal";
                });

        assertEquals("short", chain.run(new PipelineContext("m")));
        assertEquals(List.of("A", "B"), trace);
    }

    @Test
    void run_skipsBehaviorWhoseConstraintIsFalse() {
        BehaviorContribution onlyStrings = BehaviorContribution.builder()
                .id("B")
                .priority(20)
                .constraint(ctx -> ctx.getMessage() instanceof String)
                .behavior((ctx, next) -> {
                    trace.add("B");
                    return next.proceed(ctx);
                })
                .build();
        BehaviorChain chain = BehaviorChain.build(List.of(tracing("A", 10), onlyStrings, tracing("C", 30)));

        chain.run(new PipelineContext(42));
        assertEquals(List.of("A", "C"), trace);

        trace.clear();
        chain.run(new PipelineContext("text"));
        assertEquals(List.of("A", "B", "C"), trace);
    }

    @Test
    void run_behaviorCanModifyResultAfterNext() {
        BehaviorContribution wrap = BehaviorContribution.of("wrap", 1, (ctx, next) -> "[" + next.proceed(ctx) + "]");
        BehaviorChain chain = BehaviorChain.build(List.of(wrap), ctx -> "core");

        assertEquals("[core]", chain.run(new PipelineContext(null)));
    }

    @Test
    void run_errorHandlerConvertsOwnFailureIntoResult() {
        BehaviorContribution failing = BehaviorContribution.builder()
                .id("B")
                .priority(20)
                .behavior((ctx, next) -> {
                    throw new IllegalStateException("boom");
                })
                .errorHandler((error, ctx) -> "handled:" + error.getMessage())
                .build();
        BehaviorChain chain = BehaviorChain.build(List.of(tracing("A", 10), failing, tracing("C", 30)));
        PipelineContext ctx = new PipelineContext("m");

        assertEquals("handled:boom", chain.run(ctx));
        assertEquals(List.of("A"), trace);
        assertInstanceOf(IllegalStateException.class, ctx.getProperty(PipelineContext.LAST_ERROR));
    }

    @Test
    void run_errorHandlerDoesNotInterceptDownstreamFailure() {
        List<Exception> handled = new ArrayList<>();
        BehaviorContribution guarded = BehaviorContribution.builder()
                .id("A")
                .priority(10)
                .behavior((ctx, next) -> next.proceed(ctx))
                .errorHandler((error, ctx) -> {
                    handled.add(error);
                    return "handled";
                })
                .build();
        BehaviorContribution failing = BehaviorContribution.of("B", 20, (ctx, next) -> {
            throw new IllegalArgumentException("downstream");
        });
        BehaviorChain chain = BehaviorChain.build(List.of(guarded, failing));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> chain.run(new PipelineContext("m")));
        assertEquals("downstream", e.getMessage());
        assertTrue(handled.isEmpty());
    }

    @Test
    void run_unhandledRuntimeExceptionPropagatesUnchanged() {
        IllegalStateException boom = new IllegalStateException("boom");
        BehaviorChain chain = BehaviorChain.build(List.of(BehaviorContribution.of("A", (ctx, next) -> {
            throw boom;
        })));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> chain.run(new PipelineContext(null)));
        assertSame(boom, thrown);
    }

    @Test
    void run_checkedFailureIsWrapped() {
        BehaviorChain chain = BehaviorChain.build(List.of(BehaviorContribution.of("A", (ctx, next) -> {
            throw new IOException("disk");
        })));

        PipelineExecutionException e = assertThrows(PipelineExecutionException.class,
                () -> chain.run(new PipelineContext(null)));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void run_cancelledContextStopsBeforeNextBehavior() {
        BehaviorContribution cancelling = BehaviorContribution.of("A", 10, (ctx, next) -> {
            trace.add("A");
            ctx.cancel();
            return next.proceed(ctx);
        });
        BehaviorChain chain = BehaviorChain.build(List.of(cancelling, tracing("B", 20)));

        PipelineCancelledException e = assertThrows(PipelineCancelledException.class,
                () -> chain.run(new PipelineContext("m")));
        assertEquals(CancellationReason.REQUESTED, e.getReason());
        assertEquals(List.of("A"), trace);
    }

    @Test
    void run_cancellationIsNotOfferedToErrorHandler() {
        BehaviorContribution guarded = BehaviorContribution.builder()
                .id("A")
                .behavior((ctx, next) -> {
                    ctx.cancel();
                    return next.proceed(ctx);
                })
                .errorHandler((error, ctx) -> "swallowed")
                .build();
        BehaviorChain chain = BehaviorChain.build(List.of(guarded, tracing("B", 2000)));

        assertThrows(PipelineCancelledException.class, () -> chain.run(new PipelineContext(null)));
    }

    @Test
    void withTimeout_returnsResultWhenChainFinishesInTime() {
        BehaviorChain chain = BehaviorChain.build(List.of(tracing("A", 10)), ctx -> "fast")
                .withTimeout(Duration.ofSeconds(5), watchdog);
        PipelineContext ctx = new PipelineContext("m");

        assertEquals("fast", chain.run(ctx));
        assertFalse(ctx.isCancelled());
    }

    @Test
    void withTimeout_reportsTimeoutAndCancelsSlowChain() {
        BehaviorContribution slow = BehaviorContribution.of("slow", 10, (ctx, next) -> {
            ctx.awaitCancellation(Duration.ofSeconds(10));
            trace.add("slow-woke");
            return next.proceed(ctx);
        });
        BehaviorChain chain = BehaviorChain.build(List.of(slow, tracing("after", 20)), ctx -> "late")
                .withTimeout(Duration.ofMillis(50), watchdog);
        PipelineContext ctx = new PipelineContext("m");

        long start = System.nanoTime();
        PipelineTimeoutException e = assertThrows(PipelineTimeoutException.class, () -> chain.run(ctx));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertEquals(Duration.ofMillis(50), e.getTimeout());
        assertEquals(CancellationReason.DEADLINE_EXCEEDED, ctx.getCancellationReason());
        assertEquals(List.of("slow-woke"), trace);
        assertTrue(elapsedMs < 5_000, "chain should stop early, took " + elapsedMs + " ms");
    }

    @Test
    void withTimeout_timeoutIsNotOfferedToOuterErrorHandling() {
        BehaviorChain chain = BehaviorChain.build(List.of(BehaviorContribution.of("slow", (ctx, next) -> {
                    ctx.awaitCancellation(Duration.ofSeconds(10));
                    return next.proceed(ctx);
                })))
                .withTimeout(Duration.ofMillis(30), watchdog)
                .withErrorHandling((error, ctx) -> "swallowed");

        assertThrows(PipelineTimeoutException.class, () -> chain.run(new PipelineContext(null)));
    }

    @Test
    void withTimeout_rejectsNegativeTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> BehaviorChain.empty().withTimeout(Duration.ofMillis(-1), watchdog));
    }

    @Test
    void withErrorHandling_convertsChainFailure() {
        BehaviorChain chain = BehaviorChain.build(List.of(BehaviorContribution.of("A", (ctx, next) -> {
            throw new IllegalStateException("bad");
        }))).withErrorHandling((error, ctx) -> "fallback");
        PipelineContext ctx = new PipelineContext(null);

        assertEquals("fallback", chain.run(ctx));
        assertInstanceOf(IllegalStateException.class, ctx.getProperty(PipelineContext.LAST_ERROR));
    }

    @Test
    void withRetry_rerunsChainUntilSuccess() {
        int[] calls = new int[1];
        BehaviorChain chain = BehaviorChain.build(List.of(BehaviorContribution.of("flaky", (ctx, next) -> {
            if (++calls[0] < 3) {
                throw new IllegalStateException("attempt " + calls[0]);
            }
            return "ok";
        }))).withRetry(RetryPolicy.fixed(3, Duration.ofMillis(1)));
        PipelineContext ctx = new PipelineContext(null);

        assertEquals("ok", chain.run(ctx));
        assertEquals(3, calls[0]);
        assertEquals(2, ctx.getProperty(BehaviorChain.RETRY_ATTEMPT, Integer.class));
    }

    @Test
    void withRetry_givesUpAfterMaxRetries() {
        int[] calls = new int[1];
        BehaviorChain chain = BehaviorChain.build(List.of(BehaviorContribution.of("broken", (ctx, next) -> {
            calls[0]++;
            throw new IllegalStateException("always");
        }))).withRetry(RetryPolicy.fixed(2, Duration.ZERO));

        assertThrows(IllegalStateException.class, () -> chain.run(new PipelineContext(null)));
        assertEquals(3, calls[0]);
    }

    @Test
    void when_runsOtherwiseBranchWhenConditionFails() {
        BehaviorChain main = BehaviorChain.build(List.of(tracing("main", 1)), ctx -> "main");
        BehaviorChain other = BehaviorChain.build(List.of(tracing("other", 1)), ctx -> "other");
        BehaviorChain chain = main.when(ctx -> "go".equals(ctx.getMessage()), other);

        assertEquals("main", chain.run(new PipelineContext("go")));
        assertEquals("other", chain.run(new PipelineContext("stop")));
        assertEquals(List.of("main", "other"), trace);
    }

    @Test
    void when_withoutOtherwiseReturnsCurrentResult() {
        BehaviorChain chain = BehaviorChain.build(List.of(tracing("A", 1)), ctx -> "ran")
                .when(ctx -> false, null);

        assertNull(chain.run(new PipelineContext(null)));
        assertTrue(trace.isEmpty());
    }
}
