package com.conduit.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable, ordered chain of enabled behaviors plus a terminal continuation.
 * <p>
 * Built from contributions by {@link #build(Collection)}: disabled contributions are dropped, the rest
 * are ordered by ascending priority (ties by id). Execution is a single index-based dispatcher: position
 * {@code i} invokes {@code behaviors[i]} with a continuation that advances to {@code i + 1}; past the last
 * behavior the terminal runs (by default it returns the context's current result).
 * <p>
 * Before each behavior the dispatcher checks the context: a cancelled context (explicitly, or because its
 * deadline passed) stops the chain with {@link PipelineCancelledException}. A contribution whose constraint
 * is false for the request is skipped. A contribution with an {@link ErrorHandler} has failures raised by its
 * own behavior converted into a result; failures coming back from the rest of the chain pass through.
 * <p>
 * {@link #run(PipelineContext)} returns the result or throws one terminal failure: {@link PipelineTimeoutException},
 * {@link PipelineCancelledException}, the unhandled runtime exception, or {@link PipelineExecutionException}
 * wrapping an unhandled checked one.
 */
public final class BehaviorChain {

    private static final Logger log = LoggerFactory.getLogger(BehaviorChain.class);

    /** Property key holding the current retry attempt (1-based) while {@link #withRetry(RetryPolicy)} retries. */
    public static final String RETRY_ATTEMPT = "pipeline.retry.attempt";

    private static final Next RETURN_RESULT = PipelineContext::getResult;
    private static final BehaviorChain EMPTY = new BehaviorChain(List.of(), RETURN_RESULT);

    private final List<BehaviorContribution> behaviors;
    private final Next terminal;
    private final Next entry;

    private BehaviorChain(List<BehaviorContribution> behaviors, Next terminal) {
        this.behaviors = behaviors;
        this.terminal = terminal;
        this.entry = context -> dispatch(0, context);
    }

    private BehaviorChain(List<BehaviorContribution> behaviors, Next terminal, Next entry) {
        this.behaviors = behaviors;
        this.terminal = terminal;
        this.entry = entry;
    }

    /** Chain with no behaviors; running it returns the context's result. */
    public static BehaviorChain empty() {
        return EMPTY;
    }

    public static BehaviorChain build(Collection<BehaviorContribution> contributions) {
        return build(contributions, null);
    }

    /**
     * Builds a chain from contributions.
     *
     * @param contributions contributions in any order; nulls and disabled entries are ignored
     * @param terminal      continuation after the last behavior; null = return the context's current result
     */
    public static BehaviorChain build(Collection<BehaviorContribution> contributions, Next terminal) {
        List<BehaviorContribution> ordered = contributions == null ? List.of() : contributions.stream()
                .filter(Objects::nonNull)
                .filter(BehaviorContribution::isEnabled)
                .sorted(BehaviorContribution.CHAIN_ORDER)
                .collect(Collectors.toUnmodifiableList());
        return new BehaviorChain(ordered, terminal != null ? terminal : RETURN_RESULT);
    }

    /** Number of behaviors in the chain (terminal excluded). */
    public int size() {
        return behaviors.size();
    }

    public boolean isEmpty() {
        return behaviors.isEmpty();
    }

    /** Behaviors in execution order. */
    public List<BehaviorContribution> getBehaviors() {
        return behaviors;
    }

    /** Contribution ids in execution order. */
    public List<String> behaviorIds() {
        return behaviors.stream().map(BehaviorContribution::getId).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Runs the chain against the context.
     *
     * @return the chain result
     * @throws PipelineTimeoutException    if a timeout wrapper's deadline passed first
     * @throws PipelineCancelledException  if the context was cancelled before the chain finished
     * @throws PipelineExecutionException  wrapping an unhandled checked failure
     */
    public Object run(PipelineContext context) {
        Objects.requireNonNull(context, "context");
        try {
            return entry.proceed(context);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineExecutionException(e);
        } catch (Exception e) {
            throw new PipelineExecutionException(e);
        }
    }

    // --- composition ---

    /**
     * Returns this chain with its failures converted by {@code handler}. Cancellation and timeout
     * failures are not offered to the handler.
     */
    public BehaviorChain withErrorHandling(ErrorHandler handler) {
        Objects.requireNonNull(handler, "handler");
        Next inner = entry;
        return new BehaviorChain(behaviors, terminal, context -> {
            try {
                return inner.proceed(context);
            } catch (PipelineCancelledException | PipelineTimeoutException e) {
                throw e;
            } catch (Exception e) {
                context.setProperty(PipelineContext.LAST_ERROR, e);
                return handler.handle(e, context);
            }
        });
    }

    public BehaviorChain withTimeout(Duration timeout) {
        return withTimeout(timeout, ChainWatchdog.shared());
    }

    /**
     * Returns this chain bounded by {@code timeout}. If it has not completed by the deadline, the context is
     * cancelled and {@link PipelineTimeoutException} is reported instead of the eventual result; if it
     * returns before the deadline, its result is returned unchanged and the timer is cancelled.
     */
    public BehaviorChain withTimeout(Duration timeout, ChainWatchdog watchdog) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(watchdog, "watchdog");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        Next inner = entry;
        return new BehaviorChain(behaviors, terminal, context -> {
            ChainWatchdog.Watch watch = watchdog.watch(context, timeout);
            Object result = null;
            Exception failure = null;
            boolean inTime = false;
            boolean fired;
            try {
                result = inner.proceed(context);
                inTime = !context.isDeadlineExceeded();
            } catch (Exception e) {
                failure = e;
            } finally {
                fired = watch.finish();
            }
            // A result produced before the deadline stands even if the watchdog fired just after it.
            if (fired && !inTime) {
                log.warn("Chain execution {} timed out after {} ms", context.getContextId(), timeout.toMillis());
                throw new PipelineTimeoutException(timeout);
            }
            if (failure != null) throw failure;
            return result;
        });
    }

    /**
     * Returns this chain re-run on failure according to {@code policy}. Waits between attempts end early
     * (with {@link PipelineCancelledException}) if the context is cancelled.
     */
    public BehaviorChain withRetry(RetryPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        Next inner = entry;
        return new BehaviorChain(behaviors, terminal, context -> {
            int attempt = 0;
            while (true) {
                try {
                    return inner.proceed(context);
                } catch (Exception e) {
                    if (attempt >= policy.getMaxRetries() || !policy.shouldRetry(e)) {
                        throw e;
                    }
                    attempt++;
                    Duration delay = policy.delayFor(attempt);
                    context.setProperty(RETRY_ATTEMPT, attempt);
                    log.debug("Retrying chain for {} (attempt {}/{}) in {} ms: {}",
                            context.getContextId(), attempt, policy.getMaxRetries(), delay.toMillis(), e.getMessage());
                    if (context.awaitCancellation(delay)) {
                        throw new PipelineCancelledException(context.getCancellationReason());
                    }
                }
            }
        });
    }

    /**
     * Returns a chain that runs this chain only when {@code condition} holds; otherwise runs
     * {@code otherwise}, or returns the context's current result when {@code otherwise} is null.
     */
    public BehaviorChain when(Predicate<PipelineContext> condition, BehaviorChain otherwise) {
        Objects.requireNonNull(condition, "condition");
        Next inner = entry;
        return new BehaviorChain(behaviors, terminal, context -> {
            if (condition.test(context)) {
                return inner.proceed(context);
            }
            return otherwise != null ? otherwise.entry.proceed(context) : context.getResult();
        });
    }

    // --- dispatcher ---

    private Object dispatch(int index, PipelineContext context) throws Exception {
        checkNotCancelled(context);
        if (index >= behaviors.size()) {
            return terminal.proceed(context);
        }
        BehaviorContribution contribution = behaviors.get(index);
        if (!contribution.appliesTo(context)) {
            log.trace("Skipping behavior {} for {}: constraint not met", contribution.getId(), context.getContextId());
            return dispatch(index + 1, context);
        }
        return invoke(contribution, index, context);
    }

    private Object invoke(BehaviorContribution contribution, int index, PipelineContext context) throws Exception {
        ErrorHandler handler = contribution.getErrorHandler();
        if (handler == null) {
            return contribution.getBehavior().execute(context, ctx -> dispatch(index + 1, ctx));
        }
        Exception[] downstream = new Exception[1];
        Next next = ctx -> {
            try {
                return dispatch(index + 1, ctx);
            } catch (Exception e) {
                downstream[0] = e;
                throw e;
            }
        };
        try {
            return contribution.getBehavior().execute(context, next);
        } catch (Exception e) {
            if (e == downstream[0] || e instanceof PipelineCancelledException || e instanceof PipelineTimeoutException) {
                throw e;
            }
            log.debug("Behavior {} failed; handled by its error handler: {}", contribution.getId(), e.getMessage());
            context.setProperty(PipelineContext.LAST_ERROR, e);
            return handler.handle(e, context);
        }
    }

    private static void checkNotCancelled(PipelineContext context) {
        if (!context.isCancelled() && context.isDeadlineExceeded()) {
            context.cancel(CancellationReason.DEADLINE_EXCEEDED);
        }
        CancellationReason reason = context.getCancellationReason();
        if (reason != null) {
            throw new PipelineCancelledException(reason);
        }
    }

    @Override
    public String toString() {
        return "BehaviorChain" + behaviorIds();
    }
}
