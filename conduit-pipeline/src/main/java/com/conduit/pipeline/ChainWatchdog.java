package com.conduit.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deadline watchdog for chain executions. Watching a context sets its deadline and schedules one task
 * that cancels the context with {@link CancellationReason#DEADLINE_EXCEEDED} if the execution has not
 * finished by then. Cancellation is cooperative: the chain observes it before invoking the next behavior,
 * and behaviors waiting on I/O can observe it through {@link PipelineContext#awaitCancellation(Duration)}.
 */
public final class ChainWatchdog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChainWatchdog.class);

    /** Longest delay the scheduler can represent; longer timeouts are clamped to it. */
    static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    private static final int WATCHING = 0;
    private static final int FIRED = 1;
    private static final int FINISHED = 2;

    private static final ChainWatchdog SHARED = new ChainWatchdog("conduit-chain-watchdog");

    private final ScheduledExecutorService scheduler;

    public ChainWatchdog(String threadName) {
        Objects.requireNonNull(threadName, "threadName");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /** Process-wide watchdog backed by one daemon thread. */
    public static ChainWatchdog shared() {
        return SHARED;
    }

    /**
     * Starts watching {@code context}: its deadline becomes at most now + {@code timeout}. Timeouts longer
     * than about 292 years are clamped.
     *
     * @return handle that must be finished when the execution returns
     */
    public Watch watch(PipelineContext context, Duration timeout) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(timeout, "timeout");
        Duration bounded = timeout.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : timeout;
        context.restrictDeadline(Instant.now().plus(bounded));
        Duration delay = context.remaining();
        AtomicInteger state = new AtomicInteger(WATCHING);
        ScheduledFuture<?> task = scheduler.schedule(() -> {
            // Only a still-running execution is cancelled; finish() wins the race otherwise.
            if (state.compareAndSet(WATCHING, FIRED) && context.cancel(CancellationReason.DEADLINE_EXCEEDED)) {
                log.debug("Deadline exceeded for {}; cancelling in-flight chain", context.getContextId());
            }
        }, delay != null ? delay.toNanos() : 0L, TimeUnit.NANOSECONDS);
        return new Watch(task, state);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    /**
     * Handle for one watched execution.
     */
    public static final class Watch {
        private final ScheduledFuture<?> task;
        private final AtomicInteger state;

        private Watch(ScheduledFuture<?> task, AtomicInteger state) {
            this.task = task;
            this.state = state;
        }

        /**
         * Marks the execution finished and cancels the timer.
         *
         * @return true if this watch's deadline fired before the execution finished
         */
        public boolean finish() {
            boolean finishedFirst = state.compareAndSet(WATCHING, FINISHED);
            task.cancel(false);
            return !finishedFirst;
        }
    }
}
