package com.conduit.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request-scoped state for one chain execution: the inbound message, a mutable result slot,
 * cooperative cancellation with an optional deadline, and a string-keyed property bag for
 * cross-behavior metadata.
 * <p>
 * A context is created per inbound message and must not be shared across requests. Cancellation
 * may be signalled from another thread (e.g. the timeout watchdog); all other state is written by
 * the behaviors of the single request that owns the context.
 */
public final class PipelineContext {

    /** Property key under which the most recent failure handled by an error handler is stored. */
    public static final String LAST_ERROR = "pipeline.lastError";

    private final String contextId;
    private final Instant createdAt;
    private final Object message;
    private final Map<String, Object> properties = new ConcurrentHashMap<>();
    private final AtomicReference<CancellationReason> cancellation = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile Object result;
    private volatile Instant deadline;

    public PipelineContext(Object message) {
        this.contextId = UUID.randomUUID().toString();
        this.createdAt = Instant.now();
        this.message = message;
    }

    public String getContextId() {
        return contextId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** Inbound message; may be null. */
    public Object getMessage() {
        return message;
    }

    /** Typed access to the inbound message. */
    public <T> T getMessage(Class<T> type) {
        return type.isInstance(message) ? type.cast(message) : null;
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    // --- cancellation ---

    /** Requests cooperative cancellation. The chain stops before invoking the next behavior. */
    public void cancel() {
        cancel(CancellationReason.REQUESTED);
    }

    /**
     * Cancels with the given reason. The first reason wins; later calls are ignored.
     *
     * @return true if this call cancelled the context
     */
    public boolean cancel(CancellationReason reason) {
        Objects.requireNonNull(reason, "reason");
        if (cancellation.compareAndSet(null, reason)) {
            cancelled.countDown();
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancellation.get() != null;
    }

    /** Reason of cancellation, or null if not cancelled. */
    public CancellationReason getCancellationReason() {
        return cancellation.get();
    }

    /**
     * Blocks until the context is cancelled or the wait elapses. Behaviors waiting on I/O can use this
     * (or {@link #remaining()}) to give up early when the request is abandoned.
     *
     * @return true if the context was cancelled
     */
    public boolean awaitCancellation(Duration wait) throws InterruptedException {
        long nanos = wait.compareTo(ChainWatchdog.MAX_DELAY) > 0 ? Long.MAX_VALUE : Math.max(0L, wait.toNanos());
        return cancelled.await(nanos, TimeUnit.NANOSECONDS);
    }

    /** Absolute deadline for this request, or null if unbounded. */
    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Sets the deadline, keeping the earlier one if a deadline is already set (nested timeouts
     * can only shorten the budget).
     */
    public synchronized void restrictDeadline(Instant candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (deadline == null || candidate.isBefore(deadline)) {
            deadline = candidate;
        }
    }

    public boolean isDeadlineExceeded() {
        Instant d = deadline;
        return d != null && !Instant.now().isBefore(d);
    }

    /** Time left before the deadline; {@code null} when unbounded, {@link Duration#ZERO} when exceeded. */
    public Duration remaining() {
        Instant d = deadline;
        if (d == null) return null;
        Duration left = Duration.between(Instant.now(), d);
        return left.isNegative() ? Duration.ZERO : left;
    }

    // --- properties ---

    /** Sets a property; a null value removes it. */
    public void setProperty(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            properties.remove(key);
        } else {
            properties.put(key, value);
        }
    }

    public Object getProperty(String key) {
        return key != null ? properties.get(key) : null;
    }

    /** Returns the property cast to {@code type}, or null if absent or of another type. */
    public <T> T getProperty(String key, Class<T> type) {
        Object v = getProperty(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    public boolean hasProperty(String key) {
        return key != null && properties.containsKey(key);
    }

    public Object removeProperty(String key) {
        return key != null ? properties.remove(key) : null;
    }

    /** Snapshot of all properties. */
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(new HashMap<>(properties));
    }

    @Override
    public String toString() {
        return "PipelineContext{" + contextId + (isCancelled() ? ", cancelled=" + cancellation.get() : "") + "}";
    }
}
