package com.conduit.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry settings for {@link BehaviorChain#withRetry(RetryPolicy)} and
 * {@link com.conduit.pipeline.behaviors.RetryBehavior}: number of retries after the first attempt,
 * fixed or exponential delay (capped by {@code maxDelay}), and which failures are retryable.
 * Cancellation and timeout failures are never retried.
 */
public final class RetryPolicy {

    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);
    private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean exponentialBackoff;
    private final Predicate<Throwable> retryOn;

    private RetryPolicy(Builder b) {
        this.maxRetries = b.maxRetries;
        this.baseDelay = b.baseDelay;
        this.maxDelay = b.maxDelay;
        this.exponentialBackoff = b.exponentialBackoff;
        this.retryOn = b.retryOn;
    }

    /** Fixed delay between attempts. */
    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return builder().maxRetries(maxRetries).baseDelay(delay).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean isExponentialBackoff() {
        return exponentialBackoff;
    }

    public boolean shouldRetry(Throwable error) {
        if (error instanceof PipelineCancelledException || error instanceof PipelineTimeoutException) {
            return false;
        }
        return retryOn.test(error);
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        if (!exponentialBackoff || attempt <= 1) {
            return min(baseDelay, maxDelay);
        }
        int shift = Math.min(attempt - 1, 30);
        long millis = baseDelay.toMillis() * (1L << shift);
        if (millis < 0) millis = Long.MAX_VALUE;
        return min(Duration.ofMillis(millis), maxDelay);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private boolean exponentialBackoff;
        private Predicate<Throwable> retryOn = t -> true;

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        public Builder exponentialBackoff(boolean exponentialBackoff) {
            this.exponentialBackoff = exponentialBackoff;
            return this;
        }

        public Builder retryOn(Predicate<Throwable> retryOn) {
            this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
