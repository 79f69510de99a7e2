package com.locus.core.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries an unreliable call with a bounded number of attempts.
 *
 * <p>Exceptions rejected by the {@code retryOn} predicate are rethrown
 * immediately. When every attempt fails, {@link RetryExhaustedException} is
 * thrown carrying the last failure.
 *
 * <pre>{@code
 * var policy = RetryPolicy.builder()
 *         .maxAttempts(10)
 *         .fixedDelay(Duration.ofSeconds(30))
 *         .retryOn(e -> !(e instanceof ApiException api && api.isNotFound()))
 *         .build();
 * Task task = policy.execute("dispatch", () -> api.dispatchNextTask(...));
 * }</pre>
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Blocks the calling thread between attempts. Replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /** Notified before each retry. */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int failedAttempt, RuntimeException error, Duration delay);
    }

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final Predicate<RuntimeException> retryOn;
    private final Sleeper sleeper;
    private final RetryListener listener;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.retryOn = builder.retryOn;
        this.sleeper = builder.sleeper;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code action} until it returns, fails with a non-retryable error,
     * or the attempt ceiling is reached.
     *
     * @param operation short name used in log messages
     * @param action    the call to attempt
     * @return the first successful result
     */
    public <T> T execute(String operation, Supplier<T> action) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryOn.test(e)) {
                    throw e;
                }
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = delayFor(attempt);
                log.warn("{} failed (attempt {}/{}): {}. Retrying in {}s",
                        operation, attempt, maxAttempts, e.getMessage(), delay.toSeconds());
                listener.onRetry(attempt, e, delay);
                pause(operation, delay);
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, last);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    Duration delayFor(int failedAttempt) {
        if (multiplier == 1.0) {
            return initialDelay;
        }
        double factor = Math.pow(multiplier, failedAttempt - 1);
        long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(millis);
    }

    private void pause(String operation, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryExhaustedException(operation + " interrupted while waiting to retry", e);
        }
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(1);
        private double multiplier = 1.0;
        private Predicate<RuntimeException> retryOn = e -> true;
        private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());
        private RetryListener listener = (attempt, error, delay) -> { };

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder fixedDelay(Duration delay) {
            this.initialDelay = Objects.requireNonNull(delay);
            this.maxDelay = delay;
            this.multiplier = 1.0;
            return this;
        }

        public Builder exponentialBackoff(Duration initial, Duration max, double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
            }
            this.initialDelay = Objects.requireNonNull(initial);
            this.maxDelay = Objects.requireNonNull(max);
            this.multiplier = multiplier;
            return this;
        }

        public Builder retryOn(Predicate<RuntimeException> retryOn) {
            this.retryOn = Objects.requireNonNull(retryOn);
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper);
            return this;
        }

        public Builder onRetry(RetryListener listener) {
            this.listener = Objects.requireNonNull(listener);
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
