package com.locus.core.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private RetryPolicy.Builder policy() {
        return RetryPolicy.builder().sleeper(sleeps::add);
    }

    @Test
    void returnsFirstSuccess() {
        var calls = new AtomicInteger();

        String result = policy().maxAttempts(5).fixedDelay(Duration.ofSeconds(30)).build()
                .execute("dispatch", () -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new IllegalStateException("503");
                    }
                    return "task";
                });

        assertEquals("task", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(30), Duration.ofSeconds(30)), sleeps);
    }

    @Test
    void nonRetryableErrorIsRethrownImmediately() {
        var calls = new AtomicInteger();
        var policy = policy().maxAttempts(5).retryOn(e -> !(e instanceof IllegalArgumentException)).build();

        assertThrows(IllegalArgumentException.class, () -> policy.execute("dispatch", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("400");
        }));
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void exhaustionCarriesLastError() {
        var policy = policy().maxAttempts(3).fixedDelay(Duration.ofMillis(5)).build();

        var e = assertThrows(RetryExhaustedException.class,
                () -> policy.execute("dispatch", () -> { throw new IllegalStateException("down"); }));

        assertEquals(3, e.getAttempts());
        assertEquals("dispatch failed after 3 attempts: down", e.getMessage());
        assertEquals(2, sleeps.size());
    }

    @Test
    void listenerSeesEveryRetry() {
        var attempts = new ArrayList<Integer>();
        var policy = policy().maxAttempts(3).onRetry((attempt, error, delay) -> attempts.add(attempt)).build();

        assertThrows(RetryExhaustedException.class,
                () -> policy.execute("op", () -> { throw new IllegalStateException(); }));

        assertEquals(List.of(1, 2), attempts);
    }

    @Test
    void exponentialBackoffIsCapped() {
        var policy = policy().exponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0).build();

        assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(3));
        assertEquals(Duration.ofSeconds(5), policy.delayFor(6));
    }

    @Test
    void interruptedSleepStopsRetrying() {
        var policy = RetryPolicy.builder().maxAttempts(3)
                .sleeper(d -> { throw new InterruptedException(); })
                .build();

        var e = assertThrows(RetryExhaustedException.class,
                () -> policy.execute("dispatch", () -> { throw new IllegalStateException(); }));

        assertTrue(e.getMessage().contains("interrupted"));
        assertTrue(Thread.interrupted());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.builder().exponentialBackoff(Duration.ZERO, Duration.ZERO, 0.5));
    }
}
