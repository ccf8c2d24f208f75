package com.pubannotator.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {
    private final List<Duration> slept = new ArrayList<>();

    private RetryPolicy policy(int attempts, long jitterMs, double random) {
        return new RetryPolicy(attempts, Duration.ofMillis(100), 2.0, Duration.ofMillis(1_000),
            Duration.ofMillis(jitterMs), () -> random, slept::add);
    }

    @Test
    void testFirstAttemptHasNoDelay() {
        assertEquals(Duration.ZERO, policy(3, 50, 1.0).delayBeforeAttempt(1));
    }

    @Test
    void testExponentialScheduleCapped() {
        RetryPolicy p = policy(10, 0, 0.5);
        assertEquals(100, p.delayBeforeAttempt(2).toMillis());
        assertEquals(200, p.delayBeforeAttempt(3).toMillis());
        assertEquals(400, p.delayBeforeAttempt(4).toMillis());
        assertEquals(800, p.delayBeforeAttempt(5).toMillis());
        assertEquals(1_000, p.delayBeforeAttempt(6).toMillis());
        assertEquals(1_000, p.delayBeforeAttempt(9).toMillis());
    }

    @Test
    void testJitterStaysWithinBounds() {
        assertEquals(150, policy(3, 50, 1.0).delayBeforeAttempt(2).toMillis());
        assertEquals(50, policy(3, 50, 0.0).delayBeforeAttempt(2).toMillis());
        RetryPolicy random = new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofMillis(1_000), Duration.ofMillis(50));
        for (int i = 0; i < 200; i++) {
            long d = random.delayBeforeAttempt(3).toMillis();
            assertTrue(d >= 150 && d <= 250, "delay " + d);
        }
    }

    @Test
    void testJitterNeverGoesNegative() {
        RetryPolicy p = new RetryPolicy(3, Duration.ofMillis(10), 2.0, Duration.ofMillis(100),
            Duration.ofMillis(500), () -> 0.0, d -> { });
        assertEquals(Duration.ZERO, p.delayBeforeAttempt(2));
    }

    @Test
    void testAttemptBudget() {
        RetryPolicy p = policy(3, 0, 0.5);
        assertTrue(p.hasAttemptsLeft(2));
        assertFalse(p.hasAttemptsLeft(3));
    }

    @Test
    void testExecuteRetriesThenSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = policy(3, 0, 0.5).execute(() -> {
            if (calls.incrementAndGet() < 3) throw new PersistenceException("down");
            return "ok";
        }, e -> e instanceof PersistenceException, "test write");

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), slept);
    }

    @Test
    void testExecuteRethrowsLastErrorWhenBudgetSpent() {
        AtomicInteger calls = new AtomicInteger();
        PersistenceException e = assertThrows(PersistenceException.class, () ->
            policy(2, 0, 0.5).execute(() -> {
                throw new PersistenceException("down " + calls.incrementAndGet());
            }, ex -> true, "test write"));

        assertEquals("down 2", e.getMessage());
        assertEquals(1, slept.size());
    }

    @Test
    void testExecuteStopsOnNonRetryableError() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IllegalStateException.class, () ->
            policy(5, 0, 0.5).execute(() -> {
                calls.incrementAndGet();
                throw new IllegalStateException("bad");
            }, e -> e instanceof PersistenceException, "test write"));
        assertEquals(1, calls.get());
        assertTrue(slept.isEmpty());
    }

    @Test
    void testInvalidSettingsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, 0.5, Duration.ZERO, Duration.ZERO));
    }
}
