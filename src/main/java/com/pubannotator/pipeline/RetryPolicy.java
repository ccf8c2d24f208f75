package com.pubannotator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Attempt budget plus exponential backoff schedule.
 * <p>
 * Attempt 1 runs immediately. The delay before attempt {@code k >= 2} is
 * {@code min(maxDelay, baseDelay * multiplier^(k-2))} plus a uniform jitter in
 * {@code [-jitter, +jitter]}, clamped at zero.
 * <p>
 * The annotation scheduler reads {@link #delayBeforeAttempt(int)} to schedule retries without
 * blocking a worker; {@link #execute(Action, Predicate, String)} is the blocking form used for
 * run-level retries of persistence writes.
 *
 * @author Publication Annotator Team
 * @since 1.0
 */
public class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    /** Blocking wait between attempts; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /** Unit of work retried by {@link #execute(Action, Predicate, String)}. */
    @FunctionalInterface
    public interface Action<T, E extends Exception> {
        T run() throws E;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final Duration jitter;
    private final DoubleSupplier random;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay,
                       Duration jitter, DoubleSupplier random, Sleeper sleeper) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be at least 1.0");
        if (baseDelay.isNegative() || maxDelay.isNegative() || jitter.isNegative()) {
            throw new IllegalArgumentException("delays cannot be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
        this.sleeper = sleeper;
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay, Duration jitter) {
        this(maxAttempts, baseDelay, multiplier, maxDelay, jitter, new Random()::nextDouble,
            duration -> Thread.sleep(duration.toMillis()));
    }

    /** Policy for annotation attempts, built from the run configuration. */
    public static RetryPolicy forAnnotation(PipelineConfig config) {
        return new RetryPolicy(config.maxAttempts(), config.baseDelay(), config.multiplier(),
            config.maxDelay(), config.jitter());
    }

    /** Policy for run-level persistence retries: same backoff, the sink's own attempt budget. */
    public static RetryPolicy forPersistence(PipelineConfig config) {
        return new RetryPolicy(config.persistAttempts(), config.baseDelay(), config.multiplier(),
            config.maxDelay(), config.jitter());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /** Backoff before the given 1-based attempt, without jitter. */
    public Duration baseDelayBeforeAttempt(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 2);
        long capped = (long) Math.min((double) maxDelay.toMillis(), millis);
        return Duration.ofMillis(capped);
    }

    /** Backoff before the given 1-based attempt, jitter included. */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        long base = baseDelayBeforeAttempt(attempt).toMillis();
        long offset = Math.round((random.getAsDouble() * 2.0 - 1.0) * jitter.toMillis());
        return Duration.ofMillis(Math.max(0L, base + offset));
    }

    /**
     * Runs the action until it succeeds, a non-retryable exception is thrown, or the budget is
     * spent. The last exception is rethrown.
     * @throws InterruptedException if interrupted while backing off
     */
    public <T, E extends Exception> T execute(Action<T, E> action, Predicate<Exception> retryable, String actionDesc)
            throws E, InterruptedException {
        int attempt = 1;
        while (true) {
            try {
                return action.run();
            } catch (Exception e) {
                if (!retryable.test(e) || !hasAttemptsLeft(attempt)) {
                    logger.warn("Giving up on {} after {} attempt(s): {}", actionDesc, attempt, e.getMessage());
                    throw RetryPolicy.<E>castChecked(e);
                }
                attempt++;
                Duration delay = delayBeforeAttempt(attempt);
                logger.warn("Failed {} (attempt {}), retrying in {} ms: {}", actionDesc, attempt - 1, delay.toMillis(), e.getMessage());
                sleeper.sleep(delay);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Exception> E castChecked(Exception e) {
        return (E) e;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay.toMillis() + "ms, multiplier="
            + multiplier + ", maxDelay=" + maxDelay.toMillis() + "ms, jitter=" + jitter.toMillis() + "ms}";
    }
}
