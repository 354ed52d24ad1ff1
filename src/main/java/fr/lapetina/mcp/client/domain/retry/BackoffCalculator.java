package fr.lapetina.mcp.client.domain.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes jittered, capped retry delays.
 *
 * The strategy's base delay is scaled by a uniform factor in [0.8, 1.2] and then
 * capped at the configured maximum.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class BackoffCalculator {

    /** Jitter spread on each side of the base delay. */
    public static final double JITTER_RATIO = 0.2;

    private final RetryStrategy strategy;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final DoubleSupplier uniformSource;

    public BackoffCalculator(RetryStrategy strategy, Duration baseDelay, Duration maxDelay) {
        this(strategy, baseDelay, maxDelay, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param uniformSource supplies values in [0, 1)
     */
    public BackoffCalculator(
            RetryStrategy strategy,
            Duration baseDelay,
            Duration maxDelay,
            DoubleSupplier uniformSource
    ) {
        this.strategy = Objects.requireNonNull(strategy, "Strategy is required");
        this.baseDelay = Objects.requireNonNull(baseDelay, "Base delay is required");
        this.maxDelay = Objects.requireNonNull(maxDelay, "Max delay is required");
        this.uniformSource = Objects.requireNonNull(uniformSource, "Random source is required");
    }

    /**
     * Returns the delay to sleep before the given retry.
     *
     * @param attempt 1-indexed retry number
     */
    public Duration delayFor(int attempt) {
        Duration base = strategy.baseDelay(attempt, baseDelay);
        if (base.isZero()) {
            return Duration.ZERO;
        }
        // Even the lowest jitter factor would exceed the cap
        if (base.compareTo(maxDelay.multipliedBy(2)) >= 0) {
            return maxDelay;
        }
        double factor = 1.0 - JITTER_RATIO + (uniformSource.getAsDouble() * 2 * JITTER_RATIO);
        double jittered = base.toNanos() * factor;
        long capped = (long) Math.min(jittered, (double) maxDelay.toNanos());
        return Duration.ofNanos(Math.max(0, capped));
    }

    public RetryStrategy getStrategy() {
        return strategy;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
