package fr.lapetina.mcp.client.domain.retry;

import java.time.Duration;
import java.util.Locale;

/**
 * Backoff growth schedule between retries.
 *
 * The {@code attempt} passed to {@link #baseDelay} is 1-indexed and counts retries,
 * not the original attempt: the first retry is attempt 1.
 */
public enum RetryStrategy {

    /** Never retries, whatever the configured retry count. */
    NONE {
        @Override
        long multiplier(int attempt) {
            return 0;
        }
    },

    /** base * attempt */
    LINEAR {
        @Override
        long multiplier(int attempt) {
            return attempt;
        }
    },

    /** base * 2^(attempt-1) */
    EXPONENTIAL {
        @Override
        long multiplier(int attempt) {
            if (attempt - 1 >= Long.SIZE - 1) {
                return Long.MAX_VALUE;
            }
            return 1L << (attempt - 1);
        }
    },

    /** base * fib(attempt), fib(1) = fib(2) = 1 */
    FIBONACCI {
        @Override
        long multiplier(int attempt) {
            long previous = 0;
            long current = 1;
            for (int i = 1; i < attempt; i++) {
                long next = previous + current;
                if (next < 0) {
                    return Long.MAX_VALUE;
                }
                previous = current;
                current = next;
            }
            return current;
        }
    };

    abstract long multiplier(int attempt);

    public boolean allowsRetries() {
        return this != NONE;
    }

    /**
     * Computes the pre-jitter delay for a retry.
     *
     * @param attempt   1-indexed retry number
     * @param baseDelay configured base delay
     * @return the uncapped, unjittered delay
     */
    public Duration baseDelay(int attempt, Duration baseDelay) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Retry attempt must be >= 1, was " + attempt);
        }
        long factor = multiplier(attempt);
        if (factor == 0) {
            return Duration.ZERO;
        }
        long baseMillis = baseDelay.toMillis();
        try {
            return Duration.ofMillis(Math.multiplyExact(baseMillis, factor));
        } catch (ArithmeticException e) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
    }

    /**
     * Parses a strategy name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static RetryStrategy fromName(String name) {
        return RetryStrategy.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
