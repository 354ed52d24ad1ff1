package fr.lapetina.mcp.client.infrastructure.http;

import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Per-destination circuit breaker, fed once per logical request (not per attempt).
 *
 * <ul>
 *   <li>CLOSED: requests pass; consecutive failures are counted</li>
 *   <li>OPEN: requests are refused until the recovery timeout has elapsed</li>
 *   <li>HALF_OPEN: trial requests pass; enough successes close the circuit, one failure reopens it</li>
 * </ul>
 *
 * A failure threshold of 0 disables the breaker.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String destination;
    private final int failureThreshold;
    private final long recoveryNanos;
    private final int halfOpenSuccesses;
    private final LongSupplier nanoClock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger trialSuccesses = new AtomicInteger();
    private final AtomicLong openedAtNanos = new AtomicLong();

    public CircuitBreaker(String destination, int failureThreshold, Duration recoveryTimeout) {
        this(destination, failureThreshold, recoveryTimeout, 1, System::nanoTime);
    }

    CircuitBreaker(
            String destination,
            int failureThreshold,
            Duration recoveryTimeout,
            int halfOpenSuccesses,
            LongSupplier nanoClock
    ) {
        if (failureThreshold < 0) {
            throw new IllegalArgumentException("failureThreshold must be >= 0, was " + failureThreshold);
        }
        if (halfOpenSuccesses < 1) {
            throw new IllegalArgumentException("halfOpenSuccesses must be >= 1, was " + halfOpenSuccesses);
        }
        this.destination = destination;
        this.failureThreshold = failureThreshold;
        this.recoveryNanos = recoveryTimeout.toNanos();
        this.halfOpenSuccesses = halfOpenSuccesses;
        this.nanoClock = nanoClock;
    }

    static CircuitBreaker forDestination(String destination, TransportConfig config) {
        return new CircuitBreaker(destination,
                config.getCircuitBreakerFailureThreshold(),
                config.getCircuitBreakerRecoveryTimeout());
    }

    public boolean isEnabled() {
        return failureThreshold > 0;
    }

    /**
     * @return false while the circuit is open and the recovery timeout has not elapsed
     */
    public boolean allowRequest() {
        if (!isEnabled()) {
            return true;
        }
        return switch (state.get()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> tryHalfOpen();
        };
    }

    private boolean tryHalfOpen() {
        if (remainingOpenNanos() > 0) {
            return false;
        }
        if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            trialSuccesses.set(0);
            log.info("Circuit breaker half-open, letting trial requests through: destination={}", destination);
        }
        return true;
    }

    public void recordSuccess() {
        if (!isEnabled()) {
            return;
        }
        switch (state.get()) {
            case CLOSED -> consecutiveFailures.set(0);
            case HALF_OPEN -> {
                if (trialSuccesses.incrementAndGet() >= halfOpenSuccesses
                        && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                    consecutiveFailures.set(0);
                    log.info("Circuit breaker closed: destination={}", destination);
                }
            }
            case OPEN -> {
                // Request admitted before the circuit opened
            }
        }
    }

    public void recordFailure() {
        if (!isEnabled()) {
            return;
        }
        switch (state.get()) {
            case CLOSED -> {
                int failures = consecutiveFailures.incrementAndGet();
                if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                    openedAtNanos.set(nanoClock.getAsLong());
                    log.warn("Circuit breaker opened: destination={}, consecutiveFailures={}, recoveryMs={}",
                            destination, failures, Duration.ofNanos(recoveryNanos).toMillis());
                }
            }
            case HALF_OPEN -> {
                if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                    openedAtNanos.set(nanoClock.getAsLong());
                    log.warn("Circuit breaker reopened after failed trial: destination={}", destination);
                }
            }
            case OPEN -> {
                // Already open
            }
        }
    }

    /**
     * Time left before an open circuit admits a trial request; zero unless OPEN.
     */
    public Duration remainingOpenTime() {
        return Duration.ofNanos(Math.max(0, remainingOpenNanos()));
    }

    private long remainingOpenNanos() {
        if (state.get() != State.OPEN) {
            return 0;
        }
        return openedAtNanos.get() + recoveryNanos - nanoClock.getAsLong();
    }

    public State getState() {
        return state.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getDestination() {
        return destination;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{destination=" + destination
                + ", state=" + state.get()
                + ", consecutiveFailures=" + consecutiveFailures.get()
                + ", threshold=" + failureThreshold + '}';
    }
}
