package fr.lapetina.mcp.client.client;

import fr.lapetina.mcp.client.exception.RequestTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum interval of {@code 1 / requestsPerSecond} between admitted requests.
 *
 * The check-then-sleep sequence runs under a fair lock, so two callers can never observe
 * the same "time since last request" window.
 */
public final class RequestThrottler {

    private static final Logger log = LoggerFactory.getLogger(RequestThrottler.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final long minIntervalNanos;

    // Guarded by lock
    private long lastRequestNanos;
    private boolean anyRequest;

    public RequestThrottler(double requestsPerSecond) {
        if (!(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0, was " + requestsPerSecond);
        }
        this.minIntervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond);
    }

    /**
     * Blocks until the next request may be issued.
     *
     * @param deadlineNanos {@link System#nanoTime()} value after which the caller gives up
     * @throws RequestTimeoutException if the deadline passes while queued, or the required wait would pass it
     */
    public void acquire(long deadlineNanos) {
        boolean locked;
        try {
            locked = lock.tryLock(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("Interrupted while waiting for throttle", e);
        }
        if (!locked) {
            throw new RequestTimeoutException("Call deadline expired while queued behind throttled requests");
        }
        try {
            long now = System.nanoTime();
            if (anyRequest) {
                long wait = lastRequestNanos + minIntervalNanos - now;
                if (wait > 0) {
                    if (now + wait > deadlineNanos) {
                        throw new RequestTimeoutException(
                                "Call deadline expires before throttle admits the request: waitMs="
                                        + TimeUnit.NANOSECONDS.toMillis(wait));
                    }
                    log.debug("Throttling request: waitMs={}", TimeUnit.NANOSECONDS.toMillis(wait));
                    TimeUnit.NANOSECONDS.sleep(wait);
                }
            }
            lastRequestNanos = System.nanoTime();
            anyRequest = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("Interrupted while waiting for throttle", e);
        } finally {
            lock.unlock();
        }
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
