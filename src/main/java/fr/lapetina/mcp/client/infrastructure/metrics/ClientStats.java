package fr.lapetina.mcp.client.infrastructure.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Invocation-level counters of one client facade.
 * Thread-safe via independent atomic counters.
 */
public final class ClientStats {

    private final AtomicLong requestsSent = new AtomicLong();
    private final AtomicLong requestsSucceeded = new AtomicLong();
    private final AtomicLong requestsFailed = new AtomicLong();
    private final AtomicLong totalLatencyMicros = new AtomicLong();

    public void recordSent() {
        requestsSent.incrementAndGet();
    }

    public void recordSuccess(Duration latency) {
        requestsSucceeded.incrementAndGet();
        totalLatencyMicros.addAndGet(latency.toNanos() / 1_000);
    }

    public void recordFailure(Duration latency) {
        requestsFailed.incrementAndGet();
        totalLatencyMicros.addAndGet(latency.toNanos() / 1_000);
    }

    public long getRequestsSent() { return requestsSent.get(); }

    public long getRequestsSucceeded() { return requestsSucceeded.get(); }

    public long getRequestsFailed() { return requestsFailed.get(); }

    public double getTotalLatencyMs() { return totalLatencyMicros.get() / 1000.0; }

    public ClientStatsSnapshot snapshot() {
        long succeeded = requestsSucceeded.get();
        long failed = requestsFailed.get();
        double total = getTotalLatencyMs();
        long completed = succeeded + failed;
        return new ClientStatsSnapshot(
                requestsSent.get(),
                succeeded,
                failed,
                total,
                completed == 0 ? 0.0 : total / completed,
                Instant.now()
        );
    }

    public void reset() {
        requestsSent.set(0);
        requestsSucceeded.set(0);
        requestsFailed.set(0);
        totalLatencyMicros.set(0);
    }
}
