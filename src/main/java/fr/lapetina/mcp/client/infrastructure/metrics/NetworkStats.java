package fr.lapetina.mcp.client.infrastructure.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wire-level counters of one transport.
 *
 * Updated only by the owning transport, read by anyone. Each counter is an independent
 * atomic; no invariant spans several of them, so no lock is taken.
 */
public final class NetworkStats {

    private final String destination;

    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong requestsSent = new AtomicLong();
    private final AtomicLong requestsSucceeded = new AtomicLong();
    private final AtomicLong requestsFailed = new AtomicLong();
    private final AtomicLong retriedRequests = new AtomicLong();
    private final AtomicLong connectionErrors = new AtomicLong();
    private final AtomicLong timeoutErrors = new AtomicLong();
    private final AtomicLong latencySamples = new AtomicLong();
    private final AtomicLong totalLatencyMicros = new AtomicLong();
    private final AtomicLong uncompressedBytes = new AtomicLong();
    private final AtomicLong compressedBytes = new AtomicLong();

    public NetworkStats(String destination) {
        this.destination = destination;
    }

    public void recordAttempt(long wireBytes) {
        requestsSent.incrementAndGet();
        bytesSent.addAndGet(wireBytes);
    }

    public void recordResponse(long wireBytes, Duration latency) {
        bytesReceived.addAndGet(wireBytes);
        latencySamples.incrementAndGet();
        totalLatencyMicros.addAndGet(latency.toNanos() / 1_000);
    }

    public void recordCompression(long originalBytes, long compressedSize) {
        uncompressedBytes.addAndGet(originalBytes);
        compressedBytes.addAndGet(compressedSize);
    }

    public void recordSuccess() {
        requestsSucceeded.incrementAndGet();
    }

    public void recordFailure() {
        requestsFailed.incrementAndGet();
    }

    public void recordRetry() {
        retriedRequests.incrementAndGet();
    }

    public void recordConnectionError() {
        connectionErrors.incrementAndGet();
    }

    public void recordTimeoutError() {
        timeoutErrors.incrementAndGet();
    }

    public String getDestination() { return destination; }

    public long getBytesSent() { return bytesSent.get(); }

    public long getBytesReceived() { return bytesReceived.get(); }

    public long getRequestsSent() { return requestsSent.get(); }

    public long getRequestsSucceeded() { return requestsSucceeded.get(); }

    public long getRequestsFailed() { return requestsFailed.get(); }

    public long getRetriedRequests() { return retriedRequests.get(); }

    public long getConnectionErrors() { return connectionErrors.get(); }

    public long getTimeoutErrors() { return timeoutErrors.get(); }

    /**
     * Mean latency of all answered attempts, in milliseconds.
     */
    public double getAvgLatencyMs() {
        long samples = latencySamples.get();
        return samples == 0 ? 0.0 : (totalLatencyMicros.get() / 1000.0) / samples;
    }

    /**
     * Uncompressed over compressed size across every compressed body; 1.0 when nothing was compressed.
     */
    public double getCompressionRatio() {
        long compressed = compressedBytes.get();
        return compressed == 0 ? 1.0 : (double) uncompressedBytes.get() / compressed;
    }

    public NetworkStatsSnapshot snapshot() {
        return new NetworkStatsSnapshot(
                destination,
                getBytesSent(),
                getBytesReceived(),
                getRequestsSent(),
                getRequestsSucceeded(),
                getRequestsFailed(),
                getRetriedRequests(),
                getConnectionErrors(),
                getTimeoutErrors(),
                getAvgLatencyMs(),
                getCompressionRatio(),
                Instant.now()
        );
    }

    public void reset() {
        bytesSent.set(0);
        bytesReceived.set(0);
        requestsSent.set(0);
        requestsSucceeded.set(0);
        requestsFailed.set(0);
        retriedRequests.set(0);
        connectionErrors.set(0);
        timeoutErrors.set(0);
        latencySamples.set(0);
        totalLatencyMicros.set(0);
        uncompressedBytes.set(0);
        compressedBytes.set(0);
    }
}
