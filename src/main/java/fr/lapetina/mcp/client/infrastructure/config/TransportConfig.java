package fr.lapetina.mcp.client.infrastructure.config;

import fr.lapetina.mcp.client.domain.retry.BackoffCalculator;
import fr.lapetina.mcp.client.domain.retry.RetryStrategy;
import fr.lapetina.mcp.client.infrastructure.http.CompressionAlgorithm;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for one destination's transport.
 * Immutable once built; one instance is shared by every transport of a client.
 */
public final class TransportConfig {

    private final int maxConnections;
    private final int maxConnectionsPerDestination;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final boolean keepaliveEnabled;
    private final boolean compressionEnabled;
    private final CompressionAlgorithm compressionAlgorithm;
    private final int compressionThresholdBytes;
    private final RetryStrategy retryStrategy;
    private final int maxRetries;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final Duration dnsCacheTtl;
    private final int circuitBreakerFailureThreshold;
    private final Duration circuitBreakerRecoveryTimeout;
    private final Duration shutdownDrainTimeout;

    private TransportConfig(Builder builder) {
        this.maxConnections = builder.maxConnections;
        this.maxConnectionsPerDestination = builder.maxConnectionsPerDestination;
        this.connectTimeout = Objects.requireNonNull(builder.connectTimeout, "Connect timeout is required");
        this.requestTimeout = Objects.requireNonNull(builder.requestTimeout, "Request timeout is required");
        this.keepaliveEnabled = builder.keepaliveEnabled;
        this.compressionEnabled = builder.compressionEnabled;
        this.compressionAlgorithm = Objects.requireNonNull(builder.compressionAlgorithm, "Compression algorithm is required");
        this.compressionThresholdBytes = builder.compressionThresholdBytes;
        this.retryStrategy = Objects.requireNonNull(builder.retryStrategy, "Retry strategy is required");
        this.maxRetries = builder.maxRetries;
        this.retryBaseDelay = Objects.requireNonNull(builder.retryBaseDelay, "Retry base delay is required");
        this.retryMaxDelay = Objects.requireNonNull(builder.retryMaxDelay, "Retry max delay is required");
        this.dnsCacheTtl = Objects.requireNonNull(builder.dnsCacheTtl, "DNS cache TTL is required");
        this.circuitBreakerFailureThreshold = builder.circuitBreakerFailureThreshold;
        this.circuitBreakerRecoveryTimeout = Objects.requireNonNull(builder.circuitBreakerRecoveryTimeout,
                "Circuit breaker recovery timeout is required");
        this.shutdownDrainTimeout = Objects.requireNonNull(builder.shutdownDrainTimeout, "Drain timeout is required");
        validate();
    }

    private void validate() {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be >= 1, was " + maxConnections);
        }
        if (maxConnectionsPerDestination < 1) {
            throw new IllegalArgumentException(
                    "maxConnectionsPerDestination must be >= 1, was " + maxConnectionsPerDestination);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (compressionThresholdBytes < 0) {
            throw new IllegalArgumentException(
                    "compressionThresholdBytes must be >= 0, was " + compressionThresholdBytes);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (retryBaseDelay.isNegative()) {
            throw new IllegalArgumentException("retryBaseDelay must not be negative");
        }
        if (retryMaxDelay.compareTo(retryBaseDelay) < 0) {
            throw new IllegalArgumentException("retryMaxDelay must be >= retryBaseDelay");
        }
        if (circuitBreakerFailureThreshold < 0) {
            throw new IllegalArgumentException("circuitBreakerFailureThreshold must be >= 0");
        }
    }

    public int getMaxConnections() { return maxConnections; }

    public int getMaxConnectionsPerDestination() { return maxConnectionsPerDestination; }

    /**
     * Connections one transport may hold: the per-destination cap bounded by the global cap.
     */
    public int effectiveConnectionLimit() {
        return Math.min(maxConnections, maxConnectionsPerDestination);
    }

    public Duration getConnectTimeout() { return connectTimeout; }

    public Duration getRequestTimeout() { return requestTimeout; }

    /**
     * Whole-call deadline applied when a call does not supply its own.
     */
    public Duration defaultCallTimeout() {
        return connectTimeout.plus(requestTimeout);
    }

    public boolean isKeepaliveEnabled() { return keepaliveEnabled; }

    public boolean isCompressionEnabled() { return compressionEnabled; }

    public CompressionAlgorithm getCompressionAlgorithm() { return compressionAlgorithm; }

    public int getCompressionThresholdBytes() { return compressionThresholdBytes; }

    public RetryStrategy getRetryStrategy() { return retryStrategy; }

    public int getMaxRetries() { return maxRetries; }

    /**
     * Retries actually allowed: zero when the strategy is NONE.
     */
    public int effectiveMaxRetries() {
        return retryStrategy.allowsRetries() ? maxRetries : 0;
    }

    public Duration getRetryBaseDelay() { return retryBaseDelay; }

    public Duration getRetryMaxDelay() { return retryMaxDelay; }

    public Duration getDnsCacheTtl() { return dnsCacheTtl; }

    public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }

    public boolean isCircuitBreakerEnabled() { return circuitBreakerFailureThreshold > 0; }

    public Duration getCircuitBreakerRecoveryTimeout() { return circuitBreakerRecoveryTimeout; }

    public Duration getShutdownDrainTimeout() { return shutdownDrainTimeout; }

    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(retryStrategy, retryBaseDelay, retryMaxDelay);
    }

    public Builder toBuilder() {
        return new Builder()
                .maxConnections(maxConnections)
                .maxConnectionsPerDestination(maxConnectionsPerDestination)
                .connectTimeout(connectTimeout)
                .requestTimeout(requestTimeout)
                .keepaliveEnabled(keepaliveEnabled)
                .compressionEnabled(compressionEnabled)
                .compressionAlgorithm(compressionAlgorithm)
                .compressionThresholdBytes(compressionThresholdBytes)
                .retryStrategy(retryStrategy)
                .maxRetries(maxRetries)
                .retryBaseDelay(retryBaseDelay)
                .retryMaxDelay(retryMaxDelay)
                .dnsCacheTtl(dnsCacheTtl)
                .circuitBreakerFailureThreshold(circuitBreakerFailureThreshold)
                .circuitBreakerRecoveryTimeout(circuitBreakerRecoveryTimeout)
                .shutdownDrainTimeout(shutdownDrainTimeout);
    }

    @Override
    public String toString() {
        return "TransportConfig{" +
                "maxConnections=" + maxConnections +
                ", maxConnectionsPerDestination=" + maxConnectionsPerDestination +
                ", connectTimeout=" + connectTimeout +
                ", requestTimeout=" + requestTimeout +
                ", compression=" + (compressionEnabled ? compressionAlgorithm : "off") +
                ", compressionThresholdBytes=" + compressionThresholdBytes +
                ", retryStrategy=" + retryStrategy +
                ", maxRetries=" + maxRetries +
                ", retryBaseDelay=" + retryBaseDelay +
                ", retryMaxDelay=" + retryMaxDelay +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxConnections = 100;
        private int maxConnectionsPerDestination = 20;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private boolean keepaliveEnabled = true;
        private boolean compressionEnabled = true;
        private CompressionAlgorithm compressionAlgorithm = CompressionAlgorithm.GZIP;
        private int compressionThresholdBytes = 1024;
        private RetryStrategy retryStrategy = RetryStrategy.EXPONENTIAL;
        private int maxRetries = 3;
        private Duration retryBaseDelay = Duration.ofMillis(500);
        private Duration retryMaxDelay = Duration.ofSeconds(10);
        private Duration dnsCacheTtl = Duration.ofMinutes(5);
        private int circuitBreakerFailureThreshold = 5;
        private Duration circuitBreakerRecoveryTimeout = Duration.ofSeconds(30);
        private Duration shutdownDrainTimeout = Duration.ofSeconds(5);

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxConnectionsPerDestination(int maxConnectionsPerDestination) {
            this.maxConnectionsPerDestination = maxConnectionsPerDestination;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder keepaliveEnabled(boolean keepaliveEnabled) {
            this.keepaliveEnabled = keepaliveEnabled;
            return this;
        }

        public Builder compressionEnabled(boolean compressionEnabled) {
            this.compressionEnabled = compressionEnabled;
            return this;
        }

        public Builder compressionAlgorithm(CompressionAlgorithm compressionAlgorithm) {
            this.compressionAlgorithm = compressionAlgorithm;
            return this;
        }

        public Builder compressionThresholdBytes(int compressionThresholdBytes) {
            this.compressionThresholdBytes = compressionThresholdBytes;
            return this;
        }

        public Builder retryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = retryStrategy;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder retryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
            return this;
        }

        public Builder dnsCacheTtl(Duration dnsCacheTtl) {
            this.dnsCacheTtl = dnsCacheTtl;
            return this;
        }

        public Builder circuitBreakerFailureThreshold(int circuitBreakerFailureThreshold) {
            this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold;
            return this;
        }

        public Builder circuitBreakerRecoveryTimeout(Duration circuitBreakerRecoveryTimeout) {
            this.circuitBreakerRecoveryTimeout = circuitBreakerRecoveryTimeout;
            return this;
        }

        public Builder shutdownDrainTimeout(Duration shutdownDrainTimeout) {
            this.shutdownDrainTimeout = shutdownDrainTimeout;
            return this;
        }

        public TransportConfig build() {
            return new TransportConfig(this);
        }
    }
}
