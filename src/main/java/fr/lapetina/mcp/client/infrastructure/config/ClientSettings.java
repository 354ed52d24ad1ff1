package fr.lapetina.mcp.client.infrastructure.config;

import fr.lapetina.mcp.client.domain.retry.RetryStrategy;
import fr.lapetina.mcp.client.infrastructure.http.CompressionAlgorithm;

import java.time.Duration;

/**
 * Root settings object for the client.
 * Designed to be populated from YAML.
 *
 * Override sections only replace the preset values they set; null fields keep the
 * value of the selected operating mode.
 */
public class ClientSettings {

    private String mode = "standard";
    private String registryPath = "mcp-servers.json";
    private String metricsPrefix = "mcp_client";
    private TransportOverrides transport = new TransportOverrides();
    private ClientOverrides client = new ClientOverrides();

    // Getters and Setters
    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getRegistryPath() { return registryPath; }
    public void setRegistryPath(String registryPath) { this.registryPath = registryPath; }

    public String getMetricsPrefix() { return metricsPrefix; }
    public void setMetricsPrefix(String metricsPrefix) { this.metricsPrefix = metricsPrefix; }

    public TransportOverrides getTransport() { return transport; }
    public void setTransport(TransportOverrides transport) { this.transport = transport; }

    public ClientOverrides getClient() { return client; }
    public void setClient(ClientOverrides client) { this.client = client; }

    /**
     * Transport overrides. Durations are in milliseconds.
     */
    public static class TransportOverrides {
        private Integer maxConnections;
        private Integer maxConnectionsPerDestination;
        private Long connectTimeoutMs;
        private Long requestTimeoutMs;
        private Boolean keepaliveEnabled;
        private Boolean compressionEnabled;
        private String compressionAlgorithm;
        private Integer compressionThresholdBytes;
        private String retryStrategy;
        private Integer maxRetries;
        private Long retryBaseDelayMs;
        private Long retryMaxDelayMs;
        private Long dnsCacheTtlMs;
        private Integer circuitBreakerFailureThreshold;
        private Long circuitBreakerRecoveryMs;

        public Integer getMaxConnections() { return maxConnections; }
        public void setMaxConnections(Integer maxConnections) { this.maxConnections = maxConnections; }

        public Integer getMaxConnectionsPerDestination() { return maxConnectionsPerDestination; }
        public void setMaxConnectionsPerDestination(Integer value) { this.maxConnectionsPerDestination = value; }

        public Long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(Long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public Long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(Long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public Boolean getKeepaliveEnabled() { return keepaliveEnabled; }
        public void setKeepaliveEnabled(Boolean keepaliveEnabled) { this.keepaliveEnabled = keepaliveEnabled; }

        public Boolean getCompressionEnabled() { return compressionEnabled; }
        public void setCompressionEnabled(Boolean compressionEnabled) { this.compressionEnabled = compressionEnabled; }

        public String getCompressionAlgorithm() { return compressionAlgorithm; }
        public void setCompressionAlgorithm(String compressionAlgorithm) { this.compressionAlgorithm = compressionAlgorithm; }

        public Integer getCompressionThresholdBytes() { return compressionThresholdBytes; }
        public void setCompressionThresholdBytes(Integer value) { this.compressionThresholdBytes = value; }

        public String getRetryStrategy() { return retryStrategy; }
        public void setRetryStrategy(String retryStrategy) { this.retryStrategy = retryStrategy; }

        public Integer getMaxRetries() { return maxRetries; }
        public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

        public Long getRetryBaseDelayMs() { return retryBaseDelayMs; }
        public void setRetryBaseDelayMs(Long retryBaseDelayMs) { this.retryBaseDelayMs = retryBaseDelayMs; }

        public Long getRetryMaxDelayMs() { return retryMaxDelayMs; }
        public void setRetryMaxDelayMs(Long retryMaxDelayMs) { this.retryMaxDelayMs = retryMaxDelayMs; }

        public Long getDnsCacheTtlMs() { return dnsCacheTtlMs; }
        public void setDnsCacheTtlMs(Long dnsCacheTtlMs) { this.dnsCacheTtlMs = dnsCacheTtlMs; }

        public Integer getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(Integer threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public Long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(Long ms) { this.circuitBreakerRecoveryMs = ms; }

        /**
         * Returns the preset with every non-null override applied.
         */
        public TransportConfig applyTo(TransportConfig preset) {
            TransportConfig.Builder builder = preset.toBuilder();
            if (maxConnections != null) builder.maxConnections(maxConnections);
            if (maxConnectionsPerDestination != null) builder.maxConnectionsPerDestination(maxConnectionsPerDestination);
            if (connectTimeoutMs != null) builder.connectTimeout(Duration.ofMillis(connectTimeoutMs));
            if (requestTimeoutMs != null) builder.requestTimeout(Duration.ofMillis(requestTimeoutMs));
            if (keepaliveEnabled != null) builder.keepaliveEnabled(keepaliveEnabled);
            if (compressionEnabled != null) builder.compressionEnabled(compressionEnabled);
            if (compressionAlgorithm != null) {
                builder.compressionAlgorithm(CompressionAlgorithm.valueOf(compressionAlgorithm.trim().toUpperCase()));
            }
            if (compressionThresholdBytes != null) builder.compressionThresholdBytes(compressionThresholdBytes);
            if (retryStrategy != null) builder.retryStrategy(RetryStrategy.fromName(retryStrategy));
            if (maxRetries != null) builder.maxRetries(maxRetries);
            if (retryBaseDelayMs != null) builder.retryBaseDelay(Duration.ofMillis(retryBaseDelayMs));
            if (retryMaxDelayMs != null) builder.retryMaxDelay(Duration.ofMillis(retryMaxDelayMs));
            if (dnsCacheTtlMs != null) builder.dnsCacheTtl(Duration.ofMillis(dnsCacheTtlMs));
            if (circuitBreakerFailureThreshold != null) builder.circuitBreakerFailureThreshold(circuitBreakerFailureThreshold);
            if (circuitBreakerRecoveryMs != null) builder.circuitBreakerRecoveryTimeout(Duration.ofMillis(circuitBreakerRecoveryMs));
            return builder.build();
        }
    }

    /**
     * Facade overrides.
     */
    public static class ClientOverrides {
        private Integer batchSize;
        private Integer maxParallelRequests;
        private Boolean enableResponseValidation;
        private Boolean enableThrottling;
        private Double requestsPerSecond;

        public Integer getBatchSize() { return batchSize; }
        public void setBatchSize(Integer batchSize) { this.batchSize = batchSize; }

        public Integer getMaxParallelRequests() { return maxParallelRequests; }
        public void setMaxParallelRequests(Integer maxParallelRequests) { this.maxParallelRequests = maxParallelRequests; }

        public Boolean getEnableResponseValidation() { return enableResponseValidation; }
        public void setEnableResponseValidation(Boolean value) { this.enableResponseValidation = value; }

        public Boolean getEnableThrottling() { return enableThrottling; }
        public void setEnableThrottling(Boolean enableThrottling) { this.enableThrottling = enableThrottling; }

        public Double getRequestsPerSecond() { return requestsPerSecond; }
        public void setRequestsPerSecond(Double requestsPerSecond) { this.requestsPerSecond = requestsPerSecond; }

        /**
         * Returns the preset with every non-null override applied.
         */
        public ClientConfig applyTo(ClientConfig preset) {
            return new ClientConfig(
                    batchSize != null ? batchSize : preset.batchSize(),
                    maxParallelRequests != null ? maxParallelRequests : preset.maxParallelRequests(),
                    enableResponseValidation != null ? enableResponseValidation : preset.enableResponseValidation(),
                    enableThrottling != null ? enableThrottling : preset.enableThrottling(),
                    requestsPerSecond != null ? requestsPerSecond : preset.requestsPerSecond()
            );
        }
    }
}
