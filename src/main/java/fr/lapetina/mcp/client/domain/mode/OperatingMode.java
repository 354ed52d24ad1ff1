package fr.lapetina.mcp.client.domain.mode;

import fr.lapetina.mcp.client.domain.retry.RetryStrategy;
import fr.lapetina.mcp.client.infrastructure.config.ClientConfig;
import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Named configuration presets for transports and the client facade.
 *
 * <table border="1">
 *   <tr><th>Mode</th><th>Compression</th><th>Retry</th><th>Max retries</th><th>Parallelism</th><th>Validation</th></tr>
 *   <tr><td>standard</td><td>on</td><td>exponential, 500ms base</td><td>3</td><td>5</td><td>on</td></tr>
 *   <tr><td>high_throughput</td><td>on</td><td>linear, 250ms base</td><td>2</td><td>10</td><td>off</td></tr>
 *   <tr><td>low_latency</td><td>off</td><td>none</td><td>0</td><td>5</td><td>on</td></tr>
 *   <tr><td>resilient</td><td>on</td><td>exponential, 2s base</td><td>5</td><td>3</td><td>on</td></tr>
 * </table>
 */
public enum OperatingMode {

    STANDARD {
        @Override
        public TransportConfig transportConfig() {
            return TransportConfig.builder()
                    .compressionEnabled(true)
                    .retryStrategy(RetryStrategy.EXPONENTIAL)
                    .maxRetries(3)
                    .retryBaseDelay(Duration.ofMillis(500))
                    .retryMaxDelay(Duration.ofSeconds(10))
                    .build();
        }

        @Override
        public ClientConfig clientConfig() {
            return new ClientConfig(10, 5, true, false, 10.0);
        }
    },

    HIGH_THROUGHPUT {
        @Override
        public TransportConfig transportConfig() {
            return TransportConfig.builder()
                    .maxConnections(200)
                    .maxConnectionsPerDestination(50)
                    .compressionEnabled(true)
                    .compressionThresholdBytes(512)
                    .retryStrategy(RetryStrategy.LINEAR)
                    .maxRetries(2)
                    .retryBaseDelay(Duration.ofMillis(250))
                    .retryMaxDelay(Duration.ofSeconds(5))
                    .build();
        }

        @Override
        public ClientConfig clientConfig() {
            return new ClientConfig(50, 10, false, false, 50.0);
        }
    },

    LOW_LATENCY {
        @Override
        public TransportConfig transportConfig() {
            return TransportConfig.builder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .requestTimeout(Duration.ofSeconds(10))
                    .compressionEnabled(false)
                    .retryStrategy(RetryStrategy.NONE)
                    .maxRetries(0)
                    .retryBaseDelay(Duration.ZERO)
                    .retryMaxDelay(Duration.ZERO)
                    .build();
        }

        @Override
        public ClientConfig clientConfig() {
            return new ClientConfig(10, 5, true, false, 20.0);
        }
    },

    RESILIENT {
        @Override
        public TransportConfig transportConfig() {
            return TransportConfig.builder()
                    .connectTimeout(Duration.ofSeconds(60))
                    .requestTimeout(Duration.ofSeconds(60))
                    .compressionEnabled(true)
                    .retryStrategy(RetryStrategy.EXPONENTIAL)
                    .maxRetries(5)
                    .retryBaseDelay(Duration.ofSeconds(2))
                    .retryMaxDelay(Duration.ofSeconds(60))
                    .circuitBreakerFailureThreshold(10)
                    .build();
        }

        @Override
        public ClientConfig clientConfig() {
            return new ClientConfig(5, 3, true, false, 5.0);
        }
    };

    private static final Logger log = LoggerFactory.getLogger(OperatingMode.class);

    public abstract TransportConfig transportConfig();

    public abstract ClientConfig clientConfig();

    /**
     * Configuration name, e.g. {@code high_throughput}.
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a mode by name, accepting {@code high_throughput}, {@code high-throughput} or
     * {@code HIGH_THROUGHPUT}. Unknown or missing names fall back to {@link #STANDARD}
     * with a warning.
     */
    public static OperatingMode fromName(String name) {
        if (name == null || name.isBlank()) {
            log.warn("No operating mode given, falling back to {}", STANDARD.configName());
            return STANDARD;
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (OperatingMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        log.warn("Unknown operating mode: mode={}, falling back to {}", name, STANDARD.configName());
        return STANDARD;
    }
}
