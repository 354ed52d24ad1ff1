package fr.lapetina.mcp.client.domain.mode;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import fr.lapetina.mcp.client.domain.retry.RetryStrategy;
import fr.lapetina.mcp.client.infrastructure.config.ClientConfig;
import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class OperatingModeTest {

    @Nested
    @DisplayName("Presets")
    class PresetTests {

        @Test
        @DisplayName("standard should compress, retry exponentially 3 times and validate")
        void standardPreset() {
            TransportConfig transport = OperatingMode.STANDARD.transportConfig();
            ClientConfig client = OperatingMode.STANDARD.clientConfig();

            assertThat(transport.isCompressionEnabled()).isTrue();
            assertThat(transport.getRetryStrategy()).isEqualTo(RetryStrategy.EXPONENTIAL);
            assertThat(transport.getMaxRetries()).isEqualTo(3);
            assertThat(client.maxParallelRequests()).isEqualTo(5);
            assertThat(client.enableResponseValidation()).isTrue();
        }

        @Test
        @DisplayName("high_throughput should retry linearly twice without validation")
        void highThroughputPreset() {
            TransportConfig transport = OperatingMode.HIGH_THROUGHPUT.transportConfig();
            ClientConfig client = OperatingMode.HIGH_THROUGHPUT.clientConfig();

            assertThat(transport.isCompressionEnabled()).isTrue();
            assertThat(transport.getRetryStrategy()).isEqualTo(RetryStrategy.LINEAR);
            assertThat(transport.getMaxRetries()).isEqualTo(2);
            assertThat(client.maxParallelRequests()).isEqualTo(10);
            assertThat(client.enableResponseValidation()).isFalse();
        }

        @Test
        @DisplayName("low_latency should never compress nor retry")
        void lowLatencyPreset() {
            TransportConfig transport = OperatingMode.LOW_LATENCY.transportConfig();
            ClientConfig client = OperatingMode.LOW_LATENCY.clientConfig();

            assertThat(transport.isCompressionEnabled()).isFalse();
            assertThat(transport.getRetryStrategy()).isEqualTo(RetryStrategy.NONE);
            assertThat(transport.effectiveMaxRetries()).isZero();
            assertThat(client.maxParallelRequests()).isEqualTo(5);
            assertThat(client.enableResponseValidation()).isTrue();
        }

        @Test
        @DisplayName("resilient should retry 5 times with a longer base delay")
        void resilientPreset() {
            TransportConfig transport = OperatingMode.RESILIENT.transportConfig();
            ClientConfig client = OperatingMode.RESILIENT.clientConfig();

            assertThat(transport.isCompressionEnabled()).isTrue();
            assertThat(transport.getRetryStrategy()).isEqualTo(RetryStrategy.EXPONENTIAL);
            assertThat(transport.getMaxRetries()).isEqualTo(5);
            assertThat(transport.getRetryBaseDelay())
                    .isGreaterThan(OperatingMode.STANDARD.transportConfig().getRetryBaseDelay());
            assertThat(client.maxParallelRequests()).isEqualTo(3);
            assertThat(client.enableResponseValidation()).isTrue();
        }
    }

    @Nested
    @DisplayName("Name resolution")
    class FromNameTests {

        private Logger logger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void setUp() {
            logger = (Logger) LoggerFactory.getLogger(OperatingMode.class);
            appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void tearDown() {
            logger.detachAppender(appender);
        }

        @Test
        @DisplayName("should accept snake, kebab and upper case names")
        void shouldAcceptNameVariants() {
            assertThat(OperatingMode.fromName("high_throughput")).isEqualTo(OperatingMode.HIGH_THROUGHPUT);
            assertThat(OperatingMode.fromName("low-latency")).isEqualTo(OperatingMode.LOW_LATENCY);
            assertThat(OperatingMode.fromName("RESILIENT")).isEqualTo(OperatingMode.RESILIENT);
            assertThat(appender.list).isEmpty();
        }

        @Test
        @DisplayName("should fall back to standard with a warning for unknown names")
        void shouldFallBackWithWarning() {
            OperatingMode mode = OperatingMode.fromName("turbo");

            assertThat(mode).isEqualTo(OperatingMode.STANDARD);
            assertThat(appender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage()).contains("turbo");
                    });
        }

        @Test
        @DisplayName("should fall back to standard for a missing name")
        void shouldFallBackForNull() {
            assertThat(OperatingMode.fromName(null)).isEqualTo(OperatingMode.STANDARD);
        }
    }

    @Test
    @DisplayName("should derive the default call deadline from connect and request timeouts")
    void shouldDeriveDefaultCallTimeout() {
        TransportConfig transport = OperatingMode.LOW_LATENCY.transportConfig();

        assertThat(transport.defaultCallTimeout()).isEqualTo(Duration.ofSeconds(15));
    }
}
