package fr.lapetina.mcp.client.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.mcp.client.domain.model.CallEnvelope;
import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.domain.model.TransportResponse;
import fr.lapetina.mcp.client.domain.retry.RetryStrategy;
import fr.lapetina.mcp.client.exception.CircuitOpenException;
import fr.lapetina.mcp.client.exception.ConnectionException;
import fr.lapetina.mcp.client.exception.RequestFailedException;
import fr.lapetina.mcp.client.exception.RequestTimeoutException;
import fr.lapetina.mcp.client.exception.TransportClosedException;
import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;
import fr.lapetina.mcp.client.infrastructure.metrics.NetworkStats;
import fr.lapetina.mcp.client.integration.StubDestinationServer;
import fr.lapetina.mcp.client.integration.StubDestinationServer.RecordedRequest;
import fr.lapetina.mcp.client.integration.StubDestinationServer.StubResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTransportTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private StubDestinationServer stub;
    private HttpTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        stub = StubDestinationServer.start();
    }

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.shutdown();
        }
        stub.close();
    }

    private static TransportConfig.Builder fastConfig() {
        return TransportConfig.builder()
                .connectTimeout(Duration.ofSeconds(2))
                .requestTimeout(Duration.ofSeconds(3))
                .retryStrategy(RetryStrategy.EXPONENTIAL)
                .maxRetries(3)
                .retryBaseDelay(Duration.ofMillis(10))
                .retryMaxDelay(Duration.ofMillis(50));
    }

    private HttpTransport transportFor(TransportConfig config) {
        transport = new HttpTransport(Destination.of("svc", stub.baseUrl()), config);
        transport.initialize();
        return transport;
    }

    private CallEnvelope invoke(String operation, JsonNode arguments) {
        ObjectNode body = mapper.createObjectNode();
        body.put("operation", operation);
        body.set("arguments", arguments);
        return CallEnvelope.post(Destination.of("svc", stub.baseUrl()).invokeUri(operation), body, null);
    }

    private JsonNode smallArguments() {
        return mapper.createObjectNode().put("q", "java");
    }

    private JsonNode largeArguments() {
        ObjectNode arguments = mapper.createObjectNode();
        arguments.put("text", "the quick brown fox jumps over the lazy dog ".repeat(100));
        return arguments;
    }

    @Nested
    @DisplayName("Compression")
    class CompressionTests {

        @Test
        @DisplayName("should send bodies below the threshold uncompressed")
        void shouldNotCompressSmallBodies() {
            HttpTransport transport = transportFor(fastConfig().compressionThresholdBytes(1024).build());

            transport.request(invoke("search", smallArguments()));

            RecordedRequest recorded = stub.requests().get(0);
            assertThat(recorded.header("Content-Encoding")).isNull();
            assertThat(recorded.header("Content-Type")).isEqualTo("application/json");
            assertThat(transport.getStats().getCompressionRatio()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should gzip bodies above the threshold and record the ratio")
        void shouldCompressLargeBodies() throws IOException {
            HttpTransport transport = transportFor(fastConfig().compressionThresholdBytes(1024).build());
            CallEnvelope envelope = invoke("summarize", largeArguments());
            int originalSize = mapper.writeValueAsBytes(envelope.body()).length;

            transport.request(envelope);

            RecordedRequest recorded = stub.requests().get(0);
            assertThat(recorded.header("Content-Encoding")).isEqualTo("gzip");
            assertThat(recorded.wireBody().length).isLessThan(originalSize);
            assertThat(mapper.readTree(recorded.body())).isEqualTo(envelope.body());
            assertThat(transport.getStats().getCompressionRatio()).isGreaterThanOrEqualTo(1.0);
            assertThat(transport.getStats().getBytesSent()).isEqualTo(recorded.wireBody().length);
        }

        @Test
        @DisplayName("should never compress when compression is disabled")
        void shouldNotCompressWhenDisabled() {
            HttpTransport transport = transportFor(fastConfig()
                    .compressionEnabled(false)
                    .compressionThresholdBytes(0)
                    .build());

            transport.request(invoke("summarize", largeArguments()));

            assertThat(stub.requests().get(0).header("Content-Encoding")).isNull();
        }

        @Test
        @DisplayName("should inflate gzip responses")
        void shouldInflateGzipResponses() {
            stub.enqueue(StubResponse.json(200, "{\"answer\":42}").gzipped());
            HttpTransport transport = transportFor(fastConfig().build());

            TransportResponse response = transport.request(invoke("ask", smallArguments()));

            assertThat(response.json().get("answer").asInt()).isEqualTo(42);
            assertThat(stub.requests().get(0).header("Accept-Encoding")).isEqualTo("gzip");
        }
    }

    @Nested
    @DisplayName("Response decoding")
    class DecodingTests {

        @Test
        @DisplayName("should decode JSON responses")
        void shouldDecodeJson() {
            stub.enqueue(StubResponse.json(200, "{\"items\":[1,2,3]}"));
            HttpTransport transport = transportFor(fastConfig().build());

            TransportResponse response = transport.request(invoke("list", smallArguments()));

            assertThat(response.status()).isEqualTo(200);
            assertThat(response.isJson()).isTrue();
            assertThat(response.json().get("items")).hasSize(3);
            assertThat(response.attempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("should pass non-JSON bodies through as raw bytes")
        void shouldPassThroughText() {
            stub.enqueue(StubResponse.text(200, "plain result"));
            HttpTransport transport = transportFor(fastConfig().build());

            TransportResponse response = transport.request(invoke("echo", smallArguments()));

            assertThat(response.isJson()).isFalse();
            assertThat(response.bodyAsString()).isEqualTo("plain result");
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("should retry retryable statuses until success")
        void shouldRetryUntilSuccess() {
            stub.enqueue(StubResponse.status(503), StubResponse.status(503), StubResponse.json(200, "{\"ok\":true}"));
            HttpTransport transport = transportFor(fastConfig().build());

            TransportResponse response = transport.request(invoke("run", smallArguments()));

            NetworkStats stats = transport.getStats();
            assertThat(response.json().get("ok").asBoolean()).isTrue();
            assertThat(response.attempts()).isEqualTo(3);
            assertThat(stats.getRetriedRequests()).isEqualTo(2);
            assertThat(stats.getRequestsSent()).isEqualTo(3);
            assertThat(stats.getRequestsSucceeded()).isEqualTo(1);
            assertThat(stats.getRequestsFailed()).isZero();
        }

        @Test
        @DisplayName("should give up after max retries plus one attempts")
        void shouldGiveUpAfterMaxAttempts() {
            stub.respondByDefault(StubResponse.status(502));
            HttpTransport transport = transportFor(fastConfig().maxRetries(2).build());

            assertThatThrownBy(() -> transport.request(invoke("run", smallArguments())))
                    .isInstanceOfSatisfying(RequestFailedException.class, e -> {
                        assertThat(e.getStatus()).isEqualTo(502);
                        assertThat(e.getAttempts()).isEqualTo(3);
                    });
            assertThat(stub.requestCount()).isEqualTo(3);
            assertThat(transport.getStats().getRetriedRequests()).isEqualTo(2);
            assertThat(transport.getStats().getRequestsFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not retry at all with the NONE strategy")
        void shouldNotRetryWithNone() {
            stub.respondByDefault(StubResponse.status(503));
            HttpTransport transport = transportFor(fastConfig()
                    .retryStrategy(RetryStrategy.NONE)
                    .maxRetries(5)
                    .build());

            assertThatThrownBy(() -> transport.request(invoke("run", smallArguments())))
                    .isInstanceOfSatisfying(RequestFailedException.class,
                            e -> assertThat(e.getAttempts()).isEqualTo(1));
            assertThat(stub.requestCount()).isEqualTo(1);
            assertThat(transport.getStats().getRetriedRequests()).isZero();
        }

        @Test
        @DisplayName("should fail non-retryable statuses immediately")
        void shouldFailNonRetryableImmediately() {
            stub.respondByDefault(StubResponse.json(404, "{\"error\":\"unknown operation\"}"));
            HttpTransport transport = transportFor(fastConfig().build());

            assertThatThrownBy(() -> transport.request(invoke("missing", smallArguments())))
                    .isInstanceOfSatisfying(RequestFailedException.class, e -> {
                        assertThat(e.getStatus()).isEqualTo(404);
                        assertThat(e.getAttempts()).isEqualTo(1);
                    });
            assertThat(stub.requestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should honour per-call retryable statuses")
        void shouldHonourCustomRetryableStatuses() {
            stub.enqueue(StubResponse.status(409), StubResponse.json(200, "{\"ok\":true}"));
            HttpTransport transport = transportFor(fastConfig().build());

            TransportResponse response = transport.request(
                    invoke("lock", smallArguments()).withRetryableStatuses(Set.of(409)));

            assertThat(response.status()).isEqualTo(200);
            assertThat(stub.requestCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should retry connection failures and report the last error")
        void shouldRetryConnectionFailures() throws IOException {
            int closedPort;
            try (ServerSocket socket = new ServerSocket(0)) {
                closedPort = socket.getLocalPort();
            }
            transport = new HttpTransport(Destination.of("down", "http://127.0.0.1:" + closedPort),
                    fastConfig().maxRetries(2).build());
            transport.initialize();
            CallEnvelope envelope = CallEnvelope.post(
                    Destination.of("down", "http://127.0.0.1:" + closedPort).invokeUri("run"),
                    mapper.createObjectNode(), null);

            assertThatThrownBy(() -> transport.request(envelope))
                    .isInstanceOfSatisfying(RequestFailedException.class, e -> {
                        assertThat(e.getStatus()).isEqualTo(RequestFailedException.NO_STATUS);
                        assertThat(e.getAttempts()).isEqualTo(3);
                        assertThat(e.getCause()).isInstanceOf(ConnectionException.class);
                    });
            assertThat(transport.getStats().getConnectionErrors()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class DeadlineTests {

        @Test
        @DisplayName("should time out when the destination is too slow")
        void shouldTimeOutSlowDestination() {
            stub.enqueue(StubResponse.json(200, "{}").delayed(2_000));
            HttpTransport transport = transportFor(fastConfig().build());
            CallEnvelope envelope = CallEnvelope.post(
                    Destination.of("svc", stub.baseUrl()).invokeUri("slow"), smallArguments(), Duration.ofMillis(300));

            long start = System.nanoTime();
            assertThatThrownBy(() -> transport.request(envelope))
                    .isInstanceOf(RequestTimeoutException.class);

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(1_500));
            assertThat(transport.getStats().getTimeoutErrors()).isEqualTo(1);
        }

        @Test
        @DisplayName("should abort instead of sleeping past the deadline")
        void shouldAbortDuringBackoff() {
            stub.respondByDefault(StubResponse.status(503));
            HttpTransport transport = transportFor(fastConfig()
                    .retryBaseDelay(Duration.ofSeconds(5))
                    .retryMaxDelay(Duration.ofSeconds(10))
                    .build());
            CallEnvelope envelope = CallEnvelope.post(
                    Destination.of("svc", stub.baseUrl()).invokeUri("run"), smallArguments(), Duration.ofSeconds(1));

            assertThatThrownBy(() -> transport.request(envelope))
                    .isInstanceOf(RequestTimeoutException.class)
                    .hasMessageContaining("backoff");
            assertThat(stub.requestCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should tolerate shutdown twice and reject requests afterwards")
        void shouldShutdownIdempotently() {
            HttpTransport transport = transportFor(fastConfig().build());

            transport.shutdown();
            assertThatCode(transport::shutdown).doesNotThrowAnyException();

            assertThat(transport.isClosed()).isTrue();
            assertThatThrownBy(() -> transport.request(invoke("run", smallArguments())))
                    .isInstanceOf(TransportClosedException.class);
            assertThat(stub.requestCount()).isZero();
        }

        @Test
        @DisplayName("should initialize even when the host cannot be resolved")
        void shouldInitializeWithUnresolvableHost() {
            transport = new HttpTransport(Destination.of("ghost", "http://mcp-ghost.invalid:9100"), fastConfig().build());

            assertThatCode(transport::initialize).doesNotThrowAnyException();
            assertThatCode(transport::initialize).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should report health from the health endpoint")
        void shouldCheckHealth() {
            HttpTransport transport = transportFor(fastConfig().build());

            assertThat(transport.healthCheck().join()).isTrue();

            stub.healthStatus(503);
            assertThat(transport.healthCheck().join()).isFalse();
        }
    }

    @Test
    @DisplayName("should open the circuit after repeated failures and stop calling the destination")
    void shouldOpenCircuit() {
        stub.respondByDefault(StubResponse.status(400));
        HttpTransport transport = transportFor(fastConfig()
                .circuitBreakerFailureThreshold(2)
                .circuitBreakerRecoveryTimeout(Duration.ofMinutes(1))
                .build());

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> transport.request(invoke("bad", smallArguments())))
                    .isInstanceOf(RequestFailedException.class);
        }

        assertThatThrownBy(() -> transport.request(invoke("bad", smallArguments())))
                .isInstanceOfSatisfying(CircuitOpenException.class,
                        e -> assertThat(e.getRetryAfter()).isPositive());
        assertThat(stub.requestCount()).isEqualTo(2);
        assertThat(transport.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }
}
