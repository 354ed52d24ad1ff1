package fr.lapetina.mcp.client.integration;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * In-process HTTP destination answering with scripted responses.
 *
 * Scripted responses are consumed in order by invoke requests; once the script is empty the
 * default response is returned. {@code GET /health} always answers with the health status.
 */
public final class StubDestinationServer implements AutoCloseable {

    public record StubResponse(int status, String contentType, byte[] body, boolean gzip, long delayMs) {

        public static StubResponse json(int status, String json) {
            return new StubResponse(status, "application/json", json.getBytes(StandardCharsets.UTF_8), false, 0);
        }

        public static StubResponse text(int status, String text) {
            return new StubResponse(status, "text/plain; charset=utf-8", text.getBytes(StandardCharsets.UTF_8), false, 0);
        }

        public static StubResponse status(int status) {
            return new StubResponse(status, "application/json", new byte[0], false, 0);
        }

        public StubResponse gzipped() {
            return new StubResponse(status, contentType, body, true, delayMs);
        }

        public StubResponse delayed(long millis) {
            return new StubResponse(status, contentType, body, gzip, millis);
        }
    }

    public record RecordedRequest(String method, String path, Map<String, List<String>> headers, byte[] wireBody) {

        public String header(String name) {
            List<String> values = headers.get(name);
            return values == null || values.isEmpty() ? null : values.get(0);
        }

        /**
         * Body after undoing any gzip content encoding.
         */
        public String body() {
            try {
                if ("gzip".equalsIgnoreCase(header("Content-Encoding"))) {
                    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(wireBody))) {
                        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                    }
                }
                return new String(wireBody, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Unreadable request body", e);
            }
        }
    }

    private final HttpServer server;
    private final ExecutorService executor;
    private final Deque<StubResponse> script = new ConcurrentLinkedDeque<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private volatile StubResponse defaultResponse = StubResponse.json(200, "{\"ok\":true}");
    private volatile int healthStatus = 200;

    private StubDestinationServer() throws IOException {
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        this.executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/", this::handle);
    }

    public static StubDestinationServer start() throws IOException {
        StubDestinationServer stub = new StubDestinationServer();
        stub.server.start();
        return stub;
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public StubDestinationServer enqueue(StubResponse... responses) {
        script.addAll(List.of(responses));
        return this;
    }

    public StubDestinationServer respondByDefault(StubResponse response) {
        this.defaultResponse = response;
        return this;
    }

    public StubDestinationServer healthStatus(int status) {
        this.healthStatus = status;
        return this;
    }

    public List<RecordedRequest> requests() {
        return new ArrayList<>(requests);
    }

    public int requestCount() {
        return requests.size();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            if ("GET".equals(exchange.getRequestMethod()) && "/health".equals(path)) {
                exchange.sendResponseHeaders(healthStatus, -1);
                return;
            }

            Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            headers.putAll(exchange.getRequestHeaders());
            byte[] body = exchange.getRequestBody().readAllBytes();
            requests.add(new RecordedRequest(exchange.getRequestMethod(), path, headers, body));

            StubResponse response = script.poll();
            if (response == null) {
                response = defaultResponse;
            }
            if (response.delayMs() > 0) {
                try {
                    Thread.sleep(response.delayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }

            byte[] payload = response.gzip() ? gzip(response.body()) : response.body();
            exchange.getResponseHeaders().set("Content-Type", response.contentType());
            if (response.gzip()) {
                exchange.getResponseHeaders().set("Content-Encoding", "gzip");
            }
            exchange.sendResponseHeaders(response.status(), payload.length == 0 ? -1 : payload.length);
            if (payload.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(payload);
                }
            }
        } finally {
            exchange.close();
        }
    }

    private static byte[] gzip(byte[] body) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(body);
        }
        return out.toByteArray();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
