package fr.lapetina.mcp.client.infrastructure.registry;

import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.exception.ConfigLoadException;
import fr.lapetina.mcp.client.exception.DestinationNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryLoaderTest {

    private RegistryLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RegistryLoader();
    }

    private static InputStream json(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Loading")
    class LoadTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should load from the classpath, keeping file order and ignoring extra fields")
        void shouldLoadFromClasspath() {
            DestinationRegistry registry = loader.load("test-servers.json");

            assertThat(registry.names()).containsExactly("search", "files", "analytics");
            assertThat(registry.resolveBaseUrl("files")).isEqualTo("http://localhost:9102");
        }

        @Test
        @DisplayName("should load from the file system")
        void shouldLoadFromFile() throws IOException {
            Path file = tempDir.resolve("servers.json");
            Files.writeString(file, "{\"servers\": {\"svcA\": {\"baseUrl\": \"http://localhost:9100\"}}}");

            DestinationRegistry registry = DestinationRegistry.load(file.toString());

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.resolve("svcA").baseUrl()).isEqualTo(URI.create("http://localhost:9100"));
        }

        @Test
        @DisplayName("should name the path when the file is missing")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> loader.load("missing/servers.json"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("missing/servers.json");
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> loader.parse(json("{\"servers\": {"), "inline"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Malformed");
        }

        @Test
        @DisplayName("should reject a document without servers")
        void shouldRejectMissingServers() {
            assertThatThrownBy(() -> loader.parse(json("{\"destinations\": {}}"), "inline"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("servers");
        }

        @Test
        @DisplayName("should reject a destination without baseUrl")
        void shouldRejectMissingBaseUrl() {
            String document = "{\"servers\": {\"ok\": {\"baseUrl\": \"http://a\"}, \"broken\": {\"url\": \"http://b\"}}}";

            assertThatThrownBy(() -> loader.parse(json(document), "inline"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("broken")
                    .hasMessageContaining("baseUrl");
        }

        @Test
        @DisplayName("should reject a baseUrl without scheme")
        void shouldRejectRelativeBaseUrl() {
            assertThatThrownBy(() -> loader.parse(json("{\"servers\": {\"x\": {\"baseUrl\": \"localhost\"}}}"), "inline"))
                    .isInstanceOf(ConfigLoadException.class);
        }
    }

    @Test
    @DisplayName("should fail resolution of an unknown destination")
    void shouldFailUnknownDestination() {
        DestinationRegistry registry = DestinationRegistry.of(List.of(Destination.of("a", "http://a")));

        assertThat(registry.find("b")).isEmpty();
        assertThat(registry.contains("a")).isTrue();
        assertThatThrownBy(() -> registry.resolve("b"))
                .isInstanceOf(DestinationNotFoundException.class)
                .hasMessageContaining("b");
    }
}
