package fr.lapetina.mcp.client.infrastructure.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.exception.ConfigLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the destination registry document:
 *
 * <pre>{@code
 * { "servers": { "<name>": { "baseUrl": "http://host:port", ... } } }
 * }</pre>
 *
 * Unknown fields are ignored. The file system is tried before the classpath.
 */
public final class RegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(RegistryLoader.class);

    private final ObjectMapper objectMapper;

    public RegistryLoader() {
        this(new ObjectMapper());
    }

    public RegistryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the registry from a path.
     *
     * @throws ConfigLoadException if the file is missing, malformed, or a destination lacks a baseUrl
     */
    public DestinationRegistry load(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigLoadException("Registry path is required");
        }
        Path filePath = Paths.get(path);
        if (Files.exists(filePath)) {
            log.info("Loading destination registry from file: {}", filePath);
            try (InputStream is = Files.newInputStream(filePath)) {
                return parse(is, path);
            } catch (IOException e) {
                throw new ConfigLoadException("Failed to read registry file: " + path, e);
            }
        }

        String classpathResource = path.startsWith("/") ? path.substring(1) : path;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading destination registry from classpath: {}", classpathResource);
                return parse(is, path);
            }
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to load registry from classpath: " + path, e);
        }

        throw new ConfigLoadException("Registry file not found: " + path);
    }

    /**
     * Parses a registry document.
     *
     * @param source name used in error messages
     */
    public DestinationRegistry parse(InputStream inputStream, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(inputStream);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Malformed registry JSON in " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read registry: " + source, e);
        }
        return fromTree(root, source);
    }

    DestinationRegistry fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException("Registry " + source + " must be a JSON object");
        }
        JsonNode servers = root.get("servers");
        if (servers == null || !servers.isObject()) {
            throw new ConfigLoadException("Registry " + source + " has no 'servers' object");
        }

        List<Destination> destinations = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = servers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            destinations.add(toDestination(entry.getKey(), entry.getValue(), source));
        }

        DestinationRegistry registry = DestinationRegistry.of(destinations);
        log.info("Destination registry loaded: source={}, destinations={}", source, registry.names());
        return registry;
    }

    private Destination toDestination(String name, JsonNode server, String source) {
        JsonNode baseUrlNode = server != null ? server.get("baseUrl") : null;
        if (baseUrlNode == null || !baseUrlNode.isTextual() || baseUrlNode.asText().isBlank()) {
            throw new ConfigLoadException("Destination '" + name + "' in " + source + " has no baseUrl");
        }
        String baseUrl = baseUrlNode.asText().trim();
        try {
            URI uri = new URI(baseUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigLoadException("Destination '" + name + "' has an invalid baseUrl: " + baseUrl);
            }
            return new Destination(name, uri);
        } catch (URISyntaxException e) {
            throw new ConfigLoadException("Destination '" + name + "' has an invalid baseUrl: " + baseUrl, e);
        }
    }
}
