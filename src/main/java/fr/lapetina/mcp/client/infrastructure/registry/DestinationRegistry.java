package fr.lapetina.mcp.client.infrastructure.registry;

import fr.lapetina.mcp.client.domain.model.Destination;
import fr.lapetina.mcp.client.exception.DestinationNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered mapping of destination name to destination.
 *
 * Loaded once at startup; safe to share across threads.
 */
public final class DestinationRegistry {

    private final Map<String, Destination> destinations;

    private DestinationRegistry(Map<String, Destination> destinations) {
        this.destinations = Collections.unmodifiableMap(new LinkedHashMap<>(destinations));
    }

    /**
     * Creates a registry from name to base URL pairs, keeping iteration order.
     */
    public static DestinationRegistry of(Map<String, String> baseUrls) {
        Map<String, Destination> map = new LinkedHashMap<>();
        baseUrls.forEach((name, url) -> map.put(name, Destination.of(name, url)));
        return new DestinationRegistry(map);
    }

    /**
     * Creates a registry from already-built destinations, keeping iteration order.
     */
    public static DestinationRegistry of(Collection<Destination> destinations) {
        Map<String, Destination> map = new LinkedHashMap<>();
        for (Destination destination : destinations) {
            map.put(destination.name(), destination);
        }
        return new DestinationRegistry(map);
    }

    /**
     * Loads a registry from a JSON file on the file system or classpath.
     *
     * @see RegistryLoader
     */
    public static DestinationRegistry load(String path) {
        return new RegistryLoader().load(path);
    }

    /**
     * Resolves a destination by name.
     *
     * @throws DestinationNotFoundException if the name is not registered
     */
    public Destination resolve(String name) {
        Destination destination = destinations.get(name);
        if (destination == null) {
            throw new DestinationNotFoundException(name);
        }
        return destination;
    }

    /**
     * Resolves a destination's base URL.
     *
     * @throws DestinationNotFoundException if the name is not registered
     */
    public String resolveBaseUrl(String name) {
        return resolve(name).baseUrl().toString();
    }

    public Optional<Destination> find(String name) {
        return Optional.ofNullable(destinations.get(name));
    }

    public boolean contains(String name) {
        return destinations.containsKey(name);
    }

    /**
     * Destination names in registry order.
     */
    public List<String> names() {
        return List.copyOf(destinations.keySet());
    }

    public List<Destination> all() {
        return new ArrayList<>(destinations.values());
    }

    public int size() {
        return destinations.size();
    }

    @Override
    public String toString() {
        return "DestinationRegistry{" + destinations.keySet() + '}';
    }
}
