package fr.lapetina.mcp.client;

import fr.lapetina.mcp.client.client.McpClient;
import fr.lapetina.mcp.client.domain.mode.OperatingMode;
import fr.lapetina.mcp.client.infrastructure.config.ClientConfig;
import fr.lapetina.mcp.client.infrastructure.config.ClientSettings;
import fr.lapetina.mcp.client.infrastructure.config.SettingsLoader;
import fr.lapetina.mcp.client.infrastructure.config.TransportConfig;
import fr.lapetina.mcp.client.infrastructure.http.TransportFactory;
import fr.lapetina.mcp.client.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mcp.client.infrastructure.registry.DestinationRegistry;
import fr.lapetina.mcp.client.infrastructure.registry.RegistryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating a fully-wired client from a settings file.
 * This is the primary entry point for obtaining a configured {@link McpClient}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (McpClientFactory factory = McpClientFactory.create("mcp-client.yaml")) {
 *     McpClient client = factory.getClient();
 *     // use client...
 * }
 * }</pre>
 */
public class McpClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(McpClientFactory.class);

    private final ClientSettings settings;
    private final OperatingMode mode;
    private final DestinationRegistry registry;
    private final MetricsRegistry metricsRegistry;
    private final McpClient client;

    protected McpClientFactory(ClientSettings settings, TransportFactory transportFactoryOverride) {
        this.settings = settings;
        this.mode = OperatingMode.fromName(settings.getMode());

        // Preset first, then explicit overrides
        TransportConfig transportConfig = mode.transportConfig();
        if (settings.getTransport() != null) {
            transportConfig = settings.getTransport().applyTo(transportConfig);
        }
        ClientConfig clientConfig = mode.clientConfig();
        if (settings.getClient() != null) {
            clientConfig = settings.getClient().applyTo(clientConfig);
        }

        this.registry = new RegistryLoader().load(settings.getRegistryPath());
        this.metricsRegistry = new MetricsRegistry(settings.getMetricsPrefix());

        this.client = McpClient.builder()
                .registry(registry)
                .mode(mode)
                .transportConfig(transportConfig)
                .clientConfig(clientConfig)
                .transportFactory(transportFactoryOverride != null ? transportFactoryOverride : TransportFactory.http())
                .metricsRegistry(metricsRegistry)
                .build();

        log.info("McpClientFactory initialized: mode={}, registry={}, destinations={}",
                mode.configName(), settings.getRegistryPath(), registry.size());
    }

    /**
     * Creates a factory from the specified settings file.
     *
     * @throws fr.lapetina.mcp.client.exception.ConfigLoadException if the settings or registry are missing or malformed
     */
    public static McpClientFactory create(String settingsPath) {
        log.info("Initializing McpClientFactory from settings: {}", settingsPath);
        return new McpClientFactory(new SettingsLoader(settingsPath).load(), null);
    }

    /**
     * Creates a factory from the default settings file (mcp-client.yaml).
     */
    public static McpClientFactory create() {
        return create("mcp-client.yaml");
    }

    /**
     * Creates a factory from already-loaded settings.
     */
    public static McpClientFactory create(ClientSettings settings, TransportFactory transportFactory) {
        return new McpClientFactory(settings, transportFactory);
    }

    /**
     * Creates a factory for a registry file and a mode name, without a settings file.
     */
    public static McpClientFactory fromRegistry(String registryPath, String modeName) {
        ClientSettings settings = new ClientSettings();
        settings.setRegistryPath(registryPath);
        settings.setMode(modeName);
        return new McpClientFactory(settings, null);
    }

    public McpClient getClient() {
        return client;
    }

    public DestinationRegistry getRegistry() {
        return registry;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public OperatingMode getMode() {
        return mode;
    }

    public ClientSettings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        log.info("Shutting down McpClientFactory...");
        client.shutdown();
        metricsRegistry.close();
        log.info("McpClientFactory shutdown complete");
    }
}
