package fr.lapetina.mcp.client.infrastructure.config;

import fr.lapetina.mcp.client.exception.ConfigLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link ClientSettings} from YAML.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Loading from an arbitrary input stream
 */
public final class SettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private final Path settingsPath;
    private final Yaml yaml;

    public SettingsLoader(String settingsPath) {
        this.settingsPath = Paths.get(settingsPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ClientSettings.class, loaderOptions));
    }

    /**
     * Loads settings from file or classpath.
     *
     * @return the loaded settings
     * @throws ConfigLoadException if the source is missing or malformed
     */
    public ClientSettings load() {
        // Try file system first
        if (Files.exists(settingsPath)) {
            log.info("Loading client settings from file: {}", settingsPath);
            try (InputStream is = Files.newInputStream(settingsPath)) {
                return parse(is, settingsPath.toString());
            } catch (IOException e) {
                throw new ConfigLoadException("Failed to read settings: " + settingsPath, e);
            }
        }

        // Try classpath
        String classpathResource = settingsPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading client settings from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigLoadException("Settings file not found: " + settingsPath);
    }

    /**
     * Loads settings from an input stream.
     */
    public ClientSettings loadFromStream(InputStream inputStream) {
        return parse(inputStream, "<stream>");
    }

    private ClientSettings parse(InputStream is, String source) {
        try {
            ClientSettings settings = yaml.load(is);
            return settings != null ? settings : new ClientSettings();
        } catch (YAMLException e) {
            throw new ConfigLoadException("Malformed settings in " + source + ": " + e.getMessage(), e);
        }
    }
}
