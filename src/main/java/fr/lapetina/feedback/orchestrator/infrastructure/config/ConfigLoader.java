package fr.lapetina.feedback.orchestrator.infrastructure.config;

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
 * Loads the orchestrator configuration once at process start.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from an arbitrary input stream
 *
 * The loaded configuration is validated before it is returned.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_PATH = "orchestrator.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public OrchestratorConfig load() {
        return loadFromPath().validate();
    }

    private OrchestratorConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private OrchestratorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "<stream>").validate();
    }

    private OrchestratorConfig parse(InputStream inputStream, String source) {
        try {
            OrchestratorConfig config = yaml.load(inputStream);
            if (config == null) {
                log.warn("Configuration source is empty, using defaults: {}", source);
                return createDefault();
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
