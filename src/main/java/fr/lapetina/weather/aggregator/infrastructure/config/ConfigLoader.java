package fr.lapetina.weather.aggregator.infrastructure.config;

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
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Falling back to built-in defaults when no source list is configured
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG = "weather-aggregator.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(AggregatorConfig.class, loaderOptions));
    }

    public ConfigLoader() {
        this(DEFAULT_CONFIG);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public AggregatorConfig load() {
        return validate(loadFromPath());
    }

    private AggregatorConfig loadFromPath() {
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

    private AggregatorConfig loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            log.info("Loading configuration from file: {}", path);
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public AggregatorConfig loadFromStream(InputStream inputStream) {
        return validate(parse(inputStream, "stream"));
    }

    private AggregatorConfig parse(InputStream inputStream, String origin) {
        try {
            AggregatorConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    private AggregatorConfig validate(AggregatorConfig config) {
        if (config.getSources() == null || config.getSources().isEmpty()) {
            log.info("No sources configured, using built-in provider list");
            config.setSources(defaultSources());
        }
        for (AggregatorConfig.SourceConfig source : config.getSources()) {
            if (source.getType() == null || source.getType().isBlank()) {
                throw new ConfigurationException("Source entry without a type");
            }
        }
        if (config.getHttp().getRequestTimeoutMs() <= 0) {
            throw new ConfigurationException("http.requestTimeoutMs must be positive");
        }
        if (config.getOrchestrator().getSourceTimeoutMs() <= 0) {
            throw new ConfigurationException("orchestrator.sourceTimeoutMs must be positive");
        }
        if (config.getOrchestrator().getMaxParallelism() <= 0) {
            throw new ConfigurationException("orchestrator.maxParallelism must be positive");
        }
        return config;
    }

    /**
     * Creates a default configuration with every built-in provider.
     */
    public static AggregatorConfig createDefault() {
        AggregatorConfig config = new AggregatorConfig();
        config.setSources(defaultSources());
        return config;
    }

    private static List<AggregatorConfig.SourceConfig> defaultSources() {
        List<AggregatorConfig.SourceConfig> sources = new ArrayList<>();
        sources.add(new AggregatorConfig.SourceConfig("open-meteo", null));
        sources.add(new AggregatorConfig.SourceConfig("wttr-in", null));
        sources.add(new AggregatorConfig.SourceConfig("weatherapi", "WEATHER_API_COM_KEY"));
        sources.add(new AggregatorConfig.SourceConfig("weatherstack", "WEATHERSTACK_API_KEY"));
        sources.add(new AggregatorConfig.SourceConfig("meteosource", "METEOSOURCE_API_KEY"));
        sources.add(new AggregatorConfig.SourceConfig("pirate-weather", "PIRATE_WEATHER_API_KEY"));
        sources.add(new AggregatorConfig.SourceConfig("tomorrow-io", "TOMORROW_IO_API_KEY"));
        return sources;
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
