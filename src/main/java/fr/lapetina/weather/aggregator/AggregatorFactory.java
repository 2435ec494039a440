package fr.lapetina.weather.aggregator;

import fr.lapetina.weather.aggregator.domain.aggregate.WeatherAggregator;
import fr.lapetina.weather.aggregator.domain.condition.WeatherCodeCatalog;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeResolver;
import fr.lapetina.weather.aggregator.domain.geocode.OpenMeteoGeocoder;
import fr.lapetina.weather.aggregator.domain.model.AggregateSummary;
import fr.lapetina.weather.aggregator.domain.model.AggregationReport;
import fr.lapetina.weather.aggregator.domain.model.FetchMode;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.source.SourceFactory;
import fr.lapetina.weather.aggregator.domain.source.WeatherSource;
import fr.lapetina.weather.aggregator.infrastructure.config.AggregatorConfig;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.weather.aggregator.infrastructure.config.WeatherCodeLoader;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;
import fr.lapetina.weather.aggregator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.weather.aggregator.orchestration.FetchOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Factory for creating a fully-wired aggregator from configuration.
 * This is the primary entry point for running a weather batch.
 *
 * <p>Usage:
 * <pre>{@code
 * try (AggregatorFactory factory = AggregatorFactory.create("weather-aggregator.yaml")) {
 *     AggregationReport report = factory.run("Paris", List.of("wttr.in"), FetchMode.CONCURRENT);
 *     // use report...
 * }
 * }</pre>
 */
public class AggregatorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AggregatorFactory.class);

    private final AggregatorConfig config;
    private final WeatherCodeCatalog catalog;
    private final WeatherHttpClient httpClient;
    private final GeocodeResolver geocoder;
    private final MetricsRegistry metricsRegistry;
    private final SourceFactory sourceFactory;
    private final List<WeatherSource> sources;
    private final FetchOrchestrator orchestrator;
    private final WeatherAggregator aggregator;

    protected AggregatorFactory(AggregatorConfig config, Function<String, String> environment) {
        this.config = config;

        // Load condition taxonomy and code tables
        this.catalog = new WeatherCodeLoader().loadDefault();

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Initialize shared HTTP session
        AggregatorConfig.HttpConfig http = config.getHttp();
        this.httpClient = new WeatherHttpClient(
                Duration.ofMillis(http.getConnectTimeoutMs()),
                Duration.ofMillis(http.getRequestTimeoutMs()),
                http.getUserAgent()
        );

        this.geocoder = new OpenMeteoGeocoder(config.getGeocoding().getBaseUrl());

        // Build sources whose credentials are present
        this.sourceFactory = new SourceFactory(geocoder, catalog.codes(), environment);
        this.sources = List.copyOf(sourceFactory.createAll(config.getSources()));

        AggregatorConfig.OrchestratorConfig orchestration = config.getOrchestrator();
        this.orchestrator = new FetchOrchestrator(
                geocoder,
                httpClient,
                Duration.ofMillis(orchestration.getSourceTimeoutMs()),
                orchestration.getMaxParallelism(),
                metricsRegistry
        );

        this.aggregator = new WeatherAggregator(catalog.normalizer());

        log.info("AggregatorFactory initialized with {} sources", sources.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static AggregatorFactory create(String configPath) {
        log.info("Initializing AggregatorFactory from config: {}", configPath);
        return new AggregatorFactory(new ConfigLoader(configPath).load(), System::getenv);
    }

    /**
     * Creates a factory from the default configuration.
     */
    public static AggregatorFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static AggregatorFactory create(AggregatorConfig config, Function<String, String> environment) {
        return new AggregatorFactory(config, environment);
    }

    /**
     * Runs one batch: filter the sources, fetch, then aggregate.
     *
     * @param city       city name, already validated
     * @param exclusions source names to skip, compared case- and punctuation-insensitively
     * @param mode       dispatch mode
     * @throws ConfigurationException if no source is configured or all were excluded
     */
    public AggregationReport run(String city, Collection<String> exclusions, FetchMode mode) {
        if (sources.isEmpty()) {
            throw new ConfigurationException("No weather sources are configured");
        }
        List<WeatherSource> selected = SourceFactory.exclude(sources, exclusions);

        Instant start = Instant.now();
        List<Observation> observations = orchestrator.fetch(city, selected, mode);
        AggregateSummary summary = aggregator.aggregate(observations);
        Instant end = Instant.now();

        return new AggregationReport(city, mode, observations, summary, Duration.between(start, end), end);
    }

    /**
     * Runs one batch in the configured default mode.
     */
    public AggregationReport run(String city, Collection<String> exclusions) {
        return run(city, exclusions, getDefaultMode());
    }

    public FetchMode getDefaultMode() {
        try {
            return FetchMode.fromString(config.getOrchestrator().getMode());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown orchestrator mode: " + config.getOrchestrator().getMode(), e);
        }
    }

    public AggregatorConfig getConfig() {
        return config;
    }

    public WeatherCodeCatalog getCatalog() {
        return catalog;
    }

    public List<WeatherSource> getSources() {
        return sources;
    }

    public WeatherAggregator getAggregator() {
        return aggregator;
    }

    public WeatherHttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    @Override
    public void close() {
        log.info("Shutting down AggregatorFactory...");

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("AggregatorFactory shut down");
    }
}
