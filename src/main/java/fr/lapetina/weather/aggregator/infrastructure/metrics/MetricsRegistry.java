package fr.lapetina.weather.aggregator.infrastructure.metrics;

import fr.lapetina.weather.aggregator.domain.model.FetchMode;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Per-source latency timers and result counters, tagged by outcome
 * - Batch latency per fetch mode
 * - Geocoding attempt counters
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> resultCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> batchTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> geocodeCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        log.debug("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("weather_agg");
    }

    /**
     * Records one source call: latency plus a result counter tagged with the outcome.
     */
    public void recordSourceResult(Observation observation, Duration latency) {
        String source = observation.source();
        String outcome = outcomeTag(observation);
        String key = source + ":" + outcome;

        sourceTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_source_latency")
                        .description("Weather source call latency")
                        .tag("source", source)
                        .tag("outcome", outcome)
                        .publishPercentiles(0.5, 0.95)
                        .register(registry)
        ).record(latency);

        resultCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_source_results_total")
                        .description("Weather source results")
                        .tag("source", source)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the wall-clock time of a whole batch.
     */
    public void recordBatch(FetchMode mode, Duration latency) {
        String tag = mode.name().toLowerCase(Locale.ROOT);
        batchTimers.computeIfAbsent(tag, k ->
                Timer.builder(prefix + "_batch_latency")
                        .description("Batch latency across all sources")
                        .tag("mode", tag)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a batch-level geocoding attempt.
     */
    public void recordGeocode(boolean success) {
        String outcome = success ? "success" : "failure";
        geocodeCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_geocode_total")
                        .description("Batch geocoding attempts")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    private static String outcomeTag(Observation observation) {
        if (observation.isValid()) {
            return "success";
        }
        return observation.errorType() != null
                ? observation.errorType().name().toLowerCase(Locale.ROOT)
                : "error";
    }

    /**
     * Returns Prometheus-formatted metrics.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying registry for custom metrics.
     */
    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
