package fr.lapetina.weather.aggregator.domain.source;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeCache;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.domain.model.SourceError;
import fr.lapetina.weather.aggregator.infrastructure.http.JsonValues;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Base class for weather sources.
 *
 * Handles the credential check and turns the {@link Outcome} chain built by
 * subclasses into an {@link Observation}.
 */
public abstract class AbstractWeatherSource implements WeatherSource {

    private static final Logger log = LoggerFactory.getLogger(AbstractWeatherSource.class);

    private final String name;
    private final String baseUrl;
    private final String apiKey;
    private final boolean requiresCredential;

    protected AbstractWeatherSource(String name, String baseUrl, String apiKey, boolean requiresCredential) {
        this.name = Objects.requireNonNull(name, "Name is required");
        String url = Objects.requireNonNull(baseUrl, "Base URL is required");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiKey = apiKey;
        this.requiresCredential = requiresCredential;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final boolean requiresCredential() {
        return requiresCredential;
    }

    @Override
    public final Observation fetch(String city, WeatherHttpClient session, GeocodeCache cache) {
        if (requiresCredential && (apiKey == null || apiKey.isBlank())) {
            return Observation.failure(name, SourceError.missingCredential());
        }

        Outcome<Observation> outcome;
        try {
            outcome = doFetch(city, session, cache);
        } catch (RuntimeException e) {
            // Provider payloads occasionally defeat the field checks
            log.error("Unexpected failure: source={}, city={}", name, city, e);
            outcome = Outcome.failure(SourceError.parsing(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }

        return outcome.fold(
                observation -> observation,
                error -> {
                    log.debug("Source failed: source={}, city={}, error={}", name, city, error.message());
                    return Observation.failure(name, error);
                }
        );
    }

    /**
     * Provider-specific step chain: request, then map the payload.
     */
    protected abstract Outcome<Observation> doFetch(String city, WeatherHttpClient session, GeocodeCache cache);

    protected Observation observation(double temperature, Double humidity, String condition) {
        return Observation.success(name, temperature, humidity, condition);
    }

    protected String baseUrl() {
        return baseUrl;
    }

    protected String apiKey() {
        return apiKey;
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Returns the nested node at the given field path, or a parsing error naming the path.
     */
    protected static Outcome<JsonNode> section(JsonNode root, String... path) {
        JsonNode node = root;
        for (String field : path) {
            node = node.path(field);
        }
        if (!JsonValues.isPresent(node)) {
            return Outcome.failure(SourceError.parsing("missing '" + String.join(".", path) + "'"));
        }
        return Outcome.success(node);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
