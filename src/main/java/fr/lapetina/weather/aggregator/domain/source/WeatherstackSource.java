package fr.lapetina.weather.aggregator.domain.source;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeCache;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.domain.model.SourceError;
import fr.lapetina.weather.aggregator.infrastructure.http.JsonValues;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;

import java.net.URI;

/**
 * Weatherstack current conditions. Requires an API key; the free tier only serves plain HTTP.
 *
 * Weatherstack reports API-level failures (bad key, quota) with status 200
 * and an {@code error} object, which is surfaced as a parsing error.
 */
public final class WeatherstackSource extends AbstractWeatherSource {

    public static final String NAME = "Weatherstack";
    public static final String DEFAULT_BASE_URL = "http://api.weatherstack.com";

    public WeatherstackSource(String baseUrl, String apiKey) {
        super(NAME, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, apiKey, true);
    }

    @Override
    public boolean requiresCoordinates() {
        return false;
    }

    @Override
    protected Outcome<Observation> doFetch(String city, WeatherHttpClient session, GeocodeCache cache) {
        URI uri = URI.create(baseUrl() + "/current?access_key=" + encode(apiKey()) + "&query=" + encode(city));

        return session.getJson(uri)
                .flatMap(WeatherstackSource::rejectApiError)
                .flatMap(root -> section(root, "current"))
                .map(this::toObservation);
    }

    private static Outcome<JsonNode> rejectApiError(JsonNode root) {
        JsonNode error = root.path("error");
        boolean unsuccessful = root.path("success").isBoolean() && !root.path("success").asBoolean();
        if (unsuccessful || error.isObject()) {
            String info = JsonValues.text(error.path("info"));
            return Outcome.failure(SourceError.parsing(info.isEmpty() ? "provider reported an error" : info));
        }
        return Outcome.success(root);
    }

    private Observation toObservation(JsonNode current) {
        return observation(
                JsonValues.safeDouble(current.path("temperature")),
                JsonValues.nullableDouble(current.path("humidity")),
                JsonValues.text(current.path("weather_descriptions").path(0))
        );
    }
}
