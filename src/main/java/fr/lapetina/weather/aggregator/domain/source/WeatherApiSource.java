package fr.lapetina.weather.aggregator.domain.source;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeCache;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.infrastructure.http.JsonValues;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;

import java.net.URI;

/**
 * WeatherAPI.com current conditions. Requires an API key, name-based.
 */
public final class WeatherApiSource extends AbstractWeatherSource {

    public static final String NAME = "WeatherAPI.com";
    public static final String DEFAULT_BASE_URL = "https://api.weatherapi.com";

    public WeatherApiSource(String baseUrl, String apiKey) {
        super(NAME, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, apiKey, true);
    }

    @Override
    public boolean requiresCoordinates() {
        return false;
    }

    @Override
    protected Outcome<Observation> doFetch(String city, WeatherHttpClient session, GeocodeCache cache) {
        URI uri = URI.create(baseUrl() + "/v1/current.json?key=" + encode(apiKey()) + "&q=" + encode(city));

        return session.getJson(uri)
                .flatMap(root -> section(root, "current"))
                .map(this::toObservation);
    }

    private Observation toObservation(JsonNode current) {
        return observation(
                JsonValues.safeDouble(current.path("temp_c")),
                JsonValues.nullableDouble(current.path("humidity")),
                JsonValues.text(current.path("condition").path("text"))
        );
    }
}
