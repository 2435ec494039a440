package fr.lapetina.weather.aggregator.domain.source;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeResolver;
import fr.lapetina.weather.aggregator.domain.model.Coordinate;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.infrastructure.http.JsonValues;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;

import java.net.URI;

/**
 * Meteosource free point API. Requires an API key, coordinate-based.
 * The free tier may omit humidity or send it as text such as {@code "71%"}.
 */
public final class MeteosourceSource extends CoordinateWeatherSource {

    public static final String NAME = "Meteosource";
    public static final String DEFAULT_BASE_URL = "https://www.meteosource.com";

    public MeteosourceSource(String baseUrl, String apiKey, GeocodeResolver geocoder) {
        super(NAME, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, apiKey, true, geocoder);
    }

    @Override
    protected Outcome<Observation> fetchAt(Coordinate coordinate, WeatherHttpClient session) {
        URI uri = URI.create(baseUrl() + "/api/v1/free/point"
                + "?lat=" + coordinate.formattedLatitude()
                + "&lon=" + coordinate.formattedLongitude()
                + "&sections=current&language=en&units=metric"
                + "&key=" + encode(apiKey()));

        return session.getJson(uri)
                .flatMap(root -> section(root, "current"))
                .map(this::toObservation);
    }

    private Observation toObservation(JsonNode current) {
        return observation(
                JsonValues.safeDouble(current.path("temperature")),
                JsonValues.nullableDouble(current.path("humidity")),
                JsonValues.text(current.path("summary"))
        );
    }
}
