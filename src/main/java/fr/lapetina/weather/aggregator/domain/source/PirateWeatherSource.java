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
 * Pirate Weather (Dark Sky compatible). Requires an API key, coordinate-based.
 * Humidity is reported as a 0-1 fraction.
 */
public final class PirateWeatherSource extends CoordinateWeatherSource {

    public static final String NAME = "Pirate Weather";
    public static final String DEFAULT_BASE_URL = "https://api.pirateweather.net";

    public PirateWeatherSource(String baseUrl, String apiKey, GeocodeResolver geocoder) {
        super(NAME, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, apiKey, true, geocoder);
    }

    @Override
    protected Outcome<Observation> fetchAt(Coordinate coordinate, WeatherHttpClient session) {
        URI uri = URI.create(baseUrl() + "/forecast/" + encode(apiKey()) + "/"
                + coordinate.formattedLatitude() + "," + coordinate.formattedLongitude()
                + "?units=si");

        return session.getJson(uri)
                .flatMap(root -> section(root, "currently"))
                .map(this::toObservation);
    }

    private Observation toObservation(JsonNode currently) {
        Double fraction = JsonValues.nullableDouble(currently.path("humidity"));
        return observation(
                JsonValues.safeDouble(currently.path("temperature")),
                fraction != null ? fraction * 100 : null,
                JsonValues.text(currently.path("summary"))
        );
    }
}
