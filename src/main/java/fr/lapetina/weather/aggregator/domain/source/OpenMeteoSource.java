package fr.lapetina.weather.aggregator.domain.source;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.weather.aggregator.domain.condition.WeatherCodeTable;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeResolver;
import fr.lapetina.weather.aggregator.domain.model.Coordinate;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.infrastructure.http.JsonValues;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;

import java.net.URI;

/**
 * Open-Meteo forecast API. Free, coordinate-based, reports WMO weather codes.
 */
public final class OpenMeteoSource extends CoordinateWeatherSource {

    public static final String NAME = "Open-Meteo";
    public static final String DEFAULT_BASE_URL = "https://api.open-meteo.com";

    private final WeatherCodeTable codes;

    public OpenMeteoSource(String baseUrl, GeocodeResolver geocoder, WeatherCodeTable codes) {
        super(NAME, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, null, false, geocoder);
        this.codes = codes;
    }

    @Override
    protected Outcome<Observation> fetchAt(Coordinate coordinate, WeatherHttpClient session) {
        URI uri = URI.create(baseUrl() + "/v1/forecast"
                + "?latitude=" + coordinate.formattedLatitude()
                + "&longitude=" + coordinate.formattedLongitude()
                + "&current=temperature_2m,relative_humidity_2m,weather_code");

        return session.getJson(uri)
                .flatMap(root -> section(root, "current"))
                .map(this::toObservation);
    }

    private Observation toObservation(JsonNode current) {
        Integer code = JsonValues.nullableInt(current.path("weather_code"));
        return observation(
                JsonValues.safeDouble(current.path("temperature_2m")),
                JsonValues.nullableDouble(current.path("relative_humidity_2m")),
                code != null ? codes.mapWmoCode(code) : WeatherCodeTable.UNKNOWN
        );
    }
}
