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
 * Tomorrow.io realtime API. Requires an API key, coordinate-based, numeric weather codes.
 */
public final class TomorrowIoSource extends CoordinateWeatherSource {

    public static final String NAME = "Tomorrow.io";
    public static final String DEFAULT_BASE_URL = "https://api.tomorrow.io";

    private final WeatherCodeTable codes;

    public TomorrowIoSource(String baseUrl, String apiKey, GeocodeResolver geocoder, WeatherCodeTable codes) {
        super(NAME, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, apiKey, true, geocoder);
        this.codes = codes;
    }

    @Override
    protected Outcome<Observation> fetchAt(Coordinate coordinate, WeatherHttpClient session) {
        URI uri = URI.create(baseUrl() + "/v4/weather/realtime"
                + "?location=" + coordinate.formattedLatitude() + "," + coordinate.formattedLongitude()
                + "&apikey=" + encode(apiKey()));

        return session.getJson(uri)
                .flatMap(root -> section(root, "data", "values"))
                .map(this::toObservation);
    }

    private Observation toObservation(JsonNode values) {
        Integer code = JsonValues.nullableInt(values.path("weatherCode"));
        return observation(
                JsonValues.safeDouble(values.path("temperature")),
                JsonValues.nullableDouble(values.path("humidity")),
                code != null ? codes.mapTomorrowCode(code) : WeatherCodeTable.UNKNOWN
        );
    }
}
