package fr.lapetina.weather.aggregator.domain.geocode;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.weather.aggregator.domain.model.Coordinate;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.domain.model.SourceError;
import fr.lapetina.weather.aggregator.infrastructure.http.JsonValues;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Geocoder backed by the Open-Meteo search API.
 * Only the first result is used; ambiguous names are not disambiguated.
 */
public final class OpenMeteoGeocoder implements GeocodeResolver {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoGeocoder.class);

    public static final String DEFAULT_BASE_URL = "https://geocoding-api.open-meteo.com";

    private final String baseUrl;

    public OpenMeteoGeocoder(String baseUrl) {
        this.baseUrl = stripTrailingSlash(baseUrl != null ? baseUrl : DEFAULT_BASE_URL);
    }

    public OpenMeteoGeocoder() {
        this(DEFAULT_BASE_URL);
    }

    @Override
    public Outcome<Coordinate> resolve(String city, WeatherHttpClient session) {
        URI uri = URI.create(baseUrl + "/v1/search?name="
                + URLEncoder.encode(city, StandardCharsets.UTF_8) + "&count=1");

        Outcome<Coordinate> result = session.getJson(uri)
                .mapError(SourceError::geocoding)
                .flatMap(OpenMeteoGeocoder::firstResult);

        if (result.isSuccess()) {
            log.debug("Geocoded city: city={}, latitude={}, longitude={}",
                    city, result.value().latitude(), result.value().longitude());
        } else {
            log.debug("Geocoding failed: city={}, error={}", city, result.error().message());
        }
        return result;
    }

    private static Outcome<Coordinate> firstResult(JsonNode root) {
        JsonNode results = root.path("results");
        if (!results.isArray() || results.isEmpty()) {
            return Outcome.failure(SourceError.cityNotFound());
        }
        JsonNode first = results.get(0);
        Double latitude = JsonValues.nullableDouble(first.path("latitude"));
        Double longitude = JsonValues.nullableDouble(first.path("longitude"));
        if (latitude == null || longitude == null) {
            return Outcome.failure(SourceError.parsing("geocoding result has no coordinates"));
        }
        return Outcome.success(new Coordinate(latitude, longitude));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
