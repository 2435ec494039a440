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
 * wttr.in JSON format. Free and name-based; numbers arrive as strings.
 */
public final class WttrInSource extends AbstractWeatherSource {

    public static final String NAME = "wttr.in";
    public static final String DEFAULT_BASE_URL = "https://wttr.in";

    public WttrInSource(String baseUrl) {
        super(NAME, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, null, false);
    }

    public WttrInSource() {
        this(DEFAULT_BASE_URL);
    }

    @Override
    public boolean requiresCoordinates() {
        return false;
    }

    @Override
    protected Outcome<Observation> doFetch(String city, WeatherHttpClient session, GeocodeCache cache) {
        URI uri = URI.create(baseUrl() + "/" + encode(city) + "?format=j1");

        return session.getJson(uri)
                .flatMap(WttrInSource::firstCondition)
                .map(this::toObservation);
    }

    private static Outcome<JsonNode> firstCondition(JsonNode root) {
        JsonNode conditions = root.path("current_condition");
        if (!conditions.isArray() || conditions.isEmpty()) {
            return Outcome.failure(SourceError.parsing("missing 'current_condition'"));
        }
        return Outcome.success(conditions.get(0));
    }

    private Observation toObservation(JsonNode current) {
        return observation(
                JsonValues.safeDouble(current.path("temp_C")),
                JsonValues.nullableDouble(current.path("humidity")),
                JsonValues.text(current.path("weatherDesc").path(0).path("value"))
        );
    }
}
