package fr.lapetina.weather.aggregator.domain.source;

import fr.lapetina.weather.aggregator.domain.geocode.GeocodeCache;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeResolver;
import fr.lapetina.weather.aggregator.domain.model.Coordinate;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;

import java.util.Objects;

/**
 * Source queried by latitude/longitude.
 *
 * Coordinates come from the batch cache; on a miss the source resolves
 * them itself and reports any geocoding error as its own.
 */
public abstract class CoordinateWeatherSource extends AbstractWeatherSource {

    private final GeocodeResolver geocoder;

    protected CoordinateWeatherSource(
            String name,
            String baseUrl,
            String apiKey,
            boolean requiresCredential,
            GeocodeResolver geocoder
    ) {
        super(name, baseUrl, apiKey, requiresCredential);
        this.geocoder = Objects.requireNonNull(geocoder, "Geocoder is required");
    }

    @Override
    public final boolean requiresCoordinates() {
        return true;
    }

    @Override
    protected final Outcome<Observation> doFetch(String city, WeatherHttpClient session, GeocodeCache cache) {
        return cache.get(city)
                .map(Outcome::success)
                .orElseGet(() -> geocoder.resolve(city, session))
                .flatMap(coordinate -> fetchAt(coordinate, session));
    }

    /**
     * Fetches the weather at resolved coordinates.
     */
    protected abstract Outcome<Observation> fetchAt(Coordinate coordinate, WeatherHttpClient session);
}
