package fr.lapetina.weather.aggregator.domain.geocode;

import fr.lapetina.weather.aggregator.domain.model.Coordinate;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;

/**
 * Resolves a city name to coordinates.
 *
 * Implementations must be thread-safe; coordinate-based sources may call
 * them concurrently when the batch pre-resolution failed.
 */
public interface GeocodeResolver {

    /**
     * @param city    city name as given by the user
     * @param session shared HTTP session
     * @return the first match, or "city not found" / a geocoding failure
     */
    Outcome<Coordinate> resolve(String city, WeatherHttpClient session);
}
