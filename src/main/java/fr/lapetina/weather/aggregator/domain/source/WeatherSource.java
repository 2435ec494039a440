package fr.lapetina.weather.aggregator.domain.source;

import fr.lapetina.weather.aggregator.domain.geocode.GeocodeCache;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.infrastructure.http.WeatherHttpClient;

/**
 * Adapter for one external weather provider.
 *
 * Implementations must be thread-safe as the orchestrator calls every
 * source of a batch from its own worker thread.
 */
public interface WeatherSource {

    /**
     * Returns the stable display name, used for exclusion filtering and reports.
     */
    String name();

    /**
     * Whether the provider needs an API key.
     */
    boolean requiresCredential();

    /**
     * Whether the provider is queried by latitude/longitude rather than by name.
     */
    boolean requiresCoordinates();

    /**
     * Fetches and normalizes the current weather for a city.
     *
     * <p>Must never throw: every failure is reported through
     * {@link Observation#error()}.
     *
     * @param city    city name as given by the user
     * @param session shared HTTP session
     * @param cache   coordinates resolved for this batch, possibly empty
     * @return one observation, valid or not
     */
    Observation fetch(String city, WeatherHttpClient session, GeocodeCache cache);
}
