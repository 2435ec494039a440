package fr.lapetina.weather.aggregator.domain.geocode;

import fr.lapetina.weather.aggregator.domain.model.Coordinate;

import java.util.Map;
import java.util.Optional;

/**
 * City to coordinate lookup for one batch.
 *
 * Built by the orchestrator before any source is dispatched and never
 * modified afterwards, so sources read it without locking.
 */
public final class GeocodeCache {

    private static final GeocodeCache EMPTY = new GeocodeCache(Map.of());

    private final Map<String, Coordinate> entries;

    private GeocodeCache(Map<String, Coordinate> entries) {
        this.entries = entries;
    }

    public static GeocodeCache empty() {
        return EMPTY;
    }

    public static GeocodeCache of(String city, Coordinate coordinate) {
        return new GeocodeCache(Map.of(city, coordinate));
    }

    /**
     * Looks up the exact city string used as the batch key.
     */
    public Optional<Coordinate> get(String city) {
        if (city == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(city));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "GeocodeCache" + entries;
    }
}
