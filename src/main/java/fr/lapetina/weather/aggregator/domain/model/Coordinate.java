package fr.lapetina.weather.aggregator.domain.model;

import java.util.Locale;

/**
 * Geographic position in decimal degrees.
 */
public record Coordinate(double latitude, double longitude) {

    /**
     * Latitude with four decimals, as sent to providers.
     */
    public String formattedLatitude() {
        return String.format(Locale.ROOT, "%.4f", latitude);
    }

    public String formattedLongitude() {
        return String.format(Locale.ROOT, "%.4f", longitude);
    }
}
