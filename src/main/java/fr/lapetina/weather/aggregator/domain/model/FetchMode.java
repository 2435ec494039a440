package fr.lapetina.weather.aggregator.domain.model;

import java.util.Locale;

/**
 * Dispatch mode for a batch.
 */
public enum FetchMode {
    /** All sources in parallel */
    CONCURRENT,

    /** One source at a time, in declared order */
    SEQUENTIAL;

    /**
     * Parses a configured mode name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name matches no mode
     */
    public static FetchMode fromString(String name) {
        if (name == null || name.isBlank()) {
            return CONCURRENT;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
