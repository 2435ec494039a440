package fr.lapetina.weather.aggregator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Normalized weather reading from a single source.
 * Immutable and thread-safe.
 *
 * <p>Temperature is in Celsius, humidity a percentage (0-100). A null
 * humidity means the source did not report it. An observation with a
 * non-null {@code error} is invalid and excluded from aggregation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Observation(
        String source,
        double temperature,
        Double humidity,
        String condition,
        ErrorType errorType,
        String error,
        Double durationMs
) {
    public Observation {
        Objects.requireNonNull(source, "Source is required");
        if (condition == null) {
            condition = "";
        }
    }

    @JsonIgnore
    public boolean isValid() {
        return error == null;
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }

    /**
     * Creates a successful observation.
     */
    public static Observation success(String source, double temperature, Double humidity, String condition) {
        return new Observation(source, temperature, humidity, condition, null, null, null);
    }

    /**
     * Creates a failed observation carrying the rendered error message.
     */
    public static Observation failure(String source, SourceError error) {
        return new Observation(source, 0.0, null, "", error.type(), error.message(), null);
    }

    /**
     * Returns a copy with the measured call duration.
     */
    public Observation withDuration(double durationMs) {
        return new Observation(source, temperature, humidity, condition, errorType, error, durationMs);
    }
}
