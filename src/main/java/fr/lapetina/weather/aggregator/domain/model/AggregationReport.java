package fr.lapetina.weather.aggregator.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one batch: the individual observations plus their summary.
 * Immutable and thread-safe.
 */
public record AggregationReport(
        String city,
        FetchMode mode,
        List<Observation> observations,
        AggregateSummary summary,
        Duration elapsed,
        Instant completedAt
) {
    public AggregationReport {
        Objects.requireNonNull(city, "City is required");
        Objects.requireNonNull(mode, "Mode is required");
        Objects.requireNonNull(summary, "Summary is required");
        observations = observations != null ? List.copyOf(observations) : List.of();
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }
}
