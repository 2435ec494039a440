package fr.lapetina.weather.aggregator.domain.aggregate;

import fr.lapetina.weather.aggregator.domain.condition.ConditionNormalizer;
import fr.lapetina.weather.aggregator.domain.model.AggregateSummary;
import fr.lapetina.weather.aggregator.domain.model.Observation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces a batch of observations to averages and a consensus condition.
 * Stateless and thread-safe.
 */
public final class WeatherAggregator {

    private final ConditionNormalizer normalizer;

    public WeatherAggregator(ConditionNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "Normalizer is required");
    }

    /**
     * Summarizes the observations.
     *
     * <p>Temperature is averaged over every valid observation, humidity only
     * over the valid ones that reported it. The consensus is the most frequent
     * normalized condition; on a tie the condition seen first wins.
     */
    public AggregateSummary aggregate(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            return AggregateSummary.empty();
        }

        List<Observation> valid = observations.stream()
                .filter(Observation::isValid)
                .toList();
        if (valid.isEmpty()) {
            return AggregateSummary.noValidData(observations.size());
        }

        double temperatureSum = 0.0;
        double humiditySum = 0.0;
        int humidityCount = 0;
        // Insertion order decides ties
        Map<String, Integer> tally = new LinkedHashMap<>();

        for (Observation observation : valid) {
            temperatureSum += observation.temperature();
            if (observation.humidity() != null) {
                humiditySum += observation.humidity();
                humidityCount++;
            }
            String condition = normalizer.normalize(observation.condition());
            if (!condition.isEmpty()) {
                tally.merge(condition, 1, Integer::sum);
            }
        }

        return new AggregateSummary(
                temperatureSum / valid.size(),
                humidityCount > 0 ? humiditySum / humidityCount : 0.0,
                humidityCount,
                consensus(tally),
                valid.size(),
                observations.size()
        );
    }

    private static String consensus(Map<String, Integer> tally) {
        String best = AggregateSummary.UNKNOWN;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : tally.entrySet()) {
            // Strictly greater keeps the earlier entry on ties
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public ConditionNormalizer getNormalizer() {
        return normalizer;
    }
}
