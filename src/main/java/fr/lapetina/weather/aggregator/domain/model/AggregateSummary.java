package fr.lapetina.weather.aggregator.domain.model;

/**
 * Statistical summary over a batch of observations.
 * Recomputed on every aggregation call.
 *
 * @param avgTemperature      mean temperature over valid observations, 0.0 when none
 * @param avgHumidity         mean humidity over valid observations that reported it, 0.0 when none
 * @param humiditySampleCount number of valid observations that reported humidity
 * @param consensusCondition  most frequent normalized condition, or a status text
 * @param validCount          observations without an error
 * @param totalCount          all observations, valid or not
 */
public record AggregateSummary(
        double avgTemperature,
        double avgHumidity,
        int humiditySampleCount,
        String consensusCondition,
        int validCount,
        int totalCount
) {
    public static final String NO_DATA = "No data";
    public static final String NO_VALID_DATA = "No valid data";
    public static final String UNKNOWN = "Unknown";

    public AggregateSummary {
        if (validCount > totalCount) {
            throw new IllegalArgumentException("validCount " + validCount + " exceeds totalCount " + totalCount);
        }
        if (humiditySampleCount > validCount) {
            throw new IllegalArgumentException(
                    "humiditySampleCount " + humiditySampleCount + " exceeds validCount " + validCount);
        }
    }

    public static AggregateSummary empty() {
        return new AggregateSummary(0.0, 0.0, 0, NO_DATA, 0, 0);
    }

    public static AggregateSummary noValidData(int totalCount) {
        return new AggregateSummary(0.0, 0.0, 0, NO_VALID_DATA, 0, totalCount);
    }

    public boolean hasValidData() {
        return validCount > 0;
    }

    public boolean hasHumidity() {
        return humiditySampleCount > 0;
    }
}
