package fr.lapetina.weather.aggregator.domain.condition;

import java.util.List;
import java.util.Map;

/**
 * Numeric weather-code mappings used by code-based providers.
 *
 * <ul>
 *   <li>WMO codes (Open-Meteo) are bucketed into inclusive ranges.</li>
 *   <li>Tomorrow.io codes are looked up exactly.</li>
 * </ul>
 * Unmapped codes yield {@value #UNKNOWN}.
 */
public final class WeatherCodeTable {

    public static final String UNKNOWN = "Unknown";

    private final List<CodeRange> wmoRanges;
    private final Map<Integer, String> tomorrowCodes;

    public WeatherCodeTable(List<CodeRange> wmoRanges, Map<Integer, String> tomorrowCodes) {
        this.wmoRanges = List.copyOf(wmoRanges);
        this.tomorrowCodes = Map.copyOf(tomorrowCodes);
    }

    public String mapWmoCode(int code) {
        for (CodeRange range : wmoRanges) {
            if (range.contains(code)) {
                return range.condition();
            }
        }
        return UNKNOWN;
    }

    public String mapTomorrowCode(int code) {
        return tomorrowCodes.getOrDefault(code, UNKNOWN);
    }

    public List<CodeRange> getWmoRanges() {
        return wmoRanges;
    }

    /**
     * Inclusive code range mapped to one condition.
     */
    public record CodeRange(int min, int max, String condition) {
        public CodeRange {
            if (min > max) {
                throw new IllegalArgumentException("Invalid range: " + min + ".." + max);
            }
        }

        public boolean contains(int code) {
            return code >= min && code <= max;
        }
    }
}
