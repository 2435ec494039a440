package fr.lapetina.weather.aggregator.domain.aggregate;

import fr.lapetina.weather.aggregator.domain.model.AggregateSummary;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.SourceError;
import fr.lapetina.weather.aggregator.infrastructure.config.WeatherCodeLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WeatherAggregatorTest {

    private WeatherAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new WeatherAggregator(new WeatherCodeLoader().loadDefault().normalizer());
    }

    private static Observation ok(String source, double temperature, Double humidity, String condition) {
        return Observation.success(source, temperature, humidity, condition);
    }

    private static Observation failed(String source) {
        return Observation.failure(source, SourceError.timeout());
    }

    @Nested
    @DisplayName("averages")
    class AverageTests {

        @Test
        @DisplayName("should average temperature and humidity over valid observations")
        void shouldAverageBoth() {
            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 15, 60.0, "Cloudy"),
                    ok("B", 17, 70.0, "Cloudy")
            ));

            assertThat(summary.avgTemperature()).isCloseTo(16.0, within(1e-9));
            assertThat(summary.avgHumidity()).isCloseTo(65.0, within(1e-9));
            assertThat(summary.humiditySampleCount()).isEqualTo(2);
            assertThat(summary.validCount()).isEqualTo(2);
            assertThat(summary.totalCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should average humidity only over sources that reported it")
        void shouldSkipMissingHumidity() {
            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 20, 50.0, "Clear"),
                    ok("B", 10, null, "Clear")
            ));

            assertThat(summary.avgHumidity()).isCloseTo(50.0, within(1e-9));
            assertThat(summary.humiditySampleCount()).isEqualTo(1);
            assertThat(summary.avgTemperature()).isCloseTo(15.0, within(1e-9));
        }

        @Test
        @DisplayName("should report zero humidity when no valid source reported it")
        void shouldReportZeroHumidityWhenAbsent() {
            AggregateSummary summary = aggregator.aggregate(List.of(ok("A", 20, null, "Clear")));

            assertThat(summary.avgHumidity()).isZero();
            assertThat(summary.humiditySampleCount()).isZero();
            assertThat(summary.hasHumidity()).isFalse();
        }

        @Test
        @DisplayName("should exclude failed observations from means but count them in total")
        void shouldExcludeErrors() {
            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 20, 50.0, "Clear"),
                    failed("B")
            ));

            assertThat(summary.validCount()).isEqualTo(1);
            assertThat(summary.totalCount()).isEqualTo(2);
            assertThat(summary.avgTemperature()).isCloseTo(20.0, within(1e-9));
            assertThat(summary.avgHumidity()).isCloseTo(50.0, within(1e-9));
            assertThat(summary.consensusCondition()).isEqualTo("Clear");
        }

        @Test
        @DisplayName("should include zero temperatures in the mean")
        void shouldIncludeZeroTemperature() {
            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 0.0, null, "Clear"),
                    ok("B", 10.0, null, "Clear")
            ));

            assertThat(summary.avgTemperature()).isCloseTo(5.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("degraded input")
    class DegradedTests {

        @Test
        @DisplayName("should report No data for an empty batch")
        void shouldReportNoData() {
            AggregateSummary summary = aggregator.aggregate(List.of());

            assertThat(summary.consensusCondition()).isEqualTo(AggregateSummary.NO_DATA);
            assertThat(summary.validCount()).isZero();
            assertThat(summary.totalCount()).isZero();
            assertThat(summary.avgTemperature()).isZero();
        }

        @Test
        @DisplayName("should report No valid data when every source failed")
        void shouldReportNoValidData() {
            AggregateSummary summary = aggregator.aggregate(List.of(failed("A"), failed("B")));

            assertThat(summary.consensusCondition()).isEqualTo(AggregateSummary.NO_VALID_DATA);
            assertThat(summary.validCount()).isZero();
            assertThat(summary.totalCount()).isEqualTo(2);
            assertThat(summary.avgTemperature()).isZero();
            assertThat(summary.avgHumidity()).isZero();
            assertThat(summary.hasValidData()).isFalse();
        }
    }

    @Nested
    @DisplayName("consensus")
    class ConsensusTests {

        @Test
        @DisplayName("should pick the most frequent normalized condition")
        void shouldPickMostFrequent() {
            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 10, null, "Clear"),
                    ok("B", 10, null, "Sunny"),
                    ok("C", 10, null, "Cloudy")
            ));

            assertThat(summary.consensusCondition()).isEqualTo("Clear");
        }

        @Test
        @DisplayName("should break ties in favor of the condition seen first")
        void shouldBreakTiesByFirstSeen() {
            AggregateSummary cloudyFirst = aggregator.aggregate(List.of(
                    ok("A", 10, null, "Overcast"),
                    ok("B", 10, null, "Light rain"),
                    ok("C", 10, null, "Cloudy"),
                    ok("D", 10, null, "Rain")
            ));
            AggregateSummary rainFirst = aggregator.aggregate(List.of(
                    ok("B", 10, null, "Light rain"),
                    ok("A", 10, null, "Overcast"),
                    ok("D", 10, null, "Rain"),
                    ok("C", 10, null, "Cloudy")
            ));

            assertThat(cloudyFirst.consensusCondition()).isEqualTo("Cloudy");
            assertThat(rainFirst.consensusCondition()).isEqualTo("Rainy");
        }

        @Test
        @DisplayName("should ignore conditions of failed observations")
        void shouldIgnoreFailedConditions() {
            Observation failedButCloudy = new Observation("X", 0.0, null, "Cloudy",
                    null, "HTTP 500", null);

            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 10, null, "Sunny"),
                    failedButCloudy,
                    failedButCloudy
            ));

            assertThat(summary.consensusCondition()).isEqualTo("Clear");
        }

        @Test
        @DisplayName("should keep unmatched conditions as their own category")
        void shouldKeepUnmatched() {
            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 10, null, "Haze"),
                    ok("B", 10, null, "Haze"),
                    ok("C", 10, null, "Clear")
            ));

            assertThat(summary.consensusCondition()).isEqualTo("Haze");
        }

        @Test
        @DisplayName("should report Unknown when no valid observation has a condition")
        void shouldReportUnknown() {
            AggregateSummary summary = aggregator.aggregate(List.of(
                    ok("A", 10, 40.0, ""),
                    ok("B", 12, 60.0, null)
            ));

            assertThat(summary.consensusCondition()).isEqualTo(AggregateSummary.UNKNOWN);
            assertThat(summary.validCount()).isEqualTo(2);
        }
    }
}
