package fr.lapetina.weather.aggregator.infrastructure.metrics;

import fr.lapetina.weather.aggregator.domain.model.FetchMode;
import fr.lapetina.weather.aggregator.domain.model.Observation;
import fr.lapetina.weather.aggregator.domain.model.SourceError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("wx");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count source results by outcome")
    void shouldCountResultsByOutcome() {
        metrics.recordSourceResult(Observation.success("wttr.in", 10.0, 50.0, "Clear"), Duration.ofMillis(20));
        metrics.recordSourceResult(Observation.success("wttr.in", 11.0, null, "Clear"), Duration.ofMillis(30));
        metrics.recordSourceResult(Observation.failure("wttr.in", SourceError.timeout()), Duration.ofMillis(40));

        assertThat(metrics.getRegistry().get("wx_source_results_total")
                .tag("source", "wttr.in").tag("outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("wx_source_results_total")
                .tag("source", "wttr.in").tag("outcome", "timeout").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("wx_source_latency")
                .tag("outcome", "success").timer().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("should record batch latency per mode")
    void shouldRecordBatchLatency() {
        metrics.recordBatch(FetchMode.SEQUENTIAL, Duration.ofMillis(250));

        assertThat(metrics.getRegistry().get("wx_batch_latency")
                .tag("mode", "sequential").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("should count geocoding attempts and expose them to Prometheus")
    void shouldCountGeocoding() {
        metrics.recordGeocode(true);
        metrics.recordGeocode(false);
        metrics.recordGeocode(false);

        assertThat(metrics.getRegistry().get("wx_geocode_total")
                .tag("outcome", "failure").counter().count()).isEqualTo(2.0);
        assertThat(metrics.scrape()).contains("wx_geocode_total");
    }
}
