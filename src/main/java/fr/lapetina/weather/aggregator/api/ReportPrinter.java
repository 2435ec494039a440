package fr.lapetina.weather.aggregator.api;

import fr.lapetina.weather.aggregator.domain.condition.ConditionNormalizer;
import fr.lapetina.weather.aggregator.domain.model.AggregateSummary;
import fr.lapetina.weather.aggregator.domain.model.AggregationReport;
import fr.lapetina.weather.aggregator.domain.model.Observation;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Renders an {@link AggregationReport} as human-readable console text.
 */
public final class ReportPrinter {

    private final ConditionNormalizer normalizer;
    private final PrintStream out;

    public ReportPrinter(ConditionNormalizer normalizer, PrintStream out) {
        this.normalizer = normalizer;
        this.out = out;
    }

    public void printHeader(String city, int sourceCount) {
        out.printf(Locale.ROOT, "🌍 %s | Fetching from %d sources...%n", city, sourceCount);
    }

    public void print(AggregationReport report) {
        out.printf(Locale.ROOT, "⏱️  Completed in %.3fs%n%n", report.elapsed().toMillis() / 1000.0);

        for (Observation observation : report.observations()) {
            out.println(formatObservation(observation));
        }

        AggregateSummary summary = report.summary();
        out.printf(Locale.ROOT, "%n📊 Aggregated (%d/%d valid):%n", summary.validCount(), summary.totalCount());
        if (!summary.hasValidData()) {
            out.println("→ No valid data available");
            return;
        }
        out.printf(Locale.ROOT, "→ Avg Temperature: %.2f°C%n", summary.avgTemperature());
        if (summary.hasHumidity()) {
            out.printf(Locale.ROOT, "→ Avg Humidity:    %.1f%%%n", summary.avgHumidity());
        } else {
            out.println("→ Avg Humidity:    N/A");
        }
        out.printf(Locale.ROOT, "→ Consensus:       %s %s%n",
                summary.consensusCondition(), normalizer.glyph(summary.consensusCondition()));
    }

    /**
     * Formats one source line, e.g. {@code ✅ Open-Meteo:        12.3°C, 80% humidity, Cloudy (142ms)}.
     */
    String formatObservation(Observation observation) {
        String label = observation.source() + ":";
        double durationMs = observation.durationMs() != null ? observation.durationMs() : 0.0;
        if (observation.isError()) {
            return String.format(Locale.ROOT, "❌ %-18s ERROR: %s (%.0fms)", label, observation.error(), durationMs);
        }
        String humidity = observation.humidity() != null
                ? String.format(Locale.ROOT, "%.0f%%", observation.humidity())
                : "N/A";
        return String.format(Locale.ROOT, "✅ %-18s %.1f°C, %s humidity, %s (%.0fms)",
                label, observation.temperature(), humidity, observation.condition(), durationMs);
    }
}
