package fr.lapetina.weather.aggregator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.weather.aggregator.api.ReportPrinter;
import fr.lapetina.weather.aggregator.domain.model.AggregationReport;
import fr.lapetina.weather.aggregator.domain.model.FetchMode;
import fr.lapetina.weather.aggregator.domain.source.SourceFactory;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Main entry point for the weather aggregator command line.
 */
public class WeatherAggregatorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WeatherAggregatorApplication.class);

    private final AggregatorFactory factory;
    private final CommandLineOptions options;
    private final PrintStream out;
    private final ObjectMapper objectMapper;

    public WeatherAggregatorApplication(AggregatorFactory factory, CommandLineOptions options, PrintStream out) {
        this.factory = factory;
        this.options = options;
        this.out = out;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Runs one batch and prints the report.
     *
     * @throws ConfigurationException if every source was excluded or none is configured
     */
    public AggregationReport run() throws JsonProcessingException {
        FetchMode mode = options.sequential() ? FetchMode.SEQUENTIAL : factory.getDefaultMode();
        ReportPrinter printer = new ReportPrinter(factory.getCatalog().normalizer(), out);

        if (!options.json()) {
            int selected = SourceFactory.exclude(factory.getSources(), options.exclusions()).size();
            printer.printHeader(options.city(), selected);
        }

        AggregationReport report = factory.run(options.city(), options.exclusions(), mode);

        if (options.json()) {
            out.println(objectMapper.writeValueAsString(report));
        } else {
            printer.print(report);
        }

        if (options.metrics() && factory.getMetricsRegistry() != null) {
            out.println();
            out.print(factory.getMetricsRegistry().scrape());
        }
        return report;
    }

    @Override
    public void close() {
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
    }

    public static void main(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.out.println();
            System.out.println(CommandLineOptions.usage());
            System.exit(1);
            return;
        }

        try (WeatherAggregatorApplication app = new WeatherAggregatorApplication(
                AggregatorFactory.create(options.configPath()), options, System.out)) {
            app.run();
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("Weather aggregation failed", e);
            System.exit(1);
        }
    }
}
