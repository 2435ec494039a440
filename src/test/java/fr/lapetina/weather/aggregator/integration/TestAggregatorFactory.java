package fr.lapetina.weather.aggregator.integration;

import fr.lapetina.weather.aggregator.AggregatorFactory;
import fr.lapetina.weather.aggregator.infrastructure.config.AggregatorConfig;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Test helper that wires an {@link AggregatorFactory} against a local stub server.
 * Configuration is loaded from test-config.yaml, then every endpoint is redirected to the stub.
 */
public class TestAggregatorFactory implements AutoCloseable {

    private static final String TEST_CONFIG = "test-config.yaml";

    private final StubWeatherServer server;
    private final AggregatorConfig config;
    private final Map<String, String> environment = new HashMap<>();
    private AggregatorFactory factory;

    private TestAggregatorFactory() throws IOException {
        this.server = StubWeatherServer.start();
        this.config = new ConfigLoader(TEST_CONFIG).load();
        config.getGeocoding().setBaseUrl(server.baseUrl());
        for (AggregatorConfig.SourceConfig source : config.getSources()) {
            source.setBaseUrl(server.baseUrl());
        }
    }

    public static TestAggregatorFactory create() throws IOException {
        return new TestAggregatorFactory();
    }

    public TestAggregatorFactory withEnvironment(String name, String value) {
        environment.put(name, value);
        return this;
    }

    /**
     * Builds the factory on first use. Environment changes after this call are ignored.
     */
    public AggregatorFactory getFactory() {
        if (factory == null) {
            factory = AggregatorFactory.create(config, environment::get);
        }
        return factory;
    }

    public AggregatorConfig getConfig() {
        return config;
    }

    public StubWeatherServer getServer() {
        return server;
    }

    @Override
    public void close() {
        if (factory != null) {
            factory.close();
        }
        server.close();
    }
}
