/**
 * Weather Aggregator - Queries several public weather providers for one city and merges the answers.
 *
 * <p>Providers are called in parallel (or one by one) over a shared HTTP session. Their
 * readings are normalized into {@link fr.lapetina.weather.aggregator.domain.model.Observation}s
 * and reduced to an average temperature, an average humidity and a consensus condition.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.weather.aggregator.AggregatorFactory} - Main entry point for creating
 *       a fully-configured aggregator from YAML configuration</li>
 *   <li>{@link fr.lapetina.weather.aggregator.WeatherAggregatorApplication} - Command line front end</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (AggregatorFactory factory = AggregatorFactory.create("weather-aggregator.yaml")) {
 *     AggregationReport report = factory.run("Lyon", List.of(), FetchMode.CONCURRENT);
 *     System.out.println(report.summary().consensusCondition());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Seven providers, keyed ones enabled only when their API key is present</li>
 *   <li>Single geocoding lookup per batch, shared by coordinate-based providers</li>
 *   <li>Per-source timeouts; one failing provider never fails the batch</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.weather.aggregator.AggregatorFactory
 * @see fr.lapetina.weather.aggregator.orchestration.FetchOrchestrator
 */
package fr.lapetina.weather.aggregator;
