/**
 * Configuration loading.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.weather.aggregator.infrastructure.config.AggregatorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader} - YAML loading</li>
 *   <li>{@link fr.lapetina.weather.aggregator.infrastructure.config.WeatherCodeLoader} - Condition taxonomy and code tables</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code http} - Connect and request timeouts, user agent</li>
 *   <li>{@code orchestrator} - Per-source timeout, worker pool size, default mode</li>
 *   <li>{@code geocoding} - Geocoding endpoint</li>
 *   <li>{@code sources} - Provider list with endpoints and credential lookup</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader
 */
package fr.lapetina.weather.aggregator.infrastructure.config;
