/**
 * Domain model classes shared by sources, the orchestrator and the aggregator.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.weather.aggregator.domain.model.Observation} - Normalized reading from one source</li>
 *   <li>{@link fr.lapetina.weather.aggregator.domain.model.Coordinate} - Resolved latitude/longitude</li>
 *   <li>{@link fr.lapetina.weather.aggregator.domain.model.AggregateSummary} - Averages and consensus condition</li>
 *   <li>{@link fr.lapetina.weather.aggregator.domain.model.Outcome} - Value-or-error result of a fetch step</li>
 *   <li>{@link fr.lapetina.weather.aggregator.domain.model.ErrorType} - Categorized error kinds</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type in this package is immutable. Observations are produced on worker
 * threads and handed to the caller without further synchronization.
 */
package fr.lapetina.weather.aggregator.domain.model;
