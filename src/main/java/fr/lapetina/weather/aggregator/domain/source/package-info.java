/**
 * Weather provider adapters.
 *
 * <p>Every provider implements {@link fr.lapetina.weather.aggregator.domain.source.WeatherSource}
 * and never throws: failures come back as an error observation.
 *
 * <h2>Available Sources</h2>
 * <table border="1">
 *   <tr><th>Type</th><th>Name</th><th>Lookup</th><th>Credential</th></tr>
 *   <tr><td>{@code open-meteo}</td><td>Open-Meteo</td><td>coordinates</td><td>none</td></tr>
 *   <tr><td>{@code wttr-in}</td><td>wttr.in</td><td>city name</td><td>none</td></tr>
 *   <tr><td>{@code weatherapi}</td><td>WeatherAPI.com</td><td>city name</td><td>{@code WEATHER_API_COM_KEY}</td></tr>
 *   <tr><td>{@code weatherstack}</td><td>Weatherstack</td><td>city name</td><td>{@code WEATHERSTACK_API_KEY}</td></tr>
 *   <tr><td>{@code meteosource}</td><td>Meteosource</td><td>coordinates</td><td>{@code METEOSOURCE_API_KEY}</td></tr>
 *   <tr><td>{@code pirate-weather}</td><td>Pirate Weather</td><td>coordinates</td><td>{@code PIRATE_WEATHER_API_KEY}</td></tr>
 *   <tr><td>{@code tomorrow-io}</td><td>Tomorrow.io</td><td>coordinates</td><td>{@code TOMORROW_IO_API_KEY}</td></tr>
 * </table>
 *
 * <h2>Custom Sources</h2>
 * <p>Extend {@link fr.lapetina.weather.aggregator.domain.source.AbstractWeatherSource} (or
 * {@link fr.lapetina.weather.aggregator.domain.source.CoordinateWeatherSource}) and register
 * the type with {@link fr.lapetina.weather.aggregator.domain.source.SourceFactory}.
 *
 * @see fr.lapetina.weather.aggregator.domain.source.WeatherSource
 * @see fr.lapetina.weather.aggregator.domain.source.SourceFactory
 */
package fr.lapetina.weather.aggregator.domain.source;
