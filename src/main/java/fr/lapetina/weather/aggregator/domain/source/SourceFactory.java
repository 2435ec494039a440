package fr.lapetina.weather.aggregator.domain.source;

import fr.lapetina.weather.aggregator.domain.condition.WeatherCodeTable;
import fr.lapetina.weather.aggregator.domain.geocode.GeocodeResolver;
import fr.lapetina.weather.aggregator.infrastructure.config.AggregatorConfig.SourceConfig;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds weather sources from configuration.
 *
 * Free sources are always built; keyed sources only when their credential
 * resolves. Also owns the name-based exclusion filter.
 */
public final class SourceFactory {

    private static final Logger log = LoggerFactory.getLogger(SourceFactory.class);

    private final Map<String, Registration> registry = new LinkedHashMap<>();
    private final GeocodeResolver geocoder;
    private final WeatherCodeTable codes;
    private final Function<String, String> environment;

    public SourceFactory(GeocodeResolver geocoder, WeatherCodeTable codes, Function<String, String> environment) {
        this.geocoder = geocoder;
        this.codes = codes;
        this.environment = environment;

        // Register built-in providers
        register("open-meteo", false, settings -> new OpenMeteoSource(settings.baseUrl(), settings.geocoder(), settings.codes()));
        register("wttr-in", false, settings -> new WttrInSource(settings.baseUrl()));
        register("weatherapi", true, settings -> new WeatherApiSource(settings.baseUrl(), settings.apiKey()));
        register("weatherstack", true, settings -> new WeatherstackSource(settings.baseUrl(), settings.apiKey()));
        register("meteosource", true, settings -> new MeteosourceSource(settings.baseUrl(), settings.apiKey(), settings.geocoder()));
        register("pirate-weather", true, settings -> new PirateWeatherSource(settings.baseUrl(), settings.apiKey(), settings.geocoder()));
        register("tomorrow-io", true, settings -> new TomorrowIoSource(settings.baseUrl(), settings.apiKey(), settings.geocoder(), settings.codes()));
    }

    public SourceFactory(GeocodeResolver geocoder, WeatherCodeTable codes) {
        this(geocoder, codes, System::getenv);
    }

    /**
     * Registers a provider type.
     *
     * @param type               type name used in configuration
     * @param requiresCredential whether the source is skipped without an API key
     * @param creator            builds the source from its resolved settings
     */
    public void register(String type, boolean requiresCredential, SourceCreator creator) {
        registry.put(type.toLowerCase(Locale.ROOT), new Registration(requiresCredential, creator));
    }

    /**
     * Builds one source.
     *
     * @return the source, or empty if it is disabled or its credential is missing
     * @throws ConfigurationException if the type is unknown
     */
    public Optional<WeatherSource> create(SourceConfig config) {
        String type = config.getType().toLowerCase(Locale.ROOT);
        Registration registration = registry.get(type);
        if (registration == null) {
            throw new ConfigurationException("Unknown source type: " + config.getType()
                    + " (known: " + String.join(", ", registry.keySet()) + ")");
        }
        if (!config.isEnabled()) {
            log.debug("Source disabled: type={}", type);
            return Optional.empty();
        }

        String apiKey = config.resolveApiKey(environment);
        if (registration.requiresCredential() && apiKey == null) {
            log.info("Skipping source without credential: type={}, env={}", type, config.getApiKeyEnv());
            return Optional.empty();
        }

        return Optional.of(registration.creator().create(
                new SourceSettings(blankToNull(config.getBaseUrl()), apiKey, geocoder, codes)));
    }

    /**
     * Builds every configured source whose credential is present, in declared order.
     */
    public List<WeatherSource> createAll(List<SourceConfig> configs) {
        List<WeatherSource> sources = new ArrayList<>();
        for (SourceConfig config : configs) {
            create(config).ifPresent(sources::add);
        }
        log.info("Configured {} weather sources: {}", sources.size(),
                sources.stream().map(WeatherSource::name).toList());
        return sources;
    }

    /**
     * Removes sources whose normalized name is in the exclusion set.
     *
     * @throws ConfigurationException if nothing remains
     */
    public static List<WeatherSource> exclude(List<WeatherSource> sources, Collection<String> excludedNames) {
        if (excludedNames == null || excludedNames.isEmpty()) {
            return List.copyOf(sources);
        }
        Set<String> excluded = new LinkedHashSet<>();
        for (String name : excludedNames) {
            String normalized = normalizeSourceName(name);
            if (!normalized.isEmpty()) {
                excluded.add(normalized);
            }
        }

        List<WeatherSource> remaining = sources.stream()
                .filter(s -> !excluded.contains(normalizeSourceName(s.name())))
                .toList();

        if (remaining.isEmpty()) {
            throw new ConfigurationException("All sources were excluded");
        }
        if (remaining.size() < sources.size()) {
            log.info("Excluded {} sources, {} remaining", sources.size() - remaining.size(), remaining.size());
        }
        return remaining;
    }

    /**
     * Splits a comma-separated exclusion list.
     */
    public static List<String> parseExclusions(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                names.add(part.trim());
            }
        }
        return names;
    }

    /**
     * Lower-cases and strips everything but letters and digits,
     * so "wttr.in", "WTTR-IN" and "wttrin" compare equal.
     */
    public static String normalizeSourceName(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        name.toLowerCase(Locale.ROOT).codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }

    /**
     * Returns all registered type names.
     */
    public Iterable<String> getRegisteredTypes() {
        return registry.keySet();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Creates a source from resolved settings.
     */
    @FunctionalInterface
    public interface SourceCreator {
        WeatherSource create(SourceSettings settings);
    }

    /**
     * Resolved settings handed to a {@link SourceCreator}.
     *
     * @param baseUrl  endpoint override, or null for the provider default
     * @param apiKey   resolved credential, or null
     * @param geocoder shared geocoder for coordinate-based providers
     * @param codes    weather code tables
     */
    public record SourceSettings(String baseUrl, String apiKey, GeocodeResolver geocoder, WeatherCodeTable codes) {
    }

    private record Registration(boolean requiresCredential, SourceCreator creator) {
    }
}
