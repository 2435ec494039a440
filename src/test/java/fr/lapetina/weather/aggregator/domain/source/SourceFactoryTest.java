package fr.lapetina.weather.aggregator.domain.source;

import fr.lapetina.weather.aggregator.domain.geocode.OpenMeteoGeocoder;
import fr.lapetina.weather.aggregator.infrastructure.config.AggregatorConfig.SourceConfig;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.weather.aggregator.infrastructure.config.WeatherCodeLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceFactoryTest {

    private SourceFactory factory;

    @BeforeEach
    void setUp() {
        Map<String, String> environment = Map.of(
                "WEATHER_API_COM_KEY", "abc",
                "TOMORROW_IO_API_KEY", "  "
        );
        factory = new SourceFactory(new OpenMeteoGeocoder(), new WeatherCodeLoader().loadDefault().codes(),
                environment::get);
    }

    private static List<String> names(List<WeatherSource> sources) {
        return sources.stream().map(WeatherSource::name).toList();
    }

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("should always build free sources")
        void shouldBuildFreeSources() {
            assertThat(factory.create(new SourceConfig("open-meteo", null))).isPresent();
            assertThat(factory.create(new SourceConfig("wttr-in", null))).isPresent();
        }

        @Test
        @DisplayName("should build keyed sources only when the key resolves")
        void shouldRequireCredential() {
            assertThat(factory.create(new SourceConfig("weatherapi", "WEATHER_API_COM_KEY")))
                    .get().extracting(WeatherSource::name).isEqualTo("WeatherAPI.com");
            assertThat(factory.create(new SourceConfig("weatherstack", "WEATHERSTACK_API_KEY"))).isEmpty();
            assertThat(factory.create(new SourceConfig("tomorrow-io", "TOMORROW_IO_API_KEY"))).isEmpty();
        }

        @Test
        @DisplayName("should prefer an inline key")
        void shouldUseInlineKey() {
            SourceConfig config = new SourceConfig("weatherstack", "WEATHERSTACK_API_KEY");
            config.setApiKey("inline");

            assertThat(factory.create(config)).isPresent();
        }

        @Test
        @DisplayName("should skip disabled sources")
        void shouldSkipDisabled() {
            SourceConfig config = new SourceConfig("wttr-in", null);
            config.setEnabled(false);

            assertThat(factory.create(config)).isEmpty();
        }

        @Test
        @DisplayName("should match type names case-insensitively")
        void shouldIgnoreTypeCase() {
            assertThat(factory.create(new SourceConfig("Open-Meteo", null))).isPresent();
        }

        @Test
        @DisplayName("should reject unknown types")
        void shouldRejectUnknownType() {
            assertThatThrownBy(() -> factory.create(new SourceConfig("openweather", null)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("openweather");
        }

        @Test
        @DisplayName("should accept custom registrations")
        void shouldRegisterCustomType() {
            factory.register("local", false, settings -> new WttrInSource(settings.baseUrl()));
            SourceConfig config = new SourceConfig("local", null);
            config.setBaseUrl("http://localhost:9999");

            Optional<WeatherSource> source = factory.create(config);

            assertThat(source).isPresent();
            assertThat(factory.getRegisteredTypes()).contains("local");
        }

        @Test
        @DisplayName("should build the default provider list in declared order")
        void shouldBuildDefaults() {
            List<WeatherSource> sources = factory.createAll(ConfigLoader.createDefault().getSources());

            assertThat(names(sources)).containsExactly("Open-Meteo", "wttr.in", "WeatherAPI.com");
        }
    }

    @Nested
    @DisplayName("exclusions")
    class ExclusionTests {

        private List<WeatherSource> all;

        @BeforeEach
        void setUp() {
            all = List.of(
                    new WttrInSource(),
                    new WeatherApiSource(null, "k"),
                    new WeatherstackSource(null, "k")
            );
        }

        @Test
        @DisplayName("should normalize names by case and punctuation")
        void shouldNormalizeNames() {
            assertThat(SourceFactory.normalizeSourceName("wttr.in")).isEqualTo("wttrin");
            assertThat(SourceFactory.normalizeSourceName("WTTR-IN")).isEqualTo("wttrin");
            assertThat(SourceFactory.normalizeSourceName("Pirate Weather")).isEqualTo("pirateweather");
            assertThat(SourceFactory.normalizeSourceName(null)).isEmpty();
        }

        @Test
        @DisplayName("should remove excluded sources and keep order")
        void shouldExclude() {
            List<WeatherSource> remaining = SourceFactory.exclude(all, List.of("WTTRIN", "weather api.com"));

            assertThat(names(remaining)).containsExactly("Weatherstack");
        }

        @Test
        @DisplayName("should ignore unknown and blank names")
        void shouldIgnoreUnknownNames() {
            List<WeatherSource> remaining = SourceFactory.exclude(all, List.of("nope", "  "));

            assertThat(remaining).hasSize(3);
        }

        @Test
        @DisplayName("should refuse to exclude every source")
        void shouldRejectEmptyResult() {
            assertThatThrownBy(() -> SourceFactory.exclude(all, List.of("wttr.in", "WeatherAPI.com", "weatherstack")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("All sources were excluded");
        }

        @Test
        @DisplayName("should split comma-separated lists")
        void shouldParseExclusions() {
            assertThat(SourceFactory.parseExclusions("wttr.in, WeatherAPI.com,,")).containsExactly("wttr.in", "WeatherAPI.com");
            assertThat(SourceFactory.parseExclusions(null)).isEmpty();
            assertThat(SourceFactory.parseExclusions("  ")).isEmpty();
        }
    }
}
