package fr.lapetina.weather.aggregator.domain.condition;

import java.util.Objects;

/**
 * The condition taxonomy together with the numeric code tables.
 * Loaded once at startup and passed explicitly to whoever needs it.
 */
public record WeatherCodeCatalog(ConditionTaxonomy taxonomy, WeatherCodeTable codes) {

    public WeatherCodeCatalog {
        Objects.requireNonNull(taxonomy, "Taxonomy is required");
        Objects.requireNonNull(codes, "Code table is required");
    }

    public ConditionNormalizer normalizer() {
        return new ConditionNormalizer(taxonomy);
    }
}
