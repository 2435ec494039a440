package fr.lapetina.weather.aggregator.domain.condition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered table of canonical weather categories.
 *
 * Categories are tested in list order, so more specific ones ("Partly Cloudy")
 * must come before their broader supersets ("Cloudy"). Immutable once built.
 */
public final class ConditionTaxonomy {

    public static final String DEFAULT_GLYPH = "🌡️";

    private final List<ConditionCategory> categories;
    private final String defaultGlyph;

    public ConditionTaxonomy(List<ConditionCategory> categories, String defaultGlyph) {
        this.categories = List.copyOf(Objects.requireNonNull(categories, "Categories are required"));
        this.defaultGlyph = defaultGlyph != null ? defaultGlyph : DEFAULT_GLYPH;
    }

    /**
     * Returns the first category, in priority order, whose keywords match the text.
     */
    public Optional<ConditionCategory> match(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (ConditionCategory category : categories) {
            if (category.matches(lower)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public List<ConditionCategory> getCategories() {
        return categories;
    }

    public String getDefaultGlyph() {
        return defaultGlyph;
    }

    public int size() {
        return categories.size();
    }
}
