package fr.lapetina.weather.aggregator.domain.condition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One canonical weather category with its lower-case match keywords and display glyph.
 */
public record ConditionCategory(String canonicalName, List<String> keywords, String glyph) {

    public ConditionCategory {
        Objects.requireNonNull(canonicalName, "Canonical name is required");
        keywords = keywords != null
                ? keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList()
                : List.of();
        if (glyph == null) {
            glyph = "";
        }
    }

    /**
     * Returns true if any keyword occurs in the already lower-cased text.
     */
    public boolean matches(String lowerCaseText) {
        for (String keyword : keywords) {
            if (lowerCaseText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
