package fr.lapetina.weather.aggregator.domain.condition;

/**
 * Maps free-text provider conditions onto canonical categories.
 * Thread-safe; holds only the immutable taxonomy.
 */
public final class ConditionNormalizer {

    private final ConditionTaxonomy taxonomy;

    public ConditionNormalizer(ConditionTaxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    /**
     * Returns the canonical name of the first matching category,
     * or the input unchanged when nothing matches. Empty stays empty.
     */
    public String normalize(String rawCondition) {
        if (rawCondition == null) {
            return "";
        }
        return taxonomy.match(rawCondition)
                .map(ConditionCategory::canonicalName)
                .orElse(rawCondition);
    }

    /**
     * Returns the display glyph for a condition, or the neutral "no data" glyph.
     */
    public String glyph(String condition) {
        return taxonomy.match(condition)
                .map(ConditionCategory::glyph)
                .orElse(taxonomy.getDefaultGlyph());
    }

    public ConditionTaxonomy getTaxonomy() {
        return taxonomy;
    }
}
