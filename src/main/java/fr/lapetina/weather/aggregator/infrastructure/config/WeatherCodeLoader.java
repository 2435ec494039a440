package fr.lapetina.weather.aggregator.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.weather.aggregator.domain.condition.ConditionCategory;
import fr.lapetina.weather.aggregator.domain.condition.ConditionTaxonomy;
import fr.lapetina.weather.aggregator.domain.condition.WeatherCodeCatalog;
import fr.lapetina.weather.aggregator.domain.condition.WeatherCodeTable;
import fr.lapetina.weather.aggregator.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the condition taxonomy and weather code tables from JSON.
 *
 * Expected layout:
 * <pre>{@code
 * {
 *   "conditions": [ { "name": "...", "keywords": ["..."], "glyph": "..." } ],
 *   "defaultGlyph": "...",
 *   "wmo": { "ranges": [ { "min": 0, "max": 0, "condition": "Clear" } ] },
 *   "tomorrow_io": { "1000": "Clear" }
 * }
 * }</pre>
 * Condition order in the file is the match priority.
 */
public final class WeatherCodeLoader {

    private static final Logger log = LoggerFactory.getLogger(WeatherCodeLoader.class);

    public static final String DEFAULT_RESOURCE = "weather-codes.json";

    private final ObjectMapper objectMapper;

    public WeatherCodeLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WeatherCodeLoader() {
        this(new ObjectMapper());
    }

    /**
     * Loads the default resource from the classpath.
     *
     * @throws ConfigurationException if the resource is missing or malformed
     */
    public WeatherCodeCatalog loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public WeatherCodeCatalog loadFromClasspath(String resource) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Weather code resource not found: " + resource);
            }
            WeatherCodeCatalog catalog = loadFromStream(is);
            log.info("Loaded weather codes from classpath: resource={}, categories={}, wmoRanges={}",
                    resource, catalog.taxonomy().size(), catalog.codes().getWmoRanges().size());
            return catalog;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read weather codes: " + resource, e);
        }
    }

    public WeatherCodeCatalog loadFromStream(InputStream inputStream) {
        JsonNode root;
        try {
            root = objectMapper.readTree(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse weather codes", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Weather codes must be a JSON object");
        }

        ConditionTaxonomy taxonomy = new ConditionTaxonomy(
                readCategories(root.path("conditions")),
                root.path("defaultGlyph").isTextual() ? root.get("defaultGlyph").asText() : null
        );
        WeatherCodeTable codes = new WeatherCodeTable(
                readWmoRanges(root.path("wmo").path("ranges")),
                readTomorrowCodes(root.path("tomorrow_io"))
        );
        return new WeatherCodeCatalog(taxonomy, codes);
    }

    private List<ConditionCategory> readCategories(JsonNode conditions) {
        if (!conditions.isArray() || conditions.isEmpty()) {
            throw new ConfigurationException("Weather codes need a non-empty 'conditions' array");
        }
        List<ConditionCategory> categories = new ArrayList<>();
        for (JsonNode node : conditions) {
            String name = node.path("name").asText(null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Condition entry without a name: " + node);
            }
            List<String> keywords = new ArrayList<>();
            node.path("keywords").forEach(k -> keywords.add(k.asText()));
            categories.add(new ConditionCategory(name, keywords, node.path("glyph").asText("")));
        }
        return categories;
    }

    private List<WeatherCodeTable.CodeRange> readWmoRanges(JsonNode ranges) {
        List<WeatherCodeTable.CodeRange> result = new ArrayList<>();
        for (JsonNode node : ranges) {
            try {
                result.add(new WeatherCodeTable.CodeRange(
                        node.path("min").asInt(),
                        node.path("max").asInt(),
                        node.path("condition").asText(WeatherCodeTable.UNKNOWN)
                ));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid WMO range: " + node, e);
            }
        }
        return result;
    }

    private Map<Integer, String> readTomorrowCodes(JsonNode codes) {
        Map<Integer, String> result = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = codes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            try {
                result.put(Integer.parseInt(entry.getKey().trim()), entry.getValue().asText());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid Tomorrow.io code: " + entry.getKey(), e);
            }
        }
        return result;
    }
}
