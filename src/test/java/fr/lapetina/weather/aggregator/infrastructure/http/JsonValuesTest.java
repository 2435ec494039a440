package fr.lapetina.weather.aggregator.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonValuesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String body) throws Exception {
        return mapper.readTree(body);
    }

    @Test
    @DisplayName("should read numbers and numeric text")
    void shouldReadNumbers() throws Exception {
        JsonNode node = json("{\"a\": 12.5, \"b\": \"7\", \"c\": \"71%\", \"d\": \" 3.5 \"}");

        assertThat(JsonValues.nullableDouble(node.path("a"))).isEqualTo(12.5);
        assertThat(JsonValues.nullableDouble(node.path("b"))).isEqualTo(7.0);
        assertThat(JsonValues.nullableDouble(node.path("c"))).isEqualTo(71.0);
        assertThat(JsonValues.nullableDouble(node.path("d"))).isEqualTo(3.5);
    }

    @Test
    @DisplayName("should return null humidity for missing or invalid values, never zero")
    void shouldReturnNullForMissing() throws Exception {
        JsonNode node = json("{\"a\": null, \"b\": \"n/a\", \"c\": {}, \"d\": \"\"}");

        assertThat(JsonValues.nullableDouble(node.path("a"))).isNull();
        assertThat(JsonValues.nullableDouble(node.path("b"))).isNull();
        assertThat(JsonValues.nullableDouble(node.path("c"))).isNull();
        assertThat(JsonValues.nullableDouble(node.path("d"))).isNull();
        assertThat(JsonValues.nullableDouble(node.path("missing"))).isNull();
    }

    @Test
    @DisplayName("should default temperature to zero when missing")
    void shouldDefaultToZero() throws Exception {
        JsonNode node = json("{\"t\": \"warm\"}");

        assertThat(JsonValues.safeDouble(node.path("t"))).isZero();
        assertThat(JsonValues.safeDouble(node.path("missing"))).isZero();
    }

    @Test
    @DisplayName("should round integer codes")
    void shouldRoundCodes() throws Exception {
        JsonNode node = json("{\"code\": 3.0, \"text\": \"61\"}");

        assertThat(JsonValues.nullableInt(node.path("code"))).isEqualTo(3);
        assertThat(JsonValues.nullableInt(node.path("text"))).isEqualTo(61);
        assertThat(JsonValues.nullableInt(node.path("missing"))).isNull();
    }

    @Test
    @DisplayName("should read text and reject containers")
    void shouldReadText() throws Exception {
        JsonNode node = json("{\"s\": \" Sunny \", \"o\": {\"x\": 1}, \"n\": 4}");

        assertThat(JsonValues.text(node.path("s"))).isEqualTo("Sunny");
        assertThat(JsonValues.text(node.path("o"))).isEmpty();
        assertThat(JsonValues.text(node.path("n"))).isEqualTo("4");
        assertThat(JsonValues.text(node.path("missing"))).isEmpty();
    }

    @Test
    @DisplayName("should treat objects and non-empty arrays as present sections")
    void shouldDetectPresentSections() throws Exception {
        JsonNode node = json("{\"o\": {}, \"a\": [1], \"e\": [], \"s\": \"x\"}");

        assertThat(JsonValues.isPresent(node.path("o"))).isTrue();
        assertThat(JsonValues.isPresent(node.path("a"))).isTrue();
        assertThat(JsonValues.isPresent(node.path("e"))).isFalse();
        assertThat(JsonValues.isPresent(node.path("s"))).isFalse();
        assertThat(JsonValues.isPresent(node.path("missing"))).isFalse();
    }
}
