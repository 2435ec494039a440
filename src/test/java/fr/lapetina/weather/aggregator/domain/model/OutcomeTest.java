package fr.lapetina.weather.aggregator.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeTest {

    @Test
    @DisplayName("should chain successful steps")
    void shouldChainSuccess() {
        Outcome<Integer> result = Outcome.success("21")
                .map(Integer::parseInt)
                .flatMap(n -> Outcome.success(n * 2));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEqualTo(42);
        assertThat(result.error()).isNull();
    }

    @Test
    @DisplayName("should skip later steps after a failure")
    void shouldShortCircuitOnFailure() {
        AtomicBoolean called = new AtomicBoolean(false);

        Outcome<String> result = Outcome.<String>failure(SourceError.timeout())
                .flatMap(s -> {
                    called.set(true);
                    return Outcome.success(s + "!");
                });

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error().type()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(called).isFalse();
    }

    @Test
    @DisplayName("should replace only failures with mapError")
    void shouldMapErrorOnlyOnFailure() {
        Outcome<String> success = Outcome.<String>success("ok").mapError(SourceError::geocoding);
        Outcome<String> failure = Outcome.<String>failure(SourceError.timeout()).mapError(SourceError::geocoding);

        assertThat(success.value()).isEqualTo("ok");
        assertThat(failure.error().message()).isEqualTo("geocoding request failed: timeout");
    }

    @Test
    @DisplayName("should fold into a single value")
    void shouldFold() {
        String folded = Outcome.<Integer>failure(SourceError.httpStatus(404))
                .fold(n -> "value " + n, SourceError::message);

        assertThat(folded).isEqualTo("HTTP 404");
    }

    @Test
    @DisplayName("should refuse to expose a value on failure")
    void shouldThrowOnValueOfFailure() {
        Outcome<String> failure = Outcome.failure(SourceError.invalidJson());

        assertThatThrownBy(failure::value)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("invalid JSON");
    }
}
