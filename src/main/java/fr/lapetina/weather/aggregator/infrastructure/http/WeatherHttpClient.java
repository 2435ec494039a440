package fr.lapetina.weather.aggregator.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.weather.aggregator.domain.model.Outcome;
import fr.lapetina.weather.aggregator.domain.model.SourceError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;

/**
 * Shared HTTP session used by every weather source during a batch.
 *
 * Uses java.net.http.HttpClient, which pools connections and is safe for
 * concurrent use. Every request carries the same fixed timeout. Failures are
 * returned as {@link Outcome} values, never thrown.
 */
public class WeatherHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WeatherHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final String userAgent;

    public WeatherHttpClient(Duration connectTimeout, Duration requestTimeout, String userAgent) {
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public WeatherHttpClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(10), "weather-aggregator/1.0");
    }

    /**
     * Performs a GET and parses the body as JSON.
     *
     * @param uri target; may contain credentials, so only the host is logged
     * @return parsed tree, or one of timeout / HTTP status / network / invalid JSON
     */
    public Outcome<JsonNode> getJson(URI uri) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(requestTimeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid request URI: host={}, error={}", uri.getHost(), e.getMessage());
            return Outcome.failure(SourceError.network("invalid request: " + e.getMessage()));
        }

        Instant start = Instant.now();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("Request timeout: host={}, latencyMs={}", uri.getHost(), elapsedMs(start));
            return Outcome.failure(SourceError.timeout());
        } catch (IOException e) {
            log.warn("Network error: host={}, errorType={}, error={}",
                    uri.getHost(), e.getClass().getSimpleName(), e.getMessage());
            return Outcome.failure(SourceError.network(describe(e)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Request interrupted: host={}", uri.getHost());
            return Outcome.failure(SourceError.network("interrupted"));
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("Request failed with HTTP error: host={}, status={}, latencyMs={}",
                    uri.getHost(), status, elapsedMs(start));
            return Outcome.failure(SourceError.httpStatus(status));
        }

        log.debug("Request successful: host={}, status={}, latencyMs={}", uri.getHost(), status, elapsedMs(start));
        return parse(response.body());
    }

    /**
     * Parses a response body, mapping anything that is not a JSON document to "invalid JSON".
     */
    Outcome<JsonNode> parse(String body) {
        if (body == null || body.isBlank()) {
            return Outcome.failure(SourceError.invalidJson());
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                return Outcome.failure(SourceError.invalidJson());
            }
            return Outcome.success(node);
        } catch (JsonProcessingException e) {
            log.debug("Response is not valid JSON: error={}", e.getOriginalMessage());
            return Outcome.failure(SourceError.invalidJson());
        }
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    private static long elapsedMs(Instant start) {
        return Duration.between(start, Instant.now()).toMillis();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public void close() {
        // HttpClient is not AutoCloseable before Java 21
    }
}
