package fr.lapetina.weather.aggregator.domain.model;

import java.util.Objects;

/**
 * A categorized failure produced by a network, geocoding or parsing step.
 *
 * @param type   error category
 * @param detail optional detail; ignored by categories with a fixed message
 */
public record SourceError(ErrorType type, String detail) {

    public SourceError {
        Objects.requireNonNull(type, "Error type is required");
    }

    public static SourceError timeout() {
        return new SourceError(ErrorType.TIMEOUT, null);
    }

    public static SourceError httpStatus(int status) {
        return new SourceError(ErrorType.HTTP_STATUS, String.valueOf(status));
    }

    public static SourceError network(String detail) {
        return new SourceError(ErrorType.NETWORK, detail);
    }

    public static SourceError invalidJson() {
        return new SourceError(ErrorType.INVALID_JSON, null);
    }

    public static SourceError cityNotFound() {
        return new SourceError(ErrorType.CITY_NOT_FOUND, null);
    }

    public static SourceError missingCredential() {
        return new SourceError(ErrorType.MISSING_CREDENTIAL, null);
    }

    public static SourceError parsing(String detail) {
        return new SourceError(ErrorType.PARSING, detail);
    }

    /**
     * Wraps a failed geocoding request, keeping the underlying message as detail.
     */
    public static SourceError geocoding(SourceError cause) {
        return new SourceError(ErrorType.GEOCODING, cause.message());
    }

    /**
     * Renders the user-facing message, e.g. {@code "HTTP 503"} or
     * {@code "geocoding request failed: timeout"}.
     */
    public String message() {
        return switch (type) {
            case TIMEOUT -> "timeout";
            case HTTP_STATUS -> "HTTP " + detail;
            case NETWORK -> hasDetail() ? "network error: " + detail : "network error";
            case INVALID_JSON -> "invalid JSON";
            case CITY_NOT_FOUND -> "city not found";
            case MISSING_CREDENTIAL -> "API key required";
            case PARSING -> "data parsing error: " + (hasDetail() ? detail : "unexpected response");
            case GEOCODING -> "geocoding request failed: " + (hasDetail() ? detail : "unknown error");
        };
    }

    private boolean hasDetail() {
        return detail != null && !detail.isBlank();
    }

    @Override
    public String toString() {
        return message();
    }
}
