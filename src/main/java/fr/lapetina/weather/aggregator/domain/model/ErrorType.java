package fr.lapetina.weather.aggregator.domain.model;

/**
 * Error taxonomy for weather source fetches.
 * Each constant renders to the fixed message shape shown to users.
 */
public enum ErrorType {
    /** Request or source call exceeded its deadline */
    TIMEOUT,

    /** Provider answered with a non-2xx status */
    HTTP_STATUS,

    /** Connection-level failure (refused, reset, DNS, interrupted) */
    NETWORK,

    /** Response body was not valid JSON */
    INVALID_JSON,

    /** Geocoding returned no match for the city */
    CITY_NOT_FOUND,

    /** Provider needs a credential that is not configured */
    MISSING_CREDENTIAL,

    /** Response was JSON but lacked or mangled the expected fields */
    PARSING,

    /** Geocoding request itself failed */
    GEOCODING
}
