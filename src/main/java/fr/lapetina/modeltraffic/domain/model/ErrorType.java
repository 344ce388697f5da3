package fr.lapetina.modeltraffic.domain.model;

/**
 * Error taxonomy for routed requests.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Malformed request (missing model, negative token estimate, etc.) */
    VALIDATION_ERROR,

    /** Routing found no viable endpoint for the selected version */
    NO_HEALTHY_ENDPOINT,

    /** The endpoint returned an error */
    ENDPOINT_ERROR,

    /** Request timed out waiting for the endpoint */
    TIMEOUT,

    /** Internal system error */
    INTERNAL_ERROR
}
