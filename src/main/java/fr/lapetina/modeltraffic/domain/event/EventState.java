package fr.lapetina.modeltraffic.domain.event;

/**
 * Lifecycle state of a routing event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just published, awaiting route selection */
    CREATED,

    /** An endpoint has been selected for this request */
    ROUTED,

    /** The selected version has no healthy endpoint, or the model is unknown */
    NO_HEALTHY_ENDPOINT,

    /** Request handed to the inference backend */
    DISPATCHED,

    /** Request completed successfully */
    COMPLETED,

    /** Request failed */
    FAILED
}
