package fr.lapetina.modeltraffic.domain.model;

/**
 * Kinds of recommendation emitted by the performance optimizer.
 */
public enum RecommendationType {
    /** A cheaper endpoint of the same model meets the latency SLA */
    SWITCH_TO_CHEAPER_ENDPOINT,

    /** Latency degraded while the endpoint runs close to capacity */
    SCALE_UP,

    /** Latency degraded without capacity pressure, repeated work is worth caching */
    ENABLE_CACHING,

    /** Error rate degraded beyond tolerance */
    INVESTIGATE_ERRORS
}
