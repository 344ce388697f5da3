package fr.lapetina.modeltraffic.domain.model;

/**
 * Lifecycle state of a model endpoint.
 *
 * DRAFT: Deployed but never served traffic
 * CANARY: Receiving a minority traffic fraction while being validated
 * ACTIVE: Trusted production endpoint
 * RETIRING: Weight is 0, waiting for the drain grace period before removal
 */
public enum EndpointState {
    DRAFT,
    CANARY,
    ACTIVE,
    RETIRING
}
