/**
 * Endpoint health probing.
 *
 * <p>{@link fr.lapetina.modeltraffic.infrastructure.health.EndpointHealthChecker} runs probes on a
 * schedule and writes health changes into the registry. {@link
 * fr.lapetina.modeltraffic.infrastructure.health.HttpEndpointProbe} is the HTTP implementation of
 * both the health probe and the smoke test runner.
 */
package fr.lapetina.modeltraffic.infrastructure.health;
