/**
 * Canary and blue-green rollouts.
 *
 * <p>Both controllers commit weight changes through the endpoint registry and hand retired
 * endpoints to the {@link fr.lapetina.modeltraffic.rollout.EndpointDrainer}. Only one rollout may
 * hold a model at a time.
 */
package fr.lapetina.modeltraffic.rollout;
