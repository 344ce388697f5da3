/**
 * Immutable domain types shared by the registry, router, metrics collector and rollout controllers.
 *
 * <h2>Key Types</h2>
 * <ul>
 *   <li>{@link fr.lapetina.modeltraffic.domain.model.ModelEndpoint} - deployed instance of a model version</li>
 *   <li>{@link fr.lapetina.modeltraffic.domain.model.RequestMetricSample} - one request outcome</li>
 *   <li>{@link fr.lapetina.modeltraffic.domain.model.AggregateWindow} - rolling aggregate over samples</li>
 *   <li>{@link fr.lapetina.modeltraffic.domain.model.Recommendation} - optimizer output</li>
 * </ul>
 */
package fr.lapetina.modeltraffic.domain.model;
