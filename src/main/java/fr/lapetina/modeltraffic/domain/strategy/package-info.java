/**
 * Endpoint selection strategies.
 *
 * <p>{@link fr.lapetina.modeltraffic.domain.strategy.RoutingStrategy} is a closed enum; each
 * variant scores a list of {@link fr.lapetina.modeltraffic.domain.strategy.EndpointStats}
 * without side effects, which keeps routing reproducible for a given registry snapshot and
 * metric view.
 *
 * <table border="1">
 *   <tr><th>Strategy</th><th>Selects</th></tr>
 *   <tr><td>{@code cost-optimized}</td><td>Minimum cost per token</td></tr>
 *   <tr><td>{@code performance-optimized}</td><td>Minimum latency below the load threshold</td></tr>
 *   <tr><td>{@code balanced}</td><td>Highest weighted cost/latency/load score</td></tr>
 * </table>
 */
package fr.lapetina.modeltraffic.domain.strategy;
