/**
 * Model Traffic Controller - weighted routing and progressive rollouts for model-serving endpoints.
 *
 * <p>The controller keeps a registry of endpoints per model, routes each request to one endpoint
 * by cost, latency or a balanced score, and moves traffic between model versions through canary
 * and blue-green rollouts driven by observed metrics.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.modeltraffic.ControllerFactory} - builds and wires every component
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.modeltraffic.ModelTrafficControllerApplication} - standalone process
 *       exposing the admin HTTP API</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ControllerFactory factory = ControllerFactory.create("config.yaml").start()) {
 *     ModelEndpoint endpoint = factory.getRouter().route(RequestContext.of("llama3"));
 *     // call the endpoint, then report the outcome
 *     factory.getCollector().record(endpoint.id(), 120, true, 512);
 * }
 * }</pre>
 *
 * @see fr.lapetina.modeltraffic.routing.Router
 * @see fr.lapetina.modeltraffic.rollout.CanaryController
 */
package fr.lapetina.modeltraffic;
