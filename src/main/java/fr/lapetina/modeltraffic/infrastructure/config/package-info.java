/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.modeltraffic.infrastructure.config.ControllerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.modeltraffic.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.modeltraffic.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Only the {@code routing} section is applied at runtime: strategy, load threshold and
 * balanced weights. Other sections are read at startup.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - admin HTTP server settings</li>
 *   <li>{@code routing} - strategy selection and scoring parameters</li>
 *   <li>{@code metrics} - sample buffers and Prometheus prefix</li>
 *   <li>{@code pipeline} - ring buffer and wait strategy settings</li>
 *   <li>{@code rollout} - canary defaults and endpoint draining</li>
 *   <li>{@code blueGreen} - blue-green defaults</li>
 *   <li>{@code optimizer} - baseline and degradation analysis</li>
 *   <li>{@code healthCheck} - endpoint probing and smoke tests</li>
 *   <li>{@code store} - snapshot persistence</li>
 *   <li>{@code models} - initial endpoints per model</li>
 *   <li>{@code deployments} - addresses handed out when a version is deployed</li>
 * </ul>
 */
package fr.lapetina.modeltraffic.infrastructure.config;
