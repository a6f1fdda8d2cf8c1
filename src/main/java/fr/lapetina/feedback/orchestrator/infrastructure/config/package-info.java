/**
 * Configuration loading.
 *
 * <p>This package parses the YAML configuration once at process start. Values are not
 * reloaded while the process runs.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.feedback.orchestrator.infrastructure.config.OrchestratorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.feedback.orchestrator.infrastructure.config.ConfigLoader} - YAML loading and validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, threads)</li>
 *   <li>{@code remote} - Remote analysis endpoint, model, credentials and timeouts</li>
 *   <li>{@code circuitBreaker} - Failure threshold and reset timeout</li>
 *   <li>{@code throttle} - Interval bounds, multipliers and quota cooldown</li>
 *   <li>{@code batching} - Length thresholds and batch sizes</li>
 *   <li>{@code cache} - Partition capacities and optional time-to-live</li>
 *   <li>{@code concurrency} - Worker pool size, remote concurrency and request deadline</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.feedback.orchestrator.infrastructure.config.OrchestratorConfig
 * @see fr.lapetina.feedback.orchestrator.infrastructure.config.ConfigLoader
 */
package fr.lapetina.feedback.orchestrator.infrastructure.config;
