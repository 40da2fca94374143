/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.agentnetwork.infrastructure.config.AgentNetworkConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.agentnetwork.infrastructure.config.ConfigLoader} - YAML loading, validation and file watching</li>
 *   <li>{@link fr.lapetina.agentnetwork.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, backlog, threads)</li>
 *   <li>{@code provider} - Model provider type, base URL and API key</li>
 *   <li>{@code models} - Provider model and rate limit endpoint per model type</li>
 *   <li>{@code rateLimit} - Token buckets per endpoint and backoff policy</li>
 *   <li>{@code orchestration} - Concurrency, timeouts, history window, prompt file</li>
 *   <li>{@code timeouts} - Connection and request timeouts</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.agentnetwork.infrastructure.config;
