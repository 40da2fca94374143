/**
 * Agent Network - a mother agent that plans each user turn, delegates to worker agents
 * and synthesizes their outputs into one answer.
 *
 * <p>The mother answers every turn with a line-oriented directive block
 * ({@code ANALYZE:}, {@code CREATE:}, {@code TO <ref>:}, {@code SYNTHESIZE}). Workers are created
 * on demand, addressed concurrently and reused across follow-up turns.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.agentnetwork.NetworkFactory} - Main entry point for creating
 *       a fully-wired network from YAML configuration</li>
 *   <li>{@link fr.lapetina.agentnetwork.AgentNetworkApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (NetworkFactory factory = NetworkFactory.create("config.yaml")) {
 *     TurnResult result = factory.getOrchestrator().submitUserMessage("Compare three CI providers");
 *     System.out.println(result.finalResponse());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Per-endpoint token bucket rate limiting with exponential backoff</li>
 *   <li>Partial failure: failing workers degrade the answer instead of aborting the turn</li>
 *   <li>Hot-reload of rate limit configuration</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.agentnetwork.NetworkFactory
 * @see fr.lapetina.agentnetwork.orchestration.Orchestrator
 */
package fr.lapetina.agentnetwork;
