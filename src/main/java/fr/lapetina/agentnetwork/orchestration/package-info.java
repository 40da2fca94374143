/**
 * Turn loop of the agent network.
 *
 * <h2>Turn States</h2>
 * <pre>
 * AWAITING_DIRECTIVES → EXECUTING_COMMANDS → AWAITING_WORKER_OUTPUTS → SYNTHESIZING → COMPLETE
 *                    ↘ FAILED (mother unreachable or malformed twice)
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.agentnetwork.orchestration.Orchestrator} - Drives turns, one at a time per network</li>
 *   <li>{@link fr.lapetina.agentnetwork.orchestration.InstanceRegistry} - Mother, workers and role resolution</li>
 *   <li>{@link fr.lapetina.agentnetwork.orchestration.WorkerDispatcher} - Bounded concurrent fan-out</li>
 *   <li>{@link fr.lapetina.agentnetwork.orchestration.SynthesisEngine} - Final answer and degraded fallback</li>
 *   <li>{@link fr.lapetina.agentnetwork.orchestration.ModelGateway} - Rate-limited path to the model client</li>
 * </ul>
 *
 * @see fr.lapetina.agentnetwork.orchestration.Orchestrator
 */
package fr.lapetina.agentnetwork.orchestration;
