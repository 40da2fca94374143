/**
 * Domain model classes for the agent network.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.agentnetwork.domain.model.Instance} - Thread-safe mother or worker agent</li>
 *   <li>{@link fr.lapetina.agentnetwork.domain.model.InstanceView} - Immutable snapshot for readers</li>
 *   <li>{@link fr.lapetina.agentnetwork.domain.model.WorkerOutput} - Output or failure marker of one routed message</li>
 *   <li>{@link fr.lapetina.agentnetwork.domain.model.TurnResult} - Outcome of a completed turn</li>
 *   <li>{@link fr.lapetina.agentnetwork.domain.model.ErrorType} - Categorized error types</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code Instance} keeps its status in an {@code AtomicReference} and guards its
 * connection set and output history; everything else is an immutable record or enum.
 */
package fr.lapetina.agentnetwork.domain.model;
