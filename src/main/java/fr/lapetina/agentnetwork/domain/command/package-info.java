/**
 * Directive grammar of the mother agent.
 *
 * <p>{@link fr.lapetina.agentnetwork.domain.command.DirectiveParser} turns free text into a closed
 * set of {@link fr.lapetina.agentnetwork.domain.command.Command} variants. Parsing is total: lines it
 * cannot use become {@link fr.lapetina.agentnetwork.domain.command.ParseWarning}s. The only fatal
 * error is a block that does not end with {@code SYNTHESIZE}.
 *
 * <h2>Grammar</h2>
 * <pre>
 * ANALYZE: free text
 * CREATE: role | normal|thinking | responsibility
 * TO role-or-id: message
 * SYNTHESIZE
 * </pre>
 */
package fr.lapetina.agentnetwork.domain.command;
