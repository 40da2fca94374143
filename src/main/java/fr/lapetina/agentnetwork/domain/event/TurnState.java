package fr.lapetina.agentnetwork.domain.event;

/**
 * Lifecycle state of one user turn in the orchestrator.
 */
public enum TurnState {
    /** Waiting for the mother agent's directive block */
    AWAITING_DIRECTIVES,

    /** Realizing CREATE commands and dispatching TO commands */
    EXECUTING_COMMANDS,

    /** Waiting for dispatched worker calls to settle */
    AWAITING_WORKER_OUTPUTS,

    /** Merging worker outputs into the final answer */
    SYNTHESIZING,

    /** Final response produced */
    COMPLETE,

    /** Turn aborted */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
