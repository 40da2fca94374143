package fr.lapetina.agentnetwork.orchestration.exception;

import fr.lapetina.agentnetwork.domain.event.TurnState;
import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;

/**
 * Thrown when a user turn cannot produce any response.
 *
 * This occurs when:
 * - The user message is invalid
 * - The mother agent cannot be reached
 * - The mother agent keeps answering with malformed directive blocks
 */
public final class TurnFailedException extends AgentNetworkException {

    private final String turnId;
    private final TurnState failedIn;

    public TurnFailedException(ErrorType errorType, String message) {
        this(errorType, message, null, null, null);
    }

    public TurnFailedException(ErrorType errorType, String message, String turnId, TurnState failedIn, Throwable cause) {
        super(errorType, message, cause);
        this.turnId = turnId;
        this.failedIn = failedIn;
    }

    /**
     * Turn identifier, null when the message was rejected before a turn started.
     */
    public String getTurnId() {
        return turnId;
    }

    /**
     * State the turn was in when it failed, null when rejected before a turn started.
     */
    public TurnState getFailedIn() {
        return failedIn;
    }
}
