package fr.lapetina.agentnetwork.orchestration.exception;

import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;

/**
 * Thrown when a reference matches neither a role nor an instance id.
 */
public final class UnknownInstanceException extends AgentNetworkException {

    private final String reference;

    public UnknownInstanceException(String reference) {
        super(ErrorType.UNKNOWN_INSTANCE, "Unknown instance: " + reference);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
