package fr.lapetina.agentnetwork.domain.model;

import java.util.Objects;

/**
 * Base class for failures that carry an {@link ErrorType}.
 * The rate limiter, the orchestrator and the HTTP boundary all classify on it.
 */
public class AgentNetworkException extends RuntimeException {

    private final ErrorType errorType;

    public AgentNetworkException(ErrorType errorType, String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType);
    }

    public AgentNetworkException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType);
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
