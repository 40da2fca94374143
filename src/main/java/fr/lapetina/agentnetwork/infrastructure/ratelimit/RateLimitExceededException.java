package fr.lapetina.agentnetwork.infrastructure.ratelimit;

import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;

/**
 * Thrown when a call keeps failing transiently after all retries, or is interrupted while waiting.
 * The last underlying failure is the cause.
 */
public final class RateLimitExceededException extends AgentNetworkException {

    private final String endpoint;
    private final int attempts;
    private final ErrorType lastErrorType;

    public RateLimitExceededException(String endpoint, int attempts, ErrorType lastErrorType, Throwable cause) {
        super(ErrorType.RATE_LIMIT_EXCEEDED,
                "Retries exhausted: endpoint=" + endpoint + ", attempts=" + attempts + ", lastError=" + lastErrorType,
                cause);
        this.endpoint = endpoint;
        this.attempts = attempts;
        this.lastErrorType = lastErrorType;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Classification of the failure that triggered the last retry.
     */
    public ErrorType getLastErrorType() {
        return lastErrorType;
    }
}
