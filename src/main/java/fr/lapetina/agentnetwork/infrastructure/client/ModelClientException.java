package fr.lapetina.agentnetwork.infrastructure.client;

import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;

/**
 * Failure of a single model call.
 */
public final class ModelClientException extends AgentNetworkException {

    private final int statusCode;

    public ModelClientException(ErrorType errorType, String message) {
        this(errorType, message, -1, null);
    }

    public ModelClientException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, -1, cause);
    }

    public ModelClientException(ErrorType errorType, String message, int statusCode, Throwable cause) {
        super(errorType, message, cause);
        this.statusCode = statusCode;
    }

    public static ModelClientException timeout(String message) {
        return new ModelClientException(ErrorType.TIMEOUT, message);
    }

    public static ModelClientException rateLimited(String message) {
        return new ModelClientException(ErrorType.RATE_LIMITED, message);
    }

    public static ModelClientException providerError(String message) {
        return new ModelClientException(ErrorType.PROVIDER_ERROR, message);
    }

    /**
     * HTTP status of the provider response, -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
