package fr.lapetina.agentnetwork.domain.model;

/**
 * Error taxonomy for agent turns and model calls.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Mother response is not a valid directive block */
    PARSE_ERROR,

    /** A TO reference matched no role and no instance id */
    UNKNOWN_INSTANCE,

    /** A CREATE directive named a model type other than normal or thinking */
    UNKNOWN_MODEL_TYPE,

    /** An active instance with the same role already exists on a follow-up turn */
    DUPLICATE_ROLE,

    /** Provider answered with a rate-limit response */
    RATE_LIMITED,

    /** Retries exhausted at the rate limiter */
    RATE_LIMIT_EXCEEDED,

    /** Call or turn deadline elapsed */
    TIMEOUT,

    /** Provider failure (HTTP error, I/O failure, malformed body) */
    PROVIDER_ERROR,

    /** The mother agent could not be reached */
    MOTHER_UNAVAILABLE,

    /** Synthesis call failed, response degraded to raw outputs */
    SYNTHESIS_FAILED,

    /** Validation error in the user message */
    VALIDATION_ERROR,

    /** Internal system error */
    INTERNAL_ERROR;

    /**
     * Whether the rate limiter should retry a call that failed with this type.
     */
    public boolean isTransient() {
        return this == RATE_LIMITED || this == TIMEOUT;
    }
}
