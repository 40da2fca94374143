package fr.lapetina.agentnetwork.infrastructure.client;

import fr.lapetina.agentnetwork.domain.model.ModelType;

/**
 * Capability to run one prompt against a language model.
 *
 * Implementations make exactly one attempt per call. Retries and backoff belong to the
 * rate limiter wrapped around the call.
 */
public interface ModelClient extends AutoCloseable {

    /**
     * Runs a prompt and returns the generated text.
     *
     * @throws ModelClientException classified as {@code TIMEOUT}, {@code RATE_LIMITED} or {@code PROVIDER_ERROR}
     */
    String complete(String prompt, ModelType modelType);

    /**
     * Provider name for logs and health reporting.
     */
    String providerName();

    @Override
    default void close() {
    }
}
