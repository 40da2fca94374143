package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.domain.model.ModelType;
import fr.lapetina.agentnetwork.infrastructure.client.ModelClient;
import fr.lapetina.agentnetwork.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Single path for every outbound model call: the rate limiter's endpoint for the model type,
 * then the {@link ModelClient}. Records call latency per {@link CallKind}.
 */
public final class ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ModelGateway.class);

    /**
     * Who is calling, for metrics and logs.
     */
    public enum CallKind {
        MOTHER,
        WORKER,
        SYNTHESIS;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final ModelClient client;
    private final RateLimiter rateLimiter;
    private final Map<ModelType, String> endpoints;
    private final MetricsRegistry metrics;

    public ModelGateway(
            ModelClient client,
            RateLimiter rateLimiter,
            Map<ModelType, String> endpoints,
            MetricsRegistry metrics
    ) {
        this.client = Objects.requireNonNull(client, "Model client is required");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "Rate limiter is required");
        this.endpoints = new EnumMap<>(endpoints);
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");
        for (ModelType type : ModelType.values()) {
            if (!this.endpoints.containsKey(type)) {
                throw new IllegalArgumentException("No rate limit endpoint for model type: " + type.wireName());
            }
        }
    }

    /**
     * Runs a prompt through the rate limiter and the model client.
     *
     * @throws fr.lapetina.agentnetwork.domain.model.AgentNetworkException classified failure
     */
    public String call(CallKind kind, String prompt, ModelType modelType) {
        String endpoint = endpoints.get(modelType);
        long start = System.nanoTime();
        boolean success = false;

        log.debug("Model call started: kind={}, endpoint={}, modelType={}, promptLength={}",
                kind.tag(), endpoint, modelType.wireName(), prompt.length());
        try {
            String text = rateLimiter.callWithLimit(endpoint, () -> client.complete(prompt, modelType));
            success = true;
            return text;
        } finally {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordModelCall(kind.tag(), success, latency);
            log.debug("Model call finished: kind={}, endpoint={}, success={}, latencyMs={}",
                    kind.tag(), endpoint, success, latency.toMillis());
        }
    }
}
