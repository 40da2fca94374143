package fr.lapetina.agentnetwork.infrastructure.metrics;

import fr.lapetina.agentnetwork.domain.event.TurnState;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.EndpointMetrics;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.RateLimiter;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Turn latency and outcome counters
 * - Model call latency per call kind (mother, worker, synthesis)
 * - Worker failure counters by error type
 * - Rate limiter call statistics per endpoint
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> turnTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> turnCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> callTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final Set<String> boundEndpoints = ConcurrentHashMap.newKeySet();

    // Global gauges
    private final AtomicInteger instanceCount = new AtomicInteger(0);
    private final AtomicInteger turnsInProgress = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_instances", instanceCount, AtomicInteger::get)
                .description("Number of instances in the network, mother included")
                .register(registry);

        Gauge.builder(prefix + "_turns_in_progress", turnsInProgress, AtomicInteger::get)
                .description("Number of turns currently running")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("agent_network");
    }

    /**
     * Records a finished turn. {@code errorType} is null for completed turns.
     */
    public void recordTurn(TurnState outcome, ErrorType errorType, boolean degraded, Duration latency) {
        String error = errorType != null ? errorType.name() : "NONE";
        String key = outcome.name() + ":" + error + ":" + degraded;
        turnCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_turns_total")
                        .description("Total number of turns")
                        .tag("state", outcome.name())
                        .tag("error", error)
                        .tag("degraded", Boolean.toString(degraded))
                        .register(registry)
        ).increment();

        turnTimers.computeIfAbsent(outcome.name(), k ->
                Timer.builder(prefix + "_turn_latency")
                        .description("Turn latency")
                        .tag("state", outcome.name())
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records one rate-limited model call, retries included.
     */
    public void recordModelCall(String kind, boolean success, Duration latency) {
        String outcome = success ? "success" : "failure";
        String key = kind + ":" + outcome;
        callTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_model_call_latency")
                        .description("Model call latency including rate limiting and retries")
                        .tag("kind", kind)
                        .tag("outcome", outcome)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the worker failure counter.
     */
    public void incrementWorkerFailure(ErrorType errorType) {
        failureCounters.computeIfAbsent(errorType.name(), k ->
                Counter.builder(prefix + "_worker_failures_total")
                        .description("Worker calls that produced a failure marker")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Exposes the rate limiter's call statistics for an endpoint. Binding twice is a no-op.
     */
    public void bindRateLimitEndpoint(RateLimiter rateLimiter, String endpoint) {
        if (!boundEndpoints.add(endpoint)) {
            return;
        }
        endpointCounter(rateLimiter, endpoint, "_ratelimit_calls_total", "Rate-limited call attempts", EndpointMetrics::totalCalls);
        endpointCounter(rateLimiter, endpoint, "_ratelimit_failures_total", "Calls that failed after retries", EndpointMetrics::failedCalls);
        endpointCounter(rateLimiter, endpoint, "_ratelimit_retries_total", "Backoff retries", EndpointMetrics::retries);
        endpointCounter(rateLimiter, endpoint, "_ratelimit_throttled_total", "Provider rate-limit responses", EndpointMetrics::rateLimitHits);
        endpointCounter(rateLimiter, endpoint, "_ratelimit_wait_seconds_total", "Time spent waiting for tokens and backoff", EndpointMetrics::totalWaitSeconds);
    }

    private void endpointCounter(
            RateLimiter rateLimiter,
            String endpoint,
            String suffix,
            String description,
            ToDoubleFunction<EndpointMetrics> value
    ) {
        FunctionCounter.builder(prefix + suffix, rateLimiter,
                        limiter -> value.applyAsDouble(limiter.getCallMetrics(endpoint)))
                .description(description)
                .tag("endpoint", endpoint)
                .register(registry);
    }

    /**
     * Updates the instance count gauge.
     */
    public void setInstanceCount(int value) {
        instanceCount.set(value);
    }

    public void turnStarted() {
        turnsInProgress.incrementAndGet();
    }

    public void turnFinished() {
        turnsInProgress.decrementAndGet();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
