package fr.lapetina.agentnetwork;

import fr.lapetina.agentnetwork.api.HttpServer;
import fr.lapetina.agentnetwork.domain.command.DirectiveParser;
import fr.lapetina.agentnetwork.domain.model.ModelType;
import fr.lapetina.agentnetwork.infrastructure.client.ModelClient;
import fr.lapetina.agentnetwork.infrastructure.client.ModelClientFactory;
import fr.lapetina.agentnetwork.infrastructure.config.AgentNetworkConfig;
import fr.lapetina.agentnetwork.infrastructure.config.ConfigLoader;
import fr.lapetina.agentnetwork.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.BackoffPolicy;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.agentnetwork.orchestration.InstanceRegistry;
import fr.lapetina.agentnetwork.orchestration.ModelGateway;
import fr.lapetina.agentnetwork.orchestration.Orchestrator;
import fr.lapetina.agentnetwork.orchestration.OrchestratorSettings;
import fr.lapetina.agentnetwork.orchestration.PromptLibrary;
import fr.lapetina.agentnetwork.orchestration.WorkerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Factory for creating a fully-wired agent network from configuration.
 * This is the primary entry point for obtaining a configured {@link Orchestrator}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (NetworkFactory factory = NetworkFactory.create("config.yaml")) {
 *     TurnResult result = factory.getOrchestrator().submitUserMessage("Plan a trip to Lisbon");
 * }
 * }</pre>
 */
public class NetworkFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NetworkFactory.class);

    private final ConfigLoader configLoader;
    private final AgentNetworkConfig config;
    private final MetricsRegistry metricsRegistry;
    private final RateLimiter rateLimiter;
    private final ModelClient modelClient;
    private final WorkerDispatcher dispatcher;
    private final Orchestrator orchestrator;

    private HttpServer httpServer;

    protected NetworkFactory(String configPath, ModelClient modelClientOverride) {
        log.info("Initializing NetworkFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Rate limiter shared by every outbound call
        this.rateLimiter = new RateLimiter(backoffPolicy(config));
        configureEndpoints(config);

        // Initialize model client (allow override for testing)
        this.modelClient = modelClientOverride != null ? modelClientOverride : ModelClientFactory.create(config);

        Map<ModelType, String> endpoints = new EnumMap<>(ModelType.class);
        for (ModelType type : ModelType.values()) {
            endpoints.put(type, config.getModels().forType(type).getEndpoint());
        }
        ModelGateway gateway = new ModelGateway(modelClient, rateLimiter, endpoints, metricsRegistry);

        AgentNetworkConfig.OrchestrationConfig orchestration = config.getOrchestration();
        this.dispatcher = new WorkerDispatcher(
                orchestration.getMaxConcurrency(),
                Duration.ofMillis(orchestration.getCallTimeoutMs()));

        this.orchestrator = new Orchestrator(
                new InstanceRegistry(),
                new DirectiveParser(),
                gateway,
                dispatcher,
                PromptLibrary.load(orchestration.getPromptsResource()),
                metricsRegistry,
                OrchestratorSettings.from(orchestration));

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("NetworkFactory initialized: provider={}, endpoints={}, maxConcurrency={}",
                modelClient.providerName(), config.getRateLimit().getEndpoints().size(),
                orchestration.getMaxConcurrency());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static NetworkFactory create(String configPath) {
        return new NetworkFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static NetworkFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the HTTP boundary and configuration watching.
     */
    public NetworkFactory start() throws IOException {
        AgentNetworkConfig.ServerConfig server = config.getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getThreads(),
                orchestrator,
                rateLimiter,
                metricsRegistry,
                config.getMetrics().isEnabled(),
                modelClient.providerName());
        httpServer.start();
        configLoader.startWatching();
        log.info("Agent network started on port {}", httpServer.getPort());
        return this;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ModelClient getModelClient() {
        return modelClient;
    }

    public AgentNetworkConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Null until {@link #start()}.
     */
    public HttpServer getHttpServer() {
        return httpServer;
    }

    private static BackoffPolicy backoffPolicy(AgentNetworkConfig config) {
        AgentNetworkConfig.BackoffConfig backoff = config.getRateLimit().getBackoff();
        return new BackoffPolicy(
                Duration.ofMillis(backoff.getBaseDelayMs()),
                Duration.ofMillis(backoff.getMaxDelayMs()),
                backoff.getJitterMin(),
                backoff.getJitterMax());
    }

    private void configureEndpoints(AgentNetworkConfig source) {
        for (AgentNetworkConfig.EndpointConfig endpoint : source.getRateLimit().getEndpoints()) {
            rateLimiter.configureEndpoint(
                    endpoint.getName(),
                    endpoint.getMaxTokens(),
                    endpoint.getRefillRate(),
                    endpoint.getMaxRetries());
            metricsRegistry.bindRateLimitEndpoint(rateLimiter, endpoint.getName());
        }
    }

    private void onConfigChanged(AgentNetworkConfig oldConfig, AgentNetworkConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying rate limit updates...");
        configureEndpoints(newConfig);
        log.info("Configuration updates applied: endpoints={}", newConfig.getRateLimit().getEndpoints().size());
    }

    @Override
    public void close() {
        log.info("Shutting down NetworkFactory...");

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (Exception e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        try {
            modelClient.close();
        } catch (Exception e) {
            log.warn("Error closing model client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("NetworkFactory shut down");
    }
}
