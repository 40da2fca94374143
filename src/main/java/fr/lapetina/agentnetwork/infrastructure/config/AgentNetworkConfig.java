package fr.lapetina.agentnetwork.infrastructure.config;

import fr.lapetina.agentnetwork.domain.model.ModelType;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the agent network.
 * Designed to be populated from YAML.
 */
public class AgentNetworkConfig {

    private ServerConfig server = new ServerConfig();
    private ProviderConfig provider = new ProviderConfig();
    private ModelsConfig models = new ModelsConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private OrchestrationConfig orchestration = new OrchestrationConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ProviderConfig getProvider() { return provider; }
    public void setProvider(ProviderConfig provider) { this.provider = provider; }

    public ModelsConfig getModels() { return models; }
    public void setModels(ModelsConfig models) { this.models = models; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public OrchestrationConfig getOrchestration() { return orchestration; }
    public void setOrchestration(OrchestrationConfig orchestration) { this.orchestration = orchestration; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 5000;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Model provider selection.
     */
    public static class ProviderConfig {
        private String type = "gemini";
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String apiKey;
        private String apiKeyEnv = "GEMINI_API_KEY";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        /**
         * Explicit key if set, otherwise the value of {@code apiKeyEnv}, otherwise null.
         */
        public String resolveApiKey() {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey;
            }
            return apiKeyEnv != null ? System.getenv(apiKeyEnv) : null;
        }
    }

    /**
     * Provider model names per model type.
     */
    public static class ModelsConfig {
        private ModelConfig normal = new ModelConfig("gemini-1.5-flash", "gemini_api");
        private ModelConfig thinking = new ModelConfig("gemini-2.0-flash-thinking-exp", "gemini_api");

        public ModelConfig getNormal() { return normal; }
        public void setNormal(ModelConfig normal) { this.normal = normal; }

        public ModelConfig getThinking() { return thinking; }
        public void setThinking(ModelConfig thinking) { this.thinking = thinking; }

        public ModelConfig forType(ModelType type) {
            return switch (type) {
                case NORMAL -> normal;
                case THINKING -> thinking;
            };
        }
    }

    /**
     * One model: provider name plus the rate limit endpoint its calls go through.
     */
    public static class ModelConfig {
        private String name;
        private String endpoint = "gemini_api";

        public ModelConfig() {
        }

        public ModelConfig(String name, String endpoint) {
            this.name = name;
            this.endpoint = endpoint;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    }

    /**
     * Rate limit endpoints and backoff.
     */
    public static class RateLimitConfig {
        private List<EndpointConfig> endpoints = new ArrayList<>(List.of(new EndpointConfig("gemini_api", 15, 0.25, 5)));
        private BackoffConfig backoff = new BackoffConfig();

        public List<EndpointConfig> getEndpoints() { return endpoints; }
        public void setEndpoints(List<EndpointConfig> endpoints) { this.endpoints = endpoints; }

        public BackoffConfig getBackoff() { return backoff; }
        public void setBackoff(BackoffConfig backoff) { this.backoff = backoff; }
    }

    /**
     * Token bucket settings for one endpoint.
     */
    public static class EndpointConfig {
        private String name;
        private int maxTokens = 10;
        private double refillRate = 1.0;
        private int maxRetries = 3;

        public EndpointConfig() {
        }

        public EndpointConfig(String name, int maxTokens, double refillRate, int maxRetries) {
            this.name = name;
            this.maxTokens = maxTokens;
            this.refillRate = refillRate;
            this.maxRetries = maxRetries;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public double getRefillRate() { return refillRate; }
        public void setRefillRate(double refillRate) { this.refillRate = refillRate; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    /**
     * Exponential backoff between retries.
     */
    public static class BackoffConfig {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 60000;
        private double jitterMin = 0.9;
        private double jitterMax = 1.1;

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getJitterMin() { return jitterMin; }
        public void setJitterMin(double jitterMin) { this.jitterMin = jitterMin; }

        public double getJitterMax() { return jitterMax; }
        public void setJitterMax(double jitterMax) { this.jitterMax = jitterMax; }
    }

    /**
     * Turn execution settings.
     */
    public static class OrchestrationConfig {
        private int maxConcurrency = 4;
        private long callTimeoutMs = 120000;
        private long turnTimeoutMs = 300000;
        private int historyWindow = 3;
        private int maxMessageLength = 10000;
        private String promptsResource = "prompts.md";

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public long getCallTimeoutMs() { return callTimeoutMs; }
        public void setCallTimeoutMs(long callTimeoutMs) { this.callTimeoutMs = callTimeoutMs; }

        public long getTurnTimeoutMs() { return turnTimeoutMs; }
        public void setTurnTimeoutMs(long turnTimeoutMs) { this.turnTimeoutMs = turnTimeoutMs; }

        public int getHistoryWindow() { return historyWindow; }
        public void setHistoryWindow(int historyWindow) { this.historyWindow = historyWindow; }

        public int getMaxMessageLength() { return maxMessageLength; }
        public void setMaxMessageLength(int maxMessageLength) { this.maxMessageLength = maxMessageLength; }

        public String getPromptsResource() { return promptsResource; }
        public void setPromptsResource(String promptsResource) { this.promptsResource = promptsResource; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 120000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "agent_network";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
