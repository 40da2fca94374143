package fr.lapetina.agentnetwork.infrastructure.client;

import fr.lapetina.agentnetwork.domain.model.ModelType;
import fr.lapetina.agentnetwork.infrastructure.config.AgentNetworkConfig;
import fr.lapetina.agentnetwork.infrastructure.config.ConfigLoader.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link ModelClient} selected by the {@code provider} configuration section.
 */
public final class ModelClientFactory {

    private static final Logger log = LoggerFactory.getLogger(ModelClientFactory.class);

    private ModelClientFactory() {
    }

    /**
     * Creates a client for {@code provider.type} ({@code gemini} or {@code ollama}).
     *
     * @throws ConfigurationException for an unknown provider or a missing Gemini API key
     */
    public static ModelClient create(AgentNetworkConfig config) {
        AgentNetworkConfig.ProviderConfig provider = config.getProvider();
        Map<ModelType, String> models = new EnumMap<>(ModelType.class);
        for (ModelType type : ModelType.values()) {
            models.put(type, config.getModels().forType(type).getName());
        }

        Duration connectTimeout = Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs());
        Duration requestTimeout = Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs());
        URI baseUrl = URI.create(provider.getBaseUrl());
        String type = provider.getType() == null ? "" : provider.getType().toLowerCase(Locale.ROOT);

        log.info("Creating model client: provider={}, baseUrl={}, normal={}, thinking={}",
                type, baseUrl, models.get(ModelType.NORMAL), models.get(ModelType.THINKING));

        return switch (type) {
            case "gemini" -> {
                String apiKey = provider.resolveApiKey();
                if (apiKey == null || apiKey.isBlank()) {
                    throw new ConfigurationException(
                            "Gemini API key missing: set provider.apiKey or the " + provider.getApiKeyEnv()
                                    + " environment variable");
                }
                yield new GeminiModelClient(baseUrl, apiKey, models, connectTimeout, requestTimeout);
            }
            case "ollama" -> new OllamaModelClient(baseUrl, models, connectTimeout, requestTimeout);
            default -> throw new ConfigurationException("Unknown provider type: " + provider.getType());
        };
    }
}
