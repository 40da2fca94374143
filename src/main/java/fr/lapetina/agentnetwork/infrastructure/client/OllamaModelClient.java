package fr.lapetina.agentnetwork.infrastructure.client;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.agentnetwork.domain.model.ModelType;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ollama {@code /api/generate} client, non-streaming.
 */
public final class OllamaModelClient extends HttpModelClient {

    public OllamaModelClient(
            URI baseUrl,
            Map<ModelType, String> models,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        super(baseUrl, models, connectTimeout, requestTimeout);
    }

    @Override
    public String providerName() {
        return "ollama";
    }

    @Override
    protected URI requestUri(String model) {
        return URI.create(trimmedBase() + "/api/generate");
    }

    @Override
    protected Object buildRequestBody(String model, String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        return body;
    }

    @Override
    protected String extractText(JsonNode root) {
        JsonNode response = root.get("response");
        return response != null && response.isTextual() ? response.asText() : null;
    }
}
