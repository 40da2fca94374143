package fr.lapetina.agentnetwork.infrastructure.client;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.agentnetwork.domain.model.ModelType;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code generateContent} client.
 */
public final class GeminiModelClient extends HttpModelClient {

    private final String apiKey;

    public GeminiModelClient(
            URI baseUrl,
            String apiKey,
            Map<ModelType, String> models,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        super(baseUrl, models, connectTimeout, requestTimeout);
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("Gemini API key is required");
        }
        this.apiKey = apiKey;
    }

    @Override
    public String providerName() {
        return "gemini";
    }

    @Override
    protected URI requestUri(String model) {
        return URI.create(trimmedBase() + "/v1beta/models/" + model + ":generateContent?key="
                + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
    }

    @Override
    protected Object buildRequestBody(String model, String prompt) {
        return Map.of("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
    }

    @Override
    protected String extractText(JsonNode root) {
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            // Thinking models may return thought parts before the answer
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            text.append(part.path("text").asText(""));
        }
        return text.length() > 0 ? text.toString() : null;
    }
}
