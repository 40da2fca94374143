package fr.lapetina.agentnetwork.infrastructure.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.domain.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base for JSON-over-HTTP model providers.
 *
 * Uses java.net.http.HttpClient with a per-request timeout. Subclasses build the
 * request body and extract text from the response; status classification is shared:
 * 429 is {@code RATE_LIMITED}, 408/504 and client-side timeouts are {@code TIMEOUT},
 * everything else that is not 2xx is {@code PROVIDER_ERROR}.
 */
public abstract class HttpModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(HttpModelClient.class);

    protected final ObjectMapper objectMapper;
    protected final URI baseUrl;

    private final HttpClient httpClient;
    private final Map<ModelType, String> models;
    private final Duration requestTimeout;

    protected HttpModelClient(
            URI baseUrl,
            Map<ModelType, String> models,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "Base URL is required");
        this.models = new EnumMap<>(Objects.requireNonNull(models, "Models are required"));
        this.requestTimeout = requestTimeout;

        for (ModelType type : ModelType.values()) {
            if (!this.models.containsKey(type)) {
                throw new IllegalArgumentException("No model configured for type: " + type.wireName());
            }
        }

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String complete(String prompt, ModelType modelType) {
        String model = modelName(modelType);
        HttpRequest request = buildHttpRequest(model, prompt);
        Instant startTime = Instant.now();

        log.debug("Sending model request: provider={}, model={}, promptLength={}",
                providerName(), model, prompt.length());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("Model request timeout: provider={}, model={}, error={}", providerName(), model, e.getMessage());
            throw new ModelClientException(ErrorType.TIMEOUT, "Model request timed out: " + model, e);
        } catch (IOException e) {
            log.warn("Model connection error: provider={}, model={}, errorType={}, error={}",
                    providerName(), model, e.getClass().getSimpleName(), e.getMessage());
            throw new ModelClientException(ErrorType.PROVIDER_ERROR, "Model request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelClientException(ErrorType.TIMEOUT, "Model request interrupted: " + model, e);
        }

        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            log.info("Model request successful: provider={}, model={}, status={}, latencyMs={}",
                    providerName(), model, statusCode, latencyMs);
            return parseSuccess(model, response.body());
        }

        ErrorType errorType = classifyStatus(statusCode);
        String message = "HTTP " + statusCode + ": " + extractErrorMessage(response.body());
        log.warn("Model request failed with HTTP error: provider={}, model={}, status={}, errorType={}, latencyMs={}",
                providerName(), model, statusCode, errorType, latencyMs);
        throw new ModelClientException(errorType, message, statusCode, null);
    }

    /**
     * Provider model name configured for a model type.
     */
    public String modelName(ModelType modelType) {
        return models.get(modelType);
    }

    protected HttpRequest buildHttpRequest(String model, String prompt) {
        String body;
        try {
            body = objectMapper.writeValueAsString(buildRequestBody(model, prompt));
        } catch (IOException e) {
            throw new ModelClientException(ErrorType.PROVIDER_ERROR, "Failed to build request body", e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(requestUri(model))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        return builder.build();
    }

    private String parseSuccess(String model, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ModelClientException(ErrorType.PROVIDER_ERROR, "Malformed response body from " + model, e);
        }
        String text = extractText(root);
        if (text == null) {
            throw new ModelClientException(ErrorType.PROVIDER_ERROR, "Response from " + model + " contains no text");
        }
        return text;
    }

    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no body";
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.path("message").isTextual()) {
                return error.path("message").asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: provider={}, error={}", providerName(), e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    static ErrorType classifyStatus(int statusCode) {
        return switch (statusCode) {
            case 429 -> ErrorType.RATE_LIMITED;
            case 408, 504 -> ErrorType.TIMEOUT;
            default -> ErrorType.PROVIDER_ERROR;
        };
    }

    protected String trimmedBase() {
        String base = baseUrl.toString();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    /**
     * Endpoint for a generation request.
     */
    protected abstract URI requestUri(String model);

    /**
     * JSON body (serialized by Jackson) for a generation request.
     */
    protected abstract Object buildRequestBody(String model, String prompt);

    /**
     * Generated text from a 2xx response, or null if there is none.
     */
    protected abstract String extractText(JsonNode root);
}
