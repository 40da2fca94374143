package fr.lapetina.agentnetwork.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.agentnetwork.api.dto.ErrorResponse;
import fr.lapetina.agentnetwork.api.dto.MessageRequest;
import fr.lapetina.agentnetwork.api.dto.MessageResponse;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.domain.model.InstanceView;
import fr.lapetina.agentnetwork.domain.model.NetworkStats;
import fr.lapetina.agentnetwork.domain.model.TurnResult;
import fr.lapetina.agentnetwork.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.agentnetwork.orchestration.Orchestrator;
import fr.lapetina.agentnetwork.orchestration.exception.TurnFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /api/send_message - Run one turn for a user message
 * - GET /api/instances - Mother and workers
 * - GET /api/instance/{id} - One instance
 * - GET /api/network/stats - Aggregate network counters
 * - POST /api/clear - Reset the network
 * - GET /api/metrics - Rate limiter call statistics per endpoint
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String INITIALIZING_MESSAGE = "System is still initializing. Please try again in a moment.";
    static final String TIMEOUT_MESSAGE = "The request took too long to process. Please try again.";
    static final String FAILURE_MESSAGE = "Failed to process message";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Orchestrator orchestrator;
    private final RateLimiter rateLimiter;
    private final MetricsRegistry metricsRegistry;
    private final String providerName;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            Orchestrator orchestrator,
            RateLimiter rateLimiter,
            MetricsRegistry metricsRegistry,
            boolean metricsEnabled,
            String providerName
    ) throws IOException {
        this.orchestrator = orchestrator;
        this.rateLimiter = rateLimiter;
        this.metricsRegistry = metricsRegistry;
        this.providerName = providerName;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/api/send_message", new MessageHandler());
        server.createContext("/api", new NetworkHandler());
        server.createContext("/health", new HealthHandler());
        if (metricsEnabled) {
            server.createContext("/metrics", new MetricsHandler());
        }

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port; differs from the configured one when configured with 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== MESSAGE HANDLER ====================

    private class MessageHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                MessageRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, MessageRequest.class);
                } catch (JsonProcessingException e) {
                    log.warn("Malformed message request: {}", e.getOriginalMessage());
                    sendError(exchange, 400, "Request body must be a JSON object with a 'message' field");
                    return;
                }

                TurnResult result = orchestrator.submitUserMessage(request != null ? request.getMessage() : null);
                sendJson(exchange, 200, MessageResponse.fromTurnResult(result));

            } catch (TurnFailedException e) {
                int status = mapErrorToStatus(e.getErrorType());
                sendJson(exchange, status, new ErrorResponse(userMessageFor(e), e.getErrorType().name()));
            } catch (Exception e) {
                log.error("Error handling message request", e);
                sendError(exchange, 500, FAILURE_MESSAGE);
            } finally {
                MDC.remove("requestId");
            }
        }
    }

    static int mapErrorToStatus(ErrorType errorType) {
        return switch (errorType) {
            case VALIDATION_ERROR -> 400;
            case MOTHER_UNAVAILABLE -> 503;
            case TIMEOUT -> 504;
            default -> 500;
        };
    }

    static String userMessageFor(TurnFailedException e) {
        return switch (e.getErrorType()) {
            case VALIDATION_ERROR -> e.getMessage();
            case MOTHER_UNAVAILABLE -> INITIALIZING_MESSAGE;
            case TIMEOUT -> TIMEOUT_MESSAGE;
            default -> FAILURE_MESSAGE;
        };
    }

    // ==================== NETWORK HANDLER ====================

    private class NetworkHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();
            MDC.put("requestId", UUID.randomUUID().toString());

            try {
                if (path.equals("/api/instances") && "GET".equals(method)) {
                    sendJson(exchange, 200, orchestrator.listInstances());
                } else if (path.matches("/api/instance/[^/]+") && "GET".equals(method)) {
                    handleGetInstance(exchange, path);
                } else if (path.equals("/api/network/stats") && "GET".equals(method)) {
                    NetworkStats stats = orchestrator.networkStats();
                    sendJson(exchange, 200, stats);
                } else if (path.equals("/api/clear") && "POST".equals(method)) {
                    orchestrator.clear();
                    sendJson(exchange, 200, Map.of("success", true));
                } else if (path.equals("/api/metrics") && "GET".equals(method)) {
                    sendJson(exchange, 200, rateLimiter.getCallMetrics());
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in network handler: path={}", path, e);
                sendError(exchange, 500, "Internal server error");
            } finally {
                MDC.remove("requestId");
            }
        }

        private void handleGetInstance(HttpExchange exchange, String path) throws IOException {
            String id = path.substring("/api/instance/".length());
            Optional<InstanceView> instance = orchestrator.getInstance(id);
            if (instance.isEmpty()) {
                sendError(exchange, 404, "Instance not found: " + id);
                return;
            }
            sendJson(exchange, 200, instance.get());
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            NetworkStats stats = orchestrator.networkStats();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("provider", providerName);
            health.put("mother_status", stats.motherStatus());
            health.put("instance_count", stats.instanceCount());
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, ErrorResponse.of(message));
    }
}
