package fr.lapetina.agentnetwork.infrastructure.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only call statistics for one rate-limited endpoint.
 *
 * {@code successRate} is the percentage of finished calls that succeeded, retries included in the
 * call they belong to; it is 100 before any call finished. {@code callsLastMinute} counts attempts.
 */
public record EndpointMetrics(
        String endpoint,
        @JsonProperty("total_calls") long totalCalls,
        @JsonProperty("successful_calls") long successfulCalls,
        @JsonProperty("failed_calls") long failedCalls,
        @JsonProperty("success_rate") double successRate,
        @JsonProperty("calls_last_minute") long callsLastMinute,
        long retries,
        @JsonProperty("rate_limit_hits") long rateLimitHits,
        @JsonProperty("total_wait_seconds") double totalWaitSeconds
) {
}
