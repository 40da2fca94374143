package fr.lapetina.agentnetwork.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate counters for the live network.
 *
 * @param instanceCount  workers plus the mother, when present
 * @param totalMessages  sum of all output history sizes
 * @param uptimeSeconds  seconds since the current mother was created, 0 without one
 * @param motherStatus   {@code active} or {@code inactive}
 * @param turnCount      completed or failed turns since the last clear
 */
public record NetworkStats(
        @JsonProperty("instance_count") int instanceCount,
        @JsonProperty("total_messages") int totalMessages,
        @JsonProperty("uptime") long uptimeSeconds,
        @JsonProperty("mother_node_status") String motherStatus,
        @JsonProperty("turn_count") int turnCount
) {
}
