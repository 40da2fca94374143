package fr.lapetina.agentnetwork.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of an {@link Instance}, safe to hand to the HTTP layer.
 */
public record InstanceView(
        String id,
        String role,
        @JsonProperty("model_type") String modelType,
        String responsibility,
        String status,
        @JsonProperty("connected_to") List<String> connectedTo,
        @JsonProperty("output_history") List<String> outputHistory,
        @JsonProperty("created_at") Instant createdAt
) {
    public InstanceView {
        connectedTo = connectedTo != null ? List.copyOf(connectedTo) : List.of();
        outputHistory = outputHistory != null ? List.copyOf(outputHistory) : List.of();
    }
}
