package fr.lapetina.agentnetwork.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.agentnetwork.domain.model.InstanceListing;
import fr.lapetina.agentnetwork.domain.model.TurnResult;

import java.util.List;

/**
 * Response of {@code POST /api/send_message}.
 */
public record MessageResponse(
        String response,
        InstanceListing instances,
        List<String> warnings,
        boolean degraded,
        @JsonProperty("turn_id") String turnId
) {
    /**
     * Converts from the orchestrator's turn result.
     */
    public static MessageResponse fromTurnResult(TurnResult result) {
        return new MessageResponse(
                result.finalResponse(),
                result.listing(),
                result.warnings(),
                result.degraded(),
                result.turnId());
    }
}
