package fr.lapetina.agentnetwork.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Outcome of one routed message: the worker's text or an explicit failure marker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerOutput(
        String role,
        @JsonProperty("instance_id") String instanceId,
        String text,
        @JsonProperty("error_type") ErrorType errorType,
        @JsonProperty("error_message") String errorMessage
) {
    public WorkerOutput {
        Objects.requireNonNull(role, "Role is required");
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isFailure() {
        return errorType != null;
    }

    /**
     * Text used when the output is embedded in a prompt or degraded response.
     */
    public String displayText() {
        if (isSuccess()) {
            return text;
        }
        return "[instance failed to respond: " + errorType + "]";
    }

    public static WorkerOutput success(String role, String instanceId, String text) {
        return new WorkerOutput(role, instanceId, Objects.requireNonNull(text), null, null);
    }

    public static WorkerOutput failure(String role, String instanceId, ErrorType errorType, String errorMessage) {
        return new WorkerOutput(role, instanceId, null, Objects.requireNonNull(errorType), errorMessage);
    }
}
