package fr.lapetina.agentnetwork.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every endpoint. {@code errorType} is omitted for transport errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        @JsonProperty("error_type") String errorType
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
