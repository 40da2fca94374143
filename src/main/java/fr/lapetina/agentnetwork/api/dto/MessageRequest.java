package fr.lapetina.agentnetwork.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /api/send_message}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageRequest {

    private String message;

    public MessageRequest() {
    }

    public MessageRequest(String message) {
        this.message = message;
    }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
