package jobstream.broker.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jobstream.broker.model.EventType;

/**
 * Request DTO for publishing one job event.
 * POST /internal/v1/jobs/{jobId}/events
 */
public record EmitEventRequest(
        @JsonProperty("type") String type,
        @JsonProperty("payload") JsonNode payload) {

    public void validate() {
        EventType eventType = eventType();
        if (eventType == EventType.HEARTBEAT) {
            throw new IllegalArgumentException("heartbeat cannot be published");
        }
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
    }

    /** Parsed type; throws IllegalArgumentException for unknown names */
    public EventType eventType() {
        return EventType.fromWire(type);
    }
}
