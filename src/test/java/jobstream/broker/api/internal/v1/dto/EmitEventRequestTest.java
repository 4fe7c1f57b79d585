package jobstream.broker.api.internal.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import jobstream.broker.model.EventType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmitEventRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "type": "metric_update",
                  "payload": { "key": "tokens", "value": 1200, "unit": "tok" }
                }
                """;

        EmitEventRequest req = mapper.readValue(json, EmitEventRequest.class);

        assertEquals(EventType.METRIC_UPDATE, req.eventType());
        assertEquals("tokens", req.payload().get("key").asText());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void payloadIsOptional() throws Exception {
        EmitEventRequest req = mapper.readValue("{\"type\":\"done\"}", EmitEventRequest.class);

        assertNull(req.payload());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void validation() throws Exception {
        assertThrows(IllegalArgumentException.class, new EmitEventRequest(null, null)::validate);
        assertThrows(IllegalArgumentException.class, new EmitEventRequest("progress", null)::validate);
        assertThrows(IllegalArgumentException.class, new EmitEventRequest("heartbeat", null)::validate);

        EmitEventRequest arrayPayload = mapper.readValue("{\"type\":\"error\",\"payload\":[1,2]}",
                EmitEventRequest.class);
        assertThrows(IllegalArgumentException.class, arrayPayload::validate);
    }
}
