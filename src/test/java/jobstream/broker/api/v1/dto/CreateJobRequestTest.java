package jobstream.broker.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CreateJobRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "jobId": "run-2024.06_a",
                  "clientId": "portal"
                }
                """;

        CreateJobRequest req = mapper.readValue(json, CreateJobRequest.class);

        assertEquals("run-2024.06_a", req.jobId());
        assertEquals("portal", req.clientId());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void emptyBodyIsValid() throws Exception {
        CreateJobRequest req = mapper.readValue("{}", CreateJobRequest.class);

        assertNull(req.jobId());
        assertDoesNotThrow(req::validate);
        assertDoesNotThrow(CreateJobRequest.empty()::validate);
    }

    @Test
    void rejectsBadIds() {
        assertThrows(IllegalArgumentException.class, new CreateJobRequest("", null)::validate);
        assertThrows(IllegalArgumentException.class, new CreateJobRequest("has space", null)::validate);
        assertThrows(IllegalArgumentException.class, new CreateJobRequest("a/b", null)::validate);
        assertThrows(IllegalArgumentException.class, new CreateJobRequest("x".repeat(129), null)::validate);
        assertThrows(IllegalArgumentException.class, new CreateJobRequest(null, "c".repeat(129))::validate);
    }
}
