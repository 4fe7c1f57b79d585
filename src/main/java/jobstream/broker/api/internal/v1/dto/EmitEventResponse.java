package jobstream.broker.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jobstream.broker.model.JobEvent;

/**
 * Response for a stored event.
 */
public record EmitEventResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("seq") long seq,
        @JsonProperty("ts") long ts) {

    public static EmitEventResponse from(JobEvent event) {
        return new EmitEventResponse(true, event.jobId(), event.seq(), event.ts());
    }
}
