package jobstream.broker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jobstream.broker.model.Job;

import java.time.Instant;

/**
 * Response DTO for job status.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("clientId") String clientId,
        @JsonProperty("status") String status,
        @JsonProperty("lastSeq") long lastSeq,
        @JsonProperty("terminal") boolean terminal,
        @JsonProperty("closed") boolean closed,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.clientId(),
                job.status().wireName(),
                job.lastSeq(),
                job.isTerminal(),
                job.closed(),
                job.createdAt(),
                job.updatedAt());
    }
}
