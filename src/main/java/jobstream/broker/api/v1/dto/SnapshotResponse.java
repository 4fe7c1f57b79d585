package jobstream.broker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jobstream.broker.model.Job;
import jobstream.broker.model.JobEvent;

import java.util.List;

/**
 * Response DTO for a job snapshot: current status plus one page of events.
 * GET /api/v1/jobs/{jobId}/snapshot?after=N&limit=M
 */
public record SnapshotResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("lastSeq") long lastSeq,
        @JsonProperty("events") List<StreamRecord> events,
        @JsonProperty("eventCount") int eventCount,
        @JsonProperty("hasMore") boolean hasMore) {

    public static SnapshotResponse of(Job job, List<JobEvent> events) {
        List<StreamRecord> records = events.stream()
                .map(StreamRecord::from)
                .toList();
        long lastReturned = events.isEmpty() ? 0 : events.get(events.size() - 1).seq();
        return new SnapshotResponse(
                job.id(),
                job.status().wireName(),
                job.lastSeq(),
                records,
                records.size(),
                lastReturned < job.lastSeq() && !events.isEmpty());
    }
}
