package jobstream.broker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.util.Json;

/**
 * One event as clients see it, in SSE {@code data:} lines and snapshots.
 * Heartbeat and closing records carry the session cursor as {@code seq}.
 */
@JsonPropertyOrder({ "job_id", "seq", "ts", "type", "payload" })
public record StreamRecord(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("seq") long seq,
        @JsonProperty("ts") long ts,
        @JsonProperty("type") String type,
        @JsonProperty("payload") JsonNode payload) {

    public static StreamRecord from(JobEvent event) {
        return new StreamRecord(event.jobId(), event.seq(), event.ts(), event.type().wireName(), event.payload());
    }

    public static StreamRecord heartbeat(String jobId, long cursor) {
        return new StreamRecord(jobId, cursor, System.currentTimeMillis(), EventType.HEARTBEAT.wireName(),
                Json.object());
    }

    public static StreamRecord done(String jobId, long cursor, JobStatus status) {
        return new StreamRecord(jobId, cursor, System.currentTimeMillis(), EventType.DONE.wireName(),
                Json.object().put("status", status.wireName()));
    }
}
