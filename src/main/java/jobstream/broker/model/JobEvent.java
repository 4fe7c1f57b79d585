package jobstream.broker.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * One immutable entry of a job's event log.
 * {@code seq} is assigned by the event log store and is the only ordering
 * authority; {@code ts} is the producer's clock and advisory. The payload is
 * a private copy: later changes to the producer's node do not reach it.
 *
 * @param jobId   owning job
 * @param seq     per-job sequence, gapless from 1
 * @param type    event type
 * @param payload JSON object, shape depends on {@code type}
 * @param ts      producer timestamp in epoch millis
 */
public record JobEvent(String jobId, long seq, EventType type, JsonNode payload, long ts) {

    public JobEvent {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(type, "type is required");
        if (seq < 1) {
            throw new IllegalArgumentException("seq must be positive: " + seq);
        }
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            payload = JsonNodeFactory.instance.objectNode();
        } else {
            payload = payload.deepCopy();
        }
    }

    /**
     * Status this event asks the job to move to, if it carries one.
     * A {@code done} event implies {@link JobStatus#COMPLETED}; the tracker
     * ignores that when the job is already terminal.
     */
    public Optional<JobStatus> lifecycleStatus() {
        if (type == EventType.DONE) {
            return Optional.of(JobStatus.COMPLETED);
        }
        if (type != EventType.JOB_STATUS) {
            return Optional.empty();
        }
        JsonNode status = payload.get("status");
        if (status == null || !status.isTextual()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JobStatus.fromWire(status.asText()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** True for {@code done} and for status changes into a terminal status. */
    public boolean isTerminalLifecycle() {
        return lifecycleStatus().map(JobStatus::isTerminal).orElse(false);
    }

    @Override
    public String toString() {
        return "JobEvent{jobId='" + jobId + "', seq=" + seq + ", type=" + type.wireName() + "}";
    }
}
