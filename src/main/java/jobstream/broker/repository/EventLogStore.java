package jobstream.broker.repository;

import com.fasterxml.jackson.databind.JsonNode;
import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;

import java.util.List;

/**
 * Durable, append-only event log keyed by job id and sequence number.
 * This is the single source of truth for what a job has published.
 */
public interface EventLogStore {

    /**
     * Append an event, assigning the next sequence number for the job.
     * The event is durable when this returns. Appends to the same job are
     * serialized; appends to different jobs may run concurrently.
     *
     * @param jobId   the job ID
     * @param type    event type
     * @param payload JSON payload
     * @param ts      producer timestamp (epoch millis)
     * @return the stored event with its assigned seq
     * @throws StoreUnavailableException on I/O failure
     */
    JobEvent append(String jobId, EventType type, JsonNode payload, long ts);

    /**
     * Read events with {@code seq > afterSeq} in ascending order.
     * An unknown job or a job with no newer events yields an empty list.
     *
     * @param jobId    the job ID
     * @param afterSeq exclusive lower bound
     * @param limit    maximum results
     * @return ordered events
     * @throws StoreUnavailableException on I/O failure
     */
    List<JobEvent> read(String jobId, long afterSeq, int limit);

    /**
     * Highest seq appended for the job, or 0 when there is none.
     */
    long lastSeq(String jobId);
}
