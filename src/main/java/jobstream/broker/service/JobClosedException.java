package jobstream.broker.service;

import jobstream.broker.model.EventType;
import jobstream.broker.model.JobStatus;

/**
 * The job has reached a terminal status (or already acknowledged it with
 * {@code done}) and does not accept the rejected event.
 */
public class JobClosedException extends RuntimeException {

    private final String jobId;
    private final JobStatus status;
    private final EventType rejected;

    public JobClosedException(String jobId, JobStatus status, EventType rejected) {
        super("Job " + jobId + " is " + status.wireName() + " and does not accept " + rejected.wireName());
        this.jobId = jobId;
        this.status = status;
        this.rejected = rejected;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }

    public EventType rejected() {
        return rejected;
    }
}
