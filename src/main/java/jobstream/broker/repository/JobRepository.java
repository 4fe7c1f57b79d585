package jobstream.broker.repository;

import jobstream.broker.model.Job;
import jobstream.broker.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     * @throws IllegalStateException if a job with the same ID exists
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get a client's most recent jobs, newest first.
     *
     * @param clientId the client ID
     * @param limit    maximum results
     * @return list of jobs
     */
    List<Job> findByClient(String clientId, int limit);

    /**
     * Count all jobs registered by a client.
     *
     * @param clientId the client ID
     * @return number of jobs
     */
    int countByClient(String clientId);

    /**
     * Move the lifecycle checkpoint forward.
     * Applies only if {@code lastSeq} is greater than the stored checkpoint,
     * so stale or repeated updates are no-ops.
     *
     * @param jobId   the job ID
     * @param lastSeq seq of the last folded event
     * @param status  status after folding
     * @param closed  whether a done event has been folded
     * @return true if the row was updated
     */
    boolean advance(String jobId, long lastSeq, JobStatus status, boolean closed);

    /**
     * Reset the checkpoint to "nothing folded yet": seq 0, status started,
     * not closed. Used when the event log no longer holds the folded events.
     *
     * @param jobId the job ID
     */
    void rewind(String jobId);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
