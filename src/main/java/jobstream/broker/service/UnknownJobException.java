package jobstream.broker.service;

/**
 * A job id that was never registered.
 */
public class UnknownJobException extends RuntimeException {

    private final String jobId;

    public UnknownJobException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
