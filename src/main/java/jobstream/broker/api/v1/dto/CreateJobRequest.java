package jobstream.broker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.regex.Pattern;

/**
 * Request DTO for registering a job.
 * POST /api/v1/jobs
 * Both fields are optional; an id is generated when none is given.
 */
public record CreateJobRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("clientId") String clientId) {

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,128}$");

    /** Empty body means "generate everything" */
    public static CreateJobRequest empty() {
        return new CreateJobRequest(null, null);
    }

    /** Validate the request */
    public void validate() {
        if (jobId != null && !ID_PATTERN.matcher(jobId).matches()) {
            throw new IllegalArgumentException("jobId must be 1-128 characters of [A-Za-z0-9._-]");
        }
        if (clientId != null && clientId.length() > 128) {
            throw new IllegalArgumentException("clientId must be at most 128 characters");
        }
    }
}
