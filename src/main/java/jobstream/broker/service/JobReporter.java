package jobstream.broker.service;

import com.fasterxml.jackson.databind.JsonNode;
import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.repository.StoreUnavailableException;
import jobstream.broker.stream.StreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Producer-side facade bound to one job. Every call appends one event
 * (or, for the terminal helpers, a short closing sequence) through the
 * stream manager and returns the last stored event.
 */
public class JobReporter {

    private static final Logger log = LoggerFactory.getLogger(JobReporter.class);

    private final StreamManager streams;
    private final String jobId;

    public JobReporter(StreamManager streams, String jobId) {
        this.streams = streams;
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }

    public JobEvent emit(EventType type, JsonNode payload) {
        return streams.emit(jobId, type, payload);
    }

    public JobEvent started() {
        return status(JobStatus.STARTED);
    }

    public JobEvent running() {
        return status(JobStatus.RUNNING);
    }

    public JobEvent status(JobStatus status) {
        return emit(EventType.JOB_STATUS, EventPayloads.status(status));
    }

    public JobEvent progress(String step, double pct) {
        return progress(step, pct, null);
    }

    public JobEvent progress(String step, double pct, Double etaSec) {
        return emit(EventType.STEP_PROGRESS, EventPayloads.stepProgress(step, pct, etaSec));
    }

    public JobEvent insight(String id, String category, String importance, String message, String step) {
        return emit(EventType.INSIGHT_EMITTED, EventPayloads.insight(id, category, importance, message, step));
    }

    public JobEvent metric(String key, double value, String unit) {
        return emit(EventType.METRIC_UPDATE, EventPayloads.metric(key, value, unit));
    }

    public JobEvent validation(String ruleId, String status, String message) {
        return emit(EventType.VALIDATION_UPDATE, EventPayloads.validation(ruleId, status, message));
    }

    public JobEvent diffChunk(String section, String summary, String patchId) {
        return emit(EventType.DIFF_CHUNK, EventPayloads.diffChunk(section, summary, patchId));
    }

    public JobEvent agentStepStarted(String step, String agentName) {
        return emit(EventType.AGENT_STEP_STARTED, EventPayloads.agentStepStarted(step, agentName));
    }

    public JobEvent agentStepCompleted(String step, String agentName, int totalChars) {
        return emit(EventType.AGENT_STEP_COMPLETED, EventPayloads.agentStepCompleted(step, agentName, totalChars));
    }

    public JobEvent agentChunk(String step, String chunk, int seq, int totalLen) {
        return emit(EventType.AGENT_CHUNK, EventPayloads.agentChunk(step, chunk, seq, totalLen));
    }

    public JobEvent error(String code, String message) {
        return emit(EventType.ERROR, EventPayloads.error(code, message));
    }

    /** {@code job_status=completed} followed by {@code done}. */
    public JobEvent completed() {
        status(JobStatus.COMPLETED);
        return done();
    }

    /** {@code job_status=canceled} followed by {@code done}. */
    public JobEvent canceled() {
        status(JobStatus.CANCELED);
        return done();
    }

    public JobEvent done() {
        return emit(EventType.DONE, EventPayloads.empty());
    }

    /**
     * Report a failure: {@code error}, {@code job_status=failed}, {@code done}.
     * A job that is already terminal only gets its missing {@code done}.
     *
     * @throws StoreUnavailableException if the log cannot take the events
     */
    public JobEvent fail(String code, String message) {
        try {
            error(code, message);
            status(JobStatus.FAILED);
        } catch (JobClosedException e) {
            log.debug("Job {} already {}, only closing it", jobId, e.status().wireName());
        } catch (StoreUnavailableException e) {
            log.error("Could not record failure of job {}: {}", jobId, e.getMessage());
            throw e;
        }
        return done();
    }
}
