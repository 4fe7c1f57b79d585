package jobstream.broker.model;

/**
 * Closed set of event types a job stream can carry.
 */
public enum EventType {
    JOB_STATUS("job_status"),
    STEP_PROGRESS("step_progress"),
    INSIGHT_EMITTED("insight_emitted"),
    METRIC_UPDATE("metric_update"),
    VALIDATION_UPDATE("validation_update"),
    DIFF_CHUNK("diff_chunk"),
    ERROR("error"),
    /** Transport keep-alive, generated by stream sessions and never logged */
    HEARTBEAT("heartbeat"),
    /** Final event of a job; also the closing signal of a stream */
    DONE("done"),
    AGENT_STEP_STARTED("agent_step_started"),
    AGENT_STEP_COMPLETED("agent_step_completed"),
    AGENT_CHUNK("agent_chunk");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Types whose events can move the job's lifecycle status. */
    public boolean isLifecycle() {
        return this == JOB_STATUS || this == DONE;
    }

    public static EventType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("event type is required");
        }
        for (EventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown event type: " + value);
    }
}
