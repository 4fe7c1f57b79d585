package jobstream.broker.model;

import java.util.Locale;

/**
 * Lifecycle status of a job.
 * Declaration order is the allowed direction of travel: a job may move
 * forward (or stay put) but never back, and terminal statuses are final.
 */
public enum JobStatus {
    /** Run registered by its producer */
    STARTED,
    /** Producer is working through its steps */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Finished with an error */
    FAILED,
    /** Stopped on request */
    CANCELED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    /** True if a job currently in this status may be moved to {@code next}. */
    public boolean canTransitionTo(JobStatus next) {
        if (isTerminal()) {
            return false;
        }
        return next.ordinal() >= ordinal();
    }

    /** Lowercase name used on the wire and in the database. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // the original pipeline spelled it both ways
        if ("CANCELLED".equals(normalized)) {
            return CANCELED;
        }
        try {
            return JobStatus.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown job status: " + value);
        }
    }
}
