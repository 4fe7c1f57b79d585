package jobstream.broker.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one tracked pipeline run.
 * {@code lastSeq} is the checkpoint of the lifecycle projection: the seq of
 * the last log event folded into {@code status}.
 */
public final class Job {
    private final String id;
    private final String clientId;
    private final JobStatus status;
    private final long lastSeq;
    private final boolean closed; // a done event has been folded
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.clientId = builder.clientId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastSeq = builder.lastSeq;
        this.closed = builder.closed;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String clientId() {
        return clientId;
    }

    public JobStatus status() {
        return status;
    }

    public long lastSeq() {
        return lastSeq;
    }

    public boolean closed() {
        return closed;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Whether the producer may still append an event of the given type.
     * A terminal job takes exactly one trailing {@code done} acknowledgement.
     */
    public boolean accepts(EventType type) {
        if (closed) {
            return false;
        }
        return !isTerminal() || type == EventType.DONE;
    }

    /**
     * Fold one log event into this view.
     * Events at or below the checkpoint are ignored, so folding is idempotent.
     */
    public Job fold(JobEvent event) {
        if (event.seq() <= lastSeq) {
            return this;
        }
        JobStatus next = status;
        var requested = event.lifecycleStatus();
        if (requested.isPresent() && status.canTransitionTo(requested.get())) {
            next = requested.get();
        }
        return toBuilder()
                .status(next)
                .lastSeq(event.seq())
                .closed(closed || event.type() == EventType.DONE)
                .updatedAt(Instant.now())
                .build();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .clientId(clientId)
                .status(status)
                .lastSeq(lastSeq)
                .closed(closed)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String clientId;
        private JobStatus status = JobStatus.STARTED;
        private long lastSeq;
        private boolean closed;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastSeq(long lastSeq) {
            this.lastSeq = lastSeq;
            return this;
        }

        public Builder closed(boolean closed) {
            this.closed = closed;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", lastSeq=" + lastSeq + "}";
    }
}
