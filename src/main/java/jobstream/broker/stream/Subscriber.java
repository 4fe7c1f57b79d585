package jobstream.broker.stream;

import jobstream.broker.model.JobEvent;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local live registration for one client connection.
 *
 * Holds a bounded delivery queue filled by the stream manager's fan-out.
 * Offers never block: a full queue marks the subscriber overrun and closes
 * it, and the client recovers by re-attaching with its last cursor.
 */
public final class Subscriber {

    /** Why a subscriber stopped receiving events. */
    public enum CloseReason {
        /** Unsubscribed by its own session */
        UNSUBSCRIBED,
        /** Delivery queue was full when an event arrived */
        OVERRUN,
        /** The manager closed all subscribers of the job */
        JOB_CLOSED,
        /** The manager is shutting down */
        SHUTDOWN
    }

    private enum State {
        OPEN,
        CLOSED
    }

    private static final AtomicLong ID_GEN = new AtomicLong(1);

    private final long id = ID_GEN.getAndIncrement();
    private final String jobId;
    private final ArrayBlockingQueue<JobEvent> queue;
    private final SubscriberListener listener;
    private final AtomicLong cursor;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private volatile CloseReason closeReason;

    Subscriber(String jobId, long afterSeq, int queueCapacity, SubscriberListener listener) {
        this.jobId = jobId;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.listener = listener;
        this.cursor = new AtomicLong(afterSeq);
    }

    public long id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    /** Highest seq handed to this subscriber (or its starting cursor). */
    public long cursor() {
        return cursor.get();
    }

    public boolean isLive() {
        return state.get() == State.OPEN;
    }

    public CloseReason closeReason() {
        return closeReason;
    }

    /** Next queued event, or null. */
    public JobEvent poll() {
        return queue.poll();
    }

    /** Next queued event without removing it, or null. */
    public JobEvent peek() {
        return queue.peek();
    }

    public int queued() {
        return queue.size();
    }

    /**
     * Queue an event without blocking. Seqs at or below the cursor are
     * already covered and accepted as no-ops.
     *
     * @return false if the subscriber is closed or was overrun by this offer
     */
    boolean offer(JobEvent event) {
        if (!isLive()) {
            return false;
        }
        if (event.seq() <= cursor.get()) {
            return true;
        }
        if (!queue.offer(event)) {
            close(CloseReason.OVERRUN);
            return false;
        }
        cursor.set(event.seq());
        listener.onEventsAvailable(this);
        return true;
    }

    /**
     * Close once; later calls are no-ops. The listener hears about every
     * reason except its own unsubscribe.
     */
    boolean close(CloseReason reason) {
        if (!state.compareAndSet(State.OPEN, State.CLOSED)) {
            return false;
        }
        closeReason = reason;
        queue.clear();
        if (reason != CloseReason.UNSUBSCRIBED) {
            listener.onClosed(this, reason);
        }
        return true;
    }

    @Override
    public String toString() {
        return "Subscriber{id=" + id + ", jobId='" + jobId + "', cursor=" + cursor.get() + ", state=" + state.get() + "}";
    }
}
