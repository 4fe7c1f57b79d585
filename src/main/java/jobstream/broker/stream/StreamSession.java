package jobstream.broker.stream;

import jobstream.broker.model.EventType;
import jobstream.broker.model.Job;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.service.JobLifecycleTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One client attached to one job's stream, starting after a cursor.
 *
 * <pre>
 * CATCHING_UP  replay the durable log in batches
 * HANDOFF      live subscriber registered, confirming re-read in flight
 * LIVE         drain the subscriber queue, poll the log tail on every tick
 * TERMINAL     closing signal written, stream ended
 * DISCONNECTED transport gone or subscriber overrun, no closing signal
 * </pre>
 *
 * Every field below the constructor's is touched only on the sink's
 * executor. Store and tracker reads run on the replay executor and hop
 * back with their result, so a slow database never blocks the transport
 * thread. Delivery is deduplicated by seq: nothing at or below
 * {@code lastDelivered} is written twice, and a live event that would skip
 * a seq waits until the log fills the gap.
 */
public final class StreamSession implements SubscriberListener {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    public enum Phase {
        CATCHING_UP,
        HANDOFF,
        LIVE,
        TERMINAL,
        DISCONNECTED
    }

    private final String jobId;
    private final EventSink sink;
    private final StreamManager streams;
    private final JobLifecycleTracker tracker;
    private final Executor replayExecutor;
    private final int batchSize;
    private final long heartbeatNanos;
    private final Consumer<StreamSession> onEnd;
    private final AtomicBoolean drainPosted = new AtomicBoolean();

    private volatile Phase phase = Phase.CATCHING_UP;
    private volatile long lastDelivered;

    private Subscriber subscriber;
    private Future<?> ticker;
    private boolean readInFlight;
    private boolean readAgain;
    private boolean readBlocked;
    private boolean closeRequested;
    private EventType lastType;
    private long lastWriteNanos;
    private long delivered;

    StreamSession(String jobId, long cursor, EventSink sink, StreamManager streams, JobLifecycleTracker tracker,
            Executor replayExecutor, int batchSize, long heartbeatNanos, Consumer<StreamSession> onEnd) {
        this.jobId = jobId;
        this.lastDelivered = Math.max(0, cursor);
        this.sink = sink;
        this.streams = streams;
        this.tracker = tracker;
        this.replayExecutor = replayExecutor;
        this.batchSize = batchSize;
        this.heartbeatNanos = heartbeatNanos;
        this.onEnd = onEnd;
    }

    public String jobId() {
        return jobId;
    }

    public Phase phase() {
        return phase;
    }

    /** Highest seq written to the client. */
    public long lastDelivered() {
        return lastDelivered;
    }

    public boolean isFinished() {
        return phase == Phase.TERMINAL || phase == Phase.DISCONNECTED;
    }

    void start(Future<?> ticker) {
        post(() -> {
            this.ticker = ticker;
            if (isFinished()) {
                ticker.cancel(false);
                return;
            }
            lastWriteNanos = System.nanoTime();
            log.debug("Session for job {} starting after seq {}", jobId, lastDelivered);
            requestRead();
        });
    }

    /** Periodic heartbeat and live tail poll. */
    void tick() {
        post(this::onTick);
    }

    /** The transport drained below its low-water mark. */
    public void onWritable() {
        post(() -> {
            if (isFinished()) {
                return;
            }
            if (readBlocked) {
                readBlocked = false;
                requestRead();
            }
            drainQueue();
        });
    }

    /** The client went away. */
    public void onDisconnect() {
        post(() -> {
            if (!isFinished()) {
                log.debug("Client of job {} disconnected at seq {}", jobId, lastDelivered);
                end(Phase.DISCONNECTED);
            }
        });
    }

    @Override
    public void onEventsAvailable(Subscriber s) {
        if (drainPosted.compareAndSet(false, true)) {
            post(() -> {
                drainPosted.set(false);
                drainQueue();
            });
        }
    }

    @Override
    public void onClosed(Subscriber s, Subscriber.CloseReason reason) {
        post(() -> onSubscriberClosed(reason));
    }

    private void onSubscriberClosed(Subscriber.CloseReason reason) {
        if (isFinished()) {
            return;
        }
        switch (reason) {
            case OVERRUN -> {
                log.warn("Session for job {} fell behind at seq {}, closing so the client resumes from its cursor",
                        jobId, lastDelivered);
                subscriber = null;
                end(Phase.DISCONNECTED);
            }
            case JOB_CLOSED -> {
                subscriber = null;
                closeRequested = true;
                requestRead();
            }
            default -> {
                subscriber = null;
                end(Phase.DISCONNECTED);
            }
        }
    }

    private void onTick() {
        if (isFinished()) {
            return;
        }
        long now = System.nanoTime();
        if (now - lastWriteNanos >= heartbeatNanos && sink.isWritable()) {
            sink.sendHeartbeat(jobId, lastDelivered);
            lastWriteNanos = now;
        }
        if (phase == Phase.LIVE) {
            requestRead();
        }
    }

    private void requestRead() {
        if (isFinished()) {
            return;
        }
        if (readInFlight) {
            readAgain = true;
            return;
        }
        if (!sink.isWritable()) {
            readBlocked = true;
            return;
        }
        readInFlight = true;
        readAgain = false;
        long from = lastDelivered;
        try {
            replayExecutor.execute(() -> readStep(from));
        } catch (RejectedExecutionException e) {
            readInFlight = false;
            log.debug("Replay executor rejected read for job {}, ending session", jobId);
            end(Phase.DISCONNECTED);
        }
    }

    // runs on the replay executor
    private void readStep(long from) {
        List<JobEvent> batch = List.of();
        Job job = null;
        RuntimeException failure = null;
        try {
            batch = streams.readWindow(jobId, from, batchSize);
            if (batch.size() < batchSize) {
                job = tracker.getStatus(jobId);
            }
        } catch (RuntimeException e) {
            failure = e;
        }
        List<JobEvent> readBatch = batch;
        Job readJob = job;
        RuntimeException readFailure = failure;
        post(() -> onBatch(readBatch, readJob, readFailure));
    }

    private void onBatch(List<JobEvent> batch, Job job, RuntimeException failure) {
        readInFlight = false;
        if (isFinished()) {
            return;
        }
        if (failure != null) {
            log.warn("Read for job {} after seq {} failed, ending stream: {}", jobId, lastDelivered,
                    failure.getMessage());
            end(Phase.DISCONNECTED);
            return;
        }

        for (JobEvent event : batch) {
            deliver(event);
            if (isFinished()) {
                return;
            }
        }

        if (batch.size() >= batchSize) {
            requestRead();
            return;
        }

        if (job.isTerminal() || closeRequested) {
            if (lastDelivered >= job.lastSeq()) {
                finish(job.status());
            } else {
                requestRead();
            }
            return;
        }

        switch (phase) {
            case CATCHING_UP -> {
                subscriber = streams.subscribe(jobId, lastDelivered, this);
                setPhase(Phase.HANDOFF);
                requestRead();
                return;
            }
            case HANDOFF -> setPhase(Phase.LIVE);
            default -> {
            }
        }

        drainQueue();
        if (readAgain && !readInFlight) {
            requestRead();
        }
    }

    private void drainQueue() {
        if (phase != Phase.LIVE || subscriber == null) {
            return;
        }
        while (sink.isWritable()) {
            JobEvent next = subscriber.peek();
            if (next == null) {
                return;
            }
            if (next.seq() > lastDelivered + 1) {
                requestRead();
                return;
            }
            subscriber.poll();
            deliver(next);
            if (isFinished()) {
                return;
            }
        }
    }

    private void deliver(JobEvent event) {
        if (event.seq() <= lastDelivered) {
            return;
        }
        sink.send(event);
        lastDelivered = event.seq();
        lastType = event.type();
        lastWriteNanos = System.nanoTime();
        delivered++;

        if (event.type() == EventType.DONE) {
            finish(JobStatus.COMPLETED);
        } else if (event.isTerminalLifecycle()) {
            requestRead();
        }
    }

    private void finish(JobStatus status) {
        if (lastType != EventType.DONE) {
            sink.sendDone(jobId, lastDelivered, status);
        }
        end(Phase.TERMINAL);
    }

    private void end(Phase terminalPhase) {
        setPhase(terminalPhase);
        if (ticker != null) {
            ticker.cancel(false);
        }
        if (subscriber != null) {
            streams.unsubscribe(subscriber);
            subscriber = null;
        }
        sink.close();
        log.debug("Session for job {} ended {} after {} event(s), last seq {}", jobId, terminalPhase, delivered,
                lastDelivered);
        onEnd.accept(this);
    }

    private void setPhase(Phase next) {
        if (phase != next) {
            log.debug("Session for job {}: {} -> {}", jobId, phase, next);
            phase = next;
        }
    }

    private void post(Runnable task) {
        try {
            sink.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Transport executor for job {} is gone: {}", jobId, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "StreamSession{jobId='" + jobId + "', phase=" + phase + ", lastDelivered=" + lastDelivered + "}";
    }
}
