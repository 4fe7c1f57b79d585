package jobstream.broker.stream;

import jobstream.broker.config.BrokerConfig;
import jobstream.broker.service.JobLifecycleTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens stream sessions and owns the threads they borrow: a small pool for
 * blocking log reads and a single ticker for heartbeats and tail polls.
 */
public class StreamSessions implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamSessions.class);

    private final StreamManager streams;
    private final JobLifecycleTracker tracker;
    private final int batchSize;
    private final long heartbeatNanos;
    private final long pollMillis;

    private final ExecutorService replayPool;
    private final ScheduledExecutorService ticker;
    private final Set<StreamSession> open = ConcurrentHashMap.newKeySet();

    public StreamSessions(StreamManager streams, JobLifecycleTracker tracker, BrokerConfig config) {
        this.streams = streams;
        this.tracker = tracker;
        this.batchSize = Math.max(1, config.replayBatchSize());
        this.heartbeatNanos = config.heartbeatInterval().toNanos();
        this.pollMillis = Math.max(10, config.livePollInterval().toMillis());

        AtomicInteger threadIds = new AtomicInteger(1);
        this.replayPool = Executors.newFixedThreadPool(Math.max(1, config.replayThreads()), r -> {
            Thread t = new Thread(r, "jobstream-replay-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jobstream-stream-ticker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Attach a client to a job's stream after {@code cursor}. The caller has
     * already checked that the job exists.
     */
    public StreamSession open(String jobId, long cursor, EventSink sink) {
        StreamSession session = new StreamSession(jobId, cursor, sink, streams, tracker, replayPool, batchSize,
                heartbeatNanos, open::remove);
        open.add(session);
        ScheduledFuture<?> tick = ticker.scheduleAtFixedRate(session::tick, pollMillis, pollMillis,
                TimeUnit.MILLISECONDS);
        session.start(tick);
        log.debug("Opened stream for job {} after seq {} ({} open)", jobId, cursor, open.size());
        return session;
    }

    public int openCount() {
        return open.size();
    }

    public List<StreamSession> openSessions() {
        return List.copyOf(open);
    }

    @Override
    public void close() {
        for (StreamSession session : List.copyOf(open)) {
            session.onDisconnect();
        }
        ticker.shutdownNow();
        replayPool.shutdown();
        try {
            if (!replayPool.awaitTermination(5, TimeUnit.SECONDS)) {
                replayPool.shutdownNow();
                log.warn("Replay pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            replayPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stream sessions closed");
    }
}
