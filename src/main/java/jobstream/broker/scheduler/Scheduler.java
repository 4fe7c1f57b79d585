package jobstream.broker.scheduler;

import jobstream.broker.config.BrokerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the broker's background housekeeping on one thread.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StreamSweeper streamSweeper;
    private final BrokerConfig config;

    private volatile boolean running = false;

    public Scheduler(StreamSweeper streamSweeper, BrokerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jobstream-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.streamSweeper = streamSweeper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long sweepIntervalMs = config.sweepInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("stream-sweeper", streamSweeper),
                sweepIntervalMs,
                sweepIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Stream sweeper scheduled every {}ms", sweepIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the stream sweeper for direct access (e.g., manual trigger).
     */
    public StreamSweeper streamSweeper() {
        return streamSweeper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
