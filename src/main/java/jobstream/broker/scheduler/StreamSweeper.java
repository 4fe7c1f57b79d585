package jobstream.broker.scheduler;

import jobstream.broker.config.BrokerConfig;
import jobstream.broker.service.JobLifecycleTracker;
import jobstream.broker.stream.StreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Background task that releases per-job streaming state nobody uses:
 * - closed subscribers still listed on a job channel
 * - job channels with no subscribers and no emits for the idle TTL
 * - recent-event cache rings untouched for the idle TTL
 * - folded tracker views of finished jobs and of jobs idle for the TTL
 */
public class StreamSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamSweeper.class);

    private final StreamManager streamManager;
    private final JobLifecycleTracker tracker;
    private final BrokerConfig config;

    public StreamSweeper(StreamManager streamManager, JobLifecycleTracker tracker, BrokerConfig config) {
        this.streamManager = streamManager;
        this.tracker = tracker;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Stream sweeper error", e);
        }
    }

    /**
     * @return number of job channels retired
     */
    public int sweep() {
        Instant cutoff = Instant.now().minus(config.idleChannelTtl());

        int retired = streamManager.sweep(cutoff);
        int forgotten = tracker.evictIdle(cutoff);

        if (retired > 0 || forgotten > 0) {
            log.info("Stream sweeper: {} idle channel(s) retired, {} job view(s) dropped", retired, forgotten);
        } else {
            log.debug("Stream sweeper: nothing idle");
        }
        return retired;
    }
}
