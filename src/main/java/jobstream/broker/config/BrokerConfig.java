package jobstream.broker.config;

import java.time.Duration;

/**
 * Configuration holder for broker settings.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them
 * from JOBSTREAM_* environment variables.
 */
public final class BrokerConfig {

    /**
     * Which event log implementation backs the broker.
     * {@code MEMORY} keeps events in this process only: use it for tests and
     * single-run deployments. Job rows still go to the database, so a restart
     * against a file database finds checkpoints its log no longer holds; the
     * tracker then rebuilds those jobs from the (empty) log.
     */
    public enum EventLogBackend {
        JDBC,
        MEMORY
    }

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/jobstream;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    private int databasePoolSize = 10;
    private EventLogBackend eventLogBackend = EventLogBackend.JDBC;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private int writeBufferLowWaterMark = 32 * 1024;
    private int writeBufferHighWaterMark = 64 * 1024;

    // Stream settings
    private int cacheCapacity = 256;
    private int subscriberQueueCapacity = 100;
    private int replayBatchSize = 200;
    private int replayThreads = 4;
    private Duration heartbeatInterval = Duration.ofSeconds(15);
    private Duration livePollInterval = Duration.ofMillis(1000);
    private int ssePaddingBytes = 2048;
    private Duration sseRetry = Duration.ofMillis(3000);

    // Sweeper settings
    private Duration sweepInterval = Duration.ofSeconds(30);
    private Duration idleChannelTtl = Duration.ofMinutes(5);

    // Auth settings (optional)
    private String producerKey = null; // If set, producers must provide X-Jobstream-Key header

    private BrokerConfig() {
    }

    public static BrokerConfig defaults() {
        return new BrokerConfig();
    }

    public static BrokerConfig fromEnv() {
        BrokerConfig config = new BrokerConfig();

        String dbUrl = System.getenv("JOBSTREAM_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("JOBSTREAM_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String producerKey = System.getenv("JOBSTREAM_PRODUCER_KEY");
        if (producerKey != null && !producerKey.isBlank()) {
            config.producerKey = producerKey;
        }

        String backend = System.getenv("JOBSTREAM_EVENT_LOG");
        if (backend != null && !backend.isBlank()) {
            config.eventLogBackend = EventLogBackend.valueOf(backend.trim().toUpperCase());
        }

        String cache = System.getenv("JOBSTREAM_CACHE_CAPACITY");
        if (cache != null && !cache.isBlank()) {
            config.cacheCapacity = Integer.parseInt(cache);
        }

        String queue = System.getenv("JOBSTREAM_QUEUE_CAPACITY");
        if (queue != null && !queue.isBlank()) {
            config.subscriberQueueCapacity = Integer.parseInt(queue);
        }

        String batch = System.getenv("JOBSTREAM_REPLAY_BATCH");
        if (batch != null && !batch.isBlank()) {
            config.replayBatchSize = Integer.parseInt(batch);
        }

        String heartbeat = System.getenv("JOBSTREAM_HEARTBEAT_SECONDS");
        if (heartbeat != null && !heartbeat.isBlank()) {
            config.heartbeatInterval = Duration.ofSeconds(Long.parseLong(heartbeat));
        }

        String poll = System.getenv("JOBSTREAM_POLL_MILLIS");
        if (poll != null && !poll.isBlank()) {
            config.livePollInterval = Duration.ofMillis(Long.parseLong(poll));
        }

        String padding = System.getenv("JOBSTREAM_SSE_PADDING");
        if (padding != null && !padding.isBlank()) {
            config.ssePaddingBytes = Integer.parseInt(padding);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public EventLogBackend eventLogBackend() {
        return eventLogBackend;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int writeBufferLowWaterMark() {
        return writeBufferLowWaterMark;
    }

    public int writeBufferHighWaterMark() {
        return writeBufferHighWaterMark;
    }

    public int cacheCapacity() {
        return cacheCapacity;
    }

    public int subscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public int replayBatchSize() {
        return replayBatchSize;
    }

    public int replayThreads() {
        return replayThreads;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration livePollInterval() {
        return livePollInterval;
    }

    public int ssePaddingBytes() {
        return ssePaddingBytes;
    }

    public Duration sseRetry() {
        return sseRetry;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public Duration idleChannelTtl() {
        return idleChannelTtl;
    }

    public String producerKey() {
        return producerKey;
    }

    public boolean hasProducerKey() {
        return producerKey != null && !producerKey.isBlank();
    }

    // Fluent setters for testing/customization
    public BrokerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public BrokerConfig withEventLogBackend(EventLogBackend backend) {
        this.eventLogBackend = backend;
        return this;
    }

    public BrokerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public BrokerConfig withProducerKey(String key) {
        this.producerKey = key;
        return this;
    }

    public BrokerConfig withCacheCapacity(int capacity) {
        this.cacheCapacity = capacity;
        return this;
    }

    public BrokerConfig withSubscriberQueueCapacity(int capacity) {
        this.subscriberQueueCapacity = capacity;
        return this;
    }

    public BrokerConfig withReplayBatchSize(int batchSize) {
        this.replayBatchSize = batchSize;
        return this;
    }

    public BrokerConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public BrokerConfig withLivePollInterval(Duration interval) {
        this.livePollInterval = interval;
        return this;
    }

    public BrokerConfig withSsePaddingBytes(int bytes) {
        this.ssePaddingBytes = bytes;
        return this;
    }

    public BrokerConfig withIdleChannelTtl(Duration ttl) {
        this.idleChannelTtl = ttl;
        return this;
    }

    @Override
    public String toString() {
        return "BrokerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", eventLog=" + eventLogBackend +
                ", serverPort=" + serverPort +
                ", cacheCapacity=" + cacheCapacity +
                ", queueCapacity=" + subscriberQueueCapacity +
                ", replayBatch=" + replayBatchSize +
                ", heartbeat=" + heartbeatInterval +
                ", producerKeySet=" + hasProducerKey() +
                '}';
    }
}
