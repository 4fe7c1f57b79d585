package jobstream.broker.config;

import jobstream.broker.api.internal.v1.EventController;
import jobstream.broker.api.v1.HealthController;
import jobstream.broker.api.v1.JobController;
import jobstream.broker.api.v1.StreamEndpointController;
import jobstream.broker.repository.EventLogStore;
import jobstream.broker.repository.JobRepository;
import jobstream.broker.scheduler.Scheduler;
import jobstream.broker.scheduler.StreamSweeper;
import jobstream.broker.server.RouterHandler;
import jobstream.broker.service.JobLifecycleTracker;
import jobstream.broker.service.JobReporter;
import jobstream.broker.store.Database;
import jobstream.broker.store.InMemoryEventLogStore;
import jobstream.broker.store.JdbcEventLogStore;
import jobstream.broker.store.JdbcJobRepository;
import jobstream.broker.stream.RecentEventCache;
import jobstream.broker.stream.StreamManager;
import jobstream.broker.stream.StreamSessions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all broker dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(BrokerConfig.fromEnv());
 * deps.startScheduler(); // idle sweep
 * JobReporter reporter = deps.reporter(jobId);
 * // ... publish, serve streams ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final BrokerConfig config;
    private final Database database;
    private final EventLogStore eventLogStore;
    private final JobRepository jobRepository;
    private final RecentEventCache cache;
    private final JobLifecycleTracker tracker;
    private final StreamManager streamManager;
    private final StreamSessions streamSessions;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final StreamEndpointController streamController;
    private final EventController eventController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(BrokerConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.eventLogStore = config.eventLogBackend() == BrokerConfig.EventLogBackend.MEMORY
                ? new InMemoryEventLogStore()
                : new JdbcEventLogStore(database);
        this.jobRepository = new JdbcJobRepository(database);

        // Streaming
        this.cache = new RecentEventCache(config.cacheCapacity());
        this.tracker = new JobLifecycleTracker(jobRepository, eventLogStore);
        this.streamManager = new StreamManager(eventLogStore, cache, tracker, config.subscriberQueueCapacity());
        this.streamSessions = new StreamSessions(streamManager, tracker, config);

        // Controllers (public API)
        this.healthController = new HealthController(database, streamManager, streamSessions, config);
        this.jobController = new JobController(tracker, streamManager);
        this.streamController = new StreamEndpointController(tracker, streamSessions, config);

        // Controllers (internal API)
        this.eventController = new EventController(streamManager);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(BrokerConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(BrokerConfig.fromEnv());
    }

    // Getters
    public BrokerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public EventLogStore eventLogStore() {
        return eventLogStore;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public RecentEventCache cache() {
        return cache;
    }

    public JobLifecycleTracker tracker() {
        return tracker;
    }

    public StreamManager streamManager() {
        return streamManager;
    }

    public StreamSessions streamSessions() {
        return streamSessions;
    }

    /** Producer facade for one job. */
    public JobReporter reporter(String jobId) {
        return new JobReporter(streamManager, jobId);
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerStreamController(streamController)
                    .registerController(healthController)
                    .registerController(jobController)
                    .registerController(eventController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(new StreamSweeper(streamManager, tracker, config), config);
        }
        return scheduler;
    }

    /**
     * Start the background sweep of idle channels and cache rings.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            streamSessions.close();
        } catch (Exception e) {
            log.warn("Error closing stream sessions: {}", e.getMessage());
        }

        try {
            streamManager.close();
        } catch (Exception e) {
            log.warn("Error closing stream manager: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
