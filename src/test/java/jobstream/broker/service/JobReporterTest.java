package jobstream.broker.service;

import jobstream.broker.config.BrokerConfig;
import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.store.Database;
import jobstream.broker.store.InMemoryEventLogStore;
import jobstream.broker.store.JdbcJobRepository;
import jobstream.broker.stream.RecentEventCache;
import jobstream.broker.stream.StreamManager;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobReporterTest {

    private static Database db;
    private static JdbcJobRepository jobs;

    private InMemoryEventLogStore store;
    private JobLifecycleTracker tracker;
    private StreamManager manager;

    @BeforeAll
    static void setup() {
        db = new Database(BrokerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reporter;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        jobs = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void wire() {
        store = new InMemoryEventLogStore();
        tracker = new JobLifecycleTracker(jobs, store);
        manager = new StreamManager(store, new RecentEventCache(16), tracker, 16);
    }

    @AfterEach
    void unwire() {
        manager.close();
    }

    private JobReporter reporter() {
        return new JobReporter(manager, tracker.register(null, null).id());
    }

    private List<EventType> types(String jobId) {
        return store.read(jobId, 0, 100).stream().map(JobEvent::type).toList();
    }

    @Test
    void progressPayload() {
        JobReporter job = reporter();

        JobEvent event = job.progress("analyze", 42.5, 12.0);

        assertEquals(1, event.seq());
        assertEquals(EventType.STEP_PROGRESS, event.type());
        assertEquals("analyze", event.payload().get("step").asText());
        assertEquals(42.5, event.payload().get("pct").asDouble());
        assertEquals(12.0, event.payload().get("eta_sec").asDouble());
    }

    @Test
    void completedAppendsStatusThenDone() {
        JobReporter job = reporter();
        job.running();

        JobEvent last = job.completed();

        assertEquals(EventType.DONE, last.type());
        assertEquals(List.of(EventType.JOB_STATUS, EventType.JOB_STATUS, EventType.DONE), types(job.jobId()));
        assertEquals(JobStatus.COMPLETED, tracker.getStatus(job.jobId()).status());
        assertTrue(tracker.getStatus(job.jobId()).closed());
    }

    @Test
    void failAppendsErrorStatusAndDone() {
        JobReporter job = reporter();
        job.running();

        job.fail("timeout", "model did not answer");

        List<JobEvent> events = store.read(job.jobId(), 0, 100);
        assertEquals(List.of(EventType.JOB_STATUS, EventType.ERROR, EventType.JOB_STATUS, EventType.DONE),
                types(job.jobId()));
        assertEquals("timeout", events.get(1).payload().get("code").asText());
        assertEquals("failed", events.get(2).payload().get("status").asText());
        assertEquals(JobStatus.FAILED, tracker.getStatus(job.jobId()).status());
    }

    @Test
    @DisplayName("Failing a job that already ended only adds the missing done")
    void failOnTerminalJobOnlyCloses() {
        JobReporter job = reporter();
        job.status(JobStatus.CANCELED);

        job.fail("late", "worker crashed after cancel");

        assertEquals(List.of(EventType.JOB_STATUS, EventType.DONE), types(job.jobId()));
        assertEquals(JobStatus.CANCELED, tracker.getStatus(job.jobId()).status());
    }

    @Test
    void closedJobRejectsFurtherEvents() {
        JobReporter job = reporter();
        job.canceled();

        JobClosedException e = assertThrows(JobClosedException.class, () -> job.progress("late", 1));
        assertEquals(JobStatus.CANCELED, e.status());
        assertEquals(EventType.STEP_PROGRESS, e.rejected());
        assertThrows(JobClosedException.class, job::done);
    }
}
