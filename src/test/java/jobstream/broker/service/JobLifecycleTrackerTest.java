package jobstream.broker.service;

import jobstream.broker.config.BrokerConfig;
import jobstream.broker.model.EventType;
import jobstream.broker.model.Job;
import jobstream.broker.model.JobStatus;
import jobstream.broker.store.Database;
import jobstream.broker.store.InMemoryEventLogStore;
import jobstream.broker.store.JdbcEventLogStore;
import jobstream.broker.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobLifecycleTrackerTest {

    private static Database db;
    private static JdbcEventLogStore store;
    private static JdbcJobRepository jobs;

    private JobLifecycleTracker tracker;

    @BeforeAll
    static void setup() {
        db = new Database(BrokerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-tracker;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        store = new JdbcEventLogStore(db);
        jobs = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void freshTracker() {
        tracker = new JobLifecycleTracker(jobs, store);
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    @Test
    void registerStartsInStarted() {
        Job job = tracker.register("reg-" + System.nanoTime(), "client-a");

        assertEquals(JobStatus.STARTED, job.status());
        assertEquals(0, job.lastSeq());
        assertFalse(job.closed());
        assertEquals("client-a", tracker.getStatus(job.id()).clientId());
    }

    @Test
    void registerGeneratesIdWhenMissing() {
        Job job = tracker.register(null, null);

        assertNotNull(job.id());
        assertFalse(job.id().isBlank());
        assertTrue(tracker.find(job.id()).isPresent());
    }

    @Test
    void registerRejectsDuplicateId() {
        String id = "dup-" + System.nanoTime();
        tracker.register(id, null);

        assertThrows(IllegalStateException.class, () -> tracker.register(id, null));
    }

    @Test
    void unknownJob() {
        assertEquals(Optional.empty(), tracker.find("missing-job"));
        UnknownJobException e = assertThrows(UnknownJobException.class, () -> tracker.getStatus("missing-job"));
        assertEquals("missing-job", e.jobId());
    }

    @Test
    @DisplayName("Status folds events another process appended to the log")
    void foldsTailWrittenElsewhere() {
        String id = tracker.register("fold-" + System.nanoTime(), null).id();

        store.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.RUNNING), now());
        store.append(id, EventType.STEP_PROGRESS, EventPayloads.stepProgress("plan", 40, null), now());

        Job running = tracker.getStatus(id);
        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals(2, running.lastSeq());

        store.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.COMPLETED), now());
        JobLifecycleTracker other = new JobLifecycleTracker(jobs, store);
        Job completed = other.getStatus(id);
        assertEquals(JobStatus.COMPLETED, completed.status());
        assertTrue(completed.isTerminal());
        assertFalse(completed.closed());
    }

    @Test
    void observeMovesCheckpoint() {
        String id = tracker.register("observe-" + System.nanoTime(), null).id();

        tracker.observe(store.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.RUNNING), now()));
        tracker.observe(store.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.CANCELED), now()));
        tracker.observe(store.append(id, EventType.DONE, EventPayloads.empty(), now()));

        Job stored = jobs.findById(id).orElseThrow();
        assertEquals(3, stored.lastSeq());
        assertEquals(JobStatus.CANCELED, stored.status());
        assertTrue(stored.closed());
    }

    @Test
    void illegalTransitionIsIgnored() {
        String id = tracker.register("illegal-" + System.nanoTime(), null).id();

        tracker.observe(store.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.FAILED), now()));
        tracker.observe(store.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.RUNNING), now()));

        Job job = tracker.getStatus(id);
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(2, job.lastSeq());
    }

    @Test
    @DisplayName("Finished and idle views are dropped, recent open ones stay")
    void evictIdleDropsFinishedAndStaleViews() throws Exception {
        String stale = tracker.register("stale-" + System.nanoTime(), null).id();
        Thread.sleep(20);
        Instant cutoff = Instant.now();

        String open = tracker.register("open-" + System.nanoTime(), null).id();
        String failed = tracker.register("failed-" + System.nanoTime(), null).id();
        tracker.observe(store.append(failed, EventType.JOB_STATUS, EventPayloads.status(JobStatus.FAILED), now()));
        String closed = tracker.register("closed-" + System.nanoTime(), null).id();
        tracker.observe(store.append(closed, EventType.JOB_STATUS, EventPayloads.status(JobStatus.COMPLETED), now()));
        tracker.observe(store.append(closed, EventType.DONE, EventPayloads.empty(), now()));

        assertEquals(4, tracker.trackedCount());
        assertEquals(3, tracker.evictIdle(cutoff));
        assertEquals(1, tracker.trackedCount());

        assertEquals(JobStatus.STARTED, tracker.getStatus(stale).status());
        assertEquals(JobStatus.STARTED, tracker.getStatus(open).status());
        assertEquals(JobStatus.FAILED, tracker.getStatus(failed).status());
        assertTrue(tracker.getStatus(closed).closed());
    }

    @Test
    @DisplayName("A checkpoint ahead of a restarted in-memory log is rebuilt from the log")
    void checkpointAheadOfLogIsRewound() {
        InMemoryEventLogStore firstRun = new InMemoryEventLogStore();
        JobLifecycleTracker before = new JobLifecycleTracker(jobs, firstRun);
        String id = before.register("rewind-" + System.nanoTime(), null).id();
        before.observe(firstRun.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.RUNNING), now()));
        before.observe(firstRun.append(id, EventType.STEP_PROGRESS, EventPayloads.stepProgress("a", 50, null), now()));
        before.observe(firstRun.append(id, EventType.STEP_PROGRESS, EventPayloads.stepProgress("a", 90, null), now()));
        assertEquals(3, jobs.findById(id).orElseThrow().lastSeq());

        InMemoryEventLogStore secondRun = new InMemoryEventLogStore();
        JobLifecycleTracker after = new JobLifecycleTracker(jobs, secondRun);

        Job rebuilt = after.getStatus(id);
        assertEquals(0, rebuilt.lastSeq());
        assertEquals(JobStatus.STARTED, rebuilt.status());
        assertEquals(0, jobs.findById(id).orElseThrow().lastSeq());

        after.observe(secondRun.append(id, EventType.JOB_STATUS, EventPayloads.status(JobStatus.CANCELED), now()));
        assertEquals(JobStatus.CANCELED, after.getStatus(id).status());
        Job stored = jobs.findById(id).orElseThrow();
        assertEquals(1, stored.lastSeq());
        assertEquals(JobStatus.CANCELED, stored.status());
    }

    @Test
    void listByClient() {
        String client = "owner-" + System.nanoTime();
        tracker.register(null, client);
        tracker.register(null, client);
        tracker.register(null, "someone-else");

        assertEquals(2, tracker.countByClient(client));
        assertEquals(1, tracker.listByClient(client, 1).size());
    }
}
