package jobstream.broker.stream;

import jobstream.broker.config.BrokerConfig;
import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.service.JobLifecycleTracker;
import jobstream.broker.service.JobReporter;
import jobstream.broker.store.Database;
import jobstream.broker.store.JdbcEventLogStore;
import jobstream.broker.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class StreamSessionTest {

    private static Database db;
    private static JdbcEventLogStore store;
    private static JdbcJobRepository jobs;

    private JobLifecycleTracker tracker;
    private StreamManager manager;
    private StreamSessions sessions;

    @BeforeAll
    static void setup() {
        db = new Database(BrokerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-sessions;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        store = new JdbcEventLogStore(db);
        jobs = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void wire() {
        BrokerConfig config = BrokerConfig.defaults()
                .withReplayBatchSize(2)
                .withSubscriberQueueCapacity(1000)
                .withLivePollInterval(Duration.ofMillis(50))
                .withHeartbeatInterval(Duration.ofMillis(200));
        tracker = new JobLifecycleTracker(jobs, store);
        manager = new StreamManager(store, new RecentEventCache(4), tracker, config.subscriberQueueCapacity());
        sessions = new StreamSessions(manager, tracker, config);
    }

    @AfterEach
    void unwire() {
        sessions.close();
        manager.close();
    }

    private JobReporter newJob(String prefix) {
        String id = tracker.register(prefix + "-" + System.nanoTime(), null).id();
        return new JobReporter(manager, id);
    }

    private RecordingSink attach(String jobId, long cursor) {
        RecordingSink sink = new RecordingSink();
        sessions.open(jobId, cursor, sink);
        return sink;
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    private static List<Long> range(long fromInclusive, long toInclusive) {
        return LongStream.rangeClosed(fromInclusive, toInclusive).boxed().toList();
    }

    @Test
    @DisplayName("Late, replaying and resuming clients all see the same ordered events")
    void lateReplayAndResume() throws Exception {
        JobReporter j1 = newJob("J1");
        j1.progress("analyze", 10);
        j1.progress("analyze", 50);

        RecordingSink early = attach(j1.jobId(), 0);

        j1.insight("x", "skills", "high", "x", null);
        j1.progress("analyze", 100);
        j1.done();

        assertTrue(early.awaitClosed(5), "stream should end after done");
        assertEquals(range(1, 5), early.seqs());
        assertEquals(List.of(EventType.STEP_PROGRESS, EventType.STEP_PROGRESS, EventType.INSIGHT_EMITTED,
                EventType.STEP_PROGRESS, EventType.DONE), early.types());
        assertNull(early.doneStatus, "log's own done closes the stream");

        RecordingSink replay = attach(j1.jobId(), 0);
        assertTrue(replay.awaitClosed(5));
        assertEquals(early.seqs(), replay.seqs());
        for (int i = 0; i < 5; i++) {
            assertEquals(early.events.get(i).payload(), replay.events.get(i).payload());
            assertEquals(early.events.get(i).ts(), replay.events.get(i).ts());
        }

        RecordingSink resumed = attach(j1.jobId(), 3);
        assertTrue(resumed.awaitClosed(5));
        assertEquals(range(4, 5), resumed.seqs());

        for (RecordingSink sink : List.of(early, replay, resumed)) {
            assertFalse(sink.wroteAfterClose);
        }
    }

    @Test
    @DisplayName("A terminal status without done ends the stream with a closing signal")
    void terminalStatusEndsStream() throws Exception {
        JobReporter job = newJob("term");
        job.running();
        job.progress("render", 100);
        job.status(JobStatus.FAILED);

        RecordingSink sink = attach(job.jobId(), 0);
        assertTrue(sink.awaitClosed(5));
        assertEquals(range(1, 3), sink.seqs());
        assertEquals(JobStatus.FAILED, sink.doneStatus);
        assertEquals(3, sink.doneCursor);

        job.done();
        RecordingSink later = attach(job.jobId(), 0);
        assertTrue(later.awaitClosed(5));
        assertEquals(range(1, 4), later.seqs());
        assertNull(later.doneStatus);
    }

    @Test
    @DisplayName("Cursor at the end of a finished job yields only the closing signal")
    void cursorAtEndOfFinishedJob() throws Exception {
        JobReporter job = newJob("end");
        job.completed();

        RecordingSink sink = attach(job.jobId(), 2);
        assertTrue(sink.awaitClosed(5));
        assertTrue(sink.events.isEmpty());
        assertEquals(JobStatus.COMPLETED, sink.doneStatus);
        assertEquals(2, sink.doneCursor);
    }

    @Test
    @DisplayName("Clients attaching during a burst get every event exactly once")
    void handoffHasNoGapsOrDuplicates() throws Exception {
        JobReporter job = newJob("burst");
        int burst = 200;
        List<RecordingSink> clients = new ArrayList<>();

        Thread producer = new Thread(() -> {
            for (int i = 0; i < burst; i++) {
                job.agentChunk("write", "chunk-" + i, i, burst);
            }
        });

        clients.add(attach(job.jobId(), 0));
        producer.start();
        for (int i = 0; i < 3; i++) {
            Thread.sleep(5);
            clients.add(attach(job.jobId(), 0));
        }
        producer.join(TimeUnit.SECONDS.toMillis(20));
        clients.add(attach(job.jobId(), 0));
        job.completed();

        for (RecordingSink client : clients) {
            assertTrue(client.awaitClosed(15), "client did not finish");
            assertEquals(range(1, burst + 2L), client.seqs());
            assertNull(client.doneStatus);
        }
    }

    @Test
    void idleStreamGetsHeartbeats() throws Exception {
        JobReporter job = newJob("idle");
        RecordingSink sink = attach(job.jobId(), 0);

        await(() -> sink.heartbeats.get() >= 2, "heartbeats");
        assertTrue(sink.events.isEmpty());
        assertEquals(1, sessions.openCount());
        assertEquals(StreamSession.Phase.LIVE, sessions.openSessions().get(0).phase());
        assertEquals(1, manager.subscriberCount(job.jobId()));

        sessions.openSessions().get(0).onDisconnect();
        assertTrue(sink.awaitClosed(5));
        await(() -> sessions.openCount() == 0, "session removal");
        assertEquals(0, manager.subscriberCount(job.jobId()));
        assertNull(sink.doneStatus);
    }

    @Test
    void liveEventsArriveAfterHandoff() throws Exception {
        JobReporter job = newJob("live");
        RecordingSink sink = attach(job.jobId(), 0);
        await(() -> manager.hasSubscribers(job.jobId()), "live registration");

        job.running();
        job.metric("tokens", 1200, "tok");
        await(() -> sink.events.size() == 2, "live events");
        assertEquals(range(1, 2), sink.seqs());

        job.canceled();
        assertTrue(sink.awaitClosed(5));
        assertEquals(range(1, 4), sink.seqs());
    }

    @Test
    @DisplayName("Replay waits while the transport is not writable")
    void replayPausesWhileUnwritable() throws Exception {
        JobReporter job = newJob("slow");
        for (int i = 0; i < 5; i++) {
            job.progress("step", i * 20);
        }

        RecordingSink sink = new RecordingSink();
        sink.writable = false;
        StreamSession session = sessions.open(job.jobId(), 0, sink);

        Thread.sleep(300);
        assertTrue(sink.events.isEmpty());
        assertEquals(0, sink.heartbeats.get());
        assertEquals(StreamSession.Phase.CATCHING_UP, session.phase());

        sink.writable = true;
        session.onWritable();
        await(() -> sink.events.size() == 5, "replay after writability");
        assertEquals(range(1, 5), sink.seqs());
    }

    @Test
    @DisplayName("A live client that stops draining is overrun and disconnected")
    void overrunDisconnectsSession() throws Exception {
        StreamManager tight = new StreamManager(store, new RecentEventCache(4), tracker, 2);
        StreamSessions tightSessions = new StreamSessions(tight, tracker, BrokerConfig.defaults()
                .withLivePollInterval(Duration.ofSeconds(10)));
        try {
            String jobId = tracker.register("overrun-" + System.nanoTime(), null).id();
            RecordingSink sink = new RecordingSink();
            StreamSession session = tightSessions.open(jobId, 0, sink);
            await(() -> session.phase() == StreamSession.Phase.LIVE, "live phase");

            sink.writable = false;
            for (int i = 0; i < 4; i++) {
                tight.emit(jobId, EventType.AGENT_CHUNK, null);
            }

            assertTrue(sink.awaitClosed(5));
            assertEquals(StreamSession.Phase.DISCONNECTED, session.phase());
            assertNull(sink.doneStatus);
            assertEquals(1, tight.overrunCount());
        } finally {
            tightSessions.close();
            tight.close();
        }
    }

    @Test
    void closeJobFinishesSessionsWithCurrentStatus() throws Exception {
        JobReporter job = newJob("cleanup");
        job.running();
        RecordingSink sink = attach(job.jobId(), 0);
        await(() -> manager.hasSubscribers(job.jobId()), "live registration");

        assertEquals(1, manager.closeJob(job.jobId()));

        assertTrue(sink.awaitClosed(5));
        assertEquals(range(1, 1), sink.seqs());
        assertEquals(JobStatus.RUNNING, sink.doneStatus);
    }

    @Test
    void readFailureEndsTheStream() throws Exception {
        JobReporter job = newJob("broken");
        job.running();

        Database doomed = new Database(
                "jdbc:h2:mem:test-sessions-broken;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        JdbcEventLogStore brokenStore = new JdbcEventLogStore(doomed);
        doomed.close();
        StreamManager broken = new StreamManager(brokenStore, new RecentEventCache(0), tracker, 10);
        StreamSessions brokenSessions = new StreamSessions(broken, tracker, BrokerConfig.defaults());
        try {
            RecordingSink sink = new RecordingSink();
            StreamSession session = brokenSessions.open(job.jobId(), 0, sink);

            assertTrue(sink.awaitClosed(5));
            assertEquals(StreamSession.Phase.DISCONNECTED, session.phase());
            assertTrue(sink.events.isEmpty());
            assertNull(sink.doneStatus);
        } finally {
            brokenSessions.close();
            broken.close();
        }
    }

    @Test
    void eventsAreJobScoped() throws Exception {
        JobReporter a = newJob("scope-a");
        JobReporter b = newJob("scope-b");
        RecordingSink sinkA = attach(a.jobId(), 0);
        await(() -> manager.hasSubscribers(a.jobId()), "live registration");

        b.running();
        b.completed();
        a.running();
        a.completed();

        assertTrue(sinkA.awaitClosed(5));
        for (JobEvent event : sinkA.events) {
            assertEquals(a.jobId(), event.jobId());
        }
        assertEquals(range(1, 3), sinkA.seqs());
    }
}
