package jobstream.broker.integration;

import jobstream.broker.config.BrokerConfig;
import jobstream.broker.config.Dependencies;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.service.JobReporter;
import jobstream.broker.stream.EventSink;
import jobstream.broker.stream.StreamSession;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two broker instances on one database: the producer talks to one, the
 * client is attached to the other and only sees events through the log.
 */
class CrossInstanceStreamTest {

        private Dependencies producerSide;
        private Dependencies clientSide;

        @BeforeEach
        void setUp() {
                String url = "jdbc:h2:mem:test-cross-" + System.nanoTime()
                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
                BrokerConfig config = BrokerConfig.defaults()
                                .withDatabaseUrl(url)
                                .withLivePollInterval(Duration.ofMillis(50));
                producerSide = Dependencies.create(config);
                clientSide = Dependencies.create(config);
        }

        @AfterEach
        void tearDown() {
                if (clientSide != null) {
                        clientSide.close();
                }
                if (producerSide != null) {
                        producerSide.close();
                }
        }

        @Test
        @DisplayName("Events appended on another instance reach a live client in order")
        void liveClientOnOtherInstance() throws Exception {
                String jobId = producerSide.tracker().register("cross-1", null).id();
                JobReporter reporter = producerSide.reporter(jobId);
                reporter.running();

                CollectingSink sink = new CollectingSink();
                StreamSession session = clientSide.streamSessions().open(jobId, 0, sink);

                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (session.phase() != StreamSession.Phase.LIVE && System.nanoTime() < deadline) {
                        Thread.sleep(10);
                }
                assertEquals(StreamSession.Phase.LIVE, session.phase());

                for (int i = 1; i <= 10; i++) {
                        reporter.progress("render", i * 10);
                }
                reporter.completed();

                assertTrue(sink.closed.await(10, TimeUnit.SECONDS), "client stream should end");
                assertEquals(13, sink.events.size());
                for (int i = 0; i < sink.events.size(); i++) {
                        assertEquals(i + 1, sink.events.get(i).seq());
                }
                assertNull(sink.doneStatus, "the log's own done ends the stream");
                assertEquals(StreamSession.Phase.TERMINAL, session.phase());
        }

        @Test
        void statusFoldsAcrossInstances() {
                String jobId = producerSide.tracker().register("cross-2", null).id();
                clientSide.tracker().getStatus(jobId);

                JobReporter reporter = producerSide.reporter(jobId);
                reporter.running();
                reporter.status(JobStatus.CANCELED);

                assertEquals(JobStatus.CANCELED, clientSide.tracker().getStatus(jobId).status());
                assertEquals(2, clientSide.tracker().getStatus(jobId).lastSeq());
                assertEquals(List.of(1L, 2L), clientSide.streamManager().readWindow(jobId, 0, 10).stream()
                                .map(JobEvent::seq).toList());
        }

        private static final class CollectingSink implements EventSink {
                private final ExecutorService loop = Executors.newSingleThreadExecutor();
                final List<JobEvent> events = new CopyOnWriteArrayList<>();
                final CountDownLatch closed = new CountDownLatch(1);
                volatile JobStatus doneStatus;

                @Override
                public boolean isWritable() {
                        return true;
                }

                @Override
                public void send(JobEvent event) {
                        events.add(event);
                }

                @Override
                public void sendHeartbeat(String jobId, long cursor) {
                }

                @Override
                public void sendDone(String jobId, long cursor, JobStatus status) {
                        doneStatus = status;
                }

                @Override
                public void close() {
                        closed.countDown();
                        loop.shutdown();
                }

                @Override
                public void execute(Runnable task) {
                        loop.execute(task);
                }
        }
}
