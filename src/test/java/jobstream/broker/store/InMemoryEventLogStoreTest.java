package jobstream.broker.store;

import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventLogStoreTest {

    @Test
    void appendAndReadAfterCursor() {
        InMemoryEventLogStore store = new InMemoryEventLogStore();
        for (int i = 0; i < 4; i++) {
            store.append("job-1", EventType.STEP_PROGRESS, Json.object().put("pct", i * 25.0), i);
        }

        assertEquals(4, store.lastSeq("job-1"));
        assertEquals(List.of(2L, 3L), store.read("job-1", 1, 2).stream().map(JobEvent::seq).toList());
        assertTrue(store.read("job-1", 4, 10).isEmpty());
        assertTrue(store.read("job-1", 99, 10).isEmpty());
        assertTrue(store.read("nobody", 0, 10).isEmpty());
        assertEquals(0, store.lastSeq("nobody"));
    }

    @Test
    void parallelAppendsStayGapless() {
        InMemoryEventLogStore store = new InMemoryEventLogStore();
        IntStream.range(0, 500).parallel()
                .forEach(i -> store.append("job-1", EventType.AGENT_CHUNK, Json.object(), i));

        List<JobEvent> events = store.read("job-1", 0, 1000);
        assertEquals(500, events.size());
        for (int i = 0; i < events.size(); i++) {
            assertEquals(i + 1L, events.get(i).seq());
        }
    }
}
