package jobstream.broker.store;

import com.fasterxml.jackson.databind.JsonNode;
import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.repository.EventLogStore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local EventLogStore.
 * Same contract as the JDBC store within one process, but nothing survives
 * a restart and other instances cannot see it. Used by tests and by
 * single-instance deployments that opt out of durability.
 */
public class InMemoryEventLogStore implements EventLogStore {

    private final ConcurrentHashMap<String, List<JobEvent>> logs = new ConcurrentHashMap<>();

    @Override
    public JobEvent append(String jobId, EventType type, JsonNode payload, long ts) {
        List<JobEvent> log = logs.computeIfAbsent(jobId, id -> new ArrayList<>());
        synchronized (log) {
            JobEvent event = new JobEvent(jobId, log.size() + 1L, type, payload, ts);
            log.add(event);
            return event;
        }
    }

    @Override
    public List<JobEvent> read(String jobId, long afterSeq, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<JobEvent> log = logs.get(jobId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            // seq n lives at index n - 1
            int from = (int) Math.min(Math.max(afterSeq, 0L), log.size());
            int to = (int) Math.min((long) from + limit, log.size());
            return new ArrayList<>(log.subList(from, to));
        }
    }

    @Override
    public long lastSeq(String jobId) {
        List<JobEvent> log = logs.get(jobId);
        if (log == null) {
            return 0L;
        }
        synchronized (log) {
            return log.size();
        }
    }
}
