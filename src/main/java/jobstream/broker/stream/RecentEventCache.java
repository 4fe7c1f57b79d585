package jobstream.broker.stream;

import jobstream.broker.model.JobEvent;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-job ring of the most recent events, kept in front of the
 * event log store.
 *
 * A ring always holds a contiguous seq range. A read is answered only when
 * the ring covers the first requested seq; anything else is a miss and the
 * caller goes to the store. The ring never answers "nothing newer", since
 * another process may have appended past it. Capacity 0 disables caching.
 */
public final class RecentEventCache {

    private final int capacity;
    private final ConcurrentHashMap<String, Ring> rings = new ConcurrentHashMap<>();

    public RecentEventCache(int capacity) {
        this.capacity = Math.max(0, capacity);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Record a freshly appended event. A seq that does not extend the ring
     * (restart, missed append) resets it to start at this event.
     */
    public void push(JobEvent event) {
        if (capacity == 0) {
            return;
        }
        Ring ring = rings.computeIfAbsent(event.jobId(), id -> new Ring());
        synchronized (ring) {
            JobEvent last = ring.events.peekLast();
            if (last != null && event.seq() != last.seq() + 1) {
                if (event.seq() <= last.seq()) {
                    return;
                }
                ring.events.clear();
            }
            if (ring.events.size() >= capacity) {
                ring.events.removeFirst();
            }
            ring.events.addLast(event);
            ring.touched = Instant.now();
        }
    }

    /**
     * Events with {@code seq > afterSeq}, up to {@code limit}, if this ring
     * covers seq {@code afterSeq + 1}; empty on a miss.
     */
    public Optional<List<JobEvent>> readAfter(String jobId, long afterSeq, int limit) {
        Ring ring = rings.get(jobId);
        if (ring == null) {
            return Optional.empty();
        }
        synchronized (ring) {
            JobEvent first = ring.events.peekFirst();
            JobEvent last = ring.events.peekLast();
            if (first == null || afterSeq < first.seq() - 1 || afterSeq >= last.seq()) {
                return Optional.empty();
            }
            List<JobEvent> out = new ArrayList<>(Math.min(limit, ring.events.size()));
            for (JobEvent event : ring.events) {
                if (event.seq() <= afterSeq) {
                    continue;
                }
                if (out.size() >= limit) {
                    break;
                }
                out.add(event);
            }
            ring.touched = Instant.now();
            return Optional.of(out);
        }
    }

    /** Number of events held for a job. */
    public int size(String jobId) {
        Ring ring = rings.get(jobId);
        if (ring == null) {
            return 0;
        }
        synchronized (ring) {
            return ring.events.size();
        }
    }

    /** Number of jobs with a ring. */
    public int jobCount() {
        return rings.size();
    }

    public void evict(String jobId) {
        rings.remove(jobId);
    }

    public void clear() {
        rings.clear();
    }

    /**
     * Drop rings not touched since {@code cutoff}.
     *
     * @return number of rings evicted
     */
    public int evictIdle(Instant cutoff) {
        int evicted = 0;
        for (var entry : rings.entrySet()) {
            Ring ring = entry.getValue();
            boolean idle;
            synchronized (ring) {
                idle = ring.touched.isBefore(cutoff);
            }
            if (idle && rings.remove(entry.getKey(), ring)) {
                evicted++;
            }
        }
        return evicted;
    }

    private static final class Ring {
        final ArrayDeque<JobEvent> events = new ArrayDeque<>();
        Instant touched = Instant.now();
    }
}
