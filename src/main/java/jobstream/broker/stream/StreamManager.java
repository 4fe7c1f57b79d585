package jobstream.broker.stream;

import com.fasterxml.jackson.databind.JsonNode;
import jobstream.broker.model.EventType;
import jobstream.broker.model.Job;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.repository.EventLogStore;
import jobstream.broker.service.JobClosedException;
import jobstream.broker.service.JobLifecycleTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-process fan-out of job events to live subscribers.
 *
 * emit: append to the durable log, push to the recent-event cache, offer to
 * every live subscriber of the job, then fold into the lifecycle tracker.
 *
 * Each job has two locks. The emit lock orders a job's appends and their
 * fan-out; only the job's producer ever waits on it. The registry lock
 * guards the subscriber list and is held just long enough to insert,
 * remove or run the non-blocking offers of one fan-out, never across a
 * store call. Because an event is appended before it is fanned out, a
 * subscriber registered under the registry lock either receives an event
 * through its queue or finds it in the log afterwards.
 */
public class StreamManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamManager.class);

    private final EventLogStore store;
    private final RecentEventCache cache;
    private final JobLifecycleTracker tracker;
    private final int queueCapacity;

    private final ConcurrentHashMap<String, JobChannel> channels = new ConcurrentHashMap<>();

    private final LongAdder emitted = new LongAdder();
    private final LongAdder overruns = new LongAdder();

    public StreamManager(EventLogStore store, RecentEventCache cache, JobLifecycleTracker tracker, int queueCapacity) {
        this.store = store;
        this.cache = cache;
        this.tracker = tracker;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Publish one event for a job.
     *
     * @return the stored event with its assigned seq
     * @throws jobstream.broker.service.UnknownJobException if the job was never registered
     * @throws JobClosedException if the job no longer accepts this event
     * @throws jobstream.broker.repository.StoreUnavailableException if the append failed
     * @throws IllegalArgumentException for heartbeat events or a malformed status payload
     */
    public JobEvent emit(String jobId, EventType type, JsonNode payload) {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(type, "type is required");
        if (type == EventType.HEARTBEAT) {
            throw new IllegalArgumentException("heartbeat records are generated by stream sessions");
        }
        if (type == EventType.JOB_STATUS) {
            JsonNode status = payload == null ? null : payload.get("status");
            JobStatus.fromWire(status == null ? null : status.asText());
        }

        while (true) {
            JobChannel channel = channel(jobId);
            channel.emitLock.lock();
            try {
                if (channel.retired) {
                    continue;
                }
                Job job = tracker.current(jobId);
                if (!job.accepts(type)) {
                    throw new JobClosedException(jobId, job.status(), type);
                }

                JobEvent event = store.append(jobId, type, payload, System.currentTimeMillis());
                emitted.increment();
                cache.push(event);
                fanOut(channel, event);
                tracker.observe(event);
                return event;
            } finally {
                channel.emitLock.unlock();
            }
        }
    }

    private void fanOut(JobChannel channel, JobEvent event) {
        channel.lock.lock();
        try {
            channel.touch();
            Iterator<Subscriber> it = channel.subscribers.iterator();
            while (it.hasNext()) {
                Subscriber subscriber = it.next();
                if (subscriber.offer(event)) {
                    continue;
                }
                it.remove();
                if (subscriber.closeReason() == Subscriber.CloseReason.OVERRUN) {
                    overruns.increment();
                    log.warn("Subscriber {} of job {} overrun at seq {}, dropping it", subscriber.id(), event.jobId(),
                            event.seq());
                }
            }
        } finally {
            channel.lock.unlock();
        }
    }

    /**
     * Register a live subscriber. It receives every event fanned out after
     * this call whose seq is greater than {@code afterSeq}; catching up on
     * older events is the caller's job (see {@link #readWindow}).
     */
    public Subscriber subscribe(String jobId, long afterSeq, SubscriberListener listener) {
        Objects.requireNonNull(listener, "listener is required");
        while (true) {
            JobChannel channel = channel(jobId);
            channel.lock.lock();
            try {
                if (channel.retired) {
                    continue;
                }
                Subscriber subscriber = new Subscriber(jobId, afterSeq, queueCapacity, listener);
                channel.subscribers.add(subscriber);
                channel.touch();
                log.debug("Subscribed {} to job {} after seq {}", subscriber.id(), jobId, afterSeq);
                return subscriber;
            } finally {
                channel.lock.unlock();
            }
        }
    }

    /** Idempotent removal. */
    public void unsubscribe(Subscriber subscriber) {
        if (subscriber == null) {
            return;
        }
        subscriber.close(Subscriber.CloseReason.UNSUBSCRIBED);
        JobChannel channel = channels.get(subscriber.jobId());
        if (channel == null) {
            return;
        }
        channel.lock.lock();
        try {
            channel.subscribers.remove(subscriber);
        } finally {
            channel.lock.unlock();
        }
    }

    /**
     * One window of the job's log after {@code afterSeq}, from the cache
     * when it covers the range, otherwise from the store.
     */
    public List<JobEvent> readWindow(String jobId, long afterSeq, int limit) {
        return cache.readAfter(jobId, afterSeq, limit)
                .orElseGet(() -> store.read(jobId, afterSeq, limit));
    }

    /**
     * Detach every live subscriber of a job; their sessions finish on their own.
     *
     * @return number of subscribers closed
     */
    public int closeJob(String jobId) {
        return closeSubscribers(jobId, Subscriber.CloseReason.JOB_CLOSED);
    }

    private int closeSubscribers(String jobId, Subscriber.CloseReason reason) {
        JobChannel channel = channels.get(jobId);
        if (channel == null) {
            return 0;
        }
        List<Subscriber> closed = new ArrayList<>();
        channel.lock.lock();
        try {
            for (Subscriber subscriber : channel.subscribers) {
                if (subscriber.close(reason)) {
                    closed.add(subscriber);
                }
            }
            channel.subscribers.clear();
        } finally {
            channel.lock.unlock();
        }
        if (!closed.isEmpty()) {
            log.info("Closed {} subscriber(s) of job {} ({})", closed.size(), jobId, reason);
        }
        return closed.size();
    }

    public boolean hasSubscribers(String jobId) {
        return subscriberCount(jobId) > 0;
    }

    public int subscriberCount(String jobId) {
        JobChannel channel = channels.get(jobId);
        if (channel == null) {
            return 0;
        }
        channel.lock.lock();
        try {
            return (int) channel.subscribers.stream().filter(Subscriber::isLive).count();
        } finally {
            channel.lock.unlock();
        }
    }

    public int totalSubscribers() {
        int total = 0;
        for (String jobId : channels.keySet()) {
            total += subscriberCount(jobId);
        }
        return total;
    }

    public long emittedCount() {
        return emitted.sum();
    }

    public long overrunCount() {
        return overruns.sum();
    }

    public RecentEventCache cache() {
        return cache;
    }

    /**
     * Drop dead subscribers, retire channels idle since {@code idleCutoff}
     * with nobody subscribed, and evict idle cache rings. A channel whose
     * producer is mid-emit is skipped until the next sweep.
     *
     * @return number of channels retired
     */
    public int sweep(Instant idleCutoff) {
        int retired = 0;
        for (var entry : channels.entrySet()) {
            JobChannel channel = entry.getValue();
            if (!channel.emitLock.tryLock()) {
                continue;
            }
            try {
                channel.lock.lock();
                try {
                    channel.subscribers.removeIf(s -> !s.isLive());
                    if (channel.subscribers.isEmpty() && channel.lastActivity.isBefore(idleCutoff)) {
                        channel.retired = true;
                        channels.remove(entry.getKey(), channel);
                        retired++;
                    }
                } finally {
                    channel.lock.unlock();
                }
            } finally {
                channel.emitLock.unlock();
            }
        }
        int evicted = cache.evictIdle(idleCutoff);
        if (retired > 0 || evicted > 0) {
            log.debug("Sweep retired {} channel(s), evicted {} cache ring(s)", retired, evicted);
        }
        return retired;
    }

    /** Close every subscriber; sessions see SHUTDOWN and end their streams. */
    @Override
    public void close() {
        for (String jobId : channels.keySet()) {
            closeSubscribers(jobId, Subscriber.CloseReason.SHUTDOWN);
        }
    }

    private JobChannel channel(String jobId) {
        return channels.computeIfAbsent(jobId, id -> new JobChannel());
    }

    /** Per-job registry. */
    private static final class JobChannel {
        final ReentrantLock emitLock = new ReentrantLock();
        final ReentrantLock lock = new ReentrantLock();
        final List<Subscriber> subscribers = new ArrayList<>(); // guarded by lock
        volatile Instant lastActivity = Instant.now();
        volatile boolean retired; // set under both locks

        void touch() {
            lastActivity = Instant.now();
        }
    }
}
