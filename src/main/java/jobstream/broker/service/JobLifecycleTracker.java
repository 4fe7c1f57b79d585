package jobstream.broker.service;

import jobstream.broker.model.Job;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.repository.EventLogStore;
import jobstream.broker.repository.JobRepository;
import jobstream.broker.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-job lifecycle status, kept as a projection over the event log.
 *
 * The job row stores a checkpoint ({@code lastSeq}) and the status folded
 * up to it. Reads start from the newest checkpoint this process has seen
 * and fold whatever the log holds beyond it, so the answer never lags the
 * log even when another process appended the events.
 */
public class JobLifecycleTracker {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycleTracker.class);

    private static final int FOLD_BATCH = 500;

    private final JobRepository jobRepository;
    private final EventLogStore store;

    // newest folded view per job; a hint, the log stays authoritative
    private final ConcurrentHashMap<String, View> views = new ConcurrentHashMap<>();

    public JobLifecycleTracker(JobRepository jobRepository, EventLogStore store) {
        this.jobRepository = jobRepository;
        this.store = store;
    }

    /**
     * Register a new job in status {@code started}.
     *
     * @param jobId    requested id, or null to generate one
     * @param clientId optional owner
     * @return the registered job
     * @throws IllegalStateException if the id is taken
     */
    public Job register(String jobId, String clientId) {
        String id = (jobId == null || jobId.isBlank()) ? jobRepository.generateId() : jobId.trim();
        Instant now = Instant.now();
        Job job = Job.builder()
                .id(id)
                .clientId(clientId)
                .status(JobStatus.STARTED)
                .lastSeq(0)
                .closed(false)
                .createdAt(now)
                .updatedAt(now)
                .build();

        jobRepository.save(job);
        views.put(id, new View(job, now));
        log.info("Registered job {} (client={})", id, clientId);
        return job;
    }

    /**
     * Current status of a job, folded through the tail of its log.
     *
     * @throws UnknownJobException if the job was never registered
     * @throws StoreUnavailableException if the log cannot be read
     */
    public Job getStatus(String jobId) {
        return find(jobId).orElseThrow(() -> new UnknownJobException(jobId));
    }

    /** Same as {@link #getStatus}; used on the emit path for the accept check. */
    public Job current(String jobId) {
        return getStatus(jobId);
    }

    public Optional<Job> find(String jobId) {
        View view = views.get(jobId);
        Job base;
        if (view != null) {
            base = view.job();
        } else {
            Optional<Job> stored = jobRepository.findById(jobId);
            if (stored.isEmpty()) {
                return Optional.empty();
            }
            base = rewindIfAhead(stored.get());
        }

        Job folded = foldTail(base);
        return Optional.of(remember(folded));
    }

    /**
     * Fold one freshly appended event and move the stored checkpoint.
     * A failed checkpoint write is logged and left to the next fold-on-read;
     * the event itself is already durable.
     */
    public void observe(JobEvent event) {
        View view = views.get(event.jobId());
        Job before = view != null ? view.job() : getStatus(event.jobId());
        if (event.seq() > before.lastSeq() + 1) {
            before = foldTail(before);
        }
        Job after = remember(before.fold(event));

        if (after.status() != before.status()) {
            log.info("Job {} {} -> {} at seq {}", after.id(), before.status().wireName(),
                    after.status().wireName(), after.lastSeq());
        }

        try {
            jobRepository.advance(after.id(), after.lastSeq(), after.status(), after.closed());
        } catch (StoreUnavailableException e) {
            log.warn("Could not checkpoint job {} at seq {}: {}", after.id(), after.lastSeq(), e.getMessage());
        }
    }

    public List<Job> listByClient(String clientId, int limit) {
        return jobRepository.findByClient(clientId, limit);
    }

    public int countByClient(String clientId) {
        return jobRepository.countByClient(clientId);
    }

    /**
     * Forget folded views of terminal jobs and of jobs nobody has read or
     * written since {@code idleCutoff}. Evicted views reload from the stored
     * checkpoint and the log on the next read.
     *
     * @return number of views dropped
     */
    public int evictIdle(Instant idleCutoff) {
        int before = views.size();
        views.values().removeIf(v -> v.job().isTerminal() || v.job().closed() || v.touched().isBefore(idleCutoff));
        return before - views.size();
    }

    public int trackedCount() {
        return views.size();
    }

    private Job foldTail(Job job) {
        Job folded = job;
        while (true) {
            List<JobEvent> tail = store.read(folded.id(), folded.lastSeq(), FOLD_BATCH);
            for (JobEvent event : tail) {
                folded = folded.fold(event);
            }
            if (tail.size() < FOLD_BATCH) {
                return folded;
            }
        }
    }

    /**
     * A checkpoint beyond the log's head means the log lost events it once
     * held (a process-local log after a restart). The log wins: fold it again
     * from the start and move the stored checkpoint back.
     */
    private Job rewindIfAhead(Job stored) {
        if (stored.lastSeq() == 0) {
            return stored;
        }
        long head = store.lastSeq(stored.id());
        if (head >= stored.lastSeq()) {
            return stored;
        }
        log.warn("Checkpoint of job {} is at seq {} but its log ends at {}, rebuilding status from the log",
                stored.id(), stored.lastSeq(), head);
        Job rewound = stored.toBuilder()
                .status(JobStatus.STARTED)
                .lastSeq(0)
                .closed(false)
                .updatedAt(Instant.now())
                .build();
        jobRepository.rewind(stored.id());
        return rewound;
    }

    private Job remember(Job job) {
        View candidate = new View(job, Instant.now());
        return views.merge(job.id(), candidate,
                (old, fresh) -> fresh.job().lastSeq() >= old.job().lastSeq() ? fresh : new View(old.job(), fresh.touched()))
                .job();
    }

    private record View(Job job, Instant touched) {
    }
}
