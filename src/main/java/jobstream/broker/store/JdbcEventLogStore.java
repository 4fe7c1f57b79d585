package jobstream.broker.store;

import com.fasterxml.jackson.databind.JsonNode;
import jobstream.broker.model.EventType;
import jobstream.broker.model.JobEvent;
import jobstream.broker.repository.EventLogStore;
import jobstream.broker.repository.StoreUnavailableException;
import jobstream.broker.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JDBC implementation of EventLogStore.
 *
 * Sequence numbers come from {@code event_log_heads}: the append transaction
 * increments the job's head row, which holds its row lock until commit, so
 * appends to one job are serialized even across processes sharing the
 * database. Within a process a striped lock keeps same-job appenders from
 * contending on that row.
 */
public class JdbcEventLogStore implements EventLogStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLogStore.class);

    private static final int MAX_ATTEMPTS = 5;
    private static final int LOCK_STRIPES = 64;

    private final Database db;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public JdbcEventLogStore(Database db) {
        this.db = db;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public JobEvent append(String jobId, EventType type, JsonNode payload, long ts) {
        String payloadJson = Json.write(payload == null ? Json.object() : payload);
        ReentrantLock lock = stripeFor(jobId);
        lock.lock();
        try {
            for (int attempt = 1;; attempt++) {
                try {
                    long seq = appendOnce(jobId, type, payloadJson, ts);
                    log.debug("Appended {} seq={} to job {}", type.wireName(), seq, jobId);
                    return new JobEvent(jobId, seq, type, payload, ts);
                } catch (SQLException e) {
                    if (isRetryable(e) && attempt < MAX_ATTEMPTS) {
                        log.debug("Append conflict on job {} (attempt {}): {}", jobId, attempt, e.getMessage());
                        continue;
                    }
                    throw new StoreUnavailableException("Failed to append event to job: " + jobId, e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private long appendOnce(String jobId, EventType type, String payloadJson, long ts) throws SQLException {
        try (Connection conn = db.getConnection()) {
            try {
                long seq = nextSeq(conn, jobId);

                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO job_events (job_id, seq, type, payload, ts) VALUES (?, ?, ?, ?, ?)")) {
                    ps.setString(1, jobId);
                    ps.setLong(2, seq);
                    ps.setString(3, type.wireName());
                    ps.setString(4, payloadJson);
                    ps.setLong(5, ts);
                    ps.executeUpdate();
                }

                conn.commit();
                return seq;
            } catch (SQLException e) {
                rollback(conn, e);
                throw e;
            }
        }
    }

    /**
     * Bump the job's head row and return the new value.
     * The first append for a job creates the row; a racing creator from
     * another process surfaces as an integrity violation and is retried.
     */
    private long nextSeq(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE event_log_heads SET last_seq = last_seq + 1 WHERE job_id = ?")) {
            ps.setString(1, jobId);
            if (ps.executeUpdate() == 0) {
                try (PreparedStatement insert = conn.prepareStatement(
                        "INSERT INTO event_log_heads (job_id, last_seq) VALUES (?, 1)")) {
                    insert.setString(1, jobId);
                    insert.executeUpdate();
                }
                return 1;
            }
        }

        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT last_seq FROM event_log_heads WHERE job_id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("event log head vanished for job " + jobId);
                }
                return rs.getLong(1);
            }
        }
    }

    @Override
    public List<JobEvent> read(String jobId, long afterSeq, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        String sql = """
                    SELECT job_id, seq, type, payload, ts FROM job_events
                    WHERE job_id = ? AND seq > ?
                    ORDER BY seq
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setLong(2, afterSeq);
            ps.setInt(3, limit);

            List<JobEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(mapRow(rs));
                }
            }
            return events;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read events of job: " + jobId, e);
        }
    }

    @Override
    public long lastSeq(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT last_seq FROM event_log_heads WHERE job_id = ?")) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read last seq of job: " + jobId, e);
        }
    }

    // --- Helpers ---

    private ReentrantLock stripeFor(String jobId) {
        return stripes[Math.floorMod(jobId.hashCode(), LOCK_STRIPES)];
    }

    private static boolean isRetryable(SQLException e) {
        return e instanceof SQLTransactionRollbackException
                || e instanceof SQLIntegrityConstraintViolationException
                || e instanceof SQLTimeoutException;
    }

    private static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private JobEvent mapRow(ResultSet rs) throws SQLException {
        return new JobEvent(
                rs.getString("job_id"),
                rs.getLong("seq"),
                EventType.fromWire(rs.getString("type")),
                Json.read(rs.getString("payload")),
                rs.getLong("ts"));
    }
}
