package jobstream.broker.store;

import jobstream.broker.model.Job;
import jobstream.broker.model.JobStatus;
import jobstream.broker.repository.JobRepository;
import jobstream.broker.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, client_id, status, last_seq, closed, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant created = job.createdAt() != null ? job.createdAt() : Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.clientId());
            ps.setString(3, job.status().wireName());
            ps.setLong(4, job.lastSeq());
            ps.setBoolean(5, job.closed());
            ps.setTimestamp(6, Timestamp.from(created));
            ps.setTimestamp(7, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : created));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new IllegalStateException("job already exists: " + job.id(), e);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findByClient(String clientId, int limit) {
        String sql = "SELECT * FROM jobs WHERE client_id = ? ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, clientId);
            ps.setInt(2, limit);

            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRow(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to find jobs of client: " + clientId, e);
        }
    }

    @Override
    public int countByClient(String clientId) {
        String sql = "SELECT COUNT(*) FROM jobs WHERE client_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, clientId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count jobs of client: " + clientId, e);
        }
    }

    @Override
    public boolean advance(String jobId, long lastSeq, JobStatus status, boolean closed) {
        String sql = """
                    UPDATE jobs SET last_seq = ?, status = ?, closed = ?, updated_at = ?
                    WHERE id = ? AND last_seq < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, lastSeq);
            ps.setString(2, status.wireName());
            ps.setBoolean(3, closed);
            ps.setTimestamp(4, Timestamp.from(Instant.now()));
            ps.setString(5, jobId);
            ps.setLong(6, lastSeq);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to advance job checkpoint: " + jobId, e);
        }
    }

    @Override
    public void rewind(String jobId) {
        String sql = """
                    UPDATE jobs SET last_seq = 0, status = ?, closed = FALSE, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, JobStatus.STARTED.wireName());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to rewind job checkpoint: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .clientId(rs.getString("client_id"))
                .status(JobStatus.fromWire(rs.getString("status")))
                .lastSeq(rs.getLong("last_seq"))
                .closed(rs.getBoolean("closed"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
