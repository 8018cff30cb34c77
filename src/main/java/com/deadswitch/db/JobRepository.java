package com.deadswitch.db;

import com.deadswitch.core.DuplicateJobException;
import com.deadswitch.core.Job;
import com.deadswitch.core.JobStatus;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * JDBC implementation of {@link JobStore}.
 * All methods use PreparedStatement and try-with-resources for safe resource management.
 *
 * <p><b>Uniqueness:</b> a unique job carries its name in the {@code unique_key} column,
 * which has a UNIQUE constraint. The key is cleared when the job reaches a terminal
 * status, so the name becomes available again. Two producers racing on the same name
 * cannot both insert: the loser gets a constraint violation, reported as
 * {@link DuplicateJobException}.</p>
 *
 * <p><b>Claiming:</b> a conditional UPDATE that only matches enqueued, unclaimed rows.
 * Exactly one caller sees an update count of 1.</p>
 */
public class JobRepository implements JobStore {
    private static final Logger logger = Logger.getLogger(JobRepository.class.getName());

    private static final String UNIQUE_VIOLATION = "23505";
    private static final int MAX_ERROR_LENGTH = 4000;

    private final Database database;

    public JobRepository(Database database) {
        this.database = database;
    }

    @Override
    public Job createUniqueJob(String name, String handler, String args) throws SQLException {
        String existsSql = "SELECT id FROM jobs WHERE name = ? AND status IN (?, ?, ?) LIMIT 1";

        try (Connection conn = database.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(existsSql)) {
                stmt.setString(1, name);
                stmt.setString(2, JobStatus.SCHEDULED.getDbName());
                stmt.setString(3, JobStatus.ENQUEUED.getDbName());
                stmt.setString(4, JobStatus.IN_PROGRESS.getDbName());

                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        throw new DuplicateJobException(name);
                    }
                }
            }

            try {
                long id = insert(conn, name, handler, args, JobStatus.ENQUEUED, null, name);
                logger.fine("Unique job created: " + name + " (id " + id + ")");
                return selectById(conn, id).orElseThrow(() -> new SQLException("Inserted job " + id + " not found"));
            } catch (SQLException e) {
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw new DuplicateJobException(name, e);
                }
                throw e;
            }
        }
    }

    @Override
    public Job createJob(String name, String handler, String args, LocalDateTime runAfter) throws SQLException {
        JobStatus status = runAfter != null && runAfter.isAfter(LocalDateTime.now())
                ? JobStatus.SCHEDULED
                : JobStatus.ENQUEUED;

        try (Connection conn = database.getConnection()) {
            long id = insert(conn, name, handler, args, status, runAfter, null);
            logger.fine("Job created: " + name + " (id " + id + ", " + status + ")");
            return selectById(conn, id).orElseThrow(() -> new SQLException("Inserted job " + id + " not found"));
        }
    }

    private long insert(Connection conn, String name, String handler, String args, JobStatus status,
                        LocalDateTime runAfter, String uniqueKey) throws SQLException {
        String sql = "INSERT INTO jobs (name, handler, args, fails, last_error, claimed, status, unique_key, " +
                     "run_after, created_at, updated_at) VALUES (?, ?, ?, 0, '', FALSE, ?, ?, ?, ?, ?)";

        try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            Timestamp now = Timestamp.valueOf(LocalDateTime.now());

            stmt.setString(1, name);
            stmt.setString(2, handler);
            stmt.setString(3, args);
            stmt.setString(4, status.getDbName());
            stmt.setString(5, uniqueKey);
            stmt.setTimestamp(6, runAfter != null ? Timestamp.valueOf(runAfter) : null);
            stmt.setTimestamp(7, now);
            stmt.setTimestamp(8, now);

            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for job " + name);
                }
                return keys.getLong(1);
            }
        }
    }

    @Override
    public Optional<Job> firstJob(JobStatus status, boolean claimed) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE status = ? AND claimed = ? ORDER BY id ASC LIMIT 1";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.getDbName());
            stmt.setBoolean(2, claimed);

            return singleJob(stmt);
        }
    }

    @Override
    public Optional<Job> firstScheduledJobDue() throws SQLException {
        String sql = "SELECT * FROM jobs WHERE status = ? AND run_after <= ? ORDER BY run_after ASC, id ASC LIMIT 1";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.SCHEDULED.getDbName());
            stmt.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));

            return singleJob(stmt);
        }
    }

    @Override
    public boolean promoteScheduledJob(long jobId) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, updated_at = ? WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.ENQUEUED.getDbName());
            stmt.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
            stmt.setLong(3, jobId);
            stmt.setString(4, JobStatus.SCHEDULED.getDbName());

            return stmt.executeUpdate() == 1;
        }
    }

    @Override
    public boolean claim(long jobId) throws SQLException {
        String sql = "UPDATE jobs SET claimed = TRUE, status = ?, updated_at = ? " +
                     "WHERE id = ? AND claimed = FALSE AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.IN_PROGRESS.getDbName());
            stmt.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
            stmt.setLong(3, jobId);
            stmt.setString(4, JobStatus.ENQUEUED.getDbName());

            boolean won = stmt.executeUpdate() == 1;
            if (!won) {
                logger.fine("Failed to claim job " + jobId + " (already claimed or not enqueued)");
            }
            return won;
        }
    }

    /**
     * Write the fields set on {@code update} and refresh {@code updated_at}.
     * Moving a job to a terminal status releases its unique name.
     */
    @Override
    public void update(long jobId, JobUpdate update) throws SQLException {
        StringBuilder sql = new StringBuilder("UPDATE jobs SET updated_at = ?");
        List<Object> params = new ArrayList<>();
        params.add(Timestamp.valueOf(LocalDateTime.now()));

        if (update.getClaimed() != null) {
            sql.append(", claimed = ?");
            params.add(update.getClaimed());
        }
        if (update.getStatus() != null) {
            sql.append(", status = ?");
            params.add(update.getStatus().getDbName());
            if (update.getStatus().isTerminal()) {
                sql.append(", unique_key = NULL");
            }
        }
        if (update.getFails() != null) {
            sql.append(", fails = ?");
            params.add(update.getFails());
        }
        if (update.getLastError() != null) {
            sql.append(", last_error = ?");
            params.add(truncate(update.getLastError()));
        }
        sql.append(" WHERE id = ?");
        params.add(jobId);

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }

            if (stmt.executeUpdate() == 0) {
                logger.warning("No job found with id " + jobId + " for " + update);
            }
        }
    }

    @Override
    public Optional<Job> lastUpdatedOlderThan(int minutes, JobStatus status) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE status = ? AND updated_at <= ? ORDER BY updated_at ASC, id ASC LIMIT 1";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.getDbName());
            stmt.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now().minusMinutes(minutes)));

            return singleJob(stmt);
        }
    }

    @Override
    public boolean requeueStuckJob(long jobId) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, claimed = FALSE, updated_at = ? WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.ENQUEUED.getDbName());
            stmt.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
            stmt.setLong(3, jobId);
            stmt.setString(4, JobStatus.IN_PROGRESS.getDbName());

            return stmt.executeUpdate() == 1;
        }
    }

    @Override
    public Optional<Job> findJob(long jobId) throws SQLException {
        try (Connection conn = database.getConnection()) {
            return selectById(conn, jobId);
        }
    }

    @Override
    public List<Job> jobsByName(String name) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE name = ? ORDER BY id ASC";
        List<Job> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, name);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapResultSetToJob(rs));
                }
            }
        }

        return jobs;
    }

    @Override
    public Map<JobStatus, Integer> countByStatus() throws SQLException {
        String sql = "SELECT status, COUNT(*) AS cnt FROM jobs GROUP BY status";
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                counts.put(JobStatus.fromDbName(rs.getString("status")), rs.getInt("cnt"));
            }
        }

        return counts;
    }

    private Optional<Job> selectById(Connection conn, long jobId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
            stmt.setLong(1, jobId);
            return singleJob(stmt);
        }
    }

    private Optional<Job> singleJob(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.of(mapResultSetToJob(rs));
            }
        }
        return Optional.empty();
    }

    private static String truncate(String error) {
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    private Job mapResultSetToJob(ResultSet rs) throws SQLException {
        Job job = new Job();
        job.setId(rs.getLong("id"));
        job.setName(rs.getString("name"));
        job.setHandler(rs.getString("handler"));
        job.setArgs(rs.getString("args"));
        job.setFails(rs.getInt("fails"));
        job.setLastError(rs.getString("last_error"));
        job.setClaimed(rs.getBoolean("claimed"));
        job.setStatus(JobStatus.fromDbName(rs.getString("status")));

        Timestamp runAfter = rs.getTimestamp("run_after");
        if (runAfter != null) {
            job.setRunAfter(runAfter.toLocalDateTime());
        }

        job.setCreatedAt(rs.getTimestamp("created_at").toLocalDateTime());
        job.setUpdatedAt(rs.getTimestamp("updated_at").toLocalDateTime());

        return job;
    }
}
