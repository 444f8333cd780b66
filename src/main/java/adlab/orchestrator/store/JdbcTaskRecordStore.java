package adlab.orchestrator.store;

import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.model.TaskStatus;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.model.TransitionResult;
import adlab.orchestrator.repository.TaskRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRecordStore.
 * Each transition is a single UPDATE guarded by the allowed source statuses,
 * so concurrent writers cannot move a record backwards.
 */
public class JdbcTaskRecordStore implements TaskRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRecordStore.class);

    private static final int MAX_PROGRESS_LENGTH = 1024;
    private static final int MAX_ERROR_LENGTH = 4096;

    private final Database db;

    public JdbcTaskRecordStore(Database db) {
        this.db = db;
    }

    @Override
    public void create(TaskRecord record) {
        String sql = """
                    INSERT INTO task_records (id, task_type, payload, status, progress, result,
                                              error_code, error_message, error_attempt,
                                              attempts, row_version, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            TaskError error = record.error();

            ps.setString(1, record.id());
            ps.setString(2, record.type().name());
            ps.setString(3, record.payload());
            ps.setString(4, record.status().name());
            ps.setString(5, truncate(record.progress(), MAX_PROGRESS_LENGTH));
            ps.setString(6, record.result());
            ps.setString(7, error != null ? error.code() : null);
            ps.setString(8, error != null ? truncate(error.message(), MAX_ERROR_LENGTH) : null);
            setIntOrNull(ps, 9, error != null ? error.attempt() : null);
            ps.setInt(10, record.attempts());
            ps.setLong(11, record.version());
            setTimestamp(ps, 12, record.createdAt() != null ? record.createdAt() : now);
            setTimestamp(ps, 13, record.updatedAt() != null ? record.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to create task record: " + record.id(), e);
        }
    }

    @Override
    public Optional<TaskRecord> findById(String taskId) {
        String sql = "SELECT * FROM task_records WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find task record: " + taskId, e);
        }
    }

    @Override
    public Optional<TaskRecord> markRunning(String taskId, String progress) {
        String sql = """
                    UPDATE task_records
                    SET status = 'RUNNING', progress = ?, attempts = attempts + 1,
                        row_version = row_version + 1, updated_at = ?
                    WHERE id = ? AND status IN ('PENDING', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(progress, MAX_PROGRESS_LENGTH));
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to mark task record running: " + taskId, e);
        }

        return findById(taskId);
    }

    @Override
    public TransitionResult releaseAttempt(String taskId, String progress) {
        String sql = """
                    UPDATE task_records
                    SET progress = ?, attempts = attempts - 1,
                        row_version = row_version + 1, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING' AND attempts > 0
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(progress, MAX_PROGRESS_LENGTH));
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            return updated > 0 ? TransitionResult.APPLIED : explainMiss(taskId);
        } catch (SQLException e) {
            throw new StoreException("Failed to release attempt: " + taskId, e);
        }
    }

    @Override
    public TransitionResult updateProgress(String taskId, String progress) {
        String sql = """
                    UPDATE task_records
                    SET progress = ?, row_version = row_version + 1, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(progress, MAX_PROGRESS_LENGTH));
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            return updated > 0 ? TransitionResult.APPLIED : explainMiss(taskId);
        } catch (SQLException e) {
            throw new StoreException("Failed to update progress: " + taskId, e);
        }
    }

    @Override
    public TransitionResult complete(String taskId, String result) {
        String sql = """
                    UPDATE task_records
                    SET status = 'COMPLETED', result = ?, progress = NULL,
                        row_version = row_version + 1, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result);
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task record {} completed", taskId);
                return TransitionResult.APPLIED;
            }
            return explainMiss(taskId);
        } catch (SQLException e) {
            throw new StoreException("Failed to complete task record: " + taskId, e);
        }
    }

    @Override
    public TransitionResult fail(String taskId, TaskError error) {
        String sql = """
                    UPDATE task_records
                    SET status = 'FAILED', error_code = ?, error_message = ?, error_attempt = ?,
                        row_version = row_version + 1, updated_at = ?
                    WHERE id = ? AND status IN ('PENDING', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, error.code());
            ps.setString(2, truncate(error.message(), MAX_ERROR_LENGTH));
            ps.setInt(3, error.attempt());
            setTimestamp(ps, 4, Instant.now());
            ps.setString(5, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task record {} failed: {}", taskId, error.code());
                return TransitionResult.APPLIED;
            }
            return explainMiss(taskId);
        } catch (SQLException e) {
            throw new StoreException("Failed to fail task record: " + taskId, e);
        }
    }

    @Override
    public List<TaskRecord> findPendingBefore(Instant cutoff, int limit) {
        String sql = """
                    SELECT * FROM task_records
                    WHERE status = 'PENDING' AND created_at < ?
                    ORDER BY created_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find pending task records", e);
        }
    }

    @Override
    public int deleteTerminalBefore(Instant cutoff) {
        String sql = """
                    DELETE FROM task_records
                    WHERE status IN ('COMPLETED', 'FAILED') AND updated_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted > 0) {
                log.info("Purged {} expired task records", deleted);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to purge task records", e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM task_records WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count task records", e);
        }
    }

    // Helper methods

    /**
     * Work out why a conditional update touched no rows.
     */
    private TransitionResult explainMiss(String taskId) {
        Optional<TaskRecord> current = findById(taskId);
        if (current.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }
        if (current.get().isTerminal()) {
            return TransitionResult.ALREADY_TERMINAL;
        }
        log.warn("Rejected write to task record {} in status {}", taskId, current.get().status());
        return TransitionResult.REJECTED;
    }

    private List<TaskRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private TaskRecord mapRow(ResultSet rs) throws SQLException {
        String errorCode = rs.getString("error_code");
        TaskError error = null;
        if (errorCode != null) {
            error = new TaskError(errorCode, rs.getString("error_message"), rs.getInt("error_attempt"));
        }

        return TaskRecord.builder()
                .id(rs.getString("id"))
                .type(TaskType.valueOf(rs.getString("task_type")))
                .payload(rs.getString("payload"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .progress(rs.getString("progress"))
                .result(rs.getString("result"))
                .error(error)
                .attempts(rs.getInt("attempts"))
                .version(rs.getLong("row_version"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }
}
