package adlab.orchestrator.store;

import adlab.orchestrator.model.QueueMessage;
import adlab.orchestrator.model.TaskDescriptor;
import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.repository.QueueUnavailableException;
import adlab.orchestrator.repository.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Work queue backed by the {@code work_queue} table.
 *
 * A dequeue leases the oldest visible row by stamping a fresh receipt and
 * pushing {@code visible_at} forward by the visibility timeout. The row is
 * deleted only on ack, so entries survive restarts and crashed consumers.
 * Claiming is an optimistic conditional UPDATE, which keeps it safe when
 * several processes share the database.
 */
public class JdbcWorkQueue implements WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkQueue.class);

    private static final int CLAIM_CANDIDATES = 4;

    private final Database db;
    private final Duration visibilityTimeout;
    private final Duration pollInterval;

    // Local consumers serialize their claims; other processes race via the UPDATE guard
    private final Object claimLock = new Object();

    private final ReentrantLock signalLock = new ReentrantLock();
    private final Condition available = signalLock.newCondition();
    private long signals = 0;

    private volatile boolean closed = false;

    public JdbcWorkQueue(Database db, Duration visibilityTimeout, Duration pollInterval) {
        if (visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
            throw new IllegalArgumentException("visibilityTimeout must be positive");
        }
        this.db = db;
        this.visibilityTimeout = visibilityTimeout;
        this.pollInterval = pollInterval;
    }

    @Override
    public void enqueue(TaskDescriptor descriptor) {
        if (closed) {
            throw new QueueUnavailableException("Work queue is closed");
        }

        String sql = """
                    INSERT INTO work_queue (task_id, task_type, payload, created_at, enqueued_at, visible_at, deliveries)
                    VALUES (?, ?, ?, ?, ?, ?, 0)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setString(1, descriptor.taskId());
            ps.setString(2, descriptor.taskType().name());
            ps.setString(3, descriptor.payload());
            ps.setTimestamp(4, Timestamp.from(descriptor.createdAt()));
            ps.setTimestamp(5, now);
            ps.setTimestamp(6, now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new QueueUnavailableException("Failed to enqueue task: " + descriptor.taskId(), e);
        }

        log.debug("Enqueued task {}", descriptor.taskId());
        signal();
    }

    @Override
    public Optional<QueueMessage> dequeue(Duration maxWait) throws InterruptedException {
        long deadline = System.nanoTime() + Math.max(0, maxWait.toNanos());

        while (!closed) {
            long seen = currentSignals();

            Optional<QueueMessage> claimed = tryClaim();
            if (claimed.isPresent()) {
                return claimed;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            awaitSignal(seen, Math.min(remaining, pollInterval.toNanos()));
        }
        return Optional.empty();
    }

    @Override
    public boolean ack(QueueMessage message) {
        String sql = "DELETE FROM work_queue WHERE seq = ? AND receipt = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, message.sequence());
            ps.setString(2, message.receipt());

            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted == 0) {
                log.warn("Ack for task {} ignored: lease {} no longer held", message.taskId(), message.receipt());
            }
            return deleted > 0;
        } catch (SQLException e) {
            throw new QueueUnavailableException("Failed to ack task: " + message.taskId(), e);
        }
    }

    @Override
    public boolean requeue(QueueMessage message, Duration delay) {
        String sql = """
                    UPDATE work_queue
                    SET visible_at = ?, receipt = NULL
                    WHERE seq = ? AND receipt = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now().plus(delay)));
            ps.setLong(2, message.sequence());
            ps.setString(3, message.receipt());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.warn("Requeue for task {} ignored: lease {} no longer held", message.taskId(), message.receipt());
                return false;
            }
        } catch (SQLException e) {
            throw new QueueUnavailableException("Failed to requeue task: " + message.taskId(), e);
        }

        if (delay.isZero() || delay.isNegative()) {
            signal();
        }
        return true;
    }

    @Override
    public boolean extendVisibility(QueueMessage message, Duration duration) {
        String sql = "UPDATE work_queue SET visible_at = ? WHERE seq = ? AND receipt = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now().plus(duration)));
            ps.setLong(2, message.sequence());
            ps.setString(3, message.receipt());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new QueueUnavailableException("Failed to extend lease for task: " + message.taskId(), e);
        }
    }

    @Override
    public boolean contains(String taskId) {
        String sql = "SELECT 1 FROM work_queue WHERE task_id = ? LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new QueueUnavailableException("Failed to look up task: " + taskId, e);
        }
    }

    @Override
    public int depth() {
        return count("SELECT COUNT(*) FROM work_queue", null);
    }

    @Override
    public int inFlight() {
        return count("SELECT COUNT(*) FROM work_queue WHERE receipt IS NOT NULL AND visible_at > ?",
                Timestamp.from(Instant.now()));
    }

    @Override
    public void close() {
        closed = true;
        signal();
        log.info("Work queue closed");
    }

    // Helper methods

    private Optional<QueueMessage> tryClaim() {
        String selectSql = """
                    SELECT seq, task_id, task_type, payload, created_at, deliveries FROM work_queue
                    WHERE visible_at <= ?
                    ORDER BY seq
                    LIMIT ?
                """;

        String claimSql = """
                    UPDATE work_queue
                    SET receipt = ?, visible_at = ?, deliveries = deliveries + 1
                    WHERE seq = ? AND deliveries = ? AND visible_at <= ?
                """;

        synchronized (claimLock) {
            try (Connection conn = db.getConnection()) {
                try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                        PreparedStatement claimPs = conn.prepareStatement(claimSql)) {

                    Instant now = Instant.now();
                    Timestamp nowTs = Timestamp.from(now);

                    List<Candidate> candidates = new ArrayList<>();
                    selectPs.setTimestamp(1, nowTs);
                    selectPs.setInt(2, CLAIM_CANDIDATES);
                    try (ResultSet rs = selectPs.executeQuery()) {
                        while (rs.next()) {
                            candidates.add(new Candidate(
                                    rs.getLong("seq"),
                                    new TaskDescriptor(
                                            rs.getString("task_id"),
                                            TaskType.valueOf(rs.getString("task_type")),
                                            rs.getString("payload"),
                                            rs.getTimestamp("created_at").toInstant()),
                                    rs.getInt("deliveries")));
                        }
                    }

                    for (Candidate candidate : candidates) {
                        String receipt = UUID.randomUUID().toString();
                        claimPs.setString(1, receipt);
                        claimPs.setTimestamp(2, Timestamp.from(now.plus(visibilityTimeout)));
                        claimPs.setLong(3, candidate.sequence());
                        claimPs.setInt(4, candidate.deliveries());
                        claimPs.setTimestamp(5, nowTs);

                        if (claimPs.executeUpdate() == 1) {
                            conn.commit();
                            int deliveries = candidate.deliveries() + 1;
                            if (deliveries > 1) {
                                log.info("Redelivering task {} (delivery #{})",
                                        candidate.descriptor().taskId(), deliveries);
                            }
                            return Optional.of(new QueueMessage(
                                    candidate.sequence(), candidate.descriptor(), receipt, deliveries));
                        }
                    }

                    conn.commit();
                    return Optional.empty();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                throw new QueueUnavailableException("Failed to dequeue from work queue", e);
            }
        }
    }

    private int count(String sql, Timestamp param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (param != null) {
                ps.setTimestamp(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new QueueUnavailableException("Failed to count work queue entries", e);
        }
    }

    private long currentSignals() {
        signalLock.lock();
        try {
            return signals;
        } finally {
            signalLock.unlock();
        }
    }

    private void signal() {
        signalLock.lock();
        try {
            signals++;
            available.signalAll();
        } finally {
            signalLock.unlock();
        }
    }

    private void awaitSignal(long seen, long nanos) throws InterruptedException {
        signalLock.lock();
        try {
            long remaining = nanos;
            while (signals == seen && !closed && remaining > 0) {
                remaining = available.awaitNanos(remaining);
            }
        } finally {
            signalLock.unlock();
        }
    }

    private record Candidate(long sequence, TaskDescriptor descriptor, int deliveries) {
    }
}
