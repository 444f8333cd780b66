package adlab.orchestrator.stream;

import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.repository.TaskRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client watching one task. Each poll reads the record and forwards it
 * when its version moved; the subscription ends on a terminal record, on
 * the deadline, or when the client goes away.
 */
public final class Subscription {

    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final String taskId;
    private final TaskEventSink sink;
    private final TaskRecordStore store;
    private final TaskStreamService owner;
    private final long deadlineNanos;
    private final long heartbeatNanos;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ScheduledFuture<?> future;
    private long lastVersion = 0;
    private long lastEmitNanos;

    Subscription(String taskId, TaskEventSink sink, TaskRecordStore store, TaskStreamService owner,
            long deadlineNanos, long heartbeatNanos) {
        this.taskId = taskId;
        this.sink = sink;
        this.store = store;
        this.owner = owner;
        this.deadlineNanos = deadlineNanos;
        this.heartbeatNanos = heartbeatNanos;
        this.lastEmitNanos = System.nanoTime();
    }

    public String taskId() {
        return taskId;
    }

    public boolean isActive() {
        return !closed.get();
    }

    /**
     * Stop watching without further events. Used when the client disconnects;
     * the task itself keeps running.
     */
    public void cancel() {
        if (closed.compareAndSet(false, true)) {
            stopPolling();
            log.debug("Stream for task {} cancelled", taskId);
        }
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
        if (closed.get()) {
            future.cancel(false);
        }
    }

    void poll() {
        if (closed.get()) {
            return;
        }

        TaskRecord record;
        try {
            Optional<TaskRecord> current = store.findById(taskId);
            if (current.isEmpty()) {
                log.info("Task {} was purged while streaming", taskId);
                finish();
                return;
            }
            record = current.get();
        } catch (RuntimeException e) {
            // Store hiccup: keep the stream open, the deadline still applies
            log.warn("Stream for task {} could not read the record: {}", taskId, e.getMessage());
            record = null;
        }

        long now = System.nanoTime();

        if (record != null && record.version() > lastVersion) {
            TaskRecord snapshot = record;
            lastVersion = snapshot.version();
            lastEmitNanos = now;
            if (!deliver(() -> sink.onUpdate(snapshot))) {
                return;
            }
            if (snapshot.isTerminal()) {
                finish();
                return;
            }
        }

        if (now - deadlineNanos >= 0) {
            log.info("Stream for task {} timed out", taskId);
            if (deliver(sink::onTimeout)) {
                finish();
            }
            return;
        }

        if (now - lastEmitNanos >= heartbeatNanos) {
            lastEmitNanos = now;
            deliver(sink::onHeartbeat);
        }
    }

    private void finish() {
        if (closed.compareAndSet(false, true)) {
            stopPolling();
            try {
                sink.onComplete();
            } catch (RuntimeException e) {
                log.debug("Stream for task {} failed to complete cleanly: {}", taskId, e.getMessage());
            }
        }
    }

    /**
     * Run a sink callback; a failure means the client is gone.
     */
    private boolean deliver(Runnable callback) {
        if (closed.get()) {
            return false;
        }
        try {
            callback.run();
            return true;
        } catch (RuntimeException e) {
            log.debug("Stream client for task {} went away: {}", taskId, e.getMessage());
            cancel();
            return false;
        }
    }

    private void stopPolling() {
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
        owner.remove(this);
    }
}
