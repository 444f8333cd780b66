package adlab.orchestrator.scheduler;

import adlab.orchestrator.config.OrchestratorConfig;
import adlab.orchestrator.model.TaskError;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.model.TransitionResult;
import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.repository.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Background sweep over task records.
 *
 * A PENDING record whose queue entry is gone can never be picked up (the
 * process died between create and enqueue, or the entry was lost), so it is
 * failed with QUEUE_UNAVAILABLE once it is older than the orphan threshold.
 * Terminal records older than the retention window are deleted.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    static final int BATCH_SIZE = 100;

    private final TaskRecordStore store;
    private final WorkQueue queue;
    private final OrchestratorConfig config;

    public TaskReaper(TaskRecordStore store, WorkQueue queue, OrchestratorConfig config) {
        this.store = store;
        this.queue = queue;
        this.config = config;
    }

    @Override
    public void run() {
        reapOrphans();
        purgeExpired();
    }

    /**
     * @return number of orphaned records failed
     */
    public int reapOrphans() {
        Instant cutoff = Instant.now().minus(config.orphanThreshold());
        List<TaskRecord> pending = store.findPendingBefore(cutoff, BATCH_SIZE);

        int failed = 0;
        for (TaskRecord record : pending) {
            try {
                if (queue.contains(record.id())) {
                    continue;
                }
                TransitionResult result = store.fail(record.id(),
                        TaskError.queueUnavailable("Task was never queued for execution"));
                if (result == TransitionResult.APPLIED) {
                    failed++;
                    log.warn("Failed orphaned task {} (no queue entry)", record.id());
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", record.id(), e);
            }
        }

        if (failed > 0) {
            log.info("Task reaper: {} orphaned of {} pending checked", failed, pending.size());
        }
        return failed;
    }

    /**
     * @return number of terminal records deleted
     */
    public int purgeExpired() {
        return store.deleteTerminalBefore(Instant.now().minus(config.recordRetention()));
    }
}
