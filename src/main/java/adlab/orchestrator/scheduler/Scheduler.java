package adlab.orchestrator.scheduler;

import adlab.orchestrator.config.OrchestratorConfig;
import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.repository.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background maintenance on a single thread:
 * - TaskReaper: fails orphaned PENDING records and purges expired terminal ones
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskReaper taskReaper;
    private final OrchestratorConfig config;

    private volatile boolean running = false;

    public Scheduler(TaskRecordStore store, WorkQueue queue, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "adlab-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskReaper = new TaskReaper(store, queue, config);
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("task-reaper", taskReaper),
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Task reaper scheduled every {}ms", intervalMs);
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the task reaper for direct access (e.g., manual trigger).
     */
    public TaskReaper taskReaper() {
        return taskReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
