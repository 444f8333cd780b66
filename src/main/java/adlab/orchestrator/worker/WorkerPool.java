package adlab.orchestrator.worker;

import adlab.orchestrator.model.QueueMessage;
import adlab.orchestrator.repository.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads, each looping dequeue → {@link TaskWorker#process}.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkQueue queue;
    private final TaskWorker worker;
    private final int workerCount;
    private final Duration pollInterval;
    private final AtomicInteger busy = new AtomicInteger();

    private ExecutorService executor;
    private volatile boolean running = false;

    public WorkerPool(WorkQueue queue, TaskWorker worker, int workerCount, Duration pollInterval) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.queue = queue;
        this.worker = worker;
        this.workerCount = workerCount;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }

        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "adlab-worker-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        running = true;
        for (int i = 0; i < workerCount; i++) {
            executor.submit(this::workerLoop);
        }

        log.info("Worker pool started with {} workers", workerCount);
    }

    /**
     * Stop accepting work and wait for in-flight tasks. Tasks still running
     * after the grace period are interrupted and go back to the queue.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            } else {
                log.info("Worker pool stopped gracefully");
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

    public int workerCount() {
        return running ? workerCount : 0;
    }

    /** Workers currently executing a task. */
    public int busyWorkers() {
        return busy.get();
    }

    private void workerLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<QueueMessage> message = queue.dequeue(pollInterval);
                if (message.isPresent()) {
                    busy.incrementAndGet();
                    try {
                        worker.process(message.get());
                    } finally {
                        busy.decrementAndGet();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Throwable e) {
                if (running) {
                    log.error("Unexpected error in worker loop", e);
                    try {
                        Thread.sleep(1000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
    }
}
