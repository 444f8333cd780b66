package adlab.orchestrator.stream;

import adlab.orchestrator.repository.TaskRecordStore;
import adlab.orchestrator.service.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Push-style status streams built by polling the record store.
 *
 * Every subscription polls on a shared scheduler, so slow clients never hold
 * up each other or the workers. Streams only read the store.
 */
public class TaskStreamService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskStreamService.class);

    private final TaskRecordStore store;
    private final Duration pollInterval;
    private final Duration maxDuration;
    private final Duration heartbeatInterval;
    private final ScheduledThreadPoolExecutor executor;
    private final Set<Subscription> active = ConcurrentHashMap.newKeySet();

    public TaskStreamService(TaskRecordStore store, Duration pollInterval, Duration maxDuration,
            Duration heartbeatInterval) {
        this.store = store;
        this.pollInterval = pollInterval;
        this.maxDuration = maxDuration;
        this.heartbeatInterval = heartbeatInterval;

        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(2, r -> {
            Thread t = new Thread(r, "adlab-stream-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
    }

    /**
     * Start streaming a task's status to the sink.
     * The first event is the current snapshot.
     *
     * @throws TaskNotFoundException if no record exists for the id
     */
    public Subscription subscribe(String taskId, TaskEventSink sink) {
        if (store.findById(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }

        long now = System.nanoTime();
        Subscription subscription = new Subscription(taskId, sink, store, this,
                now + maxDuration.toNanos(), heartbeatInterval.toNanos());
        active.add(subscription);

        ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
                subscription::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        subscription.attach(future);

        log.debug("Stream opened for task {} ({} active)", taskId, active.size());
        return subscription;
    }

    /** Number of open subscriptions. */
    public int activeCount() {
        return active.size();
    }

    void remove(Subscription subscription) {
        active.remove(subscription);
    }

    @Override
    public void close() {
        for (Subscription subscription : Set.copyOf(active)) {
            subscription.cancel();
        }
        executor.shutdownNow();
        log.info("Stream service stopped");
    }
}
