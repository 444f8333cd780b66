package adlab.orchestrator.repository;

import adlab.orchestrator.model.QueueMessage;
import adlab.orchestrator.model.TaskDescriptor;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable multi-producer/multi-consumer FIFO of task descriptors.
 *
 * Delivery is at-least-once: a dequeued entry stays in the queue, invisible,
 * until it is acknowledged. If the consumer dies the lease runs out after the
 * visibility timeout and the entry is handed to another consumer.
 */
public interface WorkQueue extends AutoCloseable {

    /**
     * Append a descriptor.
     *
     * @throws QueueUnavailableException if the entry could not be stored
     */
    void enqueue(TaskDescriptor descriptor);

    /**
     * Lease the oldest visible entry, waiting up to {@code maxWait} for one.
     *
     * @return the leased message, or empty on timeout or after {@link #close()}
     * @throws InterruptedException      if the calling thread is interrupted while waiting
     * @throws QueueUnavailableException if the queue cannot be read
     */
    Optional<QueueMessage> dequeue(Duration maxWait) throws InterruptedException;

    /**
     * Remove the entry for good. Call only after the outcome is recorded.
     *
     * @return false if the lease was lost (receipt no longer owns the entry)
     */
    boolean ack(QueueMessage message);

    /**
     * Give the entry back, visible again after {@code delay}.
     *
     * @return false if the lease was lost
     */
    boolean requeue(QueueMessage message, Duration delay);

    /**
     * Push the lease deadline to now + {@code duration} for long-running work.
     *
     * @return false if the lease was lost
     */
    boolean extendVisibility(QueueMessage message, Duration duration);

    /**
     * Check whether any entry (leased or not) exists for the task id.
     */
    boolean contains(String taskId);

    /**
     * Number of entries in the queue, leased ones included.
     */
    int depth();

    /**
     * Number of entries currently leased to a consumer.
     */
    int inFlight();

    /**
     * Wake up blocked consumers and refuse further dequeues.
     */
    @Override
    void close();
}
