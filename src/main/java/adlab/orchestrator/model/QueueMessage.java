package adlab.orchestrator.model;

/**
 * A descriptor leased from the work queue.
 * The receipt identifies this particular delivery; ack/requeue with a stale
 * receipt (lease expired, redelivered elsewhere) has no effect.
 *
 * @param sequence   queue position, FIFO order
 * @param descriptor the queued work
 * @param receipt    lease token of this delivery
 * @param deliveries how many times the entry has been handed out, including this one
 */
public record QueueMessage(long sequence, TaskDescriptor descriptor, String receipt, int deliveries) {

    public String taskId() {
        return descriptor.taskId();
    }
}
