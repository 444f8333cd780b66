package adlab.orchestrator.stream;

import adlab.orchestrator.model.TaskRecord;

/**
 * Receiver of one subscription's events, called from a stream thread.
 * Calls for one subscription never overlap. A callback that throws is
 * taken as a disconnected client and ends the subscription.
 */
public interface TaskEventSink {

    /**
     * The record changed (or, on the first call, the snapshot at connect time).
     */
    void onUpdate(TaskRecord record);

    /**
     * The maximum stream duration elapsed before the task finished.
     * Always followed by {@link #onComplete()}.
     */
    void onTimeout();

    /**
     * Nothing happened for a while; keeps idle connections open.
     */
    void onHeartbeat();

    /**
     * No more events will follow.
     */
    void onComplete();
}
