package adlab.orchestrator.model;

import java.util.Locale;

/**
 * Task execution status.
 * Transitions only move forward: PENDING → RUNNING → {COMPLETED, FAILED}.
 */
public enum TaskStatus {
    /** Record created, descriptor waiting in the queue */
    PENDING,
    /** Picked up by a worker (also between retry attempts) */
    RUNNING,
    /** Task logic succeeded, result is set */
    COMPLETED,
    /** Attempts exhausted or the task could not be queued, error is set */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Check whether a record in this status may move to {@code next}. */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == RUNNING || next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /** Lowercase name used on the wire. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
