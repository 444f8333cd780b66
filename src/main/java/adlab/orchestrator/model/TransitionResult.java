package adlab.orchestrator.model;

/**
 * Result of a conditional write to a task record.
 */
public enum TransitionResult {
    /** The write happened */
    APPLIED,

    /** Record is already COMPLETED or FAILED - idempotent no-op */
    ALREADY_TERMINAL,

    /** Record not found */
    NOT_FOUND,

    /** Record exists but its current status does not allow this write */
    REJECTED
}
