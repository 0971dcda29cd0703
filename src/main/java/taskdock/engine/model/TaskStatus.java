package taskdock.engine.model;

/**
 * Task lifecycle status.
 * PENDING -> RUNNING -> {COMPLETED | FAILED | CANCELLED}, plus PENDING -> CANCELLED.
 */
public enum TaskStatus {
    /** Task queued, waiting for a free execution slot */
    PENDING,
    /** Task admitted and handed to the executor */
    RUNNING,
    /** Executor reported success */
    COMPLETED,
    /** Executor reported failure or threw */
    FAILED,
    /** Task cancelled or removed by the caller */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
