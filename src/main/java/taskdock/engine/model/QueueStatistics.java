package taskdock.engine.model;

/**
 * Task counts per status, taken under the scheduler lock.
 */
public record QueueStatistics(
        int total,
        int pending,
        int running,
        int completed,
        int failed,
        int cancelled) {

    public int count(TaskStatus status) {
        return switch (status) {
            case PENDING -> pending;
            case RUNNING -> running;
            case COMPLETED -> completed;
            case FAILED -> failed;
            case CANCELLED -> cancelled;
        };
    }
}
