package taskdock.engine.scheduler;

/**
 * Thrown by an executor that observed its cancellation token.
 * The scheduler ends the task as CANCELLED instead of FAILED.
 */
public class TaskCancelledException extends RuntimeException {

    private final String taskId;

    public TaskCancelledException(String taskId) {
        super("Task cancelled: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
