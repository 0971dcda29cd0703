package taskdock.engine.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag handed to an executor.
 * The scheduler only sets it; the executor decides where it is safe to stop.
 */
public final class CancellationToken {

    private final String taskId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(String taskId) {
        this.taskId = taskId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws TaskCancelledException if the task has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new TaskCancelledException(taskId);
        }
    }

    /**
     * @return true on the first call
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }
}
