package taskdock.engine.scheduler;

import taskdock.engine.model.DownloadRequest;
import taskdock.engine.model.Task;

/**
 * What an executor gets for one run: the task as admitted, its cancellation token,
 * and a hook to report progress back to the scheduler.
 */
public final class TaskContext {

    @FunctionalInterface
    interface ProgressSink {
        void update(String taskId, double percent, String speed, String eta);
    }

    private final Task task;
    private final CancellationToken token;
    private final ProgressSink progressSink;

    TaskContext(Task task, CancellationToken token, ProgressSink progressSink) {
        this.task = task;
        this.token = token;
        this.progressSink = progressSink;
    }

    /** Snapshot taken at admission */
    public Task task() {
        return task;
    }

    public String taskId() {
        return task.id();
    }

    public DownloadRequest request() {
        return task.request();
    }

    public CancellationToken cancellationToken() {
        return token;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public void throwIfCancelled() {
        token.throwIfCancelled();
    }

    /**
     * Update the task's progress and publish {@code download:progress}.
     * Ignored once the task has left RUNNING.
     *
     * @param percent 0 to 100, clamped
     */
    public void reportProgress(double percent, String speed, String eta) {
        progressSink.update(task.id(), percent, speed, eta);
    }

    public void reportProgress(double percent) {
        reportProgress(percent, "", "");
    }
}
