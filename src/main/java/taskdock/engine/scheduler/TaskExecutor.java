package taskdock.engine.scheduler;

/**
 * Performs the work of one admitted task, usually by driving an external downloader process.
 *
 * Called once per task on a worker thread. Implementations should report progress through
 * the context and poll its cancellation token at safe points; the scheduler never interrupts
 * them. Timeouts are the implementation's concern. Any exception thrown here fails the task.
 */
@FunctionalInterface
public interface TaskExecutor {

    ExecutionResult execute(TaskContext context) throws Exception;
}
