package taskdock.engine.scheduler;

/**
 * Outcome reported by a {@link TaskExecutor}.
 *
 * @param success whether the work finished
 * @param message result (e.g. output file path) on success, error text on failure
 */
public record ExecutionResult(boolean success, String message) {

    public static ExecutionResult success(String result) {
        return new ExecutionResult(true, result);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, error);
    }
}
