package taskdock.engine.model;

/**
 * Named priority levels. Lower value is dispatched first.
 */
public enum TaskPriority {
    HIGH(1),
    NORMAL(2),
    LOW(3);

    private final int value;

    TaskPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
