package taskdock.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a queued download task.
 * The scheduler owns the task table and replaces the snapshot on every transition,
 * so a Task handed out to callers never changes underneath them.
 */
public final class Task {
    private final String id;
    private final int priority;
    private final Instant createdAt;
    private final DownloadRequest request;
    private final String title;
    private final TaskStatus status;
    private final double progress;
    private final String speed;
    private final String eta;
    private final String errorMessage;
    private final String filePath; // executor result on success
    private final Instant startedAt;
    private final Instant completedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.request = Objects.requireNonNull(builder.request, "request is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.priority = builder.priority;
        this.title = builder.title;
        this.progress = builder.progress;
        this.speed = builder.speed;
        this.eta = builder.eta;
        this.errorMessage = builder.errorMessage;
        this.filePath = builder.filePath;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public int priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public DownloadRequest request() {
        return request;
    }

    public String url() {
        return request.url();
    }

    public String title() {
        return title;
    }

    public TaskStatus status() {
        return status;
    }

    public double progress() {
        return progress;
    }

    public String speed() {
        return speed;
    }

    public String eta() {
        return eta;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String filePath() {
        return filePath;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this task (for transitions) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .priority(priority)
                .createdAt(createdAt)
                .request(request)
                .title(title)
                .status(status)
                .progress(progress)
                .speed(speed)
                .eta(eta)
                .errorMessage(errorMessage)
                .filePath(filePath)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int priority = TaskPriority.NORMAL.value();
        private Instant createdAt;
        private DownloadRequest request;
        private String title = "";
        private TaskStatus status = TaskStatus.PENDING;
        private double progress = 0.0;
        private String speed = "";
        private String eta = "";
        private String errorMessage;
        private String filePath;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority.value();
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder request(DownloadRequest request) {
            this.request = request;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder speed(String speed) {
            this.speed = speed;
            return this;
        }

        public Builder eta(String eta) {
            this.eta = eta;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", priority=" + priority + ", url='" + url() + "'}";
    }
}
