package taskdock.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One finished download, as written by the history recorder.
 */
public record HistoryRecord(
        String id,
        String taskId,
        String url,
        String title,
        String filePath,
        TaskStatus status,
        String errorMessage,
        Instant recordedAt) {

    public HistoryRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(recordedAt, "recordedAt is required");
    }

    public boolean succeeded() {
        return status == TaskStatus.COMPLETED;
    }
}
