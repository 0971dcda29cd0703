package taskdock.engine.bus;

/**
 * Event name catalogue. New names follow the {@code domain:action} convention.
 */
public final class Events {
    private Events() {}

    // Download lifecycle
    public static final String DOWNLOAD_STARTED = "download:started";
    public static final String DOWNLOAD_PROGRESS = "download:progress";
    public static final String DOWNLOAD_COMPLETED = "download:completed";
    public static final String DOWNLOAD_FAILED = "download:failed";
    public static final String DOWNLOAD_CANCELLED = "download:cancelled";

    // Queue
    public static final String QUEUE_TASK_ADDED = "queue:task_added";
    public static final String QUEUE_TASK_REMOVED = "queue:task_removed";
    public static final String QUEUE_STARTED = "queue:started";
    public static final String QUEUE_STOPPED = "queue:stopped";
    public static final String QUEUE_PAUSED = "queue:paused";
    public static final String QUEUE_RESUMED = "queue:resumed";
    public static final String QUEUE_CLEARED = "queue:cleared";

    // Cache maintenance
    public static final String CACHE_CLEARED = "cache:cleared";
    public static final String CACHE_CLEANUP = "cache:cleanup";

    // Common data keys
    public static final String KEY_TASK_ID = "task_id";
    public static final String KEY_URL = "url";
    public static final String KEY_TITLE = "title";
    public static final String KEY_PROGRESS = "progress";
    public static final String KEY_SPEED = "speed";
    public static final String KEY_ETA = "eta";
    public static final String KEY_FILE_PATH = "file_path";
    public static final String KEY_ERROR = "error";
    public static final String KEY_NAMESPACE = "namespace";
    public static final String KEY_REMOVED = "removed";
}
