package taskdock.engine.history;

import taskdock.engine.bus.Event;
import taskdock.engine.bus.EventBus;
import taskdock.engine.bus.Events;
import taskdock.engine.bus.Subscription;
import taskdock.engine.model.HistoryRecord;
import taskdock.engine.model.TaskStatus;
import taskdock.engine.repository.HistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * Writes a history record for every finished download.
 *
 * Listens for {@code download:completed} and {@code download:failed}; cancelled tasks are not recorded.
 */
public class HistoryRecorder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HistoryRecorder.class);

    private final HistoryRepository repository;
    private final Clock clock;
    private final Subscription completedSub;
    private final Subscription failedSub;

    public HistoryRecorder(EventBus bus, HistoryRepository repository) {
        this(bus, repository, Clock.systemUTC());
    }

    public HistoryRecorder(EventBus bus, HistoryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.completedSub = bus.subscribe(Events.DOWNLOAD_COMPLETED, e -> record(e, TaskStatus.COMPLETED));
        this.failedSub = bus.subscribe(Events.DOWNLOAD_FAILED, e -> record(e, TaskStatus.FAILED));
    }

    private void record(Event event, TaskStatus status) {
        String url = event.getString(Events.KEY_URL);
        if (url == null) {
            log.warn("Ignoring {} without url: {}", event.name(), event);
            return;
        }

        HistoryRecord record = new HistoryRecord(
                UUID.randomUUID().toString(),
                event.getString(Events.KEY_TASK_ID),
                url,
                event.getString(Events.KEY_TITLE),
                event.getString(Events.KEY_FILE_PATH),
                status,
                event.getString(Events.KEY_ERROR),
                clock.instant());

        try {
            repository.save(record);
            log.debug("Recorded {} for task {}", status, record.taskId());
        } catch (RuntimeException e) {
            log.error("Failed to record history for task {}", record.taskId(), e);
        }
    }

    public boolean isActive() {
        return completedSub.isActive() || failedSub.isActive();
    }

    @Override
    public void close() {
        completedSub.close();
        failedSub.close();
    }
}
