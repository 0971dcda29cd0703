package taskdock.engine.scheduler;

import taskdock.engine.bus.EventBus;
import taskdock.engine.bus.Events;
import taskdock.engine.config.EngineConfig;
import taskdock.engine.model.DownloadRequest;
import taskdock.engine.model.QueueStatistics;
import taskdock.engine.model.Task;
import taskdock.engine.model.TaskPriority;
import taskdock.engine.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Priority task queue with bounded concurrent execution.
 *
 * A single dispatch thread admits tasks while fewer than {@code maxConcurrent} are running:
 * lowest priority number first, then earliest enqueue. Each admitted task runs on a worker
 * thread through the configured {@link TaskExecutor}, and every transition is announced on
 * the {@link EventBus}.
 *
 * Threading:
 * - the task table, the queue and the active set share one lock
 * - events are always published outside that lock
 * - executor failures are converted to FAILED at the worker boundary and never reach the dispatch loop
 * - cancellation is cooperative; running executors are never interrupted
 *
 * Usage:
 *
 * <pre>
 * TaskScheduler scheduler = new TaskScheduler(config, bus);
 * scheduler.setExecutor(ctx -> downloader.run(ctx));
 * scheduler.start();
 * String id = scheduler.enqueue(DownloadRequest.of(url, dir), TaskPriority.HIGH);
 * </pre>
 */
public class TaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    static final String NO_EXECUTOR_MESSAGE = "No task executor configured";

    private final EventBus bus;
    private final int maxConcurrent;
    private final boolean autoStart;
    private final long pollMillis;
    private final Duration stopTimeout;
    private final Clock clock;

    private final Object lock = new Object();
    private final PriorityQueue<QueueEntry> queue = new PriorityQueue<>();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, CancellationToken> tokens = new HashMap<>();
    private final Set<String> active = new HashSet<>();
    private final AtomicLong sequence = new AtomicLong();

    private final ExecutorService workers;

    private volatile TaskExecutor executor;
    private volatile boolean running = false;
    private volatile boolean paused = false;
    private boolean closed = false;
    private Thread dispatchThread;

    public TaskScheduler(EngineConfig config, EventBus bus) {
        this(bus, config.maxConcurrent(), config.autoStart(), config.dispatchPollInterval(),
                config.stopTimeout(), Clock.systemUTC());
    }

    /**
     * @param bus            where lifecycle events go
     * @param maxConcurrent  maximum tasks running at once, must be positive
     * @param autoStart      start the dispatch loop on the first enqueue
     * @param pollInterval   longest idle wait of the dispatch loop
     * @param stopTimeout    how long {@link #stop()} waits for the dispatch loop
     * @param clock          time source for task timestamps
     * @throws IllegalArgumentException if maxConcurrent &lt; 1
     */
    public TaskScheduler(EventBus bus, int maxConcurrent, boolean autoStart, Duration pollInterval,
            Duration stopTimeout, Clock clock) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.bus = Objects.requireNonNull(bus, "bus is required");
        this.maxConcurrent = maxConcurrent;
        this.autoStart = autoStart;
        this.pollMillis = Math.max(1, pollInterval.toMillis());
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");

        AtomicInteger threadNo = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxConcurrent, r -> {
            Thread t = new Thread(r, "taskdock-worker-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("Task scheduler initialized with {} concurrent slots", maxConcurrent);
    }

    /**
     * Set the callback that performs the work. Without one every admitted task fails.
     */
    public void setExecutor(TaskExecutor executor) {
        this.executor = executor;
    }

    // ---------- Queue operations ----------

    public String enqueue(DownloadRequest request) {
        return enqueue(request, TaskPriority.NORMAL.value(), "");
    }

    public String enqueue(DownloadRequest request, TaskPriority priority) {
        return enqueue(request, priority.value(), "");
    }

    public String enqueue(DownloadRequest request, TaskPriority priority, String title) {
        return enqueue(request, priority.value(), title);
    }

    /**
     * Add a task to the queue and publish {@code queue:task_added}.
     * Starts the dispatch loop if auto-start is on and it is not running.
     * After {@link #close()} the task is still stored but nothing is started.
     *
     * @param priority lower runs first
     * @return the new task id
     */
    public String enqueue(DownloadRequest request, int priority, String title) {
        Objects.requireNonNull(request, "request is required");

        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .priority(priority)
                .createdAt(clock.instant())
                .request(request)
                .title(title != null ? title : "")
                .build();

        boolean startNeeded;
        synchronized (lock) {
            tasks.put(task.id(), task);
            tokens.put(task.id(), new CancellationToken(task.id()));
            queue.add(new QueueEntry(task.priority(), task.createdAt(), sequence.incrementAndGet(), task.id()));
            lock.notifyAll();
            startNeeded = autoStart && !running && !closed;
        }

        log.info("Task queued: {} - {} (priority {})", task.id(), request.url(), priority);
        bus.publish(Events.QUEUE_TASK_ADDED, eventData(task));

        if (startNeeded) {
            start();
        }
        return task.id();
    }

    /**
     * Enqueue several requests with one priority, in list order.
     */
    public List<String> enqueueAll(List<DownloadRequest> requests, TaskPriority priority) {
        List<String> ids = new ArrayList<>(requests.size());
        for (DownloadRequest request : requests) {
            ids.add(enqueue(request, priority));
        }
        return ids;
    }

    /**
     * Withdraw a task that has not started yet. Sets it CANCELLED and publishes
     * {@code queue:task_removed}.
     *
     * @return false if the task is unknown, running, or already finished
     */
    public boolean remove(String taskId) {
        Task removed;
        synchronized (lock) {
            Task task = tasks.get(taskId);
            if (task == null) {
                return false;
            }
            if (task.status() != TaskStatus.PENDING) {
                log.warn("Cannot remove task {} in status {}", taskId, task.status());
                return false;
            }
            removed = transition(task, TaskStatus.CANCELLED, b -> b.completedAt(clock.instant()));
        }

        log.info("Task removed: {}", taskId);
        bus.publish(Events.QUEUE_TASK_REMOVED, eventData(removed));
        return true;
    }

    /**
     * Cancel a pending or running task and publish {@code download:cancelled}.
     * A running executor keeps going until it observes its token.
     *
     * @return false if the task is unknown or already finished
     */
    public boolean cancel(String taskId) {
        Task cancelled;
        synchronized (lock) {
            Task task = tasks.get(taskId);
            if (task == null || task.isTerminal()) {
                return false;
            }
            CancellationToken token = tokens.get(taskId);
            if (token != null) {
                token.cancel();
            }
            cancelled = transition(task, TaskStatus.CANCELLED, b -> b.completedAt(clock.instant()));
        }

        log.info("Task cancelled: {}", taskId);
        bus.publish(Events.DOWNLOAD_CANCELLED, eventData(cancelled));
        return true;
    }

    /**
     * Change the priority of a pending task, keeping its place among equals.
     *
     * @return false unless the task is PENDING
     */
    public boolean updatePriority(String taskId, int priority) {
        synchronized (lock) {
            Task task = tasks.get(taskId);
            if (task == null || task.status() != TaskStatus.PENDING) {
                return false;
            }

            QueueEntry old = null;
            for (Iterator<QueueEntry> it = queue.iterator(); it.hasNext();) {
                QueueEntry entry = it.next();
                if (entry.taskId().equals(taskId)) {
                    old = entry;
                    it.remove();
                    break;
                }
            }
            long seq = old != null ? old.sequence() : sequence.incrementAndGet();
            queue.add(new QueueEntry(priority, task.createdAt(), seq, taskId));
            tasks.put(taskId, task.toBuilder().priority(priority).build());
        }

        log.info("Task {} priority changed to {}", taskId, priority);
        return true;
    }

    public boolean updatePriority(String taskId, TaskPriority priority) {
        return updatePriority(taskId, priority.value());
    }

    // ---------- Lifecycle ----------

    /**
     * Start the dispatch loop and publish {@code queue:started}. No-op if already running.
     *
     * @throws IllegalStateException after {@link #close()}
     */
    public void start() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Task scheduler is closed");
            }
            if (running) {
                log.debug("Task scheduler already running");
                return;
            }
            running = true;
            paused = false;
            dispatchThread = new Thread(this::dispatchLoop, "taskdock-dispatch");
            dispatchThread.setDaemon(true);
            dispatchThread.start();
        }

        bus.publish(Events.QUEUE_STARTED);
        log.info("Task scheduler started");
    }

    /**
     * Stop admitting tasks and wait up to the stop timeout for the dispatch loop to exit.
     * Running executions are left alone. Publishes {@code queue:stopped}.
     */
    public void stop() {
        Thread thread;
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            thread = dispatchThread;
            dispatchThread = null;
            lock.notifyAll();
        }

        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Dispatch loop did not exit within {}ms", stopTimeout.toMillis());
            }
        }

        bus.publish(Events.QUEUE_STOPPED);
        log.info("Task scheduler stopped");
    }

    /**
     * Hold new admissions. Running tasks continue.
     */
    public void pause() {
        synchronized (lock) {
            if (paused) {
                return;
            }
            paused = true;
        }
        bus.publish(Events.QUEUE_PAUSED);
        log.info("Task scheduler paused");
    }

    public void resume() {
        synchronized (lock) {
            if (!paused) {
                return;
            }
            paused = false;
            lock.notifyAll();
        }
        bus.publish(Events.QUEUE_RESUMED);
        log.info("Task scheduler resumed");
    }

    /**
     * Stop the dispatch loop and release the worker pool once running tasks return.
     */
    @Override
    public void close() {
        stop();
        synchronized (lock) {
            closed = true;
        }
        workers.shutdown();
        log.info("Task scheduler closed");
    }

    // ---------- Housekeeping ----------

    /**
     * Drop finished tasks (completed, failed, cancelled) from the task table.
     *
     * @return number of tasks dropped
     */
    public int clearCompleted() {
        int removed = 0;
        synchronized (lock) {
            for (Iterator<Task> it = tasks.values().iterator(); it.hasNext();) {
                Task task = it.next();
                if (task.isTerminal() && !active.contains(task.id())) {
                    it.remove();
                    tokens.remove(task.id());
                    removed++;
                }
            }
        }
        log.info("Cleared {} finished tasks", removed);
        return removed;
    }

    /**
     * Empty the queue and the task table. Running tasks get their cancellation flag set
     * and a {@code download:cancelled} event, but keep their slots until their executors return.
     * Publishes {@code queue:cleared}.
     */
    public void clearAll() {
        List<Task> cancelledRunning = new ArrayList<>();
        synchronized (lock) {
            for (String id : active) {
                CancellationToken token = tokens.get(id);
                if (token != null) {
                    token.cancel();
                }
                Task task = tasks.get(id);
                if (task != null && !task.isTerminal()) {
                    cancelledRunning.add(task);
                }
            }
            queue.clear();
            tasks.clear();
            tokens.clear();
        }

        for (Task task : cancelledRunning) {
            bus.publish(Events.DOWNLOAD_CANCELLED, eventData(task));
        }
        bus.publish(Events.QUEUE_CLEARED);
        log.info("Cleared all tasks ({} running tasks cancelled)", cancelledRunning.size());
    }

    // ---------- Queries ----------

    public Optional<Task> getTask(String taskId) {
        synchronized (lock) {
            return Optional.ofNullable(tasks.get(taskId));
        }
    }

    /** All tasks in enqueue order */
    public List<Task> getAllTasks() {
        synchronized (lock) {
            return new ArrayList<>(tasks.values());
        }
    }

    public List<Task> getTasks(TaskStatus status) {
        synchronized (lock) {
            List<Task> result = new ArrayList<>();
            for (Task task : tasks.values()) {
                if (task.status() == status) {
                    result.add(task);
                }
            }
            return result;
        }
    }

    public QueueStatistics getStatistics() {
        synchronized (lock) {
            int pending = 0, runningCount = 0, completed = 0, failed = 0, cancelled = 0;
            for (Task task : tasks.values()) {
                switch (task.status()) {
                    case PENDING -> pending++;
                    case RUNNING -> runningCount++;
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                    case CANCELLED -> cancelled++;
                }
            }
            return new QueueStatistics(tasks.size(), pending, runningCount, completed, failed, cancelled);
        }
    }

    /** Entries still in the priority queue, including cancelled ones not yet discarded */
    public int queueSize() {
        synchronized (lock) {
            return queue.size();
        }
    }

    /** Occupied execution slots */
    public int activeCount() {
        synchronized (lock) {
            return active.size();
        }
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isPaused() {
        return paused;
    }

    // ---------- Dispatch ----------

    private void dispatchLoop() {
        log.info("Dispatch loop started");

        while (running) {
            try {
                Task admitted;
                CancellationToken token;

                synchronized (lock) {
                    if (!running) {
                        break;
                    }
                    if (paused || queue.isEmpty() || active.size() >= maxConcurrent) {
                        lock.wait(pollMillis);
                        continue;
                    }

                    QueueEntry entry = queue.poll();
                    Task task = tasks.get(entry.taskId());
                    if (task == null || task.status() != TaskStatus.PENDING) {
                        log.debug("Discarding queue entry for {} (not pending)", entry.taskId());
                        continue;
                    }

                    admitted = transition(task, TaskStatus.RUNNING, b -> b.startedAt(clock.instant()));
                    active.add(admitted.id());
                    token = tokens.computeIfAbsent(admitted.id(), CancellationToken::new);
                }

                log.info("Task started: {}", admitted.id());
                try {
                    bus.publish(Events.DOWNLOAD_STARTED, eventData(admitted));
                } catch (Throwable e) {
                    log.error("download:started listener failed for {}", admitted.id(), e);
                }
                submit(admitted, token);

            } catch (InterruptedException e) {
                log.info("Dispatch loop interrupted");
                Thread.currentThread().interrupt();
                break;
            } catch (Throwable e) {
                log.error("Unexpected error in dispatch loop", e);
            }
        }

        log.info("Dispatch loop exited");
    }

    private void submit(Task task, CancellationToken token) {
        try {
            workers.execute(() -> execute(task, token));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected task {}", task.id(), e);
            finishFailed(task.id(), "Worker pool rejected task");
        } catch (Throwable e) {
            log.error("Could not hand task {} to a worker", task.id(), e);
            finishFailed(task.id(), describe(e));
        }
    }

    private void execute(Task task, CancellationToken token) {
        String id = task.id();
        try {
            TaskExecutor current = executor;
            if (current == null) {
                log.warn("No executor set, failing task {}", id);
                finishFailed(id, NO_EXECUTOR_MESSAGE);
                return;
            }

            ExecutionResult result = current.execute(new TaskContext(task, token, this::updateProgress));
            if (result == null) {
                finishFailed(id, "Executor returned no result");
            } else if (result.success()) {
                finishCompleted(id, result.message());
            } else {
                finishFailed(id, result.message());
            }
        } catch (TaskCancelledException e) {
            finishCancelled(id);
        } catch (Throwable e) {
            log.error("Task {} execution failed", id, e);
            finishFailed(id, describe(e));
        } finally {
            release(id);
        }
    }

    private void updateProgress(String taskId, double percent, String speed, String eta) {
        Task updated;
        synchronized (lock) {
            Task task = tasks.get(taskId);
            if (task == null || task.status() != TaskStatus.RUNNING) {
                return;
            }
            updated = task.toBuilder()
                    .progress(Math.max(0.0, Math.min(100.0, percent)))
                    .speed(speed != null ? speed : "")
                    .eta(eta != null ? eta : "")
                    .build();
            tasks.put(taskId, updated);
        }

        Map<String, Object> data = eventData(updated);
        data.put(Events.KEY_PROGRESS, updated.progress());
        data.put(Events.KEY_SPEED, updated.speed());
        data.put(Events.KEY_ETA, updated.eta());
        bus.publish(Events.DOWNLOAD_PROGRESS, data);
    }

    private void finishCompleted(String taskId, String result) {
        Task done = finish(taskId, TaskStatus.COMPLETED, b -> b.progress(100.0).filePath(result));
        if (done != null) {
            log.info("Task completed: {}", taskId);
            Map<String, Object> data = eventData(done);
            data.put(Events.KEY_FILE_PATH, result);
            bus.publish(Events.DOWNLOAD_COMPLETED, data);
        }
    }

    private void finishFailed(String taskId, String error) {
        Task failed = finish(taskId, TaskStatus.FAILED, b -> b.errorMessage(error));
        if (failed != null) {
            log.warn("Task failed: {} - {}", taskId, error);
            Map<String, Object> data = eventData(failed);
            data.put(Events.KEY_ERROR, error);
            bus.publish(Events.DOWNLOAD_FAILED, data);
        }
    }

    private void finishCancelled(String taskId) {
        Task cancelled = finish(taskId, TaskStatus.CANCELLED, UnaryOperator.identity());
        if (cancelled != null) {
            log.info("Task {} stopped on cancellation", taskId);
            bus.publish(Events.DOWNLOAD_CANCELLED, eventData(cancelled));
        }
    }

    /**
     * Apply a terminal transition to a RUNNING task and free its slot.
     *
     * @return the new snapshot, or null if the task was cleared or already terminal
     */
    private Task finish(String taskId, TaskStatus status, UnaryOperator<Task.Builder> changes) {
        synchronized (lock) {
            active.remove(taskId);
            tokens.remove(taskId);
            lock.notifyAll();

            Task task = tasks.get(taskId);
            if (task == null || task.status() != TaskStatus.RUNNING) {
                log.debug("Task {} finished after leaving RUNNING, keeping status", taskId);
                return null;
            }
            return transition(task, status, b -> changes.apply(b).completedAt(clock.instant()));
        }
    }

    private void release(String taskId) {
        synchronized (lock) {
            if (active.remove(taskId)) {
                lock.notifyAll();
            }
        }
    }

    /** Caller holds the lock. */
    private Task transition(Task task, TaskStatus status, UnaryOperator<Task.Builder> changes) {
        Task updated = changes.apply(task.toBuilder().status(status)).build();
        tasks.put(updated.id(), updated);
        return updated;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Map<String, Object> eventData(Task task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(Events.KEY_TASK_ID, task.id());
        data.put(Events.KEY_URL, task.url());
        data.put(Events.KEY_TITLE, task.title());
        return data;
    }

    /**
     * Queue ordering: priority, then enqueue time, then enqueue sequence.
     */
    private record QueueEntry(int priority, Instant createdAt, long sequence, String taskId)
            implements Comparable<QueueEntry> {

        @Override
        public int compareTo(QueueEntry other) {
            int byPriority = Integer.compare(priority, other.priority);
            if (byPriority != 0) {
                return byPriority;
            }
            int byTime = createdAt.compareTo(other.createdAt);
            if (byTime != 0) {
                return byTime;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}
