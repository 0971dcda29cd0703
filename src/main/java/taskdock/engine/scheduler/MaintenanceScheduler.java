package taskdock.engine.scheduler;

import taskdock.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background housekeeping:
 * - CacheJanitor: purges expired durable cache rows
 * - history pruner: drops history older than the retention period
 *
 * Uses a single-threaded executor so housekeeping jobs never overlap.
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ScheduledExecutorService executor;
    private final CacheJanitor cacheJanitor;
    private final Runnable historyPruner;
    private final EngineConfig config;

    private volatile boolean running = false;

    /**
     * @param cacheJanitor  cache cleanup job
     * @param historyPruner runnable that prunes old history
     * @param config        intervals
     */
    public MaintenanceScheduler(CacheJanitor cacheJanitor, Runnable historyPruner, EngineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskdock-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.cacheJanitor = cacheJanitor;
        this.historyPruner = historyPruner;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Maintenance scheduler already running");
            return;
        }

        running = true;

        long cleanupMs = config.cacheCleanupInterval().toMillis();
        executor.scheduleAtFixedRate(cacheJanitor, cleanupMs, cleanupMs, TimeUnit.MILLISECONDS);
        log.info("Cache janitor scheduled every {}ms", cleanupMs);

        long pruneMs = config.historyPruneInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("history-pruner", historyPruner),
                pruneMs,
                pruneMs,
                TimeUnit.MILLISECONDS);
        log.info("History pruner scheduled every {}ms", pruneMs);

        log.info("Maintenance scheduler started");
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Maintenance scheduler forcefully stopped");
            } else {
                log.info("Maintenance scheduler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
        executor.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * For manual triggering.
     */
    public CacheJanitor cacheJanitor() {
        return cacheJanitor;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
