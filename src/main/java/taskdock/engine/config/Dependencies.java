package taskdock.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import taskdock.engine.bus.EventBus;
import taskdock.engine.cache.CacheRegistry;
import taskdock.engine.history.HistoryRecorder;
import taskdock.engine.repository.HistoryRepository;
import taskdock.engine.scheduler.CacheJanitor;
import taskdock.engine.scheduler.MaintenanceScheduler;
import taskdock.engine.scheduler.TaskScheduler;
import taskdock.engine.store.Database;
import taskdock.engine.store.JdbcHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Manual dependency injection container.
 * Creates and wires the event bus, caches, scheduler and history.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.taskScheduler().setExecutor(myExecutor);
 * deps.startMaintenance(); // cache cleanup, history pruning
 * deps.taskScheduler().start();
 * // ... enqueue work ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final ObjectMapper objectMapper;
    private final EventBus eventBus;
    private final CacheRegistry cacheRegistry;
    private final TaskScheduler taskScheduler;
    private final HistoryRepository historyRepository;
    private final HistoryRecorder historyRecorder;

    // Maintenance (lazy-initialized)
    private MaintenanceScheduler maintenanceScheduler;

    private Dependencies(EngineConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .findAndRegisterModules();

        this.eventBus = new EventBus();
        if (config.asyncEvents()) {
            eventBus.enableAsync();
        }

        // Services
        this.cacheRegistry = new CacheRegistry(database, objectMapper, eventBus, config);
        this.taskScheduler = new TaskScheduler(config, eventBus);

        // History
        this.historyRepository = new JdbcHistoryRepository(database);
        this.historyRecorder = new HistoryRecorder(eventBus, historyRepository);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public CacheRegistry cacheRegistry() {
        return cacheRegistry;
    }

    public TaskScheduler taskScheduler() {
        return taskScheduler;
    }

    public HistoryRepository historyRepository() {
        return historyRepository;
    }

    public HistoryRecorder historyRecorder() {
        return historyRecorder;
    }

    /**
     * Get the maintenance scheduler (creates it if not yet created).
     */
    public MaintenanceScheduler maintenanceScheduler() {
        if (maintenanceScheduler == null) {
            maintenanceScheduler = new MaintenanceScheduler(
                    new CacheJanitor(cacheRegistry, eventBus),
                    this::pruneHistory,
                    config);
        }
        return maintenanceScheduler;
    }

    /**
     * Start periodic cache cleanup and history pruning.
     */
    public void startMaintenance() {
        maintenanceScheduler().start();
    }

    /**
     * Delete history older than the configured retention.
     */
    int pruneHistory() {
        return historyRepository.deleteBefore(Instant.now().minus(config.historyRetention()));
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (maintenanceScheduler != null) {
            try {
                maintenanceScheduler.close();
            } catch (Exception e) {
                log.warn("Error stopping maintenance scheduler: {}", e.getMessage());
            }
        }

        try {
            taskScheduler.close();
        } catch (Exception e) {
            log.warn("Error closing task scheduler: {}", e.getMessage());
        }

        historyRecorder.close();

        try {
            eventBus.close();
        } catch (Exception e) {
            log.warn("Error closing event bus: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
