package taskdock.engine.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults; nothing is reconfigured after construction
 * of the components that read it.
 */
public final class EngineConfig {

    public static final String VIDEO_INFO_CACHE = "video_info";
    public static final String FORMAT_CACHE = "format";
    public static final String VERSION_CACHE = "version";

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskdock;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Scheduler settings
    private int maxConcurrent = 2;
    private boolean autoStart = false;
    private Duration dispatchPollInterval = Duration.ofMillis(500);
    private Duration stopTimeout = Duration.ofSeconds(2);

    // Event bus settings
    private boolean asyncEvents = false;

    // Cache settings
    private Duration cacheCleanupInterval = Duration.ofMinutes(10);
    private CacheSettings defaultCache = CacheSettings.of("default", 100, Duration.ofHours(24));
    private final Map<String, CacheSettings> caches = new LinkedHashMap<>();

    // History settings
    private Duration historyRetention = Duration.ofDays(30);
    private Duration historyPruneInterval = Duration.ofHours(1);

    private EngineConfig() {
        withCache(CacheSettings.of(VIDEO_INFO_CACHE, 50, Duration.ofHours(24)));
        withCache(CacheSettings.of(FORMAT_CACHE, 100, Duration.ofHours(6)));
        withCache(CacheSettings.of(VERSION_CACHE, 10, Duration.ofHours(1)));
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static EngineConfig fromEnv(Map<String, String> env) {
        EngineConfig config = new EngineConfig();

        String dbUrl = env.get("TASKDOCK_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String maxConcurrent = env.get("TASKDOCK_MAX_CONCURRENT");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            config.maxConcurrent = Integer.parseInt(maxConcurrent.trim());
        }

        String autoStart = env.get("TASKDOCK_AUTO_START");
        if (autoStart != null && !autoStart.isBlank()) {
            config.autoStart = Boolean.parseBoolean(autoStart.trim());
        }

        String cleanupSeconds = env.get("TASKDOCK_CACHE_CLEANUP_SECONDS");
        if (cleanupSeconds != null && !cleanupSeconds.isBlank()) {
            config.cacheCleanupInterval = Duration.ofSeconds(Long.parseLong(cleanupSeconds.trim()));
        }

        String retentionDays = env.get("TASKDOCK_HISTORY_RETENTION_DAYS");
        if (retentionDays != null && !retentionDays.isBlank()) {
            config.historyRetention = Duration.ofDays(Long.parseLong(retentionDays.trim()));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public boolean autoStart() {
        return autoStart;
    }

    public Duration dispatchPollInterval() {
        return dispatchPollInterval;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    public boolean asyncEvents() {
        return asyncEvents;
    }

    public Duration cacheCleanupInterval() {
        return cacheCleanupInterval;
    }

    public Duration historyRetention() {
        return historyRetention;
    }

    public Duration historyPruneInterval() {
        return historyPruneInterval;
    }

    /**
     * Settings for a namespace; unknown namespaces get the default capacity and TTL.
     */
    public CacheSettings cacheSettings(String namespace) {
        CacheSettings settings = caches.get(namespace);
        return settings != null ? settings : defaultCache.named(namespace);
    }

    public Map<String, CacheSettings> caches() {
        return Collections.unmodifiableMap(caches);
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public EngineConfig withMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
        return this;
    }

    public EngineConfig withAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
        return this;
    }

    public EngineConfig withDispatchPollInterval(Duration interval) {
        this.dispatchPollInterval = interval;
        return this;
    }

    public EngineConfig withStopTimeout(Duration timeout) {
        this.stopTimeout = timeout;
        return this;
    }

    public EngineConfig withAsyncEvents(boolean asyncEvents) {
        this.asyncEvents = asyncEvents;
        return this;
    }

    public EngineConfig withCacheCleanupInterval(Duration interval) {
        this.cacheCleanupInterval = interval;
        return this;
    }

    public EngineConfig withHistoryRetention(Duration retention) {
        this.historyRetention = retention;
        return this;
    }

    public EngineConfig withHistoryPruneInterval(Duration interval) {
        this.historyPruneInterval = interval;
        return this;
    }

    public EngineConfig withCache(CacheSettings settings) {
        this.caches.put(settings.name(), settings);
        return this;
    }

    public EngineConfig withDefaultCache(int memoryCapacity, Duration defaultTtl) {
        this.defaultCache = CacheSettings.of("default", memoryCapacity, defaultTtl);
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", maxConcurrent=" + maxConcurrent +
                ", autoStart=" + autoStart +
                ", asyncEvents=" + asyncEvents +
                ", caches=" + caches.keySet() +
                '}';
    }
}
