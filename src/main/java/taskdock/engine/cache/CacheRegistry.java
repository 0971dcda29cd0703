package taskdock.engine.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import taskdock.engine.bus.EventBus;
import taskdock.engine.bus.Events;
import taskdock.engine.config.CacheSettings;
import taskdock.engine.config.EngineConfig;
import taskdock.engine.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Holds the single {@link TwoTierCache} of each namespace.
 * Created once by the composition root; every client asks it for its namespace.
 */
public class CacheRegistry {

    private static final Logger log = LoggerFactory.getLogger(CacheRegistry.class);

    private final Database db;
    private final ObjectMapper mapper;
    private final EventBus bus;
    private final EngineConfig config;
    private final Clock clock;

    private final Map<String, Registered<?>> caches = new LinkedHashMap<>();

    public CacheRegistry(Database db, ObjectMapper mapper, EventBus bus, EngineConfig config) {
        this(db, mapper, bus, config, Clock.systemUTC());
    }

    public CacheRegistry(Database db, ObjectMapper mapper, EventBus bus, EngineConfig config, Clock clock) {
        this.db = Objects.requireNonNull(db, "db is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        this.bus = Objects.requireNonNull(bus, "bus is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Get or create the cache for a namespace.
     *
     * @throws IllegalStateException if the namespace was already created for another value type
     */
    @SuppressWarnings("unchecked")
    public synchronized <V> TwoTierCache<V> cache(String namespace, Class<V> valueType) {
        Registered<?> existing = caches.get(namespace);
        if (existing != null) {
            if (!existing.valueType().equals(valueType)) {
                throw new IllegalStateException("Cache " + namespace + " holds " + existing.valueType().getName()
                        + ", not " + valueType.getName());
            }
            return (TwoTierCache<V>) existing.cache();
        }

        CacheSettings settings = config.cacheSettings(namespace);
        TwoTierCache<V> cache = new TwoTierCache<>(
                namespace,
                settings.defaultTtl(),
                new MemoryCache<>(settings.memoryCapacity(), clock),
                new JdbcCache<>(db, namespace, mapper.constructType(valueType), mapper, clock));

        caches.put(namespace, new Registered<>(valueType, cache));
        log.info("Cache {} created (memory {}, ttl {})", namespace, settings.memoryCapacity(), settings.defaultTtl());
        return cache;
    }

    public synchronized List<String> namespaces() {
        return new ArrayList<>(caches.keySet());
    }

    public synchronized List<TwoTierCache<?>> caches() {
        List<TwoTierCache<?>> all = new ArrayList<>();
        caches.values().forEach(r -> all.add(r.cache()));
        return all;
    }

    /**
     * Remove expired durable rows in every namespace.
     *
     * @return rows removed per namespace, only namespaces with removals
     */
    public Map<String, Integer> cleanupExpired() {
        Map<String, Integer> removed = new LinkedHashMap<>();
        for (TwoTierCache<?> cache : caches()) {
            int count = cache.cleanup();
            if (count > 0) {
                removed.put(cache.name(), count);
            }
        }
        return removed;
    }

    /**
     * Clear both tiers of every namespace.
     */
    public void clearAll() {
        for (TwoTierCache<?> cache : caches()) {
            cache.clear();
            bus.publish(Events.CACHE_CLEARED, Map.of(Events.KEY_NAMESPACE, cache.name()));
        }
    }

    private record Registered<V>(Class<V> valueType, TwoTierCache<V> cache) {
    }
}
