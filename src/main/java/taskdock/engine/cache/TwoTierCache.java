package taskdock.engine.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Memory tier in front of a durable tier.
 *
 * Reads check memory first, then the durable tier; a durable hit is copied into memory
 * with its original expiry. Writes, deletes and clears go to both tiers. No lock spans
 * the two tiers, so concurrent callers may see one cycle of staleness or run a factory twice.
 */
public class TwoTierCache<V> implements Cache<V> {

    private static final Logger log = LoggerFactory.getLogger(TwoTierCache.class);

    private final String name;
    private final Duration defaultTtl;
    private final MemoryCache<V> memory;
    private final JdbcCache<V> durable;

    public TwoTierCache(String name, Duration defaultTtl, MemoryCache<V> memory, JdbcCache<V> durable) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.defaultTtl = defaultTtl;
        this.memory = Objects.requireNonNull(memory, "memory is required");
        this.durable = Objects.requireNonNull(durable, "durable is required");
    }

    public String name() {
        return name;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public Optional<V> get(String key) {
        Optional<V> hit = memory.get(key);
        if (hit.isPresent()) {
            return hit;
        }

        Optional<CacheEntry<V>> stored = durable.getEntry(key);
        if (stored.isPresent()) {
            memory.restore(stored.get());
            log.debug("Cache {} durable hit for {}", name, key);
            return Optional.of(stored.get().value());
        }
        return Optional.empty();
    }

    /**
     * Write to both tiers. A null ttl uses this cache's default.
     */
    @Override
    public void set(String key, V value, Duration ttl) {
        Duration effective = ttl != null ? ttl : defaultTtl;
        memory.set(key, value, effective);
        durable.set(key, value, effective);
    }

    @Override
    public boolean delete(String key) {
        boolean inMemory = memory.delete(key);
        boolean inDurable = durable.delete(key);
        return inMemory || inDurable;
    }

    @Override
    public boolean exists(String key) {
        return memory.exists(key) || durable.exists(key);
    }

    @Override
    public void clear() {
        memory.clear();
        durable.clear();
        log.info("Cache {} cleared", name);
    }

    /**
     * Remove expired rows from the durable tier.
     *
     * @return rows removed
     */
    public int cleanup() {
        return durable.cleanupExpired();
    }

    public int memorySize() {
        return memory.size();
    }

    public int durableSize() {
        return durable.size();
    }

    MemoryCache<V> memory() {
        return memory;
    }

    JdbcCache<V> durable() {
        return durable;
    }
}
