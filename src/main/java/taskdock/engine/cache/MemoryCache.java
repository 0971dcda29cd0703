package taskdock.engine.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded in-memory tier with least-recently-used eviction.
 * Reads, writes and {@link #exists} all count as access.
 */
public class MemoryCache<V> implements Cache<V> {

    private static final Logger log = LoggerFactory.getLogger(MemoryCache.class);

    private final Object lock = new Object();
    private final LinkedHashMap<String, CacheEntry<V>> entries;
    private final int capacity;
    private final Clock clock;

    private long evictions = 0;

    public MemoryCache(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public MemoryCache(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock is required");
        // access-order: iteration starts at the least recently touched entry
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    @Override
    public Optional<V> get(String key) {
        synchronized (lock) {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        }
    }

    /**
     * Store with no expiry when ttl is null.
     */
    @Override
    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        put(CacheEntry.of(key, value, clock.instant(), ttl));
    }

    /**
     * Insert an existing entry unchanged, keeping its creation and expiry times.
     * Used when a durable-tier hit is copied into memory.
     */
    public void restore(CacheEntry<V> entry) {
        put(Objects.requireNonNull(entry, "entry is required"));
    }

    @Override
    public boolean delete(String key) {
        synchronized (lock) {
            return entries.remove(key) != null;
        }
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long evictions() {
        synchronized (lock) {
            return evictions;
        }
    }

    private void put(CacheEntry<V> entry) {
        synchronized (lock) {
            if (!entries.containsKey(entry.key())) {
                while (entries.size() >= capacity) {
                    evictEldest();
                }
            }
            entries.put(entry.key(), entry);
        }
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            String evicted = it.next().getKey();
            it.remove();
            evictions++;
            log.debug("Evicted {} (capacity {})", evicted, capacity);
        }
    }
}
