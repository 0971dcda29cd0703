package taskdock.engine.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Keyed store with optional per-entry expiry.
 * Implemented by each tier and by the composed {@link TwoTierCache}.
 *
 * @param <V> value type
 */
public interface Cache<V> {

    /**
     * Look up a value. An expired entry is removed and reported absent.
     */
    Optional<V> get(String key);

    /**
     * Store a value with the implementation's default expiry.
     */
    default void set(String key, V value) {
        set(key, value, null);
    }

    /**
     * Store a value, replacing any previous entry for the key.
     *
     * @param ttl time to live; null uses the implementation's default
     */
    void set(String key, V value, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    boolean exists(String key);

    void clear();

    default V getOrSet(String key, Supplier<V> factory) {
        return getOrSet(key, factory, null);
    }

    /**
     * Return the cached value, or call {@code factory} once and cache a non-null result.
     * Concurrent callers for the same missing key may each invoke the factory,
     * so factories should be idempotent.
     */
    default V getOrSet(String key, Supplier<V> factory, Duration ttl) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        V value = factory.get();
        if (value != null) {
            set(key, value, ttl);
        }
        return value;
    }
}
