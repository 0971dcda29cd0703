package taskdock.engine.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value with its creation time and optional expiry.
 * Expiry is checked lazily by the tier that holds the entry.
 */
public record CacheEntry<V>(String key, V value, Instant createdAt, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    /**
     * Entry created at {@code now}; a null or non-positive ttl means no expiry.
     */
    public static <V> CacheEntry<V> of(String key, V value, Instant now, Duration ttl) {
        Instant expiresAt = ttl != null && !ttl.isZero() && !ttl.isNegative() ? now.plus(ttl) : null;
        return new CacheEntry<>(key, value, now, expiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
