package taskdock.engine.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-namespace cache settings.
 *
 * @param name           namespace, also the durable table suffix
 * @param memoryCapacity entries kept in the memory tier
 * @param defaultTtl     expiry used when a write gives none; null for no expiry
 */
public record CacheSettings(String name, int memoryCapacity, Duration defaultTtl) {

    public CacheSettings {
        Objects.requireNonNull(name, "name is required");
        if (memoryCapacity <= 0) {
            throw new IllegalArgumentException("memoryCapacity must be positive: " + memoryCapacity);
        }
    }

    public static CacheSettings of(String name, int memoryCapacity, Duration defaultTtl) {
        return new CacheSettings(name, memoryCapacity, defaultTtl);
    }

    /** Same settings under another namespace name */
    public CacheSettings named(String otherName) {
        return new CacheSettings(otherName, memoryCapacity, defaultTtl);
    }
}
