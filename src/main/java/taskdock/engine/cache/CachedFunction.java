package taskdock.engine.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Wraps a lookup function with a cache. Keys are {@code prefix:sha256(json(argument))}.
 *
 * <pre>
 * Function&lt;String, VideoInfo&gt; resolve = CachedFunction.builder(videoInfoCache)
 *         .keyPrefix("video_info")
 *         .ttl(Duration.ofHours(1))
 *         .wrap(resolver::fetch);
 * </pre>
 *
 * Null results are returned but not cached.
 */
public final class CachedFunction<K, V> implements Function<K, V> {

    private final Cache<V> cache;
    private final String keyPrefix;
    private final Duration ttl;
    private final Function<K, V> delegate;

    private CachedFunction(Cache<V> cache, String keyPrefix, Duration ttl, Function<K, V> delegate) {
        this.cache = cache;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
        this.delegate = delegate;
    }

    public static <V> Builder<V> builder(Cache<V> cache) {
        return new Builder<>(cache);
    }

    @Override
    public V apply(K argument) {
        return cache.getOrSet(keyFor(argument), () -> delegate.apply(argument), ttl);
    }

    /**
     * Drop the cached result for one argument.
     */
    public boolean invalidate(K argument) {
        return cache.delete(keyFor(argument));
    }

    public String keyFor(K argument) {
        return CacheKeys.prefixed(keyPrefix, argument);
    }

    public static final class Builder<V> {
        private final Cache<V> cache;
        private String keyPrefix = "";
        private Duration ttl;

        private Builder(Cache<V> cache) {
            this.cache = Objects.requireNonNull(cache, "cache is required");
        }

        public Builder<V> keyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
            return this;
        }

        /** Null means the cache's own default. */
        public Builder<V> ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public <K> CachedFunction<K, V> wrap(Function<K, V> delegate) {
            return new CachedFunction<>(cache, keyPrefix, ttl, Objects.requireNonNull(delegate, "delegate is required"));
        }
    }
}
