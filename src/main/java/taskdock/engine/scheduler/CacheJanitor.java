package taskdock.engine.scheduler;

import taskdock.engine.bus.EventBus;
import taskdock.engine.bus.Events;
import taskdock.engine.cache.CacheRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Background task that purges expired entries from every registered cache.
 *
 * Expired entries are already invisible to readers; this only reclaims storage.
 * Publishes {@code cache:cleanup} for each namespace that lost entries.
 */
public class CacheJanitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CacheJanitor.class);

    private final CacheRegistry registry;
    private final EventBus bus;

    public CacheJanitor(CacheRegistry registry, EventBus bus) {
        this.registry = registry;
        this.bus = bus;
    }

    @Override
    public void run() {
        try {
            cleanup();
        } catch (Exception e) {
            log.error("Cache janitor error", e);
        }
    }

    /**
     * @return total number of entries removed
     */
    public int cleanup() {
        Map<String, Integer> removed = registry.cleanupExpired();

        if (removed.isEmpty()) {
            log.debug("No expired cache entries");
            return 0;
        }

        int total = 0;
        for (Map.Entry<String, Integer> entry : removed.entrySet()) {
            total += entry.getValue();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(Events.KEY_NAMESPACE, entry.getKey());
            data.put(Events.KEY_REMOVED, entry.getValue());
            bus.publish(Events.CACHE_CLEANUP, data);
        }

        log.info("Cache cleanup removed {} expired entries from {}", total, removed.keySet());
        return total;
    }
}
