package taskdock.engine.bus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable event delivered by the {@link EventBus}.
 *
 * @param name      catalogue name, {@code domain:action}
 * @param data      payload; an unmodifiable copy, null values allowed
 * @param timestamp publish time
 * @param source    optional publisher id
 */
public record Event(String name, Map<String, Object> data, Instant timestamp, String source) {

    public Event {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        data = data == null || data.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Event of(String name, Map<String, Object> data) {
        return new Event(name, data, Instant.now(), null);
    }

    /** Typed lookup into {@link #data()}; null when absent. */
    public <T> T get(String key, Class<T> type) {
        Object value = data.get(key);
        return value == null ? null : type.cast(value);
    }

    public String getString(String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return "Event{" + name + ", data=" + data + ", source=" + source + "}";
    }
}
