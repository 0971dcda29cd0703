package taskdock.engine.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Publish/subscribe hub shared by the scheduler, the caches and any listener.
 *
 * One instance per process, created by {@link taskdock.engine.config.Dependencies}
 * and passed to whoever needs it.
 *
 * Delivery rules:
 * - handlers for one publish run in registration order
 * - a handler that throws is logged and skipped; the rest still run and the publisher never sees it
 * - closed subscriptions are skipped and pruned on the next publish to their event name
 *
 * Usage:
 *
 * <pre>
 * Subscription sub = bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> render(e.data()));
 * bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("progress", 50.0));
 * sub.close();
 * </pre>
 */
public final class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final Event STOP = new Event("__stop__", Map.of(), Instant.EPOCH, null);
    private static final long POLL_MS = 100;
    private static final long JOIN_MS = 2000;

    private final Object lock = new Object();
    private final Map<String, List<Subscription>> subscribers = new HashMap<>();
    private final BlockingQueue<Event> asyncQueue = new LinkedBlockingQueue<>();

    private volatile boolean asyncEnabled = false;
    private volatile boolean deliveryRunning = false;
    private Thread deliveryThread;

    /**
     * Register a handler.
     *
     * @param eventName event to listen for
     * @param handler   callback, invoked with each matching event
     * @return handle that removes the handler when closed
     */
    public Subscription subscribe(String eventName, Consumer<Event> handler) {
        Objects.requireNonNull(eventName, "eventName is required");
        Objects.requireNonNull(handler, "handler is required");

        Subscription subscription = new Subscription(this, eventName, handler);
        register(subscription);
        log.debug("Subscribed to {}", eventName);
        return subscription;
    }

    /**
     * Alias for {@link #subscribe(String, Consumer)}.
     */
    public Subscription on(String eventName, Consumer<Event> handler) {
        return subscribe(eventName, handler);
    }

    /**
     * Register a handler that removes itself after its first delivery.
     */
    public Subscription once(String eventName, Consumer<Event> handler) {
        Objects.requireNonNull(handler, "handler is required");

        AtomicBoolean fired = new AtomicBoolean(false);
        Subscription[] holder = new Subscription[1];
        Consumer<Event> wrapper = event -> {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                handler.accept(event);
            } finally {
                holder[0].unsubscribe();
            }
        };
        holder[0] = new Subscription(this, Objects.requireNonNull(eventName, "eventName is required"), wrapper);
        register(holder[0]);
        return holder[0];
    }

    /**
     * Drop every subscription for all events.
     */
    public void unsubscribeAll() {
        synchronized (lock) {
            subscribers.values().forEach(list -> list.forEach(Subscription::deactivate));
            subscribers.clear();
        }
        log.debug("Removed all subscriptions");
    }

    /**
     * Drop every subscription for one event.
     */
    public void unsubscribeAll(String eventName) {
        synchronized (lock) {
            List<Subscription> removed = subscribers.remove(eventName);
            if (removed != null) {
                removed.forEach(Subscription::deactivate);
            }
        }
        log.debug("Removed all subscriptions for {}", eventName);
    }

    public void publish(String eventName) {
        publish(eventName, Map.of(), null, DeliveryMode.SYNC);
    }

    public void publish(String eventName, Map<String, Object> data) {
        publish(eventName, data, null, DeliveryMode.SYNC);
    }

    public void publish(String eventName, Map<String, Object> data, String source) {
        publish(eventName, data, source, DeliveryMode.SYNC);
    }

    /**
     * Build an event and deliver it to the current subscribers of its name.
     * Publishing with no subscribers is a no-op.
     */
    public void publish(String eventName, Map<String, Object> data, String source, DeliveryMode mode) {
        Event event = new Event(eventName, data, Instant.now(), source);

        if (mode == DeliveryMode.ASYNC) {
            synchronized (lock) {
                if (asyncEnabled) {
                    asyncQueue.offer(event);
                    return;
                }
            }
        }
        dispatch(event);
    }

    /**
     * Start the delivery thread used by {@link DeliveryMode#ASYNC}.
     */
    public void enableAsync() {
        synchronized (lock) {
            if (asyncEnabled) {
                return;
            }
            asyncEnabled = true;
            deliveryRunning = true;
            deliveryThread = new Thread(this::deliveryLoop, "taskdock-event-delivery");
            deliveryThread.setDaemon(true);
            deliveryThread.start();
        }
        log.info("Async event delivery enabled");
    }

    /**
     * Stop the delivery thread. Events queued before this call are still delivered,
     * by the thread or, once it has exited, on the calling thread.
     */
    public void disableAsync() {
        Thread thread;
        synchronized (lock) {
            if (!asyncEnabled) {
                return;
            }
            asyncEnabled = false;
            thread = deliveryThread;
            deliveryThread = null;
        }

        asyncQueue.offer(STOP);
        try {
            thread.join(JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        deliveryRunning = false;

        if (thread.isAlive()) {
            log.warn("Event delivery thread did not stop within {}ms", JOIN_MS);
            return;
        }

        // Anything still queued behind STOP is delivered on the caller's thread.
        List<Event> leftover = new ArrayList<>();
        asyncQueue.drainTo(leftover);
        for (Event event : leftover) {
            if (event != STOP) {
                dispatch(event);
            }
        }
        log.info("Async event delivery disabled");
    }

    public boolean isAsyncEnabled() {
        return asyncEnabled;
    }

    /**
     * Number of active subscriptions across all events.
     */
    public int subscriberCount() {
        synchronized (lock) {
            int count = 0;
            for (List<Subscription> list : subscribers.values()) {
                count += countActive(list);
            }
            return count;
        }
    }

    public int subscriberCount(String eventName) {
        synchronized (lock) {
            return countActive(subscribers.getOrDefault(eventName, List.of()));
        }
    }

    /**
     * Names that currently have at least one active subscription.
     */
    public List<String> subscribedEvents() {
        synchronized (lock) {
            List<String> names = new ArrayList<>();
            subscribers.forEach((name, list) -> {
                if (countActive(list) > 0) {
                    names.add(name);
                }
            });
            return names;
        }
    }

    /**
     * Drop all subscriptions and any queued async events. Used for test isolation.
     */
    public void clear() {
        unsubscribeAll();
        asyncQueue.removeIf(event -> event != STOP);
        log.info("Event bus cleared");
    }

    @Override
    public void close() {
        disableAsync();
    }

    // Package-private: used by Subscription

    void remove(Subscription subscription) {
        synchronized (lock) {
            List<Subscription> list = subscribers.get(subscription.eventName());
            if (list == null) {
                return;
            }
            list.remove(subscription);
            if (list.isEmpty()) {
                subscribers.remove(subscription.eventName());
            }
        }
        log.debug("Unsubscribed from {}", subscription.eventName());
    }

    // Internal

    private void register(Subscription subscription) {
        synchronized (lock) {
            subscribers.computeIfAbsent(subscription.eventName(), k -> new ArrayList<>()).add(subscription);
        }
    }

    private void dispatch(Event event) {
        List<Subscription> snapshot;
        synchronized (lock) {
            List<Subscription> list = subscribers.get(event.name());
            if (list == null || list.isEmpty()) {
                return;
            }
            snapshot = new ArrayList<>(list);
        }

        List<Subscription> stale = new ArrayList<>();
        for (Subscription subscription : snapshot) {
            if (!subscription.isActive()) {
                stale.add(subscription);
                continue;
            }
            try {
                subscription.handler().accept(event);
            } catch (Throwable e) {
                log.error("Event handler error ({})", event.name(), e);
            }
        }

        if (!stale.isEmpty()) {
            synchronized (lock) {
                List<Subscription> list = subscribers.get(event.name());
                if (list != null) {
                    list.removeAll(stale);
                    if (list.isEmpty()) {
                        subscribers.remove(event.name());
                    }
                }
            }
            log.debug("Pruned {} stale subscriptions for {}", stale.size(), event.name());
        }
    }

    private void deliveryLoop() {
        while (deliveryRunning) {
            try {
                Event event = asyncQueue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                if (event == STOP) {
                    break;
                }
                dispatch(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Throwable e) {
                log.error("Async event delivery error", e);
            }
        }
        log.debug("Event delivery loop exited");
    }

    private static int countActive(List<Subscription> list) {
        int count = 0;
        for (Subscription subscription : list) {
            if (subscription.isActive()) {
                count++;
            }
        }
        return count;
    }
}
