package taskdock.engine.bus;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle for one registered handler. Owners close it on their own teardown;
 * closing twice is a no-op.
 */
public final class Subscription implements AutoCloseable {

    private final EventBus bus;
    private final String eventName;
    private final Consumer<Event> handler;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(EventBus bus, String eventName, Consumer<Event> handler) {
        this.bus = bus;
        this.eventName = eventName;
        this.handler = handler;
    }

    public String eventName() {
        return eventName;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Remove the handler from the bus.
     *
     * @return true if this call deactivated the subscription
     */
    public boolean unsubscribe() {
        if (!active.compareAndSet(true, false)) {
            return false;
        }
        bus.remove(this);
        return true;
    }

    @Override
    public void close() {
        unsubscribe();
    }

    Consumer<Event> handler() {
        return handler;
    }

    /** Mark inactive without touching the registry (bulk removal already did). */
    void deactivate() {
        active.set(false);
    }
}
