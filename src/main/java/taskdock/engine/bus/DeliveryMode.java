package taskdock.engine.bus;

/**
 * How {@link EventBus#publish} hands an event to its subscribers.
 */
public enum DeliveryMode {
    /** Handlers run on the publishing thread before publish returns */
    SYNC,
    /**
     * Event is queued for the single delivery thread. Handlers share that thread,
     * so a stalled handler delays every later async event.
     * Falls back to SYNC while async delivery is disabled.
     */
    ASYNC
}
