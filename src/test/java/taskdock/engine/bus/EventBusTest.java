package taskdock.engine.bus;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventBus delivery and subscription handling.
 */
class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setup() {
        bus = new EventBus();
    }

    @AfterEach
    void teardown() {
        bus.close();
    }

    @Test
    @DisplayName("Publishing with no subscribers is a no-op")
    void publishWithoutSubscribers() {
        assertDoesNotThrow(() -> bus.publish(Events.QUEUE_STARTED));
        assertDoesNotThrow(() -> bus.publish("unknown:event", Map.of("k", "v")));
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    @DisplayName("Handlers run in registration order with the published data")
    void deliversInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        AtomicReference<Event> received = new AtomicReference<>();

        bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> calls.add("first"));
        bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> {
            calls.add("second");
            received.set(e);
        });
        bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> calls.add("third"));

        bus.publish(Events.DOWNLOAD_PROGRESS, Map.of(Events.KEY_PROGRESS, 50.0), "test");

        assertEquals(List.of("first", "second", "third"), calls);
        assertEquals(Events.DOWNLOAD_PROGRESS, received.get().name());
        assertEquals(50.0, received.get().get(Events.KEY_PROGRESS, Double.class));
        assertEquals("test", received.get().source());
        assertNotNull(received.get().timestamp());
    }

    @Test
    @DisplayName("A throwing handler does not stop the others or reach the publisher")
    void handlerExceptionIsIsolated() {
        List<String> calls = new ArrayList<>();

        bus.subscribe(Events.DOWNLOAD_FAILED, e -> calls.add("h1"));
        bus.subscribe(Events.DOWNLOAD_FAILED, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(Events.DOWNLOAD_FAILED, e -> calls.add("h3"));

        assertDoesNotThrow(() -> bus.publish(Events.DOWNLOAD_FAILED, Map.of(Events.KEY_ERROR, "x")));
        assertEquals(List.of("h1", "h3"), calls);
    }

    @Test
    void handlersOnlySeeTheirEvent() {
        AtomicInteger started = new AtomicInteger();
        bus.subscribe(Events.QUEUE_STARTED, e -> started.incrementAndGet());

        bus.publish(Events.QUEUE_STOPPED);
        bus.publish(Events.QUEUE_STARTED);

        assertEquals(1, started.get());
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        AtomicInteger count = new AtomicInteger();
        Subscription sub = bus.subscribe(Events.QUEUE_CLEARED, e -> count.incrementAndGet());

        bus.publish(Events.QUEUE_CLEARED);
        assertTrue(sub.unsubscribe());
        assertFalse(sub.unsubscribe());
        bus.publish(Events.QUEUE_CLEARED);

        assertEquals(1, count.get());
        assertFalse(sub.isActive());
        assertEquals(0, bus.subscriberCount(Events.QUEUE_CLEARED));
    }

    @Test
    void subscriptionClosedDuringDeliveryIsSkipped() {
        List<String> calls = new ArrayList<>();
        Subscription[] second = new Subscription[1];

        bus.subscribe(Events.QUEUE_STARTED, e -> {
            calls.add("first");
            second[0].close();
        });
        second[0] = bus.subscribe(Events.QUEUE_STARTED, e -> calls.add("second"));

        bus.publish(Events.QUEUE_STARTED);

        assertEquals(List.of("first"), calls);
    }

    @Test
    void onceFiresExactlyOnce() {
        AtomicInteger count = new AtomicInteger();
        Subscription sub = bus.once(Events.QUEUE_STARTED, e -> count.incrementAndGet());

        bus.publish(Events.QUEUE_STARTED);
        bus.publish(Events.QUEUE_STARTED);

        assertEquals(1, count.get());
        assertFalse(sub.isActive());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void unsubscribeAllForOneEvent() {
        bus.subscribe(Events.QUEUE_STARTED, e -> { });
        bus.subscribe(Events.QUEUE_STARTED, e -> { });
        bus.subscribe(Events.QUEUE_STOPPED, e -> { });

        assertEquals(3, bus.subscriberCount());
        bus.unsubscribeAll(Events.QUEUE_STARTED);

        assertEquals(0, bus.subscriberCount(Events.QUEUE_STARTED));
        assertEquals(List.of(Events.QUEUE_STOPPED), bus.subscribedEvents());
    }

    @Test
    void clearRemovesEverything() {
        Subscription sub = bus.subscribe(Events.QUEUE_STARTED, e -> { });
        bus.subscribe(Events.CACHE_CLEARED, e -> { });

        bus.clear();

        assertEquals(0, bus.subscriberCount());
        assertTrue(bus.subscribedEvents().isEmpty());
        assertFalse(sub.isActive());
    }

    @Test
    void eventDataIsImmutableAndAllowsNulls() {
        AtomicReference<Event> received = new AtomicReference<>();
        bus.subscribe(Events.DOWNLOAD_COMPLETED, received::set);

        Map<String, Object> data = new HashMap<>();
        data.put(Events.KEY_FILE_PATH, null);
        bus.publish(Events.DOWNLOAD_COMPLETED, data);

        Event event = received.get();
        assertTrue(event.data().containsKey(Events.KEY_FILE_PATH));
        assertNull(event.getString(Events.KEY_FILE_PATH));
        assertThrows(UnsupportedOperationException.class, () -> event.data().put("x", 1));
    }

    @Test
    @DisplayName("Async delivery runs handlers off the publishing thread")
    void asyncDelivery() throws InterruptedException {
        bus.enableAsync();
        assertTrue(bus.isAsyncEnabled());

        CountDownLatch latch = new CountDownLatch(3);
        List<Integer> seen = new CopyOnWriteArrayList<>();
        AtomicReference<String> thread = new AtomicReference<>();

        bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> {
            thread.set(Thread.currentThread().getName());
            seen.add(e.get("n", Integer.class));
            latch.countDown();
        });

        for (int i = 1; i <= 3; i++) {
            bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("n", i), null, DeliveryMode.ASYNC);
        }

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2, 3), seen);
        assertEquals("taskdock-event-delivery", thread.get());

        bus.disableAsync();
        assertFalse(bus.isAsyncEnabled());
    }

    @Test
    void asyncRequestWithoutAsyncEnabledDeliversSynchronously() {
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(Events.QUEUE_STARTED, e -> threads.add(Thread.currentThread().getName()));

        bus.publish(Events.QUEUE_STARTED, Map.of(), null, DeliveryMode.ASYNC);

        assertEquals(List.of(Thread.currentThread().getName()), threads);
    }

    @Test
    @DisplayName("A handler throwing an Error does not stop the others or reach the publisher")
    void handlerErrorIsIsolated() {
        AtomicInteger delivered = new AtomicInteger();

        bus.subscribe(Events.DOWNLOAD_COMPLETED, e -> {
            throw new AssertionError("boom");
        });
        bus.subscribe(Events.DOWNLOAD_COMPLETED, e -> delivered.incrementAndGet());

        assertDoesNotThrow(() -> bus.publish(Events.DOWNLOAD_COMPLETED, Map.of(Events.KEY_TASK_ID, "t1")));
        assertEquals(1, delivered.get());
    }

    @Test
    void asyncDeliverySurvivesHandlerError() throws InterruptedException {
        bus.enableAsync();
        CountDownLatch latch = new CountDownLatch(2);

        bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> {
            if (e.get("n", Integer.class) == 1) {
                throw new StackOverflowError("deep");
            }
        });
        bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> latch.countDown());

        bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("n", 1), null, DeliveryMode.ASYNC);
        bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("n", 2), null, DeliveryMode.ASYNC);

        assertTrue(latch.await(2, TimeUnit.SECONDS), "delivery thread keeps running after an Error");
    }

    @Test
    @DisplayName("Events queued for async delivery are all delivered by the time disableAsync returns")
    void disableAsyncDeliversQueuedEvents() throws InterruptedException {
        bus.enableAsync();
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<Integer> seen = new CopyOnWriteArrayList<>();

        bus.subscribe(Events.DOWNLOAD_PROGRESS, e -> {
            int n = e.get("n", Integer.class);
            if (n == 1) {
                firstStarted.countDown();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            seen.add(n);
        });

        bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("n", 1), null, DeliveryMode.ASYNC);
        assertTrue(firstStarted.await(2, TimeUnit.SECONDS));
        bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("n", 2), null, DeliveryMode.ASYNC);
        bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("n", 3), null, DeliveryMode.ASYNC);
        release.countDown();

        bus.disableAsync();

        assertEquals(List.of(1, 2, 3), seen);
        bus.publish(Events.DOWNLOAD_PROGRESS, Map.of("n", 4), null, DeliveryMode.ASYNC);
        assertEquals(List.of(1, 2, 3, 4), seen);
    }

    @Test
    void onIsAnAliasForSubscribe() {
        List<String> calls = new ArrayList<>();

        Subscription sub = bus.on(Events.QUEUE_PAUSED, e -> calls.add(e.name()));
        bus.publish(Events.QUEUE_PAUSED);
        sub.close();
        bus.publish(Events.QUEUE_PAUSED);

        assertEquals(List.of(Events.QUEUE_PAUSED), calls);
        assertEquals(0, bus.subscriberCount(Events.QUEUE_PAUSED));
    }
}
