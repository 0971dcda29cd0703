package taskdock.engine.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import taskdock.engine.bus.Event;
import taskdock.engine.bus.EventBus;
import taskdock.engine.bus.Events;
import taskdock.engine.cache.CacheRegistry;
import taskdock.engine.cache.MutableClock;
import taskdock.engine.cache.TwoTierCache;
import taskdock.engine.config.CacheSettings;
import taskdock.engine.config.EngineConfig;
import taskdock.engine.store.Database;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheJanitor functionality.
 */
class CacheJanitorTest {

    private static Database db;
    private static EngineConfig config;

    private EventBus bus;
    private MutableClock clock;
    private CacheRegistry registry;
    private List<Event> cleanups;

    @BeforeAll
    static void setup() {
        config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-janitor;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withCache(CacheSettings.of("janitor_a", 10, Duration.ofSeconds(1)))
                .withCache(CacheSettings.of("janitor_b", 10, Duration.ofHours(1)));

        db = new Database(config);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void createRegistry() {
        bus = new EventBus();
        clock = MutableClock.atEpochMillis(1_700_000_000_000L);
        registry = new CacheRegistry(db, new ObjectMapper(), bus, config, clock);
        registry.cache("janitor_a", String.class).clear();
        registry.cache("janitor_b", String.class).clear();

        cleanups = new ArrayList<>();
        bus.subscribe(Events.CACHE_CLEANUP, cleanups::add);
    }

    @Test
    void removesExpiredEntriesAndPublishesPerNamespace() {
        TwoTierCache<String> a = registry.cache("janitor_a", String.class);
        TwoTierCache<String> b = registry.cache("janitor_b", String.class);
        a.set("k1", "v1");
        a.set("k2", "v2");
        b.set("k3", "v3");

        clock.advance(Duration.ofSeconds(10));

        CacheJanitor janitor = new CacheJanitor(registry, bus);
        assertEquals(2, janitor.cleanup());

        assertEquals(0, a.durableSize());
        assertEquals(1, b.durableSize());
        assertEquals(1, cleanups.size());
        assertEquals("janitor_a", cleanups.get(0).getString(Events.KEY_NAMESPACE));
        assertEquals(2, cleanups.get(0).get(Events.KEY_REMOVED, Integer.class));
    }

    @Test
    void nothingExpiredPublishesNothing() {
        registry.cache("janitor_b", String.class).set("k", "v");

        CacheJanitor janitor = new CacheJanitor(registry, bus);
        assertEquals(0, janitor.cleanup());
        assertTrue(cleanups.isEmpty());
    }

    @Test
    void runSwallowsFailures() {
        Database broken = new Database(
                "jdbc:h2:mem:test-janitor-broken;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        CacheRegistry brokenRegistry = new CacheRegistry(broken, new ObjectMapper(), bus, config, clock);
        brokenRegistry.cache("janitor_a", String.class);
        broken.close();

        CacheJanitor janitor = new CacheJanitor(brokenRegistry, bus);
        assertDoesNotThrow(janitor::run);
        assertTrue(cleanups.isEmpty());
    }
}
