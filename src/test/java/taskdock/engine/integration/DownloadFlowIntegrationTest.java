package taskdock.engine.integration;

import taskdock.engine.cache.CachedFunction;
import taskdock.engine.cache.TwoTierCache;
import taskdock.engine.config.Dependencies;
import taskdock.engine.config.EngineConfig;
import taskdock.engine.model.DownloadRequest;
import taskdock.engine.model.HistoryRecord;
import taskdock.engine.model.TaskPriority;
import taskdock.engine.model.TaskStatus;
import taskdock.engine.scheduler.ExecutionResult;
import taskdock.engine.scheduler.TaskScheduler;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flow through the composition root:
 * 1. Enqueue downloads with mixed priorities
 * 2. Executor resolves metadata through the video_info cache
 * 3. Finished downloads land in history
 */
class DownloadFlowIntegrationTest {

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-flow-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withMaxConcurrent(2)
                .withDispatchPollInterval(Duration.ofMillis(20));
        deps = Dependencies.create(config);
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Full flow: enqueue, execute with cached metadata, record history")
    void fullDownloadFlow() throws InterruptedException {
        TwoTierCache<String> videoInfo = deps.cacheRegistry().cache(EngineConfig.VIDEO_INFO_CACHE, String.class);
        AtomicInteger lookups = new AtomicInteger();
        CachedFunction<String, String> titleOf = CachedFunction.builder(videoInfo)
                .keyPrefix("title")
                .wrap(url -> {
                    lookups.incrementAndGet();
                    return "Title for " + url;
                });

        TaskScheduler scheduler = deps.taskScheduler();
        scheduler.setExecutor(ctx -> {
            String url = ctx.request().url();
            if (url.contains("private")) {
                return ExecutionResult.failure("Private video");
            }
            String title = titleOf.apply(url);
            ctx.reportProgress(50.0);
            return ExecutionResult.success(ctx.request().outputDir() + "/" + title + ".mp4");
        });

        List<String> ids = scheduler.enqueueAll(List.of(
                DownloadRequest.of("https://example.com/watch?v=1", "/tmp/dl"),
                DownloadRequest.of("https://example.com/watch?v=1", "/tmp/dl"),
                DownloadRequest.of("https://example.com/private", "/tmp/dl")), TaskPriority.NORMAL);
        scheduler.start();

        waitFor(() -> deps.historyRepository().count() == 3);

        assertEquals(TaskStatus.FAILED, scheduler.getTask(ids.get(2)).orElseThrow().status());
        assertEquals("/tmp/dl/Title for https://example.com/watch?v=1.mp4",
                scheduler.getTask(ids.get(0)).orElseThrow().filePath());
        assertTrue(lookups.get() <= 2, "second lookup of the same url is usually a cache hit");
        assertTrue(videoInfo.exists(titleOf.keyFor("https://example.com/watch?v=1")));

        assertEquals(2, deps.historyRepository().countByStatus(TaskStatus.COMPLETED));
        List<HistoryRecord> failed = deps.historyRepository().findByUrl("https://example.com/private");
        assertEquals(1, failed.size());
        assertEquals("Private video", failed.get(0).errorMessage());
    }

    @Test
    void asyncEventsAreEnabledFromConfig() {
        deps.close();
        deps = Dependencies.create(EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-flow-async-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withAsyncEvents(true));

        assertTrue(deps.eventBus().isAsyncEnabled());
        assertTrue(deps.historyRecorder().isActive());
    }

    @Test
    void maintenanceStartsAndStopsWithDependencies() {
        deps.startMaintenance();
        assertTrue(deps.maintenanceScheduler().isRunning());
        assertEquals(0, deps.maintenanceScheduler().cacheJanitor().cleanup());

        deps.close();
        assertFalse(deps.maintenanceScheduler().isRunning());
        assertTrue(deps.database().isClosed());
        deps = null;
    }
}
