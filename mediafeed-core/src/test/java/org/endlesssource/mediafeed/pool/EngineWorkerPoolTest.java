package org.endlesssource.mediafeed.pool;

import org.endlesssource.mediafeed.api.EngineEvent;
import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.EngineState;
import org.endlesssource.mediafeed.test.FakeEngineProvider;
import org.endlesssource.mediafeed.test.FakeMediaEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class EngineWorkerPoolTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    private FakeEngineProvider provider;
    private EngineWorkerPool pool;

    @BeforeEach
    void setUp() {
        provider = new FakeEngineProvider();
        pool = new EngineWorkerPool(provider, 3);
    }

    @Test
    void workersStartLazily() throws Exception {
        assertFalse(pool.isStarted());
        pool.create(file("a.mp4")).close();
        assertTrue(pool.isStarted());
    }

    @Test
    void stateIsUpdatedOnceSetStateCompletes() throws Exception {
        try (EngineHandle handle = pool.create(file("a.mp4"))) {
            assertEquals(EngineState.READY, handle.state());
            handle.setState(EngineState.PLAYING).get(5, TimeUnit.SECONDS);
            assertEquals(EngineState.PLAYING, handle.state());
        }
    }

    @Test
    void onlyPipelineLevelStateChangesAreForwarded() throws Exception {
        try (EngineHandle handle = pool.create(file("a.mp4"))) {
            handle.setState(EngineState.PAUSED).get(5, TimeUnit.SECONDS);

            Optional<EngineEvent> first = handle.events().poll(WAIT);
            assertEquals(Optional.of(new EngineEvent.StateChanged(EngineState.READY, EngineState.PAUSED)), first);
            assertTrue(handle.events().drain().isEmpty());
        }
    }

    @Test
    void errorsAndEndOfStreamAreForwarded() throws Exception {
        try (EngineHandle handle = pool.create(file("a.mp4"))) {
            FakeMediaEngine engine = awaitEngine(0);
            awaitTrue(() -> engine.listenerCount() == 1);

            engine.postError("boom");
            engine.postEndOfStream();

            assertEquals(Optional.of(new EngineEvent.Error("boom")), handle.events().poll(WAIT));
            assertEquals(Optional.of(new EngineEvent.EndOfStream()), handle.events().poll(WAIT));
        }
    }

    @Test
    void refusedStateCompletesExceptionally() throws Exception {
        try (EngineHandle handle = pool.create(file("refuse.mp4"))) {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> handle.setState(EngineState.PAUSED).get(5, TimeUnit.SECONDS));
            assertInstanceOf(EngineException.class, e.getCause());
            assertEquals(EngineState.READY, handle.state());
        }
    }

    @Test
    void constructionFailureSurfacesToCaller() {
        assertThrows(EngineException.class, () -> pool.create(dir.resolve("unopenable.mp4")));
        assertEquals(0, pool.liveEngineCount());
    }

    @Test
    void enginesAreAssignedRoundRobin() throws Exception {
        for (int i = 0; i < 6; i++) {
            EngineHandle handle = pool.create(file("rr-" + i + ".mp4"));
            assertEquals(OptionalInt.of(i % 3), pool.workerOf(handle.id()));
        }
        assertEquals(6, pool.liveEngineCount());
    }

    @Test
    void everyEngineCallRunsOnItsOwningWorker() throws Exception {
        try (EngineHandle handle = pool.create(file("a.mp4"))) {
            handle.setState(EngineState.PAUSED).get(5, TimeUnit.SECONDS);
            handle.seek(Duration.ofSeconds(3)).get(5, TimeUnit.SECONDS);
            handle.resize(640, 480);
            handle.setState(EngineState.PLAYING).get(5, TimeUnit.SECONDS);

            FakeMediaEngine engine = awaitEngine(0);
            int worker = pool.workerOf(handle.id()).orElseThrow();
            assertEquals(List.of("mediafeed-engine-worker-" + worker), List.copyOf(engine.callingThreads()));
            assertEquals(Duration.ofSeconds(3), engine.position());
        }
    }

    @Test
    void negativeSeekClampsToZero() throws Exception {
        try (EngineHandle handle = pool.create(file("a.mp4"))) {
            handle.setState(EngineState.PAUSED).get(5, TimeUnit.SECONDS);
            handle.seek(Duration.ofSeconds(-4)).get(5, TimeUnit.SECONDS);
            assertEquals(Duration.ZERO, awaitEngine(0).position());
        }
    }

    @Test
    void lastSubscriberCloseDisposesEngine() throws Exception {
        EngineHandle handle = pool.create(file("a.mp4"));
        EngineHandle shared = handle.share();
        assertEquals(2, handle.subscriberCount());
        FakeMediaEngine engine = awaitEngine(0);

        handle.close();
        handle.close();
        assertEquals(1, shared.subscriberCount());
        assertTrue(pool.workerOf(shared.id()).isPresent());

        shared.close();
        awaitTrue(() -> pool.workerOf(shared.id()).isEmpty());
        assertTrue(engine.isClosed());
        assertEquals(EngineState.NULL, shared.state());
        assertEquals(0, engine.listenerCount());
    }

    @Test
    void engineStaysRoutedUntilItsWorkerFinishesTeardown() throws Exception {
        List<EngineHandle> handles = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            handles.add(pool.create(file("live-" + i + ".mp4")));
        }
        awaitTrue(() -> provider.created().stream().allMatch(engine -> engine.listenerCount() == 1));
        handles.forEach(EngineHandle::close);

        // whenever the table has shrunk, the engines it dropped are already closed
        while (pool.liveEngineCount() > 0) {
            long routed = pool.liveEngineCount();
            long closed = provider.created().stream().filter(FakeMediaEngine::isClosed).count();
            assertTrue(closed >= 9 - routed, "closed " + closed + " routed " + routed);
            Thread.sleep(1);
        }
        assertEquals(0L, provider.liveCount());
    }

    @Test
    void closedHandleRejectsCommands() throws Exception {
        EngineHandle handle = pool.create(file("a.mp4"));
        handle.close();
        assertThrows(IllegalStateException.class, () -> handle.setState(EngineState.PLAYING));
        assertThrows(IllegalStateException.class, handle::share);
    }

    @Test
    void commandForUnknownEngineIsFatal() {
        assertThrows(IllegalStateException.class,
                () -> pool.send(new EngineCommand.Remove(new EngineId(Long.MAX_VALUE))));
    }

    @Test
    void resizeRejectsNonPositiveSize() throws Exception {
        try (EngineHandle handle = pool.create(file("a.mp4"))) {
            assertThrows(IllegalArgumentException.class, () -> handle.resize(0, 10));
        }
    }

    private Path file(String name) throws IOException {
        Path file = dir.resolve(name);
        if (!Files.exists(file)) {
            Files.writeString(file, "x");
        }
        return file;
    }

    private FakeMediaEngine awaitEngine(int index) throws InterruptedException {
        awaitTrue(() -> provider.created().size() > index);
        return provider.created().get(index);
    }

    static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + WAIT);
            }
            Thread.sleep(10);
        }
    }
}
