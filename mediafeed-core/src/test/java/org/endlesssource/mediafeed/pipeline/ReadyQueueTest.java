package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.MediaKind;
import org.endlesssource.mediafeed.pool.EngineHandle;
import org.endlesssource.mediafeed.pool.EngineWorkerPool;
import org.endlesssource.mediafeed.test.FakeEngineProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReadyQueueTest {
    @TempDir
    Path dir;

    private EngineWorkerPool pool;
    private final List<Candidate> released = new ArrayList<>();

    @BeforeEach
    void setUp() {
        pool = new EngineWorkerPool(new FakeEngineProvider(), 1);
    }

    @Test
    void offer_refusesWhenFull() throws Exception {
        ReadyQueue queue = new ReadyQueue(2);
        assertTrue(queue.offer(media("a.mp4")));
        assertTrue(queue.offer(media("b.mp4")));
        assertTrue(queue.isFull());
        assertFalse(queue.offer(media("c.mp4")));
        assertEquals(2, queue.size());
    }

    @Test
    void poll_isFifo() throws Exception {
        ReadyQueue queue = new ReadyQueue(3);
        ReadyMedia first = media("a.mp4");
        ReadyMedia second = media("b.mp4");
        queue.offer(first);
        queue.offer(second);
        assertEquals(Optional.of(first), queue.poll());
        assertEquals(Optional.of(second), queue.poll(Duration.ofMillis(10)));
        assertEquals(Optional.empty(), queue.poll(Duration.ofMillis(10)));
    }

    @Test
    void offer_respectsAdmissionPredicate() throws Exception {
        ReadyQueue queue = new ReadyQueue(3);
        assertFalse(queue.offer(media("a.mp4"), m -> false));
        assertEquals(0, queue.size());
    }

    @Test
    void removeIf_keepsOrderOfRemaining() throws Exception {
        ReadyQueue queue = new ReadyQueue(4);
        queue.offer(media("a.mp4"));
        queue.offer(media("b.jpg"));
        queue.offer(media("c.mp4"));

        List<ReadyMedia> removed = queue.removeIf(m -> m.kind() == MediaKind.IMAGE);
        assertEquals(1, removed.size());
        assertEquals(List.of(dir.resolve("a.mp4"), dir.resolve("c.mp4")), queue.paths());
    }

    @Test
    void close_refusesOffersAndWakesWaiters() throws Exception {
        ReadyQueue queue = new ReadyQueue(1);
        queue.close();
        assertTrue(queue.isClosed());
        assertFalse(queue.offer(media("a.mp4")));
        assertEquals(Optional.empty(), queue.poll(Duration.ofSeconds(5)));
    }

    @Test
    void closingMedia_releasesOnce() throws Exception {
        ReadyMedia media = media("a.mp4");
        media.close();
        media.close();
        assertTrue(media.isClosed());
        assertTrue(media.engine().isClosed());
        assertEquals(1, released.size());
    }

    private ReadyMedia media(String name) throws Exception {
        Path file = Files.writeString(dir.resolve(name), "x");
        Candidate candidate = new Candidate(file, MediaKind.fromPath(file).orElseThrow());
        EngineHandle handle = pool.create(file);
        return new ReadyMedia(candidate, handle, released::add);
    }
}
