package org.endlesssource.mediafeed.pool;

import org.endlesssource.mediafeed.api.EngineEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded stream of pipeline-level events for one engine. Shared by every handle to that engine.
 */
public final class EngineEventStream {
    private final BlockingQueue<EngineEvent> events = new LinkedBlockingQueue<>();

    void publish(EngineEvent event) {
        events.add(event);
    }

    /**
     * Wait up to {@code timeout} for the next event
     * @return The event, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<EngineEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(events.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * @return The next event if one is immediately available
     */
    public Optional<EngineEvent> tryPoll() {
        return Optional.ofNullable(events.poll());
    }

    /**
     * Remove and return every event that is immediately available
     */
    public List<EngineEvent> drain() {
        List<EngineEvent> drained = new ArrayList<>();
        events.drainTo(drained);
        return drained;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
