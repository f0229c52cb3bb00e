package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.EngineEvent;
import org.endlesssource.mediafeed.api.EngineState;
import org.endlesssource.mediafeed.api.MediaKind;
import org.endlesssource.mediafeed.pool.EngineHandle;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A media file whose engine is loaded and paused, ready to play instantly.
 * <p>
 * Whoever withdraws an item from the Ready queue owns it and must {@link #close()} it when done;
 * closing releases the engine and frees the path for sampling again.
 */
public final class ReadyMedia implements AutoCloseable {
    private final Candidate candidate;
    private final EngineHandle engine;
    private final Consumer<Candidate> releaser;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean failed;

    ReadyMedia(Candidate candidate, EngineHandle engine, Consumer<Candidate> releaser) {
        this.candidate = candidate;
        this.engine = engine;
        this.releaser = releaser;
    }

    public Path path() {
        return candidate.path();
    }

    public MediaKind kind() {
        return candidate.kind();
    }

    public EngineHandle engine() {
        return engine;
    }

    /**
     * Ask the engine to start playing.
     */
    public CompletableFuture<Void> play() {
        return engine.setState(EngineState.PLAYING);
    }

    /**
     * Scan pending engine events for a runtime error without blocking. Used while the item sits
     * in the Ready queue, where nobody else consumes its events.
     */
    boolean checkFailed() {
        if (failed) {
            return true;
        }
        for (EngineEvent event : engine.events().drain()) {
            if (event instanceof EngineEvent.Error) {
                failed = true;
            }
        }
        return failed;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        engine.close();
        releaser.accept(candidate);
    }

    @Override
    public String toString() {
        return "ReadyMedia{" + candidate.kind() + ", " + candidate.path() + '}';
    }
}
