package org.endlesssource.mediafeed.pool;

import org.endlesssource.mediafeed.api.EngineState;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caller-side reference to an engine living on a pool worker.
 * <p>
 * Handles are reference counted: {@link #share()} adds a subscriber and each {@link #close()}
 * drops one. When the last subscriber closes, the engine is stopped and disposed on its worker.
 */
public final class EngineHandle implements AutoCloseable {
    private final EngineWorkerPool pool;
    private final EngineId id;
    private final Path path;
    private final EngineStateCell stateCell;
    private final EngineEventStream events;
    private final AtomicInteger subscribers;
    private final AtomicBoolean closed = new AtomicBoolean();

    EngineHandle(EngineWorkerPool pool, EngineId id, Path path, EngineStateCell stateCell, EngineEventStream events) {
        this(pool, id, path, stateCell, events, new AtomicInteger(1));
    }

    private EngineHandle(EngineWorkerPool pool,
                         EngineId id,
                         Path path,
                         EngineStateCell stateCell,
                         EngineEventStream events,
                         AtomicInteger subscribers) {
        this.pool = pool;
        this.id = id;
        this.path = path;
        this.stateCell = stateCell;
        this.events = events;
        this.subscribers = subscribers;
    }

    public EngineId id() {
        return id;
    }

    public Path path() {
        return path;
    }

    /**
     * Last lifecycle state reported by the engine. Never blocks on the worker.
     */
    public EngineState state() {
        return stateCell.get();
    }

    /**
     * Request a state transition on the owning worker
     * @return Completes once the engine accepted the request, exceptionally if it refused
     */
    public CompletableFuture<Void> setState(EngineState target) {
        Objects.requireNonNull(target, "target must not be null");
        ensureOpen();
        CompletableFuture<Void> reply = new CompletableFuture<>();
        pool.send(new EngineCommand.SetState(id, target, reply));
        return reply;
    }

    public CompletableFuture<Void> seek(Duration position) {
        return seek(position, OptionalDouble.empty());
    }

    /**
     * Seek to {@code position}, optionally switching playback rate. Negative positions clamp to zero.
     */
    public CompletableFuture<Void> seek(Duration position, OptionalDouble rate) {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(rate, "rate must not be null");
        ensureOpen();
        Duration clamped = position.isNegative() ? Duration.ZERO : position;
        CompletableFuture<Void> reply = new CompletableFuture<>();
        pool.send(new EngineCommand.Seek(id, clamped, rate, reply));
        return reply;
    }

    /**
     * Fire-and-forget hint about the video output size.
     */
    public void resize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        ensureOpen();
        pool.send(new EngineCommand.Resize(id, width, height));
    }

    public EngineEventStream events() {
        return events;
    }

    /**
     * Add a subscriber to the same engine
     * @return A new handle that must be closed independently
     * @throws IllegalStateException if this handle is closed
     */
    public EngineHandle share() {
        ensureOpen();
        subscribers.incrementAndGet();
        return new EngineHandle(pool, id, path, stateCell, events, subscribers);
    }

    public int subscriberCount() {
        return subscribers.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (subscribers.decrementAndGet() == 0) {
            pool.send(new EngineCommand.Remove(id));
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Handle for " + id + " is closed");
        }
    }

    @Override
    public String toString() {
        return "EngineHandle{" + id + ", " + path + '}';
    }
}
