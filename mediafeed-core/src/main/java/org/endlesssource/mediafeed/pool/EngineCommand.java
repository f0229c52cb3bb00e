package org.endlesssource.mediafeed.pool;

import org.endlesssource.mediafeed.api.EngineState;
import org.endlesssource.mediafeed.api.MediaEngine;

import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;

/**
 * Message sent to the worker that owns an engine.
 */
interface EngineCommand {

    EngineId id();

    /**
     * @return The one-shot reply for commands that report a result, otherwise null
     */
    default CompletableFuture<Void> reply() {
        return null;
    }

    record Add(EngineId id, MediaEngine engine, EngineEventStream events, EngineStateCell stateCell)
            implements EngineCommand {
    }

    record Remove(EngineId id) implements EngineCommand {
    }

    record SetState(EngineId id, EngineState target, CompletableFuture<Void> reply) implements EngineCommand {
    }

    record Seek(EngineId id, Duration position, OptionalDouble rate, CompletableFuture<Void> reply)
            implements EngineCommand {
    }

    record Resize(EngineId id, int width, int height) implements EngineCommand {
    }
}
