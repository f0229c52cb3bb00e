package org.endlesssource.mediafeed.pool;

import org.endlesssource.mediafeed.api.EngineBusListener;
import org.endlesssource.mediafeed.api.EngineEvent;
import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.EngineState;
import org.endlesssource.mediafeed.api.MediaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Event loop of one pool thread. Owns a subset of the live engines and runs every command for
 * them in arrival order, so no engine is ever touched by two threads.
 */
final class EngineWorker implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(EngineWorker.class);

    private final int index;
    private final Consumer<EngineId> onDisposed;
    private final BlockingQueue<EngineCommand> commands = new LinkedBlockingQueue<>();
    // Only touched from the worker thread.
    private final Map<EngineId, OwnedEngine> engines = new HashMap<>();

    /**
     * @param onDisposed Called on the worker thread once an engine is fully torn down
     */
    EngineWorker(int index, Consumer<EngineId> onDisposed) {
        this.index = index;
        this.onDisposed = onDisposed;
    }

    int index() {
        return index;
    }

    void send(EngineCommand command) {
        commands.add(command);
    }

    @Override
    public void run() {
        logger.debug("Engine worker {} started", index);
        while (true) {
            EngineCommand command;
            try {
                command = commands.take();
            } catch (InterruptedException e) {
                logger.info("Engine worker {} interrupted, stopping with {} engines", index, engines.size());
                Thread.currentThread().interrupt();
                return;
            }
            try {
                dispatch(command);
            } catch (RuntimeException e) {
                logger.error("Engine worker {} failed to run {} for {}", index,
                        command.getClass().getSimpleName(), command.id(), e);
                CompletableFuture<Void> reply = command.reply();
                if (reply != null) {
                    reply.completeExceptionally(e);
                }
            }
        }
    }

    private void dispatch(EngineCommand command) {
        if (command instanceof EngineCommand.Add add) {
            addEngine(add);
        } else if (command instanceof EngineCommand.Remove remove) {
            removeEngine(remove.id());
        } else if (command instanceof EngineCommand.SetState setState) {
            OwnedEngine owned = require(setState.id());
            try {
                owned.engine.setState(setState.target());
                owned.stateCell.set(owned.engine.currentState());
                setState.reply().complete(null);
            } catch (EngineException e) {
                setState.reply().completeExceptionally(e);
            }
        } else if (command instanceof EngineCommand.Seek seek) {
            OwnedEngine owned = require(seek.id());
            try {
                owned.engine.seek(seek.position(), seek.rate());
                seek.reply().complete(null);
            } catch (EngineException e) {
                seek.reply().completeExceptionally(e);
            }
        } else if (command instanceof EngineCommand.Resize resize) {
            require(resize.id()).engine.resize(resize.width(), resize.height());
        } else {
            throw new IllegalArgumentException("Unknown engine command: " + command);
        }
    }

    private void addEngine(EngineCommand.Add add) {
        ForwardingObserver observer = new ForwardingObserver(add.events(), add.stateCell());
        add.engine().addBusListener(observer);
        engines.put(add.id(), new OwnedEngine(add.engine(), observer, add.stateCell()));
        logger.debug("Worker {} now owns {} ({} live)", index, add.id(), engines.size());
    }

    private void removeEngine(EngineId id) {
        OwnedEngine owned = engines.remove(id);
        if (owned == null) {
            throw new IllegalStateException("Engine not found on worker " + index + ": " + id);
        }
        try {
            owned.engine.removeBusListener(owned.observer);
            try {
                owned.engine.setState(EngineState.NULL);
            } catch (EngineException e) {
                logger.debug("Failed to stop {} before disposal: {}", id, e.getMessage());
            }
            owned.stateCell.set(EngineState.NULL);
            owned.engine.close();
        } finally {
            onDisposed.accept(id);
        }
        logger.debug("Worker {} disposed {} ({} live)", index, id, engines.size());
    }

    private OwnedEngine require(EngineId id) {
        OwnedEngine owned = engines.get(id);
        if (owned == null) {
            throw new IllegalStateException("Engine not found on worker " + index + ": " + id);
        }
        return owned;
    }

    private static final class OwnedEngine {
        private final MediaEngine engine;
        private final EngineBusListener observer;
        private final EngineStateCell stateCell;

        private OwnedEngine(MediaEngine engine, EngineBusListener observer, EngineStateCell stateCell) {
            this.engine = engine;
            this.observer = observer;
            this.stateCell = stateCell;
        }
    }

    /**
     * Forwards pipeline-level messages only; element-level chatter stays on the bus.
     */
    private static final class ForwardingObserver implements EngineBusListener {
        private final EngineEventStream events;
        private final EngineStateCell stateCell;

        private ForwardingObserver(EngineEventStream events, EngineStateCell stateCell) {
            this.events = events;
            this.stateCell = stateCell;
        }

        @Override
        public void onEndOfStream(MediaEngine engine) {
            events.publish(new EngineEvent.EndOfStream());
        }

        @Override
        public void onError(MediaEngine engine, String message) {
            events.publish(new EngineEvent.Error(message));
        }

        @Override
        public void onStateChanged(MediaEngine engine, boolean pipelineLevel, EngineState from, EngineState to) {
            if (!pipelineLevel) {
                return;
            }
            stateCell.set(to);
            events.publish(new EngineEvent.StateChanged(from, to));
        }
    }
}
