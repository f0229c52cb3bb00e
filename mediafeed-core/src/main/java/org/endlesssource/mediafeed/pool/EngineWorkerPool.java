package org.endlesssource.mediafeed.pool;

import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.MediaEngine;
import org.endlesssource.mediafeed.api.MediaFeedOptions;
import org.endlesssource.mediafeed.spi.MediaEngineProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multiplexes many live media engines over a fixed number of dedicated worker threads.
 * <p>
 * Engines are assigned round-robin on creation. The id → worker routing table is consulted for
 * every later command so all operations on one engine run on one thread. Worker threads start on
 * first use and run for the lifetime of the pool.
 */
public final class EngineWorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(EngineWorkerPool.class);

    private final MediaEngineProvider provider;
    private final EngineWorker[] workers;
    private final AtomicInteger nextIndex = new AtomicInteger();
    private final Map<EngineId, Integer> routingTable = new HashMap<>();
    private final Object routingLock = new Object();
    private volatile boolean started;

    public EngineWorkerPool(MediaEngineProvider provider) {
        this(provider, MediaFeedOptions.DEFAULT_WORKER_COUNT);
    }

    public EngineWorkerPool(MediaEngineProvider provider, int workerCount) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workers = new EngineWorker[workerCount];
        for (int i = 0; i < workerCount; i++) {
            workers[i] = new EngineWorker(i, this::erase);
        }
    }

    /**
     * Build an engine for {@code path} and hand it to a worker thread
     * @param path Media file
     * @return Handle holding the only reference to the new engine
     * @throws EngineException if the provider cannot build the engine
     */
    public EngineHandle create(Path path) throws EngineException {
        Objects.requireNonNull(path, "path must not be null");
        ensureStarted();

        MediaEngine engine = provider.create(path);
        EngineId id = EngineId.next();
        EngineStateCell stateCell = new EngineStateCell(engine.currentState());
        EngineEventStream events = new EngineEventStream();

        int index = Math.floorMod(nextIndex.getAndIncrement(), workers.length);
        synchronized (routingLock) {
            routingTable.put(id, index);
        }
        workers[index].send(new EngineCommand.Add(id, engine, events, stateCell));
        logger.debug("Created {} for {} on worker {}", id, path, index);
        return new EngineHandle(this, id, path, stateCell, events);
    }

    public int workerCount() {
        return workers.length;
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * @return Number of engines currently in the routing table
     */
    public int liveEngineCount() {
        synchronized (routingLock) {
            return routingTable.size();
        }
    }

    /**
     * @return Index of the worker owning {@code id}, or empty if the engine is not live
     */
    public OptionalInt workerOf(EngineId id) {
        synchronized (routingLock) {
            Integer index = routingTable.get(id);
            return index == null ? OptionalInt.empty() : OptionalInt.of(index);
        }
    }

    void send(EngineCommand command) {
        int index;
        synchronized (routingLock) {
            Integer routed = routingTable.get(command.id());
            if (routed == null) {
                throw new IllegalStateException("Engine not found in routing table: " + command.id());
            }
            index = routed;
        }
        workers[index].send(command);
    }

    /**
     * Drop the routing entry once the owning worker has disposed the engine, so the table only
     * ever lists live engines.
     */
    private void erase(EngineId id) {
        synchronized (routingLock) {
            routingTable.remove(id);
        }
    }

    private void ensureStarted() {
        if (started) {
            return;
        }
        synchronized (workers) {
            if (started) {
                return;
            }
            for (EngineWorker worker : workers) {
                Thread thread = new Thread(worker, "mediafeed-engine-worker-" + worker.index());
                thread.setDaemon(true);
                thread.start();
            }
            started = true;
            logger.info("Started {} engine worker threads", workers.length);
        }
    }
}
