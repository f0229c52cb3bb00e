package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.EngineEvent;
import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.EngineState;
import org.endlesssource.mediafeed.api.MediaFeedOptions;
import org.endlesssource.mediafeed.pool.EngineHandle;
import org.endlesssource.mediafeed.pool.EngineWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Second stage: builds an engine for each candidate, drives it to PAUSED and moves it to the
 * Ready queue once there is room.
 * <p>
 * Up to {@code prerollCapacity} candidates are worked on at once. A paused entry that finds the
 * Ready queue full stays in the working set and is retried on the next pass.
 */
final class PrerollLoop implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(PrerollLoop.class);

    private final EngineWorkerPool pool;
    private final RootSet roots;
    private final StageChannel<Candidate> input;
    private final ReadyQueue ready;
    private final Consumer<Candidate> releaser;
    private final Consumer<Candidate> duplicateDropper;
    private final int capacity;
    private final Duration pollInterval;
    private final List<Entry> workingSet = new ArrayList<>();
    private volatile int activeCount;

    PrerollLoop(MediaFeedOptions options,
                EngineWorkerPool pool,
                RootSet roots,
                StageChannel<Candidate> input,
                ReadyQueue ready,
                Consumer<Candidate> releaser,
                Consumer<Candidate> duplicateDropper) {
        this.pool = pool;
        this.roots = roots;
        this.input = input;
        this.ready = ready;
        this.releaser = releaser;
        this.duplicateDropper = duplicateDropper;
        this.capacity = options.getPrerollCapacity();
        this.pollInterval = options.getPrerollPollInterval();
    }

    @Override
    public void run() {
        logger.debug("Preroll loop started");
        try {
            while (!ready.isClosed()) {
                boolean waited = advance();
                sweepFailedReady();
                if (workingSet.size() >= capacity || input.isDrained()) {
                    if (workingSet.isEmpty()) {
                        break;
                    }
                    if (!waited) {
                        // every entry is paused and waiting for room
                        Thread.sleep(pollInterval.toMillis());
                    }
                    continue;
                }
                Optional<Candidate> next = input.poll(pollInterval);
                if (next.isEmpty()) {
                    continue;
                }
                admit(next.get());
                for (Candidate candidate : input.drain(capacity - workingSet.size())) {
                    admit(candidate);
                }
                activeCount = workingSet.size();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            for (Entry entry : workingSet) {
                discard(entry);
            }
            workingSet.clear();
            activeCount = 0;
            logger.debug("Preroll loop stopped");
        }
    }

    /**
     * Add a candidate to the working set unless its path is already live here or in the Ready
     * queue. A dropped duplicate leaves the cache entry alone, the live copy owns it.
     */
    private void admit(Candidate candidate) {
        Path path = candidate.path();
        boolean live = ready.containsPath(path);
        for (Entry entry : workingSet) {
            live |= entry.candidate.path().equals(path);
        }
        if (live) {
            logger.debug("Dropping {}: already being prerolled or ready", path);
            duplicateDropper.accept(candidate);
            return;
        }
        workingSet.add(new Entry(candidate));
    }

    /**
     * @return Number of candidates currently being prerolled
     */
    int activeCount() {
        return activeCount;
    }

    /**
     * One pass over the working set
     * @return true if the pass waited on at least one engine's events
     */
    private boolean advance() throws InterruptedException {
        boolean waited = false;
        Iterator<Entry> it = workingSet.iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            waited |= !entry.paused;
            if (!step(entry)) {
                discard(entry);
                it.remove();
            } else if (entry.paused && ready.offer(entry.toReadyMedia(releaser), m -> roots.covers(m.path()))) {
                logger.debug("Ready: {}", entry.candidate.path());
                it.remove();
            }
        }
        activeCount = workingSet.size();
        return waited;
    }

    /**
     * Move one entry along
     * @return false if the entry must be discarded
     */
    private boolean step(Entry entry) throws InterruptedException {
        if (!roots.covers(entry.candidate.path())) {
            logger.debug("Discarding {}: no longer under an enabled root", entry.candidate.path());
            return false;
        }
        if (entry.handle == null) {
            try {
                entry.handle = pool.create(entry.candidate.path());
            } catch (EngineException e) {
                logger.warn("Could not create engine for {}: {}", entry.candidate.path(), e.getMessage());
                return false;
            }
            entry.pauseRequest = entry.handle.setState(EngineState.PAUSED);
        }
        if (entry.pauseRequest.isCompletedExceptionally()) {
            logger.warn("Engine for {} refused to pause", entry.candidate.path());
            return false;
        }
        List<EngineEvent> events = new ArrayList<>();
        if (!entry.paused) {
            entry.handle.events().poll(pollInterval).ifPresent(events::add);
        }
        // paused entries held back by a full Ready queue still get their errors noticed
        events.addAll(entry.handle.events().drain());
        for (EngineEvent event : events) {
            if (event instanceof EngineEvent.Error error) {
                logger.error("Engine error for {}: {}", entry.candidate.path(), error.message());
                return false;
            }
            if (event instanceof EngineEvent.StateChanged changed && changed.to() == EngineState.PAUSED) {
                entry.paused = true;
            }
        }
        if (!entry.paused && entry.handle.state() == EngineState.PAUSED) {
            entry.paused = true;
        }
        return true;
    }

    private void sweepFailedReady() {
        for (ReadyMedia media : ready.removeIf(ReadyMedia::checkFailed)) {
            logger.warn("Dropping {} from the Ready queue after an engine error", media.path());
            media.close();
        }
    }

    private void discard(Entry entry) {
        if (entry.handle != null) {
            entry.handle.close();
        }
        releaser.accept(entry.candidate);
    }

    private static final class Entry {
        private final Candidate candidate;
        private EngineHandle handle;
        private CompletableFuture<Void> pauseRequest;
        private boolean paused;

        private Entry(Candidate candidate) {
            this.candidate = candidate;
        }

        private ReadyMedia toReadyMedia(Consumer<Candidate> releaser) {
            return new ReadyMedia(candidate, handle, releaser);
        }
    }
}
