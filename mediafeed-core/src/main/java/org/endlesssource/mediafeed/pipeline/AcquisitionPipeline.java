package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.MediaFeedOptions;
import org.endlesssource.mediafeed.api.MediaKind;
import org.endlesssource.mediafeed.dedup.OutstandingPathCache;
import org.endlesssource.mediafeed.pool.EngineWorkerPool;
import org.endlesssource.mediafeed.sampler.RandomFileSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps a bounded queue of randomly chosen, preloaded media topped up in the background.
 * <p>
 * Two stage threads run once {@link #start()} is called:
 * <ul>
 *     <li>Discover samples files from the enabled roots and removes duplicates</li>
 *     <li>Preroll builds an engine for each candidate and pauses it</li>
 * </ul>
 * Paused engines land in the Ready queue, from which the consumer withdraws with {@link #nextReady()}.
 * Withdrawn items belong to the consumer and must be closed when no longer needed.
 */
public final class AcquisitionPipeline implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AcquisitionPipeline.class);
    private static final Duration STAGE_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final MediaFeedOptions options;
    private final RootSet roots;
    private final OutstandingPathCache cache;
    private final OutstandingCounters counters = new OutstandingCounters();
    private final StageChannel<Candidate> pending;
    private final ReadyQueue ready;
    private final DiscoverLoop discoverLoop;
    private final PrerollLoop prerollLoop;
    private final Object lifecycleLock = new Object();
    private Thread discoverThread;
    private Thread prerollThread;
    private boolean closed;

    public AcquisitionPipeline(MediaFeedOptions options, RootSet roots, EngineWorkerPool pool) {
        this(options, roots, pool, new RandomFileSampler());
    }

    public AcquisitionPipeline(MediaFeedOptions options,
                               RootSet roots,
                               EngineWorkerPool pool,
                               RandomFileSampler sampler) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.roots = Objects.requireNonNull(roots, "roots must not be null");
        Objects.requireNonNull(pool, "pool must not be null");
        Objects.requireNonNull(sampler, "sampler must not be null");
        this.cache = new OutstandingPathCache(options.getDedupCapacity());
        this.pending = new StageChannel<>(options.getDiscoverCapacity());
        this.ready = new ReadyQueue(options.getReadyCapacity());
        this.discoverLoop = new DiscoverLoop(options, roots, sampler, cache, counters, ready, pending, this::release);
        this.prerollLoop = new PrerollLoop(options, pool, roots, pending, ready, this::release, this::dropDuplicate);
    }

    /**
     * Start the Discover and Preroll threads. Calling this more than once has no effect.
     * @throws IllegalStateException if the pipeline was closed
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Pipeline is closed");
            }
            if (discoverThread != null) {
                return;
            }
            discoverThread = stageThread(discoverLoop, "mediafeed-discover");
            prerollThread = stageThread(prerollLoop, "mediafeed-preroll");
            prerollThread.start();
            discoverThread.start();
            logger.info("Acquisition pipeline started with roots {}", roots.enabledRoots());
        }
    }

    public boolean isStarted() {
        synchronized (lifecycleLock) {
            return discoverThread != null && !closed;
        }
    }

    /**
     * Withdraw the oldest ready item without waiting
     */
    public Optional<ReadyMedia> nextReady() {
        return ready.poll();
    }

    /**
     * Withdraw the oldest ready item, waiting up to {@code timeout}
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<ReadyMedia> nextReady(Duration timeout) throws InterruptedException {
        return ready.poll(timeout);
    }

    public ReadyQueue readyQueue() {
        return ready;
    }

    public RootSet roots() {
        return roots;
    }

    public MediaFeedOptions options() {
        return options;
    }

    /**
     * @return true if {@code path} is currently somewhere between sampling and release
     */
    public boolean isOutstanding(Path path) {
        return cache.contains(path);
    }

    public QueueStatus status() {
        return new QueueStatus(
                ready.size(),
                ready.capacity(),
                prerollLoop.activeCount(),
                pending.size(),
                counters.get(MediaKind.VIDEO),
                counters.get(MediaKind.IMAGE),
                counters.get(MediaKind.AUDIO),
                cache.size());
    }

    /**
     * Enable or disable a known root. Disabling evicts Ready items that are no longer covered.
     * @return true if the root changed state
     */
    public boolean setRootEnabled(Path root, boolean enabled) {
        boolean changed = roots.setEnabled(root, enabled);
        if (changed) {
            logger.info("Root {} {}", root, enabled ? "enabled" : "disabled");
            evictUncovered();
        }
        return changed;
    }

    /**
     * Apply several enable/disable changes, then evict once
     */
    public void updateRoots(Map<Path, Boolean> changes) {
        boolean changed = false;
        for (Map.Entry<Path, Boolean> change : changes.entrySet()) {
            changed |= roots.setEnabled(change.getKey(), change.getValue());
        }
        if (changed) {
            logger.info("Roots updated, enabled: {}", roots.enabledRoots());
            evictUncovered();
        }
    }

    public boolean addRoot(Path root) {
        boolean added = roots.add(root);
        if (added) {
            logger.info("Root {} added", root);
        }
        return added;
    }

    public boolean removeRoot(Path root) {
        boolean removed = roots.remove(root);
        if (removed) {
            logger.info("Root {} removed", root);
            evictUncovered();
        }
        return removed;
    }

    /**
     * Close and release every queued Ready item. Items already withdrawn are not affected.
     * @return Number of items dropped
     */
    public int resetQueue() {
        List<ReadyMedia> dropped = ready.drainAll();
        dropped.forEach(ReadyMedia::close);
        if (!dropped.isEmpty()) {
            logger.info("Ready queue reset, dropped {} items", dropped.size());
        }
        return dropped.size();
    }

    /**
     * Evict Ready items whose path is not under an enabled root
     * @return Number of items evicted
     */
    int evictUncovered() {
        List<ReadyMedia> evicted = ready.removeIf(media -> !roots.covers(media.path()));
        for (ReadyMedia media : evicted) {
            logger.debug("Evicting {}: root disabled", media.path());
            media.close();
        }
        return evicted.size();
    }

    void release(Candidate candidate) {
        cache.release(candidate.path());
        counters.decrement(candidate.kind());
    }

    /**
     * Forget a candidate whose path is already live elsewhere. Its cache entry belongs to the
     * live copy and stays.
     */
    void dropDuplicate(Candidate candidate) {
        counters.decrement(candidate.kind());
    }

    /**
     * Stop both stage threads and release everything still queued. Items already withdrawn stay
     * valid until their owner closes them.
     */
    @Override
    public void close() {
        Thread discover;
        Thread preroll;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            discover = discoverThread;
            preroll = prerollThread;
        }
        pending.close();
        ready.close();
        if (discover != null) {
            discover.interrupt();
            preroll.interrupt();
            join(discover);
            join(preroll);
        }
        for (Candidate candidate : pending.drainAll()) {
            release(candidate);
        }
        resetQueue();
        logger.info("Acquisition pipeline closed");
    }

    private static void join(Thread thread) {
        try {
            thread.join(STAGE_JOIN_TIMEOUT.toMillis());
            if (thread.isAlive()) {
                logger.warn("{} did not stop within {}", thread.getName(), STAGE_JOIN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Thread stageThread(Runnable loop, String name) {
        Thread thread = new Thread(loop, name);
        thread.setDaemon(true);
        return thread;
    }
}
