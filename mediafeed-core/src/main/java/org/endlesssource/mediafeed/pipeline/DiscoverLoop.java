package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.MediaFeedOptions;
import org.endlesssource.mediafeed.api.MediaKind;
import org.endlesssource.mediafeed.dedup.OutstandingPathCache;
import org.endlesssource.mediafeed.sampler.RandomFileSampler;
import org.endlesssource.mediafeed.sampler.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * First stage: samples candidate files from the enabled roots, drops duplicates and unsupported
 * kinds, and hands the rest to preroll through a bounded channel.
 * <p>
 * The scan budget grows with the Ready queue fill level: an empty queue needs a candidate fast,
 * a full one can afford a more thorough (and more uniform) scan.
 */
final class DiscoverLoop implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(DiscoverLoop.class);
    private static final long EMPTY_SCAN_STEP_MILLIS = 1000L;

    private final MediaFeedOptions options;
    private final RootSet roots;
    private final RandomFileSampler sampler;
    private final OutstandingPathCache cache;
    private final OutstandingCounters counters;
    private final ReadyQueue ready;
    private final StageChannel<Candidate> output;
    private final Consumer<Candidate> releaser;

    DiscoverLoop(MediaFeedOptions options,
                 RootSet roots,
                 RandomFileSampler sampler,
                 OutstandingPathCache cache,
                 OutstandingCounters counters,
                 ReadyQueue ready,
                 StageChannel<Candidate> output,
                 Consumer<Candidate> releaser) {
        this.options = options;
        this.roots = roots;
        this.sampler = sampler;
        this.cache = cache;
        this.counters = counters;
        this.ready = ready;
        this.output = output;
        this.releaser = releaser;
    }

    @Override
    public void run() {
        logger.debug("Discover loop started");
        try {
            while (!output.isClosed()) {
                Optional<Path> sampled = sampleNext();
                if (sampled.isEmpty()) {
                    continue;
                }
                Path path = sampled.get();
                Optional<MediaKind> kind = MediaKind.fromPath(path);
                if (kind.isEmpty() || !options.getAcceptedKinds().contains(kind.get())) {
                    logger.trace("Skipping {}: not an accepted media kind", path);
                    continue;
                }
                if (!cache.toggle(path)) {
                    logger.debug("Dropping {}: already outstanding", path);
                    continue;
                }
                Candidate candidate = new Candidate(path, kind.get());
                counters.increment(candidate.kind());
                boolean sent = false;
                try {
                    sent = output.send(candidate);
                } finally {
                    if (!sent) {
                        releaser.accept(candidate);
                    }
                }
                if (!sent) {
                    break;
                }
                logger.debug("Discovered {} {}", candidate.kind(), path);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Discover loop stopped");
    }

    /**
     * Sample until a file turns up. Each empty scan that used up its budget retries with one more
     * second; an empty scan that finished early means there is nothing to find, so back off.
     * @return The sampled path, or empty if the caller should loop again
     */
    private Optional<Path> sampleNext() throws InterruptedException {
        long timeoutMillis = scanTimeoutMillis(ready.size(), ready.capacity(), options);
        while (!output.isClosed()) {
            List<Path> enabled = roots.enabledRoots();
            if (enabled.isEmpty()) {
                logger.debug("No enabled roots, waiting {}", options.getNoRootsBackoff());
                Thread.sleep(options.getNoRootsBackoff().toMillis());
                return Optional.empty();
            }

            Duration busyTimeout = Duration.ofMillis(timeoutMillis);
            Duration scanTimeout = busyTimeout.multipliedBy(2);
            long started = System.nanoTime();
            ScanResult result = sampler.scan(enabled, scanTimeout, busyTimeout);
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while sampling");
            }
            if (!result.isEmpty()) {
                return result.selected();
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (elapsed.compareTo(scanTimeout) < 0) {
                logger.debug("No files under {}, waiting {}", enabled, options.getNoRootsBackoff());
                Thread.sleep(options.getNoRootsBackoff().toMillis());
                return Optional.empty();
            }
            timeoutMillis += EMPTY_SCAN_STEP_MILLIS;
            logger.debug("Scan found nothing within {}, retrying with {}ms", scanTimeout, timeoutMillis);
        }
        return Optional.empty();
    }

    /**
     * Busy timeout for the next scan, linear between the configured minimum (empty Ready queue)
     * and maximum (full Ready queue)
     */
    static long scanTimeoutMillis(int readyCount, int readyCapacity, MediaFeedOptions options) {
        long min = options.getMinScanTimeout().toMillis();
        long max = options.getMaxScanTimeout().toMillis();
        int filled = Math.max(0, Math.min(readyCount, readyCapacity));
        return min + (max - min) * filled / readyCapacity;
    }
}
