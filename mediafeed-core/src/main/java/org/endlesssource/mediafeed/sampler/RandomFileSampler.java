package org.endlesssource.mediafeed.sampler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Picks a leaf file uniformly at random across a set of roots, under a time budget.
 * <p>
 * Every call scans the roots in parallel on its own short-lived fork/join pool. Once the scan
 * timeout elapses no new leaves are admitted, but partial results gathered so far are still
 * combined. Roots whose workers are still blocked on I/O {@code busyTimeout} after the deadline
 * are abandoned.
 */
public final class RandomFileSampler {
    private static final Logger logger = LoggerFactory.getLogger(RandomFileSampler.class);

    public static final Duration DEFAULT_SCAN_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(1);

    private final int parallelism;

    public RandomFileSampler() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public RandomFileSampler(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.parallelism = parallelism;
    }

    /**
     * Sample with the default 2s scan / 1s busy budget
     * @param roots Directories or files to sample from
     * @return A random leaf, or empty if none was found in time
     */
    public Optional<Path> sample(List<Path> roots) {
        return sample(roots, DEFAULT_SCAN_TIMEOUT, DEFAULT_BUSY_TIMEOUT);
    }

    /**
     * Sample one leaf file uniformly across all roots
     * @param roots Directories or files to sample from
     * @param scanTimeout Time after which no more leaves are admitted
     * @param busyTimeout Extra time granted to workers blocked on filesystem I/O
     * @return A random leaf, or empty if none was found in time
     */
    public Optional<Path> sample(List<Path> roots, Duration scanTimeout, Duration busyTimeout) {
        return scan(roots, scanTimeout, busyTimeout).selected();
    }

    /**
     * Same as {@link #sample(List, Duration, Duration)} but exposes the number of leaves seen.
     */
    public ScanResult scan(List<Path> roots, Duration scanTimeout, Duration busyTimeout) {
        Objects.requireNonNull(roots, "roots must not be null");
        Objects.requireNonNull(scanTimeout, "scanTimeout must not be null");
        Objects.requireNonNull(busyTimeout, "busyTimeout must not be null");
        if (roots.isEmpty()) {
            return ScanResult.empty();
        }

        ScanBudget budget = ScanBudget.startingNow(scanTimeout);
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        ScanResult result = ScanResult.empty();
        try {
            List<ForkJoinTask<ScanResult>> tasks = new ArrayList<>(roots.size());
            for (Path root : roots) {
                tasks.add(pool.submit(new RootScanTask(root, budget)));
            }

            long graceDeadline = budget.deadlineNanos() + busyTimeout.toNanos();
            for (ForkJoinTask<ScanResult> task : tasks) {
                long waitNanos = Math.max(0L, graceDeadline - System.nanoTime());
                try {
                    result = result.combine(task.get(waitNanos, TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    budget.cancel();
                    logger.debug("Scan worker still busy {} after deadline, dropping its partial result", busyTimeout);
                } catch (ExecutionException e) {
                    logger.debug("Root scan failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Scan interrupted, returning partial result of {} leaves", result.count());
        } finally {
            budget.cancel();
            pool.shutdownNow();
        }
        return result;
    }

    private static final class RootScanTask extends RecursiveTask<ScanResult> {
        private final Path root;
        private final ScanBudget budget;

        private RootScanTask(Path root, ScanBudget budget) {
            this.root = root;
            this.budget = budget;
        }

        @Override
        protected ScanResult compute() {
            if (!budget.admit()) {
                return ScanResult.empty();
            }
            BasicFileAttributes attributes;
            try {
                attributes = Files.readAttributes(root, BasicFileAttributes.class);
            } catch (IOException e) {
                logger.debug("Skipping unreadable root {}: {}", root, e.getMessage());
                return ScanResult.empty();
            }
            if (!attributes.isDirectory()) {
                return ScanResult.of(root);
            }
            return new DirectoryScanTask(root, budget).invoke();
        }
    }
}
