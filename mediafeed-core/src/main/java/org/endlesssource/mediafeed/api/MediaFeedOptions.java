package org.endlesssource.mediafeed.api;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration options for the acquisition pipeline and its engine worker pool.
 */
public final class MediaFeedOptions {
    public static final int DEFAULT_READY_CAPACITY = 20;
    public static final int DEFAULT_PREROLL_CAPACITY = 10;
    public static final int DEFAULT_DISCOVER_CAPACITY = 10;
    public static final int DEFAULT_WORKER_COUNT = 3;
    public static final int DEFAULT_DEDUP_CAPACITY = 1000;
    public static final Duration DEFAULT_PREROLL_POLL_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_MIN_SCAN_TIMEOUT = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_SCAN_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_NO_ROOTS_BACKOFF = Duration.ofSeconds(1);

    private final int readyCapacity;
    private final int prerollCapacity;
    private final int discoverCapacity;
    private final int workerCount;
    private final int dedupCapacity;
    private final Duration prerollPollInterval;
    private final Duration minScanTimeout;
    private final Duration maxScanTimeout;
    private final Duration noRootsBackoff;
    private final Set<MediaKind> acceptedKinds;

    private MediaFeedOptions(int readyCapacity,
                             int prerollCapacity,
                             int discoverCapacity,
                             int workerCount,
                             int dedupCapacity,
                             Duration prerollPollInterval,
                             Duration minScanTimeout,
                             Duration maxScanTimeout,
                             Duration noRootsBackoff,
                             Set<MediaKind> acceptedKinds) {
        this.readyCapacity = requirePositive("readyCapacity", readyCapacity);
        this.prerollCapacity = requirePositive("prerollCapacity", prerollCapacity);
        this.discoverCapacity = requirePositive("discoverCapacity", discoverCapacity);
        this.workerCount = requirePositive("workerCount", workerCount);
        this.dedupCapacity = requirePositive("dedupCapacity", dedupCapacity);
        this.prerollPollInterval = requirePositive("prerollPollInterval", prerollPollInterval);
        this.minScanTimeout = requirePositive("minScanTimeout", minScanTimeout);
        this.maxScanTimeout = requirePositive("maxScanTimeout", maxScanTimeout);
        this.noRootsBackoff = requirePositive("noRootsBackoff", noRootsBackoff);
        if (maxScanTimeout.compareTo(minScanTimeout) < 0) {
            throw new IllegalArgumentException("maxScanTimeout must not be shorter than minScanTimeout");
        }
        Objects.requireNonNull(acceptedKinds, "acceptedKinds must not be null");
        if (acceptedKinds.isEmpty()) {
            throw new IllegalArgumentException("acceptedKinds must not be empty");
        }
        this.acceptedKinds = Set.copyOf(acceptedKinds);
    }

    public static MediaFeedOptions defaults() {
        return new MediaFeedOptions(DEFAULT_READY_CAPACITY, DEFAULT_PREROLL_CAPACITY, DEFAULT_DISCOVER_CAPACITY,
                DEFAULT_WORKER_COUNT, DEFAULT_DEDUP_CAPACITY, DEFAULT_PREROLL_POLL_INTERVAL,
                DEFAULT_MIN_SCAN_TIMEOUT, DEFAULT_MAX_SCAN_TIMEOUT, DEFAULT_NO_ROOTS_BACKOFF,
                EnumSet.allOf(MediaKind.class));
    }

    public int getReadyCapacity() {
        return readyCapacity;
    }

    public int getPrerollCapacity() {
        return prerollCapacity;
    }

    public int getDiscoverCapacity() {
        return discoverCapacity;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getDedupCapacity() {
        return dedupCapacity;
    }

    public Duration getPrerollPollInterval() {
        return prerollPollInterval;
    }

    public Duration getMinScanTimeout() {
        return minScanTimeout;
    }

    public Duration getMaxScanTimeout() {
        return maxScanTimeout;
    }

    public Duration getNoRootsBackoff() {
        return noRootsBackoff;
    }

    public Set<MediaKind> getAcceptedKinds() {
        return acceptedKinds;
    }

    public MediaFeedOptions withReadyCapacity(int capacity) {
        return new MediaFeedOptions(capacity, prerollCapacity, discoverCapacity, workerCount, dedupCapacity,
                prerollPollInterval, minScanTimeout, maxScanTimeout, noRootsBackoff, acceptedKinds);
    }

    public MediaFeedOptions withPrerollCapacity(int capacity) {
        return new MediaFeedOptions(readyCapacity, capacity, discoverCapacity, workerCount, dedupCapacity,
                prerollPollInterval, minScanTimeout, maxScanTimeout, noRootsBackoff, acceptedKinds);
    }

    public MediaFeedOptions withDiscoverCapacity(int capacity) {
        return new MediaFeedOptions(readyCapacity, prerollCapacity, capacity, workerCount, dedupCapacity,
                prerollPollInterval, minScanTimeout, maxScanTimeout, noRootsBackoff, acceptedKinds);
    }

    public MediaFeedOptions withWorkerCount(int count) {
        return new MediaFeedOptions(readyCapacity, prerollCapacity, discoverCapacity, count, dedupCapacity,
                prerollPollInterval, minScanTimeout, maxScanTimeout, noRootsBackoff, acceptedKinds);
    }

    public MediaFeedOptions withDedupCapacity(int capacity) {
        return new MediaFeedOptions(readyCapacity, prerollCapacity, discoverCapacity, workerCount, capacity,
                prerollPollInterval, minScanTimeout, maxScanTimeout, noRootsBackoff, acceptedKinds);
    }

    public MediaFeedOptions withPrerollPollInterval(Duration interval) {
        return new MediaFeedOptions(readyCapacity, prerollCapacity, discoverCapacity, workerCount, dedupCapacity,
                interval, minScanTimeout, maxScanTimeout, noRootsBackoff, acceptedKinds);
    }

    public MediaFeedOptions withScanTimeoutRange(Duration min, Duration max) {
        return new MediaFeedOptions(readyCapacity, prerollCapacity, discoverCapacity, workerCount, dedupCapacity,
                prerollPollInterval, min, max, noRootsBackoff, acceptedKinds);
    }

    public MediaFeedOptions withNoRootsBackoff(Duration backoff) {
        return new MediaFeedOptions(readyCapacity, prerollCapacity, discoverCapacity, workerCount, dedupCapacity,
                prerollPollInterval, minScanTimeout, maxScanTimeout, backoff, acceptedKinds);
    }

    public MediaFeedOptions withAcceptedKinds(Set<MediaKind> kinds) {
        return new MediaFeedOptions(readyCapacity, prerollCapacity, discoverCapacity, workerCount, dedupCapacity,
                prerollPollInterval, minScanTimeout, maxScanTimeout, noRootsBackoff, kinds);
    }

    private static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
