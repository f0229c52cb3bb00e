package org.endlesssource.mediafeed.dedup;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;

/**
 * Bounded, approximate set of paths currently outstanding in the acquisition pipeline.
 * <p>
 * Membership means "somewhere between discovery and release", not "ever seen". The set keeps
 * insertion order; inserting beyond capacity evicts the oldest entry whether or not it is still
 * in flight, so under heavy load duplicates can slip through but memory stays bounded.
 */
public final class OutstandingPathCache {
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final LinkedHashSet<Path> entries;

    public OutstandingPathCache() {
        this(DEFAULT_CAPACITY);
    }

    public OutstandingPathCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.entries = new LinkedHashSet<>(Math.min(capacity, 1 << 16));
    }

    /**
     * Admit a path, or release it if it is already outstanding
     * @param path Sampled path
     * @return true if the path was admitted, false if it was outstanding (and is now removed)
     */
    public synchronized boolean toggle(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (entries.remove(path)) {
            return false;
        }
        entries.add(path);
        evictOverflow();
        return true;
    }

    /**
     * Release a path that left the pipeline
     * @return true if the path was outstanding
     */
    public synchronized boolean release(Path path) {
        return path != null && entries.remove(path);
    }

    public synchronized boolean contains(Path path) {
        return path != null && entries.contains(path);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }

    private void evictOverflow() {
        Iterator<Path> oldest = entries.iterator();
        while (entries.size() > capacity && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
