package org.endlesssource.mediafeed.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Ordered set of root paths, each either enabled or disabled. Safe for concurrent use.
 * <p>
 * Paths are stored absolute and normalized; {@link #covers(Path)} normalizes its argument the same way.
 */
public final class RootSet {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Path> enabled = new ArrayList<>();
    private final List<Path> disabled = new ArrayList<>();

    public RootSet() {
    }

    public RootSet(Collection<Path> roots) {
        Objects.requireNonNull(roots, "roots must not be null");
        roots.forEach(this::add);
    }

    public static RootSet of(Path... roots) {
        return new RootSet(List.of(roots));
    }

    /**
     * Add an enabled root
     * @return false if the root is already known (enabled or disabled)
     */
    public boolean add(Path root) {
        Path normalized = normalize(root);
        lock.writeLock().lock();
        try {
            if (enabled.contains(normalized) || disabled.contains(normalized)) {
                return false;
            }
            enabled.add(normalized);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forget a root entirely
     * @return true if the root was known
     */
    public boolean remove(Path root) {
        Path normalized = normalize(root);
        lock.writeLock().lock();
        try {
            return enabled.remove(normalized) | disabled.remove(normalized);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Move a known root between the enabled and disabled lists
     * @return true if the root changed list
     */
    public boolean setEnabled(Path root, boolean enable) {
        Path normalized = normalize(root);
        lock.writeLock().lock();
        try {
            List<Path> from = enable ? disabled : enabled;
            List<Path> to = enable ? enabled : disabled;
            if (!from.remove(normalized)) {
                return false;
            }
            to.add(normalized);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Path> enabledRoots() {
        lock.readLock().lock();
        try {
            return List.copyOf(enabled);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Path> disabledRoots() {
        lock.readLock().lock();
        try {
            return List.copyOf(disabled);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasEnabledRoots() {
        lock.readLock().lock();
        try {
            return !enabled.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return true if {@code path} lies under (or is) an enabled root
     */
    public boolean covers(Path path) {
        if (path == null) {
            return false;
        }
        Path normalized = normalize(path);
        lock.readLock().lock();
        try {
            for (Path root : enabled) {
                if (normalized.startsWith(root)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Path normalize(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        return path.toAbsolutePath().normalize();
    }

    @Override
    public String toString() {
        return "RootSet{enabled=" + enabledRoots() + ", disabled=" + disabledRoots() + '}';
    }
}
