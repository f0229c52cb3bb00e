package org.endlesssource.mediafeed.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded FIFO of paused engines. Offers never block: a full queue simply refuses the item so the
 * producer can keep it and retry later.
 */
public final class ReadyQueue {
    private final int capacity;
    private final Deque<ReadyMedia> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    ReadyQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Append {@code media} if there is room and {@code admit} still accepts it. The predicate is
     * evaluated under the queue lock.
     * @return false if the queue is full, closed or the item was not admitted
     */
    boolean offer(ReadyMedia media, Predicate<ReadyMedia> admit) {
        lock.lock();
        try {
            if (closed || items.size() >= capacity || !admit.test(media)) {
                return false;
            }
            items.addLast(media);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean offer(ReadyMedia media) {
        return offer(media, m -> true);
    }

    /**
     * Withdraw the oldest item without waiting
     */
    public Optional<ReadyMedia> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Withdraw the oldest item, waiting up to {@code timeout} for one to arrive
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<ReadyMedia> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every item matching {@code filter}, preserving the order of the rest
     * @return The removed items, oldest first. The caller owns them.
     */
    List<ReadyMedia> removeIf(Predicate<ReadyMedia> filter) {
        List<ReadyMedia> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<ReadyMedia> it = items.iterator();
            while (it.hasNext()) {
                ReadyMedia media = it.next();
                if (filter.test(media)) {
                    it.remove();
                    removed.add(media);
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    List<ReadyMedia> drainAll() {
        return removeIf(m -> true);
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isFull() {
        return size() >= capacity;
    }

    boolean containsPath(Path path) {
        lock.lock();
        try {
            for (ReadyMedia media : items) {
                if (media.path().equals(path)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Items currently queued, oldest first. The queue keeps ownership.
     */
    List<ReadyMedia> snapshot() {
        lock.lock();
        try {
            return List.copyOf(items);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Paths currently queued, oldest first
     */
    public List<Path> paths() {
        lock.lock();
        try {
            List<Path> paths = new ArrayList<>(items.size());
            for (ReadyMedia media : items) {
                paths.add(media.path());
            }
            return paths;
        } finally {
            lock.unlock();
        }
    }
}
