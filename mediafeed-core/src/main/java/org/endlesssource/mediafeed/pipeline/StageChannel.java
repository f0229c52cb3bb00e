package org.endlesssource.mediafeed.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between two stage threads that either side can disconnect.
 * <p>
 * A full channel blocks the sender (backpressure). Once closed, senders give up and receivers
 * drain whatever is left before seeing the channel as finished.
 */
final class StageChannel<T> {
    private static final long SEND_SLICE_MILLIS = 50L;

    private final BlockingQueue<T> queue;
    private volatile boolean closed;

    StageChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Block until there is room for {@code item} or the channel closes
     * @return false if the channel closed before the item was accepted
     */
    boolean send(T item) throws InterruptedException {
        while (!closed) {
            if (queue.offer(item, SEND_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    Optional<T> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    List<T> drain(int max) {
        List<T> drained = new ArrayList<>();
        if (max > 0) {
            queue.drainTo(drained, max);
        }
        return drained;
    }

    List<T> drainAll() {
        List<T> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    /**
     * @return true once the channel is closed and nothing is left to receive
     */
    boolean isDrained() {
        return closed && queue.isEmpty();
    }

    int size() {
        return queue.size();
    }
}
