package org.endlesssource.mediafeed.sampler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline plus a shared cancellation flag, polled cooperatively by every traversal step.
 */
final class ScanBudget {
    private final long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private ScanBudget(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    static ScanBudget startingNow(Duration timeout) {
        return new ScanBudget(System.nanoTime() + timeout.toNanos());
    }

    /**
     * @return true while new leaves may still enter the reduction
     */
    boolean admit() {
        if (cancelled.get()) {
            return false;
        }
        if (System.nanoTime() - deadlineNanos > 0L) {
            cancelled.set(true);
            return false;
        }
        return true;
    }

    void cancel() {
        cancelled.set(true);
    }

    long deadlineNanos() {
        return deadlineNanos;
    }
}
