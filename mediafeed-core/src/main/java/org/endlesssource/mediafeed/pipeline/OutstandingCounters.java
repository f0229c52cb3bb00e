package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.MediaKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Number of items of each kind between deduplication and release.
 */
final class OutstandingCounters {
    private final Map<MediaKind, AtomicInteger> counts = new EnumMap<>(MediaKind.class);

    OutstandingCounters() {
        for (MediaKind kind : MediaKind.values()) {
            counts.put(kind, new AtomicInteger());
        }
    }

    void increment(MediaKind kind) {
        counts.get(kind).incrementAndGet();
    }

    void decrement(MediaKind kind) {
        // never below zero
        counts.get(kind).updateAndGet(n -> n > 0 ? n - 1 : 0);
    }

    int get(MediaKind kind) {
        return counts.get(kind).get();
    }
}
