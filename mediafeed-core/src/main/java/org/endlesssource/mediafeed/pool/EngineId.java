package org.endlesssource.mediafeed.pool;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifier assigned once per engine instance.
 */
public record EngineId(long value) {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    static EngineId next() {
        return new EngineId(NEXT_ID.getAndIncrement());
    }

    @Override
    public String toString() {
        return "engine-" + value;
    }
}
