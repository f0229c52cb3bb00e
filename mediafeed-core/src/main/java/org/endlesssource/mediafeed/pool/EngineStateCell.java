package org.endlesssource.mediafeed.pool;

import org.endlesssource.mediafeed.api.EngineState;

/**
 * Last known lifecycle state of one engine, written by its worker and read by any thread.
 */
final class EngineStateCell {
    private EngineState state;

    EngineStateCell(EngineState initial) {
        this.state = initial;
    }

    synchronized EngineState get() {
        return state;
    }

    synchronized void set(EngineState state) {
        this.state = state;
    }
}
