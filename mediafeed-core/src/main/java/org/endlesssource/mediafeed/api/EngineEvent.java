package org.endlesssource.mediafeed.api;

import java.util.Objects;

/**
 * Pipeline-level signal forwarded from an engine to its handle's event stream.
 */
public interface EngineEvent {

    record EndOfStream() implements EngineEvent {
    }

    record Error(String message) implements EngineEvent {
        public Error {
            message = message == null ? "" : message;
        }
    }

    record StateChanged(EngineState from, EngineState to) implements EngineEvent {
        public StateChanged {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
        }
    }
}
