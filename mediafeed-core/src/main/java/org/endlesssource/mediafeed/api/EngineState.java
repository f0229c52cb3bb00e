package org.endlesssource.mediafeed.api;

/**
 * Lifecycle state of a media engine.
 * <p>
 * Engines move NULL → READY → PAUSED → PLAYING and back; PAUSED means the engine is prerolled
 * and can start output without stalling.
 */
public enum EngineState {
    NULL,
    READY,
    PAUSED,
    PLAYING
}
