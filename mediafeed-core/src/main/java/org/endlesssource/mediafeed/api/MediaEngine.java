package org.endlesssource.mediafeed.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalDouble;

/**
 * A decode/render engine bound to a single media file.
 * <p>
 * Engines are not thread-safe. The worker pool guarantees that every call after construction
 * happens on the same worker thread.
 */
public interface MediaEngine extends AutoCloseable {

    /**
     * Get the file this engine plays
     * @return Source path
     */
    Path getPath();

    /**
     * Get the state the engine is currently in
     * @return Current lifecycle state
     */
    EngineState currentState();

    /**
     * Request a state transition. The transition may complete asynchronously; completion is
     * reported through {@link EngineBusListener#onStateChanged}.
     * @param target Target state
     * @throws EngineException if the engine refuses the transition
     */
    void setState(EngineState target) throws EngineException;

    /**
     * Seek to a position, optionally changing the playback rate
     * @param position Target position
     * @param rate New playback rate, or empty to keep the current one
     * @throws EngineException if the seek fails
     */
    void seek(Duration position, OptionalDouble rate) throws EngineException;

    /**
     * Hint the engine about the size of the video output area
     * @param width Output width in pixels
     * @param height Output height in pixels
     */
    void resize(int width, int height);

    /**
     * Add a bus observer
     * @param listener The listener to add
     */
    void addBusListener(EngineBusListener listener);

    /**
     * Remove a bus observer
     * @param listener The listener to remove
     */
    void removeBusListener(EngineBusListener listener);

    /**
     * Release native resources. The engine must already be in {@link EngineState#NULL}.
     */
    @Override
    void close();
}
