package org.endlesssource.mediafeed.api;

/**
 * Observer for messages posted on a media engine's bus.
 * <p>
 * Engines invoke these callbacks on the thread that drives them, so implementations must not block.
 */
public interface EngineBusListener {

    /**
     * Called when the engine has rendered the end of its stream
     * @param engine The engine that posted the message
     */
    default void onEndOfStream(MediaEngine engine) {}

    /**
     * Called when the engine hits a runtime error
     * @param engine The engine that posted the message
     * @param message Human readable error description
     */
    default void onError(MediaEngine engine, String message) {}

    /**
     * Called when the engine or one of its elements changes state
     * @param engine The engine that posted the message
     * @param pipelineLevel true if the whole engine changed state, false for a single element
     * @param from Previous state
     * @param to New state
     */
    default void onStateChanged(MediaEngine engine, boolean pipelineLevel, EngineState from, EngineState to) {}

    /**
     * Called for any other element-level message (buffering, tags, clock...)
     * @param engine The engine that posted the message
     * @param source Name of the element that posted the message
     * @param name Message name
     */
    default void onElementMessage(MediaEngine engine, String source, String name) {}
}
