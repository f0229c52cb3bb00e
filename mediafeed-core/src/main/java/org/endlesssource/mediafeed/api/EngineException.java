package org.endlesssource.mediafeed.api;

/**
 * Raised when a media engine cannot be built or refuses a command.
 */
public class EngineException extends Exception {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
