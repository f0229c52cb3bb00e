package org.endlesssource.mediafeed.spi;

import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.MediaEngine;

import java.nio.file.Path;

/**
 * SPI implemented by media engine modules.
 */
public interface MediaEngineProvider {

    /**
     * Stable provider id, e.g. precache.
     */
    String providerId();

    /**
     * Check runtime availability (native libraries, plugins, init preconditions).
     */
    ProviderStatus status();

    /**
     * Build an engine for one file. The engine starts in {@code NULL} or {@code READY}; it is not
     * driven any further by this call.
     *
     * @throws EngineException if the file cannot be opened or the engine cannot be assembled
     */
    MediaEngine create(Path path) throws EngineException;
}
