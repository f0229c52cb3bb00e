package org.endlesssource.mediafeed.test;

import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.MediaEngine;
import org.endlesssource.mediafeed.spi.MediaEngineProvider;
import org.endlesssource.mediafeed.spi.ProviderStatus;

import java.nio.file.Path;

/**
 * Installed but never usable, so provider selection has something to skip.
 */
public final class UnavailableEngineProvider implements MediaEngineProvider {
    public static final String ID = "test-absent";
    public static final String REASON = "native library not loaded";

    @Override
    public String providerId() {
        return ID;
    }

    @Override
    public ProviderStatus status() {
        return ProviderStatus.unavailable(ID, REASON);
    }

    @Override
    public MediaEngine create(Path path) throws EngineException {
        throw new EngineException(REASON);
    }
}
