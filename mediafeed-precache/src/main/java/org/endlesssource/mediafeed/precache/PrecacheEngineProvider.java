package org.endlesssource.mediafeed.precache;

import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.MediaEngine;
import org.endlesssource.mediafeed.spi.MediaEngineProvider;
import org.endlesssource.mediafeed.spi.ProviderStatus;

import java.nio.file.Path;

public final class PrecacheEngineProvider implements MediaEngineProvider {
    private final int prefetchBytes;

    public PrecacheEngineProvider() {
        this(PrecacheMediaEngine.DEFAULT_PREFETCH_BYTES);
    }

    public PrecacheEngineProvider(int prefetchBytes) {
        if (prefetchBytes < 0) {
            throw new IllegalArgumentException("prefetchBytes must not be negative");
        }
        this.prefetchBytes = prefetchBytes;
    }

    @Override
    public String providerId() {
        return "precache";
    }

    @Override
    public ProviderStatus status() {
        return ProviderStatus.ready(providerId());
    }

    @Override
    public MediaEngine create(Path path) throws EngineException {
        return new PrecacheMediaEngine(path, prefetchBytes);
    }
}
