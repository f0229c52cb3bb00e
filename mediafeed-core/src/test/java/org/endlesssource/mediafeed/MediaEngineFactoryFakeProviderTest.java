package org.endlesssource.mediafeed;

import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.EngineState;
import org.endlesssource.mediafeed.api.MediaEngine;
import org.endlesssource.mediafeed.spi.MediaEngineProvider;
import org.endlesssource.mediafeed.spi.ProviderStatus;
import org.endlesssource.mediafeed.test.FakeEngineProvider;
import org.endlesssource.mediafeed.test.UnavailableEngineProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MediaEngineFactoryFakeProviderTest {

    @Test
    void createProvider_picksFakeProvider() throws Exception {
        MediaEngineProvider provider = MediaEngineFactory.createProvider();
        assertEquals(FakeEngineProvider.ID, provider.providerId());
    }

    @Test
    void createdProvider_buildsEnginesInReadyState(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("clip.mp4"), "x");
        MediaEngineProvider provider = MediaEngineFactory.createProvider();
        try (MediaEngine engine = provider.create(file)) {
            assertEquals(file, engine.getPath());
            assertEquals(EngineState.READY, engine.currentState());
        }
    }

    @Test
    void currentStatus_reportsAvailableWhenFakeProviderPresent() {
        ProviderStatus status = MediaEngineFactory.getCurrentStatus();
        assertTrue(status.available());
        assertEquals(FakeEngineProvider.ID, status.providerId());
        assertEquals("", status.reason());
        assertTrue(MediaEngineFactory.isEngineAvailable());
    }

    @Test
    void createProvider_skipsUnavailableProviders() {
        // test-absent sorts ahead of test-fake
        assertEquals(FakeEngineProvider.ID, MediaEngineFactory.createProvider().providerId());
        assertEquals(FakeEngineProvider.ID, MediaEngineFactory.getCurrentStatus().providerId());
    }

    @Test
    void installedAndAvailableProviders_separateUnusableOnes() {
        assertTrue(MediaEngineFactory.getInstalledProviders().contains(FakeEngineProvider.ID));
        assertTrue(MediaEngineFactory.getInstalledProviders().contains(UnavailableEngineProvider.ID));
        assertTrue(MediaEngineFactory.getAvailableProviders().contains(FakeEngineProvider.ID));
        assertFalse(MediaEngineFactory.getAvailableProviders().contains(UnavailableEngineProvider.ID));
    }

    @Test
    void findProvider_matchesIdIgnoringCase() {
        assertTrue(MediaEngineFactory.findProvider("TEST-FAKE").isPresent());
        assertTrue(MediaEngineFactory.findProvider("gstreamer").isEmpty());
    }

    @Test
    void unavailableProvider_cannotBuildEngines(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("clip.mp4"), "x");
        MediaEngineProvider absent = MediaEngineFactory.findProvider(UnavailableEngineProvider.ID).orElseThrow();
        assertFalse(absent.status().available());
        assertEquals(UnavailableEngineProvider.REASON, absent.status().reason());
        assertThrows(EngineException.class, () -> absent.create(file));
    }

    @Test
    void providerStatus_normalizesReason() {
        ProviderStatus unavailable = ProviderStatus.unavailable("x", null);
        assertFalse(unavailable.available());
        assertEquals("", unavailable.reason());

        ProviderStatus ready = ProviderStatus.ready("x");
        assertTrue(ready.available());
        assertEquals("x", ready.providerId());

        assertThrows(NullPointerException.class, () -> ProviderStatus.ready(null));
    }
}
