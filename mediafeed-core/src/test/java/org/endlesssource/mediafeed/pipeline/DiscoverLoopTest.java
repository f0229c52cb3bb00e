package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.MediaFeedOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DiscoverLoopTest {

    @Test
    void scanTimeout_growsLinearlyWithReadyFill() {
        MediaFeedOptions options = MediaFeedOptions.defaults();
        assertEquals(100L, DiscoverLoop.scanTimeoutMillis(0, 20, options));
        assertEquals(5050L, DiscoverLoop.scanTimeoutMillis(10, 20, options));
        assertEquals(10_000L, DiscoverLoop.scanTimeoutMillis(20, 20, options));
    }

    @Test
    void scanTimeout_clampsOverfill() {
        MediaFeedOptions options = MediaFeedOptions.defaults()
                .withScanTimeoutRange(Duration.ofMillis(200), Duration.ofMillis(400));
        assertEquals(400L, DiscoverLoop.scanTimeoutMillis(7, 4, options));
        assertEquals(200L, DiscoverLoop.scanTimeoutMillis(-1, 4, options));
    }
}
