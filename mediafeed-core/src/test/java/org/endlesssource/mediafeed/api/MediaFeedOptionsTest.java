package org.endlesssource.mediafeed.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MediaFeedOptionsTest {

    @Test
    void defaults_areExpected() {
        MediaFeedOptions defaults = MediaFeedOptions.defaults();
        assertEquals(20, defaults.getReadyCapacity());
        assertEquals(10, defaults.getPrerollCapacity());
        assertEquals(10, defaults.getDiscoverCapacity());
        assertEquals(3, defaults.getWorkerCount());
        assertEquals(1000, defaults.getDedupCapacity());
        assertEquals(Duration.ofMillis(100), defaults.getPrerollPollInterval());
        assertEquals(Duration.ofMillis(100), defaults.getMinScanTimeout());
        assertEquals(Duration.ofSeconds(10), defaults.getMaxScanTimeout());
        assertEquals(MediaFeedOptions.DEFAULT_NO_ROOTS_BACKOFF, defaults.getNoRootsBackoff());
        assertEquals(EnumSet.allOf(MediaKind.class), defaults.getAcceptedKinds());
    }

    @Test
    void withers_returnModifiedCopy() {
        MediaFeedOptions defaults = MediaFeedOptions.defaults();
        MediaFeedOptions changed = defaults.withReadyCapacity(5).withWorkerCount(1);
        assertNotSame(defaults, changed);
        assertEquals(5, changed.getReadyCapacity());
        assertEquals(1, changed.getWorkerCount());
        assertEquals(20, defaults.getReadyCapacity());
    }

    @Test
    void withCapacities_rejectZeroOrNegative() {
        MediaFeedOptions defaults = MediaFeedOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withReadyCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withPrerollCapacity(-1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withDiscoverCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withWorkerCount(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withDedupCapacity(0));
    }

    @Test
    void withIntervals_rejectZeroNegativeAndInvertedRange() {
        MediaFeedOptions defaults = MediaFeedOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withPrerollPollInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> defaults.withNoRootsBackoff(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withScanTimeoutRange(Duration.ofSeconds(2), Duration.ofSeconds(1)));
        assertThrows(NullPointerException.class, () -> defaults.withPrerollPollInterval(null));
    }

    @Test
    void withAcceptedKinds_rejectsEmptySet() {
        MediaFeedOptions defaults = MediaFeedOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withAcceptedKinds(Set.of()));
        assertEquals(Set.of(MediaKind.VIDEO), defaults.withAcceptedKinds(Set.of(MediaKind.VIDEO)).getAcceptedKinds());
    }
}
