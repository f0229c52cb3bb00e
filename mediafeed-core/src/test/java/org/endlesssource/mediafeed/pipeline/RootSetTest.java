package org.endlesssource.mediafeed.pipeline;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RootSetTest {
    private static final Path MOVIES = Path.of("/srv/movies").toAbsolutePath();
    private static final Path PHOTOS = Path.of("/srv/photos").toAbsolutePath();

    @Test
    void newRootsAreEnabled() {
        RootSet roots = RootSet.of(MOVIES, PHOTOS);
        assertEquals(List.of(MOVIES, PHOTOS), roots.enabledRoots());
        assertTrue(roots.disabledRoots().isEmpty());
        assertFalse(roots.add(MOVIES));
    }

    @Test
    void setEnabled_movesBetweenLists() {
        RootSet roots = RootSet.of(MOVIES, PHOTOS);
        assertTrue(roots.setEnabled(PHOTOS, false));
        assertFalse(roots.setEnabled(PHOTOS, false));
        assertEquals(List.of(MOVIES), roots.enabledRoots());
        assertEquals(List.of(PHOTOS), roots.disabledRoots());

        assertTrue(roots.setEnabled(PHOTOS, true));
        assertTrue(roots.disabledRoots().isEmpty());
        assertFalse(roots.setEnabled(Path.of("/unknown"), true));
    }

    @Test
    void covers_onlyPathsUnderEnabledRoots() {
        RootSet roots = RootSet.of(MOVIES, PHOTOS);
        roots.setEnabled(PHOTOS, false);
        assertTrue(roots.covers(MOVIES.resolve("a/b.mp4")));
        assertTrue(roots.covers(MOVIES.resolve("x/../c.mp4")));
        assertFalse(roots.covers(PHOTOS.resolve("a.jpg")));
        assertFalse(roots.covers(Path.of("/srv/movies-old/a.mp4").toAbsolutePath()));
        assertFalse(roots.covers(null));
    }

    @Test
    void remove_forgetsRoot() {
        RootSet roots = RootSet.of(MOVIES);
        assertTrue(roots.remove(MOVIES));
        assertFalse(roots.hasEnabledRoots());
        assertFalse(roots.remove(MOVIES));
    }
}
