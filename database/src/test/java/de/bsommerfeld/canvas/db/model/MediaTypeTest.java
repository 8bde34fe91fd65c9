package de.bsommerfeld.canvas.db.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MediaTypeTest {

    @Test
    void of_shouldClassifyByExtension() {
        assertEquals(Optional.of(MediaType.IMAGE), MediaType.of(Path.of("a/b/photo.JPG")));
        assertEquals(Optional.of(MediaType.VIDEO), MediaType.of(Path.of("clip.rmvb")));
        assertEquals(Optional.of(MediaType.AUDIO), MediaType.of(Path.of("song.m4a")));
    }

    @Test
    void of_shouldRejectUnsupportedFiles() {
        assertTrue(MediaType.of(Path.of("notes.txt")).isEmpty());
        assertTrue(MediaType.of(Path.of("README")).isEmpty());
        assertTrue(MediaType.of(Path.of(".png")).isEmpty());
        assertTrue(MediaType.of(Path.of("trailing.")).isEmpty());
    }

    @Test
    void fromColumn_shouldFallBackToImage() {
        assertEquals(MediaType.VIDEO, MediaType.fromColumn("video"));
        assertEquals(MediaType.IMAGE, MediaType.fromColumn("unknown"));
        assertEquals(MediaType.IMAGE, MediaType.fromColumn(null));
    }
}
