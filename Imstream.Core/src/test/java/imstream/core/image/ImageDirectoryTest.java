package imstream.core.image;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImageDirectory")
class ImageDirectoryTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("only image files are listed")
    void testFiltersImages() throws Exception {
        for (String name : new String[] {"a.png", "b.JPEG", "c.tif", "d.txt", "e.mp4", "f.Ras", "noext", ".png"}) {
            Files.createFile(tempDir.resolve(name));
        }
        Files.createDirectory(tempDir.resolve("dir.png"));

        List<String> names = ImageDirectory.list(tempDir);
        assertEquals(Set.of("a.png", "b.JPEG", "c.tif", "f.Ras"), new HashSet<>(names));
        assertEquals(4, names.size());
    }

    @Test
    @DisplayName("a glob narrows the listing")
    void testGlob() throws Exception {
        for (String name : new String[] {"frame_1.png", "frame_2.png", "thumb_1.png", "frame_3.txt"}) {
            Files.createFile(tempDir.resolve(name));
        }
        assertEquals(Set.of("frame_1.png", "frame_2.png"), new HashSet<>(ImageDirectory.list(tempDir, "frame_*")));
    }

    @Test
    @DisplayName("extension check is case-insensitive")
    void testIsImageName() {
        assertTrue(ImageDirectory.isImageName("X.GIF"));
        assertTrue(ImageDirectory.isImageName("x.tiff"));
        assertFalse(ImageDirectory.isImageName("x.png.bak"));
        assertFalse(ImageDirectory.isImageName("png"));
        assertFalse(ImageDirectory.isImageName("x."));
    }
}
