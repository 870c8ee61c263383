package imstream.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DumpOptions")
class DumpOptionsTest {

    @Test
    @DisplayName("defaults cover the whole stream into the working directory")
    void testDefaults() {
        DumpOptions options = DumpOptions.parse(new String[] {"clip.mp4"});
        assertEquals(Paths.get("clip.mp4"), options.getSource());
        assertNull(options.getCacheLength());
        assertEquals(1, options.getFrom());
        assertNull(options.getTo());
        assertEquals(Paths.get("."), options.getOutputDir());
        assertFalse(options.isRgb());
        assertFalse(options.isInfoOnly());
        assertNull(options.getBackground());
    }

    @Test
    @DisplayName("all flags are read, in any position")
    void testAllFlags() {
        DumpOptions options = DumpOptions.parse(new String[] {
            "-cache", "3", "-from", "4", "-to", "9", "img.0001.png", "-out", "frames", "-rgb", "-background", "w", "-info"
        });
        assertEquals(Paths.get("img.0001.png"), options.getSource());
        assertEquals(3, options.getCacheLength());
        assertEquals(4, options.getFrom());
        assertEquals(9, options.getTo());
        assertEquals(Paths.get("frames"), options.getOutputDir());
        assertTrue(options.isRgb());
        assertEquals("w", options.getBackground());
        assertTrue(options.isInfoOnly());
    }

    @Test
    @DisplayName("bad input is reported as IllegalArgumentException")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.parse(new String[] {}));
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.parse(new String[] {"a.png", "b.png"}));
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.parse(new String[] {"a.png", "-cache"}));
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.parse(new String[] {"a.png", "-cache", "0"}));
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.parse(new String[] {"a.png", "-from", "x"}));
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.parse(new String[] {"a.png", "-from", "5", "-to", "2"}));
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.parse(new String[] {"a.png", "-verbose"}));
    }
}
