package imstream.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImstreamConfig")
class ImstreamConfigTest {

    @Test
    @DisplayName("defaults when nothing is configured")
    void testDefaults() {
        ImstreamConfig config = new ImstreamConfig();
        assertEquals("ffmpeg", config.getFfmpegPath());
        assertEquals("ffprobe", config.getFfprobePath());
        assertEquals(1, config.getCacheLength());
        assertNull(config.getBackground());
    }

    @Test
    @DisplayName("fields missing from JSON keep their defaults")
    void testPartialJson() {
        ImstreamConfig config = ImstreamConfig.fromJson("{\"cacheLength\": 5, \"background\": \"w\"}");
        assertEquals(5, config.getCacheLength());
        assertEquals("w", config.getBackground());
        assertEquals("ffmpeg", config.getFfmpegPath());
        assertEquals("ffprobe", config.getFfprobePath());
    }

    @Test
    @DisplayName("explicit nulls fall back to the executable names")
    void testNullPaths() {
        ImstreamConfig config = ImstreamConfig.fromJson("{\"ffmpegPath\": null, \"ffprobePath\": \"/opt/ff/ffprobe\"}");
        assertEquals("ffmpeg", config.getFfmpegPath());
        assertEquals("/opt/ff/ffprobe", config.getFfprobePath());
    }

    @Test
    @DisplayName("empty input yields defaults")
    void testEmptyJson() {
        assertEquals(1, ImstreamConfig.fromJson("").getCacheLength());
    }

    @Test
    @DisplayName("malformed JSON is rejected")
    void testMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> ImstreamConfig.fromJson("{\"cacheLength\": "));
    }
}
