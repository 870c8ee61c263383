package imstream.core;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.FileReader;

/**
 * Settings shared by streams opened through {@code MediaStream.open}.
 *
 * Example config file (.imstream/config.json):
 * {
 *   "ffmpegPath": "/usr/local/bin/ffmpeg",
 *   "ffprobePath": "/usr/local/bin/ffprobe",
 *   "cacheLength": 3,
 *   "background": "w"
 * }
 *
 * Every field is optional. "background" is a color character (see ColorNames)
 * used when flattening transparent images; unset means a grey checkerboard.
 */
public class ImstreamConfig {

    private static final Logger LOGGER = Logger.getLogger(ImstreamConfig.class);
    private static final String CONFIG_ENV = "IMSTREAM_CONFIG";
    private static final String[] CONFIG_PATHS = {
        ".imstream/config.json",    // If running from workspace root
        "../.imstream/config.json"  // If running from a module directory
    };

    private String ffmpegPath = "ffmpeg";
    private String ffprobePath = "ffprobe";
    private int cacheLength = 1;
    private String background;

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public String getFfprobePath() {
        return ffprobePath;
    }

    public void setFfprobePath(String ffprobePath) {
        this.ffprobePath = ffprobePath;
    }

    public int getCacheLength() {
        return cacheLength;
    }

    public void setCacheLength(int cacheLength) {
        this.cacheLength = cacheLength;
    }

    public String getBackground() {
        return background;
    }

    public void setBackground(String background) {
        this.background = background;
    }

    /**
     * Parse a config from JSON. Missing fields keep their defaults.
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public static ImstreamConfig fromJson(String json) {
        try {
            ImstreamConfig config = new Gson().fromJson(json, ImstreamConfig.class);
            return config != null ? config.withDefaults() : new ImstreamConfig();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid imstream config: " + e.getMessage(), e);
        }
    }

    /**
     * Load config from environment variable, file, or return defaults.
     */
    public static ImstreamConfig load() {
        String configJson = System.getenv(CONFIG_ENV);
        if (configJson != null && !configJson.isEmpty()) {
            try {
                ImstreamConfig config = fromJson(configJson);
                LOGGER.info("Loaded imstream config from environment variable " + CONFIG_ENV);
                return config;
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Failed to parse imstream config from environment variable", e);
            }
        }

        for (String path : CONFIG_PATHS) {
            File configFile = new File(path);
            if (configFile.exists()) {
                try (FileReader reader = new FileReader(configFile)) {
                    ImstreamConfig config = new Gson().fromJson(reader, ImstreamConfig.class);
                    if (config != null) {
                        LOGGER.info("Loaded imstream config from " + configFile.getAbsolutePath());
                        return config.withDefaults();
                    }
                } catch (Exception e) {
                    LOGGER.warn("Failed to load imstream config from " + configFile.getAbsolutePath(), e);
                }
            }
        }

        LOGGER.debug("Using default imstream config - no config found at any of: " + String.join(", ", CONFIG_PATHS));
        return new ImstreamConfig();
    }

    // Gson leaves explicit nulls in place
    private ImstreamConfig withDefaults() {
        if (ffmpegPath == null || ffmpegPath.isEmpty()) {
            ffmpegPath = "ffmpeg";
        }
        if (ffprobePath == null || ffprobePath.isEmpty()) {
            ffprobePath = "ffprobe";
        }
        return this;
    }

    @Override
    public String toString() {
        return "ImstreamConfig{" +
               "ffmpegPath='" + ffmpegPath + '\'' +
               ", ffprobePath='" + ffprobePath + '\'' +
               ", cacheLength=" + cacheLength +
               ", background=" + background +
               '}';
    }
}
