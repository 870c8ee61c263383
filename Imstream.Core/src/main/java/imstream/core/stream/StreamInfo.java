package imstream.core.stream;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import imstream.core.source.FrameSource;

/**
 * Snapshot of a stream's properties, printable as JSON.
 */
public final class StreamInfo {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final String name;
    private final String type;
    private final int numberOfFrames;
    private final double frameRate;
    private final double duration;
    private final int width;
    private final int height;
    private final int bitsPerPixel;
    private final String videoFormat;

    StreamInfo(String name, String type, int numberOfFrames, double frameRate, double duration,
               int width, int height, int bitsPerPixel, String videoFormat) {
        this.name = name;
        this.type = type;
        this.numberOfFrames = numberOfFrames;
        this.frameRate = frameRate;
        this.duration = duration;
        this.width = width;
        this.height = height;
        this.bitsPerPixel = bitsPerPixel;
        this.videoFormat = videoFormat;
    }

    static StreamInfo of(FrameSource source, int numberOfFrames) {
        return new StreamInfo(source.getName(), source.getType(), numberOfFrames, source.getFrameRate(),
                source.getDuration(), source.getWidth(), source.getHeight(), source.getBitsPerPixel(),
                source.getVideoFormat());
    }

    public String getName() { return name; }
    public String getType() { return type; }
    public int getNumberOfFrames() { return numberOfFrames; }
    public double getFrameRate() { return frameRate; }
    public double getDuration() { return duration; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBitsPerPixel() { return bitsPerPixel; }
    public String getVideoFormat() { return videoFormat; }

    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return "StreamInfo{" +
               "name='" + name + '\'' +
               ", type=" + type +
               ", numberOfFrames=" + numberOfFrames +
               ", frameRate=" + frameRate +
               ", width=" + width +
               ", height=" + height +
               ", videoFormat=" + videoFormat +
               '}';
    }
}
