package imstream.core.stream;

import imstream.core.EndOfStreamException;
import imstream.core.source.FrameSource;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory video-like source. Frame n is a 1x1 image whose RGB value is n.
 * Records every reposition and decode so tests can check what reached the backend.
 */
class ScriptedSource implements FrameSource {

    final int frames;
    final double frameRate;
    final List<Double> seeks = new ArrayList<>();
    final List<Integer> decodes = new ArrayList<>();
    final Set<Integer> failing = new HashSet<>();
    int closeCount;
    private double currentTime;

    ScriptedSource(int frames, double frameRate) {
        this.frames = frames;
        this.frameRate = frameRate;
    }

    /** Frame number encoded in an image read from this source. */
    static int frameOf(BufferedImage image) {
        return image.getRGB(0, 0) & 0xFFFFFF;
    }

    @Override
    public BufferedImage readFrame() throws IOException {
        int frame = (int) Math.round(currentTime * frameRate) + 1;
        if (frame > frames) {
            throw new EndOfStreamException("past end");
        }
        if (failing.contains(frame)) {
            throw new IOException("corrupt frame " + frame);
        }
        decodes.add(frame);
        currentTime = frame / frameRate;
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, frame);
        return image;
    }

    @Override
    public void setCurrentTime(double seconds) {
        seeks.add(seconds);
        currentTime = seconds;
    }

    @Override
    public double getCurrentTime() {
        return currentTime;
    }

    @Override
    public boolean hasFrame() {
        return currentTime < getDuration();
    }

    @Override
    public String getName() {
        return "scripted.mp4";
    }

    @Override
    public String getType() {
        return "video";
    }

    @Override
    public double getFrameRate() {
        return frameRate;
    }

    @Override
    public double getDuration() {
        return frames / frameRate;
    }

    @Override
    public int getNumberOfFrames() {
        return frames;
    }

    @Override
    public int getWidth() {
        return 1;
    }

    @Override
    public int getHeight() {
        return 1;
    }

    @Override
    public int getBitsPerPixel() {
        return 24;
    }

    @Override
    public String getVideoFormat() {
        return "RGB24";
    }

    @Override
    public void close() {
        closeCount++;
    }
}
