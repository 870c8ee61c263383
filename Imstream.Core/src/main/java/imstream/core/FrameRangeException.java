package imstream.core;

/**
 * Thrown when a frame index lies outside {@code [1, numberOfFrames]}.
 */
public class FrameRangeException extends MediaStreamException {

    private final long frame;
    private final int numberOfFrames;

    public FrameRangeException(long frame, int numberOfFrames) {
        super("Frame " + frame + " is not in the range of allowed frames: [1 " + numberOfFrames + "].");
        this.frame = frame;
        this.numberOfFrames = numberOfFrames;
    }

    public long getFrame() {
        return frame;
    }

    public int getNumberOfFrames() {
        return numberOfFrames;
    }
}
