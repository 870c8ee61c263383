package imstream.core.source;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;

/**
 * A backend that materializes frames one at a time from a playback cursor,
 * in the style of a video reader.
 *
 * The cursor is a time in seconds. {@link #readFrame()} decodes the frame at
 * the cursor and advances it by one frame period; {@link #setCurrentTime}
 * repositions it, which may be far more expensive than reading on.
 */
public interface FrameSource extends Closeable {

    /** Name the source was opened with. */
    String getName();

    /** Short backend identifier, e.g. "imseq" or "video". */
    String getType();

    double getFrameRate();

    /** Length in seconds. */
    double getDuration();

    int getNumberOfFrames();

    int getWidth();

    int getHeight();

    int getBitsPerPixel();

    /** Pixel layout description, e.g. "RGB24" or "Gray8". */
    String getVideoFormat();

    double getCurrentTime();

    void setCurrentTime(double seconds) throws IOException;

    boolean hasFrame();

    BufferedImage readFrame() throws IOException;

    /**
     * Release files, processes or decoder state held by the source.
     */
    @Override
    void close();
}
