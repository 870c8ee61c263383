package imstream.core.stream;

import imstream.core.EndOfStreamException;
import imstream.core.FrameRangeException;
import imstream.core.ImstreamConfig;
import imstream.core.StreamClosedException;
import imstream.core.UnsupportedFormatException;
import imstream.core.cache.LruCache;
import imstream.core.source.FFmpegVideoSource;
import imstream.core.source.FrameSource;
import imstream.core.source.ImageSequenceSource;
import imstream.core.source.MediaFormats;
import org.apache.log4j.Logger;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * One frame-indexed interface to both video files and image sequences.
 *
 * Frames are addressed by 1-based index through {@link #read(int)} and kept in
 * an LRU cache, which pays off when frames are read several times:
 *
 * <pre>
 *   // Process all frame triplets, caching the last 3 frames used
 *   try (MediaStream ims = MediaStream.open(Paths.get("input.000.png"), 3)) {
 *       int n = ims.numFrames();
 *       for (int a = 2; a &lt; n; a++) {
 *           process(ims.read(a - 1), ims.read(a), ims.read(a + 1));
 *       }
 *   }
 * </pre>
 *
 * The sequential methods ({@link #hasFrame}, {@link #readFrame}, {@link #next},
 * {@link #seek}, {@link #step}) follow the usual video-reader contract and all
 * go through {@link #read(int)}.
 *
 * All public methods lock the stream, so a read is atomic with respect to the
 * cache and the decode cursor.
 */
public class MediaStream implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(MediaStream.class);

    /** Frame index meaning "the last frame". */
    public static final int LAST_FRAME = Integer.MAX_VALUE;

    private static final int UNKNOWN = -1;

    private final FrameSource source;
    private final int numberOfFrames;
    private final LruCache<BufferedImage> cache;
    private int currentFrame;
    private int lastDecodedFrame;
    private boolean closed;

    /**
     * Wrap an already opened source. The stream takes ownership and closes it;
     * the source must not be used directly afterwards.
     */
    public MediaStream(FrameSource source, int cacheLength) {
        this.source = source;
        this.numberOfFrames = source.getNumberOfFrames();
        this.cache = new LruCache<>(this::readLowLevel, cacheLength);
        this.currentFrame = 0;
        this.lastDecodedFrame = 0;
    }

    public static MediaStream open(Path file) throws IOException {
        ImstreamConfig config = ImstreamConfig.load();
        return open(file, config.getCacheLength(), config);
    }

    public static MediaStream open(Path file, int cacheLength) throws IOException {
        return open(file, cacheLength, ImstreamConfig.load());
    }

    /**
     * Open a video file or the first frame of an image sequence, chosen by extension.
     *
     * @param file video file, or first file of a numbered image sequence
     * @param cacheLength number of frames to keep cached (at least 1)
     * @throws UnsupportedFormatException if the extension is not a known image or video type
     * @throws IOException if the source cannot be opened
     */
    public static MediaStream open(Path file, int cacheLength, ImstreamConfig config) throws IOException {
        FrameSource source;
        if (MediaFormats.isImage(file)) {
            source = ImageSequenceSource.open(file);
        } else if (MediaFormats.isVideo(file)) {
            source = FFmpegVideoSource.open(file, config);
        } else {
            throw new UnsupportedFormatException("File extension ." + MediaFormats.extension(file) + " not recognised: " + file);
        }
        LOGGER.info("Opened " + source.getType() + " stream " + file + " (" + source.getNumberOfFrames()
                + " frames, cache " + cacheLength + ")");
        return new MediaStream(source, cacheLength);
    }

    /**
     * Open a list of image files as a stream, one frame per file.
     */
    public static MediaStream open(List<Path> images, int cacheLength) throws IOException {
        return new MediaStream(ImageSequenceSource.of(images), cacheLength);
    }

    /**
     * Read frame {@code frame} (1-based), from the cache if possible. The
     * frame becomes the current frame.
     *
     * @param frame frame index, or {@link #LAST_FRAME}
     * @throws FrameRangeException if the frame is outside {@code [1, numFrames()]}
     * @throws StreamClosedException if the stream has been closed
     */
    public synchronized BufferedImage read(int frame) throws IOException {
        ensureOpen();
        if (frame == LAST_FRAME) {
            frame = numberOfFrames;
        }
        if (frame < 1 || frame > numberOfFrames) {
            throw new FrameRangeException(frame, numberOfFrames);
        }
        BufferedImage image = cache.get(frame);
        currentFrame = frame;
        return image;
    }

    /** True while frames remain after the current one. */
    public synchronized boolean hasFrame() {
        ensureOpen();
        return currentFrame < numberOfFrames;
    }

    /**
     * Read the frame after the current one.
     *
     * @throws EndOfStreamException if the last frame has already been read
     */
    public synchronized BufferedImage readFrame() throws IOException {
        if (!hasFrame()) {
            throw new EndOfStreamException("No frames left after frame " + currentFrame + " of " + name());
        }
        return read(currentFrame + 1);
    }

    /**
     * Move to frame {@code frame} by reading it.
     *
     * @return true once the frame has been read; failures are thrown
     */
    public synchronized boolean seek(int frame) throws IOException {
        return read(frame) != null;
    }

    /** Seek {@code delta} frames relative to the current frame. */
    public synchronized boolean step(int delta) throws IOException {
        return seek(currentFrame + delta);
    }

    /** Seek to the next frame. */
    public synchronized boolean next() throws IOException {
        return step(1);
    }

    /** Return the current frame. */
    public synchronized BufferedImage getFrame() throws IOException {
        return read(currentFrame);
    }

    /** Advance one frame and return it. */
    public synchronized BufferedImage getNext() throws IOException {
        next();
        return getFrame();
    }

    public int numFrames() {
        return numberOfFrames;
    }

    /** Index of the frame last read, 0 before the first read. */
    public synchronized int getCurrentFrame() {
        return currentFrame;
    }

    public StreamInfo info() {
        return StreamInfo.of(source, numberOfFrames);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Release the cached frames and the underlying source. Later calls do nothing.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOGGER.info("Closing stream " + name() + " (" + cache.getLoadCount() + " decodes, "
                + cache.getHitCount() + " cache hits)");
        cache.clear();
        source.close();
    }

    /** Physical decode cursor; -1 after a failed decode. */
    synchronized int getLastDecodedFrame() {
        return lastDecodedFrame;
    }

    private BufferedImage readLowLevel(int frame) throws IOException {
        // Reading on from the last decoded frame avoids a time-based seek
        boolean sequential = frame == lastDecodedFrame + 1;
        lastDecodedFrame = UNKNOWN;
        if (!sequential) {
            source.setCurrentTime((frame - 1) / source.getFrameRate());
        }
        BufferedImage image = source.readFrame();
        lastDecodedFrame = frame;
        return image;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StreamClosedException("Stream " + name() + " has been closed");
        }
    }

    private String name() {
        return source.getName();
    }
}
