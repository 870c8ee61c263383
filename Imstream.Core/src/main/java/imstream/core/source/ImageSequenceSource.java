package imstream.core.source;

import imstream.core.FrameRangeException;
import imstream.core.image.ImageFiles;
import org.apache.log4j.Logger;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * A sequence of numbered image files read as if it were a video.
 *
 * The name passed to {@link #open} must contain an integer, and each following
 * frame is assumed to increment it by one, e.g.
 * {@code input.98.jpg, input.99.jpg, input.100.jpg} or, zero padded,
 * {@code 0000.png, 0001.png, 0002.png}. The named file is frame 1; the
 * sequence ends before the first number whose file cannot be opened.
 *
 * The frame rate is a fixed 30 fps so that the time-based reader contract
 * holds; it says nothing about the images.
 */
public class ImageSequenceSource implements FrameSource {

    private static final Logger LOGGER = Logger.getLogger(ImageSequenceSource.class);

    public static final double FRAME_RATE = 30;
    public static final String TYPE = "imseq";

    private static final String[] VIDEO_FORMATS = {"Gray%d", "%d", "RGB%d", "CMYK%d"};

    private final String name;
    private final IntFunction<Path> framePath;
    private final int numberOfFrames;
    private final int width;
    private final int height;
    private final int bitsPerPixel;
    private final String videoFormat;
    private double currentTime;

    private ImageSequenceSource(String name, IntFunction<Path> framePath, int numberOfFrames) throws IOException {
        this.name = name;
        this.framePath = framePath;
        this.numberOfFrames = numberOfFrames;
        if (numberOfFrames == 0) {
            throw new NoSuchFileException(name, null, "first frame of the sequence cannot be opened");
        }

        BufferedImage first = read(1);
        Raster raster = first.getRaster();
        int bands = raster.getNumBands();
        int bits = 0;
        for (int b = 0; b < bands; b++) {
            bits += raster.getSampleModel().getSampleSize(b);
        }
        this.width = first.getWidth();
        this.height = first.getHeight();
        this.bitsPerPixel = bits;
        this.videoFormat = String.format(bands <= VIDEO_FORMATS.length ? VIDEO_FORMATS[bands - 1] : "%d", bits);
        this.currentTime = 0;
    }

    /**
     * Open the sequence starting at {@code firstFrame}, probing the file system for its length.
     *
     * @throws imstream.core.SequenceDetectionException if the file name holds no number
     * @throws IOException if the named file cannot be opened or decoded
     */
    public static ImageSequenceSource open(Path firstFrame) throws IOException {
        Path absolute = firstFrame.toAbsolutePath();
        Path directory = absolute.getParent();
        SequenceNaming naming = SequenceNaming.parse(absolute.getFileName().toString());
        long zeroIndex = naming.getNumber() - 1;

        int count = 0;
        while (isReadable(directory.resolve(naming.format(zeroIndex + count + 1)))) {
            count++;
        }
        LOGGER.info("Image sequence " + directory.resolve(naming.toString()) + ": " + count + " frames from "
                + naming.getNumber());

        return new ImageSequenceSource(firstFrame.toString(),
                frame -> directory.resolve(naming.format(zeroIndex + frame)), count);
    }

    /**
     * Treat an explicit list of image files as the frames of a sequence.
     *
     * @throws IOException if the first file cannot be decoded
     */
    public static ImageSequenceSource of(List<Path> files) throws IOException {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Image list is empty");
        }
        List<Path> frames = new ArrayList<>(files);
        LOGGER.info("Image list starting at " + frames.get(0) + ": " + frames.size() + " frames");
        return new ImageSequenceSource(frames.get(0).toString(), frame -> frames.get(frame - 1), frames.size());
    }

    /**
     * Decode frame {@code frame} (1-based) and move the cursor past it.
     *
     * @throws FrameRangeException if the frame is outside {@code [1, numberOfFrames]}
     */
    public BufferedImage read(int frame) throws IOException {
        if (frame < 1 || frame > numberOfFrames) {
            throw new FrameRangeException(frame, numberOfFrames);
        }
        currentTime = frame / FRAME_RATE;
        return ImageFiles.read(framePath.apply(frame));
    }

    /** Path of the file backing {@code frame}. */
    public Path getFramePath(int frame) {
        if (frame < 1 || frame > numberOfFrames) {
            throw new FrameRangeException(frame, numberOfFrames);
        }
        return framePath.apply(frame);
    }

    @Override
    public BufferedImage readFrame() throws IOException {
        return read((int) Math.round(currentTime * FRAME_RATE) + 1);
    }

    @Override
    public boolean hasFrame() {
        return currentTime < getDuration();
    }

    @Override
    public double getCurrentTime() {
        return currentTime;
    }

    @Override
    public void setCurrentTime(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("CurrentTime must not be negative: " + seconds);
        }
        currentTime = seconds;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public double getFrameRate() {
        return FRAME_RATE;
    }

    @Override
    public double getDuration() {
        return numberOfFrames / FRAME_RATE;
    }

    @Override
    public int getNumberOfFrames() {
        return numberOfFrames;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getBitsPerPixel() {
        return bitsPerPixel;
    }

    @Override
    public String getVideoFormat() {
        return videoFormat;
    }

    @Override
    public void close() {
        // Files are opened per read; nothing is held between frames
    }

    private static boolean isReadable(Path file) {
        return Files.isRegularFile(file) && Files.isReadable(file);
    }
}
