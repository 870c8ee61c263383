package imstream.tools;

import imstream.core.ImstreamConfig;
import imstream.core.MediaStreamException;
import imstream.core.image.ColorNames;
import imstream.core.image.ImageFiles;
import imstream.core.stream.MediaStream;
import org.apache.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point: prints a stream's properties as JSON and writes a
 * range of its frames out as PNG files.
 *
 * Usage:
 *   java -jar imstream-tools.jar input.0001.png -from 10 -to 20 -out frames/
 *   java -jar imstream-tools.jar clip.mp4 -info
 *
 * Frames are written as frame_NNNNN.png, numbered by their index in the stream.
 */
public class FrameDumpMain {

    private static final Logger LOGGER = Logger.getLogger(FrameDumpMain.class);

    public static void main(final String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOGGER.fatal(null, e));

        DumpOptions options;
        try {
            options = DumpOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(DumpOptions.USAGE);
            System.exit(2);
            return;
        }

        try {
            int written = dump(options, ImstreamConfig.load(), System.out);
            LOGGER.info("Wrote " + written + " frame(s) to " + options.getOutputDir().toAbsolutePath());
        } catch (IOException | MediaStreamException | IllegalArgumentException e) {
            LOGGER.fatal("Failed to dump " + options.getSource() + ": " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Open the source, print its properties to {@code out}, and unless only
     * info was asked for, write the requested frames.
     *
     * @return number of frames written
     */
    static int dump(DumpOptions options, ImstreamConfig config, PrintStream out) throws IOException {
        int cacheLength = options.getCacheLength() != null ? options.getCacheLength() : config.getCacheLength();
        String backgroundName = options.getBackground() != null ? options.getBackground() : config.getBackground();
        Color background = backgroundName != null ? ColorNames.parse(backgroundName) : null;

        try (MediaStream stream = MediaStream.open(options.getSource(), cacheLength, config)) {
            out.println(stream.info().toJson());
            if (options.isInfoOnly()) {
                return 0;
            }

            int last = options.getTo() != null ? Math.min(options.getTo(), stream.numFrames()) : stream.numFrames();
            if (options.getFrom() > last) {
                LOGGER.warn("Nothing to write: -from " + options.getFrom() + " is past the last frame " + last);
                return 0;
            }
            Files.createDirectories(options.getOutputDir());

            int written = 0;
            BufferedImage frame = stream.read(options.getFrom());
            while (true) {
                if (options.isRgb() || background != null) {
                    frame = ImageFiles.toRgb(frame, background);
                }
                write(frame, options.getOutputDir().resolve(String.format("frame_%05d.png", stream.getCurrentFrame())));
                written++;
                if (stream.getCurrentFrame() >= last) {
                    break;
                }
                frame = stream.readFrame();
            }
            return written;
        }
    }

    private static void write(BufferedImage frame, Path target) throws IOException {
        if (!ImageIO.write(frame, "png", target.toFile())) {
            throw new IOException("No PNG writer accepts this frame layout (try -rgb): " + target);
        }
        LOGGER.debug("Wrote " + target);
    }
}
