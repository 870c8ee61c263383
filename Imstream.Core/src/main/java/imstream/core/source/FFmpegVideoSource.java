package imstream.core.source;

import imstream.core.EndOfStreamException;
import imstream.core.ImstreamConfig;
import org.apache.log4j.Logger;

import java.awt.image.BufferedImage;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Video file source decoding through external ffprobe/ffmpeg processes.
 *
 * Frames are piped from ffmpeg as raw rgb24. Reading on is a plain read from
 * the running decoder; changing the current time restarts the decoder with
 * {@code -ss}, so seeking is only as exact as ffmpeg's time-based seek.
 */
public class FFmpegVideoSource implements FrameSource {

    private static final Logger LOGGER = Logger.getLogger(FFmpegVideoSource.class);

    public static final String TYPE = "video";

    private final Path file;
    private final String ffmpegPath;
    private final VideoProbe probe;
    private final int frameSize;

    private Process decoder;
    private DataInputStream frames;
    private Path decoderLog;
    private double startTime;
    private long framesRead;
    private double currentTime;

    FFmpegVideoSource(Path file, String ffmpegPath, VideoProbe probe) {
        this.file = file;
        this.ffmpegPath = ffmpegPath;
        this.probe = probe;
        this.frameSize = probe.getWidth() * probe.getHeight() * 3;
    }

    /**
     * Probe a video file with ffprobe and prepare it for decoding.
     *
     * @throws IOException if the file is missing, ffprobe fails, or there is no video stream
     */
    public static FFmpegVideoSource open(Path file, ImstreamConfig config) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        List<String> command = VideoProbe.command(config.getFfprobePath(), file.toAbsolutePath().toString());
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = pb.start();
        String output;
        try (InputStream is = process.getInputStream()) {
            output = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IOException("ffprobe exited with code " + exitCode + " for " + file);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while probing " + file, e);
        }

        VideoProbe probe = VideoProbe.parse(output);
        LOGGER.info("Video " + file + ": " + probe.getWidth() + "x" + probe.getHeight()
                + " @ " + String.format("%.2f", probe.getFrameRate()) + " fps, "
                + probe.getNumberOfFrames() + " frames");
        return new FFmpegVideoSource(file, config.getFfmpegPath(), probe);
    }

    /**
     * @throws EndOfStreamException if ffmpeg finished cleanly without another frame
     * @throws IOException if ffmpeg cannot be started or exits with an error
     */
    @Override
    public BufferedImage readFrame() throws IOException {
        if (decoder == null) {
            startDecoder();
        }
        byte[] frameData = new byte[frameSize];
        try {
            frames.readFully(frameData);
        } catch (EOFException e) {
            int exitCode = waitForDecoder();
            String log = readDecoderLog();
            stopDecoder();
            if (exitCode != 0) {
                throw new IOException("ffmpeg exited with code " + exitCode + " decoding " + file
                        + (log.isEmpty() ? "" : ": " + log));
            }
            throw new EndOfStreamException("No frame at " + String.format("%.3f", currentTime) + "s in " + file);
        }
        framesRead++;
        currentTime = startTime + framesRead / probe.getFrameRate();
        return toImage(frameData, probe.getWidth(), probe.getHeight());
    }

    @Override
    public void setCurrentTime(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("CurrentTime must not be negative: " + seconds);
        }
        stopDecoder();
        startTime = seconds;
        framesRead = 0;
        currentTime = seconds;
    }

    @Override
    public double getCurrentTime() {
        return currentTime;
    }

    @Override
    public boolean hasFrame() {
        return currentTime < probe.getDuration();
    }

    @Override
    public String getName() {
        return file.toString();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public double getFrameRate() {
        return probe.getFrameRate();
    }

    @Override
    public double getDuration() {
        return probe.getDuration();
    }

    @Override
    public int getNumberOfFrames() {
        return probe.getNumberOfFrames();
    }

    @Override
    public int getWidth() {
        return probe.getWidth();
    }

    @Override
    public int getHeight() {
        return probe.getHeight();
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
        stopDecoder();
    }

    /**
     * ffmpeg arguments decoding from {@code seconds} to raw rgb24 on stdout.
     */
    List<String> decoderCommand(double seconds) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegPath);
        cmd.add("-v"); cmd.add("error");
        if (seconds > 0) {
            cmd.add("-ss"); cmd.add(String.valueOf(seconds));
        }
        cmd.add("-i"); cmd.add(file.toAbsolutePath().toString());
        cmd.add("-f"); cmd.add("rawvideo");
        cmd.add("-pix_fmt"); cmd.add("rgb24");
        cmd.add("-an");
        cmd.add("-");
        return cmd;
    }

    private void startDecoder() throws IOException {
        List<String> cmd = decoderCommand(startTime);
        LOGGER.debug("Starting decoder: " + String.join(" ", cmd));
        decoderLog = Files.createTempFile("imstream-ffmpeg", ".log");
        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectError(decoderLog.toFile());
        try {
            decoder = pb.start();
        } catch (IOException e) {
            Files.deleteIfExists(decoderLog);
            decoderLog = null;
            throw e;
        }
        frames = new DataInputStream(decoder.getInputStream());
    }

    private int waitForDecoder() throws IOException {
        try {
            return decoder.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopDecoder();
            throw new IOException("Interrupted while waiting for ffmpeg on " + file, e);
        }
    }

    private String readDecoderLog() {
        try {
            return new String(Files.readAllBytes(decoderLog), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            LOGGER.warn("Could not read ffmpeg log " + decoderLog, e);
            return "";
        }
    }

    /** Running decoder process, or null when none has been started since the last reposition. */
    Process decoderProcess() {
        return decoder;
    }

    private void stopDecoder() {
        if (decoder == null) {
            return;
        }
        try {
            frames.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing decoder output for " + file, e);
        }
        decoder.destroyForcibly();
        try {
            Files.deleteIfExists(decoderLog);
        } catch (IOException e) {
            LOGGER.warn("Could not delete ffmpeg log " + decoderLog, e);
        }
        decoder = null;
        frames = null;
        decoderLog = null;
    }

    static BufferedImage toImage(byte[] rgb, int width, int height) {
        BufferedImage frame = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] pixels = new int[width * height];
        for (int i = 0; i < pixels.length; i++) {
            int r = rgb[i * 3] & 0xFF;
            int g = rgb[i * 3 + 1] & 0xFF;
            int b = rgb[i * 3 + 2] & 0xFF;
            pixels[i] = (r << 16) | (g << 8) | b;
        }
        frame.setRGB(0, 0, width, height, pixels, 0, width);
        return frame;
    }
}
