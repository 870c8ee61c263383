package imstream.core.source;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Video stream properties as reported by {@code ffprobe -of json}.
 */
public final class VideoProbe {

    private final int width;
    private final int height;
    private final double frameRate;
    private final double duration;
    private final int reportedFrames;

    VideoProbe(int width, int height, double frameRate, double duration, int reportedFrames) {
        this.width = width;
        this.height = height;
        this.frameRate = frameRate;
        this.duration = duration;
        this.reportedFrames = reportedFrames;
    }

    /**
     * Arguments that make ffprobe print what {@link #parse} expects.
     */
    public static List<String> command(String ffprobePath, String file) {
        List<String> command = new ArrayList<>();
        command.add(ffprobePath);
        command.add("-v"); command.add("error");
        command.add("-select_streams"); command.add("v:0");
        command.add("-show_entries"); command.add("stream=width,height,r_frame_rate,nb_frames,duration:format=duration");
        command.add("-of"); command.add("json");
        command.add(file);
        return command;
    }

    /**
     * Parse ffprobe's JSON output.
     *
     * @throws IOException if there is no video stream or a required field is missing
     */
    public static VideoProbe parse(String json) throws IOException {
        JsonObject root;
        try {
            root = JsonParser.parseString(json).getAsJsonObject();
        } catch (JsonSyntaxException | IllegalStateException e) {
            throw new IOException("Unreadable ffprobe output: " + e.getMessage(), e);
        }

        JsonArray streams = root.has("streams") ? root.getAsJsonArray("streams") : null;
        if (streams == null || streams.size() == 0) {
            throw new IOException("No video stream found");
        }
        JsonObject stream = streams.get(0).getAsJsonObject();
        JsonObject format = root.has("format") ? root.getAsJsonObject("format") : new JsonObject();

        int width = requireInt(stream, "width");
        int height = requireInt(stream, "height");
        double frameRate = parseRate(require(stream, "r_frame_rate").getAsString());
        int frames = stream.has("nb_frames") ? (int) parseDouble(stream.get("nb_frames").getAsString(), "nb_frames") : -1;
        if (frameRate <= 0) {
            throw new IOException("Invalid frame rate: " + stream.get("r_frame_rate").getAsString());
        }
        return new VideoProbe(width, height, frameRate, duration(format, stream, frames, frameRate), frames);
    }

    /**
     * Parse a rate written as a fraction ("24000/1001") or a plain number ("25").
     */
    static double parseRate(String rate) throws IOException {
        if (rate.contains("/")) {
            String[] parts = rate.split("/");
            double num = parseDouble(parts[0], "r_frame_rate");
            double den = parseDouble(parts[1], "r_frame_rate");
            return den == 0 ? 0 : num / den;
        }
        return parseDouble(rate, "r_frame_rate");
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getFrameRate() {
        return frameRate;
    }

    public double getDuration() {
        return duration;
    }

    /**
     * Frame count from the container if it reports one, otherwise duration times frame rate.
     */
    public int getNumberOfFrames() {
        return reportedFrames > 0 ? reportedFrames : (int) Math.round(duration * frameRate);
    }

    /**
     * Container duration, else the stream's own, else the reported frame count at the frame rate.
     */
    private static double duration(JsonObject format, JsonObject stream, int frames, double frameRate) throws IOException {
        if (present(format, "duration")) {
            return parseDouble(format.get("duration").getAsString(), "duration");
        }
        if (present(stream, "duration")) {
            return parseDouble(stream.get("duration").getAsString(), "duration");
        }
        if (frames > 0) {
            return frames / frameRate;
        }
        throw new IOException("ffprobe output lacks duration");
    }

    private static boolean present(JsonObject obj, String field) {
        JsonElement value = obj.get(field);
        return value != null && !value.isJsonNull() && !"N/A".equals(value.getAsString());
    }

    private static JsonElement require(JsonObject obj, String field) throws IOException {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            throw new IOException("ffprobe output lacks " + field);
        }
        return value;
    }

    private static int requireInt(JsonObject obj, String field) throws IOException {
        return (int) parseDouble(require(obj, field).getAsString(), field);
    }

    private static double parseDouble(String value, String field) throws IOException {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IOException("Could not parse " + field + ": " + value, e);
        }
    }
}
