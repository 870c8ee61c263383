package imstream.core.source;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * File extensions understood by the two backends.
 */
public final class MediaFormats {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "bmp", "tif", "tiff", "jpeg", "jpg", "png", "ppm", "pgm", "pbm", "gif");

    public static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "mpg", "avi", "mp4", "m4v", "mpeg", "mxf", "mj2", "wmv", "asf", "asx", "mov", "ogg");

    private MediaFormats() {
    }

    /** Lower-cased extension without the dot, or "" if the name has none. */
    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public static boolean isImage(Path file) {
        return IMAGE_EXTENSIONS.contains(extension(file));
    }

    public static boolean isVideo(Path file) {
        return VIDEO_EXTENSIONS.contains(extension(file));
    }
}
