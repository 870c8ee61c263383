package imstream.core.image;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lists the image files in a directory.
 */
public final class ImageDirectory {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "png", "tif", "tiff", "jpg", "jpeg", "bmp", "ppm", "pgm", "pbm", "gif", "ras");

    private ImageDirectory() {
    }

    /**
     * Names of all image files in {@code directory}, in the order the file system returns them.
     */
    public static List<String> list(Path directory) throws IOException {
        return list(directory, "*");
    }

    /**
     * Names of the image files in {@code directory} that also match {@code glob}
     * (e.g. {@code "frame_*"}).
     */
    public static List<String> list(Path directory, String glob) throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory, glob)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (Files.isRegularFile(entry) && isImageName(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    /**
     * True if the name ends in one of the supported image extensions (case-insensitive).
     */
    public static boolean isImageName(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return false;
        }
        return IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
