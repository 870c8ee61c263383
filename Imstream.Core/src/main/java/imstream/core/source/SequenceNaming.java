package imstream.core.source;

import imstream.core.SequenceDetectionException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File name grammar of a numbered image sequence: {@code <prefix><digits><suffix>},
 * where the digits are the last run of decimal digits before the extension.
 *
 * The digit count of the original name is kept as the minimum width when
 * generating names, so {@code img.0001.png} yields {@code img.0007.png} for 7.
 */
public final class SequenceNaming {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private final String prefix;
    private final int width;
    private final String suffix;
    private final long number;

    private SequenceNaming(String prefix, int width, String suffix, long number) {
        this.prefix = prefix;
        this.width = width;
        this.suffix = suffix;
        this.number = number;
    }

    /**
     * Derive the naming scheme from one file name of the sequence (no directory part).
     *
     * @throws SequenceDetectionException if the base name contains no digits
     */
    public static SequenceNaming parse(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        Matcher m = DIGITS.matcher(base);
        int start = -1;
        int end = -1;
        while (m.find()) {
            start = m.start();
            end = m.end();
        }
        if (start < 0) {
            throw new SequenceDetectionException("No image index found in file name: " + fileName);
        }
        String digits = base.substring(start, end);
        long number;
        try {
            number = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new SequenceDetectionException("Image index too large in file name: " + fileName);
        }
        return new SequenceNaming(base.substring(0, start), digits.length(),
                base.substring(end) + extension, number);
    }

    /** Generate the file name carrying {@code index}. */
    public String format(long index) {
        String digits = Long.toString(index);
        StringBuilder name = new StringBuilder(prefix.length() + Math.max(width, digits.length()) + suffix.length());
        name.append(prefix);
        for (int i = digits.length(); i < width; i++) {
            name.append('0');
        }
        return name.append(digits).append(suffix).toString();
    }

    /** The number found in the parsed file name. */
    public long getNumber() {
        return number;
    }

    public String getPrefix() {
        return prefix;
    }

    public int getWidth() {
        return width;
    }

    /** Everything after the digits, extension included. */
    public String getSuffix() {
        return suffix;
    }

    @Override
    public String toString() {
        return prefix + "%0" + width + "d" + suffix;
    }
}
