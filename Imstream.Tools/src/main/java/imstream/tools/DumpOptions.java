package imstream.tools;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line options of {@link FrameDumpMain}.
 */
public class DumpOptions {

    static final String USAGE = "Usage: imstream-tools <video-or-first-image> [-cache N] [-from A] [-to B]"
            + " [-out DIR] [-rgb] [-background C] [-info]";

    private Path source;
    private Integer cacheLength;
    private int from = 1;
    private Integer to;
    private Path outputDir = Paths.get(".");
    private boolean rgb;
    private String background;
    private boolean infoOnly;

    /**
     * @throws IllegalArgumentException on unknown flags, missing values or a missing source
     */
    public static DumpOptions parse(String[] args) {
        DumpOptions options = new DumpOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-cache":
                    options.cacheLength = positive(arg, value(args, ++i, arg));
                    break;
                case "-from":
                    options.from = positive(arg, value(args, ++i, arg));
                    break;
                case "-to":
                    options.to = positive(arg, value(args, ++i, arg));
                    break;
                case "-out":
                    options.outputDir = Paths.get(value(args, ++i, arg));
                    break;
                case "-rgb":
                    options.rgb = true;
                    break;
                case "-background":
                    options.background = value(args, ++i, arg);
                    break;
                case "-info":
                    options.infoOnly = true;
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (options.source != null) {
                        throw new IllegalArgumentException("Only one source may be given, got " + options.source + " and " + arg);
                    }
                    options.source = Paths.get(arg);
            }
        }
        if (options.source == null) {
            throw new IllegalArgumentException("No source given");
        }
        if (options.to != null && options.to < options.from) {
            throw new IllegalArgumentException("-to " + options.to + " is before -from " + options.from);
        }
        return options;
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static int positive(String flag, String value) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number for " + flag + ", got: " + value);
        }
        if (n < 1) {
            throw new IllegalArgumentException(flag + " must be at least 1, got: " + n);
        }
        return n;
    }

    public Path getSource() {
        return source;
    }

    /** Cache length, or null to use the configured one. */
    public Integer getCacheLength() {
        return cacheLength;
    }

    public int getFrom() {
        return from;
    }

    /** Last frame to write, or null for the end of the stream. */
    public Integer getTo() {
        return to;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public boolean isRgb() {
        return rgb;
    }

    public String getBackground() {
        return background;
    }

    public boolean isInfoOnly() {
        return infoOnly;
    }
}
