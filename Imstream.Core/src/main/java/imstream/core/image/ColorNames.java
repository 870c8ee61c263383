package imstream.core.image;

import java.awt.Color;

/**
 * Single-character color names, as used by plotting tools.
 */
public final class ColorNames {

    // Position in this string encodes the color: bit 2 = red, bit 1 = green, bit 0 = blue
    private static final String CODES = "kbgcrmyw";

    private ColorNames() {
    }

    /**
     * Convert one of {@code k b g c r m y w} to its color.
     * @throws IllegalArgumentException for any other character
     */
    public static Color parse(char code) {
        int index = CODES.indexOf(code);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown color character: '" + code + "'. Valid: " + CODES);
        }
        return new Color((index & 4) != 0 ? 255 : 0, (index & 2) != 0 ? 255 : 0, (index & 1) != 0 ? 255 : 0);
    }

    /**
     * Parse a one-character color name.
     * @throws IllegalArgumentException if the string is not exactly one known character
     */
    public static Color parse(String code) {
        if (code == null || code.length() != 1) {
            throw new IllegalArgumentException("Color must be a single character, got: " + code);
        }
        return parse(code.charAt(0));
    }
}
