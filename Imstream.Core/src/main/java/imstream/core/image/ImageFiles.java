package imstream.core.image;

import org.apache.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Single-file image decoding.
 *
 * {@link #read} returns the decoded pixels as they are stored, except that
 * palette images are expanded to true color. {@link #readRgb} goes further and
 * always returns 8-bit RGB.
 */
public final class ImageFiles {

    private static final Logger LOGGER = Logger.getLogger(ImageFiles.class);

    private static final int CHECKER_DARK = 85;
    private static final int CHECKER_LIGHT = 171;

    private ImageFiles() {
    }

    /**
     * Decode the first image in a file. Palette images are expanded with
     * 0-based palette lookup into a TYPE_INT_RGB image.
     *
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if no installed reader can decode the file
     */
    public static BufferedImage read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("No image reader available for " + file);
        }
        if (image.getColorModel() instanceof IndexColorModel) {
            return expandPalette(image);
        }
        return image;
    }

    /**
     * Decode an image to 8-bit RGB, flattening transparency over a grey checkerboard.
     */
    public static BufferedImage readRgb(Path file) throws IOException {
        return readRgb(file, null);
    }

    /**
     * Decode an image to 8-bit RGB regardless of its stored format.
     *
     * Grayscale is replicated into the three channels, deeper samples are
     * scaled down to 8 bits, four-channel TIFFs without alpha are treated as
     * CMYK, and transparent pixels are blended over {@code background}
     * (or a grey checkerboard when it is null).
     */
    public static BufferedImage readRgb(Path file, Color background) throws IOException {
        BufferedImage image = read(file);
        if (image.getRaster().getNumBands() == 4 && !image.getColorModel().hasAlpha() && isTiff(file)) {
            LOGGER.debug("Converting CMYK image " + file.getFileName() + " to RGB");
            return cmykToRgb(image.getRaster());
        }
        return toRgb(image, background);
    }

    /**
     * Convert an already decoded image to 8-bit RGB, blending transparency over
     * {@code background} (or a grey checkerboard when it is null). The input is
     * never modified.
     */
    public static BufferedImage toRgb(BufferedImage image, Color background) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        ColorModel cm = image.getColorModel();
        if (cm instanceof IndexColorModel) {
            return expandPalette(image);
        }
        if (cm.isAlphaPremultiplied()) {
            // The input may be a cached frame, so un-premultiply a copy
            image = new BufferedImage(cm, image.copyData(null), true, null);
            image.coerceData(false);
        }
        return toRgb(image.getRaster(), cm.hasAlpha(), background);
    }

    /**
     * Expand a palette image into true color. Transparency in the palette is dropped.
     */
    static BufferedImage expandPalette(BufferedImage image) {
        IndexColorModel palette = (IndexColorModel) image.getColorModel();
        Raster raster = image.getRaster();
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] indices = new int[width];
        int[] pixels = new int[width];
        for (int y = 0; y < height; y++) {
            raster.getSamples(0, y, width, 1, 0, indices);
            for (int x = 0; x < width; x++) {
                pixels[x] = palette.getRGB(indices[x]) & 0xFFFFFF;
            }
            rgb.setRGB(0, y, width, 1, pixels, 0, width);
        }
        return rgb;
    }

    /**
     * Convert inverted CMYK samples to RGB: {@code channel = (255 - c) * (255 - k) / 255}.
     */
    static BufferedImage cmykToRgb(Raster raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double black = (255 - sample8(raster, x, y, 3)) / 255.0;
                int r = clamp((255 - sample8(raster, x, y, 0)) * black);
                int g = clamp((255 - sample8(raster, x, y, 1)) * black);
                int b = clamp((255 - sample8(raster, x, y, 2)) * black);
                rgb.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return rgb;
    }

    static BufferedImage toRgb(Raster raster, boolean hasAlpha, Color background) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        int colorBands = hasAlpha ? raster.getNumBands() - 1 : raster.getNumBands();
        int checkerSize = checkerSquareSize(width, height);
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] c = new int[3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int i = 0; i < 3; i++) {
                    c[i] = sample8(raster, x, y, colorBands >= 3 ? i : 0);
                }
                if (hasAlpha) {
                    double alpha = sample8(raster, x, y, colorBands) / 255.0;
                    for (int i = 0; i < 3; i++) {
                        double bg = background != null
                                ? backgroundLevel(background, i)
                                : checkerLevel(x, y, checkerSize);
                        c[i] = clamp(c[i] * alpha + bg * (1 - alpha));
                    }
                }
                rgb.setRGB(x, y, (c[0] << 16) | (c[1] << 8) | c[2]);
            }
        }
        return rgb;
    }

    /**
     * Size in pixels of one checkerboard square for an image of the given size.
     */
    static int checkerSquareSize(int width, int height) {
        int size = Math.max(width, height);
        return (int) Math.floor(Math.max(Math.log(size / 100.0), 0) * 10 + 1 + Math.min(size, 100) / 20.0);
    }

    static int checkerLevel(int x, int y, int squareSize) {
        return ((x / squareSize + y / squareSize) % 2 == 1) ? CHECKER_LIGHT : CHECKER_DARK;
    }

    private static double backgroundLevel(Color background, int channel) {
        switch (channel) {
            case 0:
                return background.getRed();
            case 1:
                return background.getGreen();
            default:
                return background.getBlue();
        }
    }

    /**
     * Read one sample scaled to the 0-255 range.
     */
    private static int sample8(Raster raster, int x, int y, int band) {
        int dataType = raster.getDataBuffer().getDataType();
        if (dataType == DataBuffer.TYPE_FLOAT || dataType == DataBuffer.TYPE_DOUBLE) {
            return clamp(raster.getSampleDouble(x, y, band) * 255);
        }
        int bits = raster.getSampleModel().getSampleSize(band);
        int value = raster.getSample(x, y, band);
        if (bits == 8) {
            return value;
        }
        if (bits > 8) {
            return (value >>> (bits - 8)) & 0xFF;
        }
        return clamp(value * 255.0 / ((1 << bits) - 1));
    }

    private static int clamp(double value) {
        long rounded = Math.round(value);
        return (int) Math.max(0, Math.min(255, rounded));
    }

    private static boolean isTiff(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".tif") || name.endsWith(".tiff");
    }
}
