package imstream.core.image;

import imstream.core.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferInt;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImageFiles")
class ImageFilesTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        @DisplayName("true-color images come back as stored")
        void testTrueColor() throws Exception {
            Path file = tempDir.resolve("rgb.png");
            TestImages.write(TestImages.solid(0x123456), file);
            BufferedImage image = ImageFiles.read(file);
            assertEquals(0x123456, TestImages.rgbAt(image));
            assertEquals(3, image.getRaster().getNumBands());
        }

        @Test
        @DisplayName("missing files raise NoSuchFileException")
        void testMissing() {
            assertThrows(NoSuchFileException.class, () -> ImageFiles.read(tempDir.resolve("nope.png")));
        }

        @Test
        @DisplayName("files no reader understands raise IOException")
        void testUnreadable() throws Exception {
            Path file = tempDir.resolve("junk.png");
            Files.writeString(file, "not an image");
            assertThrows(IOException.class, () -> ImageFiles.read(file));
        }
    }

    @Nested
    @DisplayName("readRgb")
    class ReadRgb {

        @Test
        @DisplayName("grayscale is replicated into three channels")
        void testGray() throws Exception {
            BufferedImage gray = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
            gray.getRaster().setSample(0, 0, 0, 77);
            Path file = tempDir.resolve("gray.png");
            TestImages.write(gray, file);

            BufferedImage rgb = ImageFiles.readRgb(file);
            assertEquals(BufferedImage.TYPE_INT_RGB, rgb.getType());
            assertEquals(0x4D4D4D, TestImages.rgbAt(rgb));
        }

        @Test
        @DisplayName("16-bit samples are reduced to their high byte")
        void testSixteenBit() throws Exception {
            BufferedImage gray = new BufferedImage(2, 2, BufferedImage.TYPE_USHORT_GRAY);
            gray.getRaster().setSample(0, 0, 0, 0xABCD);
            Path file = tempDir.resolve("gray16.png");
            TestImages.write(gray, file);

            assertEquals(0xABABAB, TestImages.rgbAt(ImageFiles.readRgb(file)));
        }

        @Test
        @DisplayName("transparency is blended over the given background")
        void testAlphaOverBackground() throws Exception {
            BufferedImage argb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
            argb.setRGB(0, 0, 0x00FF0000);
            argb.setRGB(1, 0, 0xFF00FF00);
            Path file = tempDir.resolve("alpha.png");
            TestImages.write(argb, file);

            BufferedImage rgb = ImageFiles.readRgb(file, Color.WHITE);
            assertEquals(0xFFFFFF, rgb.getRGB(0, 0) & 0xFFFFFF);
            assertEquals(0x00FF00, rgb.getRGB(1, 0) & 0xFFFFFF);
        }

        @Test
        @DisplayName("without a background, transparency shows a grey checkerboard")
        void testAlphaOverCheckerboard() throws Exception {
            BufferedImage argb = new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB);
            Path file = tempDir.resolve("clear.png");
            TestImages.write(argb, file);

            BufferedImage rgb = ImageFiles.readRgb(file);
            assertEquals(0x555555, rgb.getRGB(0, 0) & 0xFFFFFF);
            assertEquals(0xABABAB, rgb.getRGB(1, 0) & 0xFFFFFF);
            assertEquals(0xABABAB, rgb.getRGB(0, 1) & 0xFFFFFF);
            assertEquals(0x555555, rgb.getRGB(1, 1) & 0xFFFFFF);
        }

        @Test
        @DisplayName("an already RGB frame is passed through")
        void testToRgbPassThrough() {
            BufferedImage image = TestImages.solid(0x010203);
            assertSame(image, ImageFiles.toRgb(image, null));
        }
    }

    @Nested
    @DisplayName("Conversions")
    class Conversions {

        @Test
        @DisplayName("CMYK samples are inverted and scaled by black")
        void testCmyk() {
            WritableRaster raster = Raster.createInterleavedRaster(DataBuffer.TYPE_BYTE, 3, 1, 4, null);
            raster.setPixel(0, 0, new int[] {0, 255, 0, 0});
            raster.setPixel(1, 0, new int[] {0, 0, 0, 255});
            raster.setPixel(2, 0, new int[] {255, 0, 0, 128});

            BufferedImage rgb = ImageFiles.cmykToRgb(raster);
            assertEquals(0xFF00FF, rgb.getRGB(0, 0) & 0xFFFFFF);
            assertEquals(0x000000, rgb.getRGB(1, 0) & 0xFFFFFF);
            assertEquals(0x007F7F, rgb.getRGB(2, 0) & 0xFFFFFF);
        }

        @Test
        @DisplayName("premultiplied input is converted without being modified")
        void testPremultipliedInputUntouched() {
            BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB_PRE);
            image.setRGB(0, 0, 0x80FF0000);
            image.setRGB(1, 0, 0xFF00FF00);
            int[] stored = ((DataBufferInt) image.getRaster().getDataBuffer()).getData().clone();

            BufferedImage rgb = ImageFiles.toRgb(image, Color.WHITE);

            assertTrue(image.isAlphaPremultiplied());
            assertArrayEquals(stored, ((DataBufferInt) image.getRaster().getDataBuffer()).getData());
            assertEquals(BufferedImage.TYPE_INT_RGB, rgb.getType());
            assertEquals(0x00FF00, rgb.getRGB(1, 0) & 0xFFFFFF);
        }

        @Test
        @DisplayName("checkerboard squares grow with image size")
        void testCheckerSquareSize() {
            assertEquals(1, ImageFiles.checkerSquareSize(4, 4));
            assertEquals(6, ImageFiles.checkerSquareSize(100, 50));
            assertEquals(12, ImageFiles.checkerSquareSize(200, 120));
        }
    }
}
