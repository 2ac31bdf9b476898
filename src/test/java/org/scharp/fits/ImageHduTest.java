///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ImageHdu}. */
public class ImageHduTest {

    /** Makes a row of pixels for an image, with values that depend on the row. */
    private static Object row(int bitsPerPixel, int rowNumber) {
        switch (bitsPerPixel) {
        case 8:
            return new byte[] { (byte) rowNumber, (byte) 0xFF, 0 };
        case 16:
            return new short[] { (short) rowNumber, Short.MIN_VALUE, Short.MAX_VALUE };
        case 32:
            return new int[] { rowNumber, Integer.MIN_VALUE, -1 };
        case 64:
            return new long[] { rowNumber, Long.MAX_VALUE, Long.MIN_VALUE };
        case -32:
            return new float[] { rowNumber, Float.NaN, -0.0f };
        default:
            return new double[] { rowNumber, Double.NEGATIVE_INFINITY, 1e300 };
        }
    }

    private static void assertRowEquals(Object expected, Object actual) {
        assertEquals(expected.getClass(), actual.getClass());
        if (expected instanceof byte[] bytes) {
            assertArrayEquals(bytes, (byte[]) actual);
        } else if (expected instanceof short[] shorts) {
            assertArrayEquals(shorts, (short[]) actual);
        } else if (expected instanceof int[] ints) {
            assertArrayEquals(ints, (int[]) actual);
        } else if (expected instanceof long[] longs) {
            assertArrayEquals(longs, (long[]) actual);
        } else if (expected instanceof float[] floats) {
            assertArrayEquals(floats, (float[]) actual);
        } else {
            assertArrayEquals((double[]) expected, (double[]) actual);
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 8, 16, 32, 64, -32, -64 })
    void testWriteAndReadImage(int bitsPerPixel) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (FitsFile file = FitsFile.write(output, FitsOptions.defaults())) {
            ImageHdu image = file.createImageHdu(bitsPerPixel, 3, 2);
            assertEquals(3, image.width());
            assertEquals(HduKind.IMAGE, image.hdu().kind());

            image.writeNextStride(row(bitsPerPixel, 0));
            assertTrue(image.hasMoreStrides());
            image.writeNextStride(row(bitsPerPixel, 1));
            assertFalse(image.hasMoreStrides());
            assertEquals(HduState.DONE, image.hdu().state());
        }

        int dataSize = Math.abs(bitsPerPixel) / 8 * 6;
        assertEquals(2 * FitsFile.BLOCK_SIZE, output.size());

        try (FitsFile file = FitsFile.read(new ByteArrayInputStream(output.toByteArray()), FitsOptions.defaults())) {
            Hdu hdu = file.readNextHdu().get();
            assertEquals(HduKind.IMAGE, hdu.kind());
            assertTrue(hdu.isSimple());
            assertEquals(bitsPerPixel, hdu.bitsPerPixel());
            assertEquals(dataSize, hdu.dataSize());

            ImageHdu image = hdu.asImage();
            assertRowEquals(row(bitsPerPixel, 0), image.readNextStride());
            assertRowEquals(row(bitsPerPixel, 1), image.readNextStride());
            assertFalse(image.hasMoreStrides());
            assertThrows(HduStateException.class, image::readNextStride);
        }
    }

    @Test
    void testPixelsMustMatchImage() throws IOException {
        try (FitsFile file = FitsFile.write(new ByteArrayOutputStream(), FitsOptions.defaults())) {
            ImageHdu image = file.createImageHdu(16, 2, 1);

            Exception exception = assertThrows(IllegalArgumentException.class, () -> image.writeNextStride(new int[2]));
            assertEquals("an image with BITPIX = 16 needs pixels of type short[], not int[]", exception.getMessage());

            exception = assertThrows(IllegalArgumentException.class, () -> image.writeNextStride(new short[3]));
            assertEquals("a row of this image has 2 pixels, not 3", exception.getMessage());

            exception = assertThrows(NullPointerException.class, () -> image.writeNextStride(null));
            assertEquals("pixels must not be null", exception.getMessage());

            // A rejected row doesn't write the header.
            assertEquals(HduState.START, image.hdu().state());
        }
    }

    @Test
    void testRowTooWideForArray() throws IOException {
        try (FitsFile file = FitsFile.write(new ByteArrayOutputStream(), FitsOptions.defaults())) {
            // NAXIS1 doesn't fit in an int, so it must not be narrowed to one.
            ImageHdu image = file.createImageHdu(8, 4_294_967_298L, 1);

            Exception exception = assertThrows(UnsupportedFitsFeatureException.class, image::width);
            assertEquals("strides of 4294967298 bytes are not supported", exception.getMessage());

            exception = assertThrows(UnsupportedFitsFeatureException.class, () -> image.writeNextStride(new byte[2]));
            assertEquals("strides of 4294967298 bytes are not supported", exception.getMessage());
            assertEquals(HduState.START, image.hdu().state());
        }
    }

    @Test
    void testLaterImagesAreExtensions() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (FitsFile file = FitsFile.write(output, FitsOptions.defaults())) {
            ImageHdu primary = file.createImageHdu(8, 1);
            primary.writeNextStride(new byte[] { 42 });

            ImageHdu extension = file.createImageHdu(-32, 2);
            extension.hdu().setExtensionName("SCI");
            extension.writeNextStride(new float[] { 0.25f, 4f });
        }

        try (FitsFile file = FitsFile.read(new ByteArrayInputStream(output.toByteArray()), FitsOptions.defaults())) {
            Hdu primary = file.readNextHdu().get();
            assertTrue(primary.isSimple());
            assertNull(primary.extension());
            assertTrue(primary.hasExtensions());

            Hdu extension = file.readNextHdu().get();
            assertFalse(extension.isSimple());
            assertEquals(HduKind.IMAGE, extension.kind());
            assertEquals("IMAGE", extension.extension());
            assertEquals("SCI", extension.extensionName());
            assertEquals(1, extension.cards().get(FitsKeywords.GCOUNT).getInt32());
            assertArrayEquals(new float[] { 0.25f, 4f }, (float[]) extension.asImage().readNextStride());

            // The skipped primary data didn't disturb the extension.
            assertEquals(2 * FitsFile.BLOCK_SIZE, extension.headerPosition());
        }
    }

    @Test
    void testViewMustMatchKind() throws IOException {
        try (FitsFile file = FitsFile.write(new ByteArrayOutputStream(), FitsOptions.defaults())) {
            BinaryTableHdu table = file.createBinaryTableHdu();

            Exception exception = assertThrows(IllegalStateException.class, () -> table.hdu().asImage());
            assertEquals("HDU is BINARY_TABLE, not IMAGE", exception.getMessage());

            Hdu primary = file.hdus().get(0);
            exception = assertThrows(IllegalStateException.class, primary::asBinaryTable);
            assertEquals("HDU is RAW, not BINARY_TABLE", exception.getMessage());
        }
    }
}
