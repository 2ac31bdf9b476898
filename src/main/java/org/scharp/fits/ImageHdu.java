///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;

/**
 * A view of an HDU as an image: either a primary HDU with axes or an {@code IMAGE} extension.  Each stride is one row
 * of pixels along the first axis, decoded into an array whose type depends on {@code BITPIX}:
 *
 * <table>
 *   <caption>Stride types</caption>
 *   <tr><th>BITPIX</th><th>Java type</th></tr>
 *   <tr><td>8</td><td>{@code byte[]} (unsigned)</td></tr>
 *   <tr><td>16</td><td>{@code short[]}</td></tr>
 *   <tr><td>32</td><td>{@code int[]}</td></tr>
 *   <tr><td>64</td><td>{@code long[]}</td></tr>
 *   <tr><td>-32</td><td>{@code float[]}</td></tr>
 *   <tr><td>-64</td><td>{@code double[]}</td></tr>
 * </table>
 */
public final class ImageHdu {

    private final Hdu hdu;

    ImageHdu(Hdu hdu) {
        this.hdu = hdu;
    }

    /**
     * @return The HDU that this is a view of.
     */
    public Hdu hdu() {
        return hdu;
    }

    /**
     * @return The number of pixels in a stride ({@code NAXIS1}).
     *
     * @throws FitsException
     *     if the header doesn't describe the image, or if a stride would be too large for an array.
     */
    public int width() throws FitsException {
        // strideLength() checks that a row of pixels fits in an array.
        return hdu.strideLength() / (Math.abs(hdu.bitsPerPixel()) / Byte.SIZE);
    }

    /**
     * @return {@code true} if the image has rows that haven't been read yet.
     */
    public boolean hasMoreStrides() {
        return hdu.hasMoreStrides();
    }

    /**
     * Reads the next row of pixels.
     *
     * @return A new array of pixels.  Its type depends on {@code BITPIX}.
     *
     * @throws HduStateException
     *     if all rows have been read.
     * @throws IOException
     *     if the row can't be read.
     */
    public Object readNextStride() throws IOException {
        byte[] stride = hdu.readStride();
        BinaryConverter converter = hdu.file().converter();
        int width = width();
        switch (hdu.bitsPerPixel()) {
        case 8:
            return converter.getByteArray(stride, 0, width);
        case 16:
            return converter.getShortArray(stride, 0, width);
        case 32:
            return converter.getIntArray(stride, 0, width);
        case 64:
            return converter.getLongArray(stride, 0, width);
        case -32:
            return converter.getFloatArray(stride, 0, width);
        case -64:
            return converter.getDoubleArray(stride, 0, width);
        default:
            throw new AssertionError("bitsPerPixel() returned an unsupported value");
        }
    }

    /**
     * Writes the next row of pixels.  If the header hasn't been written yet, it's written first.
     *
     * @param pixels
     *     An array of {@code NAXIS1} pixels whose type matches {@code BITPIX}.
     *
     * @throws IllegalArgumentException
     *     if {@code pixels} has the wrong type or length.
     * @throws HduStateException
     *     if all rows have been written.
     * @throws IOException
     *     if the row can't be written.
     */
    public void writeNextStride(Object pixels) throws IOException {
        ArgumentUtil.checkNotNull(pixels, "pixels");
        int bitsPerPixel = hdu.bitsPerPixel();
        int width = width();
        checkPixels(pixels, bitsPerPixel, width);
        if (hdu.state() == HduState.START) {
            hdu.writeHeader();
        }

        byte[] stride = hdu.strideBuffer();
        BinaryConverter converter = hdu.file().converter();
        switch (bitsPerPixel) {
        case 8:
            converter.putByteArray((byte[]) pixels, stride, 0, width);
            break;
        case 16:
            converter.putShortArray((short[]) pixels, stride, 0, width);
            break;
        case 32:
            converter.putIntArray((int[]) pixels, stride, 0, width);
            break;
        case 64:
            converter.putLongArray((long[]) pixels, stride, 0, width);
            break;
        case -32:
            converter.putFloatArray((float[]) pixels, stride, 0, width);
            break;
        default:
            converter.putDoubleArray((double[]) pixels, stride, 0, width);
            break;
        }
        hdu.writeStride();
    }

    private static void checkPixels(Object pixels, int bitsPerPixel, int width) {
        final String expectedType;
        final int length;
        switch (bitsPerPixel) {
        case 8:
            expectedType = "byte[]";
            length = pixels instanceof byte[] bytes ? bytes.length : -1;
            break;
        case 16:
            expectedType = "short[]";
            length = pixels instanceof short[] shorts ? shorts.length : -1;
            break;
        case 32:
            expectedType = "int[]";
            length = pixels instanceof int[] ints ? ints.length : -1;
            break;
        case 64:
            expectedType = "long[]";
            length = pixels instanceof long[] longs ? longs.length : -1;
            break;
        case -32:
            expectedType = "float[]";
            length = pixels instanceof float[] floats ? floats.length : -1;
            break;
        default:
            expectedType = "double[]";
            length = pixels instanceof double[] doubles ? doubles.length : -1;
            break;
        }

        if (length == -1) {
            throw new IllegalArgumentException("an image with BITPIX = " + bitsPerPixel + " needs pixels of type " +
                expectedType + ", not " + pixels.getClass().getSimpleName());
        }
        if (length != width) {
            throw new IllegalArgumentException("a row of this image has " + width + " pixels, not " + length);
        }
    }
}
