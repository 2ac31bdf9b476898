///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Arrays;
import java.util.Objects;

/**
 * Converts between a window of bytes and primitive values under a fixed byte order.
 * <p>
 * Every method touches exactly {@code [offset, offset + width)} of the given array, where the width is the size of the
 * value (times {@code count} for the array forms).  Callers are responsible for allocating enough memory; accessing
 * bytes outside of the array is a programming error and is reported by an {@link IndexOutOfBoundsException} before
 * any byte is read or written.
 * </p>
 * <p>
 * The {@code put} methods return the number of bytes which were written.
 * </p>
 */
public abstract class BinaryConverter {

    static final int BOOLEAN_SIZE = 1;
    static final int BYTE_SIZE = 1;
    static final int SHORT_SIZE = 2;
    static final int INT_SIZE = 4;
    static final int LONG_SIZE = 8;
    static final int FLOAT_SIZE = 4;
    static final int DOUBLE_SIZE = 8;
    static final int SINGLE_COMPLEX_SIZE = 2 * FLOAT_SIZE;
    static final int DOUBLE_COMPLEX_SIZE = 2 * DOUBLE_SIZE;

    private static final byte TRUE = 'T';
    private static final byte FALSE = 'F';

    /**
     * Gets the converter for a byte order.
     *
     * @param endianness
     *     The byte order.
     *
     * @return A converter. This is never {@code null}.
     */
    public static BinaryConverter forEndianness(Endianness endianness) {
        ArgumentUtil.checkNotNull(endianness, "endianness");
        return endianness == Endianness.BIG_ENDIAN ? BigEndianConverter.INSTANCE : LittleEndianConverter.INSTANCE;
    }

    /**
     * @return The byte order of this converter.
     */
    public abstract Endianness endianness();

    /**
     * Writes the low {@code width} bytes of {@code bits} in this converter's byte order. The range was already
     * checked.
     */
    abstract void putBits(byte[] data, int offset, long bits, int width);

    /**
     * Reads {@code width} bytes in this converter's byte order into the low bytes of a long, without sign extension.
     * The range was already checked.
     */
    abstract long getBits(byte[] data, int offset, int width);

    private static void checkRange(byte[] data, int offset, int width) {
        Objects.checkFromIndexSize(offset, width, data.length);
    }

    private static int fieldWidth(int count, int elementSize) {
        ArgumentUtil.checkNotNegative(count, "count");
        return Math.multiplyExact(count, elementSize);
    }

    private static void checkSourceLength(int valuesLength, int count) {
        if (valuesLength < count) {
            throw new IllegalArgumentException("values has " + valuesLength + " elements but count is " + count);
        }
    }

    //
    // Boolean (logical)
    //

    /**
     * Reads a logical value.  Any byte other than {@code 0x00}, {@code 'F'} or {@code 'f'} is read as {@code true}.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset in the array to read from.
     *
     * @return The value.
     */
    public boolean getBoolean(byte[] data, int offset) {
        checkRange(data, offset, BOOLEAN_SIZE);
        byte b = data[offset];
        return b != 0 && b != 'F' && b != 'f';
    }

    public boolean[] getBooleanArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, BOOLEAN_SIZE));
        boolean[] values = new boolean[count];
        for (int i = 0; i < count; i++) {
            values[i] = getBoolean(data, offset + i);
        }
        return values;
    }

    /**
     * Writes a logical value as {@code 'T'} or {@code 'F'}.
     *
     * @param value
     *     The value to write.
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     *
     * @return The number of bytes written.
     */
    public int putBoolean(boolean value, byte[] data, int offset) {
        checkRange(data, offset, BOOLEAN_SIZE);
        data[offset] = value ? TRUE : FALSE;
        return BOOLEAN_SIZE;
    }

    public int putBooleanArray(boolean[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        checkRange(data, offset, fieldWidth(count, BOOLEAN_SIZE));
        for (int i = 0; i < count; i++) {
            data[offset + i] = values[i] ? TRUE : FALSE;
        }
        return count;
    }

    //
    // Byte
    //

    public byte getByte(byte[] data, int offset) {
        checkRange(data, offset, BYTE_SIZE);
        return data[offset];
    }

    public byte[] getByteArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, BYTE_SIZE));
        return Arrays.copyOfRange(data, offset, offset + count);
    }

    public int putByte(byte value, byte[] data, int offset) {
        checkRange(data, offset, BYTE_SIZE);
        data[offset] = value;
        return BYTE_SIZE;
    }

    public int putByteArray(byte[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        checkRange(data, offset, fieldWidth(count, BYTE_SIZE));
        System.arraycopy(values, 0, data, offset, count);
        return count;
    }

    //
    // Short (16-bit integer)
    //

    public short getShort(byte[] data, int offset) {
        checkRange(data, offset, SHORT_SIZE);
        return (short) getBits(data, offset, SHORT_SIZE);
    }

    public short[] getShortArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, SHORT_SIZE));
        short[] values = new short[count];
        for (int i = 0; i < count; i++) {
            values[i] = (short) getBits(data, offset + i * SHORT_SIZE, SHORT_SIZE);
        }
        return values;
    }

    public int putShort(short value, byte[] data, int offset) {
        checkRange(data, offset, SHORT_SIZE);
        putBits(data, offset, value, SHORT_SIZE);
        return SHORT_SIZE;
    }

    public int putShortArray(short[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        int width = fieldWidth(count, SHORT_SIZE);
        checkRange(data, offset, width);
        for (int i = 0; i < count; i++) {
            putBits(data, offset + i * SHORT_SIZE, values[i], SHORT_SIZE);
        }
        return width;
    }

    //
    // Int (32-bit integer)
    //

    public int getInt(byte[] data, int offset) {
        checkRange(data, offset, INT_SIZE);
        return (int) getBits(data, offset, INT_SIZE);
    }

    public int[] getIntArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, INT_SIZE));
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            values[i] = (int) getBits(data, offset + i * INT_SIZE, INT_SIZE);
        }
        return values;
    }

    public int putInt(int value, byte[] data, int offset) {
        checkRange(data, offset, INT_SIZE);
        putBits(data, offset, value, INT_SIZE);
        return INT_SIZE;
    }

    public int putIntArray(int[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        int width = fieldWidth(count, INT_SIZE);
        checkRange(data, offset, width);
        for (int i = 0; i < count; i++) {
            putBits(data, offset + i * INT_SIZE, values[i], INT_SIZE);
        }
        return width;
    }

    //
    // Long (64-bit integer)
    //

    public long getLong(byte[] data, int offset) {
        checkRange(data, offset, LONG_SIZE);
        return getBits(data, offset, LONG_SIZE);
    }

    public long[] getLongArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, LONG_SIZE));
        long[] values = new long[count];
        for (int i = 0; i < count; i++) {
            values[i] = getBits(data, offset + i * LONG_SIZE, LONG_SIZE);
        }
        return values;
    }

    public int putLong(long value, byte[] data, int offset) {
        checkRange(data, offset, LONG_SIZE);
        putBits(data, offset, value, LONG_SIZE);
        return LONG_SIZE;
    }

    public int putLongArray(long[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        int width = fieldWidth(count, LONG_SIZE);
        checkRange(data, offset, width);
        for (int i = 0; i < count; i++) {
            putBits(data, offset + i * LONG_SIZE, values[i], LONG_SIZE);
        }
        return width;
    }

    //
    // Float (IEEE 754 single precision)
    //

    public float getFloat(byte[] data, int offset) {
        checkRange(data, offset, FLOAT_SIZE);
        return Float.intBitsToFloat((int) getBits(data, offset, FLOAT_SIZE));
    }

    public float[] getFloatArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, FLOAT_SIZE));
        float[] values = new float[count];
        for (int i = 0; i < count; i++) {
            values[i] = Float.intBitsToFloat((int) getBits(data, offset + i * FLOAT_SIZE, FLOAT_SIZE));
        }
        return values;
    }

    public int putFloat(float value, byte[] data, int offset) {
        checkRange(data, offset, FLOAT_SIZE);
        // raw bits so that the payload of a NaN survives the round trip
        putBits(data, offset, Float.floatToRawIntBits(value), FLOAT_SIZE);
        return FLOAT_SIZE;
    }

    public int putFloatArray(float[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        int width = fieldWidth(count, FLOAT_SIZE);
        checkRange(data, offset, width);
        for (int i = 0; i < count; i++) {
            putBits(data, offset + i * FLOAT_SIZE, Float.floatToRawIntBits(values[i]), FLOAT_SIZE);
        }
        return width;
    }

    //
    // Double (IEEE 754 double precision)
    //

    public double getDouble(byte[] data, int offset) {
        checkRange(data, offset, DOUBLE_SIZE);
        return Double.longBitsToDouble(getBits(data, offset, DOUBLE_SIZE));
    }

    public double[] getDoubleArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, DOUBLE_SIZE));
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = Double.longBitsToDouble(getBits(data, offset + i * DOUBLE_SIZE, DOUBLE_SIZE));
        }
        return values;
    }

    public int putDouble(double value, byte[] data, int offset) {
        checkRange(data, offset, DOUBLE_SIZE);
        putBits(data, offset, Double.doubleToRawLongBits(value), DOUBLE_SIZE);
        return DOUBLE_SIZE;
    }

    public int putDoubleArray(double[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        int width = fieldWidth(count, DOUBLE_SIZE);
        checkRange(data, offset, width);
        for (int i = 0; i < count; i++) {
            putBits(data, offset + i * DOUBLE_SIZE, Double.doubleToRawLongBits(values[i]), DOUBLE_SIZE);
        }
        return width;
    }

    //
    // Characters and strings (one byte per ASCII character)
    //

    public char getChar(byte[] data, int offset) {
        checkRange(data, offset, BYTE_SIZE);
        return (char) (data[offset] & 0xFF);
    }

    public int putChar(char value, byte[] data, int offset) {
        checkRange(data, offset, BYTE_SIZE);
        if (0x7F < value) {
            throw new IllegalArgumentException("character values must be ASCII");
        }
        data[offset] = (byte) value;
        return BYTE_SIZE;
    }

    /**
     * Reads a character field.  The string ends at the first NUL character or at the end of the field, whichever comes
     * first.  Padding spaces are part of the returned value.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset of the field.
     * @param width
     *     The width of the field in bytes.
     *
     * @return The string. This is never {@code null}.
     */
    public String getString(byte[] data, int offset, int width) {
        checkRange(data, offset, width);
        StringBuilder builder = new StringBuilder(width);
        for (int i = offset; i < offset + width && data[i] != 0; i++) {
            builder.append((char) (data[i] & 0xFF));
        }
        return builder.toString();
    }

    /**
     * Writes a string into a fixed-width character field, padding it with spaces.
     *
     * @param value
     *     The string to write. This must be ASCII and must not be longer than {@code width}.
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset of the field.
     * @param width
     *     The width of the field in bytes.
     *
     * @return The number of bytes written, which is always {@code width}.
     *
     * @throws IllegalArgumentException
     *     if {@code value} is longer than the field or contains non-ASCII characters.
     */
    public int putString(String value, byte[] data, int offset, int width) {
        checkRange(data, offset, width);
        if (width < value.length()) {
            throw new IllegalArgumentException(
                "A string of " + value.length() + " characters does not fit in a field of " + width + " bytes");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (0x7F < c) {
                throw new IllegalArgumentException("character values must be ASCII");
            }
            data[offset + i] = (byte) c;
        }
        Arrays.fill(data, offset + value.length(), offset + width, (byte) ' ');
        return width;
    }

    //
    // Complex numbers (two adjacent floating point values, real part first)
    //

    public SingleComplex getSingleComplex(byte[] data, int offset) {
        checkRange(data, offset, SINGLE_COMPLEX_SIZE);
        return new SingleComplex(
            Float.intBitsToFloat((int) getBits(data, offset, FLOAT_SIZE)),
            Float.intBitsToFloat((int) getBits(data, offset + FLOAT_SIZE, FLOAT_SIZE)));
    }

    public SingleComplex[] getSingleComplexArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, SINGLE_COMPLEX_SIZE));
        SingleComplex[] values = new SingleComplex[count];
        for (int i = 0; i < count; i++) {
            values[i] = getSingleComplex(data, offset + i * SINGLE_COMPLEX_SIZE);
        }
        return values;
    }

    public int putSingleComplex(SingleComplex value, byte[] data, int offset) {
        checkRange(data, offset, SINGLE_COMPLEX_SIZE);
        putBits(data, offset, Float.floatToRawIntBits(value.real()), FLOAT_SIZE);
        putBits(data, offset + FLOAT_SIZE, Float.floatToRawIntBits(value.imaginary()), FLOAT_SIZE);
        return SINGLE_COMPLEX_SIZE;
    }

    public int putSingleComplexArray(SingleComplex[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        int width = fieldWidth(count, SINGLE_COMPLEX_SIZE);
        checkRange(data, offset, width);
        for (int i = 0; i < count; i++) {
            putSingleComplex(values[i], data, offset + i * SINGLE_COMPLEX_SIZE);
        }
        return width;
    }

    public DoubleComplex getDoubleComplex(byte[] data, int offset) {
        checkRange(data, offset, DOUBLE_COMPLEX_SIZE);
        return new DoubleComplex(
            Double.longBitsToDouble(getBits(data, offset, DOUBLE_SIZE)),
            Double.longBitsToDouble(getBits(data, offset + DOUBLE_SIZE, DOUBLE_SIZE)));
    }

    public DoubleComplex[] getDoubleComplexArray(byte[] data, int offset, int count) {
        checkRange(data, offset, fieldWidth(count, DOUBLE_COMPLEX_SIZE));
        DoubleComplex[] values = new DoubleComplex[count];
        for (int i = 0; i < count; i++) {
            values[i] = getDoubleComplex(data, offset + i * DOUBLE_COMPLEX_SIZE);
        }
        return values;
    }

    public int putDoubleComplex(DoubleComplex value, byte[] data, int offset) {
        checkRange(data, offset, DOUBLE_COMPLEX_SIZE);
        putBits(data, offset, Double.doubleToRawLongBits(value.real()), DOUBLE_SIZE);
        putBits(data, offset + DOUBLE_SIZE, Double.doubleToRawLongBits(value.imaginary()), DOUBLE_SIZE);
        return DOUBLE_COMPLEX_SIZE;
    }

    public int putDoubleComplexArray(DoubleComplex[] values, byte[] data, int offset, int count) {
        checkSourceLength(values.length, count);
        int width = fieldWidth(count, DOUBLE_COMPLEX_SIZE);
        checkRange(data, offset, width);
        for (int i = 0; i < count; i++) {
            putDoubleComplex(values[i], data, offset + i * DOUBLE_COMPLEX_SIZE);
        }
        return width;
    }
}
