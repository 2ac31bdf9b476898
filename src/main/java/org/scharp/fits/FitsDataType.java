///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The data type of a binary table column: an element type, the number of elements in each cell, and optionally the
 * column's null value and linear scaling.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link FitsDataType.Builder} or parsed from the
 * {@code TFORMn} value of a header.
 * </p>
 *
 * <pre>
 * FitsDataType type = FitsDataType.builder().
 *     typeCode(FitsTypeCode.INT).
 *     nullValue(-1).
 *     build();
 * </pre>
 *
 * <p>
 * A cell is decoded into a boxed scalar when the repeat count is 1 and into an array otherwise, except for
 * {@link FitsTypeCode#CHARACTER}, which is always a {@code String}, and {@link FitsTypeCode#BIT}, which is always a
 * {@code byte[]} of the packed bits.
 * </p>
 */
public final class FitsDataType {

    // The repeat count is optional. Anything after the type code (for example, the maximum length of a
    // variable-length array) is ignored.
    private static final Pattern TFORM_PATTERN = Pattern.compile("\\s*([0-9]*)([A-Z])(.*)");

    private final FitsTypeCode typeCode;
    private final int repeat;
    private final Long nullValue;
    private final Double scale;
    private final Double zero;

    /**
     * A builder class for {@link FitsDataType}.
     */
    public static final class Builder {
        private FitsTypeCode typeCode;
        private int repeat;
        private Long nullValue;
        private Double scale;
        private Double zero;

        private Builder() {
            this.typeCode = null; // required parameter
            this.repeat = 1;
            this.nullValue = null;
            this.scale = null;
            this.zero = null;
        }

        /**
         * Sets the element type.
         *
         * @param typeCode
         *     The element type.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code typeCode} is {@code null}.
         */
        public Builder typeCode(FitsTypeCode typeCode) {
            ArgumentUtil.checkNotNull(typeCode, "typeCode");
            this.typeCode = typeCode;
            return this;
        }

        /**
         * Sets the number of elements in each cell.  For character columns, this is the length of the string.
         *
         * @param repeat
         *     The number of elements.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code repeat} is negative.
         */
        public Builder repeat(int repeat) {
            ArgumentUtil.checkNotNegative(repeat, "repeat");
            this.repeat = repeat;
            return this;
        }

        /**
         * Sets the value ({@code TNULLn}) that marks a missing value in an integer column.
         *
         * @param nullValue
         *     The null value, or {@code null} if the column has none.
         *
         * @return This builder
         */
        public Builder nullValue(Long nullValue) {
            this.nullValue = nullValue;
            return this;
        }

        /**
         * Sets the scale ({@code TSCALn}) of the column's linear transformation.
         *
         * @param scale
         *     The scale, or {@code null} for the default of 1.
         *
         * @return This builder
         */
        public Builder scale(Double scale) {
            this.scale = scale;
            return this;
        }

        /**
         * Sets the offset ({@code TZEROn}) of the column's linear transformation.
         *
         * @param zero
         *     The offset, or {@code null} for the default of 0.
         *
         * @return This builder
         */
        public Builder zero(Double zero) {
            this.zero = zero;
            return this;
        }

        /**
         * @return A new data type with the settings of this builder.
         *
         * @throws IllegalStateException
         *     if the type code hasn't been set, or if a null value was given for a type that isn't an integer.
         */
        public FitsDataType build() {
            if (typeCode == null) {
                throw new IllegalStateException("typeCode must be set");
            }
            if (nullValue != null && !typeCode.isInteger()) {
                throw new IllegalStateException("only integer columns can have a null value");
            }
            return new FitsDataType(this);
        }
    }

    private FitsDataType(Builder builder) {
        this.typeCode = builder.typeCode;
        this.repeat = builder.repeat;
        this.nullValue = builder.nullValue;
        this.scale = builder.scale;
        this.zero = builder.zero;
    }

    /**
     * @return A new builder for a {@code FitsDataType}.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a data type without a null value or scaling.
     *
     * @param typeCode
     *     The element type.
     * @param repeat
     *     The number of elements in each cell.
     *
     * @return A new data type.
     */
    public static FitsDataType of(FitsTypeCode typeCode, int repeat) {
        return builder().typeCode(typeCode).repeat(repeat).build();
    }

    /**
     * Parses the value of a {@code TFORMn} card, such as {@code 1J} or {@code 20A}.
     *
     * @param tform
     *     The value.
     *
     * @return A data type for the column.
     *
     * @throws UnsupportedFitsFeatureException
     *     if the column is a variable-length array.
     * @throws FitsFormatException
     *     if {@code tform} is malformed.
     */
    public static FitsDataType fromTForm(String tform) throws FitsException {
        ArgumentUtil.checkNotNull(tform, "tform");
        Matcher matcher = TFORM_PATTERN.matcher(tform);
        if (!matcher.matches()) {
            throw new FitsFormatException("Malformed TFORM value: " + tform);
        }

        final int repeat;
        try {
            repeat = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException exception) {
            throw new FitsFormatException("Repeat count of TFORM value " + tform + " is too large", exception);
        }
        FitsTypeCode typeCode = FitsTypeCode.fromCode(matcher.group(2).charAt(0));
        return of(typeCode, repeat);
    }

    /**
     * @return This type in the form of a {@code TFORMn} value. The repeat count is omitted when it's 1.
     */
    public String tform() {
        return repeat == 1 ? String.valueOf(typeCode.code()) : repeat + String.valueOf(typeCode.code());
    }

    public FitsTypeCode typeCode() {
        return typeCode;
    }

    public int repeat() {
        return repeat;
    }

    /**
     * @return The null value ({@code TNULLn}), or {@code null} if the column has none.
     */
    public Long nullValue() {
        return nullValue;
    }

    /**
     * @return The scale ({@code TSCALn}), or {@code null} if it's not set.
     */
    public Double scale() {
        return scale;
    }

    /**
     * @return The offset ({@code TZEROn}), or {@code null} if it's not set.
     */
    public Double zero() {
        return zero;
    }

    /**
     * @return The number of bytes a cell of this type occupies in a row.
     */
    public int byteWidth() {
        if (typeCode == FitsTypeCode.BIT) {
            return MathUtil.divideAndRoundUp(repeat, Byte.SIZE);
        }
        return Math.multiplyExact(typeCode.elementSize(), repeat);
    }

    private boolean isScalar() {
        return repeat == 1 && typeCode != FitsTypeCode.CHARACTER && typeCode != FitsTypeCode.BIT;
    }

    /**
     * Applies the column's linear transformation to a stored value.
     *
     * @param storedValue
     *     The value as it's stored in the table.
     *
     * @return {@code TZEROn + TSCALn * storedValue}
     */
    public double toPhysical(double storedValue) {
        double actualScale = scale == null ? 1.0 : scale;
        double actualZero = zero == null ? 0.0 : zero;
        return actualZero + actualScale * storedValue;
    }

    /**
     * Inverts the column's linear transformation.
     *
     * @param physicalValue
     *     The value as it's meant to be interpreted.
     *
     * @return {@code (physicalValue - TZEROn) / TSCALn}
     */
    public double toStored(double physicalValue) {
        double actualScale = scale == null ? 1.0 : scale;
        double actualZero = zero == null ? 0.0 : zero;
        return (physicalValue - actualZero) / actualScale;
    }

    /**
     * Decodes a cell.
     *
     * @param converter
     *     The converter for the file's byte order.
     * @param data
     *     The row.
     * @param offset
     *     The offset of the cell in the row.
     *
     * @return The value of the cell. This is {@code null} for an integer scalar that holds the column's null value.
     */
    Object decode(BinaryConverter converter, byte[] data, int offset) {
        if (isScalar()) {
            switch (typeCode) {
            case LOGICAL:
                return converter.getBoolean(data, offset);
            case BYTE:
                // FITS bytes are unsigned, and so is TNULLn for them.
                byte byteValue = converter.getByte(data, offset);
                return isNull(byteValue & 0xFF) ? null : byteValue;
            case SHORT:
                short shortValue = converter.getShort(data, offset);
                return isNull(shortValue) ? null : shortValue;
            case INT:
                int intValue = converter.getInt(data, offset);
                return isNull(intValue) ? null : intValue;
            case LONG:
                long longValue = converter.getLong(data, offset);
                return isNull(longValue) ? null : longValue;
            case FLOAT:
                return converter.getFloat(data, offset);
            case DOUBLE:
                return converter.getDouble(data, offset);
            case SINGLE_COMPLEX:
                return converter.getSingleComplex(data, offset);
            case DOUBLE_COMPLEX:
                return converter.getDoubleComplex(data, offset);
            default:
                throw new AssertionError("not a scalar type: " + typeCode);
            }
        }

        switch (typeCode) {
        case LOGICAL:
            return converter.getBooleanArray(data, offset, repeat);
        case BIT:
            return converter.getByteArray(data, offset, byteWidth());
        case BYTE:
            return converter.getByteArray(data, offset, repeat);
        case SHORT:
            return converter.getShortArray(data, offset, repeat);
        case INT:
            return converter.getIntArray(data, offset, repeat);
        case LONG:
            return converter.getLongArray(data, offset, repeat);
        case CHARACTER:
            return converter.getString(data, offset, repeat);
        case FLOAT:
            return converter.getFloatArray(data, offset, repeat);
        case DOUBLE:
            return converter.getDoubleArray(data, offset, repeat);
        case SINGLE_COMPLEX:
            return converter.getSingleComplexArray(data, offset, repeat);
        default:
            return converter.getDoubleComplexArray(data, offset, repeat);
        }
    }

    private boolean isNull(long storedValue) {
        return nullValue != null && nullValue == storedValue;
    }

    /**
     * Encodes a cell.
     *
     * @param converter
     *     The converter for the file's byte order.
     * @param value
     *     The value of the cell.  Integer and floating point scalars may be given as any {@code Number}.  A
     *     {@code null} integer is written as the column's null value and a {@code null} floating point number as NaN.
     * @param data
     *     The row.
     * @param offset
     *     The offset of the cell in the row.
     *
     * @return The number of bytes written, which is always {@link #byteWidth()}.
     *
     * @throws IllegalArgumentException
     *     if {@code value} doesn't have a type that matches this column, if it's {@code null} and this column has no
     *     way to represent a missing value, or if it's an array of the wrong length.
     */
    int encode(BinaryConverter converter, Object value, byte[] data, int offset) {
        if (isScalar()) {
            if (value == null) {
                return encodeNull(converter, data, offset);
            }
            switch (typeCode) {
            case LOGICAL:
                return converter.putBoolean(cast(value, Boolean.class), data, offset);
            case BYTE:
                return converter.putByte(cast(value, Number.class).byteValue(), data, offset);
            case SHORT:
                return converter.putShort(cast(value, Number.class).shortValue(), data, offset);
            case INT:
                return converter.putInt(cast(value, Number.class).intValue(), data, offset);
            case LONG:
                return converter.putLong(cast(value, Number.class).longValue(), data, offset);
            case FLOAT:
                return converter.putFloat(cast(value, Number.class).floatValue(), data, offset);
            case DOUBLE:
                return converter.putDouble(cast(value, Number.class).doubleValue(), data, offset);
            case SINGLE_COMPLEX:
                return converter.putSingleComplex(cast(value, SingleComplex.class), data, offset);
            case DOUBLE_COMPLEX:
                return converter.putDoubleComplex(cast(value, DoubleComplex.class), data, offset);
            default:
                throw new AssertionError("not a scalar type: " + typeCode);
            }
        }

        ArgumentUtil.checkNotNull(value, "an array value");
        switch (typeCode) {
        case LOGICAL:
            boolean[] booleans = cast(value, boolean[].class);
            checkArrayLength(booleans.length);
            return converter.putBooleanArray(booleans, data, offset, repeat);
        case BIT:
            byte[] bits = cast(value, byte[].class);
            if (bits.length != byteWidth()) {
                throw new IllegalArgumentException(
                    "a column of " + repeat + " bits takes " + byteWidth() + " bytes, not " + bits.length);
            }
            return converter.putByteArray(bits, data, offset, byteWidth());
        case BYTE:
            byte[] bytes = cast(value, byte[].class);
            checkArrayLength(bytes.length);
            return converter.putByteArray(bytes, data, offset, repeat);
        case SHORT:
            short[] shorts = cast(value, short[].class);
            checkArrayLength(shorts.length);
            return converter.putShortArray(shorts, data, offset, repeat);
        case INT:
            int[] ints = cast(value, int[].class);
            checkArrayLength(ints.length);
            return converter.putIntArray(ints, data, offset, repeat);
        case LONG:
            long[] longs = cast(value, long[].class);
            checkArrayLength(longs.length);
            return converter.putLongArray(longs, data, offset, repeat);
        case CHARACTER:
            // Shorter strings are padded with spaces.
            return converter.putString(cast(value, String.class), data, offset, repeat);
        case FLOAT:
            float[] floats = cast(value, float[].class);
            checkArrayLength(floats.length);
            return converter.putFloatArray(floats, data, offset, repeat);
        case DOUBLE:
            double[] doubles = cast(value, double[].class);
            checkArrayLength(doubles.length);
            return converter.putDoubleArray(doubles, data, offset, repeat);
        case SINGLE_COMPLEX:
            SingleComplex[] singleComplexes = cast(value, SingleComplex[].class);
            checkArrayLength(singleComplexes.length);
            return converter.putSingleComplexArray(singleComplexes, data, offset, repeat);
        default:
            DoubleComplex[] doubleComplexes = cast(value, DoubleComplex[].class);
            checkArrayLength(doubleComplexes.length);
            return converter.putDoubleComplexArray(doubleComplexes, data, offset, repeat);
        }
    }

    private void checkArrayLength(int length) {
        if (length != repeat) {
            throw new IllegalArgumentException(
                "a " + tform() + " column holds " + repeat + " elements, not " + length);
        }
    }

    private int encodeNull(BinaryConverter converter, byte[] data, int offset) {
        if (typeCode.isInteger() && nullValue != null) {
            long value = nullValue;
            switch (typeCode) {
            case BYTE:
                return converter.putByte((byte) value, data, offset);
            case SHORT:
                return converter.putShort((short) value, data, offset);
            case INT:
                return converter.putInt((int) value, data, offset);
            default:
                return converter.putLong(value, data, offset);
            }
        }
        if (typeCode == FitsTypeCode.FLOAT) {
            return converter.putFloat(Float.NaN, data, offset);
        }
        if (typeCode == FitsTypeCode.DOUBLE) {
            return converter.putDouble(Double.NaN, data, offset);
        }
        if (typeCode == FitsTypeCode.SINGLE_COMPLEX) {
            return converter.putSingleComplex(SingleComplex.NaN, data, offset);
        }
        if (typeCode == FitsTypeCode.DOUBLE_COMPLEX) {
            return converter.putDoubleComplex(DoubleComplex.NaN, data, offset);
        }
        throw new IllegalArgumentException("a " + tform() + " column without a null value cannot hold null");
    }

    private <T> T cast(Object value, Class<T> expectedType) {
        if (!expectedType.isInstance(value)) {
            throw new IllegalArgumentException("a " + tform() + " column cannot hold a value of type " +
                value.getClass().getSimpleName());
        }
        return expectedType.cast(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FitsDataType otherType)) {
            return false;
        }
        return typeCode == otherType.typeCode &&
            repeat == otherType.repeat &&
            Objects.equals(nullValue, otherType.nullValue) &&
            Objects.equals(scale, otherType.scale) &&
            Objects.equals(zero, otherType.zero);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeCode, repeat, nullValue, scale, zero);
    }

    @Override
    public String toString() {
        return tform();
    }
}
