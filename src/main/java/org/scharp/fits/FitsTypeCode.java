///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * The element types of binary table columns, identified in {@code TFORMn} by a single letter.
 */
public enum FitsTypeCode {
    /** {@code L}: a logical, written as {@code 'T'} or {@code 'F'}. */
    LOGICAL('L', BinaryConverter.BOOLEAN_SIZE),

    /** {@code X}: a bit. Bits are packed eight to a byte. */
    BIT('X', 1),

    /** {@code B}: an unsigned byte. */
    BYTE('B', BinaryConverter.BYTE_SIZE),

    /** {@code I}: a 16-bit integer. */
    SHORT('I', BinaryConverter.SHORT_SIZE),

    /** {@code J}: a 32-bit integer. */
    INT('J', BinaryConverter.INT_SIZE),

    /** {@code K}: a 64-bit integer. */
    LONG('K', BinaryConverter.LONG_SIZE),

    /** {@code A}: an ASCII character. */
    CHARACTER('A', 1),

    /** {@code E}: a single precision floating point number. */
    FLOAT('E', BinaryConverter.FLOAT_SIZE),

    /** {@code D}: a double precision floating point number. */
    DOUBLE('D', BinaryConverter.DOUBLE_SIZE),

    /** {@code C}: a pair of single precision floating point numbers. */
    SINGLE_COMPLEX('C', BinaryConverter.SINGLE_COMPLEX_SIZE),

    /** {@code M}: a pair of double precision floating point numbers. */
    DOUBLE_COMPLEX('M', BinaryConverter.DOUBLE_COMPLEX_SIZE);

    private final char code;
    private final int elementSize;

    FitsTypeCode(char code, int elementSize) {
        this.code = code;
        this.elementSize = elementSize;
    }

    /**
     * @return The letter that identifies this type in {@code TFORMn}.
     */
    public char code() {
        return code;
    }

    /**
     * @return The number of bytes an element of this type occupies. For {@link #BIT}, this is the size of a byte,
     *     which holds eight elements.
     */
    public int elementSize() {
        return elementSize;
    }

    /**
     * @return {@code true} for the integer types, which may have a {@code TNULLn} value.
     */
    public boolean isInteger() {
        return this == BYTE || this == SHORT || this == INT || this == LONG;
    }

    /**
     * Gets the type identified by a {@code TFORMn} letter.
     *
     * @param code
     *     The letter.
     *
     * @return The type.
     *
     * @throws UnsupportedFitsFeatureException
     *     if {@code code} identifies an array descriptor ({@code P} or {@code Q}).
     * @throws FitsFormatException
     *     if {@code code} isn't a FITS type.
     */
    public static FitsTypeCode fromCode(char code) throws FitsException {
        for (FitsTypeCode typeCode : values()) {
            if (typeCode.code == code) {
                return typeCode;
            }
        }
        if (code == 'P' || code == 'Q') {
            throw new UnsupportedFitsFeatureException("variable-length array columns are not supported");
        }
        throw new FitsFormatException("'" + code + "' is not a FITS column type");
    }
}
