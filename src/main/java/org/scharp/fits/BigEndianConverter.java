///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/** A {@link BinaryConverter} that stores the most significant byte of each field first. */
final class BigEndianConverter extends BinaryConverter {

    static final BigEndianConverter INSTANCE = new BigEndianConverter();

    // private constructor to enforce the singleton.
    private BigEndianConverter() {
    }

    @Override
    public Endianness endianness() {
        return Endianness.BIG_ENDIAN;
    }

    @Override
    void putBits(byte[] data, int offset, long bits, int width) {
        for (int i = width - 1; 0 <= i; i--) {
            data[offset + i] = (byte) bits;
            bits >>= 8;
        }
    }

    @Override
    long getBits(byte[] data, int offset, int width) {
        long bits = 0;
        for (int i = 0; i < width; i++) {
            bits = (bits << 8) | (data[offset + i] & 0xFF);
        }
        return bits;
    }
}
