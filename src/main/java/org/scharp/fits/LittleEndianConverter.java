///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/** A {@link BinaryConverter} that stores the least significant byte of each field first. */
final class LittleEndianConverter extends BinaryConverter {

    static final LittleEndianConverter INSTANCE = new LittleEndianConverter();

    // private constructor to enforce the singleton.
    private LittleEndianConverter() {
    }

    @Override
    public Endianness endianness() {
        return Endianness.LITTLE_ENDIAN;
    }

    @Override
    void putBits(byte[] data, int offset, long bits, int width) {
        for (int i = 0; i < width; i++) {
            data[offset + i] = (byte) bits;
            bits >>= 8;
        }
    }

    @Override
    long getBits(byte[] data, int offset, int width) {
        long bits = 0;
        for (int i = width - 1; 0 <= i; i--) {
            bits = (bits << 8) | (data[offset + i] & 0xFF);
        }
        return bits;
    }
}
