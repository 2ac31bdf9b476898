///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/** Unit tests for {@link MathUtil}. */
public class MathUtilTest {
    @Test
    void testDivideAndRoundUp() {
        // bits to bytes
        assertEquals(0, MathUtil.divideAndRoundUp(0, 8));
        assertEquals(1, MathUtil.divideAndRoundUp(1, 8));
        assertEquals(1, MathUtil.divideAndRoundUp(8, 8));
        assertEquals(2, MathUtil.divideAndRoundUp(9, 8));
        assertEquals(2, MathUtil.divideAndRoundUp(16, 8));
        assertEquals(3, MathUtil.divideAndRoundUp(17, 8));

        // divide by 2880
        assertEquals(1, MathUtil.divideAndRoundUp(2879, 2880));
        assertEquals(1, MathUtil.divideAndRoundUp(2880, 2880));
        assertEquals(2, MathUtil.divideAndRoundUp(2881, 2880));
    }

    @Test
    void testBytesToAlignment() {
        assertEquals(0, MathUtil.bytesToAlignment(0, FitsFile.BLOCK_SIZE));
        assertEquals(2879, MathUtil.bytesToAlignment(1, FitsFile.BLOCK_SIZE));
        assertEquals(2880 - 80, MathUtil.bytesToAlignment(80, FitsFile.BLOCK_SIZE));
        assertEquals(1, MathUtil.bytesToAlignment(2879, FitsFile.BLOCK_SIZE));
        assertEquals(0, MathUtil.bytesToAlignment(2880, FitsFile.BLOCK_SIZE));
        assertEquals(2880 - 15, MathUtil.bytesToAlignment(3 * 2880L + 15, FitsFile.BLOCK_SIZE));

        // Positions beyond the range of an int.
        assertEquals(0, MathUtil.bytesToAlignment(2880L * Integer.MAX_VALUE, FitsFile.BLOCK_SIZE));
        assertEquals(2879, MathUtil.bytesToAlignment(2880L * Integer.MAX_VALUE + 1, FitsFile.BLOCK_SIZE));
    }
}
