///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link FitsDataType}. */
public class FitsDataTypeTest {

    private static final BinaryConverter CONVERTER = BinaryConverter.forEndianness(Endianness.BIG_ENDIAN);

    @ParameterizedTest
    @CsvSource({
        "L,    L,   LOGICAL,        1, 1",
        "1J,   J,   INT,            1, 4",
        "20A,  20A, CHARACTER,      20, 20",
        "2E,   2E,  FLOAT,          2, 8",
        "3D,   3D,  DOUBLE,         3, 24",
        "1C,   C,   SINGLE_COMPLEX, 1, 8",
        "2M,   2M,  DOUBLE_COMPLEX, 2, 32",
        "4I,   4I,  SHORT,          4, 8",
        "K,    K,   LONG,           1, 8",
        "10B,  10B, BYTE,           10, 10",
        "9X,   9X,  BIT,            9, 2",
        "8X,   8X,  BIT,            8, 1",
        "0A,   0A,  CHARACTER,      0, 0",
    })
    void testFromTForm(String tform, String normalized, FitsTypeCode typeCode, int repeat, int byteWidth)
        throws FitsException {
        FitsDataType dataType = FitsDataType.fromTForm(tform);
        assertEquals(typeCode, dataType.typeCode());
        assertEquals(repeat, dataType.repeat());
        assertEquals(byteWidth, dataType.byteWidth());
        assertEquals(normalized, dataType.tform());
        assertEquals(normalized, dataType.toString());
        assertNull(dataType.nullValue());
    }

    @Test
    void testFromTFormWithExtraCharacters() throws FitsException {
        // Some writers append a width for display, which is ignored.
        FitsDataType dataType = FitsDataType.fromTForm("  12A:SSTR8");
        assertEquals(FitsTypeCode.CHARACTER, dataType.typeCode());
        assertEquals(12, dataType.repeat());
    }

    @Test
    void testMalformedTForm() {
        Exception exception = assertThrows(FitsFormatException.class, () -> FitsDataType.fromTForm("1Z"));
        assertEquals("'Z' is not a FITS column type", exception.getMessage());

        exception = assertThrows(FitsFormatException.class, () -> FitsDataType.fromTForm("12"));
        assertEquals("Malformed TFORM value: 12", exception.getMessage());

        exception = assertThrows(FitsFormatException.class, () -> FitsDataType.fromTForm("99999999999J"));
        assertEquals("Repeat count of TFORM value 99999999999J is too large", exception.getMessage());

        exception = assertThrows(UnsupportedFitsFeatureException.class, () -> FitsDataType.fromTForm("1PE(100)"));
        assertEquals("variable-length array columns are not supported", exception.getMessage());

        assertThrows(UnsupportedFitsFeatureException.class, () -> FitsDataType.fromTForm("1QJ"));
    }

    @Test
    void testBuilder() {
        FitsDataType dataType = FitsDataType.builder()
            .typeCode(FitsTypeCode.SHORT)
            .nullValue(-1L)
            .scale(2.0)
            .zero(32768.0)
            .build();
        assertEquals(FitsTypeCode.SHORT, dataType.typeCode());
        assertEquals(1, dataType.repeat());
        assertEquals(-1L, dataType.nullValue());
        assertEquals(2.0, dataType.scale());
        assertEquals(32768.0, dataType.zero());

        Exception exception = assertThrows(IllegalStateException.class, () -> FitsDataType.builder().build());
        assertEquals("typeCode must be set", exception.getMessage());

        exception = assertThrows(
            IllegalStateException.class,
            () -> FitsDataType.builder().typeCode(FitsTypeCode.FLOAT).nullValue(0L).build());
        assertEquals("only integer columns can have a null value", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> FitsDataType.builder().repeat(-1));
        assertEquals("repeat must not be negative", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> FitsDataType.builder().typeCode(null));
        assertEquals("typeCode must not be null", exception.getMessage());
    }

    @Test
    void testScaling() {
        FitsDataType unscaled = FitsDataType.of(FitsTypeCode.INT, 1);
        assertEquals(7.0, unscaled.toPhysical(7));
        assertEquals(7.0, unscaled.toStored(7));

        // The usual way to store unsigned 16-bit integers.
        FitsDataType unsigned = FitsDataType.builder().typeCode(FitsTypeCode.SHORT).zero(32768.0).build();
        assertEquals(65535.0, unsigned.toPhysical(Short.MAX_VALUE));
        assertEquals(0.0, unsigned.toPhysical(Short.MIN_VALUE));
        assertEquals(Short.MIN_VALUE, unsigned.toStored(0));

        FitsDataType scaled = FitsDataType.builder().typeCode(FitsTypeCode.INT).scale(0.5).zero(10.0).build();
        assertEquals(15.0, scaled.toPhysical(10));
        assertEquals(10.0, scaled.toStored(15));
    }

    @Test
    void testNullValues() {
        FitsDataType withNull = FitsDataType.builder().typeCode(FitsTypeCode.INT).nullValue(-999L).build();
        byte[] cell = new byte[4];

        assertEquals(4, withNull.encode(CONVERTER, null, cell, 0));
        assertEquals(-999, CONVERTER.getInt(cell, 0));
        assertNull(withNull.decode(CONVERTER, cell, 0));

        withNull.encode(CONVERTER, 5, cell, 0);
        assertEquals(5, withNull.decode(CONVERTER, cell, 0));

        // TNULL for bytes is an unsigned value.
        FitsDataType byteWithNull = FitsDataType.builder().typeCode(FitsTypeCode.BYTE).nullValue(255L).build();
        byteWithNull.encode(CONVERTER, null, cell, 0);
        assertEquals((byte) 0xFF, cell[0]);
        assertNull(byteWithNull.decode(CONVERTER, cell, 0));

        // Floating point columns use NaN.
        FitsDataType doubleType = FitsDataType.of(FitsTypeCode.DOUBLE, 1);
        byte[] doubleCell = new byte[8];
        doubleType.encode(CONVERTER, null, doubleCell, 0);
        assertTrue(Double.isNaN((Double) doubleType.decode(CONVERTER, doubleCell, 0)));

        FitsDataType withoutNull = FitsDataType.of(FitsTypeCode.INT, 1);
        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> withoutNull.encode(CONVERTER, null, cell, 0));
        assertEquals("a J column without a null value cannot hold null", exception.getMessage());
    }

    @Test
    void testScalarsAcceptAnyNumber() {
        FitsDataType shortType = FitsDataType.of(FitsTypeCode.SHORT, 1);
        byte[] cell = new byte[2];
        shortType.encode(CONVERTER, 300L, cell, 0);
        assertEquals((short) 300, shortType.decode(CONVERTER, cell, 0));

        FitsDataType floatType = FitsDataType.of(FitsTypeCode.FLOAT, 1);
        byte[] floatCell = new byte[4];
        floatType.encode(CONVERTER, 0.5, floatCell, 0);
        assertEquals(0.5f, floatType.decode(CONVERTER, floatCell, 0));

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> shortType.encode(CONVERTER, "300", cell, 0));
        assertEquals("a I column cannot hold a value of type String", exception.getMessage());
    }

    @Test
    void testArrays() {
        FitsDataType intArray = FitsDataType.of(FitsTypeCode.INT, 3);
        byte[] cell = new byte[12];
        assertEquals(12, intArray.encode(CONVERTER, new int[] { 1, -2, 3 }, cell, 0));
        assertArrayEquals(new int[] { 1, -2, 3 }, (int[]) intArray.decode(CONVERTER, cell, 0));

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> intArray.encode(CONVERTER, new int[2], cell, 0));
        assertEquals("a 3J column holds 3 elements, not 2", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> intArray.encode(CONVERTER, new long[3], cell, 0));
        assertEquals("a 3J column cannot hold a value of type long[]", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> intArray.encode(CONVERTER, null, cell, 0));
        assertEquals("an array value must not be null", exception.getMessage());
    }

    @Test
    void testBits() {
        FitsDataType bits = FitsDataType.of(FitsTypeCode.BIT, 12);
        byte[] cell = new byte[2];
        bits.encode(CONVERTER, new byte[] { (byte) 0xA5, (byte) 0xF0 }, cell, 0);
        assertArrayEquals(new byte[] { (byte) 0xA5, (byte) 0xF0 }, (byte[]) bits.decode(CONVERTER, cell, 0));

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> bits.encode(CONVERTER, new byte[12], cell, 0));
        assertEquals("a column of 12 bits takes 2 bytes, not 12", exception.getMessage());
    }

    @Test
    void testCharacters() {
        FitsDataType text = FitsDataType.of(FitsTypeCode.CHARACTER, 5);
        byte[] cell = new byte[5];
        text.encode(CONVERTER, "abc", cell, 0);
        assertArrayEquals(new byte[] { 'a', 'b', 'c', ' ', ' ' }, cell);
        assertEquals("abc  ", text.decode(CONVERTER, cell, 0));

        // A single character is still a string.
        FitsDataType oneCharacter = FitsDataType.of(FitsTypeCode.CHARACTER, 1);
        oneCharacter.encode(CONVERTER, "z", cell, 0);
        assertEquals("z", oneCharacter.decode(CONVERTER, cell, 0));

        assertThrows(IllegalArgumentException.class, () -> text.encode(CONVERTER, "too long", cell, 0));
    }

    @Test
    void testEquals() {
        FitsDataType type1 = FitsDataType.builder().typeCode(FitsTypeCode.LONG).repeat(2).zero(1.0).build();
        FitsDataType type2 = FitsDataType.builder().typeCode(FitsTypeCode.LONG).repeat(2).zero(1.0).build();
        FitsDataType type3 = FitsDataType.of(FitsTypeCode.LONG, 2);

        assertEquals(type1, type2);
        assertEquals(type1.hashCode(), type2.hashCode());
        assertNotEquals(type1, type3);
        assertNotEquals(type3, FitsDataType.of(FitsTypeCode.LONG, 3));
    }
}
