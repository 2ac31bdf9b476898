package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");
        ArgumentUtil.checkNotNull(0, "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "myArg"));
        assertEquals("myArg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkAscii(String, int, String)} */
    @Test
    void testCheckAscii() {
        final String sigma = "σ"; // GREEK SMALL LETTER SIGMA

        // empty string fits into 0 characters.
        ArgumentUtil.checkAscii("", 0, "arg");

        // Every printable character is allowed, including the space and the tilde.
        ArgumentUtil.checkAscii(" hello, world~", 14, "arg");
        ArgumentUtil.checkAscii("'quoted' / not a comment", 80, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkAscii("hello", 4, "arg"));
        assertEquals("arg must not be longer than 4 characters", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkAscii(sigma, 1, "myArg"));
        assertEquals("myArg must only contain printable ASCII characters", exception.getMessage());

        // Control characters aren't printable.
        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkAscii("line\n", 80, "the argument"));
        assertEquals("the argument must only contain printable ASCII characters", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkAscii("\u007F", 80, "arg"));
        assertEquals("arg must only contain printable ASCII characters", exception.getMessage());

        // The length is checked first.
        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkAscii(sigma + sigma, 1, "arg"));
        assertEquals("arg must not be longer than 1 characters", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNotNegative(long, String)} */
    @Test
    void testCheckNotNegative() {
        ArgumentUtil.checkNotNegative(0, "arg");
        ArgumentUtil.checkNotNegative(Long.MAX_VALUE, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(-1, "length"));
        assertEquals("length must not be negative", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(Long.MIN_VALUE, "spillLimit"));
        assertEquals("spillLimit must not be negative", exception.getMessage());
    }
}
