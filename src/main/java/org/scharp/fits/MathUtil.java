package org.scharp.fits;

/**
 * A class for holding utility methods.
 */
abstract class MathUtil {

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes dividend / divisor, but instead of truncating any remainder, it always rounds up.
     *
     * @param dividend
     *     the dividend
     * @param divisor
     *     the divisor
     *
     * @return The result of the calculation.
     */
    // This can be replaced by Math.cielDiv() in Java 18
    static int divideAndRoundUp(int dividend, int divisor) {
        assert 0 < divisor : "divideAndRoundUp doesn't handle non-positive divisors";
        assert 0 <= dividend : "divideAndRoundUp doesn't handle negative numbers";

        return (dividend + divisor - 1) / divisor;
    }

    /**
     * Computes the number of bytes between {@code position} and the next multiple of {@code alignmentSize}.
     *
     * @param position
     *     A position in a stream.
     * @param alignmentSize
     *     The desired alignment.
     *
     * @return The number of bytes to add to {@code position} to make it aligned. This is {@code 0} when
     *     {@code position} is already aligned.
     */
    static int bytesToAlignment(long position, int alignmentSize) {
        assert 0 <= position : "position must not be negative";
        assert 0 < alignmentSize : "alignmentSize must be positive";

        int excess = (int) (position % alignmentSize);
        return excess == 0 ? 0 : alignmentSize - excess;
    }
}
