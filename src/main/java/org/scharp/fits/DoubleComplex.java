///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A double precision complex number, as stored in an {@code M} column or as the value of a header card.
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class DoubleComplex {

    /** A complex number whose parts are both NaN. This is the null value of {@code M} columns. */
    public static final DoubleComplex NaN = new DoubleComplex(Double.NaN, Double.NaN);

    private final double real;
    private final double imaginary;

    /**
     * Creates a complex number.
     *
     * @param real
     *     The real part.
     * @param imaginary
     *     The imaginary part.
     */
    public DoubleComplex(double real, double imaginary) {
        this.real = real;
        this.imaginary = imaginary;
    }

    /** @return the real part. */
    public double real() {
        return real;
    }

    /** @return the imaginary part. */
    public double imaginary() {
        return imaginary;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DoubleComplex otherComplex)) {
            return false;
        }
        return Double.doubleToLongBits(real) == Double.doubleToLongBits(otherComplex.real) &&
            Double.doubleToLongBits(imaginary) == Double.doubleToLongBits(otherComplex.imaginary);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(real) + Double.hashCode(imaginary);
    }

    @Override
    public String toString() {
        return "(" + real + ", " + imaginary + ")";
    }
}
