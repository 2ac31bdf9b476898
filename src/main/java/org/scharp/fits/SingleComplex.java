///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A single precision complex number, as stored in a {@code C} column.
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class SingleComplex {

    /** A complex number whose parts are both NaN. This is the null value of {@code C} columns. */
    public static final SingleComplex NaN = new SingleComplex(Float.NaN, Float.NaN);

    private final float real;
    private final float imaginary;

    /**
     * Creates a complex number.
     *
     * @param real
     *     The real part.
     * @param imaginary
     *     The imaginary part.
     */
    public SingleComplex(float real, float imaginary) {
        this.real = real;
        this.imaginary = imaginary;
    }

    /** @return the real part. */
    public float real() {
        return real;
    }

    /** @return the imaginary part. */
    public float imaginary() {
        return imaginary;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SingleComplex otherComplex)) {
            return false;
        }
        // Compare the bits so that NaN equals NaN.
        return Float.floatToIntBits(real) == Float.floatToIntBits(otherComplex.real) &&
            Float.floatToIntBits(imaginary) == Float.floatToIntBits(otherComplex.imaginary);
    }

    @Override
    public int hashCode() {
        return 31 * Float.hashCode(real) + Float.hashCode(imaginary);
    }

    @Override
    public String toString() {
        return "(" + real + ", " + imaginary + ")";
    }
}
