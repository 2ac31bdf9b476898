///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Names of the header keywords this library interprets.
 * <p>
 * Keywords whose names end in "n" in the FITS standard (for example {@code TFORMn}) are given without the suffix.
 * The column or axis number is appended to them.
 * </p>
 */
public final class FitsKeywords {

    // private constructor to prevent anyone from instantiating the class.
    private FitsKeywords() {
    }

    public static final String SIMPLE = "SIMPLE";
    public static final String EXTEND = "EXTEND";
    public static final String XTENSION = "XTENSION";
    public static final String EXTNAME = "EXTNAME";
    public static final String BITPIX = "BITPIX";
    public static final String NAXIS = "NAXIS";
    public static final String TFIELDS = "TFIELDS";
    public static final String PCOUNT = "PCOUNT";
    public static final String GCOUNT = "GCOUNT";
    public static final String THEAP = "THEAP";
    public static final String TFORM = "TFORM";
    public static final String TTYPE = "TTYPE";
    public static final String TUNIT = "TUNIT";
    public static final String TNULL = "TNULL";
    public static final String TSCAL = "TSCAL";
    public static final String TZERO = "TZERO";
    public static final String TDISP = "TDISP";
    public static final String TDIM = "TDIM";
    public static final String LONGSTRN = "LONGSTRN";
    public static final String COMMENT = "COMMENT";
    public static final String HISTORY = "HISTORY";
    public static final String CONTINUE = "CONTINUE";
    public static final String HIERARCH = "HIERARCH";
    public static final String END = "END";

    /** The value of {@code XTENSION} for binary tables. */
    public static final String EXTENSION_BINTABLE = "BINTABLE";

    /** The value of {@code XTENSION} for image extensions. */
    public static final String EXTENSION_IMAGE = "IMAGE";
}
