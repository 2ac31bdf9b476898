///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * The byte order of multibyte values in a FITS data region.
 */
public enum Endianness {
    /** Most significant byte first. This is what the FITS standard requires. */
    BIG_ENDIAN,

    /** Least significant byte first. Only some non-standard writers produce this. */
    LITTLE_ENDIAN,
}
