///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * How the data of an HDU is interpreted.  All kinds share the same header and stride machinery.
 */
public enum HduKind {
    /** A primary HDU without data, or whose data is only available as raw strides. */
    RAW,

    /** An image, either the primary HDU or an {@code IMAGE} extension. A stride is one row of pixels. */
    IMAGE,

    /** A {@code BINTABLE} extension. A stride is one row of the table. */
    BINARY_TABLE,
}
