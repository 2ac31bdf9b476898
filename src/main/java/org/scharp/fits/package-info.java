///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library reads and writes FITS files, the container format used throughout astronomy.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.fits.FitsFile} for sample code on writing a binary table.
 * </p>
 *
 * <h2>A FITS Primer for Java Programmers</h2>
 *
 * <p>
 * A FITS file is a sequence of header-data units (HDUs). The first is the "primary" HDU and the rest are
 * "extensions". Each HDU has a header made of 80 byte ASCII records called "cards", each of which holds a keyword, an
 * optional value, and an optional comment. The header ends with an {@code END} card. The header is followed by binary
 * data whose layout is described by the header's structural keywords ({@code BITPIX}, {@code NAXIS},
 * {@code NAXISn}, and for tables {@code TFIELDS} and the {@code TFORMn} family). Both the header and the data are
 * padded to a multiple of 2880 bytes, the "block" size.
 * </p>
 *
 * <p>
 * The data is an array with up to 999 axes. The first axis varies fastest. This library transfers the data one
 * "stride" at a time, where a stride is the first axis: one row of pixels of an image or one row of a binary table.
 * Binary data is big-endian.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * Invalid arguments are rejected as soon as possible with a {@code NullPointerException} or an
 * {@code IllegalArgumentException}.  Calling an operation in the wrong state of an HDU, for example writing a stride
 * before its header, throws an {@link org.scharp.fits.HduStateException}.  Problems with the file itself are reported
 * as subclasses of {@link org.scharp.fits.FitsException}, which is an {@code IOException}.  Nothing is retried, and
 * after a failed write the file should be discarded.
 * </p>
 */
package org.scharp.fits;
