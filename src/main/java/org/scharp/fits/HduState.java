///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * The states of an HDU's read/write protocol.
 * <p>
 * An HDU moves {@code START -> STRIDES -> DONE}.  When writing an HDU whose row count is not known in advance, it
 * moves {@code START -> BUFFERING -> DONE} instead.  The header can only be modified in the {@code START} state.
 * </p>
 */
public enum HduState {
    /** Nothing has been read or written. The header may be modified. */
    START,

    /** The header is being written. This is only observable while the cards are being flushed. */
    HEADER,

    /** Data is being written to a spill buffer because the header can't be committed yet. */
    BUFFERING,

    /** The header has been read or written and strides are being transferred. */
    STRIDES,

    /** The data region, including its padding, has been completely read, skipped, or written. */
    DONE,
}
