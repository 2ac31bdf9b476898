///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Signals that the stream ended inside a fixed-size read (a card image, a stride, or block padding).
 */
public class UnexpectedEndOfStreamException extends FitsException {

    private static final long serialVersionUID = 1L;

    public UnexpectedEndOfStreamException(long position) {
        super("Unexpected end of stream at byte " + position);
    }
}
