///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Signals malformed FITS content: an unparsable card image, an invalid {@code TFORMn} code, a missing mandatory
 * keyword, or structural keywords that contradict each other.
 */
public class FitsFormatException extends FitsException {

    private static final long serialVersionUID = 1L;

    public FitsFormatException(String message) {
        super(message);
    }

    public FitsFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
