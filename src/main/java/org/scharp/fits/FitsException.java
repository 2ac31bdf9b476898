///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;

/**
 * Signals that a FITS stream could not be read or written because of its contents.
 */
public class FitsException extends IOException {

    private static final long serialVersionUID = 1L;

    public FitsException(String message) {
        super(message);
    }

    public FitsException(String message, Throwable cause) {
        super(message, cause);
    }
}
