///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Signals that an operation was invoked on an HDU (or its header) in a state that doesn't permit it, for example
 * modifying a header that has already been written, or reading a stride before the header.
 * <p>
 * This is a programming error, so it is unchecked.
 * </p>
 */
public class HduStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final HduState state;

    HduStateException(String message, HduState state) {
        super(message + " (HDU is in state " + state + ")");
        this.state = state;
    }

    /**
     * @return The state the HDU was in when the operation was rejected.
     */
    public HduState state() {
        return state;
    }
}
