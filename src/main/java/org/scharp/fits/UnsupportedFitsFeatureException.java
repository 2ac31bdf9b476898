///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Signals well-formed FITS content that this library does not implement, such as variable-length array columns or
 * extension types other than {@code IMAGE} and {@code BINTABLE}.
 */
public class UnsupportedFitsFeatureException extends FitsException {

    private static final long serialVersionUID = 1L;

    public UnsupportedFitsFeatureException(String message) {
        super(message);
    }
}
