///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.Closeable;
import java.io.IOException;

/**
 * The byte stream underneath a {@link FitsFile}.
 * <p>
 * A stream is either read or written, never both. Positions only move forward, which lets a forward-only stream,
 * such as a decompressing input, stand in for a file.
 * </p>
 */
interface FitsStream extends Closeable {

    /**
     * @return The number of bytes read from or written to this stream since it was opened.
     */
    long position();

    /**
     * Reads up to {@code length} bytes.
     *
     * @return The number of bytes read, or {@code -1} if the stream is at its end.
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Reads exactly {@code length} bytes.
     *
     * @throws UnexpectedEndOfStreamException
     *     if the stream ends before {@code length} bytes are read.
     */
    default void readFully(byte[] buffer, int offset, int length) throws IOException {
        int total = 0;
        while (total < length) {
            int count = read(buffer, offset + total, length - total);
            if (count < 0) {
                throw new UnexpectedEndOfStreamException(position());
            }
            total += count;
        }
    }

    /**
     * Moves the read position forward without returning the bytes in between.
     *
     * @param count
     *     The number of bytes to skip.
     *
     * @throws UnexpectedEndOfStreamException
     *     if the stream ends before {@code count} bytes are skipped.
     */
    void skip(long count) throws IOException;

    void write(byte[] buffer, int offset, int length) throws IOException;

    void flush() throws IOException;
}
