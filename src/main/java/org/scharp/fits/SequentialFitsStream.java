///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A {@link FitsStream} over a forward-only {@code InputStream} or {@code OutputStream}. The position is the number of
 * bytes transferred so far, and skipping reads and discards.
 */
final class SequentialFitsStream implements FitsStream {

    private static final int SKIP_BUFFER_SIZE = 8192;

    private final InputStream inputStream;
    private final OutputStream outputStream;
    private long position;
    private byte[] skipBuffer;

    private SequentialFitsStream(InputStream inputStream, OutputStream outputStream) {
        this.inputStream = inputStream;
        this.outputStream = outputStream;
        this.position = 0;
    }

    static SequentialFitsStream forReading(InputStream inputStream) {
        return new SequentialFitsStream(inputStream, null);
    }

    static SequentialFitsStream forWriting(OutputStream outputStream) {
        return new SequentialFitsStream(null, outputStream);
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (inputStream == null) {
            throw new IllegalStateException("stream is not open for reading");
        }
        int count = inputStream.read(buffer, offset, length);
        if (0 < count) {
            position += count;
        }
        return count;
    }

    @Override
    public void skip(long count) throws IOException {
        assert 0 <= count : "can only skip forward";

        // InputStream.skip() may skip past the end of some streams without saying so, so read instead.
        if (skipBuffer == null) {
            skipBuffer = new byte[SKIP_BUFFER_SIZE];
        }
        long remaining = count;
        while (0 < remaining) {
            int chunk = (int) Math.min(remaining, skipBuffer.length);
            readFully(skipBuffer, 0, chunk);
            remaining -= chunk;
        }
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        if (outputStream == null) {
            throw new IllegalStateException("stream is not open for writing");
        }
        outputStream.write(buffer, offset, length);
        position += length;
    }

    @Override
    public void flush() throws IOException {
        if (outputStream != null) {
            outputStream.flush();
        }
    }

    @Override
    public void close() throws IOException {
        if (inputStream != null) {
            inputStream.close();
        } else {
            outputStream.close();
        }
    }
}
