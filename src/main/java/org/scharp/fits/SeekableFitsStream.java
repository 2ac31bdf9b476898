///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * A {@link FitsStream} over a channel that supports seeking, such as a file. Skipping moves the channel's position
 * instead of reading.
 */
final class SeekableFitsStream implements FitsStream {

    private final SeekableByteChannel channel;
    private long position;

    SeekableFitsStream(SeekableByteChannel channel) throws IOException {
        this.channel = channel;
        this.position = channel.position();
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        int count = channel.read(ByteBuffer.wrap(buffer, offset, length));
        if (0 < count) {
            position += count;
        }
        return count;
    }

    @Override
    public void skip(long count) throws IOException {
        assert 0 <= count : "can only skip forward";

        long newPosition = position + count;
        if (channel.size() < newPosition) {
            throw new UnexpectedEndOfStreamException(channel.size());
        }
        channel.position(newPosition);
        position = newPosition;
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        ByteBuffer byteBuffer = ByteBuffer.wrap(buffer, offset, length);
        while (byteBuffer.hasRemaining()) {
            position += channel.write(byteBuffer);
        }
    }

    @Override
    public void flush() {
        // Channels don't buffer.
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
