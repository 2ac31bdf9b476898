///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * An append-only staging area for the data of an HDU whose size isn't known when it's started.
 * <p>
 * Bytes are kept in memory until the total would go past the spill limit. From then on, every write goes to a temporary
 * file. {@link #writeTo} replays everything, in order, exactly once.
 * </p>
 */
final class SpillBuffer implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SpillBuffer.class);

    private static final int COPY_BUFFER_SIZE = 8192;

    private final long spillLimit;
    private final Path spillDirectory;
    private final ByteArrayOutputStream memoryBuffer;

    private Path spillFile;
    private OutputStream spillStream;
    private long size;
    private boolean isReplayed;

    /**
     * @param spillLimit
     *     The number of bytes that may be kept in memory.
     * @param spillDirectory
     *     The directory in which to create the temporary file, or {@code null} for the default temporary directory.
     */
    SpillBuffer(long spillLimit, Path spillDirectory) {
        assert 0 <= spillLimit : "spillLimit must not be negative";

        this.spillLimit = spillLimit;
        this.spillDirectory = spillDirectory;
        this.memoryBuffer = new ByteArrayOutputStream();
        this.spillFile = null;
        this.spillStream = null;
        this.size = 0;
        this.isReplayed = false;
    }

    /**
     * @return The number of bytes written to this buffer.
     */
    long size() {
        return size;
    }

    /**
     * @return {@code true} if some of the bytes have been written to a temporary file.
     */
    boolean isSpilled() {
        return spillStream != null;
    }

    /**
     * @return The temporary file, or {@code null} if nothing spilled.
     */
    Path spillFile() {
        return spillFile;
    }

    void write(byte[] data, int offset, int length) throws IOException {
        if (isReplayed) {
            throw new IllegalStateException("cannot write to a spill buffer after it has been replayed");
        }

        // Once spilled, everything goes to the file so that the order is kept.
        if (spillStream == null && size + length <= spillLimit) {
            memoryBuffer.write(data, offset, length);
        } else {
            if (spillStream == null) {
                spillFile = spillDirectory == null ?
                    Files.createTempFile("fits", ".spill") :
                    Files.createTempFile(spillDirectory, "fits", ".spill");
                spillStream = new BufferedOutputStream(Files.newOutputStream(spillFile), COPY_BUFFER_SIZE);
                logger.debug("spilling after {} bytes to {}", size, spillFile);
            }
            spillStream.write(data, offset, length);
        }
        size += length;
    }

    /**
     * Writes the contents of this buffer to a stream: first the bytes held in memory, then the bytes in the temporary
     * file.  This can only be done once.
     *
     * @param target
     *     The stream to write to.
     *
     * @throws IOException
     *     if the temporary file can't be read or {@code target} can't be written.
     */
    void writeTo(FitsStream target) throws IOException {
        if (isReplayed) {
            throw new IllegalStateException("a spill buffer can only be replayed once");
        }
        isReplayed = true;

        byte[] memoryBytes = memoryBuffer.toByteArray();
        target.write(memoryBytes, 0, memoryBytes.length);
        memoryBuffer.reset();

        if (spillStream != null) {
            spillStream.close();
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            try (InputStream inputStream = Files.newInputStream(spillFile)) {
                int count;
                while ((count = inputStream.read(buffer)) != -1) {
                    target.write(buffer, 0, count);
                }
            }
        }
        logger.trace("replayed {} bytes", size);
    }

    /**
     * Releases the memory and deletes the temporary file, if there is one.
     */
    @Override
    public void close() throws IOException {
        memoryBuffer.reset();
        if (spillStream != null) {
            spillStream.close();
        }
        if (spillFile != null) {
            try {
                Files.deleteIfExists(spillFile);
            } catch (IOException exception) {
                logger.warn("could not delete temporary file {}", spillFile, exception);
            }
            spillFile = null;
        }
    }
}
