///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link SpillBuffer}. */
public class SpillBufferTest {

    @TempDir
    Path spillDirectory;

    private static byte[] sequence(int start, int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (start + i);
        }
        return bytes;
    }

    private static byte[] replay(SpillBuffer buffer) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (FitsStream stream = SequentialFitsStream.forWriting(output)) {
            buffer.writeTo(stream);
        }
        return output.toByteArray();
    }

    private long spillFileCount() throws IOException {
        try (var files = Files.list(spillDirectory)) {
            return files.count();
        }
    }

    @Test
    void testStaysInMemoryBelowLimit() throws IOException {
        try (SpillBuffer buffer = new SpillBuffer(10, spillDirectory)) {
            buffer.write(sequence(0, 4), 0, 4);
            buffer.write(sequence(4, 5), 0, 5);

            assertEquals(9, buffer.size());
            assertFalse(buffer.isSpilled());
            assertNull(buffer.spillFile());
            assertEquals(0, spillFileCount());

            assertArrayEquals(sequence(0, 9), replay(buffer));
        }
    }

    @Test
    void testFillingToLimitStaysInMemory() throws IOException {
        try (SpillBuffer buffer = new SpillBuffer(10, spillDirectory)) {
            buffer.write(sequence(0, 4), 0, 4);
            buffer.write(sequence(4, 6), 0, 6);

            assertEquals(10, buffer.size());
            assertFalse(buffer.isSpilled());
            assertEquals(0, spillFileCount());
            assertArrayEquals(sequence(0, 10), replay(buffer));
        }
    }

    @Test
    void testSpillsPastLimit() throws IOException {
        try (SpillBuffer buffer = new SpillBuffer(10, spillDirectory)) {
            buffer.write(sequence(0, 4), 0, 4);
            buffer.write(sequence(4, 4), 0, 4);
            assertFalse(buffer.isSpilled());

            // This write would take the total past the limit, so it goes to the file.
            buffer.write(sequence(8, 4), 0, 4);
            assertTrue(buffer.isSpilled());
            Path spillFile = buffer.spillFile();
            assertEquals(spillDirectory, spillFile.getParent());
            assertThat(spillFile.getFileName().toString(), startsWith("fits"));

            // A small write after spilling still goes to the file to keep the order.
            buffer.write(sequence(12, 8), 2, 1);
            assertEquals(13, buffer.size());

            byte[] expected = new byte[13];
            System.arraycopy(sequence(0, 12), 0, expected, 0, 12);
            expected[12] = 14;
            assertArrayEquals(expected, replay(buffer));
        }
    }

    @Test
    void testZeroLimitSpillsEverything() throws IOException {
        try (SpillBuffer buffer = new SpillBuffer(0, spillDirectory)) {
            buffer.write(sequence(0, 100), 0, 100);
            assertTrue(buffer.isSpilled());
            assertEquals(1, spillFileCount());
            assertArrayEquals(sequence(0, 100), replay(buffer));
        }
        assertEquals(0, spillFileCount());
    }

    @Test
    void testLargeReplay() throws IOException {
        // More than the copy buffer, to replay the file in several pieces.
        byte[] chunk = sequence(0, 1000);
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        try (SpillBuffer buffer = new SpillBuffer(2500, spillDirectory)) {
            for (int i = 0; i < 30; i++) {
                buffer.write(chunk, 0, chunk.length);
                expected.write(chunk);
            }
            assertTrue(buffer.isSpilled());
            assertEquals(30000, buffer.size());
            assertArrayEquals(expected.toByteArray(), replay(buffer));
        }
    }

    @Test
    void testReplayIsOneShot() throws IOException {
        try (SpillBuffer buffer = new SpillBuffer(10, spillDirectory)) {
            buffer.write(sequence(0, 3), 0, 3);
            replay(buffer);

            Exception exception = assertThrows(IllegalStateException.class, () -> replay(buffer));
            assertEquals("a spill buffer can only be replayed once", exception.getMessage());

            exception = assertThrows(IllegalStateException.class, () -> buffer.write(sequence(0, 1), 0, 1));
            assertEquals("cannot write to a spill buffer after it has been replayed", exception.getMessage());
        }
    }

    @Test
    void testCloseDeletesSpillFile() throws IOException {
        Path spillFile;
        SpillBuffer buffer = new SpillBuffer(1, spillDirectory);
        buffer.write(sequence(0, 10), 0, 10);
        spillFile = buffer.spillFile();
        assertTrue(Files.exists(spillFile));

        // Closing without replaying is how an abandoned HDU is cleaned up.
        buffer.close();
        assertFalse(Files.exists(spillFile));
        assertNull(buffer.spillFile());

        // Closing again does nothing.
        buffer.close();
    }
}
