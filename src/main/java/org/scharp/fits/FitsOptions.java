///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings that control how a {@link FitsFile} reads or writes.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link FitsOptions.Builder}:
 * </p>
 *
 * <pre>
 * FitsOptions options = FitsOptions.builder().
 *     bufferingAllowed(true).
 *     spillLimit(16 * 1024 * 1024).
 *     build();
 * </pre>
 */
public final class FitsOptions {

    /** The default number of bytes a buffered HDU keeps in memory before it spills to a temporary file. */
    public static final long DEFAULT_SPILL_LIMIT = 0x100000;

    private static final FitsOptions DEFAULTS = builder().build();

    private final Endianness endianness;
    private final boolean bufferingAllowed;
    private final long spillLimit;
    private final Path spillDirectory;

    /**
     * A builder class for {@link FitsOptions}.
     */
    public static final class Builder {
        private Endianness endianness;
        private boolean bufferingAllowed;
        private long spillLimit;
        private Path spillDirectory;

        private Builder() {
            this.endianness = Endianness.BIG_ENDIAN; // the FITS standard
            this.bufferingAllowed = false;
            this.spillLimit = DEFAULT_SPILL_LIMIT;
            this.spillDirectory = null; // the JVM's temporary directory
        }

        /**
         * Sets the byte order of the binary data.  FITS files are big-endian, so only set this to read or write
         * non-standard files.
         *
         * @param endianness
         *     The byte order.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code endianness} is {@code null}.
         */
        public Builder endianness(Endianness endianness) {
            ArgumentUtil.checkNotNull(endianness, "endianness");
            this.endianness = endianness;
            return this;
        }

        /**
         * Sets whether an HDU may be written before its size is known.  When allowed, an HDU whose last axis is 0 when
         * its header is written keeps its data in a buffer until {@link Hdu#markEnd()} is called, and then its header
         * is written with the number of strides that were written.
         *
         * @param bufferingAllowed
         *     {@code true} to allow buffering.
         *
         * @return This builder
         */
        public Builder bufferingAllowed(boolean bufferingAllowed) {
            this.bufferingAllowed = bufferingAllowed;
            return this;
        }

        /**
         * Sets how many bytes of a buffered HDU are kept in memory before the rest is written to a temporary file.
         *
         * @param spillLimit
         *     The limit in bytes.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code spillLimit} is negative.
         */
        public Builder spillLimit(long spillLimit) {
            ArgumentUtil.checkNotNegative(spillLimit, "spillLimit");
            this.spillLimit = spillLimit;
            return this;
        }

        /**
         * Sets the directory in which temporary files for buffered HDUs are created.
         *
         * @param spillDirectory
         *     The directory, or {@code null} to use the JVM's temporary directory.
         *
         * @return This builder
         */
        public Builder spillDirectory(Path spillDirectory) {
            this.spillDirectory = spillDirectory;
            return this;
        }

        /**
         * @return A new {@code FitsOptions} with the settings of this builder.
         */
        public FitsOptions build() {
            return new FitsOptions(this);
        }
    }

    private FitsOptions(Builder builder) {
        this.endianness = builder.endianness;
        this.bufferingAllowed = builder.bufferingAllowed;
        this.spillLimit = builder.spillLimit;
        this.spillDirectory = builder.spillDirectory;
    }

    /**
     * @return A new builder with the default settings.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The default settings: big-endian, no buffering.
     */
    public static FitsOptions defaults() {
        return DEFAULTS;
    }

    public Endianness endianness() {
        return endianness;
    }

    public boolean bufferingAllowed() {
        return bufferingAllowed;
    }

    public long spillLimit() {
        return spillLimit;
    }

    /**
     * @return The directory for temporary files, or {@code null} for the JVM's temporary directory.
     */
    public Path spillDirectory() {
        return spillDirectory;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FitsOptions otherOptions)) {
            return false;
        }
        return endianness == otherOptions.endianness &&
            bufferingAllowed == otherOptions.bufferingAllowed &&
            spillLimit == otherOptions.spillLimit &&
            Objects.equals(spillDirectory, otherOptions.spillDirectory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endianness, bufferingAllowed, spillLimit, spillDirectory);
    }
}
