///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A FITS file: a sequence of HDUs, read or written one at a time over a single stream.
 * <p>
 * A file is opened either for reading or for writing.  When reading, {@link #readNextHdu()} reads the header of each
 * HDU in turn, skipping whatever the caller didn't read of the previous one.  When writing, each HDU is created with
 * one of the {@code create} methods after the previous HDU is {@link HduState#DONE}.
 * </p>
 *
 * <pre>
 * try (FitsFile fits = FitsFile.openWrite(path, FitsOptions.defaults())) {
 *     BinaryTableHdu table = fits.createBinaryTableHdu();
 *     table.createColumns(
 *         FitsTableColumn.of("ID", FitsDataType.of(FitsTypeCode.INT, 1)),
 *         FitsTableColumn.of("NAME", FitsDataType.of(FitsTypeCode.CHARACTER, 10)));
 *     table.setRowCount(2);
 *     table.writeNextRow(1, "first");
 *     table.writeNextRow(2, "second");
 * }
 * </pre>
 *
 * <p>
 * Instances of this class are not thread-safe.
 * </p>
 */
public final class FitsFile implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FitsFile.class);

    /** The size of a block, the unit to which headers and data are padded. */
    public static final int BLOCK_SIZE = 2880;

    private final FitsStream stream;
    private final boolean isWriting;
    private final FitsOptions options;
    private final BinaryConverter converter;
    private final List<Hdu> hdus;
    private boolean isClosed;

    private FitsFile(FitsStream stream, boolean isWriting, FitsOptions options) {
        this.stream = stream;
        this.isWriting = isWriting;
        this.options = options;
        this.converter = BinaryConverter.forEndianness(options.endianness());
        this.hdus = new ArrayList<>();
        this.isClosed = false;
    }

    /**
     * Opens a file for reading.
     *
     * @param path
     *     The file.
     * @param options
     *     Settings for reading.
     *
     * @return A new {@code FitsFile}.
     *
     * @throws IOException
     *     if the file can't be opened.
     */
    public static FitsFile openRead(Path path, FitsOptions options) throws IOException {
        ArgumentUtil.checkNotNull(path, "path");
        ArgumentUtil.checkNotNull(options, "options");
        logger.debug("opening {} for reading", path);
        return new FitsFile(new SeekableFitsStream(Files.newByteChannel(path, StandardOpenOption.READ)), false, options);
    }

    /**
     * Creates a file for writing.  If the file exists, it's overwritten.
     *
     * @param path
     *     The file.
     * @param options
     *     Settings for writing.
     *
     * @return A new {@code FitsFile}.
     *
     * @throws IOException
     *     if the file can't be created.
     */
    public static FitsFile openWrite(Path path, FitsOptions options) throws IOException {
        ArgumentUtil.checkNotNull(path, "path");
        ArgumentUtil.checkNotNull(options, "options");
        logger.debug("opening {} for writing", path);
        return new FitsFile(
            new SeekableFitsStream(Files.newByteChannel(path,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)),
            true,
            options);
    }

    /**
     * Reads a FITS file from a stream, such as a decompressing stream, that can't seek.  Closing the
     * {@code FitsFile} closes the stream.
     *
     * @param inputStream
     *     The stream, positioned at the start of the file.
     * @param options
     *     Settings for reading.
     *
     * @return A new {@code FitsFile}.
     */
    public static FitsFile read(InputStream inputStream, FitsOptions options) {
        ArgumentUtil.checkNotNull(inputStream, "inputStream");
        ArgumentUtil.checkNotNull(options, "options");
        return new FitsFile(SequentialFitsStream.forReading(inputStream), false, options);
    }

    /**
     * Writes a FITS file to a stream.  Closing the {@code FitsFile} closes the stream.
     *
     * @param outputStream
     *     The stream.
     * @param options
     *     Settings for writing.
     *
     * @return A new {@code FitsFile}.
     */
    public static FitsFile write(OutputStream outputStream, FitsOptions options) {
        ArgumentUtil.checkNotNull(outputStream, "outputStream");
        ArgumentUtil.checkNotNull(options, "options");
        return new FitsFile(SequentialFitsStream.forWriting(outputStream), true, options);
    }

    FitsStream stream() {
        return stream;
    }

    boolean isWriting() {
        return isWriting;
    }

    /**
     * @return The settings of this file.
     */
    public FitsOptions options() {
        return options;
    }

    /**
     * @return The converter for the byte order of this file.
     */
    public BinaryConverter converter() {
        return converter;
    }

    /**
     * @return The HDUs that have been read or created so far, in file order.
     */
    public List<Hdu> hdus() {
        return Collections.unmodifiableList(hdus);
    }

    void ensureOpen() {
        if (isClosed) {
            throw new IllegalStateException("file is closed");
        }
    }

    //
    // Reading
    //

    /**
     * Reads the header of the next HDU.  Any part of the previous HDU that wasn't read is skipped.
     *
     * @return The next HDU, or an empty optional if the file has no more HDUs.
     *
     * @throws IllegalStateException
     *     if the file is open for writing or closed.
     * @throws FitsFormatException
     *     if the header is malformed or doesn't start with {@code SIMPLE} (for the first HDU) or {@code XTENSION}
     *     (for the others).
     * @throws UnsupportedFitsFeatureException
     *     if the HDU is an extension of a type that isn't supported.
     * @throws IOException
     *     if the stream ends within an HDU or can't be read.
     */
    public Optional<Hdu> readNextHdu() throws IOException {
        ensureOpen();
        if (isWriting) {
            throw new IllegalStateException("cannot read from a file that is open for writing");
        }

        if (!hdus.isEmpty()) {
            hdus.get(hdus.size() - 1).readToFinish();
        }

        Hdu hdu = new Hdu(this, HduKind.RAW);
        if (!hdu.tryReadHeader()) {
            logger.debug("end of file after {} HDUs", hdus.size());
            return Optional.empty();
        }

        hdu.setKind(detectKind(hdu, hdus.isEmpty()));
        hdus.add(hdu);
        logger.debug("read HDU {} of kind {} at {}", hdus.size() - 1, hdu.kind(), hdu.headerPosition());
        return Optional.of(hdu);
    }

    private static HduKind detectKind(Hdu hdu, boolean isPrimary) throws FitsException {
        if (isPrimary) {
            if (!hdu.cards().containsKey(FitsKeywords.SIMPLE)) {
                throw new FitsFormatException("File doesn't start with a " + FitsKeywords.SIMPLE + " card");
            }
            return hdu.axisCount() == 0 ? HduKind.RAW : HduKind.IMAGE;
        }

        String extension = hdu.extension();
        if (extension == null) {
            throw new FitsFormatException("Extension at " + hdu.headerPosition() + " has no " +
                FitsKeywords.XTENSION + " card");
        }
        switch (extension) {
        case FitsKeywords.EXTENSION_BINTABLE:
            return HduKind.BINARY_TABLE;
        case FitsKeywords.EXTENSION_IMAGE:
            return HduKind.IMAGE;
        default:
            throw new UnsupportedFitsFeatureException("Extensions of type " + extension + " are not supported");
        }
    }

    //
    // Writing
    //

    void ensureCanWrite(Hdu hdu) {
        ensureOpen();
        if (!isWriting) {
            throw new IllegalStateException("cannot write to a file that is open for reading");
        }
        int index = hdus.indexOf(hdu);
        if (0 < index) {
            Hdu previous = hdus.get(index - 1);
            if (previous.state() != HduState.DONE) {
                throw new HduStateException("the previous HDU must be finished first", previous.state());
            }
        }
    }

    private Hdu newHdu(HduKind kind) {
        ensureCanWrite(null);
        if (!hdus.isEmpty()) {
            Hdu previous = hdus.get(hdus.size() - 1);
            if (previous.state() != HduState.DONE) {
                throw new HduStateException("the previous HDU must be finished first", previous.state());
            }
        }
        Hdu hdu = new Hdu(this, kind);
        hdus.add(hdu);
        return hdu;
    }

    /**
     * Creates a primary HDU without data.  This must be the first HDU of the file.
     *
     * @param hasExtensions
     *     Whether to add {@code EXTEND = T} to the header.
     *
     * @return The new HDU. Its header can be modified until it's written with {@link Hdu#writeHeader()}.
     *
     * @throws IllegalStateException
     *     if the file is open for reading or already has HDUs.
     */
    public Hdu createPrimaryHdu(boolean hasExtensions) {
        ensureCanWrite(null);
        if (!hdus.isEmpty()) {
            throw new IllegalStateException("the primary HDU must be the first HDU");
        }
        Hdu hdu = newHdu(HduKind.RAW);
        hdu.initializePrimaryCards(hasExtensions);
        return hdu;
    }

    /**
     * Creates an image.  The first HDU of a file becomes the primary HDU; later ones are {@code IMAGE} extensions.
     *
     * @param bitsPerPixel
     *     The value of {@code BITPIX}: 8, 16, 32, 64, -32, or -64.
     * @param axisLengths
     *     The length of each axis. If the last is 0 and the file allows buffering, it is set by {@link Hdu#markEnd()}.
     *
     * @return The new image. Its header can be modified until its first stride is written.
     *
     * @throws IllegalArgumentException
     *     if {@code bitsPerPixel} isn't valid, if there are no axes or more than 999, or if an axis length is
     *     negative.
     * @throws HduStateException
     *     if the previous HDU isn't done.
     */
    public ImageHdu createImageHdu(int bitsPerPixel, long... axisLengths) {
        ArgumentUtil.checkNotNull(axisLengths, "axisLengths");
        if (!Arrays.asList(8, 16, 32, 64, -32, -64).contains(bitsPerPixel)) {
            throw new IllegalArgumentException("bitsPerPixel must be 8, 16, 32, 64, -32, or -64");
        }
        if (axisLengths.length == 0 || 999 < axisLengths.length) {
            throw new IllegalArgumentException("an image must have between 1 and 999 axes");
        }
        for (long axisLength : axisLengths) {
            ArgumentUtil.checkNotNegative(axisLength, "axis lengths");
        }

        boolean isPrimary = hdus.isEmpty();
        Hdu hdu = newHdu(HduKind.IMAGE);
        if (isPrimary) {
            hdu.initializePrimaryCards(true);
        } else {
            hdu.initializeExtensionCards(FitsKeywords.EXTENSION_IMAGE);
        }
        hdu.initializeImageCards(bitsPerPixel, axisLengths.clone());
        return hdu.asImage();
    }

    /**
     * Creates a binary table extension.  If the file has no HDUs yet, a primary HDU without data is written first.
     *
     * @return The new table. Its header can be modified until its first row is written.
     *
     * @throws HduStateException
     *     if the previous HDU isn't done.
     * @throws IOException
     *     if the primary HDU can't be written.
     */
    public BinaryTableHdu createBinaryTableHdu() throws IOException {
        if (hdus.isEmpty()) {
            createPrimaryHdu(true).writeHeader();
        }
        Hdu hdu = newHdu(HduKind.BINARY_TABLE);
        BinaryTableHdu.initializeCards(hdu);
        return hdu.asBinaryTable();
    }

    //
    // Blocks
    //

    /**
     * Moves the read position to the start of the next block.  This does nothing if the position is at the start of a
     * block.
     */
    void skipBlock() throws IOException {
        if (isWriting) {
            skipBlock((byte) 0);
            return;
        }
        int count = MathUtil.bytesToAlignment(stream.position(), BLOCK_SIZE);
        if (0 < count) {
            stream.skip(count);
        }
    }

    /**
     * Writes fill bytes up to the start of the next block.  This does nothing if the position is at the start of a
     * block.
     *
     * @param fill
     *     The fill byte: a space for headers and zero for data.
     */
    void skipBlock(byte fill) throws IOException {
        int count = MathUtil.bytesToAlignment(stream.position(), BLOCK_SIZE);
        if (0 < count) {
            byte[] padding = new byte[count];
            Arrays.fill(padding, fill);
            stream.write(padding, 0, count);
        }
    }

    /**
     * Closes the underlying stream.  An HDU that is still being written is left incomplete.
     *
     * @throws IOException
     *     if the stream can't be flushed or closed.
     */
    @Override
    public void close() throws IOException {
        if (isClosed) {
            return;
        }
        isClosed = true;
        try {
            if (isWriting) {
                for (Hdu hdu : hdus) {
                    if (hdu.state() != HduState.DONE) {
                        logger.debug("closing file with an unfinished HDU at {}", hdu.headerPosition());
                    }
                    hdu.discard();
                }
                stream.flush();
            }
        } finally {
            stream.close();
        }
    }
}
