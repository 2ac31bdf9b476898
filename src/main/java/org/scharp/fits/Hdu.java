///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * A header-data unit: a header followed by data that is transferred one stride at a time.
 * <p>
 * An HDU moves through the states of {@link HduState}. Its header can be modified until it's written (or read).
 * Then its data is transferred stride by stride through a single stride buffer, which is allocated on first use. A
 * stride is the first axis of the data: one row of pixels of an image or one row of a table. The number of strides
 * is the product of the lengths of the remaining axes.
 * </p>
 * <p>
 * When a {@link FitsFile} allows buffering, an HDU whose last axis length is 0 when its header is written enters the
 * {@link HduState#BUFFERING} state. Its strides are kept in a {@link SpillBuffer} until {@link #markEnd()} sets the
 * last axis length from the number of strides written and writes the header and the data.
 * </p>
 * <p>
 * The interpretation of the data is delegated to a view: {@link #asBinaryTable()} or {@link #asImage()}.
 * </p>
 */
public final class Hdu {

    private static final Logger logger = LoggerFactory.getLogger(Hdu.class);

    private static final byte SPACE_FILL = ' ';
    private static final byte ZERO_FILL = 0;

    private final FitsFile file;
    private final CardCollection cards;

    private HduKind kind;
    private HduState state;
    private long headerPosition;
    private long dataPosition;
    private byte[] strideBuffer;
    private long totalStrides;
    private long strideCounter;
    private boolean longStringsEnabled;
    private SpillBuffer spillBuffer;

    private BinaryTableHdu binaryTableView;
    private ImageHdu imageView;

    Hdu(FitsFile file, HduKind kind) {
        this.file = file;
        this.cards = new CardCollection(this);
        this.kind = kind;
        this.state = HduState.START;
        this.headerPosition = -1;
        this.dataPosition = -1;
        this.strideBuffer = null;
        this.totalStrides = 0;
        this.strideCounter = 0;
        this.longStringsEnabled = false;
        this.spillBuffer = null;
    }

    //
    // Initial headers
    //

    /**
     * Adds the mandatory cards of a primary HDU without data.
     */
    void initializePrimaryCards(boolean hasExtensions) {
        cards.addUnchecked(new Card(FitsKeywords.SIMPLE).withValue(true).withComment("conforms to FITS standard"));
        cards.addUnchecked(new Card(FitsKeywords.BITPIX).withValue(8).withComment("array data type"));
        cards.addUnchecked(new Card(FitsKeywords.NAXIS).withValue(0).withComment("number of array dimensions"));
        if (hasExtensions) {
            cards.addUnchecked(new Card(FitsKeywords.EXTEND).withValue(true));
        }
        cards.addUnchecked(Card.endCard());
    }

    /**
     * Adds the mandatory cards of an extension without data.
     */
    void initializeExtensionCards(String extension) {
        cards.addUnchecked(new Card(FitsKeywords.XTENSION).withValue(extension).withComment("extension type"));
        cards.addUnchecked(new Card(FitsKeywords.BITPIX).withValue(8).withComment("array data type"));
        cards.addUnchecked(new Card(FitsKeywords.NAXIS).withValue(0).withComment("number of array dimensions"));
        cards.addUnchecked(new Card(FitsKeywords.PCOUNT).withValue(0).withComment("number of parameters"));
        cards.addUnchecked(new Card(FitsKeywords.GCOUNT).withValue(1).withComment("number of groups"));
        cards.addUnchecked(Card.endCard());
    }

    /**
     * Sets the structural cards of an image, replacing those of {@link #initializePrimaryCards} or
     * {@link #initializeExtensionCards}.
     */
    void initializeImageCards(int bitsPerPixel, long[] axisLengths) {
        cards.setUnchecked(new Card(FitsKeywords.BITPIX).withValue(bitsPerPixel).withComment("array data type"));
        cards.setUnchecked(
            new Card(FitsKeywords.NAXIS).withValue(axisLengths.length).withComment("number of array dimensions"));
        for (int i = 0; i < axisLengths.length; i++) {
            cards.setUnchecked(new Card(FitsKeywords.NAXIS, i + 1).withValue(axisLengths[i]));
        }
    }

    //
    // State
    //

    /**
     * @return The file that this HDU belongs to.
     */
    public FitsFile file() {
        return file;
    }

    /**
     * @return How the data of this HDU is interpreted.
     */
    public HduKind kind() {
        return kind;
    }

    void setKind(HduKind kind) {
        this.kind = kind;
    }

    /**
     * @return The state of this HDU.
     */
    public HduState state() {
        return state;
    }

    /**
     * @return The header of this HDU.
     */
    public CardCollection cards() {
        return cards;
    }

    /**
     * @return The position of the first header card in the stream, or {@code -1} if the header hasn't been read or
     *     written.
     */
    public long headerPosition() {
        return headerPosition;
    }

    /**
     * @return The position of the data in the stream, or {@code -1} if the header hasn't been read or written.
     */
    public long dataPosition() {
        return dataPosition;
    }

    /**
     * @return {@code true} if the header has a {@code LONGSTRN} card, which announces the convention of continuing
     *     long string values on {@code CONTINUE} cards.
     */
    public boolean longStringsEnabled() {
        return longStringsEnabled;
    }

    private void ensureState(HduState expectedState, String message) {
        if (state != expectedState) {
            throw new HduStateException(message, state);
        }
    }

    private void ensureModifiable() {
        ensureState(HduState.START, "the header can no longer be modified");
    }

    private void ensureReading() {
        file.ensureOpen();
        if (file.isWriting()) {
            throw new IllegalStateException("cannot read from a file that is open for writing");
        }
    }

    private void ensureWriting() {
        file.ensureOpen();
        if (!file.isWriting()) {
            throw new IllegalStateException("cannot write to a file that is open for reading");
        }
    }

    //
    // Structural keywords
    //

    private Card requireCard(String keyword) throws FitsFormatException {
        Optional<Card> card = cards.tryGet(keyword);
        if (card.isEmpty()) {
            throw new FitsFormatException("Header has no " + keyword + " card");
        }
        return card.get();
    }

    /**
     * @return {@code true} if this HDU has a {@code SIMPLE = T} card, which marks a primary HDU that conforms to the
     *     FITS standard.
     *
     * @throws FitsFormatException
     *     if the value of {@code SIMPLE} isn't a logical.
     */
    public boolean isSimple() throws FitsFormatException {
        Optional<Card> card = cards.tryGet(FitsKeywords.SIMPLE);
        return card.isPresent() && card.get().getBoolean();
    }

    /**
     * @return The extension type ({@code XTENSION}), such as {@code BINTABLE}, or {@code null} if this is the
     *     primary HDU.
     *
     * @throws FitsFormatException
     *     if the value of {@code XTENSION} isn't a string.
     */
    public String extension() throws FitsFormatException {
        Optional<Card> card = cards.tryGet(FitsKeywords.XTENSION);
        return card.isPresent() ? card.get().getString().trim() : null;
    }

    /**
     * @return The name of this extension ({@code EXTNAME}), or {@code null} if it has none.
     *
     * @throws FitsFormatException
     *     if the value of {@code EXTNAME} isn't a string.
     */
    public String extensionName() throws FitsFormatException {
        Optional<Card> card = cards.tryGet(FitsKeywords.EXTNAME);
        return card.isPresent() ? card.get().getString().trim() : null;
    }

    /**
     * Sets the name of this extension.
     *
     * @param extensionName
     *     The name.
     *
     * @throws IllegalArgumentException
     *     if {@code extensionName} is not printable ASCII or doesn't fit on a card.
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public void setExtensionName(String extensionName) {
        ArgumentUtil.checkNotNull(extensionName, "extensionName");
        ensureModifiable();
        cards.setUnchecked(new Card(FitsKeywords.EXTNAME).withValue(extensionName));
    }

    /**
     * @return {@code true} if the file may contain extensions after this HDU. This is the value of {@code EXTEND}
     *     or, if there is no such card, whether this HDU has no axes.
     *
     * @throws FitsFormatException
     *     if {@code EXTEND} or {@code NAXIS} has a value of the wrong type.
     */
    public boolean hasExtensions() throws FitsFormatException {
        Optional<Card> card = cards.tryGet(FitsKeywords.EXTEND);
        if (card.isPresent()) {
            return card.get().getBoolean();
        }
        return axisCount() == 0;
    }

    /**
     * @return The number of bits in each data value ({@code BITPIX}). Negative values are floating point numbers.
     *
     * @throws FitsFormatException
     *     if the header has no valid {@code BITPIX} card.
     */
    public int bitsPerPixel() throws FitsFormatException {
        int bitsPerPixel = requireCard(FitsKeywords.BITPIX).getInt32();
        switch (bitsPerPixel) {
        case 8:
        case 16:
        case 32:
        case 64:
        case -32:
        case -64:
            return bitsPerPixel;
        default:
            throw new FitsFormatException("BITPIX must be 8, 16, 32, 64, -32, or -64, not " + bitsPerPixel);
        }
    }

    /**
     * @return The number of axes ({@code NAXIS}).
     *
     * @throws FitsFormatException
     *     if the header has no valid {@code NAXIS} card.
     */
    public int axisCount() throws FitsFormatException {
        int axisCount = requireCard(FitsKeywords.NAXIS).getInt32();
        if (axisCount < 0 || 999 < axisCount) {
            throw new FitsFormatException("NAXIS must be between 0 and 999, not " + axisCount);
        }
        return axisCount;
    }

    /**
     * Gets the length of an axis.
     *
     * @param axis
     *     The 1-based axis number.
     *
     * @return The value of {@code NAXISn}.
     *
     * @throws FitsFormatException
     *     if the header has no valid {@code NAXISn} card for the axis.
     */
    public long axisLength(int axis) throws FitsFormatException {
        long length = requireCard(FitsKeywords.NAXIS + axis).getInt64();
        if (length < 0) {
            throw new FitsFormatException(FitsKeywords.NAXIS + axis + " must not be negative");
        }
        return length;
    }

    /**
     * Sets the length of an axis.  For a table, axis 2 is the number of rows.
     *
     * @param axis
     *     The 1-based axis number.
     * @param length
     *     The length of the axis.
     *
     * @throws IllegalArgumentException
     *     if {@code axis} isn't between 1 and {@code NAXIS} or if {@code length} is negative.
     * @throws HduStateException
     *     if the header can no longer be modified.
     * @throws FitsFormatException
     *     if the header has no valid {@code NAXIS} card.
     */
    public void setAxisLength(int axis, long length) throws FitsFormatException {
        ArgumentUtil.checkNotNegative(length, "length");
        ensureModifiable();
        if (axis < 1 || axisCount() < axis) {
            throw new IllegalArgumentException("axis must be between 1 and " + axisCount());
        }
        setAxisLengthUnchecked(axis, length);
    }

    void setAxisLengthUnchecked(int axis, long length) {
        // Keep the comment of an existing card.
        Card card = cards.tryGet(FitsKeywords.NAXIS, axis).orElseGet(() -> new Card(FitsKeywords.NAXIS, axis));
        cards.setUnchecked(card.withValue(length));
    }

    private long optionalCount(String keyword, long defaultValue) throws FitsFormatException {
        Optional<Card> card = cards.tryGet(keyword);
        return card.isPresent() ? card.get().getInt64() : defaultValue;
    }

    //
    // Strides
    //

    /**
     * @return The number of bytes in a stride: the size of a value times the length of the first axis. This is 0 if
     *     the HDU has no axes.
     *
     * @throws FitsException
     *     if the header doesn't describe the data, or if a stride would be too large for an array.
     */
    public int strideLength() throws FitsException {
        if (axisCount() == 0) {
            return 0;
        }
        long length = Math.multiplyExact((long) Math.abs(bitsPerPixel()) / Byte.SIZE, axisLength(1));
        if (Integer.MAX_VALUE - 8 < length) {
            throw new UnsupportedFitsFeatureException("strides of " + length + " bytes are not supported");
        }
        return (int) length;
    }

    private long computeTotalStrides() throws FitsFormatException {
        int axisCount = axisCount();
        if (axisCount == 0) {
            return 0;
        }
        long total = 1;
        for (int axis = 2; axis <= axisCount; axis++) {
            total = Math.multiplyExact(total, axisLength(axis));
        }
        return total;
    }

    /**
     * @return The number of strides in the data: the product of the lengths of all axes but the first.  This is
     *     {@code 0} if the HDU has no axes.
     *
     * @throws FitsFormatException
     *     if the header doesn't describe the data.
     */
    public long totalStrides() throws FitsFormatException {
        // Once the header is committed, the count is fixed.
        if (state == HduState.STRIDES || state == HduState.DONE) {
            return totalStrides;
        }
        return computeTotalStrides();
    }

    /**
     * @return The number of strides read or written so far.
     */
    public long strideCounter() {
        return strideCounter;
    }

    /**
     * @return {@code true} if the data has strides that haven't been read yet. While buffering, this is always
     *     {@code true}, as there is no limit.
     */
    public boolean hasMoreStrides() {
        if (state == HduState.BUFFERING) {
            return true;
        }
        return state == HduState.STRIDES && strideCounter < totalStrides;
    }

    /**
     * Gets the size of the data in bytes, not counting the padding at its end.  This includes the heap of a binary
     * table, which follows the rows.
     *
     * @return {@code |BITPIX| / 8 * GCOUNT * (PCOUNT + NAXIS1 * ... * NAXISn)}, or 0 if the HDU has no axes.
     *
     * @throws FitsFormatException
     *     if the header doesn't describe the data.
     */
    public long dataSize() throws FitsFormatException {
        int axisCount = axisCount();
        if (axisCount == 0) {
            return 0;
        }
        long product = 1;
        for (int axis = 1; axis <= axisCount; axis++) {
            product = Math.multiplyExact(product, axisLength(axis));
        }
        long parameterCount = optionalCount(FitsKeywords.PCOUNT, 0);
        long groupCount = optionalCount(FitsKeywords.GCOUNT, 1);
        long bytesPerValue = Math.abs(bitsPerPixel()) / Byte.SIZE;
        return Math.multiplyExact(Math.multiplyExact(bytesPerValue, groupCount), parameterCount + product);
    }

    /**
     * Gets the buffer through which strides are transferred.  The same buffer is used for every stride of this HDU.
     * To write a stride, fill this buffer and call {@link #writeStride()}.
     *
     * @return The buffer. Its length is {@link #strideLength()}.
     *
     * @throws HduStateException
     *     if the header hasn't been read or written.
     * @throws FitsException
     *     if the header doesn't describe the data.
     */
    public byte[] strideBuffer() throws FitsException {
        if (strideBuffer == null) {
            if (state == HduState.START || state == HduState.HEADER) {
                throw new HduStateException("the header must be read or written first", state);
            }
            strideBuffer = new byte[strideLength()];
        }
        return strideBuffer;
    }

    //
    // Reading
    //

    /**
     * Reads the header from the file.  Afterward, the HDU is in the {@link HduState#STRIDES} state, or in the
     * {@link HduState#DONE} state if it has no data.
     *
     * @throws IllegalStateException
     *     if the file is open for writing.
     * @throws HduStateException
     *     if the header has already been read.
     * @throws UnexpectedEndOfStreamException
     *     if the stream ends before the {@code END} card.
     * @throws FitsFormatException
     *     if a card is malformed.
     * @throws IOException
     *     if the stream can't be read.
     */
    public void readHeader() throws IOException {
        if (!tryReadHeader()) {
            throw new UnexpectedEndOfStreamException(file.stream().position());
        }
    }

    /**
     * Reads the header like {@link #readHeader()}, except that an end of stream before the first card isn't an
     * error.
     *
     * @return {@code false} if the stream was at its end; {@code true} if a header was read.
     */
    boolean tryReadHeader() throws IOException {
        ensureReading();
        ensureState(HduState.START, "the header has already been read or written");

        FitsStream stream = file.stream();
        headerPosition = stream.position();

        byte[] image = new byte[Card.CARD_SIZE];
        boolean isFirstCard = true;
        Card card;
        do {
            int count = readCardImage(stream, image);
            if (count == 0 && isFirstCard) {
                return false;
            }
            if (count < Card.CARD_SIZE) {
                throw new UnexpectedEndOfStreamException(stream.position());
            }

            card = Card.parse(image, 0);
            processCard(card);
            cards.addUnchecked(card);
            isFirstCard = false;
        } while (!card.isEnd());

        state = HduState.HEADER;
        file.skipBlock();
        dataPosition = stream.position();
        totalStrides = computeTotalStrides();
        state = HduState.STRIDES;
        logger.debug("read header of {} cards at {}, data at {}", cards.size(), headerPosition, dataPosition);

        if (totalStrides == 0) {
            finishReading();
        }
        return true;
    }

    private static int readCardImage(FitsStream stream, byte[] image) throws IOException {
        int total = 0;
        while (total < image.length) {
            int count = stream.read(image, total, image.length - total);
            if (count < 0) {
                break;
            }
            total += count;
        }
        return total;
    }

    private void processCard(Card card) {
        if (FitsKeywords.LONGSTRN.equals(card.keyword())) {
            longStringsEnabled = true;
        }
    }

    /**
     * Reads the next stride into the stride buffer.
     *
     * @return The stride buffer.
     *
     * @throws IllegalStateException
     *     if the file is open for writing.
     * @throws HduStateException
     *     if the header hasn't been read or all strides have been read.
     * @throws UnexpectedEndOfStreamException
     *     if the stream ends within the stride.
     * @throws IOException
     *     if the stream can't be read.
     */
    public byte[] readStride() throws IOException {
        ensureReading();
        ensureState(HduState.STRIDES, "strides can only be read after the header and before the end of the data");

        byte[] buffer = strideBuffer();
        file.stream().readFully(buffer, 0, buffer.length);
        strideCounter++;
        if (strideCounter == totalStrides) {
            finishReading();
        }
        return buffer;
    }

    /**
     * Skips any strides that haven't been read, and the rest of the data, so that the stream is positioned at the
     * next HDU.  This does nothing if the HDU is already {@link HduState#DONE}.
     *
     * @throws IllegalStateException
     *     if the file is open for writing.
     * @throws HduStateException
     *     if the header hasn't been read.
     * @throws IOException
     *     if the stream ends early or can't be read.
     */
    public void readToFinish() throws IOException {
        ensureReading();
        if (state == HduState.DONE) {
            return;
        }
        ensureState(HduState.STRIDES, "the header must be read first");

        long unreadStrides = totalStrides - strideCounter;
        file.stream().skip(Math.multiplyExact(unreadStrides, (long) strideLength()));
        strideCounter = totalStrides;
        finishReading();
    }

    private void finishReading() throws IOException {
        // A binary table's heap follows its rows.
        long remainingData = dataSize() - Math.multiplyExact(totalStrides, (long) strideLength());
        if (0 < remainingData) {
            file.stream().skip(remainingData);
        }
        file.skipBlock();
        state = HduState.DONE;
        logger.trace("finished reading HDU at {}", headerPosition);
    }

    //
    // Writing
    //

    /**
     * Writes the header to the file.
     * <p>
     * If the last axis length is 0 and the file allows buffering, the header isn't written yet. Instead, the HDU
     * enters the {@link HduState#BUFFERING} state and the header is written by {@link #markEnd()}. Otherwise, the
     * cards are sorted into standard order, written, and padded with spaces to the end of the block.  The HDU then
     * enters the {@link HduState#STRIDES} state, or the {@link HduState#DONE} state if it has no data (which is how
     * an empty table is written when buffering isn't allowed).
     * </p>
     *
     * @throws IllegalStateException
     *     if the file is open for reading.
     * @throws HduStateException
     *     if the header has already been written or if the previous HDU isn't done.
     * @throws FitsException
     *     if the header doesn't describe the data.
     * @throws IOException
     *     if the stream can't be written.
     */
    public void writeHeader() throws IOException {
        ensureWriting();
        ensureState(HduState.START, "the header has already been written");
        file.ensureCanWrite(this);

        if (0 < axisCount() && computeTotalStrides() == 0 && file.options().bufferingAllowed()) {
            spillBuffer = new SpillBuffer(file.options().spillLimit(), file.options().spillDirectory());
            state = HduState.BUFFERING;
            logger.debug("buffering strides until the end of the HDU is marked");
            return;
        }

        commitHeader();
        if (totalStrides == 0) {
            finishWriting();
        }
    }

    private void commitHeader() throws IOException {
        state = HduState.HEADER;

        if (!cards.containsKey(FitsKeywords.END)) {
            cards.addUnchecked(Card.endCard());
        }
        cards.sortUnchecked();

        FitsStream stream = file.stream();
        headerPosition = stream.position();
        for (Card card : cards) {
            byte[] image = card.toBytes();
            stream.write(image, 0, image.length);
        }
        file.skipBlock(SPACE_FILL);
        dataPosition = stream.position();
        totalStrides = computeTotalStrides();
        state = HduState.STRIDES;
        logger.debug("wrote header of {} cards at {}, data at {}", cards.size(), headerPosition, dataPosition);
    }

    /**
     * Writes the contents of the stride buffer as the next stride.  While buffering, the stride is kept in the spill
     * buffer. Otherwise, it's written to the file, and after the last stride, the data is padded with zeros to the end
     * of the block and the HDU is {@link HduState#DONE}.
     *
     * @throws IllegalStateException
     *     if the file is open for reading.
     * @throws HduStateException
     *     if the header hasn't been written or all strides have been written.
     * @throws IOException
     *     if the stream can't be written.
     */
    public void writeStride() throws IOException {
        ensureWriting();
        if (state != HduState.STRIDES && state != HduState.BUFFERING) {
            throw new HduStateException(
                "strides can only be written after the header and before the end of the data", state);
        }

        byte[] buffer = strideBuffer();
        if (state == HduState.BUFFERING) {
            spillBuffer.write(buffer, 0, buffer.length);
            strideCounter++;
        } else {
            file.stream().write(buffer, 0, buffer.length);
            strideCounter++;
            if (strideCounter == totalStrides) {
                finishWriting();
            }
        }
    }

    /**
     * Copies a stride into the stride buffer and writes it.
     *
     * @param stride
     *     The bytes of the stride.
     *
     * @throws IllegalArgumentException
     *     if {@code stride} doesn't have the length of a stride.
     * @throws IOException
     *     if the stream can't be written.
     * @see #writeStride()
     */
    public void writeStride(byte[] stride) throws IOException {
        ArgumentUtil.checkNotNull(stride, "stride");
        byte[] buffer = strideBuffer();
        if (stride.length != buffer.length) {
            throw new IllegalArgumentException(
                "stride has " + stride.length + " bytes, but strides of this HDU have " + buffer.length);
        }
        System.arraycopy(stride, 0, buffer, 0, buffer.length);
        writeStride();
    }

    /**
     * Ends the data of a buffered HDU.  The length of the last axis is set so that the number of strides matches the
     * number of strides written, then the header and the buffered strides are written to the file and the data is
     * padded to the end of the block.
     *
     * @throws IllegalStateException
     *     if the file is open for reading.
     * @throws HduStateException
     *     if the HDU isn't in the {@link HduState#BUFFERING} or {@link HduState#STRIDES} state, if the strides written
     *     while buffering don't fill a whole number of the last axis, or if fewer strides were written than the
     *     header declares.
     * @throws IOException
     *     if the stream or the spill buffer's temporary file can't be written.
     */
    public void markEnd() throws IOException {
        ensureWriting();
        if (state == HduState.STRIDES) {
            // The header is already written, so it can't be changed to match.
            throw new HduStateException(
                "only " + strideCounter + " of " + totalStrides + " strides have been written", state);
        }
        ensureState(HduState.BUFFERING, "the end can only be marked while strides are written");

        int axisCount = axisCount();
        long otherStrides = 1;
        for (int axis = 2; axis < axisCount; axis++) {
            otherStrides = Math.multiplyExact(otherStrides, axisLength(axis));
        }
        if (otherStrides == 0 || strideCounter % otherStrides != 0) {
            throw new HduStateException(
                "the length of axis " + axisCount + " cannot be derived from " + strideCounter + " strides", state);
        }
        setAxisLengthUnchecked(axisCount, strideCounter / otherStrides);

        try (SpillBuffer buffer = spillBuffer) {
            commitHeader();
            assert totalStrides == strideCounter : "header doesn't match the buffered strides";
            buffer.writeTo(file.stream());
        } finally {
            spillBuffer = null;
        }
        finishWriting();
    }

    private void finishWriting() throws IOException {
        file.skipBlock(ZERO_FILL);
        state = HduState.DONE;
        logger.trace("finished writing HDU at {}", headerPosition);
    }

    /**
     * Releases the spill buffer of an HDU that is abandoned while buffering.
     */
    void discard() throws IOException {
        if (spillBuffer != null) {
            spillBuffer.close();
            spillBuffer = null;
        }
    }

    //
    // Views
    //

    /**
     * Gets this HDU as a binary table.
     *
     * @return A view of this HDU.
     *
     * @throws IllegalStateException
     *     if this HDU isn't a binary table.
     * @throws FitsException
     *     if the header doesn't describe a valid binary table.
     */
    public BinaryTableHdu asBinaryTable() throws FitsException {
        if (kind != HduKind.BINARY_TABLE) {
            throw new IllegalStateException("HDU is " + kind + ", not " + HduKind.BINARY_TABLE);
        }
        if (binaryTableView == null) {
            binaryTableView = new BinaryTableHdu(this);
        }
        return binaryTableView;
    }

    /**
     * Gets this HDU as an image.
     *
     * @return A view of this HDU.
     *
     * @throws IllegalStateException
     *     if this HDU isn't an image.
     */
    public ImageHdu asImage() {
        if (kind != HduKind.IMAGE) {
            throw new IllegalStateException("HDU is " + kind + ", not " + HduKind.IMAGE);
        }
        if (imageView == null) {
            imageView = new ImageHdu(this);
        }
        return imageView;
    }

    @Override
    public String toString() {
        return "Hdu[" + kind + ", " + state + ", " + cards.size() + " cards]";
    }
}
