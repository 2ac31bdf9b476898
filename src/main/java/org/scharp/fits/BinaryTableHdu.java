///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A view of an HDU as a binary table ({@code XTENSION = 'BINTABLE'}).  Each stride is a row, and the bytes of a row
 * are divided among the columns in order.
 * <p>
 * To write a table, create it with {@link FitsFile#createBinaryTableHdu()}, call {@link #createColumns}, and then
 * call {@link #writeNextRow} for each row.  If the number of rows isn't set with {@link #setRowCount}, the file must
 * allow buffering and {@link Hdu#markEnd()} must be called after the last row.
 * </p>
 */
public final class BinaryTableHdu {

    private final Hdu hdu;
    private final List<FitsTableColumn> columns;
    private int[] columnOffsets;

    BinaryTableHdu(Hdu hdu) throws FitsException {
        this.hdu = hdu;
        this.columns = new ArrayList<>();

        // A table that was read from a file is described by its header.
        if (hdu.state() != HduState.START) {
            detectColumns();
        }
        computeColumnOffsets();
    }

    /**
     * Adds the mandatory cards of a binary table extension with no columns and no rows.
     */
    static void initializeCards(Hdu hdu) {
        CardCollection cards = hdu.cards();
        hdu.initializeExtensionCards(FitsKeywords.EXTENSION_BINTABLE);
        cards.setUnchecked(new Card(FitsKeywords.NAXIS).withValue(2).withComment("number of array dimensions"));
        cards.setUnchecked(new Card(FitsKeywords.NAXIS, 1).withValue(0).withComment("width of a row in bytes"));
        cards.setUnchecked(new Card(FitsKeywords.NAXIS, 2).withValue(0).withComment("number of rows"));
        cards.setUnchecked(new Card(FitsKeywords.TFIELDS).withValue(0).withComment("number of columns"));
    }

    private void detectColumns() throws FitsException {
        int columnCount = columnCount();
        for (int columnNumber = 1; columnNumber <= columnCount; columnNumber++) {
            columns.add(FitsTableColumn.fromCards(hdu.cards(), columnNumber));
        }

        long rowWidth = hdu.axisLength(1);
        if (rowWidth != totalColumnWidth()) {
            throw new FitsFormatException(
                "NAXIS1 is " + rowWidth + " but the columns take " + totalColumnWidth() + " bytes");
        }
    }

    private long totalColumnWidth() {
        long width = 0;
        for (FitsTableColumn column : columns) {
            width += column.dataType().byteWidth();
        }
        return width;
    }

    private void computeColumnOffsets() {
        columnOffsets = new int[columns.size()];
        int offset = 0;
        for (int i = 0; i < columns.size(); i++) {
            columnOffsets[i] = offset;
            offset += columns.get(i).dataType().byteWidth();
        }
    }

    /**
     * @return The HDU that this is a view of.
     */
    public Hdu hdu() {
        return hdu;
    }

    /**
     * @return The columns of this table, in order.
     */
    public List<FitsTableColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Sets the columns of this table.  This sets {@code TFIELDS}, the cards that describe each column, and
     * {@code NAXIS1}, the width of a row.
     *
     * @param newColumns
     *     The columns.
     *
     * @throws NullPointerException
     *     if {@code newColumns} is {@code null} or contains {@code null}.
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public void createColumns(List<FitsTableColumn> newColumns) {
        ArgumentUtil.checkNotNull(newColumns, "newColumns");
        for (FitsTableColumn column : newColumns) {
            ArgumentUtil.checkNotNull(column, "column");
        }
        CardCollection cards = hdu.cards();

        // Remove the cards of the previous columns.
        for (int columnNumber = 1; columnNumber <= columns.size(); columnNumber++) {
            for (Card card : columns.get(columnNumber - 1).toCards(columnNumber)) {
                cards.remove(card.keyword());
            }
        }
        columns.clear();

        cards.set(new Card(FitsKeywords.TFIELDS).withValue(newColumns.size()).withComment("number of columns"));
        for (int i = 0; i < newColumns.size(); i++) {
            for (Card card : newColumns.get(i).toCards(i + 1)) {
                cards.set(card);
            }
            columns.add(newColumns.get(i));
        }
        Card rowWidth = cards.tryGet(FitsKeywords.NAXIS, 1).orElseGet(() -> new Card(FitsKeywords.NAXIS, 1));
        cards.set(rowWidth.withValue(totalColumnWidth()));
        computeColumnOffsets();
    }

    /**
     * Sets the columns of this table.
     *
     * @param newColumns
     *     The columns.
     *
     * @see #createColumns(List)
     */
    public void createColumns(FitsTableColumn... newColumns) {
        ArgumentUtil.checkNotNull(newColumns, "newColumns");
        createColumns(Arrays.asList(newColumns));
    }

    /**
     * @return The number of columns ({@code TFIELDS}).
     *
     * @throws FitsFormatException
     *     if the header has no valid {@code TFIELDS} card.
     */
    public int columnCount() throws FitsFormatException {
        Optional<Card> card = hdu.cards().tryGet(FitsKeywords.TFIELDS);
        if (card.isEmpty()) {
            throw new FitsFormatException("Header has no " + FitsKeywords.TFIELDS + " card");
        }
        int columnCount = card.get().getInt32();
        if (columnCount < 0 || 999 < columnCount) {
            throw new FitsFormatException("TFIELDS must be between 0 and 999, not " + columnCount);
        }
        return columnCount;
    }

    /**
     * @return The number of rows ({@code NAXIS2}).
     *
     * @throws FitsFormatException
     *     if the header has no valid {@code NAXIS2} card.
     */
    public long rowCount() throws FitsFormatException {
        return hdu.axisLength(2);
    }

    /**
     * Sets the number of rows.  This must be set before the header is written unless the file allows buffering.
     *
     * @param rowCount
     *     The number of rows.
     *
     * @throws IllegalArgumentException
     *     if {@code rowCount} is negative.
     * @throws HduStateException
     *     if the header can no longer be modified.
     * @throws FitsFormatException
     *     if the header has no valid {@code NAXIS} card.
     */
    public void setRowCount(long rowCount) throws FitsFormatException {
        hdu.setAxisLength(2, rowCount);
    }

    /**
     * @return The size of the heap in bytes ({@code PCOUNT}).
     *
     * @throws FitsFormatException
     *     if the header has no valid {@code PCOUNT} card.
     */
    public long parameterCount() throws FitsFormatException {
        return hdu.cards().get(FitsKeywords.PCOUNT).getInt64();
    }

    /**
     * @return The number of groups ({@code GCOUNT}), which is always 1 for a binary table.
     *
     * @throws FitsFormatException
     *     if the header has no valid {@code GCOUNT} card.
     */
    public long groupCount() throws FitsFormatException {
        return hdu.cards().get(FitsKeywords.GCOUNT).getInt64();
    }

    /**
     * Reads the next row.
     *
     * @param values
     *     An array into which the value of each column is stored.  See {@link FitsDataType} for the types of the
     *     values.
     *
     * @return {@code true} if a row was read; {@code false} if there are no more rows.
     *
     * @throws IllegalArgumentException
     *     if {@code values} is shorter than the number of columns.
     * @throws IOException
     *     if the row can't be read.
     */
    public boolean readNextRow(Object[] values) throws IOException {
        ArgumentUtil.checkNotNull(values, "values");
        if (values.length < columns.size()) {
            throw new IllegalArgumentException(
                "values has " + values.length + " elements but the table has " + columns.size() + " columns");
        }
        if (!hdu.hasMoreStrides()) {
            return false;
        }

        byte[] row = hdu.readStride();
        BinaryConverter converter = hdu.file().converter();
        for (int i = 0; i < columns.size(); i++) {
            values[i] = columns.get(i).dataType().decode(converter, row, columnOffsets[i]);
        }
        return true;
    }

    /**
     * Writes the next row.  If the header hasn't been written yet, it's written first.
     *
     * @param values
     *     The value of each column. See {@link FitsDataType} for the types that are accepted.
     *
     * @throws IllegalArgumentException
     *     if the number of values doesn't match the number of columns, or if a value doesn't match its column.
     * @throws HduStateException
     *     if all rows have already been written.
     * @throws IOException
     *     if the row can't be written.
     */
    public void writeNextRow(Object... values) throws IOException {
        ArgumentUtil.checkNotNull(values, "values");
        writeNextRow(Arrays.asList(values));
    }

    /**
     * Writes the next row.
     *
     * @param values
     *     The value of each column.
     *
     * @throws IOException
     *     if the row can't be written.
     * @see #writeNextRow(Object...)
     */
    public void writeNextRow(List<?> values) throws IOException {
        ArgumentUtil.checkNotNull(values, "values");
        if (values.size() != columns.size()) {
            throw new IllegalArgumentException(
                "row has " + values.size() + " values but the table has " + columns.size() + " columns");
        }
        if (hdu.state() == HduState.START) {
            hdu.writeHeader();
        }

        byte[] row = hdu.strideBuffer();
        BinaryConverter converter = hdu.file().converter();
        for (int i = 0; i < columns.size(); i++) {
            columns.get(i).dataType().encode(converter, values.get(i), row, columnOffsets[i]);
        }
        hdu.writeStride();
    }
}
