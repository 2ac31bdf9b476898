///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A column of a binary table.
 * <p>
 * Instances of this class are immutable.  A column is described in the header by a family of cards that share its
 * 1-based column number: {@code TFORMn} (data type), {@code TTYPEn} (name), {@code TUNITn} (unit), {@code TDISPn}
 * (display format), and {@code TNULLn}/{@code TSCALn}/{@code TZEROn}, which are part of the data type.
 * </p>
 */
public final class FitsTableColumn {

    private final String name;
    private final FitsDataType dataType;
    private final String unit;
    private final String displayFormat;

    /**
     * Creates a column.
     *
     * @param name
     *     The column's name. May be {@code null}.
     * @param dataType
     *     The column's data type.
     * @param unit
     *     The physical unit of the column's values. May be {@code null}.
     * @param displayFormat
     *     The Fortran-style display format, such as {@code F8.3}. May be {@code null}.
     *
     * @throws NullPointerException
     *     if {@code dataType} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code name}, {@code unit}, or {@code displayFormat} is not printable ASCII or too long for a header card.
     */
    public FitsTableColumn(String name, FitsDataType dataType, String unit, String displayFormat) {
        ArgumentUtil.checkNotNull(dataType, "dataType");
        checkHeaderString(name, "column names");
        checkHeaderString(unit, "units");
        checkHeaderString(displayFormat, "display formats");

        this.name = name;
        this.dataType = dataType;
        this.unit = unit;
        this.displayFormat = displayFormat;
    }

    private static void checkHeaderString(String value, String argumentName) {
        if (value != null) {
            // leave room for the quotes
            ArgumentUtil.checkAscii(value, 68, argumentName);
        }
    }

    /**
     * Creates a column without a unit or display format.
     *
     * @param name
     *     The column's name. May be {@code null}.
     * @param dataType
     *     The column's data type.
     *
     * @return A new column.
     */
    public static FitsTableColumn of(String name, FitsDataType dataType) {
        return new FitsTableColumn(name, dataType, null, null);
    }

    /**
     * @return The column's name ({@code TTYPEn}), or {@code null} if it has none.
     */
    public String name() {
        return name;
    }

    public FitsDataType dataType() {
        return dataType;
    }

    /**
     * @return The column's unit ({@code TUNITn}), or {@code null} if it has none.
     */
    public String unit() {
        return unit;
    }

    /**
     * @return The column's display format ({@code TDISPn}), or {@code null} if it has none.
     */
    public String displayFormat() {
        return displayFormat;
    }

    /**
     * Reads the description of a column from a header.
     *
     * @param cards
     *     The header.
     * @param columnNumber
     *     The 1-based column number.
     *
     * @return The column.
     *
     * @throws FitsFormatException
     *     if the header has no {@code TFORMn} card for the column, or if one of the column's cards has a value of the
     *     wrong type.
     * @throws UnsupportedFitsFeatureException
     *     if the column is a variable-length array.
     */
    static FitsTableColumn fromCards(CardCollection cards, int columnNumber) throws FitsException {
        Optional<Card> tform = cards.tryGet(FitsKeywords.TFORM, columnNumber);
        if (tform.isEmpty()) {
            throw new FitsFormatException("Header has no " + FitsKeywords.TFORM + columnNumber + " card");
        }
        FitsDataType parsedType = FitsDataType.fromTForm(tform.get().getString());

        FitsDataType.Builder dataType = FitsDataType.builder().
            typeCode(parsedType.typeCode()).
            repeat(parsedType.repeat());
        Optional<Card> card = cards.tryGet(FitsKeywords.TNULL, columnNumber);
        if (card.isPresent() && parsedType.typeCode().isInteger()) {
            dataType.nullValue(card.get().getInt64());
        }
        card = cards.tryGet(FitsKeywords.TSCAL, columnNumber);
        if (card.isPresent()) {
            dataType.scale(card.get().getDouble());
        }
        card = cards.tryGet(FitsKeywords.TZERO, columnNumber);
        if (card.isPresent()) {
            dataType.zero(card.get().getDouble());
        }

        return new FitsTableColumn(
            optionalString(cards, FitsKeywords.TTYPE, columnNumber),
            dataType.build(),
            optionalString(cards, FitsKeywords.TUNIT, columnNumber),
            optionalString(cards, FitsKeywords.TDISP, columnNumber));
    }

    private static String optionalString(CardCollection cards, String keyword, int columnNumber)
        throws FitsFormatException {
        Optional<Card> card = cards.tryGet(keyword, columnNumber);
        return card.isPresent() ? card.get().getString().trim() : null;
    }

    /**
     * Creates the header cards that describe this column.
     *
     * @param columnNumber
     *     The 1-based column number.
     *
     * @return The cards, in standard order.
     */
    List<Card> toCards(int columnNumber) {
        List<Card> cards = new ArrayList<>();
        if (name != null) {
            cards.add(new Card(FitsKeywords.TTYPE, columnNumber).withValue(name));
        }
        cards.add(new Card(FitsKeywords.TFORM, columnNumber).withValue(dataType.tform()));
        if (unit != null) {
            cards.add(new Card(FitsKeywords.TUNIT, columnNumber).withValue(unit));
        }
        if (dataType.nullValue() != null) {
            cards.add(new Card(FitsKeywords.TNULL, columnNumber).withValue(dataType.nullValue().longValue()));
        }
        if (dataType.scale() != null) {
            cards.add(new Card(FitsKeywords.TSCAL, columnNumber).withValue(dataType.scale().doubleValue()));
        }
        if (dataType.zero() != null) {
            cards.add(new Card(FitsKeywords.TZERO, columnNumber).withValue(dataType.zero().doubleValue()));
        }
        if (displayFormat != null) {
            cards.add(new Card(FitsKeywords.TDISP, columnNumber).withValue(displayFormat));
        }
        return cards;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FitsTableColumn otherColumn)) {
            return false;
        }
        return Objects.equals(name, otherColumn.name) &&
            dataType.equals(otherColumn.dataType) &&
            Objects.equals(unit, otherColumn.unit) &&
            Objects.equals(displayFormat, otherColumn.displayFormat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, unit, displayFormat);
    }

    @Override
    public String toString() {
        return (name == null ? "" : name) + " " + dataType.tform();
    }
}
