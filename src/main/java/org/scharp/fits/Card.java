///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A header card: one 80 byte record of a FITS header that holds a keyword, an optional value, and an optional
 * comment.
 * <p>
 * Instances of this class are immutable.  The value is kept in the form in which it appears in the file (for example,
 * a string value keeps its quotes), and it's parsed on demand by the typed accessors.  To create a card with a value,
 * start with the keyword and derive copies from it:
 * </p>
 *
 * <pre>
 * Card card = new Card("NAXIS").withValue(2).withComment("number of array dimensions");
 * </pre>
 *
 * <p>
 * Keywords are case-insensitive. They are stored trimmed and in upper case.
 * </p>
 */
public final class Card {

    /** The size of a card image in bytes. */
    public static final int CARD_SIZE = 80;

    /** The maximum length of a keyword. */
    public static final int KEYWORD_SIZE = 8;

    // Numbers and logicals are right-justified so that they end in column 30.
    private static final int FIXED_VALUE_SIZE = 20;

    // Everything after the "= " value indicator.
    private static final int VALUE_AREA_SIZE = CARD_SIZE - KEYWORD_SIZE - 2;

    // FITS strings are padded to at least 8 characters between the quotes.
    private static final int MINIMUM_STRING_LENGTH = 8;

    private static final Set<String> COMMENT_KEYWORDS = Set.of(
        "",
        FitsKeywords.COMMENT,
        FitsKeywords.HISTORY,
        FitsKeywords.CONTINUE,
        FitsKeywords.HIERARCH);

    private static final Pattern KEYWORD_PARTS = Pattern.compile("([A-Z_]*)([0-9]*).*");

    private static final Pattern COMPLEX_VALUE = Pattern.compile("\\(\\s*([^,\\s]+)\\s*,\\s*([^)\\s]+)\\s*\\)");

    // Rank of the alphabetic part of a keyword when sorting a header.
    private static final int UNKNOWN_KEYWORD_RANK = Integer.MAX_VALUE / 2;
    private static final int END_RANK = Integer.MAX_VALUE;
    private static final Map<String, Integer> KEYWORD_RANKS = new HashMap<>();

    static {
        String[] orderedKeywords = {
            FitsKeywords.SIMPLE,
            FitsKeywords.XTENSION,
            FitsKeywords.BITPIX,
            FitsKeywords.NAXIS,
            FitsKeywords.EXTEND,
            FitsKeywords.PCOUNT,
            FitsKeywords.GCOUNT,
            FitsKeywords.TFIELDS,
            FitsKeywords.TTYPE,
            FitsKeywords.TFORM,
            FitsKeywords.TUNIT,
            FitsKeywords.TNULL,
            FitsKeywords.TSCAL,
            FitsKeywords.TZERO,
            FitsKeywords.TDISP,
            FitsKeywords.TDIM,
            FitsKeywords.THEAP,
            FitsKeywords.EXTNAME,
            FitsKeywords.LONGSTRN,
        };
        for (int i = 0; i < orderedKeywords.length; i++) {
            KEYWORD_RANKS.put(orderedKeywords[i], i);
        }
    }

    /**
     * Orders cards the way the FITS standard requires mandatory keywords to appear: by the rank of the keyword's
     * alphabetic prefix, then by its numeric suffix.  Keywords this library doesn't know come after the known ones
     * and {@code END} is always last.  Cards which compare as equal keep their relative order in a stable sort.
     */
    public static final Comparator<Card> STANDARD_ORDER = Comparator
        .comparingInt(Card::rank)
        .thenComparingInt(Card::keywordNumber);

    private final String keyword;
    private final String rawValue;
    private final String comment;

    /**
     * Creates a card with a keyword and neither a value nor a comment.
     *
     * @param keyword
     *     The keyword. This is trimmed and converted to upper case.
     *
     * @throws NullPointerException
     *     if {@code keyword} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code keyword} is longer than 8 characters or isn't printable ASCII.
     */
    public Card(String keyword) {
        this(normalizeKeyword(keyword), null, null);
    }

    /**
     * Creates a card for an indexed keyword, such as {@code TFORM3}.
     *
     * @param keyword
     *     The keyword without its index.
     * @param index
     *     The index (column or axis number) to append to the keyword.
     */
    public Card(String keyword, int index) {
        this(keyword + index);
    }

    private Card(String normalizedKeyword, String rawValue, String comment) {
        this.keyword = normalizedKeyword;
        this.rawValue = rawValue;
        this.comment = comment;
    }

    /**
     * Creates a {@code COMMENT} card.
     *
     * @param text
     *     The text of the comment.
     *
     * @return A new card.
     */
    public static Card commentCard(String text) {
        return new Card(FitsKeywords.COMMENT).withComment(text);
    }

    /**
     * @return A new {@code END} card.
     */
    public static Card endCard() {
        return new Card(FitsKeywords.END);
    }

    static String normalizeKeyword(String keyword) {
        ArgumentUtil.checkNotNull(keyword, "keyword");
        String normalized = keyword.trim().toUpperCase(Locale.ROOT);
        ArgumentUtil.checkAscii(normalized, KEYWORD_SIZE, "keywords");
        return normalized;
    }

    /** @return the keyword, trimmed and in upper case. This is never {@code null}. */
    public String keyword() {
        return keyword;
    }

    /** @return the value as it appears in the card image, or {@code null} if this card has no value. */
    public String rawValue() {
        return rawValue;
    }

    /** @return the comment, or {@code null} if this card has no comment. */
    public String comment() {
        return comment;
    }

    /** @return whether this card has a value. */
    public boolean hasValue() {
        return rawValue != null;
    }

    /**
     * Gets whether this card holds free text instead of a value.  Such cards ({@code COMMENT}, {@code HISTORY},
     * {@code CONTINUE}, {@code HIERARCH}, and blank keywords) may occur any number of times in a header.
     *
     * @return {@code true} if this is a comment-like card; {@code false} otherwise.
     */
    public boolean isCommentLike() {
        return isCommentKeyword(keyword);
    }

    static boolean isCommentKeyword(String normalizedKeyword) {
        return COMMENT_KEYWORDS.contains(normalizedKeyword);
    }

    /** @return whether this is a {@code CONTINUE} card. */
    public boolean isContinue() {
        return FitsKeywords.CONTINUE.equals(keyword);
    }

    /** @return whether this is the {@code END} card. */
    public boolean isEnd() {
        return FitsKeywords.END.equals(keyword);
    }

    //
    // Derived copies
    //

    /**
     * Returns a copy of this card with a different comment.
     *
     * @param comment
     *     The new comment. May be {@code null}.
     *
     * @return A new card.
     *
     * @throws IllegalArgumentException
     *     if {@code comment} is not printable ASCII, or if this is a comment-like card and {@code comment} doesn't fit
     *     on it.
     */
    public Card withComment(String comment) {
        if (comment != null) {
            ArgumentUtil.checkAscii(comment, isCommentLike() ? VALUE_AREA_SIZE : CARD_SIZE, "comments");
        }
        return new Card(keyword, rawValue, comment);
    }

    /**
     * Returns a copy of this card with a string value.  The value is quoted, embedded quotes are doubled, and it's
     * padded with spaces to at least 8 characters, as the FITS standard requires.
     *
     * @param value
     *     The string.
     *
     * @return A new card.
     *
     * @throws IllegalArgumentException
     *     if this card can't have a value or if the quoted value doesn't fit on a card.
     */
    public Card withValue(String value) {
        ArgumentUtil.checkNotNull(value, "value");
        String escaped = value.replace("'", "''");
        if (escaped.length() < MINIMUM_STRING_LENGTH) {
            escaped = escaped + " ".repeat(MINIMUM_STRING_LENGTH - escaped.length());
        }
        return withFormattedValue("'" + escaped + "'");
    }

    public Card withValue(boolean value) {
        return withFormattedValue(value ? "T" : "F");
    }

    public Card withValue(int value) {
        return withFormattedValue(Integer.toString(value));
    }

    public Card withValue(long value) {
        return withFormattedValue(Long.toString(value));
    }

    /**
     * Returns a copy of this card with a floating point value.
     *
     * @param value
     *     The number. This must be finite.
     *
     * @return A new card.
     *
     * @throws IllegalArgumentException
     *     if {@code value} is NaN or infinite, as FITS can't represent them in a header.
     */
    public Card withValue(double value) {
        return withFormattedValue(formatDouble(value));
    }

    public Card withValue(DoubleComplex value) {
        ArgumentUtil.checkNotNull(value, "value");
        return withFormattedValue("(" + formatDouble(value.real()) + ", " + formatDouble(value.imaginary()) + ")");
    }

    private static String formatDouble(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("header values must be finite numbers");
        }
        // Double.toString() is locale-independent and always includes a decimal point.
        return Double.toString(value);
    }

    private Card withFormattedValue(String formattedValue) {
        if (isCommentLike() || isEnd()) {
            throw new IllegalArgumentException(keyword + " cards cannot have a value");
        }
        ArgumentUtil.checkAscii(formattedValue, VALUE_AREA_SIZE, "card values");
        return new Card(keyword, formattedValue, comment);
    }

    //
    // Typed value accessors
    //

    private String requireValue() throws FitsFormatException {
        if (rawValue == null || rawValue.isBlank()) {
            throw new FitsFormatException("Card " + keyword + " has no value");
        }
        return rawValue.trim();
    }

    private FitsFormatException invalidValue(String expectedType) {
        return new FitsFormatException("Card " + keyword + " has a value of " + rawValue + ", which is not " + expectedType);
    }

    /**
     * Gets the value of this card as a string.  Doubled quotes are unescaped and trailing spaces, which are not
     * significant in FITS strings, are removed.
     *
     * @return The string value.
     *
     * @throws FitsFormatException
     *     if this card has no value or its value isn't a quoted string.
     */
    public String getString() throws FitsFormatException {
        String value = requireValue();
        if (value.length() < 2 || value.charAt(0) != '\'' || value.charAt(value.length() - 1) != '\'') {
            throw invalidValue("a string");
        }
        return value.substring(1, value.length() - 1).replace("''", "'").stripTrailing();
    }

    /**
     * Gets the value of this card as a logical.
     *
     * @return {@code true} for {@code T} and {@code false} for {@code F}.
     *
     * @throws FitsFormatException
     *     if this card has no value or its value isn't a logical.
     */
    public boolean getBoolean() throws FitsFormatException {
        String value = requireValue();
        if (value.equalsIgnoreCase("T")) {
            return true;
        }
        if (value.equalsIgnoreCase("F")) {
            return false;
        }
        throw invalidValue("a logical");
    }

    public int getInt32() throws FitsFormatException {
        String value = requireValue();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException exception) {
            throw invalidValue("a 32-bit integer");
        }
    }

    public long getInt64() throws FitsFormatException {
        String value = requireValue();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException exception) {
            throw invalidValue("a 64-bit integer");
        }
    }

    /**
     * Gets the value of this card as a floating point number.  Both {@code E} and {@code D} exponents are accepted.
     *
     * @return The number.
     *
     * @throws FitsFormatException
     *     if this card has no value or its value isn't a number.
     */
    public double getDouble() throws FitsFormatException {
        return parseDouble(requireValue());
    }

    private double parseDouble(String value) throws FitsFormatException {
        // Java would accept suffixes like "f" and words like "NaN", FITS doesn't.
        if (!value.matches("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([EeDd][+-]?[0-9]+)?")) {
            throw invalidValue("a number");
        }
        return Double.parseDouble(value.replace('D', 'E').replace('d', 'e'));
    }

    /**
     * Gets the value of this card as a complex number, given as {@code (real, imaginary)}.
     *
     * @return The number.
     *
     * @throws FitsFormatException
     *     if this card has no value or its value isn't a complex number.
     */
    public DoubleComplex getComplex() throws FitsFormatException {
        Matcher matcher = COMPLEX_VALUE.matcher(requireValue());
        if (!matcher.matches()) {
            throw invalidValue("a complex number");
        }
        return new DoubleComplex(parseDouble(matcher.group(1)), parseDouble(matcher.group(2)));
    }

    //
    // Card images
    //

    /**
     * Parses a card image.
     *
     * @param image
     *     An array that holds the card image.
     * @param offset
     *     The offset of the card image within {@code image}.
     *
     * @return The card.
     *
     * @throws FitsFormatException
     *     if the card image is malformed.
     */
    static Card parse(byte[] image, int offset) throws FitsFormatException {
        String line = new String(image, offset, CARD_SIZE, StandardCharsets.US_ASCII);

        String keyword = line.substring(0, KEYWORD_SIZE).trim().toUpperCase(Locale.ROOT);
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c < 0x20 || 0x7E < c) {
                throw new FitsFormatException("Card image for " + keyword + " contains a non-printable character");
            }
        }

        String remainder = line.substring(KEYWORD_SIZE + 2);
        if (isCommentKeyword(keyword)) {
            // Free text, even if it happens to contain "= ".
            String text = remainder.stripTrailing();
            return new Card(keyword, null, text.isEmpty() ? null : text);
        }

        if (line.charAt(KEYWORD_SIZE) == '=' && line.charAt(KEYWORD_SIZE + 1) == ' ') {
            return parseValue(keyword, remainder);
        }

        // A keyword without a value indicator, such as END.
        String text = remainder.trim();
        return new Card(keyword, null, text.isEmpty() ? null : text);
    }

    private static Card parseValue(String keyword, String valueArea) throws FitsFormatException {
        int start = 0;
        while (start < valueArea.length() && valueArea.charAt(start) == ' ') {
            start++;
        }

        final String rawValue;
        final int commentSearchStart;
        if (start < valueArea.length() && valueArea.charAt(start) == '\'') {
            // A string literal. A doubled quote is an escaped quote.
            int end = start + 1;
            while (true) {
                if (valueArea.length() <= end) {
                    throw new FitsFormatException("Card " + keyword + " has an unterminated string value");
                }
                if (valueArea.charAt(end) == '\'') {
                    if (end + 1 < valueArea.length() && valueArea.charAt(end + 1) == '\'') {
                        end += 2;
                        continue;
                    }
                    break;
                }
                end++;
            }
            rawValue = valueArea.substring(start, end + 1);
            commentSearchStart = end + 1;
        } else {
            int slash = valueArea.indexOf('/', start);
            rawValue = (slash < 0 ? valueArea.substring(start) : valueArea.substring(start, slash)).trim();
            commentSearchStart = slash < 0 ? valueArea.length() : slash;
        }

        int slash = valueArea.indexOf('/', commentSearchStart);
        String comment = slash < 0 ? null : valueArea.substring(slash + 1).trim();
        return new Card(keyword, rawValue, comment);
    }

    /**
     * Formats this card as an 80 byte card image.  Unused bytes are filled with spaces.  A comment that doesn't fit
     * is truncated.
     *
     * @return A new array of 80 bytes.
     */
    byte[] toBytes() {
        StringBuilder line = new StringBuilder(CARD_SIZE);
        line.append(keyword);
        line.append(" ".repeat(KEYWORD_SIZE - keyword.length()));

        if (rawValue != null && !isCommentLike()) {
            line.append("= ");
            if (!rawValue.startsWith("'") && !rawValue.startsWith("(") && rawValue.length() < FIXED_VALUE_SIZE) {
                line.append(" ".repeat(FIXED_VALUE_SIZE - rawValue.length()));
            }
            line.append(rawValue);
            if (comment != null) {
                line.append(" / ").append(comment);
            }
        } else if (comment != null) {
            line.append("  ").append(comment);
        }

        byte[] image = new byte[CARD_SIZE];
        Arrays.fill(image, (byte) ' ');
        byte[] text = line.toString().getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(text, 0, image, 0, Math.min(text.length, CARD_SIZE));
        return image;
    }

    //
    // Ordering
    //

    private int rank() {
        if (isEnd()) {
            return END_RANK;
        }
        Matcher matcher = KEYWORD_PARTS.matcher(keyword);
        if (!matcher.matches()) {
            return UNKNOWN_KEYWORD_RANK;
        }
        return KEYWORD_RANKS.getOrDefault(matcher.group(1), UNKNOWN_KEYWORD_RANK);
    }

    private int keywordNumber() {
        Matcher matcher = KEYWORD_PARTS.matcher(keyword);
        if (!matcher.matches() || matcher.group(2).isEmpty()) {
            return -1;
        }
        try {
            return Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException exception) {
            // More digits than an int can hold. Such a keyword can't be one of the indexed keywords we rank.
            return Integer.MAX_VALUE;
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Card otherCard)) {
            return false;
        }
        return keyword.equals(otherCard.keyword) &&
            Objects.equals(rawValue, otherCard.rawValue) &&
            Objects.equals(comment, otherCard.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, rawValue, comment);
    }

    @Override
    public String toString() {
        return new String(toBytes(), StandardCharsets.US_ASCII).stripTrailing();
    }
}
