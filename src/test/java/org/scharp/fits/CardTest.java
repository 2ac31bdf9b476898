///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link Card}. */
public class CardTest {

    /** Pads a string with spaces to make a card image. */
    private static byte[] image(String text) {
        assert text.length() <= Card.CARD_SIZE : "TEST BUG: card image too long";
        return (text + " ".repeat(Card.CARD_SIZE - text.length())).getBytes(StandardCharsets.US_ASCII);
    }

    private static String imageText(Card card) {
        byte[] bytes = card.toBytes();
        assertEquals(Card.CARD_SIZE, bytes.length, "card image has the wrong size");
        return new String(bytes, StandardCharsets.US_ASCII);
    }

    private static Card roundTrip(Card card) throws FitsFormatException {
        return Card.parse(card.toBytes(), 0);
    }

    @Test
    void testKeywordNormalization() {
        Card card = new Card(" naxis ");
        assertEquals("NAXIS", card.keyword());
        assertFalse(card.hasValue());
        assertNull(card.rawValue());
        assertNull(card.comment());

        assertEquals("TFORM12", new Card("tform", 12).keyword());
    }

    @Test
    void testInvalidKeyword() {
        Exception exception = assertThrows(NullPointerException.class, () -> new Card(null));
        assertEquals("keyword must not be null", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> new Card("LONGKEYWORD"));
        assertEquals("keywords must not be longer than 8 characters", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> new Card("TAB\tKEY"));
        assertEquals("keywords must only contain printable ASCII characters", exception.getMessage());
    }

    @Test
    void testStringValueWithQuote() throws FitsFormatException {
        Card card = new Card("OBSERVER").withValue("O'Brien");
        assertEquals("'O''Brien'", card.rawValue());
        assertEquals("O'Brien", card.getString());

        String text = imageText(card);
        assertEquals("OBSERVER= 'O''Brien'" + " ".repeat(60), text);

        Card parsed = roundTrip(card);
        assertEquals(card, parsed);
        assertEquals("O'Brien", parsed.getString());
    }

    @Test
    void testShortStringValueIsPadded() throws FitsFormatException {
        Card card = new Card(FitsKeywords.XTENSION).withValue("IMAGE");
        assertEquals("'IMAGE   '", card.rawValue());
        assertEquals("IMAGE", card.getString());

        // Trailing spaces aren't significant.
        assertEquals("", new Card("EMPTY").withValue("").getString());
    }

    @Test
    void testNumericValuesAreRightJustified() {
        Card card = new Card(FitsKeywords.NAXIS).withValue(2);
        assertEquals("NAXIS   = " + " ".repeat(19) + "2" + " ".repeat(50), imageText(card));

        card = new Card(FitsKeywords.SIMPLE).withValue(true).withComment("conforms to FITS standard");
        assertEquals(
            "SIMPLE  = " + " ".repeat(19) + "T / conforms to FITS standard" + " ".repeat(22),
            imageText(card));
    }

    @Test
    void testTypedRoundTrips() throws FitsFormatException {
        assertEquals(-42, roundTrip(new Card("A").withValue(-42)).getInt32());
        assertEquals(Long.MAX_VALUE, roundTrip(new Card("B").withValue(Long.MAX_VALUE)).getInt64());
        assertEquals(0.1, roundTrip(new Card("C").withValue(0.1)).getDouble());
        assertEquals(-1.25E-300, roundTrip(new Card("D").withValue(-1.25E-300)).getDouble());
        assertFalse(roundTrip(new Card("E").withValue(false)).getBoolean());
        assertEquals("a / b", roundTrip(new Card("F").withValue("a / b")).getString());

        DoubleComplex complex = new DoubleComplex(1.5, -2.0);
        Card complexCard = new Card("G").withValue(complex).withComment("complex");
        assertEquals("(1.5, -2.0)", complexCard.rawValue());
        Card parsed = roundTrip(complexCard);
        assertEquals(complex, parsed.getComplex());
        assertEquals("complex", parsed.comment());
    }

    @Test
    void testParseValueAndComment() throws FitsFormatException {
        Card card = Card.parse(image("BITPIX  =                   16 / number of bits per data pixel"), 0);
        assertEquals("BITPIX", card.keyword());
        assertEquals("16", card.rawValue());
        assertEquals("number of bits per data pixel", card.comment());
        assertEquals(16, card.getInt32());

        // A slash inside a string is not a comment.
        card = Card.parse(image("EXTNAME = 'A/B     '           / the name"), 0);
        assertEquals("A/B", card.getString());
        assertEquals("the name", card.comment());

        // A value without a comment
        card = Card.parse(image("EXTEND  =                    T"), 0);
        assertTrue(card.getBoolean());
        assertNull(card.comment());
    }

    @Test
    void testParseAtOffset() throws FitsFormatException {
        byte[] twoCards = new byte[2 * Card.CARD_SIZE];
        System.arraycopy(image("NAXIS   =                    0"), 0, twoCards, 0, Card.CARD_SIZE);
        System.arraycopy(image("END"), 0, twoCards, Card.CARD_SIZE, Card.CARD_SIZE);

        assertEquals(0, Card.parse(twoCards, 0).getInt32());
        assertTrue(Card.parse(twoCards, Card.CARD_SIZE).isEnd());
    }

    @Test
    void testParseDoubleWithDExponent() throws FitsFormatException {
        Card card = Card.parse(image("CRVAL1  =              1.5D+02"), 0);
        assertEquals(150.0, card.getDouble());

        card = Card.parse(image("CRVAL2  =                -2.5e-1"), 0);
        assertEquals(-0.25, card.getDouble());
    }

    @Test
    void testParseCommentLikeCards() throws FitsFormatException {
        Card card = Card.parse(image("COMMENT   This = not a value"), 0);
        assertTrue(card.isCommentLike());
        assertFalse(card.hasValue());
        assertEquals("This = not a value", card.comment());
        assertEquals(card, roundTrip(card));

        card = Card.parse(image("HISTORY   reduced by hand"), 0);
        assertTrue(card.isCommentLike());
        assertEquals("reduced by hand", card.comment());

        card = Card.parse(image("CONTINUE  'more text&'"), 0);
        assertTrue(card.isContinue());
        assertTrue(card.isCommentLike());
        assertEquals("'more text&'", card.comment());

        card = Card.parse(image("          blank keyword"), 0);
        assertEquals("", card.keyword());
        assertTrue(card.isCommentLike());

        card = Card.parse(image("END"), 0);
        assertTrue(card.isEnd());
        assertFalse(card.isCommentLike());
        assertFalse(card.hasValue());
        assertNull(card.comment());
    }

    @Test
    void testCommentCard() throws FitsFormatException {
        Card card = Card.commentCard("written by a test");
        assertEquals("COMMENT   written by a test" + " ".repeat(53), imageText(card));
        assertEquals(card, roundTrip(card));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> Card.commentCard("x".repeat(71)));
        assertEquals("comments must not be longer than 70 characters", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> Card.commentCard("x").withValue(1));
        assertEquals("COMMENT cards cannot have a value", exception.getMessage());
    }

    @Test
    void testLongCommentIsTruncated() {
        Card card = new Card("KEY").withValue(1).withComment("c".repeat(80));
        String text = imageText(card);
        assertTrue(text.startsWith("KEY     = " + " ".repeat(19) + "1 / ccc"));
        assertTrue(text.endsWith("c"));
    }

    @Test
    void testValueTooLong() {
        Exception exception = assertThrows(IllegalArgumentException.class, () -> new Card("KEY").withValue("x".repeat(69)));
        assertEquals("card values must not be longer than 70 characters", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> new Card("KEY").withValue(Double.NaN));
        assertEquals("header values must be finite numbers", exception.getMessage());
    }

    @Test
    void testMalformedValues() throws FitsFormatException {
        Card card = new Card("NAME").withValue("abc");
        Exception exception = assertThrows(FitsFormatException.class, card::getInt32);
        assertEquals("Card NAME has a value of 'abc     ', which is not a 32-bit integer", exception.getMessage());

        assertThrows(FitsFormatException.class, card::getDouble);
        assertThrows(FitsFormatException.class, card::getBoolean);
        assertThrows(FitsFormatException.class, card::getComplex);
        assertThrows(FitsFormatException.class, () -> new Card("NUMBER").withValue(1).getString());
        assertThrows(FitsFormatException.class, () -> Card.parse(image("NUMBER  =                  1.0f"), 0).getDouble());

        exception = assertThrows(FitsFormatException.class, () -> new Card("NOVALUE").getInt32());
        assertEquals("Card NOVALUE has no value", exception.getMessage());

        exception = assertThrows(FitsFormatException.class, () -> Card.parse(image("NAME    = 'unterminated"), 0));
        assertEquals("Card NAME has an unterminated string value", exception.getMessage());

        byte[] binary = image("NAME    = 1");
        binary[40] = 0;
        assertThrows(FitsFormatException.class, () -> Card.parse(binary, 0));
    }

    @Test
    void testStandardOrder() {
        List<Card> cards = new ArrayList<>(List.of(
            Card.endCard(),
            new Card(FitsKeywords.TFORM, 2),
            Card.commentCard("first comment"),
            new Card(FitsKeywords.TFORM, 1),
            new Card(FitsKeywords.NAXIS, 2),
            new Card(FitsKeywords.NAXIS),
            new Card(FitsKeywords.SIMPLE),
            new Card("DATE-OBS"),
            new Card(FitsKeywords.TTYPE, 1),
            new Card(FitsKeywords.BITPIX),
            new Card(FitsKeywords.NAXIS, 10),
            new Card(FitsKeywords.NAXIS, 1)));
        cards.sort(Card.STANDARD_ORDER);

        List<String> keywords = new ArrayList<>();
        for (Card card : cards) {
            keywords.add(card.keyword());
        }
        assertEquals(
            List.of("SIMPLE", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS10", "TTYPE1", "TFORM1", "TFORM2",
                "COMMENT", "DATE-OBS", "END"),
            keywords);
    }

    @Test
    void testEqualsAndHashCode() {
        Card card1 = new Card("KEY").withValue(1).withComment("c");
        Card card2 = new Card("key").withValue(1).withComment("c");
        Card card3 = new Card("KEY").withValue(1);

        assertEquals(card1, card2);
        assertEquals(card1.hashCode(), card2.hashCode());
        assertFalse(card1.equals(card3));
        assertFalse(card1.equals(null));
        assertEquals("KEY     =                    1 / c", card1.toString());
    }
}
