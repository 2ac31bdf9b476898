///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * The header of an HDU: its cards, in the order in which they appear in the file.
 * <p>
 * Keywords are either unique, in which case at most one card may have them, or comment-like ({@code COMMENT},
 * {@code HISTORY}, {@code CONTINUE}, {@code HIERARCH}, and blank), in which case any number of cards may have them.
 * Cards with unique keywords can be looked up by keyword.
 * </p>
 * <p>
 * A header can only be modified while its HDU is in the {@link HduState#START} state. Once the header has been
 * read or written, every mutator throws an {@link HduStateException}.
 * </p>
 */
public final class CardCollection implements Iterable<Card> {

    private final Hdu owner;
    private final List<Card> cards;
    private final Map<String, Card> uniqueCards;

    CardCollection(Hdu owner) {
        this.owner = owner;
        this.cards = new ArrayList<>();
        this.uniqueCards = new HashMap<>();
    }

    private void ensureModifiable() {
        HduState state = owner.state();
        if (state != HduState.START) {
            throw new HduStateException("the header can no longer be modified", state);
        }
    }

    /**
     * @return The number of cards in this header.
     */
    public int size() {
        return cards.size();
    }

    /**
     * Gets the card at a given position.
     *
     * @param index
     *     The 0-based position of the card.
     *
     * @return The card.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code index} is out of range.
     */
    public Card get(int index) {
        return cards.get(index);
    }

    /**
     * Gets the card with a unique keyword.
     *
     * @param keyword
     *     The keyword. This is case-insensitive.
     *
     * @return The card.
     *
     * @throws NoSuchElementException
     *     if the header has no card with {@code keyword}.
     */
    public Card get(String keyword) {
        return tryGet(keyword).orElseThrow(() -> new NoSuchElementException("header has no " + keyword.trim() + " card"));
    }

    /**
     * Looks up the card with a unique keyword.
     *
     * @param keyword
     *     The keyword. This is case-insensitive.
     *
     * @return The card or an empty optional if the header has no card with {@code keyword}.
     */
    public Optional<Card> tryGet(String keyword) {
        return Optional.ofNullable(uniqueCards.get(Card.normalizeKeyword(keyword)));
    }

    /**
     * Looks up the card for an indexed keyword, such as {@code NAXIS2} or {@code TFORM5}.
     *
     * @param keyword
     *     The keyword without its index.
     * @param index
     *     The index to append to the keyword.
     *
     * @return The card or an empty optional if the header has no card with the indexed keyword.
     */
    public Optional<Card> tryGet(String keyword, int index) {
        return tryGet(keyword + index);
    }

    /**
     * @param keyword
     *     The keyword. This is case-insensitive.
     *
     * @return {@code true} if the header has a card with the unique keyword {@code keyword}.
     */
    public boolean containsKey(String keyword) {
        return uniqueCards.containsKey(Card.normalizeKeyword(keyword));
    }

    private void checkNotDuplicate(Card card) {
        if (!card.isCommentLike() && uniqueCards.containsKey(card.keyword())) {
            throw new IllegalArgumentException("header already has a " + card.keyword() + " card");
        }
    }

    /**
     * Appends a card to the header.
     *
     * @param card
     *     The card to add.
     *
     * @throws NullPointerException
     *     if {@code card} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code card} has a unique keyword that the header already has.
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public void add(Card card) {
        ArgumentUtil.checkNotNull(card, "card");
        ensureModifiable();
        checkNotDuplicate(card);
        addUnchecked(card);
    }

    /**
     * Appends a card without checking the HDU's state.  This is used while reading a header, which the FITS standard
     * doesn't require to be free of duplicates.  A duplicated unique keyword keeps its first card in the index.
     */
    void addUnchecked(Card card) {
        cards.add(card);
        if (!card.isCommentLike()) {
            uniqueCards.putIfAbsent(card.keyword(), card);
        }
    }

    /**
     * Inserts a card into the header at a given position.
     *
     * @param index
     *     The 0-based position at which to insert the card.
     * @param card
     *     The card to insert.
     *
     * @throws NullPointerException
     *     if {@code card} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code card} has a unique keyword that the header already has.
     * @throws IndexOutOfBoundsException
     *     if {@code index} is out of range.
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public void insert(int index, Card card) {
        ArgumentUtil.checkNotNull(card, "card");
        ensureModifiable();
        checkNotDuplicate(card);
        cards.add(index, card);
        if (!card.isCommentLike()) {
            uniqueCards.put(card.keyword(), card);
        }
    }

    /**
     * Adds a card with a unique keyword or, if the header already has a card with that keyword, replaces it without
     * changing its position.
     *
     * @param card
     *     The card to add or replace.
     *
     * @throws NullPointerException
     *     if {@code card} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code card} is comment-like, as such cards don't have a keyword that identifies them.
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public void set(Card card) {
        ArgumentUtil.checkNotNull(card, "card");
        if (card.isCommentLike()) {
            throw new IllegalArgumentException(card.keyword() + " cards cannot be set, only added");
        }
        ensureModifiable();
        setUnchecked(card);
    }

    /**
     * Sets a card without checking the HDU's state.  This is used when structural keywords are filled in as the
     * header is committed.
     */
    void setUnchecked(Card card) {
        assert !card.isCommentLike() : "comment-like cards cannot be set";

        Card existingCard = uniqueCards.put(card.keyword(), card);
        if (existingCard == null) {
            cards.add(card);
        } else {
            cards.set(cards.indexOf(existingCard), card);
        }
    }

    /**
     * Removes a card from the header.
     *
     * @param card
     *     The card to remove.
     *
     * @return {@code true} if the header contained {@code card}.
     *
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public boolean remove(Card card) {
        ArgumentUtil.checkNotNull(card, "card");
        ensureModifiable();
        int index = cards.indexOf(card);
        if (index < 0) {
            return false;
        }
        removeAt(index);
        return true;
    }

    /**
     * Removes the card with a unique keyword.
     *
     * @param keyword
     *     The keyword of the card to remove.
     *
     * @return {@code true} if the header had a card with {@code keyword}.
     *
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public boolean remove(String keyword) {
        ensureModifiable();
        Optional<Card> card = tryGet(keyword);
        if (card.isEmpty()) {
            return false;
        }
        return remove(card.get());
    }

    /**
     * Removes the card at a given position.
     *
     * @param index
     *     The 0-based position of the card to remove.
     *
     * @return The card that was removed.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code index} is out of range.
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public Card removeAt(int index) {
        ensureModifiable();
        Card removed = cards.remove(index);
        if (uniqueCards.get(removed.keyword()) == removed) {
            uniqueCards.remove(removed.keyword());
        }
        return removed;
    }

    /**
     * Removes all cards.
     *
     * @throws HduStateException
     *     if the header can no longer be modified.
     */
    public void clear() {
        ensureModifiable();
        cards.clear();
        uniqueCards.clear();
    }

    /**
     * Sorts the cards into the order the FITS standard requires for the mandatory keywords.  Cards with keywords of
     * the same rank, such as the comment-like cards, keep their relative order.
     *
     * @throws HduStateException
     *     if the header can no longer be modified.
     * @see Card#STANDARD_ORDER
     */
    public void sort() {
        ensureModifiable();
        sortUnchecked();
    }

    void sortUnchecked() {
        cards.sort(Card.STANDARD_ORDER);
    }

    /**
     * @return An unmodifiable view of the cards in this header.
     */
    public List<Card> asList() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public Iterator<Card> iterator() {
        return asList().iterator();
    }
}
