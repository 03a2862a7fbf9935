package com.shadowhunters.engine.game.zones;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * One of the three decks: a draw pile and its discard pile.
 * Top of the draw pile is the head of the deque; the most recent discard is
 * at the end of the discard list.
 */
public class Deck {
    private final DeckColor color;
    private final GameRng rng;
    private Deque<Card> drawPile;
    private final List<Card> discardPile;

    public Deck(DeckColor color, GameRng rng) {
        this.color = color;
        this.rng = rng;
        this.drawPile = new ArrayDeque<>();
        this.discardPile = new ArrayList<>();
    }

    public DeckColor getColor() {
        return color;
    }

    public void addCard(Card card) {
        drawPile.addLast(card);
    }

    /**
     * Draw the top card.
     * An empty draw pile is first refilled from the shuffled discard pile.
     * @return the card, or empty when both piles are exhausted
     */
    public Optional<Card> draw() {
        if (drawPile.isEmpty()) {
            if (discardPile.isEmpty()) {
                return Optional.empty();
            }
            reshuffleDiscards();
        }
        return Optional.of(drawPile.pollFirst());
    }

    /**
     * Check whether a draw would yield a card.
     */
    public boolean hasDrawableCard() {
        return !drawPile.isEmpty() || !discardPile.isEmpty();
    }

    public void discard(Card card) {
        discardPile.add(card);
    }

    /**
     * Remove and return the most recently discarded equipment card.
     */
    public Optional<Card> takeLastDiscardedEquipment() {
        for (int i = discardPile.size() - 1; i >= 0; i--) {
            if (discardPile.get(i).isEquipment()) {
                return Optional.of(discardPile.remove(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Shuffle the draw pile in place.
     */
    public void shuffle() {
        List<Card> list = new ArrayList<>(drawPile);
        rng.shuffle(list);
        drawPile = new ArrayDeque<>(list);
    }

    private void reshuffleDiscards() {
        List<Card> list = new ArrayList<>(discardPile);
        discardPile.clear();
        rng.shuffle(list);
        drawPile = new ArrayDeque<>(list);
    }

    public int drawPileSize() {
        return drawPile.size();
    }

    public int discardPileSize() {
        return discardPile.size();
    }

    /**
     * Get an unmodifiable copy of the discard pile.
     */
    public List<Card> getDiscards() {
        return List.copyOf(discardPile);
    }
}
