package com.shadowhunters.engine.game.zones;

import com.shadowhunters.engine.card.DeckColor;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default board: each zone offers the deck printed on it.
 * The Underworld Gate offers the first deck, in white, black, vision order,
 * that still has a card, or the white deck once all three are exhausted.
 */
public class StandardBoard implements DeckLocator {
    private final Map<DeckColor, Deck> decks;

    public StandardBoard(Map<DeckColor, Deck> decks) {
        this.decks = new EnumMap<>(DeckColor.class);
        this.decks.putAll(decks);
    }

    @Override
    public Optional<Deck> deckAt(Zone zone) {
        if (zone == null) {
            return Optional.empty();
        }
        if (zone == Zone.UNDERWORLD_GATE) {
            for (DeckColor color : DeckColor.values()) {
                Deck deck = decks.get(color);
                if (deck != null && deck.hasDrawableCard()) {
                    return Optional.of(deck);
                }
            }
            return Optional.ofNullable(decks.get(DeckColor.WHITE));
        }
        return Optional.ofNullable(zone.getDeck()).map(decks::get);
    }

    public Deck deck(DeckColor color) {
        return decks.get(color);
    }

    public Iterable<Deck> decks() {
        return decks.values();
    }
}
