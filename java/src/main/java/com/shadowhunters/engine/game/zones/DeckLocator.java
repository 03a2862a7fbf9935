package com.shadowhunters.engine.game.zones;

import java.util.Optional;

/**
 * Board configuration: which deck, if any, a player may draw from in a zone.
 */
@FunctionalInterface
public interface DeckLocator {

    Optional<Deck> deckAt(Zone zone);
}
