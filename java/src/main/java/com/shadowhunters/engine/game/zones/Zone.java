package com.shadowhunters.engine.game.zones;

import com.shadowhunters.engine.card.DeckColor;

/**
 * Board locations, in board order.
 * Neighbouring zones are paired into areas; players in the same area can
 * attack each other.
 */
public enum Zone {
    HERMITS_CABIN("Hermit's Cabin", DeckColor.VISION),
    UNDERWORLD_GATE("Underworld Gate", null),
    CHURCH("Church", DeckColor.WHITE),
    CEMETERY("Cemetery", DeckColor.BLACK),
    WEIRD_WOODS("Weird Woods", null),
    ERSTWHILE_ALTAR("Erstwhile Altar", null);

    private final String displayName;
    private final DeckColor deck;

    Zone(String displayName, DeckColor deck) {
        this.displayName = displayName;
        this.deck = deck;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * The deck printed on this zone, or null (no deck, or any deck).
     */
    public DeckColor getDeck() {
        return deck;
    }

    public int boardIndex() {
        return ordinal();
    }

    public int area() {
        return ordinal() / 2;
    }

    public int distanceTo(Zone other) {
        return Math.abs(boardIndex() - other.boardIndex());
    }

    public boolean sharesAreaWith(Zone other) {
        return other != null && area() == other.area();
    }

    /**
     * The next zone on the board, wrapping around.
     */
    public Zone next() {
        Zone[] zones = values();
        return zones[(ordinal() + 1) % zones.length];
    }
}
