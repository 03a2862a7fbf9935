package com.shadowhunters.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The three card decks on the board.
 */
public enum DeckColor {
    WHITE("white"),
    BLACK("black"),
    VISION("vision");

    private final String jsonValue;

    DeckColor(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
