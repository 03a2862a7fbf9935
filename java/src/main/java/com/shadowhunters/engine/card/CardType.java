package com.shadowhunters.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a drawn card is resolved.
 */
public enum CardType {
    /** Resolved once on the drawer, then discarded. */
    INSTANT("instant"),
    /** Kept face up in front of the drawer. */
    EQUIPMENT("equipment"),
    /** Handed secretly to another player, who answers it. */
    VISION("vision");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
