package com.shadowhunters.engine.character;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Secret alignments assigned at setup.
 */
public enum Faction {
    HUNTER("hunter"),
    SHADOW("shadow"),
    NEUTRAL("neutral");

    private final String jsonValue;

    Faction(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * The faction whose extinction this faction needs, or null for neutrals.
     */
    public Faction opponent() {
        return switch (this) {
            case HUNTER -> SHADOW;
            case SHADOW -> HUNTER;
            case NEUTRAL -> null;
        };
    }
}
