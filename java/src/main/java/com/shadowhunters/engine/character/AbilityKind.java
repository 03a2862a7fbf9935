package com.shadowhunters.engine.character;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a character's ability comes into play.
 */
public enum AbilityKind {
    /** Fires automatically on its trigger event. */
    PASSIVE("passive"),
    /** Invoked by the player. */
    ACTIVE("active"),
    /** Constant trait read directly by the rule that it modifies. */
    STATIC("static");

    private final String jsonValue;

    AbilityKind(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
