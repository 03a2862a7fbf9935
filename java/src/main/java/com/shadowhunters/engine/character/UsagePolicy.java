package com.shadowhunters.engine.character;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UsagePolicy {
    UNLIMITED("unlimited"),
    ONCE("once");

    private final String jsonValue;

    UsagePolicy(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
