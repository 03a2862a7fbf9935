package com.shadowhunters.engine.character;

import java.util.Optional;

/**
 * Every character the engine has rules for.
 * Character data may name other characters; those fall back to default
 * behaviour wherever a rule is looked up by id.
 */
public enum CharacterId {
    // Hunters
    EMI("emi"),
    FRANKLIN("franklin"),
    GEORGE("george"),
    ELLEN("ellen"),
    FUKA("fuka"),
    GREGOR("gregor"),
    // Shadows
    VALKYRIE("valkyrie"),
    VAMPIRE("vampire"),
    WEREWOLF("werewolf"),
    ULTRA_SOUL("ultra_soul"),
    UNKNOWN("unknown"),
    WIGHT("wight"),
    // Neutrals
    ALLIE("allie"),
    AGNES("agnes"),
    BOB("bob"),
    BRYAN("bryan"),
    CATHERINE("catherine"),
    CHARLES("charles"),
    DANIEL("daniel"),
    DAVID("david");

    private final String key;

    CharacterId(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<CharacterId> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (CharacterId id : values()) {
            if (id.key.equalsIgnoreCase(key)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
