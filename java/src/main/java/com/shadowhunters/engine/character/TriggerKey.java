package com.shadowhunters.engine.character;

import java.util.Optional;

/**
 * Trigger keys an ability declaration may name.
 * Kept as plain strings in the character data so that an unknown key is a
 * registration failure rather than a load failure.
 */
public enum TriggerKey {
    ON_ATTACKED("on_attacked"),
    ON_ATTACK("on_attack"),
    ON_TURN_START("on_turn_start"),
    ON_KILL("on_kill"),
    ON_DEATH("on_death"),
    ON_CHARACTER_DEATH("on_character_death"),
    ON_REVEAL("on_reveal"),
    MANUAL("manual");

    private final String key;

    TriggerKey(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isPassive() {
        return this != MANUAL;
    }

    public static Optional<TriggerKey> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (TriggerKey trigger : values()) {
            if (trigger.key.equals(key)) {
                return Optional.of(trigger);
            }
        }
        return Optional.empty();
    }
}
