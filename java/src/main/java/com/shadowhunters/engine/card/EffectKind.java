package com.shadowhunters.engine.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card effect kinds understood by the engine.
 */
public enum EffectKind {
    ATTACK_BONUS("attack_bonus"),
    DEFENSE_BONUS("defense_bonus"),
    FORCED_SINGLE_DIE("forced_single_die"),
    STEAL_EQUIPMENT_ON_KILL("steal_equipment_on_kill"),
    HEAL("heal"),
    DAMAGE("damage"),
    DAMAGE_IMMUNITY("damage_immunity"),
    NONE("none");

    private final String jsonValue;

    EffectKind(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
