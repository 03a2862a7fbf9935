package com.shadowhunters.engine.ability;

import com.shadowhunters.engine.character.TriggerKey;
import com.shadowhunters.engine.game.Player;

/**
 * What caused a passive ability to fire.
 *
 * @param trigger    the trigger that fired
 * @param other      the other party: attacker, victim, killer or the dead character
 * @param amount     damage amount for damage triggers, otherwise 0
 * @param fromAttack true when the damage came from an attack roll
 * @param turnNumber turn number for turn-start triggers, otherwise 0
 */
public record TriggerContext(TriggerKey trigger, Player other, int amount, boolean fromAttack, int turnNumber) {

    public static TriggerContext damage(TriggerKey trigger, Player other, int amount, boolean fromAttack) {
        return new TriggerContext(trigger, other, amount, fromAttack, 0);
    }

    public static TriggerContext turnStart(int turnNumber) {
        return new TriggerContext(TriggerKey.ON_TURN_START, null, 0, false, turnNumber);
    }

    public static TriggerContext of(TriggerKey trigger, Player other) {
        return new TriggerContext(trigger, other, 0, false, 0);
    }
}
