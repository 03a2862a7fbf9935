package com.shadowhunters.engine.ability;

/**
 * Result of an active ability.
 *
 * @param success     whether the effect happened
 * @param description what happened, or why not
 * @param value       effect payload: damage dealt, hp healed, turns gained
 */
public record AbilityOutcome(boolean success, String description, int value) {

    public static AbilityOutcome success(String description, int value) {
        return new AbilityOutcome(true, description, value);
    }

    public static AbilityOutcome failure(String reason) {
        return new AbilityOutcome(false, reason, 0);
    }
}
