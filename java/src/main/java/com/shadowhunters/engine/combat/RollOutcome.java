package com.shadowhunters.engine.combat;

/**
 * Dice and damage of one attack roll.
 *
 * @param sixSided   value of the six-sided die, 0 when not rolled
 * @param fourSided  value of the four-sided die, 0 when not rolled
 * @param singleDie  true when only the four-sided die counted
 * @param missed     true when equal dice produced a miss
 * @param baseDamage damage from the dice alone
 * @param damage     final damage after equipment
 */
public record RollOutcome(int sixSided, int fourSided, boolean singleDie, boolean missed,
                          int baseDamage, int damage) {

    /**
     * No roll happened (missing or already fallen target).
     */
    public static RollOutcome none() {
        return new RollOutcome(0, 0, false, false, 0, 0);
    }

    public boolean hits() {
        return damage > 0;
    }
}
