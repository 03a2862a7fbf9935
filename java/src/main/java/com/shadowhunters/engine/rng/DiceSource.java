package com.shadowhunters.engine.rng;

/**
 * Source of die rolls for combat, movement and card effects.
 */
@FunctionalInterface
public interface DiceSource {

    /**
     * Roll a single die.
     *
     * @param sides number of faces
     * @return a value in [1, sides]
     */
    int roll(int sides);
}
