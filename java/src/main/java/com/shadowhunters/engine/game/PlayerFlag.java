package com.shadowhunters.engine.game;

/**
 * Transient tags a character effect may put on a player.
 */
public enum PlayerFlag {
    /** Blocks the next damage taken, then disappears. Cleared at the holder's next turn. */
    SHIELDED,
    /** Blocks all damage until the holder's next turn. */
    DAMAGE_IMMUNE,
    /** Agnes' Capriccio: win condition follows the left neighbour. */
    DIRECTION_SWAPPED
}
