package com.shadowhunters.engine.simulation;

import com.shadowhunters.engine.character.Faction;

import java.util.List;

/**
 * Result of a single simulated game.
 *
 * @param seed           seed the game was played with
 * @param turns          last turn reached
 * @param finished       whether a win condition ended the game
 * @param winningFaction Hunter or Shadow faction that won, or null
 * @param winners        characters that won, in seat order
 * @param deaths         players dead at the end
 */
public record GameResult(
    long seed,
    int turns,
    boolean finished,
    Faction winningFaction,
    List<String> winners,
    int deaths
) {
    public GameResult {
        winners = List.copyOf(winners);
    }

    /**
     * Check if a faction won, rather than neutrals alone or nobody.
     */
    public boolean hasFactionWinner() {
        return winningFaction != null;
    }
}
