package com.shadowhunters.engine.game;

/**
 * Result of one phase advance.
 *
 * @param phase       phase after the advance
 * @param player      player whose turn it is after the advance
 * @param turnNumber  global turn counter after the advance
 * @param turnStarted true if a new player turn began (including extra turns)
 */
public record TurnTransition(Phase phase, Player player, int turnNumber, boolean turnStarted) {
}
