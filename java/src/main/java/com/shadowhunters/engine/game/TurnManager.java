package com.shadowhunters.engine.game;

import java.util.List;

/**
 * Manages turn structure: MOVEMENT, ACTION and END for each living player in
 * seat order.
 */
public final class TurnManager {

    private TurnManager() {
        // Utility class - prevent instantiation
    }

    /**
     * Start the game on the first living player in seat order.
     *
     * @param state The current game state
     * @throws GameStateException if the game already started or nobody is alive
     */
    public static TurnTransition beginGame(GameState state) throws GameStateException {
        if (state.isStarted()) {
            throw new GameStateException("Game already started");
        }
        List<Player> players = state.getPlayers();
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).isAlive()) {
                state.markStarted();
                state.setCurrentIndex(i);
                return startTurn(state);
            }
        }
        throw new GameStateException("No living players to start the game");
    }

    /**
     * Advance to the next phase.
     * MOVEMENT and ACTION move on within the same turn. END hands the turn to
     * the next living player, or back to the same player if they hold an
     * extra turn; the turn counter goes up once each time play wraps past
     * the last seat.
     *
     * @param state The current game state
     * @throws GameStateException if no player is alive to take the next turn
     */
    public static TurnTransition advancePhase(GameState state) throws GameStateException {
        Phase next = state.getPhase().nextInTurn();
        if (next != null) {
            state.setPhase(next);
            return new TurnTransition(next, state.getCurrentPlayer(), state.getTurn(), false);
        }

        Player current = state.getCurrentPlayer();
        if (current.isAlive() && current.consumeExtraTurn()) {
            return startTurn(state);
        }

        List<Player> players = state.getPlayers();
        int count = players.size();
        int from = state.getCurrentIndex();
        boolean wrapped = false;
        for (int step = 1; step <= count; step++) {
            if (from + step >= count) {
                wrapped = true;
            }
            int index = (from + step) % count;
            if (players.get(index).isAlive()) {
                if (wrapped) {
                    state.incrementTurn();
                }
                state.setCurrentIndex(index);
                return startTurn(state);
            }
        }
        throw new GameStateException("No living players left to take a turn");
    }

    /**
     * Reset per-turn flags and expire the new player's "until your next turn" protections.
     */
    private static TurnTransition startTurn(GameState state) {
        state.resetTurnState();
        state.setPhase(Phase.MOVEMENT);
        Player player = state.getCurrentPlayer();
        player.clearFlag(PlayerFlag.SHIELDED);
        player.clearFlag(PlayerFlag.DAMAGE_IMMUNE);
        return new TurnTransition(Phase.MOVEMENT, player, state.getTurn(), true);
    }
}
