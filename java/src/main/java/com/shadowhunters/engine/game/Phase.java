package com.shadowhunters.engine.game;

/**
 * Phases of a player's turn.
 */
public enum Phase {
    MOVEMENT,
    ACTION,
    END;

    /**
     * The phase that follows within the same turn, or null after END.
     */
    public Phase nextInTurn() {
        return switch (this) {
            case MOVEMENT -> ACTION;
            case ACTION -> END;
            case END -> null;
        };
    }
}
