package com.shadowhunters.engine.game;

/**
 * Thrown when the session reaches a state from which play cannot continue,
 * such as advancing the turn with no living player.
 */
public class GameStateException extends Exception {
    public GameStateException(String message) {
        super(message);
    }
}
