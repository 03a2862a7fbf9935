package com.shadowhunters.engine.simulation;

/**
 * Exception thrown when a game cannot be set up.
 */
public class GameSetupException extends Exception {

    public GameSetupException(String message) {
        super(message);
    }

    public GameSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
