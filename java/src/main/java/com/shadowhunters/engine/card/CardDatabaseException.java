package com.shadowhunters.engine.card;

/**
 * Exception thrown by CardDatabase operations.
 */
public class CardDatabaseException extends Exception {
    public CardDatabaseException(String message) {
        super(message);
    }

    public CardDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
