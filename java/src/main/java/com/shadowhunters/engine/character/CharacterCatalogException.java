package com.shadowhunters.engine.character;

/**
 * Exception thrown when character data cannot be loaded or looked up.
 */
public class CharacterCatalogException extends Exception {
    public CharacterCatalogException(String message) {
        super(message);
    }

    public CharacterCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
