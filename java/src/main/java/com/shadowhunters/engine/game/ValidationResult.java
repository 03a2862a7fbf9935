package com.shadowhunters.engine.game;

/**
 * Verdict on a requested action: valid, or invalid with a reason the caller
 * can show to the player.
 */
public record ValidationResult(boolean valid, String reason) {
    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String reason) {
        return new ValidationResult(false, reason);
    }
}
