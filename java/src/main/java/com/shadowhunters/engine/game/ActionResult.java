package com.shadowhunters.engine.game;

/**
 * Outcome of a player action. A rejected action changed nothing.
 *
 * @param success whether the action was carried out
 * @param message what happened, or why it was refused
 * @param value   dice total, damage dealt or hp healed, depending on the action
 */
public record ActionResult(boolean success, String message, int value) {

    public static ActionResult ok(String message) {
        return new ActionResult(true, message, 0);
    }

    public static ActionResult ok(String message, int value) {
        return new ActionResult(true, message, value);
    }

    public static ActionResult fail(String reason) {
        return new ActionResult(false, reason, 0);
    }

    public static ActionResult rejected(ValidationResult validation) {
        return fail(validation.reason());
    }
}
