package com.shadowhunters.engine.event;

import com.shadowhunters.engine.character.TriggerKey;
import com.shadowhunters.engine.game.Player;

/**
 * Domain events raised by the engine.
 * Delivered synchronously; a listener may raise further events, which are
 * delivered before the outer publish returns.
 */
public sealed interface GameEvent
        permits GameEvent.DamageDealt, GameEvent.PlayerDied, GameEvent.CharacterRevealed,
                GameEvent.TurnStarted, GameEvent.AbilityTriggered, GameEvent.AbilityActivated,
                GameEvent.AbilityFailed {

    /**
     * Hit points were lost. The attacker is null for card and self-inflicted damage.
     */
    record DamageDealt(Player attacker, Player victim, int amount, boolean fromAttack) implements GameEvent {}

    /**
     * A player died. The killer is null when nobody is credited.
     */
    record PlayerDied(Player victim, Player killer) implements GameEvent {}

    record CharacterRevealed(Player player, boolean forced) implements GameEvent {}

    record TurnStarted(Player player, int turnNumber) implements GameEvent {}

    record AbilityTriggered(Player player, TriggerKey trigger, String description) implements GameEvent {}

    record AbilityActivated(Player player, String description, int value) implements GameEvent {}

    record AbilityFailed(Player player, String reason) implements GameEvent {}
}
