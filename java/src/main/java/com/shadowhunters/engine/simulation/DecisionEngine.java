package com.shadowhunters.engine.simulation;

import com.shadowhunters.engine.character.CharacterId;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.game.ActionValidator;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.zones.Zone;
import com.shadowhunters.engine.rng.GameRng;

import java.util.List;

/**
 * Choices of a simple bot: random among legal options, but never aiming at a
 * player it knows to be on its own side.
 */
public final class DecisionEngine {

    private DecisionEngine() {
        // Utility class - prevent instantiation
    }

    public static Zone chooseDestination(GameState state, Player player, GameRng rng) {
        return rng.pick(ActionValidator.reachableZones(state, player));
    }

    /**
     * Pick an attack target in range, preferring revealed enemies.
     */
    public static Player chooseAttackTarget(GameState state, Player attacker, GameRng rng) {
        List<Player> targets = ActionValidator.legalAttackTargets(state, attacker).stream()
                .filter(t -> !isKnownAlly(attacker, t))
                .toList();
        List<Player> enemies = targets.stream()
                .filter(t -> t.isRevealed() && isEnemy(attacker, t))
                .toList();
        return rng.pick(enemies.isEmpty() ? targets : enemies);
    }

    /**
     * Any living player other than the chooser, avoiding known allies.
     */
    public static Player chooseOtherPlayer(GameState state, Player chooser, GameRng rng) {
        List<Player> others = state.livingPlayers().stream()
                .filter(p -> p != chooser)
                .toList();
        List<Player> preferred = others.stream()
                .filter(p -> !isKnownAlly(chooser, p))
                .toList();
        return rng.pick(preferred.isEmpty() ? others : preferred);
    }

    /**
     * Whether the character's active ability names exactly one target.
     */
    public static boolean abilityNeedsTarget(CharacterId id) {
        return switch (id) {
            case FRANKLIN, GEORGE, ELLEN, FUKA, CHARLES -> true;
            default -> false;
        };
    }

    public static boolean shouldReveal(Player player, double revealChance, GameRng rng) {
        if (player.isRevealed()) {
            return false;
        }
        return player.getHp() * 2 <= player.getHpMax() || rng.next() < revealChance;
    }

    private static boolean isKnownAlly(Player self, Player other) {
        return other.isRevealed()
                && self.getFaction() != Faction.NEUTRAL
                && self.getFaction() == other.getFaction();
    }

    private static boolean isEnemy(Player self, Player other) {
        Faction opponent = self.getFaction().opponent();
        return opponent == null || other.getFaction() == opponent;
    }
}
