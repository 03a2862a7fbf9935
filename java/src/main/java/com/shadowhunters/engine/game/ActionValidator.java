package com.shadowhunters.engine.game;

import com.shadowhunters.engine.game.zones.Deck;
import com.shadowhunters.engine.game.zones.DeckLocator;
import com.shadowhunters.engine.game.zones.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Phase, zone and resource gating for player actions.
 * Every check is read-only.
 */
public final class ActionValidator {
    private static final Logger log = LoggerFactory.getLogger(ActionValidator.class);

    private ActionValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validate an action by its identifier.
     *
     * @param destination target zone of a move, ignored by other actions
     */
    public static ValidationResult validate(GameState state, Player player, String actionId,
                                            DeckLocator locator, Zone destination) {
        Optional<ActionKind> kind = ActionKind.fromId(actionId);
        if (kind.isEmpty()) {
            log.warn("Rejecting unknown action '{}'", actionId);
            return ValidationResult.fail("unknown action: " + actionId);
        }
        return switch (kind.get()) {
            case ROLL_MOVEMENT -> canRollMovement(state, player);
            case MOVE -> canMove(state, player, destination);
            case DRAW_CARD -> canDraw(state, player, locator);
            case ATTACK -> canAttack(state, player);
            case END_TURN -> canEndTurn(state, player);
        };
    }

    public static ValidationResult canRollMovement(GameState state, Player player) {
        ValidationResult turn = checkTurn(state, player);
        if (!turn.valid()) {
            return turn;
        }
        if (state.getPhase() != Phase.MOVEMENT) {
            return ValidationResult.fail("can only roll for movement in the movement phase");
        }
        if (state.hasRolledThisTurn()) {
            return ValidationResult.fail("already rolled this turn");
        }
        return ValidationResult.ok();
    }

    public static ValidationResult canMove(GameState state, Player player, Zone destination) {
        ValidationResult turn = checkTurn(state, player);
        if (!turn.valid()) {
            return turn;
        }
        if (state.getPhase() != Phase.MOVEMENT) {
            return ValidationResult.fail("can only move in the movement phase");
        }
        if (!state.hasRolledThisTurn()) {
            return ValidationResult.fail("roll the dice before moving");
        }
        if (state.hasMovedThisTurn()) {
            return ValidationResult.fail("already moved this turn");
        }
        if (destination == null) {
            return ValidationResult.fail("no destination given");
        }
        Zone from = player.getZone();
        if (destination == from) {
            return ValidationResult.fail("must move to a different zone");
        }
        if (from != null && from.distanceTo(destination) > state.getMovementRoll()) {
            return ValidationResult.fail(destination.getDisplayName() + " is out of reach (rolled "
                    + state.getMovementRoll() + ")");
        }
        return ValidationResult.ok();
    }

    public static ValidationResult canDraw(GameState state, Player player, DeckLocator locator) {
        ValidationResult turn = checkTurn(state, player);
        if (!turn.valid()) {
            return turn;
        }
        if (state.getPhase() != Phase.ACTION) {
            return ValidationResult.fail("can only draw in the action phase");
        }
        if (state.hasDrawnThisTurn()) {
            return ValidationResult.fail("already drew a card this turn");
        }
        Optional<Deck> deck = locator.deckAt(player.getZone());
        if (deck.isEmpty()) {
            return ValidationResult.fail("no deck in this zone");
        }
        if (!deck.get().hasDrawableCard()) {
            return ValidationResult.fail("the " + deck.get().getColor().getJsonValue() + " deck is exhausted");
        }
        return ValidationResult.ok();
    }

    public static ValidationResult canAttack(GameState state, Player player) {
        ValidationResult turn = checkTurn(state, player);
        if (!turn.valid()) {
            return turn;
        }
        if (state.getPhase() != Phase.ACTION) {
            return ValidationResult.fail("can only attack in the action phase");
        }
        if (state.hasAttackedThisTurn()) {
            return ValidationResult.fail("already attacked this turn");
        }
        if (legalAttackTargets(state, player).isEmpty()) {
            return ValidationResult.fail("no target in range");
        }
        return ValidationResult.ok();
    }

    /**
     * {@link #canAttack} plus a check that this particular target is in range.
     */
    public static ValidationResult canAttackTarget(GameState state, Player attacker, Player target) {
        ValidationResult attack = canAttack(state, attacker);
        if (!attack.valid()) {
            return attack;
        }
        if (target == null || !legalAttackTargets(state, attacker).contains(target)) {
            return ValidationResult.fail("target is not in range");
        }
        return ValidationResult.ok();
    }

    /**
     * Ending the turn is legal in every phase; it is how a player passes.
     */
    public static ValidationResult canEndTurn(GameState state, Player player) {
        return checkTurn(state, player);
    }

    /**
     * Living players other than the attacker in the attacker's area.
     */
    public static List<Player> legalAttackTargets(GameState state, Player attacker) {
        Zone zone = attacker.getZone();
        if (zone == null) {
            return List.of();
        }
        return state.getPlayers().stream()
                .filter(p -> p != attacker)
                .filter(Player::isAlive)
                .filter(p -> zone.sharesAreaWith(p.getZone()))
                .toList();
    }

    /**
     * Zones a move may reach with the current roll.
     */
    public static List<Zone> reachableZones(GameState state, Player player) {
        Zone from = player.getZone();
        return Arrays.stream(Zone.values())
                .filter(z -> z != from)
                .filter(z -> from == null || from.distanceTo(z) <= state.getMovementRoll())
                .toList();
    }

    private static ValidationResult checkTurn(GameState state, Player player) {
        if (player == null) {
            return ValidationResult.fail("no such player");
        }
        if (!state.isStarted()) {
            return ValidationResult.fail("the game has not started");
        }
        if (state.isGameOver()) {
            return ValidationResult.fail("the game is over");
        }
        if (state.getCurrentPlayer() != player) {
            return ValidationResult.fail("not your turn");
        }
        if (!player.isAlive()) {
            return ValidationResult.fail("dead players cannot act");
        }
        return ValidationResult.ok();
    }
}
