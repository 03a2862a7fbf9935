package com.shadowhunters.engine.ability;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.character.CharacterId;
import com.shadowhunters.engine.combat.CombatResolver;
import com.shadowhunters.engine.combat.RollOutcome;
import com.shadowhunters.engine.game.ActionValidator;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Phase;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.PlayerFlag;
import com.shadowhunters.engine.game.zones.Deck;
import com.shadowhunters.engine.game.zones.Zone;

import java.util.List;
import java.util.Optional;

/**
 * Active abilities, one per character. Each effect checks its own target
 * constraints before changing anything.
 */
class ActiveEffects {
    static final int FUKA_DAMAGE_MARK = 7;
    static final int CHARLES_SELF_DAMAGE = 2;

    private final GameState state;
    private final CombatResolver combat;

    ActiveEffects(GameState state, CombatResolver combat) {
        this.state = state;
        this.combat = combat;
    }

    AbilityOutcome apply(CharacterId id, Player holder, List<Player> targets) {
        return switch (id) {
            case EMI -> teleport(holder, targets);
            case FRANKLIN -> lightning(holder, targets, 6);
            case GEORGE -> lightning(holder, targets, 4);
            case ELLEN -> forbiddenCurse(holder, targets);
            case FUKA -> dynamiteNurse(holder, targets);
            case GREGOR -> ghostlyBarrier(holder, targets);
            case WIGHT -> multiplication(holder, targets);
            case ALLIE -> mothersLove(holder, targets);
            case AGNES -> capriccio(holder, targets);
            case CHARLES -> bloodyFeast(holder, targets);
            case DAVID -> graveDigger(holder, targets);
            case VALKYRIE, VAMPIRE, WEREWOLF, ULTRA_SOUL, UNKNOWN,
                 BOB, BRYAN, CATHERINE, DANIEL -> unhandled(holder);
        };
    }

    private AbilityOutcome teleport(Player holder, List<Player> targets) {
        if (!targets.isEmpty()) {
            return expects(0);
        }
        if (state.getCurrentPlayer() != holder || state.getPhase() != Phase.MOVEMENT || state.hasMovedThisTurn()) {
            return AbilityOutcome.failure("can only teleport instead of moving");
        }
        Zone from = holder.getZone();
        Zone to = from == null ? Zone.HERMITS_CABIN : from.next();
        holder.setZone(to);
        state.markMoved();
        return AbilityOutcome.success("teleported to " + to.getDisplayName(), to.boardIndex());
    }

    private AbilityOutcome lightning(Player holder, List<Player> targets, int sides) {
        Optional<Player> target = singleOtherTarget(holder, targets);
        if (target.isEmpty()) {
            return expectsOther();
        }
        int roll = combat.getDice().roll(sides);
        int dealt = combat.applyDamage(holder, target.get(), roll);
        return AbilityOutcome.success("rolled " + roll + ", dealt " + dealt + " to " + target.get().getName(), dealt);
    }

    private AbilityOutcome forbiddenCurse(Player holder, List<Player> targets) {
        Optional<Player> target = singleOtherTarget(holder, targets);
        if (target.isEmpty()) {
            return expectsOther();
        }
        target.get().disableAbility();
        return AbilityOutcome.success(target.get().getName() + "'s ability is disabled for the game", 0);
    }

    private AbilityOutcome dynamiteNurse(Player holder, List<Player> targets) {
        Optional<Player> target = singleOtherTarget(holder, targets);
        if (target.isEmpty()) {
            return expectsOther();
        }
        Player victim = target.get();
        int newHp = Math.max(0, victim.getHpMax() - FUKA_DAMAGE_MARK);
        if (newHp < victim.getHp()) {
            combat.applyDamage(holder, victim, victim.getHp() - newHp);
        } else {
            victim.setHp(newHp);
        }
        return AbilityOutcome.success(victim.getName() + " now at " + victim.getHp() + " hp", victim.getHp());
    }

    private AbilityOutcome ghostlyBarrier(Player holder, List<Player> targets) {
        if (!targets.isEmpty()) {
            return expects(0);
        }
        holder.setFlag(PlayerFlag.SHIELDED);
        return AbilityOutcome.success("shielded until next turn", 0);
    }

    private AbilityOutcome multiplication(Player holder, List<Player> targets) {
        if (!targets.isEmpty()) {
            return expects(0);
        }
        int dead = state.deadCount();
        if (dead == 0) {
            return AbilityOutcome.failure("no dead characters yet");
        }
        holder.addExtraTurns(dead);
        return AbilityOutcome.success("gains " + dead + " extra turn(s)", dead);
    }

    private AbilityOutcome mothersLove(Player holder, List<Player> targets) {
        if (!targets.isEmpty()) {
            return expects(0);
        }
        int healed = holder.heal(holder.getHpMax());
        return AbilityOutcome.success("fully healed", healed);
    }

    private AbilityOutcome capriccio(Player holder, List<Player> targets) {
        if (!targets.isEmpty()) {
            return expects(0);
        }
        holder.setFlag(PlayerFlag.DIRECTION_SWAPPED);
        return AbilityOutcome.success("now follows the left neighbour", 0);
    }

    private AbilityOutcome bloodyFeast(Player holder, List<Player> targets) {
        Optional<Player> target = singleOtherTarget(holder, targets);
        if (target.isEmpty()) {
            return expectsOther();
        }
        if (state.getCurrentPlayer() != holder || !state.hasAttackedThisTurn()) {
            return AbilityOutcome.failure("must attack before feasting");
        }
        if (!ActionValidator.legalAttackTargets(state, holder).contains(target.get())) {
            return AbilityOutcome.failure("target is not in range");
        }
        combat.applyDamage(null, holder, CHARLES_SELF_DAMAGE);
        if (!holder.isAlive()) {
            return AbilityOutcome.success("died paying for the feast", 0);
        }
        RollOutcome outcome = combat.attack(holder, target.get());
        return AbilityOutcome.success("attacked again for " + outcome.damage(), outcome.damage());
    }

    private AbilityOutcome graveDigger(Player holder, List<Player> targets) {
        if (!targets.isEmpty()) {
            return expects(0);
        }
        for (DeckColor color : List.of(DeckColor.WHITE, DeckColor.BLACK)) {
            Deck deck = state.getDeck(color);
            if (deck == null) {
                continue;
            }
            Optional<Card> card = deck.takeLastDiscardedEquipment();
            if (card.isPresent()) {
                holder.equip(card.get());
                return AbilityOutcome.success("dug up " + card.get().getName(), 1);
            }
        }
        return AbilityOutcome.failure("no equipment in the discard piles");
    }

    private AbilityOutcome unhandled(Player holder) {
        return AbilityOutcome.failure(holder.getCharacter().getName() + " has no active ability");
    }

    private static Optional<Player> singleOtherTarget(Player holder, List<Player> targets) {
        if (targets.size() != 1) {
            return Optional.empty();
        }
        Player target = targets.get(0);
        if (target == null || target == holder || !target.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(target);
    }

    private static AbilityOutcome expects(int count) {
        return AbilityOutcome.failure("expects exactly " + count + " target(s)");
    }

    private static AbilityOutcome expectsOther() {
        return AbilityOutcome.failure("expects exactly 1 living target other than yourself");
    }
}
