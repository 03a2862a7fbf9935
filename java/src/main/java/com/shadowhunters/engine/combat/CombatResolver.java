package com.shadowhunters.engine.combat;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.card.EffectKind;
import com.shadowhunters.engine.character.CharacterId;
import com.shadowhunters.engine.event.EventBus;
import com.shadowhunters.engine.event.GameEvent;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.PlayerFlag;
import com.shadowhunters.engine.rng.DiceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Attack rolls, damage and death.
 */
public class CombatResolver {
    private static final Logger log = LoggerFactory.getLogger(CombatResolver.class);

    public static final int MAJOR_DIE = 6;
    public static final int MINOR_DIE = 4;
    public static final int MIN_HIT_DAMAGE = 1;

    private final EventBus bus;
    private final DiceSource dice;

    public CombatResolver(EventBus bus, DiceSource dice) {
        this.bus = bus;
        this.dice = dice;
    }

    /**
     * Roll an attack. Both dice are always rolled; equal dice miss unless the
     * attacker counts the four-sided die alone.
     */
    public RollOutcome rollAttack(Player attacker, Player target) {
        if (attacker == null || target == null) {
            log.warn("Attack roll with missing player (attacker={}, target={})", attacker, target);
            return RollOutcome.none();
        }
        if (!target.isStanding()) {
            return RollOutcome.none();
        }

        int six = dice.roll(MAJOR_DIE);
        int four = dice.roll(MINOR_DIE);
        boolean singleDie = isNoMiss(attacker);

        int base;
        boolean missed;
        if (singleDie) {
            base = four;
            missed = false;
        } else {
            base = Math.abs(six - four);
            missed = six == four;
        }

        int damage = 0;
        if (!missed) {
            int modified = base
                    + attacker.equipmentBonus(EffectKind.ATTACK_BONUS)
                    - target.equipmentBonus(EffectKind.DEFENSE_BONUS);
            damage = Math.max(MIN_HIT_DAMAGE, modified);
        }
        return new RollOutcome(six, four, singleDie, missed, base, damage);
    }

    /**
     * Roll and apply an attack.
     * @return the roll; its damage is what the roll produced, not what a shield let through
     */
    public RollOutcome attack(Player attacker, Player target) {
        RollOutcome outcome = rollAttack(attacker, target);
        if (outcome.hits()) {
            applyDamage(attacker, target, outcome.damage(), true);
        }
        return outcome;
    }

    /**
     * Apply non-attack damage (cards, abilities, self-inflicted).
     * @return hit points actually lost
     */
    public int applyDamage(Player attacker, Player target, int amount) {
        return applyDamage(attacker, target, amount, false);
    }

    /**
     * Apply damage and process the target's death if it falls to zero.
     *
     * @param fromAttack true for damage from an attack roll, which is what
     *                   counterattacks respond to
     * @return hit points actually lost
     */
    public int applyDamage(Player attacker, Player target, int amount, boolean fromAttack) {
        if (target == null) {
            log.warn("Damage of {} with no target", amount);
            return 0;
        }
        if (!target.isAlive() || amount <= 0) {
            return 0;
        }
        if (target.hasFlag(PlayerFlag.DAMAGE_IMMUNE)) {
            log.debug("{} is immune, {} damage ignored", target, amount);
            return 0;
        }
        if (target.clearFlag(PlayerFlag.SHIELDED)) {
            log.debug("{}'s shield absorbed {} damage", target, amount);
            return 0;
        }

        int lost = target.loseHp(amount);
        bus.publish(new GameEvent.DamageDealt(attacker, target, lost, fromAttack));
        if (target.getHp() <= 0) {
            processDeath(target, attacker);
        }
        return lost;
    }

    /**
     * Kill a player.
     * Equipment stolen on the kill changes hands before {@code PlayerDied} is
     * published. A second call for the same victim does nothing.
     *
     * @return true if the victim died now
     */
    public boolean processDeath(Player victim, Player killer) {
        if (victim == null) {
            log.warn("Death processing with no victim");
            return false;
        }
        if (!victim.isAlive()) {
            return false;
        }

        boolean wasHidden = !victim.isRevealed();
        victim.markDead();
        log.debug("{} ({}) died, killer={}", victim, victim.getCharacter().getName(), killer);
        bus.publish(new GameEvent.CharacterRevealed(victim, wasHidden));

        if (killer != null && killer != victim && killer.isAlive() && canStealOnKill(killer)) {
            List<Card> loot = victim.removeAllEquipment();
            loot.forEach(killer::equip);
            log.debug("{} took {} equipment card(s) from {}", killer, loot.size(), victim);
        }

        bus.publish(new GameEvent.PlayerDied(victim, killer));
        return true;
    }

    private static boolean canStealOnKill(Player killer) {
        return killer.getEquipment().stream()
                .filter(c -> c.hasEffect(EffectKind.STEAL_EQUIPMENT_ON_KILL))
                .anyMatch(c -> c.getEffect().matchesFaction(killer.getFaction()));
    }

    /**
     * Whether the attacker counts only the four-sided die and never misses.
     */
    public boolean isNoMiss(Player attacker) {
        boolean valkyrie = attacker.is(CharacterId.VALKYRIE)
                && attacker.isRevealed()
                && !attacker.isAbilityDisabled();
        return valkyrie || !attacker.activeEquipment(EffectKind.FORCED_SINGLE_DIE).isEmpty();
    }

    public DiceSource getDice() {
        return dice;
    }
}
