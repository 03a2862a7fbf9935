package com.shadowhunters.engine.ability;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.character.CharacterId;
import com.shadowhunters.engine.combat.CombatResolver;
import com.shadowhunters.engine.event.EventBus;
import com.shadowhunters.engine.event.GameEvent;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.zones.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Passive effects, one per character, as printed on the character cards.
 */
class PassiveEffects {
    private static final Logger log = LoggerFactory.getLogger(PassiveEffects.class);

    static final int CATHERINE_HEAL = 1;
    static final int VAMPIRE_HEAL = 2;
    static final int ULTRA_SOUL_DAMAGE = 3;
    static final int BRYAN_REVEAL_MAX_HP = 12;

    private final GameState state;
    private final EventBus bus;
    private final CombatResolver combat;

    PassiveEffects(GameState state, EventBus bus, CombatResolver combat) {
        this.state = state;
        this.bus = bus;
        this.combat = combat;
    }

    /**
     * Apply the holder's passive effect.
     * @return a description of what happened
     */
    String apply(CharacterId id, Player holder, TriggerContext context) {
        return switch (id) {
            case CATHERINE -> stigmata(holder);
            case VAMPIRE -> suckBlood(holder, context);
            case WEREWOLF -> counterattack(holder, context);
            case ULTRA_SOUL -> murderRay(holder);
            case BOB -> robbery(holder, context);
            case BRYAN -> oopsRevealOnSmallKill(holder, context);
            case DANIEL -> scream(holder, context);
            case EMI, FRANKLIN, GEORGE, ELLEN, FUKA, GREGOR,
                 VALKYRIE, UNKNOWN, WIGHT,
                 ALLIE, AGNES, CHARLES, DAVID -> unhandled(holder, context);
        };
    }

    private String stigmata(Player holder) {
        int healed = holder.heal(CATHERINE_HEAL);
        return "healed " + healed;
    }

    private String suckBlood(Player holder, TriggerContext context) {
        if (!context.fromAttack() || context.amount() <= 0) {
            return "no attack damage";
        }
        int healed = holder.heal(VAMPIRE_HEAL);
        return "healed " + healed + " after dealing " + context.amount();
    }

    private String counterattack(Player holder, TriggerContext context) {
        Player attacker = context.other();
        if (!context.fromAttack() || attacker == null || attacker == holder || !attacker.isAlive()) {
            return "nothing to counter";
        }
        int damage = combat.attack(holder, attacker).damage();
        return "countered " + attacker.getName() + " for " + damage;
    }

    private String murderRay(Player holder) {
        Player target = state.getPlayers().stream()
                .filter(p -> p != holder && p.isAlive() && p.getZone() == Zone.UNDERWORLD_GATE)
                .findFirst()
                .orElse(null);
        if (target == null) {
            return "nobody at the " + Zone.UNDERWORLD_GATE.getDisplayName();
        }
        int dealt = combat.applyDamage(holder, target, ULTRA_SOUL_DAMAGE);
        return "dealt " + dealt + " to " + target.getName();
    }

    private String robbery(Player holder, TriggerContext context) {
        Player victim = context.other();
        if (victim == null) {
            return "no victim";
        }
        List<Card> loot = victim.removeAllEquipment();
        loot.forEach(holder::equip);
        return "took " + loot.size() + " equipment card(s)";
    }

    private String oopsRevealOnSmallKill(Player holder, TriggerContext context) {
        Player victim = context.other();
        if (victim == null || victim.getHpMax() > BRYAN_REVEAL_MAX_HP) {
            return "no reveal needed";
        }
        return forceReveal(holder) ? "forced to reveal" : "already revealed";
    }

    private String scream(Player holder, TriggerContext context) {
        if (context.other() == holder) {
            return "own death";
        }
        return forceReveal(holder) ? "forced to reveal" : "already revealed";
    }

    private String unhandled(Player holder, TriggerContext context) {
        log.warn("{} ({}) has no passive effect for {}", holder, holder.getCharacter().getName(),
                context.trigger().getKey());
        return "no effect";
    }

    private boolean forceReveal(Player holder) {
        if (!holder.reveal()) {
            return false;
        }
        bus.publish(new GameEvent.CharacterRevealed(holder, true));
        return true;
    }
}
