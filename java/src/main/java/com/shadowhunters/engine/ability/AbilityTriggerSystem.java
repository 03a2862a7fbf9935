package com.shadowhunters.engine.ability;

import com.shadowhunters.engine.character.AbilityDeclaration;
import com.shadowhunters.engine.character.AbilityKind;
import com.shadowhunters.engine.character.CharacterId;
import com.shadowhunters.engine.character.TriggerKey;
import com.shadowhunters.engine.character.UsagePolicy;
import com.shadowhunters.engine.combat.CombatResolver;
import com.shadowhunters.engine.event.EventBus;
import com.shadowhunters.engine.event.GameEvent;
import com.shadowhunters.engine.event.GameEventListener;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of passive abilities and dispatcher for both passive triggers and
 * active activations.
 *
 * <p>Within one death the victim's {@code on_death} fires first, the victim
 * is then unregistered, and only then do the killer's {@code on_kill} and the
 * {@code on_character_death} broadcast run.
 */
public class AbilityTriggerSystem implements GameEventListener {
    private static final Logger log = LoggerFactory.getLogger(AbilityTriggerSystem.class);

    private final EventBus bus;
    private final PassiveEffects passives;
    private final ActiveEffects actives;
    private final Map<Integer, AbilityRegistration> registry = new LinkedHashMap<>();

    public AbilityTriggerSystem(GameState state, EventBus bus, CombatResolver combat) {
        this.bus = bus;
        this.passives = new PassiveEffects(state, bus, combat);
        this.actives = new ActiveEffects(state, combat);
    }

    // ==================== REGISTRY ====================

    /**
     * Register the player's passive ability.
     * Active and static abilities are not registered; an unknown trigger key
     * is rejected.
     *
     * @return true if the player is now registered
     */
    public boolean register(Player player) {
        if (player == null) {
            log.warn("Cannot register ability of a missing player");
            return false;
        }
        AbilityDeclaration ability = player.getCharacter().getAbility();
        if (ability.getKind() != AbilityKind.PASSIVE) {
            return false;
        }
        Optional<TriggerKey> trigger = TriggerKey.fromKey(ability.getTrigger());
        if (trigger.isEmpty() || !trigger.get().isPassive()) {
            log.warn("Rejecting passive ability of {} ({}): unknown trigger '{}'",
                    player, player.getCharacter().getName(), ability.getTrigger());
            return false;
        }
        registry.put(player.getId(), new AbilityRegistration(
                player, trigger.get(), ability.getUsage(), ability.isRequiresReveal()));
        return true;
    }

    /**
     * @return true if the player was registered
     */
    public boolean unregister(Player player) {
        if (player == null) {
            return false;
        }
        return registry.remove(player.getId()) != null;
    }

    public boolean isRegistered(int playerId) {
        return registry.containsKey(playerId);
    }

    public Optional<AbilityRegistration> registration(int playerId) {
        return Optional.ofNullable(registry.get(playerId));
    }

    // ==================== EVENT HANDLING ====================

    @Override
    public void onEvent(GameEvent event) {
        if (event instanceof GameEvent.DamageDealt damage) {
            onDamageDealt(damage);
        } else if (event instanceof GameEvent.TurnStarted turn) {
            fire(turn.player(), TriggerKey.ON_TURN_START, TriggerContext.turnStart(turn.turnNumber()));
        } else if (event instanceof GameEvent.PlayerDied died) {
            onPlayerDied(died.victim(), died.killer());
        } else if (event instanceof GameEvent.CharacterRevealed revealed) {
            fire(revealed.player(), TriggerKey.ON_REVEAL, TriggerContext.of(TriggerKey.ON_REVEAL, null));
        }
    }

    private void onDamageDealt(GameEvent.DamageDealt damage) {
        Player attacker = damage.attacker();
        Player victim = damage.victim();
        if (victim != null) {
            fire(victim, TriggerKey.ON_ATTACKED,
                    TriggerContext.damage(TriggerKey.ON_ATTACKED, attacker, damage.amount(), damage.fromAttack()));
        }
        if (attacker != null) {
            fire(attacker, TriggerKey.ON_ATTACK,
                    TriggerContext.damage(TriggerKey.ON_ATTACK, victim, damage.amount(), damage.fromAttack()));
        }
    }

    private void onPlayerDied(Player victim, Player killer) {
        fire(victim, TriggerKey.ON_DEATH, TriggerContext.of(TriggerKey.ON_DEATH, killer));
        unregister(victim);
        if (killer != null && killer != victim) {
            fire(killer, TriggerKey.ON_KILL, TriggerContext.of(TriggerKey.ON_KILL, victim));
        }
        List<AbilityRegistration> listeners = new ArrayList<>();
        for (AbilityRegistration registration : registry.values()) {
            if (registration.trigger() == TriggerKey.ON_CHARACTER_DEATH && registration.player() != victim) {
                listeners.add(registration);
            }
        }
        for (AbilityRegistration registration : listeners) {
            fire(registration.player(), TriggerKey.ON_CHARACTER_DEATH,
                    TriggerContext.of(TriggerKey.ON_CHARACTER_DEATH, victim));
        }
    }

    private void fire(Player player, TriggerKey trigger, TriggerContext context) {
        if (player == null) {
            return;
        }
        AbilityRegistration registration = registry.get(player.getId());
        if (registration == null || registration.trigger() != trigger) {
            return;
        }
        // The victim's own on_death is the only trigger a fallen player answers
        if (trigger != TriggerKey.ON_DEATH && !player.isStanding()) {
            return;
        }
        if (player.isAbilityDisabled()) {
            return;
        }
        if (registration.requiresReveal() && !player.isRevealed()) {
            return;
        }
        if (registration.usage() == UsagePolicy.ONCE) {
            if (player.isAbilityUsed()) {
                return;
            }
            player.markAbilityUsed();
        }
        execute(player, context);
    }

    /**
     * Run the holder's passive effect and announce it.
     */
    public void execute(Player player, TriggerContext context) {
        if (player == null) {
            log.warn("Passive trigger {} with no player", context.trigger().getKey());
            return;
        }
        Optional<CharacterId> id = player.getCharacterId();
        if (id.isEmpty()) {
            log.warn("No ability rules for character '{}'", player.getCharacter().getKey());
            return;
        }
        String description = passives.apply(id.get(), player, context);
        log.debug("{} {}: {}", player, context.trigger().getKey(), description);
        bus.publish(new GameEvent.AbilityTriggered(player, context.trigger(), description));
    }

    // ==================== ACTIVE ABILITIES ====================

    /**
     * Check, without side effects, whether the player may use their active ability now.
     */
    public ValidationResult canActivate(Player player) {
        if (player == null) {
            return ValidationResult.fail("no such player");
        }
        if (!player.isAlive()) {
            return ValidationResult.fail("dead players cannot use abilities");
        }
        AbilityDeclaration ability = player.getCharacter().getAbility();
        if (ability.getKind() != AbilityKind.ACTIVE) {
            return ValidationResult.fail("ability is not an active ability");
        }
        if (player.isAbilityDisabled()) {
            return ValidationResult.fail("ability is disabled");
        }
        if (ability.getUsage() == UsagePolicy.ONCE && player.isAbilityUsed()) {
            return ValidationResult.fail("ability already used this game");
        }
        if (ability.isRequiresReveal() && !player.isRevealed()) {
            return ValidationResult.fail("must reveal before using this ability");
        }
        return ValidationResult.ok();
    }

    /**
     * Use the player's active ability on the given targets.
     * A successful once-per-game ability is spent for the rest of the game.
     */
    public AbilityOutcome activate(Player player, List<Player> targets) {
        ValidationResult verdict = canActivate(player);
        if (!verdict.valid()) {
            return fail(player, verdict.reason());
        }
        Optional<CharacterId> id = player.getCharacterId();
        if (id.isEmpty()) {
            log.warn("No ability rules for character '{}'", player.getCharacter().getKey());
            return fail(player, "no rules for this character");
        }

        AbilityOutcome outcome = actives.apply(id.get(), player, targets == null ? List.of() : targets);
        if (!outcome.success()) {
            return fail(player, outcome.description());
        }
        if (player.getCharacter().getAbility().getUsage() == UsagePolicy.ONCE) {
            player.markAbilityUsed();
        }
        log.debug("{} used {}: {}", player, player.getCharacter().getAbility().getName(), outcome.description());
        bus.publish(new GameEvent.AbilityActivated(player, outcome.description(), outcome.value()));
        return outcome;
    }

    private AbilityOutcome fail(Player player, String reason) {
        if (player != null) {
            bus.publish(new GameEvent.AbilityFailed(player, reason));
        }
        return AbilityOutcome.failure(reason);
    }
}
