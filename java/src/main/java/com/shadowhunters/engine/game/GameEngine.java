package com.shadowhunters.engine.game;

import com.shadowhunters.engine.ability.AbilityOutcome;
import com.shadowhunters.engine.ability.AbilityTriggerSystem;
import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.card.CardEffect;
import com.shadowhunters.engine.card.CardType;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.combat.CombatResolver;
import com.shadowhunters.engine.combat.RollOutcome;
import com.shadowhunters.engine.event.EventBus;
import com.shadowhunters.engine.event.GameEvent;
import com.shadowhunters.engine.event.GameEventListener;
import com.shadowhunters.engine.game.zones.Deck;
import com.shadowhunters.engine.game.zones.DeckLocator;
import com.shadowhunters.engine.game.zones.StandardBoard;
import com.shadowhunters.engine.game.zones.Zone;
import com.shadowhunters.engine.rng.DiceSource;
import com.shadowhunters.engine.win.WinConditionEvaluator;
import com.shadowhunters.engine.win.WinContext;
import com.shadowhunters.engine.win.WinResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for driving one game session.
 *
 * <p>Wires the combat resolver, the ability trigger system and the win
 * evaluator onto one event bus. Ability triggers are subscribed before the
 * win evaluator, so on-kill and on-death effects resolve before the winners
 * are decided. Listeners added through {@link #addListener} see every event
 * after both.
 *
 * <p>Player actions are validated first and refused with a reason if they are
 * not legal; a refused action changes nothing. Not thread-safe.
 */
public class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final GameState state;
    private final EventBus bus;
    private final DiceSource dice;
    private final DeckLocator locator;
    private final CombatResolver combat;
    private final AbilityTriggerSystem abilities;
    private final WinConditionEvaluator wins;

    /**
     * Engine on the standard board, rolling dice from the session's RNG.
     */
    public GameEngine(GameState state) {
        this(state, state.getRng(), new StandardBoard(state.getDecks()));
    }

    public GameEngine(GameState state, DiceSource dice, DeckLocator locator) {
        this.state = state;
        this.dice = dice;
        this.locator = locator;
        this.bus = new EventBus();
        this.combat = new CombatResolver(bus, dice);
        this.abilities = new AbilityTriggerSystem(state, bus, combat);
        this.wins = new WinConditionEvaluator(state);
        bus.subscribe(abilities);
        bus.subscribe(wins);
    }

    // ==================== SESSION ====================

    /**
     * Register every passive ability and hand the first turn to the first
     * living player.
     *
     * @throws GameStateException if the game already started or nobody is alive
     */
    public void startGame() throws GameStateException {
        for (Player player : state.getPlayers()) {
            abilities.register(player);
        }
        TurnTransition first = TurnManager.beginGame(state);
        log.info("Game started with {} players", state.getPlayers().size());
        bus.publish(new GameEvent.TurnStarted(first.player(), first.turnNumber()));
    }

    public void addListener(GameEventListener listener) {
        bus.subscribe(listener);
    }

    public void removeListener(GameEventListener listener) {
        bus.unsubscribe(listener);
    }

    public GameSnapshot snapshot() {
        return GameSnapshot.of(state);
    }

    public GameState getState() {
        return state;
    }

    public DeckLocator getLocator() {
        return locator;
    }

    // ==================== PLAYER ACTIONS ====================

    /**
     * Roll a six-sided and a four-sided die for movement.
     */
    public ActionResult rollMovement(Player player) {
        ValidationResult check = ActionValidator.canRollMovement(state, player);
        if (!check.valid()) {
            return ActionResult.rejected(check);
        }
        int roll = dice.roll(CombatResolver.MAJOR_DIE) + dice.roll(CombatResolver.MINOR_DIE);
        state.recordMovementRoll(roll);
        log.debug("{} rolled {} for movement", player, roll);
        return ActionResult.ok("rolled " + roll, roll);
    }

    public ActionResult move(Player player, Zone destination) {
        ValidationResult check = ActionValidator.canMove(state, player, destination);
        if (!check.valid()) {
            return ActionResult.rejected(check);
        }
        player.setZone(destination);
        state.markMoved();
        log.debug("{} moved to {}", player, destination.getDisplayName());
        return ActionResult.ok("moved to " + destination.getDisplayName());
    }

    /**
     * Draw from the deck of the player's zone and resolve the card.
     *
     * @param target receiver of a vision card, or the victim of a damaging
     *               instant; ignored for other cards
     */
    public ActionResult drawCard(Player player, Player target) {
        ValidationResult check = ActionValidator.canDraw(state, player, locator);
        if (!check.valid()) {
            return ActionResult.rejected(check);
        }
        Deck deck = locator.deckAt(player.getZone()).orElseThrow();
        if (deck.getColor() == DeckColor.VISION && !isVisionReceiver(player, target)) {
            return ActionResult.fail("a vision card must be given to another living player");
        }
        Optional<Card> drawn = deck.draw();
        if (drawn.isEmpty()) {
            return ActionResult.fail("the " + deck.getColor().getJsonValue() + " deck is exhausted");
        }
        state.markDrawn();
        Card card = drawn.get();
        log.debug("{} drew {}", player, card);
        return resolveCard(player, card, target);
    }

    public ActionResult attack(Player attacker, Player target) {
        ValidationResult check = ActionValidator.canAttackTarget(state, attacker, target);
        if (!check.valid()) {
            return ActionResult.rejected(check);
        }
        state.markAttacked();
        RollOutcome roll = combat.attack(attacker, target);
        if (roll.missed()) {
            return ActionResult.ok("missed " + target.getName(), 0);
        }
        return ActionResult.ok("hit " + target.getName() + " for " + roll.damage(), roll.damage());
    }

    /**
     * End the current player's turn, whatever phase it is in.
     *
     * @throws GameStateException if nobody is alive to take the next turn
     */
    public ActionResult endTurn(Player player) throws GameStateException {
        ValidationResult check = ActionValidator.canEndTurn(state, player);
        if (!check.valid()) {
            return ActionResult.rejected(check);
        }
        TurnTransition next = advanceToNextTurn();
        return ActionResult.ok(next.player().getName() + " to play", next.turnNumber());
    }

    /**
     * Reveal the player's character voluntarily.
     */
    public ActionResult reveal(Player player) {
        if (player == null) {
            log.warn("Reveal requested for a missing player");
            return ActionResult.fail("no such player");
        }
        if (state.isGameOver()) {
            return ActionResult.fail("the game is over");
        }
        if (!player.reveal()) {
            return ActionResult.fail("already revealed");
        }
        log.info("{} revealed as {}", player, player.getCharacter().getName());
        bus.publish(new GameEvent.CharacterRevealed(player, false));
        return ActionResult.ok("revealed as " + player.getCharacter().getName());
    }

    // ==================== RULE ENTRY POINTS ====================

    public RollOutcome rollAttack(Player attacker, Player target) {
        return combat.rollAttack(attacker, target);
    }

    public int applyDamage(Player attacker, Player target, int amount) {
        return combat.applyDamage(attacker, target, amount);
    }

    public boolean processDeath(Player victim, Player killer) {
        return combat.processDeath(victim, killer);
    }

    public boolean registerPlayerAbility(Player player) {
        return abilities.register(player);
    }

    public boolean unregisterPlayerAbility(Player player) {
        return abilities.unregister(player);
    }

    public ValidationResult canActivateAbility(Player player) {
        if (state.isGameOver()) {
            return ValidationResult.fail("the game is over");
        }
        return abilities.canActivate(player);
    }

    /**
     * Use the player's active ability. Equipment and movement may change, so
     * a successful activation is followed by a win check.
     */
    public AbilityOutcome activateAbility(Player player, List<Player> targets) {
        if (state.isGameOver()) {
            return AbilityOutcome.failure("the game is over");
        }
        AbilityOutcome outcome = abilities.activate(player, targets);
        if (outcome.success()) {
            checkWinConditions(WinContext.none());
        }
        return outcome;
    }

    /**
     * Evaluate win conditions; a game-over result is stored on the session.
     */
    public WinResult checkWinConditions(WinContext context) {
        if (state.isGameOver()) {
            return state.getResult();
        }
        WinResult result = wins.checkWinConditions(context);
        if (result.gameOver()) {
            state.finish(result);
        }
        return result;
    }

    /**
     * Advance one phase. Announces the turn when a new one starts.
     *
     * @throws GameStateException if the game is over or nobody is alive
     */
    public TurnTransition advancePhase() throws GameStateException {
        if (state.isGameOver()) {
            throw new GameStateException("The game is over");
        }
        TurnTransition transition = TurnManager.advancePhase(state);
        if (transition.turnStarted()) {
            log.debug("Turn {}: {}", transition.turnNumber(), transition.player());
            bus.publish(new GameEvent.TurnStarted(transition.player(), transition.turnNumber()));
        }
        return transition;
    }

    /**
     * Advance phases until the next turn starts. Used by {@link #endTurn} and
     * to move past a player who died during their own turn.
     */
    public TurnTransition advanceToNextTurn() throws GameStateException {
        TurnTransition transition = advancePhase();
        while (!transition.turnStarted()) {
            transition = advancePhase();
        }
        return transition;
    }

    public WinConditionEvaluator getWinEvaluator() {
        return wins;
    }

    public AbilityTriggerSystem getAbilities() {
        return abilities;
    }

    public CombatResolver getCombat() {
        return combat;
    }

    // ==================== CARD RESOLUTION ====================

    private boolean isVisionReceiver(Player drawer, Player target) {
        return target != null && target != drawer && target.isAlive();
    }

    private ActionResult resolveCard(Player player, Card card, Player target) {
        if (card.getType() == CardType.EQUIPMENT) {
            player.equip(card);
            checkWinConditions(WinContext.none());
            return ActionResult.ok("equipped " + card.getName());
        }

        CardEffect effect = card.getEffect();
        ActionResult result;
        if (card.getType() == CardType.VISION) {
            result = resolveVision(card, effect, target);
        } else {
            result = resolveInstant(player, card, effect, target);
        }
        state.discard(card);
        return result;
    }

    private ActionResult resolveVision(Card card, CardEffect effect, Player target) {
        if (effect == null || !effect.matchesFaction(target.getFaction())) {
            return ActionResult.ok(card.getName() + ": nothing happens to " + target.getName());
        }
        return switch (effect.getKind()) {
            case HEAL -> {
                int healed = target.heal(effect.getValue());
                yield ActionResult.ok(card.getName() + ": " + target.getName() + " heals " + healed, healed);
            }
            case DAMAGE -> {
                int dealt = combat.applyDamage(null, target, effect.getValue());
                yield ActionResult.ok(card.getName() + ": " + target.getName() + " takes " + dealt, dealt);
            }
            default -> ActionResult.ok(card.getName() + ": " + target.getName() + " is affected");
        };
    }

    private ActionResult resolveInstant(Player player, Card card, CardEffect effect, Player target) {
        if (effect == null) {
            return ActionResult.ok(card.getName() + " has no effect");
        }
        if (effect.getFaction() != null && !effect.appliesTo(player.getFaction(), player.isRevealed())) {
            return ActionResult.ok(card.getName() + " has no effect on " + player.getName());
        }
        return switch (effect.getKind()) {
            case HEAL -> {
                int healed = player.heal(effect.getValue());
                yield ActionResult.ok(card.getName() + ": healed " + healed, healed);
            }
            case DAMAGE -> {
                Player victim = target != null && target.isAlive() ? target : player;
                int dealt = combat.applyDamage(null, victim, effect.getValue());
                yield ActionResult.ok(card.getName() + ": " + victim.getName() + " takes " + dealt, dealt);
            }
            case DAMAGE_IMMUNITY -> {
                player.setFlag(PlayerFlag.DAMAGE_IMMUNE);
                yield ActionResult.ok(card.getName() + ": immune to damage until next turn");
            }
            default -> ActionResult.ok(card.getName() + " has no effect");
        };
    }
}
