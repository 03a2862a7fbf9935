package com.shadowhunters.engine.simulation;

import com.shadowhunters.engine.ability.AbilityOutcome;
import com.shadowhunters.engine.card.CardDatabase;
import com.shadowhunters.engine.character.CharacterCatalog;
import com.shadowhunters.engine.event.GameEvent;
import com.shadowhunters.engine.game.ActionResult;
import com.shadowhunters.engine.game.ActionValidator;
import com.shadowhunters.engine.game.GameEngine;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.GameStateException;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.zones.Zone;
import com.shadowhunters.engine.rng.GameRng;
import com.shadowhunters.engine.win.WinResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Plays whole games between bots through the public engine entry points.
 */
public final class SimulationEngine {
    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    private SimulationEngine() {
        // Utility class - prevent instantiation
    }

    /**
     * Play one game from setup to the end, or until the turn cap.
     */
    public static GameResult runGame(CharacterCatalog catalog, CardDatabase cards, int playerCount,
                                     long seed, GameConfig config, boolean verbose) throws GameSetupException {
        GameRng rng = new GameRng(seed);
        GameState state = GameSetup.newGame(catalog, cards, playerCount, rng);
        GameEngine engine = new GameEngine(state);

        if (verbose) {
            System.out.println("=== Game Start (seed: " + seed + ") ===");
            for (Player player : state.getPlayers()) {
                System.out.println("  " + player.getName() + ": " + player.getCharacter().getName()
                        + " (" + player.getFaction().getJsonValue() + ", " + player.getHpMax() + " hp)");
            }
            engine.addListener(event -> System.out.println("    " + describe(event)));
        }

        try {
            engine.startGame();
            while (!state.isGameOver() && state.getTurn() <= config.maxTurns()) {
                Player current = state.getCurrentPlayer();
                if (current.isAlive()) {
                    playTurn(engine, current, rng, config, verbose);
                }
                if (state.isGameOver()) {
                    break;
                }
                if (current.isAlive() && state.getCurrentPlayer() == current) {
                    engine.endTurn(current);
                } else {
                    engine.advanceToNextTurn();
                }
            }
        } catch (GameStateException e) {
            log.warn("Game {} stopped: {}", seed, e.getMessage());
        }

        WinResult result = state.getResult();
        if (verbose) {
            System.out.println(result.gameOver()
                    ? "=== Game Over on turn " + state.getTurn() + ": " + result.winners() + " ==="
                    : "=== No winner after " + config.maxTurns() + " turns ===");
        }
        return new GameResult(
            seed,
            state.getTurn(),
            result.gameOver(),
            result.winningFaction(),
            result.winners().stream().map(p -> p.getCharacter().getName()).toList(),
            state.deadCount()
        );
    }

    /**
     * One bot turn: reveal, ability, move, draw, attack. Stops as soon as the
     * game ends or the player falls.
     */
    static void playTurn(GameEngine engine, Player player, GameRng rng, GameConfig config, boolean verbose)
            throws GameStateException {
        GameState state = engine.getState();
        if (verbose) {
            System.out.println("-- Turn " + state.getTurn() + ": " + player + " (" + player.getHp() + " hp)");
        }

        if (DecisionEngine.shouldReveal(player, config.revealChance(), rng)) {
            engine.reveal(player);
        }
        tryAbility(engine, player, rng, config);
        if (!stillPlaying(state, player)) {
            return;
        }

        if (!state.hasMovedThisTurn()) {
            engine.rollMovement(player);
            Zone destination = DecisionEngine.chooseDestination(state, player, rng);
            if (destination != null) {
                report(verbose, engine.move(player, destination));
            }
        }
        engine.advancePhase();

        if (ActionValidator.canDraw(state, player, engine.getLocator()).valid()) {
            report(verbose, engine.drawCard(player, DecisionEngine.chooseOtherPlayer(state, player, rng)));
        }
        if (!stillPlaying(state, player)) {
            return;
        }

        Player target = DecisionEngine.chooseAttackTarget(state, player, rng);
        if (target != null && ActionValidator.canAttackTarget(state, player, target).valid()) {
            report(verbose, engine.attack(player, target));
        }
        if (stillPlaying(state, player)) {
            tryAbility(engine, player, rng, config);
        }
    }

    private static void tryAbility(GameEngine engine, Player player, GameRng rng, GameConfig config) {
        if (!engine.canActivateAbility(player).valid() || rng.next() >= config.abilityChance()) {
            return;
        }
        List<Player> targets = List.of();
        if (player.getCharacterId().map(DecisionEngine::abilityNeedsTarget).orElse(false)) {
            Player target = DecisionEngine.chooseOtherPlayer(engine.getState(), player, rng);
            if (target == null) {
                return;
            }
            targets = List.of(target);
        }
        AbilityOutcome outcome = engine.activateAbility(player, targets);
        log.debug("{} ability: {}", player, outcome.description());
    }

    private static boolean stillPlaying(GameState state, Player player) {
        return !state.isGameOver() && player.isAlive();
    }

    private static void report(boolean verbose, ActionResult result) {
        if (verbose) {
            System.out.println("    " + (result.success() ? "" : "(refused) ") + result.message());
        }
    }

    static String describe(GameEvent event) {
        if (event instanceof GameEvent.DamageDealt damage) {
            String source = damage.attacker() != null ? damage.attacker().getName() : "a card";
            return damage.victim().getName() + " takes " + damage.amount() + " from " + source;
        } else if (event instanceof GameEvent.PlayerDied died) {
            return died.victim().getName() + " dies" + (died.killer() != null ? " (" + died.killer().getName() + ")" : "");
        } else if (event instanceof GameEvent.CharacterRevealed revealed) {
            return revealed.player().getName() + " is " + revealed.player().getCharacter().getName();
        } else if (event instanceof GameEvent.TurnStarted turn) {
            return "turn " + turn.turnNumber() + " for " + turn.player().getName();
        } else if (event instanceof GameEvent.AbilityTriggered triggered) {
            return triggered.player().getName() + " triggers: " + triggered.description();
        } else if (event instanceof GameEvent.AbilityActivated activated) {
            return activated.player().getName() + " activates: " + activated.description();
        } else if (event instanceof GameEvent.AbilityFailed failed) {
            return failed.player().getName() + " ability failed: " + failed.reason();
        }
        return event.toString();
    }
}
