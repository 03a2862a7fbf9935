package com.shadowhunters.engine.win;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.character.CharacterId;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.event.GameEvent;
import com.shadowhunters.engine.event.GameEventListener;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.PlayerFlag;
import com.shadowhunters.engine.game.zones.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether the game is over and who won.
 *
 * <p>Hunters win when every Shadow is dead while a Hunter lives, and the
 * other way round; if both factions die out together neither wins. Every
 * Neutral has a condition of their own. Some of those end the game the moment
 * they come true, the others are only collected once the game ends.
 */
public class WinConditionEvaluator implements GameEventListener {
    private static final Logger log = LoggerFactory.getLogger(WinConditionEvaluator.class);

    public static final int BOB_EQUIPMENT_NEEDED = 5;
    public static final int CHARLES_DEAD_NEEDED = 3;
    public static final int BRYAN_VICTIM_MIN_HP = 13;
    public static final int CATHERINE_LAST_STANDING = 2;
    public static final int DAVID_RELICS_NEEDED = 3;
    public static final Set<String> DAVID_RELICS = Set.of(
        "Talisman",
        "Spear of Longinus",
        "Holy Robe",
        "Silver Rosary"
    );

    /**
     * Result of one neutral's condition.
     */
    enum Verdict {
        NOT_MET,
        MET,
        /** Met, and the game ends because of it. */
        MET_ENDS_GAME;

        boolean met() {
            return this != NOT_MET;
        }
    }

    private final GameState state;

    public WinConditionEvaluator(GameState state) {
        this.state = state;
    }

    /**
     * Record a death in kill order. Call once per death, before the matching check.
     */
    public void registerKill(Player killer, Player victim) {
        if (victim == null) {
            log.warn("Kill registered without a victim");
            return;
        }
        Integer killerId = killer != null ? killer.getId() : null;
        if (!state.getWinTracker().record(victim.getId(), killerId, victim.getHpMax(), state.getTurn())) {
            log.warn("Death of {} already registered", victim);
        }
    }

    /**
     * Register every death and check for the end of the game; the first
     * game-over result is stored on the session.
     */
    @Override
    public void onEvent(GameEvent event) {
        if (event instanceof GameEvent.PlayerDied died) {
            registerKill(died.killer(), died.victim());
            WinResult result = checkWinConditions(WinContext.kill(died.killer(), died.victim()));
            if (result.gameOver()) {
                state.finish(result);
            }
        }
    }

    public WinResult checkWinConditions(WinContext context) {
        Faction winningFaction = factionWinner();
        boolean over = winningFaction != null;
        for (Player player : state.getPlayers()) {
            if (player.getFaction() == Faction.NEUTRAL
                    && evaluateNeutral(player, context, true) == Verdict.MET_ENDS_GAME) {
                over = true;
            }
        }
        if (!over) {
            return WinResult.ongoing();
        }

        WinContext ending = WinContext.gameEnding();
        List<Player> winners = state.getPlayers().stream()
                .filter(p -> (winningFaction != null && p.getFaction() == winningFaction)
                        || (p.getFaction() == Faction.NEUTRAL
                            && (evaluateNeutral(p, context, true).met() || evaluateNeutral(p, ending, true).met())))
                .toList();
        log.info("Game over: faction={}, winners={}", winningFaction, winners);
        return new WinResult(true, winningFaction, winners);
    }

    /**
     * The Hunter or Shadow faction that has won, or null.
     * A member at 0 hp has fallen even before its death is processed.
     */
    public Faction factionWinner() {
        long hunters = livingCount(Faction.HUNTER);
        long shadows = livingCount(Faction.SHADOW);
        if (hunters > 0 && shadows == 0) {
            return Faction.HUNTER;
        }
        if (shadows > 0 && hunters == 0) {
            return Faction.SHADOW;
        }
        return null;
    }

    /**
     * Whether a player currently satisfies their own win condition.
     */
    public boolean satisfies(Player player, WinContext context) {
        return satisfies(player, context, true);
    }

    private boolean satisfies(Player player, WinContext context, boolean allowNeighbor) {
        if (player.getFaction() == Faction.NEUTRAL) {
            return evaluateNeutral(player, context, allowNeighbor).met();
        }
        return factionWinner() == player.getFaction();
    }

    Verdict evaluateNeutral(Player player, WinContext context, boolean allowNeighbor) {
        Optional<CharacterId> id = player.getCharacterId();
        if (id.isEmpty()) {
            log.warn("No win condition for character '{}', using survival", player.getCharacter().getKey());
            return whenTrue(player.isAlive());
        }
        WinTracker tracker = state.getWinTracker();
        return switch (id.get()) {
            case ALLIE -> whenTrue(player.isAlive());
            case AGNES -> neighborWins(player, context, allowNeighbor);
            case BOB -> player.isAlive() && player.equipmentCount() >= BOB_EQUIPMENT_NEEDED
                    ? Verdict.MET_ENDS_GAME : Verdict.NOT_MET;
            case BRYAN -> bryan(player, context, tracker);
            case CATHERINE -> whenTrue(isFirstDeath(player, tracker)
                    || (player.isAlive() && state.livingPlayers().size() <= CATHERINE_LAST_STANDING));
            case CHARLES -> charles(player, context, tracker);
            case DANIEL -> whenTrue(isFirstDeath(player, tracker)
                    || tracker.getFirstKillerId().filter(k -> k == player.getId()).isPresent());
            case DAVID -> relicCount(player) >= DAVID_RELICS_NEEDED ? Verdict.MET_ENDS_GAME : Verdict.NOT_MET;
            case EMI, FRANKLIN, GEORGE, ELLEN, FUKA, GREGOR,
                 VALKYRIE, VAMPIRE, WEREWOLF, ULTRA_SOUL, UNKNOWN, WIGHT -> whenTrue(player.isAlive());
        };
    }

    private Verdict neighborWins(Player player, WinContext context, boolean allowNeighbor) {
        if (!allowNeighbor) {
            return Verdict.NOT_MET;
        }
        Player neighbor = player.hasFlag(PlayerFlag.DIRECTION_SWAPPED)
                ? state.leftNeighbor(player)
                : state.rightNeighbor(player);
        if (neighbor == player || neighbor.is(CharacterId.AGNES)) {
            return Verdict.NOT_MET;
        }
        return whenTrue(satisfies(neighbor, context, false));
    }

    private Verdict bryan(Player player, WinContext context, WinTracker tracker) {
        boolean bigKill = tracker.getDeaths().stream()
                .anyMatch(d -> d.killedBy(player.getId()) && d.victimHpMax() >= BRYAN_VICTIM_MIN_HP);
        if (context.event() == WinContext.Event.KILL && context.killer() == player
                && context.victim() != null && context.victim().getHpMax() >= BRYAN_VICTIM_MIN_HP) {
            bigKill = true;
        }
        if (bigKill) {
            return Verdict.MET_ENDS_GAME;
        }
        return whenTrue(context.isGameEnding() && player.isAlive() && player.getZone() == Zone.ERSTWHILE_ALTAR);
    }

    private Verdict charles(Player player, WinContext context, WinTracker tracker) {
        boolean feast = tracker.getDeaths().stream()
                .anyMatch(d -> d.killedBy(player.getId()) && d.deadCountAfter() >= CHARLES_DEAD_NEEDED);
        if (context.event() == WinContext.Event.KILL && context.killer() == player
                && state.deadCount() >= CHARLES_DEAD_NEEDED) {
            feast = true;
        }
        return feast ? Verdict.MET_ENDS_GAME : Verdict.NOT_MET;
    }

    private static boolean isFirstDeath(Player player, WinTracker tracker) {
        return tracker.getFirstDeathId().filter(d -> d == player.getId()).isPresent();
    }

    private static int relicCount(Player player) {
        return (int) player.getEquipment().stream()
                .map(Card::getName)
                .filter(DAVID_RELICS::contains)
                .distinct()
                .count();
    }

    private long livingCount(Faction faction) {
        return state.getPlayers().stream()
                .filter(p -> p.getFaction() == faction && p.isStanding())
                .count();
    }

    private static Verdict whenTrue(boolean condition) {
        return condition ? Verdict.MET : Verdict.NOT_MET;
    }
}
