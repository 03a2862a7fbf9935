package com.shadowhunters.engine.ability;

import com.shadowhunters.engine.Fixtures;
import com.shadowhunters.engine.ScriptedDice;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.combat.CombatResolver;
import com.shadowhunters.engine.event.EventBus;
import com.shadowhunters.engine.event.GameEvent;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.GameStateException;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.PlayerFlag;
import com.shadowhunters.engine.game.TurnManager;
import com.shadowhunters.engine.game.ValidationResult;
import com.shadowhunters.engine.game.zones.Zone;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for active ability checks and effects.
 */
class ActiveAbilityTest {

    private final List<GameEvent> events = new ArrayList<>();
    private final ScriptedDice dice = new ScriptedDice();
    private GameState state;
    private AbilityTriggerSystem abilities;

    private void setUp(Player... players) throws GameStateException {
        state = Fixtures.state(players);
        EventBus bus = new EventBus();
        CombatResolver combat = new CombatResolver(bus, dice);
        abilities = new AbilityTriggerSystem(state, bus, combat);
        bus.subscribe(abilities);
        bus.subscribe(events::add);
        TurnManager.beginGame(state);
        for (Player player : players) {
            player.reveal();
        }
    }

    @Test
    void testCanActivateIsReadOnly() throws GameStateException {
        Player franklin = Fixtures.player(0, "franklin");
        Player emi = Fixtures.player(1, "emi");
        setUp(franklin, emi);

        ValidationResult first = abilities.canActivate(franklin);
        ValidationResult second = abilities.canActivate(franklin);
        assertEquals(first, second);
        assertTrue(first.valid());
        assertFalse(franklin.isAbilityUsed());
        assertTrue(events.isEmpty());
    }

    @Test
    void testCanActivateReasons() throws GameStateException {
        Player franklin = Fixtures.player(0, "franklin");
        Player catherine = Fixtures.player(1, "catherine");
        Player george = Fixtures.player(2, "george");
        setUp(franklin, catherine, george);

        assertEquals("no such player", abilities.canActivate(null).reason());
        assertEquals("ability is not an active ability", abilities.canActivate(catherine).reason());

        Player hidden = Fixtures.player(3, "ellen");
        assertEquals("must reveal before using this ability", abilities.canActivate(hidden).reason());

        george.disableAbility();
        assertEquals("ability is disabled", abilities.canActivate(george).reason());

        franklin.markDead();
        assertEquals("dead players cannot use abilities", abilities.canActivate(franklin).reason());
    }

    @Test
    void testOnceAbilityIsSpent() throws GameStateException {
        Player franklin = Fixtures.player(0, "franklin");
        Player emi = Fixtures.player(1, "emi");
        setUp(franklin, emi);

        dice.add(5);
        AbilityOutcome outcome = abilities.activate(franklin, List.of(emi));
        assertTrue(outcome.success());
        assertEquals(5, outcome.value());
        assertEquals(5, emi.getHp());
        assertTrue(franklin.isAbilityUsed());

        AbilityOutcome again = abilities.activate(franklin, List.of(emi));
        assertFalse(again.success());
        assertEquals("ability already used this game", again.description());
        assertInstanceOf(GameEvent.AbilityFailed.class, events.get(events.size() - 1));
    }

    @Test
    void testWrongTargetsDoNotSpendTheAbility() throws GameStateException {
        Player george = Fixtures.player(0, "george");
        Player emi = Fixtures.player(1, "emi");
        setUp(george, emi);

        assertFalse(abilities.activate(george, List.of()).success());
        assertFalse(abilities.activate(george, List.of(george)).success());
        assertFalse(george.isAbilityUsed());

        dice.add(3);
        assertTrue(abilities.activate(george, List.of(emi)).success());
        assertEquals(7, emi.getHp());
    }

    @Test
    void testEllenDisablesTarget() throws GameStateException {
        Player ellen = Fixtures.player(0, "ellen");
        Player vampire = Fixtures.player(1, "vampire");
        setUp(ellen, vampire);

        assertTrue(abilities.activate(ellen, List.of(vampire)).success());
        assertTrue(vampire.isAbilityDisabled());
    }

    @Test
    void testFukaSetsDamageMark() throws GameStateException {
        Player fuka = Fixtures.player(0, "fuka");
        Player wight = Fixtures.player(1, "wight");
        Player allie = Fixtures.player(2, "allie");
        setUp(fuka, wight, allie);

        assertTrue(abilities.activate(fuka, List.of(wight)).success());
        assertEquals(7, wight.getHp());
        assertTrue(events.stream().anyMatch(e -> e instanceof GameEvent.DamageDealt d && d.victim() == wight));

        allie.loseHp(7);
        Player other = Fixtures.player(3, "fuka");
        other.reveal();
        assertTrue(abilities.activate(other, List.of(allie)).success());
        assertEquals(1, allie.getHp(), "hpMax 8 minus 7");
    }

    @Test
    void testGregorShield() throws GameStateException {
        Player gregor = Fixtures.player(0, "gregor");
        setUp(gregor, Fixtures.player(1, "emi"));
        assertTrue(abilities.activate(gregor, List.of()).success());
        assertTrue(gregor.hasFlag(PlayerFlag.SHIELDED));
    }

    @Test
    void testWightNeedsDeadCharacters() throws GameStateException {
        Player wight = Fixtures.player(0, "wight");
        Player emi = Fixtures.player(1, "emi");
        Player allie = Fixtures.player(2, "allie");
        setUp(wight, emi, allie);

        assertEquals("no dead characters yet", abilities.activate(wight, List.of()).description());
        assertFalse(wight.isAbilityUsed());

        emi.markDead();
        allie.markDead();
        AbilityOutcome outcome = abilities.activate(wight, List.of());
        assertTrue(outcome.success());
        assertEquals(2, wight.getExtraTurns());
    }

    @Test
    void testAllieFullHeal() throws GameStateException {
        Player allie = Fixtures.player(0, "allie");
        setUp(allie, Fixtures.player(1, "emi"));
        allie.loseHp(6);
        assertTrue(abilities.activate(allie, List.of()).success());
        assertEquals(8, allie.getHp());
    }

    @Test
    void testAgnesSwapsDirection() throws GameStateException {
        Player agnes = Fixtures.player(0, "agnes");
        setUp(agnes, Fixtures.player(1, "emi"));
        assertTrue(abilities.activate(agnes, List.of()).success());
        assertTrue(agnes.hasFlag(PlayerFlag.DIRECTION_SWAPPED));
    }

    @Test
    void testEmiTeleportsInsteadOfMoving() throws GameStateException {
        Player emi = Fixtures.player(0, "emi");
        setUp(emi, Fixtures.player(1, "allie"));
        emi.setZone(Zone.CEMETERY);

        AbilityOutcome outcome = abilities.activate(emi, List.of());
        assertTrue(outcome.success());
        assertEquals(Zone.WEIRD_WOODS, emi.getZone());
        assertTrue(state.hasMovedThisTurn());
        assertFalse(abilities.activate(emi, List.of()).success(), "Only once per movement");
        assertFalse(emi.isAbilityUsed(), "Unlimited abilities are never spent");
    }

    @Test
    void testCharlesFeastsAfterAttacking() throws GameStateException {
        Player charles = Fixtures.player(0, "charles");
        Player emi = Fixtures.player(1, "emi");
        setUp(charles, emi);
        charles.setZone(Zone.CHURCH);
        emi.setZone(Zone.CEMETERY);

        assertEquals("must attack before feasting", abilities.activate(charles, List.of(emi)).description());

        state.markAttacked();
        dice.add(5, 1);
        AbilityOutcome outcome = abilities.activate(charles, List.of(emi));
        assertTrue(outcome.success());
        assertEquals(9, charles.getHp());
        assertEquals(6, emi.getHp());
    }

    @Test
    void testDavidDigsUpEquipment() throws GameStateException {
        Player david = Fixtures.player(0, "david");
        setUp(david, Fixtures.player(1, "emi"));
        assertEquals("no equipment in the discard piles", abilities.activate(david, List.of()).description());

        state.getDeck(DeckColor.BLACK).discard(Fixtures.equipment("Masamune"));
        assertTrue(abilities.activate(david, List.of()).success());
        assertEquals("Masamune", david.getEquipment().get(0).getName());
        assertTrue(david.isAbilityUsed());
    }

    @Test
    void testPassiveCharacterHasNoActivation() throws GameStateException {
        Player bob = Fixtures.player(0, "bob");
        setUp(bob, Fixtures.player(1, "emi"));
        assertFalse(abilities.activate(bob, List.of()).success());
    }
}
