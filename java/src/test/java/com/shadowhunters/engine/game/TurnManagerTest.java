package com.shadowhunters.engine.game;

import com.shadowhunters.engine.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TurnManager.
 */
class TurnManagerTest {

    private Player first;
    private Player second;
    private Player third;
    private GameState state;

    @BeforeEach
    void setUp() {
        first = Fixtures.player(0, "emi");
        second = Fixtures.player(1, "wight");
        third = Fixtures.player(2, "allie");
        state = Fixtures.state(first, second, third);
    }

    private TurnTransition endTurn() throws GameStateException {
        TurnTransition t = TurnManager.advancePhase(state);
        while (!t.turnStarted()) {
            t = TurnManager.advancePhase(state);
        }
        return t;
    }

    @Test
    void testPhasesWithinATurn() throws GameStateException {
        TurnTransition start = TurnManager.beginGame(state);
        assertTrue(start.turnStarted());
        assertEquals(first, start.player());
        assertEquals(Phase.MOVEMENT, state.getPhase());

        TurnTransition action = TurnManager.advancePhase(state);
        assertEquals(Phase.ACTION, action.phase());
        assertFalse(action.turnStarted());
        assertEquals(Phase.END, TurnManager.advancePhase(state).phase());
        assertEquals(first, state.getCurrentPlayer());
    }

    @Test
    void testTurnCounterGoesUpOnWraparound() throws GameStateException {
        TurnManager.beginGame(state);
        assertEquals(second, endTurn().player());
        assertEquals(1, state.getTurn());
        assertEquals(third, endTurn().player());
        assertEquals(1, state.getTurn());
        TurnTransition wrapped = endTurn();
        assertEquals(first, wrapped.player());
        assertEquals(2, wrapped.turnNumber());
    }

    @Test
    void testDeadPlayersAreSkipped() throws GameStateException {
        TurnManager.beginGame(state);
        second.markDead();
        assertEquals(third, endTurn().player());
    }

    @Test
    void testWrapCountsEvenWhenSeatZeroIsDead() throws GameStateException {
        TurnManager.beginGame(state);
        endTurn();
        endTurn();
        first.markDead();
        TurnTransition next = endTurn();
        assertEquals(second, next.player());
        assertEquals(2, next.turnNumber());
    }

    @Test
    void testExtraTurnRepeatsThePlayer() throws GameStateException {
        TurnManager.beginGame(state);
        endTurn();
        second.addExtraTurns(1);
        assertEquals(second, endTurn().player());
        assertEquals(third, endTurn().player());
    }

    @Test
    void testNewTurnResetsFlags() throws GameStateException {
        TurnManager.beginGame(state);
        state.recordMovementRoll(4);
        state.markAttacked();
        second.setFlag(PlayerFlag.SHIELDED);
        second.setFlag(PlayerFlag.DAMAGE_IMMUNE);
        second.setFlag(PlayerFlag.DIRECTION_SWAPPED);

        endTurn();
        assertFalse(state.hasRolledThisTurn());
        assertFalse(state.hasAttackedThisTurn());
        assertFalse(second.hasFlag(PlayerFlag.SHIELDED));
        assertFalse(second.hasFlag(PlayerFlag.DAMAGE_IMMUNE));
        assertTrue(second.hasFlag(PlayerFlag.DIRECTION_SWAPPED));
    }

    @Test
    void testNoLivingPlayersIsAnError() throws GameStateException {
        TurnManager.beginGame(state);
        first.markDead();
        second.markDead();
        third.markDead();
        TurnManager.advancePhase(state);
        TurnManager.advancePhase(state);
        assertThrows(GameStateException.class, () -> TurnManager.advancePhase(state));
    }

    @Test
    void testCannotBeginTwice() throws GameStateException {
        TurnManager.beginGame(state);
        assertThrows(GameStateException.class, () -> TurnManager.beginGame(state));
    }
}
