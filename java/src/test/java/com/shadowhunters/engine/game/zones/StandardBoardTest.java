package com.shadowhunters.engine.game.zones;

import com.shadowhunters.engine.Fixtures;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.card.EffectKind;
import com.shadowhunters.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for zone geometry and deck lookup.
 */
class StandardBoardTest {

    private Map<DeckColor, Deck> decks;
    private StandardBoard board;

    @BeforeEach
    void setUp() {
        decks = Fixtures.emptyDecks(new GameRng(1));
        board = new StandardBoard(decks);
    }

    @Test
    void testAreasPairNeighbouringZones() {
        assertTrue(Zone.HERMITS_CABIN.sharesAreaWith(Zone.UNDERWORLD_GATE));
        assertTrue(Zone.CHURCH.sharesAreaWith(Zone.CEMETERY));
        assertTrue(Zone.WEIRD_WOODS.sharesAreaWith(Zone.ERSTWHILE_ALTAR));
        assertFalse(Zone.UNDERWORLD_GATE.sharesAreaWith(Zone.CHURCH));
        assertFalse(Zone.CHURCH.sharesAreaWith(null));
    }

    @Test
    void testDistanceAndNext() {
        assertEquals(5, Zone.HERMITS_CABIN.distanceTo(Zone.ERSTWHILE_ALTAR));
        assertEquals(Zone.HERMITS_CABIN, Zone.ERSTWHILE_ALTAR.next());
        assertEquals(Zone.CEMETERY, Zone.CHURCH.next());
    }

    @Test
    void testPrintedDecks() {
        assertEquals(decks.get(DeckColor.WHITE), board.deckAt(Zone.CHURCH).orElseThrow());
        assertEquals(decks.get(DeckColor.BLACK), board.deckAt(Zone.CEMETERY).orElseThrow());
        assertEquals(decks.get(DeckColor.VISION), board.deckAt(Zone.HERMITS_CABIN).orElseThrow());
        assertTrue(board.deckAt(Zone.WEIRD_WOODS).isEmpty());
        assertTrue(board.deckAt(null).isEmpty());
    }

    @Test
    void testUnderworldGateOffersFirstDrawableDeck() {
        decks.get(DeckColor.BLACK).addCard(Fixtures.instant("Dynamite", DeckColor.BLACK, EffectKind.DAMAGE, 3));
        assertEquals(DeckColor.BLACK, board.deckAt(Zone.UNDERWORLD_GATE).orElseThrow().getColor());

        decks.get(DeckColor.WHITE).addCard(Fixtures.instant("Blessing", DeckColor.WHITE, EffectKind.HEAL, 3));
        assertEquals(DeckColor.WHITE, board.deckAt(Zone.UNDERWORLD_GATE).orElseThrow().getColor());
    }

    @Test
    void testUnderworldGateFallsBackToWhite() {
        assertEquals(DeckColor.WHITE, board.deckAt(Zone.UNDERWORLD_GATE).orElseThrow().getColor());
    }
}
