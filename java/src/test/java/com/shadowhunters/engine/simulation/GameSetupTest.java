package com.shadowhunters.engine.simulation;

import com.shadowhunters.engine.Fixtures;
import com.shadowhunters.engine.card.CardDatabase;
import com.shadowhunters.engine.card.CardDatabaseException;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GameSetupTest {

    private static CardDatabase cards;

    @BeforeAll
    static void loadCards() throws CardDatabaseException {
        cards = CardDatabase.fromResource("cards.json");
    }

    @Test
    void testCompositionTable() throws GameSetupException {
        assertEquals(new GameSetup.Composition(2, 2, 0), GameSetup.composition(4));
        assertEquals(new GameSetup.Composition(2, 2, 1), GameSetup.composition(5));
        assertEquals(new GameSetup.Composition(2, 2, 3), GameSetup.composition(7));
        assertEquals(new GameSetup.Composition(3, 3, 2), GameSetup.composition(8));
        for (int n = GameConfig.MIN_PLAYERS; n <= GameConfig.MAX_PLAYERS; n++) {
            assertEquals(n, GameSetup.composition(n).total());
        }
    }

    @Test
    void testUnsupportedTableSize() {
        assertThrows(GameSetupException.class, () -> GameSetup.composition(3));
        assertThrows(GameSetupException.class, () -> GameSetup.composition(9));
    }

    @Test
    void testNewGameDealsTheComposition() throws GameSetupException {
        GameState state = GameSetup.newGame(Fixtures.catalog(), cards, 6, new GameRng(42));
        List<Player> players = state.getPlayers();
        assertEquals(6, players.size());
        assertEquals(2, players.stream().filter(p -> p.getFaction() == Faction.HUNTER).count());
        assertEquals(2, players.stream().filter(p -> p.getFaction() == Faction.SHADOW).count());
        assertEquals(2, players.stream().filter(p -> p.getFaction() == Faction.NEUTRAL).count());

        Set<String> characters = new HashSet<>();
        for (Player player : players) {
            assertTrue(player.isBot());
            assertFalse(player.isRevealed());
            assertEquals(player.getHpMax(), player.getHp());
            assertNull(player.getZone());
            characters.add(player.getCharacter().getKey());
        }
        assertEquals(6, characters.size(), "No character is dealt twice");
        assertFalse(state.isStarted());
    }

    @Test
    void testDecksHoldEveryCard() {
        int total = 0;
        for (DeckColor color : DeckColor.values()) {
            total += GameSetup.buildDecks(cards, new GameRng(1)).get(color).drawPileSize();
        }
        assertEquals(cards.cardCount(), total);
    }

    @Test
    void testSameSeedSameTable() throws GameSetupException {
        GameState a = GameSetup.newGame(Fixtures.catalog(), cards, 8, new GameRng(99));
        GameState b = GameSetup.newGame(Fixtures.catalog(), cards, 8, new GameRng(99));
        for (int i = 0; i < 8; i++) {
            assertEquals(a.getPlayers().get(i).getCharacter().getKey(), b.getPlayers().get(i).getCharacter().getKey());
        }
    }
}
