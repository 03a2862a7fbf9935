package com.shadowhunters.engine.simulation;

import com.shadowhunters.engine.card.CardDatabase;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.character.CharacterCatalog;
import com.shadowhunters.engine.character.CharacterData;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.zones.Deck;
import com.shadowhunters.engine.rng.GameRng;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deals characters and builds the decks for a new game.
 */
public final class GameSetup {

    /**
     * How many characters of each faction a table of a given size gets.
     */
    public record Composition(int hunters, int shadows, int neutrals) {
        public int total() {
            return hunters + shadows + neutrals;
        }
    }

    private GameSetup() {
        // Utility class - prevent instantiation
    }

    public static Composition composition(int playerCount) throws GameSetupException {
        return switch (playerCount) {
            case 4 -> new Composition(2, 2, 0);
            case 5 -> new Composition(2, 2, 1);
            case 6 -> new Composition(2, 2, 2);
            case 7 -> new Composition(2, 2, 3);
            case 8 -> new Composition(3, 3, 2);
            default -> throw new GameSetupException("Unsupported player count: " + playerCount
                    + " (" + GameConfig.MIN_PLAYERS + "-" + GameConfig.MAX_PLAYERS + ")");
        };
    }

    /**
     * Deal random characters to bot players in random seats and shuffle the
     * three decks.
     */
    public static GameState newGame(CharacterCatalog catalog, CardDatabase cards, int playerCount, GameRng rng)
            throws GameSetupException {
        Composition composition = composition(playerCount);

        List<CharacterData> dealt = new ArrayList<>();
        dealt.addAll(deal(catalog, Faction.HUNTER, composition.hunters(), rng));
        dealt.addAll(deal(catalog, Faction.SHADOW, composition.shadows(), rng));
        dealt.addAll(deal(catalog, Faction.NEUTRAL, composition.neutrals(), rng));
        rng.shuffle(dealt);

        List<Player> players = new ArrayList<>();
        for (int i = 0; i < dealt.size(); i++) {
            players.add(new Player(i, "Player " + (i + 1), true, dealt.get(i)));
        }
        return new GameState(players, buildDecks(cards, rng), rng);
    }

    public static Map<DeckColor, Deck> buildDecks(CardDatabase cards, GameRng rng) {
        Map<DeckColor, Deck> decks = new EnumMap<>(DeckColor.class);
        for (DeckColor color : DeckColor.values()) {
            Deck deck = new Deck(color, rng);
            cards.cardsOf(color).forEach(deck::addCard);
            deck.shuffle();
            decks.put(color, deck);
        }
        return decks;
    }

    private static List<CharacterData> deal(CharacterCatalog catalog, Faction faction, int count, GameRng rng)
            throws GameSetupException {
        List<CharacterData> pool = new ArrayList<>(catalog.byFaction(faction));
        if (pool.size() < count) {
            throw new GameSetupException("Need " + count + " " + faction.getJsonValue()
                    + " characters, catalog has " + pool.size());
        }
        rng.shuffle(pool);
        return pool.subList(0, count);
    }
}
