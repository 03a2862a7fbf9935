package com.shadowhunters.engine;

import com.shadowhunters.engine.card.Card;
import com.shadowhunters.engine.card.CardEffect;
import com.shadowhunters.engine.card.CardType;
import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.card.EffectKind;
import com.shadowhunters.engine.character.AbilityDeclaration;
import com.shadowhunters.engine.character.AbilityKind;
import com.shadowhunters.engine.character.CharacterCatalog;
import com.shadowhunters.engine.character.CharacterCatalogException;
import com.shadowhunters.engine.character.CharacterData;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.character.UsagePolicy;
import com.shadowhunters.engine.game.GameState;
import com.shadowhunters.engine.game.Player;
import com.shadowhunters.engine.game.zones.Deck;
import com.shadowhunters.engine.rng.GameRng;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Players, cards and sessions for tests, built from the bundled catalog.
 */
public final class Fixtures {

    private static final CharacterCatalog CATALOG = loadCatalog();

    private Fixtures() {
        // Utility class - prevent instantiation
    }

    private static CharacterCatalog loadCatalog() {
        try {
            return CharacterCatalog.fromResource("characters.json");
        } catch (CharacterCatalogException e) {
            throw new IllegalStateException("Bundled catalog failed to load", e);
        }
    }

    public static CharacterCatalog catalog() {
        return CATALOG;
    }

    public static CharacterData character(String key) {
        try {
            return CATALOG.get(key);
        } catch (CharacterCatalogException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    /**
     * A character with no ability of its own.
     */
    public static CharacterData plain(String key, Faction faction, int hp) {
        AbilityDeclaration none = new AbilityDeclaration("None", AbilityKind.STATIC, "manual",
                UsagePolicy.UNLIMITED, false);
        return new CharacterData(key, key, faction, hp, none);
    }

    public static Player player(int id, String characterKey) {
        return new Player(id, "P" + id, true, character(characterKey));
    }

    public static Player player(int id, CharacterData data) {
        return new Player(id, "P" + id, true, data);
    }

    public static GameState state(Player... players) {
        GameRng rng = new GameRng(7);
        return new GameState(List.of(players), emptyDecks(rng), rng);
    }

    public static Map<DeckColor, Deck> emptyDecks(GameRng rng) {
        Map<DeckColor, Deck> decks = new EnumMap<>(DeckColor.class);
        for (DeckColor color : DeckColor.values()) {
            decks.put(color, new Deck(color, rng));
        }
        return decks;
    }

    public static Card equipment(String name, DeckColor deck, EffectKind kind, int value, Faction faction) {
        return new Card(name.toLowerCase().replace(' ', '_'), name, deck, CardType.EQUIPMENT,
                new CardEffect(kind, value, faction));
    }

    public static Card equipment(String name) {
        return equipment(name, DeckColor.WHITE, EffectKind.NONE, 0, null);
    }

    public static Card instant(String name, DeckColor deck, EffectKind kind, int value) {
        return new Card(name.toLowerCase().replace(' ', '_'), name, deck, CardType.INSTANT,
                new CardEffect(kind, value, null));
    }

    public static Card vision(String name, EffectKind kind, int value, Faction faction) {
        return new Card(name.toLowerCase().replace(' ', '_'), name, DeckColor.VISION, CardType.VISION,
                new CardEffect(kind, value, faction));
    }
}
