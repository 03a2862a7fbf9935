package com.shadowhunters.engine.card;

import com.shadowhunters.engine.character.Faction;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardDatabase.
 */
class CardDatabaseTest {

    private static CardDatabase db;

    @BeforeAll
    static void loadDatabase() throws CardDatabaseException {
        db = CardDatabase.fromResource("cards.json");
    }

    @Test
    void testLoadCards() {
        assertTrue(db.cardCount() > 0, "Should have loaded cards");
        for (DeckColor color : DeckColor.values()) {
            assertFalse(db.cardsOf(color).isEmpty(), "Every deck should have cards: " + color);
        }
    }

    @Test
    void testGetEquipment() throws CardDatabaseException {
        Card spear = db.getCard("spear_of_longinus");
        assertEquals("Spear of Longinus", spear.getName());
        assertEquals(DeckColor.WHITE, spear.getDeck());
        assertTrue(spear.isEquipment());
        assertEquals(EffectKind.ATTACK_BONUS, spear.getEffect().getKind());
        assertEquals(2, spear.getEffect().getValue());
        assertEquals(Faction.HUNTER, spear.getEffect().getFaction());
    }

    @Test
    void testRelicsArePresent() {
        for (String id : new String[] {"talisman", "spear_of_longinus", "holy_robe", "silver_rosary"}) {
            assertTrue(db.hasCard(id), "Missing " + id);
        }
    }

    @Test
    void testVisionCardsComeFromTheVisionDeck() {
        for (Card card : db.cardsOf(DeckColor.VISION)) {
            assertEquals(CardType.VISION, card.getType(), card.getName());
        }
    }

    @Test
    void testUnknownCardThrows() {
        assertThrows(CardDatabaseException.class, () -> db.getCard("nonexistent"));
    }

    @Test
    void testDuplicateIdsRejected() {
        String json = """
            [
              {"id": "axe", "name": "Axe", "deck": "black", "type": "equipment"},
              {"id": "axe", "name": "Axe", "deck": "black", "type": "equipment"}
            ]
            """;
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromJson(json));
    }

    @Test
    void testMissingDeckRejected() {
        String json = """
            [{"id": "axe", "name": "Axe", "type": "equipment"}]
            """;
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromJson(json));
    }

    @Test
    void testMalformedJson() {
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromJson("{not json"));
    }

    @Test
    void testRestrictedEffectNeedsRevealedHolder() {
        CardEffect effect = new CardEffect(EffectKind.ATTACK_BONUS, 2, Faction.HUNTER);
        assertFalse(effect.appliesTo(Faction.HUNTER, false));
        assertTrue(effect.appliesTo(Faction.HUNTER, true));
        assertFalse(effect.appliesTo(Faction.SHADOW, true));

        CardEffect open = new CardEffect(EffectKind.ATTACK_BONUS, 1, null);
        assertTrue(open.appliesTo(Faction.SHADOW, false));
    }
}
