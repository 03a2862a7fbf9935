package com.shadowhunters.engine.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Card database that loads the three decks from JSON.
 * Ids are unique; several copies of the same card carry distinct ids.
 */
public class CardDatabase {
    private final Map<String, Card> cards;

    private CardDatabase(Map<String, Card> cards) {
        this.cards = cards;
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CardDatabaseException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            ObjectMapper mapper = new ObjectMapper();
            List<Card> cardList = mapper.readValue(is, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            ObjectMapper mapper = new ObjectMapper();
            List<Card> cardList = mapper.readValue(json, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CardDatabase fromCardList(List<Card> cardList) throws CardDatabaseException {
        Map<String, Card> cards = new LinkedHashMap<>();
        for (Card card : cardList) {
            if (card.getId() == null || card.getDeck() == null || card.getType() == null) {
                throw new CardDatabaseException("Incomplete card entry: " + card.getName());
            }
            if (cards.putIfAbsent(card.getId(), card) != null) {
                throw new CardDatabaseException("Duplicate card id: " + card.getId());
            }
        }
        return new CardDatabase(cards);
    }

    /**
     * Get a card by id.
     * @throws CardDatabaseException if the card is not found
     */
    public Card getCard(String id) throws CardDatabaseException {
        Card card = cards.get(id);
        if (card == null) {
            throw new CardDatabaseException("Card not found: " + id);
        }
        return card;
    }

    /**
     * All cards belonging to one deck, in file order.
     */
    public List<Card> cardsOf(DeckColor deck) {
        List<Card> result = new ArrayList<>();
        for (Card card : cards.values()) {
            if (card.getDeck() == deck) {
                result.add(card);
            }
        }
        return result;
    }

    /**
     * Get total number of cards.
     */
    public int cardCount() {
        return cards.size();
    }

    /**
     * Check if a card exists.
     */
    public boolean hasCard(String id) {
        return cards.containsKey(id);
    }
}
