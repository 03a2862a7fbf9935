package com.shadowhunters.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A card from one of the three decks.
 */
public class Card {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("deck")
    private DeckColor deck;

    @JsonProperty("type")
    private CardType type;

    @JsonProperty("effect")
    private CardEffect effect = new CardEffect();

    public Card() {
    }

    public Card(String id, String name, DeckColor deck, CardType type, CardEffect effect) {
        this.id = id;
        this.name = name;
        this.deck = deck;
        this.type = type;
        this.effect = effect != null ? effect : new CardEffect();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public DeckColor getDeck() {
        return deck;
    }

    public CardType getType() {
        return type;
    }

    public CardEffect getEffect() {
        return effect;
    }

    public boolean isEquipment() {
        return type == CardType.EQUIPMENT;
    }

    /**
     * Shorthand for the effect kind.
     */
    public boolean hasEffect(EffectKind kind) {
        return effect != null && effect.getKind() == kind;
    }

    // Setters for Jackson
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setDeck(DeckColor deck) { this.deck = deck; }
    public void setType(CardType type) { this.type = type; }
    public void setEffect(CardEffect effect) { this.effect = effect; }

    @Override
    public String toString() {
        return name;
    }
}
