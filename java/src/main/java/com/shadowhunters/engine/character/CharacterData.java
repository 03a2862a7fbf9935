package com.shadowhunters.engine.character;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Static data of one character card.
 */
public class CharacterData {
    @JsonProperty("id")
    private String key;

    @JsonProperty("name")
    private String name;

    @JsonProperty("faction")
    private Faction faction;

    @JsonProperty("hp")
    private int hp;

    @JsonProperty("ability")
    private AbilityDeclaration ability = new AbilityDeclaration();

    @JsonProperty("win_condition")
    private String winCondition;

    public CharacterData() {
    }

    public CharacterData(String key, String name, Faction faction, int hp, AbilityDeclaration ability) {
        this.key = key;
        this.name = name;
        this.faction = faction;
        this.hp = hp;
        this.ability = ability != null ? ability : new AbilityDeclaration();
    }

    public String getKey() {
        return key;
    }

    /**
     * The rule set for this character, empty when the engine has none.
     */
    public Optional<CharacterId> characterId() {
        return CharacterId.fromKey(key);
    }

    public String getName() {
        return name;
    }

    public Faction getFaction() {
        return faction;
    }

    public int getHp() {
        return hp;
    }

    public AbilityDeclaration getAbility() {
        return ability;
    }

    public String getWinCondition() {
        return winCondition;
    }

    // Setters for Jackson
    public void setKey(String key) { this.key = key; }
    public void setName(String name) { this.name = name; }
    public void setFaction(Faction faction) { this.faction = faction; }
    public void setHp(int hp) { this.hp = hp; }
    public void setAbility(AbilityDeclaration ability) { this.ability = ability; }
    public void setWinCondition(String winCondition) { this.winCondition = winCondition; }

    @Override
    public String toString() {
        return name;
    }
}
