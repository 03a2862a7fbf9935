package com.shadowhunters.engine.simulation;

/**
 * Tunables of a simulated game.
 *
 * @param maxTurns            full rounds played before a game is abandoned
 * @param charactersResource  classpath resource of the character catalog
 * @param cardsResource       classpath resource of the card database
 * @param revealChance        chance a hidden bot reveals itself on its turn
 * @param abilityChance       chance a bot uses an available active ability
 */
public record GameConfig(
    int maxTurns,
    String charactersResource,
    String cardsResource,
    double revealChance,
    double abilityChance
) {
    public static final int MIN_PLAYERS = 4;
    public static final int MAX_PLAYERS = 8;

    public GameConfig {
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive: " + maxTurns);
        }
    }

    public static GameConfig defaults() {
        return new GameConfig(100, "characters.json", "cards.json", 0.1, 0.5);
    }

    public GameConfig withMaxTurns(int turns) {
        return new GameConfig(turns, charactersResource, cardsResource, revealChance, abilityChance);
    }
}
