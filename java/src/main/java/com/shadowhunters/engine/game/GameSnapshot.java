package com.shadowhunters.engine.game;

import com.shadowhunters.engine.card.DeckColor;
import com.shadowhunters.engine.character.Faction;
import com.shadowhunters.engine.game.zones.Deck;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only picture of a session for renderers and bots.
 *
 * @param currentPlayerId id of the player whose turn it is, or -1 before the start
 * @param drawPiles       cards left in each draw pile
 * @param winnerIds       ids of the winners, empty while the game runs
 */
public record GameSnapshot(
    int turn,
    Phase phase,
    int currentPlayerId,
    boolean gameOver,
    Faction winningFaction,
    List<Integer> winnerIds,
    Map<DeckColor, Integer> drawPiles,
    List<PlayerSnapshot> players
) {
    public GameSnapshot {
        winnerIds = List.copyOf(winnerIds);
        drawPiles = Map.copyOf(drawPiles);
        players = List.copyOf(players);
    }

    public static GameSnapshot of(GameState state) {
        Map<DeckColor, Integer> piles = new EnumMap<>(DeckColor.class);
        for (Map.Entry<DeckColor, Deck> entry : state.getDecks().entrySet()) {
            piles.put(entry.getKey(), entry.getValue().drawPileSize());
        }
        return new GameSnapshot(
            state.getTurn(),
            state.getPhase(),
            state.isStarted() ? state.getCurrentPlayer().getId() : -1,
            state.isGameOver(),
            state.getResult().winningFaction(),
            state.getResult().winners().stream().map(Player::getId).toList(),
            piles,
            state.getPlayers().stream().map(PlayerSnapshot::of).toList()
        );
    }

    public PlayerSnapshot player(int id) {
        return players.stream().filter(p -> p.id() == id).findFirst().orElse(null);
    }
}
